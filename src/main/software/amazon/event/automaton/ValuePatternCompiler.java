package software.amazon.event.automaton;

/**
 * Compiles a pattern into a fragment whose accepting transitions lead to the given state. Holds the compilation
 * context shared by all patterns of one matcher: its configuration and its rune range shell cache.
 */
final class ValuePatternCompiler {

    private final RuneRangeCompiler runeRangeCompiler;
    private final RegexpCompiler regexpCompiler;

    ValuePatternCompiler(Configuration configuration, RuneRangeShellCache shellCache) {
        this.runeRangeCompiler = new RuneRangeCompiler(shellCache);
        this.regexpCompiler = new RegexpCompiler(runeRangeCompiler, configuration.getRegexpQuantifierMax());
    }

    /**
     * @param pattern The pattern to compile.
     * @param accept The state reached when a value fully matches.
     * @return The start state of the fragment.
     * @throws CompileException if the pattern is invalid.
     */
    ByteState compile(Patterns pattern, ByteState accept) {
        switch (pattern.type()) {
            case EXACT:
                return StringValueCompiler.compileExact(((ValuePatterns) pattern).pattern(), accept);
            case NUMERIC_EQUALS:
                return StringValueCompiler.compileNumeric(((ValuePatterns) pattern).pattern(), accept);
            case PREFIX:
                return StringValueCompiler.compilePrefix(((ValuePatterns) pattern).pattern(), accept);
            case SHELL_STYLE:
                return GlobCompiler.compileShellStyle(((ValuePatterns) pattern).pattern(), accept);
            case WILDCARD:
                return GlobCompiler.compileWildcard(((ValuePatterns) pattern).pattern(), accept);
            case EQUALS_IGNORE_CASE:
                return MonocaseCompiler.compile(((ValuePatterns) pattern).pattern(), accept);
            case RUNE_RANGE:
                return runeRangeCompiler.compile(((RuneRangePattern) pattern).getRanges(), accept);
            case REGEXP:
                return regexpCompiler.compile(((ValuePatterns) pattern).pattern(), accept);
            case ANYTHING_BUT:
                return AnythingButCompiler.compile(((AnythingBut) pattern).getValues(), accept);
            default:
                throw new AssertionError(pattern + " is not implemented yet");
        }
    }
}
