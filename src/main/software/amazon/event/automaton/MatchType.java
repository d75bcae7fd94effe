package software.amazon.event.automaton;

/**
 * The types of value matches that can be compiled into an automaton.
 */
public enum MatchType {
    EXACT,               // exact value, string or literal
    NUMERIC_EQUALS,      // number, matched in any spelling of the same value
    PREFIX,              // string prefix
    SHELL_STYLE,         // string match with at most one unescaped '*'
    WILDCARD,            // string match using one or more non-consecutive '*' wildcards, '\' escapes
    EQUALS_IGNORE_CASE,  // case-insensitive string match
    RUNE_RANGE,          // a single code point drawn from a set of ranges
    REGEXP,              // I-Regexp subset, '~' escapes
    ANYTHING_BUT,        // deny list effect
}
