package software.amazon.event.automaton.input;

/**
 * What a parsed InputCharacter asks the compilers to build.
 */
public enum InputCharacterType {
    BYTE,            // one transition on one byte value
    MULTI_BYTE_SET,  // parallel byte paths, one per encoding, rejoining at a single next state
    WILDCARD         // a loop that consumes any run of bytes before the glob resumes
}
