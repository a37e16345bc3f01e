package domain.format;

/**
 * What the next emitted token should do about its separator. At most one is active.
 */
enum PendingDirective {
    NONE,
    /** clause keyword was written; content starts on a new, indented line */
    NEW_INDENTED_LINE,
    /** single-value clause or join; content follows after one space */
    SAME_LINE,
    /** list comma already broke the line; no separator */
    AFTER_COMMA_BREAK,
    /** previous keyword was a DDL starter; object name follows after one space */
    INLINE_DDL_NAME
}
