package domain.format;

/**
 * Where list commas go when a list breaks over several lines.
 */
public enum CommaPlacement {
    /** {@code a,} newline {@code b} */
    TRAILING,
    /** {@code a} newline {@code , b} */
    LEADING
}
