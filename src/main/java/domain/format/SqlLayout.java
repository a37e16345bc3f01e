package domain.format;

import domain.token.Token;

/**
 * Layout policy called by {@link LayoutEngine} once per significant token.
 *
 * <p>Comments and dots are written by the driver itself; the policy only gets the
 * {@link #onComment()} / {@link #onDot()} notifications.</p>
 */
abstract class SqlLayout {

    protected final FormatterState state;

    protected SqlLayout(FormatterState state) {
        this.state = state;
    }

    abstract void keyword(Token token, Token prev);

    abstract void comma();

    /**
     * @param subquery the next significant token is a clause starter (decided once, here)
     */
    abstract void openParen(Token token, Token prev, boolean subquery);

    abstract void closeParen();

    abstract void semicolon();

    /** Any non-keyword token, or a keyword used as a qualified name. */
    abstract void value(String text, Token token, Token prev);

    /** Column where code resumes after a line comment. */
    abstract int resumeColumn();

    void onComment() {
        state.setPending(PendingDirective.NONE);
    }

    void onDot() {
        state.setPending(PendingDirective.NONE);
    }

    /** Final text; every line is right-trimmed, including lines inside block comments. */
    String finish() {
        return stripLineEnds(state.trimmedOutput());
    }

    static String stripLineEnds(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            int end = line.length();
            while (end > 0 && FormatterState.isTrailingSpace(line.charAt(end - 1))) end--;
            sb.append(line, 0, end);
        }
        return sb.toString();
    }
}
