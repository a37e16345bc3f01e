package domain.format;

/**
 * One open parenthesis on the frame stack.
 */
final class ParenFrame {

    enum Kind {
        /** starts with a clause keyword; content is laid out as a nested statement */
        SUBQUERY,
        /** top-level DDL column list; one item per line */
        BLOCK,
        /** function call, value list, type argument; stays on one line */
        INLINE
    }

    private final Kind kind;
    private final ClauseContext enclosing;
    private final int savedBase;
    private final boolean openedInline;

    private ParenFrame(Kind kind, ClauseContext enclosing, int savedBase, boolean openedInline) {
        this.kind = kind;
        this.enclosing = enclosing;
        this.savedBase = savedBase;
        this.openedInline = openedInline;
    }

    static ParenFrame subquery(ClauseContext enclosing, int savedBase, boolean openedInline) {
        return new ParenFrame(Kind.SUBQUERY, enclosing, savedBase, openedInline);
    }

    static ParenFrame block(ClauseContext enclosing, int savedBase) {
        return new ParenFrame(Kind.BLOCK, enclosing, savedBase, false);
    }

    static ParenFrame inline(ClauseContext enclosing, int savedBase) {
        return new ParenFrame(Kind.INLINE, enclosing, savedBase, true);
    }

    Kind getKind() {
        return kind;
    }

    /** Clause context to restore when this paren closes. */
    ClauseContext getEnclosing() {
        return enclosing;
    }

    /** Indentation baseline (depth or column, depending on the layout) to restore on close. */
    int getSavedBase() {
        return savedBase;
    }

    /** Subquery opened inside an inline paren; its close stays on the same line. */
    boolean isOpenedInline() {
        return openedInline;
    }

    @Override
    public String toString() {
        return kind + "(" + enclosing + ", base=" + savedBase + ")";
    }
}
