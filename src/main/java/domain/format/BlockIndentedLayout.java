package domain.format;

import domain.token.KeywordKind;
import domain.token.Token;
import domain.token.TokenType;

/**
 * Clause keywords on their own line at the statement's base depth, clause content one
 * level deeper. Each subquery adds one level of base depth.
 *
 * <p>Used by the {@code basic}, {@code streamline} and {@code dataops} styles; they differ
 * only in indent width and comma placement.</p>
 */
final class BlockIndentedLayout extends SqlLayout {

    private final int indentUnit;
    private final CommaPlacement commas;

    /** depth (in indent units) of the current clause content */
    private int indentDepth = 0;

    BlockIndentedLayout(FormatterState state, int indentUnit, CommaPlacement commas) {
        super(state);
        this.indentUnit = indentUnit;
        this.commas = commas;
    }

    private int column(int depth) {
        return depth * indentUnit;
    }

    private int baseIndent() {
        return state.subqueryDepth();
    }

    @Override
    void keyword(Token token, Token prev) {
        KeywordKind kw = token.getKeyword();
        String text = state.keywordText(kw);

        if (kw.isDdlStarter()) {
            ddlStarter(text);
        } else if (kw.isClauseStarter()) {
            clauseStarter(kw, text, token, prev);
        } else if (kw.isJoinKeyword()) {
            if (emitInline(text, token, prev)) return;
            clauseLine(text);
            state.setClause(ClauseContext.JOIN);
            state.setPending(PendingDirective.SAME_LINE);
        } else if (kw.isOrderModifier()) {
            if (emitInline(text, token, prev)) return;
            clauseLine(text);
            state.setClause(ClauseContext.fromKeyword(kw));
            state.setPending(PendingDirective.NEW_INDENTED_LINE);
        } else if (kw.isSubClause()) {
            if (emitInline(text, token, prev)) return;
            state.setPending(PendingDirective.NONE);
            int base = baseIndent();
            if (!state.isFirstToken()) state.newLine(column(base + 1));
            state.append(text);
            indentDepth = base + 1;
        } else {
            content(text, token, prev);
        }
    }

    private void ddlStarter(String text) {
        state.setPending(PendingDirective.NONE);
        int base = baseIndent();
        if (!state.isFirstToken()) state.newLine(column(base));
        state.append(text);
        state.setClause(ClauseContext.DDL);
        indentDepth = base + 1;
        state.setPending(PendingDirective.INLINE_DDL_NAME);
    }

    private void clauseStarter(KeywordKind kw, String text, Token token, Token prev) {
        if (emitInline(text, token, prev)) {
            state.setPending(PendingDirective.NONE);
            return;
        }
        clauseLine(text);
        state.setClause(ClauseContext.fromKeyword(kw));
        state.setPending(kw.isSingleValueClause()
                ? PendingDirective.SAME_LINE
                : PendingDirective.NEW_INDENTED_LINE);
    }

    /** Keyword at the base depth on a fresh line; its content goes one level deeper. */
    private void clauseLine(String text) {
        state.setPending(PendingDirective.NONE);
        int base = baseIndent();
        if (!state.isFirstToken()) state.newLine(column(base));
        state.append(text);
        indentDepth = base + 1;
    }

    private boolean emitInline(String text, Token token, Token prev) {
        if (!state.isInline()) return false;
        state.spaceIfNeeded(token, prev);
        state.append(text);
        return true;
    }

    private void content(String text, Token token, Token prev) {
        if (state.isInline()) {
            state.setPending(PendingDirective.NONE);
            state.spaceIfNeeded(token, prev);
            state.append(text);
            return;
        }
        switch (state.pending()) {
            case INLINE_DDL_NAME:
            case SAME_LINE:
                state.setPending(PendingDirective.NONE);
                state.space();
                state.append(text);
                return;
            case NEW_INDENTED_LINE:
                state.setPending(PendingDirective.NONE);
                state.newLine(column(indentDepth));
                state.append(text);
                return;
            case AFTER_COMMA_BREAK:
                state.setPending(PendingDirective.NONE);
                state.append(text);
                return;
            default:
                state.spaceIfNeeded(token, prev);
                state.append(text);
        }
    }

    @Override
    void value(String text, Token token, Token prev) {
        content(text, token, prev);
    }

    @Override
    void comma() {
        state.setPending(PendingDirective.NONE);
        if (state.isInline() || !state.clause().isListContext()) {
            state.append(",");
            return;
        }
        if (commas == CommaPlacement.LEADING) {
            state.newLine(column(indentDepth));
            state.append(", ");
        } else {
            state.append(",");
            state.newLine(column(indentDepth));
        }
        state.setPending(PendingDirective.AFTER_COMMA_BREAK);
    }

    @Override
    void openParen(Token token, Token prev, boolean subquery) {
        if (state.pending() == PendingDirective.NEW_INDENTED_LINE) {
            state.newLine(column(indentDepth));
        }
        state.setPending(PendingDirective.NONE);

        if (subquery) {
            state.pushFrame(ParenFrame.subquery(state.clause(), indentDepth, state.isInline()));
            indentDepth = baseIndent();
            state.spaceIfNeeded(token, prev);
            state.append("(");
        } else if (state.clause() == ClauseContext.DDL && state.parenDepth() == baseIndent()) {
            state.pushFrame(ParenFrame.block(state.clause(), indentDepth));
            state.spaceIfNeeded(token, prev);
            state.append("(");
            state.newLine(column(indentDepth));
        } else {
            state.pushFrame(ParenFrame.inline(state.clause(), indentDepth));
            // function call: no space between name and paren
            if (prev == null || !prev.is(TokenType.IDENTIFIER)) state.spaceIfNeeded(token, prev);
            state.append("(");
        }
    }

    @Override
    void closeParen() {
        state.setPending(PendingDirective.NONE);
        int subqueryBase = baseIndent();
        ParenFrame frame = state.popFrame();
        if (frame == null) {
            state.append(")");
            return;
        }
        switch (frame.getKind()) {
            case SUBQUERY:
                if (!frame.isOpenedInline()) state.newLine(column(subqueryBase));
                state.append(")");
                indentDepth = frame.getSavedBase();
                state.setClause(frame.getEnclosing());
                break;
            case BLOCK:
                int base = baseIndent();
                state.newLine(column(base));
                state.append(")");
                indentDepth = base;
                break;
            default:
                state.append(")");
        }
    }

    @Override
    void semicolon() {
        state.setPending(PendingDirective.NONE);
        state.append(";");
        state.newLine(0);
        state.newLine(0);
        indentDepth = 0;
        state.setClause(ClauseContext.NONE);
        state.startStatement();
    }

    @Override
    int resumeColumn() {
        return column(indentDepth);
    }
}
