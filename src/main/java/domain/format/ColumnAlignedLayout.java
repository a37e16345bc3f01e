package domain.format;

import domain.token.KeywordKind;
import domain.token.Token;
import domain.token.TokenType;

/**
 * River layout: clause keywords are right-aligned so their content starts in one column,
 * list items continue on the next line behind a leading comma.
 *
 * <pre>
 * SELECT id
 *        , name
 *   FROM users
 *  WHERE id = 1
 * </pre>
 */
final class ColumnAlignedLayout extends SqlLayout {

    /** keyword padding is measured against this; each subquery shifts it by two */
    private int baseCol = 0;
    /** BETWEEN seen, its AND not yet */
    private int betweenDepth = 0;

    ColumnAlignedLayout(FormatterState state) {
        super(state);
    }

    int keywordPadding(KeywordKind kw) {
        int len = kw.canonical().length();
        if (kw.isJoinKeyword()) return Math.max(0, baseCol + 11 - len);
        if (len > 6) return baseCol + 1;
        return Math.max(0, baseCol + 6 - len);
    }

    private void writeKeywordOnNewline(KeywordKind kw) {
        state.takePending(PendingDirective.AFTER_COMMA_BREAK);
        int padding = keywordPadding(kw);
        if (state.isFirstToken()) {
            state.pad(padding);
        } else {
            state.newLine(padding);
        }
        state.append(state.keywordText(kw));
    }

    @Override
    void keyword(Token token, Token prev) {
        KeywordKind kw = token.getKeyword();
        String text = state.keywordText(kw);

        if (state.isInline()) {
            state.spaceIfNeeded(token, prev);
            state.append(text);
            return;
        }

        if (kw.isDdlStarter()) {
            writeKeywordOnNewline(kw);
            state.setClause(ClauseContext.DDL);
            state.setPending(PendingDirective.INLINE_DDL_NAME);
        } else if (kw == KeywordKind.WITH) {
            if (!state.isFirstToken()) state.newLine(baseCol);
            state.append(text);
            state.setClause(ClauseContext.CTE);
        } else if (kw.isClauseStarter()) {
            // UNION gets a blank line on both sides
            if (kw.isUnion() && !state.isFirstToken()) state.newLine(0);
            writeKeywordOnNewline(kw);
            if (kw.isUnion()) state.newLine(0);
            state.setClause(ClauseContext.fromKeyword(kw));
        } else if (kw.isJoinKeyword()) {
            writeKeywordOnNewline(kw);
            state.setClause(ClauseContext.JOIN);
        } else if (kw.isOrderModifier()) {
            writeKeywordOnNewline(kw);
            state.setClause(ClauseContext.fromKeyword(kw));
        } else if (kw == KeywordKind.AND && betweenDepth > 0) {
            betweenDepth--;
            state.spaceIfNeeded(token, prev);
            state.append(text);
        } else if (kw.isSubClause()) {
            writeKeywordOnNewline(kw);
        } else {
            if (kw == KeywordKind.BETWEEN) betweenDepth++;
            if (!state.takePending(PendingDirective.AFTER_COMMA_BREAK)) state.spaceIfNeeded(token, prev);
            state.append(text);
        }
    }

    @Override
    void comma() {
        if (state.isInline()) {
            state.append(",");
            return;
        }
        ClauseContext ctx = state.clause();
        if (ctx.isListContext()) {
            state.newLine(baseCol + 7);
        } else if (ctx == ClauseContext.CTE) {
            state.newLine(baseCol);
        } else {
            state.append(",");
            return;
        }
        state.append(", ");
        state.setPending(PendingDirective.AFTER_COMMA_BREAK);
    }

    @Override
    void openParen(Token token, Token prev, boolean subquery) {
        boolean afterComma = state.takePending(PendingDirective.AFTER_COMMA_BREAK);
        if (subquery) {
            state.pushFrame(ParenFrame.subquery(state.clause(), baseCol, state.isInline()));
            baseCol += 2;
            if (!afterComma) state.spaceIfNeeded(token, prev);
        } else {
            state.pushFrame(ParenFrame.inline(state.clause(), baseCol));
            if (!afterComma && (prev == null || !prev.is(TokenType.IDENTIFIER))) {
                state.spaceIfNeeded(token, prev);
            }
        }
        state.append("(");
    }

    @Override
    void closeParen() {
        ParenFrame frame = state.popFrame();
        if (frame == null || frame.getKind() != ParenFrame.Kind.SUBQUERY) {
            state.append(")");
            return;
        }
        int oldBase = frame.getSavedBase();
        ClauseContext oldClause = frame.getEnclosing();
        if (!frame.isOpenedInline()) {
            boolean flush = oldClause == ClauseContext.CTE || oldClause == ClauseContext.FROM;
            state.newLine(flush ? oldBase : oldBase + 2);
        }
        state.append(")");
        baseCol = oldBase;
        state.setClause(oldClause);
    }

    @Override
    void semicolon() {
        state.setPending(PendingDirective.NONE);
        state.append(";");
        state.newLine(0);
        state.newLine(0);
        baseCol = 0;
        betweenDepth = 0;
        state.setClause(ClauseContext.NONE);
        state.startStatement();
    }

    @Override
    void value(String text, Token token, Token prev) {
        if (state.takePending(PendingDirective.INLINE_DDL_NAME)) {
            state.space();
        } else if (!state.takePending(PendingDirective.AFTER_COMMA_BREAK)) {
            state.spaceIfNeeded(token, prev);
        }
        state.append(text);
    }

    @Override
    int resumeColumn() {
        return baseCol + 7;
    }
}
