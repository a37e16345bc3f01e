package domain.format;

import domain.lex.TokenStream;
import domain.token.Token;
import domain.token.TokenType;

import java.util.List;
import java.util.Locale;

/**
 * Shared driver: walks the significant tokens once and hands each one to the style's layout.
 */
final class LayoutEngine {

    private LayoutEngine() {
    }

    static String render(List<Token> tokens, FormatOptions options) {
        if (tokens == null || tokens.isEmpty()) return "";

        int sizeHint = tokens.get(tokens.size() - 1).getSpanEnd();
        FormatterState state = new FormatterState(options, sizeHint);
        SqlLayout layout = options.getStyle().newLayout(state);
        TokenStream ts = TokenStream.significant(tokens);

        Token prev = null;
        while (ts.hasNext()) {
            Token token = ts.next();
            switch (token.getType()) {
                case KEYWORD:
                    if (prev != null && prev.is(TokenType.DOT)) {
                        // qualified name: es.order, t.key
                        Token name = token.asIdentifier();
                        layout.value(token.getKeyword().canonical().toLowerCase(Locale.ROOT), name, prev);
                        prev = name;
                        continue;
                    }
                    layout.keyword(token, prev);
                    break;
                case COMMA:
                    layout.comma();
                    break;
                case OPEN_PAREN:
                    Token next = ts.peek();
                    layout.openParen(token, prev, next != null && next.isClauseStarter());
                    break;
                case CLOSE_PAREN:
                    layout.closeParen();
                    break;
                case SEMICOLON:
                    layout.semicolon();
                    break;
                case LINE_COMMENT:
                    if (!state.isFirstToken()) state.space();
                    state.append(token.getRaw());
                    layout.onComment();
                    state.breakAfterComment(layout.resumeColumn());
                    break;
                case BLOCK_COMMENT:
                    if (!state.isFirstToken()) state.spaceIfNeeded(token, prev);
                    state.append(token.getRaw());
                    layout.onComment();
                    break;
                case DOT:
                    state.append(".");
                    layout.onDot();
                    break;
                default:
                    layout.value(token.getRaw(), token, prev);
            }
            prev = token;
        }
        return layout.finish();
    }
}
