package domain.lex;

import domain.token.Token;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only cursor over the significant (non-whitespace) tokens, with small lookahead.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int pos = 0;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Drops whitespace tokens; comments stay. */
    public static TokenStream significant(List<Token> all) {
        List<Token> kept = new ArrayList<>(all == null ? 0 : all.size());
        if (all != null) {
            for (Token t : all) {
                if (t != null && !t.is(TokenType.WHITESPACE)) kept.add(t);
            }
        }
        return new TokenStream(kept);
    }

    public static TokenStream of(String sql) {
        return significant(SqlLexer.tokenize(sql));
    }

    public boolean hasNext() {
        return pos < tokens.size();
    }

    public Token next() {
        return (pos < tokens.size()) ? tokens.get(pos++) : null;
    }

    /** Next token without consuming it, or {@code null} at the end. */
    public Token peek() {
        return peek(0);
    }

    public Token peek(int ahead) {
        int p = pos + ahead;
        return (p >= 0 && p < tokens.size()) ? tokens.get(p) : null;
    }
}
