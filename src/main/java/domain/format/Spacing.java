package domain.format;

import domain.token.Token;
import domain.token.TokenType;

/**
 * Single-space rule between two adjacent significant tokens.
 */
final class Spacing {

    private Spacing() {
    }

    static boolean needsSpaceBefore(Token token, Token prev) {
        if (prev == null || token == null) return false;
        if (token.isTightOperator() || prev.isTightOperator()) return false;

        TokenType p = prev.getType();
        if (p == TokenType.OPEN_PAREN || p == TokenType.DOT) return false;

        switch (token.getType()) {
            case CLOSE_PAREN:
            case DOT:
            case COMMA:
            case SEMICOLON:
                return false;
            default:
                return true;
        }
    }
}
