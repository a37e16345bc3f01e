package domain.lex;

import domain.token.KeywordKind;
import domain.token.Token;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass SQL lexer.
 *
 * <p>Never fails: every input character ends up in exactly one token. Unterminated
 * strings, quoted identifiers and block comments run to the end of input; an unterminated
 * template opener degrades to a lone brace operator; anything unknown becomes a
 * one-character operator.</p>
 *
 * <p>Multi-word keywords are combined here by looking past whitespace (never past comments)
 * for the expected next word. On a mismatch only the first word is emitted and the lookahead
 * is not consumed.</p>
 */
public final class SqlLexer {

    private static final String[] TWO_CHAR_OPS = {"<>", "!=", "<=", ">=", "||", "::", "->"};

    private final String s;
    private int pos = 0;

    private SqlLexer(String s) {
        this.s = (s == null) ? "" : s;
    }

    public static List<Token> tokenize(String sql) {
        SqlLexer lx = new SqlLexer(sql);
        List<Token> out = new ArrayList<>(Math.max(16, lx.s.length() / 3));
        Token t;
        while ((t = lx.next()) != null) {
            out.add(t);
        }
        return out;
    }

    private Token next() {
        if (pos >= s.length()) return null;
        char c = s.charAt(pos);

        if (isAsciiWhitespace(c)) return readWhitespace();
        if (c == '-' && peekAt(1) == '-') return readLineComment();
        if (c == '/' && peekAt(1) == '*') return readBlockComment();
        if (c == '\'') return readStringLiteral();
        if (c == '"') return readQuotedIdentifier();
        if (isDigit(c)) return readNumber();
        if (c == '.' && isDigit(peekAt(1))) return readNumber();

        switch (c) {
            case ',':
                return single(TokenType.COMMA);
            case ';':
                return single(TokenType.SEMICOLON);
            case '.':
                return single(TokenType.DOT);
            case '(':
                return single(TokenType.OPEN_PAREN);
            case ')':
                return single(TokenType.CLOSE_PAREN);
            default:
                break;
        }

        if (c == '{' && peekAt(1) == '{') return readTemplateVariable();
        if (c == '{' || c == '}') return single(TokenType.OPERATOR);
        if (isOperatorStart(c)) return readOperator();
        if (isWordStart(c)) return readWord();

        // unknown: one code point, so surrogate pairs stay intact
        int start = pos;
        pos += Character.charCount(s.codePointAt(pos));
        return Token.of(TokenType.OPERATOR, s, start, pos);
    }

    private char peekAt(int offset) {
        int p = pos + offset;
        return (p < s.length()) ? s.charAt(p) : '\0';
    }

    private Token single(TokenType type) {
        int start = pos++;
        return Token.of(type, s, start, pos);
    }

    private Token readWhitespace() {
        int start = pos;
        while (pos < s.length() && isAsciiWhitespace(s.charAt(pos))) pos++;
        return Token.of(TokenType.WHITESPACE, s, start, pos);
    }

    private Token readLineComment() {
        int start = pos;
        pos += 2;
        int contentStart = pos;
        while (pos < s.length() && s.charAt(pos) != '\n') pos++;
        return Token.delimited(TokenType.LINE_COMMENT, s, start, pos, contentStart, pos);
    }

    private Token readBlockComment() {
        int start = pos;
        pos += 2;
        int contentStart = pos;
        int end = s.indexOf("*/", pos);
        if (end < 0) {
            pos = s.length();
            return Token.delimited(TokenType.BLOCK_COMMENT, s, start, pos, contentStart, pos);
        }
        pos = end + 2;
        return Token.delimited(TokenType.BLOCK_COMMENT, s, start, pos, contentStart, end);
    }

    private Token readStringLiteral() {
        int start = pos++;
        int contentStart = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (c == '\'') {
                if (peekAt(1) == '\'') {
                    // '' is an escaped quote and stays part of the content
                    pos += 2;
                    continue;
                }
                int end = pos++;
                return Token.delimited(TokenType.STRING_LITERAL, s, start, pos, contentStart, end);
            }
            pos++;
        }
        return Token.delimited(TokenType.STRING_LITERAL, s, start, pos, contentStart, pos);
    }

    private Token readQuotedIdentifier() {
        int start = pos++;
        int contentStart = pos;
        int end = s.indexOf('"', pos);
        if (end < 0) {
            pos = s.length();
            return Token.delimited(TokenType.QUOTED_IDENTIFIER, s, start, pos, contentStart, pos);
        }
        pos = end + 1;
        return Token.delimited(TokenType.QUOTED_IDENTIFIER, s, start, pos, contentStart, end);
    }

    private Token readNumber() {
        int start = pos;
        while (pos < s.length() && isDigit(s.charAt(pos))) pos++;
        if (peekAt(0) == '.' && isDigit(peekAt(1))) {
            pos++;
            while (pos < s.length() && isDigit(s.charAt(pos))) pos++;
        }
        return Token.of(TokenType.NUMBER_LITERAL, s, start, pos);
    }

    private Token readOperator() {
        int start = pos;
        if (s.startsWith("->>", pos)) {
            pos += 3;
            return Token.of(TokenType.OPERATOR, s, start, pos);
        }
        for (String op : TWO_CHAR_OPS) {
            if (s.startsWith(op, pos)) {
                pos += 2;
                return Token.of(TokenType.OPERATOR, s, start, pos);
            }
        }
        pos++;
        return Token.of(TokenType.OPERATOR, s, start, pos);
    }

    private Token readTemplateVariable() {
        int start = pos;
        int contentStart = pos + 2;
        int end = s.indexOf("}}", contentStart);
        if (end < 0) {
            // unclosed: only the first '{' is consumed
            pos = start + 1;
            return Token.of(TokenType.OPERATOR, s, start, pos);
        }
        pos = end + 2;
        return Token.delimited(TokenType.TEMPLATE_VARIABLE, s, start, pos, contentStart, end);
    }

    private Token readWord() {
        int start = pos;
        pos = wordEnd(pos);
        KeywordKind kind = KeywordKind.lookup(s.substring(start, pos));
        if (kind == null) return Token.of(TokenType.IDENTIFIER, s, start, pos);
        return combineKeyword(kind, start);
    }

    private Token combineKeyword(KeywordKind kind, int start) {
        switch (kind) {
            case ORDER:
                return combineTwoWords(kind, start, "BY", KeywordKind.ORDER_BY);
            case GROUP:
                return combineTwoWords(kind, start, "BY", KeywordKind.GROUP_BY);
            case LEFT:
                return combineTwoWords(kind, start, "JOIN", KeywordKind.LEFT_JOIN);
            case RIGHT:
                return combineTwoWords(kind, start, "JOIN", KeywordKind.RIGHT_JOIN);
            case INNER:
                return combineTwoWords(kind, start, "JOIN", KeywordKind.INNER_JOIN);
            case OUTER:
                return combineTwoWords(kind, start, "JOIN", KeywordKind.OUTER_JOIN);
            case CROSS:
                return combineTwoWords(kind, start, "JOIN", KeywordKind.CROSS_JOIN);
            case UNION:
                return combineTwoWords(kind, start, "ALL", KeywordKind.UNION_ALL);
            case PRIMARY:
                return combineTwoWords(kind, start, "KEY", KeywordKind.PRIMARY_KEY);
            case FOREIGN:
                return combineTwoWords(kind, start, "KEY", KeywordKind.FOREIGN_KEY);
            case ROWS:
                return combineTwoWords(kind, start, "BETWEEN", KeywordKind.ROWS_BETWEEN);
            case RANGE:
                return combineTwoWords(kind, start, "BETWEEN", KeywordKind.RANGE_BETWEEN);
            case FULL:
                return combineThreeWords(kind, start, "JOIN", KeywordKind.FULL_JOIN,
                        "OUTER", "JOIN", KeywordKind.FULL_JOIN);
            case IF:
                return combineThreeWords(kind, start, "EXISTS", KeywordKind.IF_EXISTS,
                        "NOT", "EXISTS", KeywordKind.IF_NOT_EXISTS);
            default:
                return Token.keyword(kind, s, start, pos);
        }
    }

    private Token combineTwoWords(KeywordKind standalone, int start, String expected, KeywordKind combined) {
        int end = matchWordAfterWhitespace(pos, expected);
        if (end < 0) return Token.keyword(standalone, s, start, pos);
        pos = end;
        return Token.keyword(combined, s, start, pos);
    }

    /**
     * FULL [OUTER] JOIN, IF [NOT] EXISTS: the direct continuation is tried first,
     * then the middle word followed by the final word.
     */
    private Token combineThreeWords(KeywordKind standalone, int start,
                                    String directWord, KeywordKind directCombined,
                                    String middleWord, String finalWord, KeywordKind fullCombined) {
        int end = matchWordAfterWhitespace(pos, directWord);
        if (end >= 0) {
            pos = end;
            return Token.keyword(directCombined, s, start, pos);
        }
        int middleEnd = matchWordAfterWhitespace(pos, middleWord);
        if (middleEnd >= 0) {
            int finalEnd = matchWordAfterWhitespace(middleEnd, finalWord);
            if (finalEnd >= 0) {
                pos = finalEnd;
                return Token.keyword(fullCombined, s, start, pos);
            }
        }
        return Token.keyword(standalone, s, start, pos);
    }

    /**
     * Skips whitespace from {@code from} and matches one whole word case-insensitively.
     *
     * @return end offset of the matched word, or -1
     */
    private int matchWordAfterWhitespace(int from, String expected) {
        int p = from;
        while (p < s.length() && isAsciiWhitespace(s.charAt(p))) p++;
        if (p >= s.length() || !isWordStart(s.charAt(p))) return -1;
        int end = wordEnd(p);
        if (end - p != expected.length()) return -1;
        for (int i = 0; i < expected.length(); i++) {
            if (toAsciiUpper(s.charAt(p + i)) != expected.charAt(i)) return -1;
        }
        return end;
    }

    private static char toAsciiUpper(char c) {
        return (c >= 'a' && c <= 'z') ? (char) (c - 32) : c;
    }

    private int wordEnd(int from) {
        int p = from;
        while (p < s.length() && isWordChar(s.charAt(p))) p++;
        return p;
    }

    static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        if (c < 0x80) return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        return Character.isLetter(c);
    }

    private static boolean isWordChar(char c) {
        if (c < 0x80) return isWordStart(c) || isDigit(c);
        return Character.isLetterOrDigit(c);
    }

    private static boolean isOperatorStart(char c) {
        switch (c) {
            case '<':
            case '>':
            case '!':
            case '=':
            case '|':
            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
            case '&':
            case '^':
            case '~':
            case ':':
                return true;
            default:
                return false;
        }
    }
}
