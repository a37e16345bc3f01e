package domain.token;

/**
 * One lexeme: an immutable, offset-based view into the source text.
 *
 * <p>The span ({@code spanStart..spanEnd}) covers every character the lexer consumed for this
 * token, delimiters included, so concatenating the spans of all tokens gives back the input.
 * The content range excludes delimiters ({@code '...'}, {@code "..."}, {@code --},
 * {@code /* ... *}{@code /}, {@code {{...}}}). Text is only materialized on request.</p>
 */
public final class Token {

    private final TokenType type;
    private final KeywordKind keyword;
    private final String source;
    private final int spanStart;
    private final int spanEnd;
    private final int contentStart;
    private final int contentEnd;

    private Token(TokenType type, KeywordKind keyword, String source,
                  int spanStart, int spanEnd, int contentStart, int contentEnd) {
        this.type = type;
        this.keyword = keyword;
        this.source = source;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.contentStart = contentStart;
        this.contentEnd = contentEnd;
    }

    /** Token whose content is the whole span (identifiers, numbers, operators, punctuation, whitespace). */
    public static Token of(TokenType type, String source, int start, int end) {
        return new Token(type, null, source, start, end, start, end);
    }

    /** Token with delimiters around its content (literals, quoted identifiers, comments, templates). */
    public static Token delimited(TokenType type, String source, int spanStart, int spanEnd,
                                  int contentStart, int contentEnd) {
        return new Token(type, null, source, spanStart, spanEnd, contentStart, contentEnd);
    }

    public static Token keyword(KeywordKind kind, String source, int start, int end) {
        if (kind == null) throw new IllegalArgumentException("kind is null");
        return new Token(TokenType.KEYWORD, kind, source, start, end, start, end);
    }

    /**
     * Same span, re-typed as a plain identifier. Used when a reserved word is a
     * qualified name ({@code es.order}).
     */
    public Token asIdentifier() {
        if (type == TokenType.IDENTIFIER) return this;
        return new Token(TokenType.IDENTIFIER, null, source, spanStart, spanEnd, contentStart, contentEnd);
    }

    public TokenType getType() {
        return type;
    }

    /** Keyword kind, or {@code null} for non-keyword tokens. */
    public KeywordKind getKeyword() {
        return keyword;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean isKeyword(KeywordKind k) {
        return type == TokenType.KEYWORD && keyword == k;
    }

    public boolean isClauseStarter() {
        return type == TokenType.KEYWORD && keyword.isClauseStarter();
    }

    /** Operators that bind without surrounding spaces: {@code ::}, {@code ->}, {@code ->>}. */
    public boolean isTightOperator() {
        if (type != TokenType.OPERATOR) return false;
        int n = contentEnd - contentStart;
        if (n == 2) {
            return source.startsWith("::", contentStart) || source.startsWith("->", contentStart);
        }
        return n == 3 && source.startsWith("->>", contentStart);
    }

    /** Inner text without delimiters. */
    public String getText() {
        return source.substring(contentStart, contentEnd);
    }

    /** Exact source text of the span, delimiters included. */
    public String getRaw() {
        return source.substring(spanStart, spanEnd);
    }

    public int getSpanEnd() {
        return spanEnd;
    }

    @Override
    public String toString() {
        if (type == TokenType.KEYWORD) return "KEYWORD(" + keyword.canonical() + ")";
        return type + "(" + getText() + ")";
    }
}
