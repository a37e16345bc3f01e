package domain.token;

/**
 * Lexical kinds produced by {@link domain.lex.SqlLexer}.
 *
 * <p>Whitespace and comments are real tokens: the lexer never drops input,
 * the layout layer decides what is significant.</p>
 */
public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING_LITERAL,
    NUMBER_LITERAL,
    OPERATOR,
    COMMA,
    SEMICOLON,
    DOT,
    OPEN_PAREN,
    CLOSE_PAREN,
    LINE_COMMENT,
    BLOCK_COMMENT,
    WHITESPACE,
    TEMPLATE_VARIABLE
}
