package domain.token;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of keywords the formatter understands.
 *
 * <p>Single-word keywords are returned by {@link #lookup(String)}. Multi-word keywords
 * (ORDER BY, LEFT JOIN, IF NOT EXISTS, ...) are never looked up directly; the lexer
 * combines them from their first word plus whitespace lookahead.</p>
 */
public enum KeywordKind {

    // DML
    SELECT("SELECT"),
    FROM("FROM"),
    WHERE("WHERE"),
    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    IN("IN"),
    BETWEEN("BETWEEN"),
    LIKE("LIKE"),
    IS("IS"),
    NULL("NULL"),
    AS("AS"),
    ON("ON"),
    JOIN("JOIN"),
    HAVING("HAVING"),
    LIMIT("LIMIT"),
    OFFSET("OFFSET"),
    UNION("UNION"),
    INTERSECT("INTERSECT"),
    EXCEPT("EXCEPT"),
    INSERT("INSERT"),
    INTO("INTO"),
    VALUES("VALUES"),
    UPDATE("UPDATE"),
    SET("SET"),
    DELETE("DELETE"),
    DISTINCT("DISTINCT"),
    ALL("ALL"),
    ASC("ASC"),
    DESC("DESC"),
    CASE("CASE"),
    WHEN("WHEN"),
    THEN("THEN"),
    ELSE("ELSE"),
    END("END"),
    EXISTS("EXISTS"),
    ANY("ANY"),
    WITH("WITH"),
    RECURSIVE("RECURSIVE"),
    RETURNING("RETURNING"),
    USING("USING"),
    NATURAL("NATURAL"),
    FETCH("FETCH"),
    FOR("FOR"),
    WINDOW("WINDOW"),
    OVER("OVER"),
    PARTITION("PARTITION"),
    ROWS("ROWS"),
    RANGE("RANGE"),
    UNBOUNDED("UNBOUNDED"),
    PRECEDING("PRECEDING"),
    FOLLOWING("FOLLOWING"),
    CURRENT("CURRENT"),
    ROW("ROW"),

    // first words of multi-word keywords, when they stand alone
    ORDER("ORDER"),
    GROUP("GROUP"),
    LEFT("LEFT"),
    RIGHT("RIGHT"),
    INNER("INNER"),
    OUTER("OUTER"),
    FULL("FULL"),
    CROSS("CROSS"),

    // DDL
    CREATE("CREATE"),
    ALTER("ALTER"),
    DROP("DROP"),
    TABLE("TABLE"),
    INDEX("INDEX"),
    VIEW("VIEW"),
    COLUMN("COLUMN"),
    ADD("ADD"),
    PRIMARY("PRIMARY"),
    KEY("KEY"),
    FOREIGN("FOREIGN"),
    REFERENCES("REFERENCES"),
    UNIQUE("UNIQUE"),
    DEFAULT("DEFAULT"),
    CHECK("CHECK"),
    CONSTRAINT("CONSTRAINT"),
    CASCADE("CASCADE"),
    RESTRICT("RESTRICT"),
    IF("IF"),
    TEMPORARY("TEMPORARY"),
    TEMP("TEMP"),
    SCHEMA("SCHEMA"),
    DATABASE("DATABASE"),
    SEQUENCE("SEQUENCE"),
    TRIGGER("TRIGGER"),
    FUNCTION("FUNCTION"),
    PROCEDURE("PROCEDURE"),
    TYPE("TYPE"),
    ENUM("ENUM"),
    GRANT("GRANT"),
    REVOKE("REVOKE"),
    TRUNCATE("TRUNCATE"),
    RENAME("RENAME"),
    REPLACE("REPLACE"),
    COMMENT("COMMENT"),

    // other
    TRUE("TRUE"),
    FALSE("FALSE"),
    BEGIN("BEGIN"),
    COMMIT("COMMIT"),
    ROLLBACK("ROLLBACK"),
    SAVEPOINT("SAVEPOINT"),
    TRANSACTION("TRANSACTION"),
    LOCK("LOCK"),
    UNLOCK("UNLOCK"),

    // multi-word (lexer-combined)
    ORDER_BY("ORDER BY"),
    GROUP_BY("GROUP BY"),
    LEFT_JOIN("LEFT JOIN"),
    RIGHT_JOIN("RIGHT JOIN"),
    INNER_JOIN("INNER JOIN"),
    OUTER_JOIN("OUTER JOIN"),
    FULL_JOIN("FULL JOIN"),
    CROSS_JOIN("CROSS JOIN"),
    UNION_ALL("UNION ALL"),
    PRIMARY_KEY("PRIMARY KEY"),
    FOREIGN_KEY("FOREIGN KEY"),
    IF_EXISTS("IF EXISTS"),
    IF_NOT_EXISTS("IF NOT EXISTS"),
    ROWS_BETWEEN("ROWS BETWEEN"),
    RANGE_BETWEEN("RANGE BETWEEN");

    private static final Map<String, KeywordKind> SINGLE_WORDS = singleWordTable();

    private final String canonical;

    KeywordKind(String canonical) {
        this.canonical = canonical;
    }

    /** Canonical (upper-case) spelling; multi-word kinds use a single space between words. */
    public String canonical() {
        return canonical;
    }

    public String render(boolean uppercase) {
        return uppercase ? canonical : canonical.toLowerCase(Locale.ROOT);
    }

    public boolean isMultiWord() {
        return canonical.indexOf(' ') >= 0;
    }

    /**
     * Case-insensitive lookup of a single word.
     *
     * @return the keyword, or {@code null} when the word is not a keyword
     */
    public static KeywordKind lookup(String word) {
        if (word == null || word.isEmpty()) return null;
        for (int i = 0; i < word.length(); i++) {
            // ASCII only: "joın".toUpperCase() would otherwise become JOIN
            if (word.charAt(i) >= 0x80) return null;
        }
        return SINGLE_WORDS.get(word.toUpperCase(Locale.ROOT));
    }

    public boolean isClauseStarter() {
        switch (this) {
            case SELECT:
            case FROM:
            case WHERE:
            case SET:
            case VALUES:
            case INTO:
            case HAVING:
            case LIMIT:
            case OFFSET:
            case UNION:
            case UNION_ALL:
            case INTERSECT:
            case EXCEPT:
            case RETURNING:
            case INSERT:
            case UPDATE:
            case DELETE:
            case WITH:
            case FETCH:
                return true;
            default:
                return false;
        }
    }

    public boolean isJoinKeyword() {
        switch (this) {
            case JOIN:
            case LEFT_JOIN:
            case RIGHT_JOIN:
            case INNER_JOIN:
            case OUTER_JOIN:
            case FULL_JOIN:
            case CROSS_JOIN:
            case NATURAL:
                return true;
            default:
                return false;
        }
    }

    /** ON / AND / OR. */
    public boolean isSubClause() {
        return this == ON || this == AND || this == OR;
    }

    public boolean isOrderModifier() {
        return this == ORDER_BY || this == GROUP_BY;
    }

    public boolean isDdlStarter() {
        switch (this) {
            case CREATE:
            case ALTER:
            case DROP:
            case TRUNCATE:
            case GRANT:
            case REVOKE:
                return true;
            default:
                return false;
        }
    }

    /** LIMIT / OFFSET keep their single value on the keyword's line. */
    public boolean isSingleValueClause() {
        return this == LIMIT || this == OFFSET;
    }

    public boolean isUnion() {
        return this == UNION || this == UNION_ALL;
    }

    private static Map<String, KeywordKind> singleWordTable() {
        Map<String, KeywordKind> m = new HashMap<>();
        for (KeywordKind k : values()) {
            if (!k.isMultiWord()) m.put(k.canonical, k);
        }
        return Collections.unmodifiableMap(m);
    }
}
