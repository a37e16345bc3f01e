package domain.format;

import domain.token.KeywordKind;

/**
 * Clause the layout is currently inside of; decides how commas break.
 */
enum ClauseContext {
    NONE,
    SELECT,
    FROM,
    WHERE,
    SET,
    VALUES,
    HAVING,
    GROUP_BY,
    ORDER_BY,
    JOIN,
    DDL,
    CTE,
    OTHER;

    static ClauseContext fromKeyword(KeywordKind kw) {
        if (kw == null) return OTHER;
        switch (kw) {
            case SELECT:
                return SELECT;
            case FROM:
                return FROM;
            case WHERE:
                return WHERE;
            case SET:
                return SET;
            case VALUES:
                return VALUES;
            case HAVING:
                return HAVING;
            case GROUP_BY:
                return GROUP_BY;
            case ORDER_BY:
                return ORDER_BY;
            default:
                return OTHER;
        }
    }

    /** Contexts whose top-level commas put each item on its own line. */
    boolean isListContext() {
        return this == SELECT || this == GROUP_BY || this == ORDER_BY || this == SET || this == DDL;
    }
}
