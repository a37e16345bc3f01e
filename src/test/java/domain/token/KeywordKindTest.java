package domain.token;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordKindTest {

    @Test
    void lookup_is_case_insensitive() {
        assertEquals(KeywordKind.SELECT, KeywordKind.lookup("select"));
        assertEquals(KeywordKind.SELECT, KeywordKind.lookup("SeLeCt"));
        assertEquals(KeywordKind.FROM, KeywordKind.lookup("FROM"));
    }

    @Test
    void lookup_returns_null_for_non_keywords() {
        assertNull(KeywordKind.lookup("users"));
        assertNull(KeywordKind.lookup(""));
        assertNull(KeywordKind.lookup(null));
        assertNull(KeywordKind.lookup("by"));
    }

    @Test
    void lookup_never_returns_multi_word_kinds() {
        assertNull(KeywordKind.lookup("ORDER BY"));
        assertNull(KeywordKind.lookup("ORDER_BY"));
        assertEquals(KeywordKind.ORDER, KeywordKind.lookup("order"));
    }

    @Test
    void lookup_ignores_non_ascii_case_folding() {
        // dotless i upper-cases to I
        assertNull(KeywordKind.lookup("joın"));
    }

    @Test
    void render_respects_casing() {
        assertEquals("LEFT JOIN", KeywordKind.LEFT_JOIN.render(true));
        assertEquals("left join", KeywordKind.LEFT_JOIN.render(false));
        assertEquals("IF NOT EXISTS", KeywordKind.IF_NOT_EXISTS.canonical());
    }

    @Test
    void categories() {
        assertTrue(KeywordKind.SELECT.isClauseStarter());
        assertTrue(KeywordKind.UNION_ALL.isClauseStarter());
        assertTrue(KeywordKind.WITH.isClauseStarter());
        assertFalse(KeywordKind.ORDER_BY.isClauseStarter());

        assertTrue(KeywordKind.NATURAL.isJoinKeyword());
        assertTrue(KeywordKind.FULL_JOIN.isJoinKeyword());
        assertFalse(KeywordKind.ON.isJoinKeyword());

        assertTrue(KeywordKind.GROUP_BY.isOrderModifier());
        assertTrue(KeywordKind.TRUNCATE.isDdlStarter());
        assertFalse(KeywordKind.TABLE.isDdlStarter());
        assertTrue(KeywordKind.OR.isSubClause());
        assertTrue(KeywordKind.OFFSET.isSingleValueClause());
    }
}
