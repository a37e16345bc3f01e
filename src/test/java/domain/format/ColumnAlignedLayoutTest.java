package domain.format;

import domain.token.KeywordKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColumnAlignedLayoutTest {

    private static String aligned(String sql) {
        return SqlFormatter.format(sql, FormatOptions.of(FormatStyle.ALIGNED, true));
    }

    @Test
    void select_with_leading_commas() {
        assertEquals("SELECT id\n       , name\n  FROM users", aligned("select id, name from users"));
        assertEquals("SELECT a\n       , b\n       , c\n  FROM t", aligned("select a, b, c from t"));
    }

    @Test
    void where_and() {
        assertEquals("SELECT id\n  FROM users\n WHERE id = 1\n   AND status = 'active'",
                aligned("select id from users where id = 1 and status = 'active'"));
    }

    @Test
    void left_join() {
        assertEquals("SELECT *\n  FROM a\n  LEFT JOIN b\n    ON a.id = b.a_id\n   AND b.active = TRUE",
                aligned("select * from a left join b on a.id = b.a_id and b.active = true"));
    }

    @Test
    void plain_join_is_right_aligned() {
        assertEquals("SELECT *\n  FROM a\n       JOIN b\n    ON a.x = b.x", aligned("select * from a join b on a.x = b.x"));
    }

    @Test
    void lowercase_keywords_use_the_same_columns() {
        assertEquals("select altitude\n  from volcanoes\n where dormant = true",
                SqlFormatter.format("select altitude from volcanoes where dormant = true",
                        FormatOptions.of(FormatStyle.ALIGNED, false)));
    }

    @Test
    void long_keywords_overhang_by_one() {
        assertEquals("SELECT a\n  FROM t\n ORDER BY a\n       , b", aligned("select a from t order by a, b"));
        assertEquals("SELECT dept\n       , count(*)\n  FROM emp\n GROUP BY dept",
                aligned("select dept, count(*) from emp group by dept"));
    }

    @Test
    void between_and_stays_inline() {
        assertEquals("SELECT a\n  FROM t\n WHERE a BETWEEN 1 AND 5\n   AND b = 2",
                aligned("select a from t where a between 1 and 5 and b = 2"));
    }

    @Test
    void union_is_surrounded_by_blank_lines() {
        assertEquals("SELECT a\n  FROM t\n\n UNION ALL\n\nSELECT b\n  FROM u",
                aligned("select a from t union all select b from u"));
    }

    @Test
    void subquery_shifts_the_river() {
        assertEquals("SELECT a\n  FROM t\n WHERE a IN (\n  SELECT b\n    FROM u\n  )",
                aligned("select a from t where a in (select b from u)"));
    }

    @Test
    void cte_bodies_and_leading_commas() {
        assertEquals("WITH x AS (\n  SELECT 1\n)\n, y AS (\n  SELECT 2\n)\nSELECT *\n  FROM x",
                aligned("with x as (select 1), y as (select 2) select * from x"));
    }

    @Test
    void line_comment_then_keyword() {
        assertEquals("SELECT a -- note\n  FROM t", aligned("select a -- note\nfrom t"));
    }

    @Test
    void ddl_name_follows_the_starter() {
        assertEquals("CREATE TABLE t(id int, name text)", aligned("create table t (id int, name text)"));
    }

    @Test
    void keyword_padding() {
        ColumnAlignedLayout layout = new ColumnAlignedLayout(new FormatterState(FormatOptions.defaults(), 0));
        assertEquals(0, layout.keywordPadding(KeywordKind.SELECT));
        assertEquals(2, layout.keywordPadding(KeywordKind.FROM));
        assertEquals(1, layout.keywordPadding(KeywordKind.GROUP_BY));
        assertEquals(7, layout.keywordPadding(KeywordKind.JOIN));
        assertEquals(2, layout.keywordPadding(KeywordKind.LEFT_JOIN));
        assertEquals(1, layout.keywordPadding(KeywordKind.CROSS_JOIN));
    }
}
