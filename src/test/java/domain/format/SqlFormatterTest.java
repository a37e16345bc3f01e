package domain.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFormatterTest {

    private static final List<String> CORPUS = List.of(
            "select id, name from users where id = 1 order by name",
            "select * from a left join b on a.id = b.a_id and b.x = 'y' limit 3",
            "with x as (select 1), y as (select 2) select * from x, y",
            "insert into t (a, b) values (1, 2); update t set a = 1, b = 2 where c in (select d from e)",
            "create table if not exists t (id int primary key, v text default 'x');",
            "select a -- trailing comment\n, b /* inline */ from t -- end",
            "select count(distinct x) over (partition by y rows between unbounded preceding and current row) from t",
            "select 'unterminated",
            "select /* open comment",
            "))) ((( ;;; ,,,",
            "{{ config(materialized='table') }} select {{ col }} from {{ ref('m') }}",
            "select a::int, b->'k', c->>'v' from t union all select 1, 2, 3",
            "-- only a comment",
            "select é, 名前, \"Quoted Col\" from テーブル",
            "select /* a   \n   b */ x from t",
            "select /* a\r\n b */ x from t",
            "select x /* tab\t\n\f*/ from t"
    );

    @Test
    void blank_input_formats_to_empty() {
        assertEquals("", SqlFormatter.format(null));
        assertEquals("", SqlFormatter.format(""));
        assertEquals("", SqlFormatter.format("  \n\t "));
        assertEquals("", SqlFormatter.format("   ", FormatOptions.of(FormatStyle.ALIGNED, false)));
    }

    @Test
    void default_options_are_uppercase_basic() {
        assertEquals(SqlFormatter.format("select 1", FormatOptions.of(FormatStyle.BASIC, true)),
                SqlFormatter.format("select 1"));
        assertEquals("SELECT\n    1", SqlFormatter.format("select 1", null));
    }

    @Test
    void binding_entry_uses_style_names() {
        assertEquals("select\n    1", SqlFormatter.format("SELECT 1", false, "basic"));
        assertEquals("SELECT a\n       , b\n  FROM t", SqlFormatter.format("select a, b from t", true, "aligned"));
        assertEquals("SELECT\n  1", SqlFormatter.format("select 1", true, "streamline"));
    }

    @Test
    void unknown_style_name_falls_back_to_basic() {
        assertEquals(SqlFormatter.format("select a, b from t"), SqlFormatter.format("select a, b from t", true, "fancy"));
        assertEquals(SqlFormatter.format("select a, b from t"), SqlFormatter.format("select a, b from t", true, null));
        // names are case-sensitive
        assertEquals(SqlFormatter.format("select a, b from t"), SqlFormatter.format("select a, b from t", true, "ALIGNED"));
    }

    @Test
    void identifiers_and_literals_keep_their_spelling() {
        assertEquals("select\n    MyCol,\n    \"Order\",\n    'MiXeD'\nfrom\n    MyTable",
                SqlFormatter.format("SELECT MyCol, \"Order\", 'MiXeD' FROM MyTable", false, "basic"));
    }

    @Test
    void unterminated_literal_is_emitted_as_written() {
        assertEquals("SELECT\n    'abc", SqlFormatter.format("select 'abc"));
    }

    @Test
    void multi_line_block_comment_lines_are_right_trimmed() {
        assertEquals("SELECT /* a\n   b */ x\nFROM\n    t",
                SqlFormatter.format("select /* a   \n   b */ x from t"));
        for (FormatStyle style : FormatStyle.values()) {
            String out = SqlFormatter.format("select /* a\r\n b */ x from t", FormatOptions.forStyle(style));
            assertFalse(out.contains("\r"), style.styleName() + ": " + out);
            assertTrue(out.contains("/* a\n b */"), style.styleName() + ": " + out);
        }
    }

    @Test
    void dot_cancels_pending_line_break() {
        assertTrue(SqlFormatter.format("select .x from t").startsWith("SELECT.x\n"),
                SqlFormatter.format("select .x from t"));
        assertTrue(SqlFormatter.format("select a, .b from t", true, "dataops").contains(".b"));
    }

    @Test
    void comment_only_input() {
        assertEquals("-- only a comment", SqlFormatter.format("-- only a comment\n"));
    }

    @Test
    void every_style_is_deterministic_and_clean() {
        for (FormatStyle style : FormatStyle.values()) {
            for (boolean upper : new boolean[]{true, false}) {
                FormatOptions opts = FormatOptions.of(style, upper);
                for (String sql : CORPUS) {
                    String first = SqlFormatter.format(sql, opts);
                    String second = SqlFormatter.format(sql, opts);
                    assertEquals(first, second, opts + " / " + sql);

                    assertFalse(first.endsWith("\n"), opts + " / " + sql);
                    for (String line : first.split("\n", -1)) {
                        assertEquals(line.stripTrailing(), line, "trailing whitespace: " + opts + " / " + sql);
                    }
                }
            }
        }
    }

    @Test
    void parens_are_never_added_or_dropped() {
        String sql = "select f(a, (select max(b) from c)), g((1)) from t where x in (1, 2) and (y or z)";
        for (FormatStyle style : FormatStyle.values()) {
            String out = SqlFormatter.format(sql, FormatOptions.of(style, true));
            assertEquals(count(sql, '('), count(out, '('), style.styleName());
            assertEquals(count(sql, ')'), count(out, ')'), style.styleName());
        }
    }

    @Test
    void keyword_casing_only_touches_keywords() {
        String upper = SqlFormatter.format("select Foo from Bar where Baz = 'Qux'", true, "basic");
        String lower = SqlFormatter.format("select Foo from Bar where Baz = 'Qux'", false, "basic");
        assertEquals(upper.replace("SELECT", "select").replace("FROM", "from").replace("WHERE", "where"), lower);
    }

    @Test
    void options_value_object() {
        FormatOptions a = FormatOptions.of(FormatStyle.DATAOPS, false);
        assertEquals(a, FormatOptions.of(FormatStyle.DATAOPS, false));
        assertEquals(a.hashCode(), FormatOptions.of(FormatStyle.DATAOPS, false).hashCode());
        assertNotEquals(a, a.withUppercase(true));
        assertSame(a, a.withUppercase(false));
        assertFalse(FormatOptions.forStyle(FormatStyle.STREAMLINE).isUppercase());
        assertTrue(FormatOptions.forStyle(FormatStyle.ALIGNED).isUppercase());
        assertEquals(FormatStyle.BASIC, FormatOptions.of(null, true).getStyle());
    }

    @Test
    void style_lookup() {
        assertEquals(FormatStyle.DATAOPS, FormatStyle.lookup("dataops"));
        assertNull(FormatStyle.lookup("Dataops"));
        assertNull(FormatStyle.lookup(null));
        assertEquals(FormatStyle.BASIC, FormatStyle.fromName("nope"));
        assertEquals(FormatStyle.STREAMLINE, FormatStyle.fromName("streamline"));
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }
}
