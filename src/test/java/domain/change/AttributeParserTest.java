package domain.change;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AttributeParserTest {

    @Test
    void should_split_on_br_tags_and_newlines() {
        AttributeMap m = AttributeParser.parse("name=Revenue<br>ord=10<BR/>lvl=2\nparent=ID1");

        assertEquals(4, m.size());
        assertEquals("Revenue", m.get("name"));
        assertEquals("10", m.get("ord"));
        assertEquals("2", m.get("lvl"));
        assertEquals("ID1", m.get("parent"));
    }

    @Test
    void keys_are_case_insensitive_and_values_trimmed() {
        AttributeMap m = AttributeParser.parse("  Name =  Total assets  \r\nORD= 5");

        assertEquals("Total assets", m.get("name"));
        assertEquals("Total assets", m.get("NAME"));
        assertEquals("5", m.get("ord"));
    }

    @Test
    void value_keeps_everything_after_first_equals() {
        AttributeMap m = AttributeParser.parse("name=a=b");
        assertEquals("a=b", m.get("name"));
    }

    @Test
    void lines_without_equals_are_ignored() {
        AttributeMap m = AttributeParser.parse("just text\nord=3");

        assertEquals(1, m.size());
        assertFalse(m.has("just text"));
        assertEquals("3", m.get("ord"));
    }

    @Test
    void blank_input_gives_empty_map() {
        assertTrue(AttributeParser.parse(null).isEmpty());
        assertTrue(AttributeParser.parse("   ").isEmpty());
    }

    @Test
    void hasAll_requires_every_key() {
        AttributeMap m = AttributeParser.parse("name=X<br>lvl=1<br>parent=0");

        assertTrue(m.hasAll("name", "lvl"));
        assertFalse(m.hasAll("name", "ord", "lvl", "parent"));
    }

    @Test
    void blank_value_counts_as_absent() {
        AttributeMap m = AttributeParser.parse("name=X\nord=\nlvl=1\nparent=ID1");

        assertEquals("", m.get("ord"));
        assertFalse(m.has("ord"));
        assertFalse(m.hasAll("name", "ord", "lvl", "parent"));
    }

    @Test
    void keys_are_lower_cased_independent_of_default_locale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            AttributeMap m = AttributeParser.parse("TITLE=X");
            assertEquals("X", m.get("title"));
            assertEquals("X", m.get("TITLE"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
