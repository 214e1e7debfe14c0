package com.mimecast.pdbconf.config.section;

import com.mimecast.pdbconf.config.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SectionNameTest {

    @Test
    void parseSection() {
        SectionName name = SectionName.parse("[database]");
        assertEquals("database", name.getSection());
        assertFalse(name.getSubsection().isPresent());
    }

    @Test
    void parseSubsection() {
        SectionName name = SectionName.parse("[database \"primary\"]");
        assertEquals("database", name.getSection());
        assertEquals("primary", name.getSubsection().orElseThrow());
    }

    @Test
    void parseTabSeparator() {
        assertEquals("primary", SectionName.parse("[database\t\"primary\"]").getSubsection().orElseThrow());
    }

    @Test
    void parseEscapes() {
        assertEquals("a\"b", SectionName.parse("[x \"a\\\"b\"]").getSubsection().orElseThrow());
        assertEquals("a\\", SectionName.parse("[x \"a\\\\\"]").getSubsection().orElseThrow());
        assertEquals("ab", SectionName.parse("[x \"\\a\\b\"]").getSubsection().orElseThrow());
    }

    @Test
    void parseEmptySubsection() {
        assertEquals("", SectionName.parse("[x \"\"]").getSubsection().orElseThrow());
    }

    @Test
    void parseSpacesAndUnicodeInSubsection() {
        assertEquals("my primary db", SectionName.parse("[database \"my primary db\"]").getSubsection().orElseThrow());
        assertEquals("bücher", SectionName.parse("[database \"bücher\"]").getSubsection().orElseThrow());
    }

    @Test
    void fromKey() {
        assertEquals(new SectionName("database", "replica"), SectionName.fromKey("database \"replica\""));
        assertEquals(new SectionName("read-database", null), SectionName.fromKey("read-database"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"[database]", "[read-database]", "[x \"\"]", "[x \"a\\\"b\"]", "[x \"a\\\\\"]", "[db \"one two\"]"})
    void toHeaderParsesBack(String header) {
        SectionName name = SectionName.parse(header);
        assertEquals(name, SectionName.parse(name.toHeader()));
    }

    @Test
    void toHeaderEscapes() {
        assertEquals("[x \"a\\\"b\\\\\"]", new SectionName("x", "a\"b\\").toHeader());
    }

    @ParameterizedTest
    @ValueSource(strings = {"[]", "database", "[database", "[data_base]", "[database.x]", "[ database]"})
    void invalidSectionName(String header) {
        ConfigException e = assertThrows(ConfigException.class, () -> SectionName.parse(header));
        assertEquals(ConfigException.Kind.GRAMMAR, e.getKind());
        assertEquals("error: invalid section name \"" + header + "\"", e.getMessage());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "[x y]|must start with a double-quote",
            "[x \"]|must end with an unescaped double-quote",
            "[x \"abc]|must end with an unescaped double-quote",
            "[x \"abc\\\"]|must end with an unescaped double-quote",
            "[x \"abc\\\\\\\"]|must end with an unescaped double-quote"
    })
    void invalidSubsection(String header, String reason) {
        ConfigException e = assertThrows(ConfigException.class, () -> SectionName.parse(header));
        assertEquals(ConfigException.Kind.GRAMMAR, e.getKind());
        assertEquals("error: config subsection \"" + header + "\" " + reason, e.getMessage());
    }
}
