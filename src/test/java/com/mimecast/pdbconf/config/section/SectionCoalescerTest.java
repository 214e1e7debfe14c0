package com.mimecast.pdbconf.config.section;

import com.mimecast.pdbconf.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class SectionCoalescerTest {

    private static final Pattern DATABASE = Pattern.compile("^database.*");

    @Test
    void sectionwideOnly() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("database", Map.of("subname", "//db/pdb"));

        Map<String, Object> result = SectionCoalescer.coalesce(DATABASE, document);

        SectionNode node = (SectionNode) result.get("database");
        assertEquals(Map.of("subname", "//db/pdb"), node.getSectionwide());
        assertTrue(node.getSubsections().isEmpty());
    }

    @Test
    void subsectionsCollected() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("database", Map.of("user", "pdb"));
        document.put("database \"primary\"", Map.of("subname", "//primary/pdb"));
        document.put("database \"replica\"", Map.of("subname", "//replica/pdb"));

        SectionNode node = (SectionNode) SectionCoalescer.coalesce(DATABASE, document).get("database");

        assertEquals(Map.of("user", "pdb"), node.getSectionwide());
        assertEquals(List.of("primary", "replica"), List.copyOf(node.getSubsections().keySet()));
        assertEquals(Map.of("subname", "//replica/pdb"), node.getSubsections().get("replica"));
    }

    @Test
    void subsectionWithoutSectionwide() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("database \"primary\"", Map.of("subname", "//primary/pdb"));

        SectionNode node = (SectionNode) SectionCoalescer.coalesce(DATABASE, document).get("database");

        assertTrue(node.getSectionwide().isEmpty());
        assertTrue(node.hasSubsections());
        assertFalse(SectionCoalescer.coalesce(DATABASE, document).containsKey("database \"primary\""));
    }

    @Test
    void otherKeysPassThrough() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("global", Map.of("vardir", "/var"));
        document.put("read-database", Map.of("subname", "//replica/pdb"));
        document.put("database", Map.of());

        Map<String, Object> result = SectionCoalescer.coalesce(DATABASE, document);

        assertEquals(Map.of("vardir", "/var"), result.get("global"));
        assertEquals(Map.of("subname", "//replica/pdb"), result.get("read-database"));
        assertEquals(SectionNode.empty(), result.get("database"));
    }

    @Test
    void duplicateSubsection() {
        List<Map.Entry<String, Object>> entries = List.of(
                new AbstractMap.SimpleEntry<String, Object>("database \"x\"", Map.of()),
                new AbstractMap.SimpleEntry<String, Object>("database \"x\"", Map.of()));

        ConfigException e = assertThrows(ConfigException.class, () -> SectionCoalescer.coalesce(DATABASE, entries));
        assertEquals(ConfigException.Kind.STRUCTURE, e.getKind());
        assertEquals("error: multiple [\"database \"x\"\"] subsections in config file", e.getMessage());
    }

    @Test
    void duplicateSection() {
        List<Map.Entry<String, Object>> entries = List.of(
                new AbstractMap.SimpleEntry<String, Object>("database", Map.of("user", "a")),
                new AbstractMap.SimpleEntry<String, Object>("database", Map.of("user", "b")));

        ConfigException e = assertThrows(ConfigException.class, () -> SectionCoalescer.coalesce(DATABASE, entries));
        assertEquals(ConfigException.Kind.STRUCTURE, e.getKind());
        assertEquals("error: multiple [\"database\"] sections in config file", e.getMessage());
    }

    @Test
    void malformedHeader() {
        Map<String, Object> document = Map.of("database primary", Map.of());

        ConfigException e = assertThrows(ConfigException.class, () -> SectionCoalescer.coalesce(DATABASE, document));
        assertEquals(ConfigException.Kind.GRAMMAR, e.getKind());
    }

    @Test
    void sectionNotAMap() {
        Map<String, Object> document = Map.of("database", "localhost");

        ConfigException e = assertThrows(ConfigException.class, () -> SectionCoalescer.coalesce(DATABASE, document));
        assertEquals(ConfigException.Kind.STRUCTURE, e.getKind());
    }
}
