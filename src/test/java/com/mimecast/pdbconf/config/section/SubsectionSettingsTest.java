package com.mimecast.pdbconf.config.section;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsectionSettingsTest {

    @Test
    void cascadesSectionwideIntoSubsections() {
        Map<String, Map<String, Object>> subsections = new LinkedHashMap<>();
        subsections.put("primary", Map.of("subname", "//primary/pdb"));
        subsections.put("replica", Map.of("subname", "//replica/pdb", "user", "reader"));
        SectionNode node = new SectionNode(Map.of("user", "pdb", "password", "secret"), subsections);

        SectionNode result = SubsectionSettings.update(node,
                (subsection, sectionwide, settings) -> subsection == null ? settings : Settings.merge(sectionwide, settings));

        assertEquals(Map.of("user", "pdb", "password", "secret"), result.getSectionwide());
        assertEquals(Map.of("user", "pdb", "password", "secret", "subname", "//primary/pdb"),
                result.getSubsections().get("primary"));
        assertEquals(Map.of("user", "reader", "password", "secret", "subname", "//replica/pdb"),
                result.getSubsections().get("replica"));
    }

    @Test
    void subsectionsSeeResolvedSectionwide() {
        SectionNode node = new SectionNode(Map.of("n", 1L), Map.of("a", Map.of()));

        SectionNode result = SubsectionSettings.update(node, (subsection, sectionwide, settings) -> {
            if (subsection == null) {
                return Map.of("n", 2L);
            }
            return Map.of("seen", sectionwide.get("n"));
        });

        assertEquals(Map.of("n", 2L), result.getSectionwide());
        assertEquals(Map.of("seen", 2L), result.getSubsections().get("a"));
    }

    @Test
    void sectionwideCalledFirstWithEmptyContext() {
        Map<String, Map<String, Object>> subsections = new LinkedHashMap<>();
        subsections.put("one", Map.of());
        subsections.put("two", Map.of());
        List<String> calls = new ArrayList<>();

        SubsectionSettings.update(new SectionNode(Map.of("k", "v"), subsections), (subsection, sectionwide, settings) -> {
            if (subsection == null) {
                assertTrue(sectionwide.isEmpty());
            }
            calls.add(String.valueOf(subsection));
            return settings;
        });

        assertEquals(List.of("null", "one", "two"), calls);
    }

    @Test
    void noSubsections() {
        SectionNode result = SubsectionSettings.update(SectionNode.of(Map.of("k", "v")), (subsection, sectionwide, settings) -> settings);

        assertEquals(Map.of("k", "v"), result.getSectionwide());
        assertFalse(result.hasSubsections());
    }
}
