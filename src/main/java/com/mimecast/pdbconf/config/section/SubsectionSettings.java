package com.mimecast.pdbconf.config.section;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds a transform over one section node.
 *
 * <p>The transform is first applied to the sectionwide settings with no subsection name and an empty baseline.
 * <br>Each subsection is then transformed with the <b>resolved</b> sectionwide result as its baseline.
 *
 * <p>The returned node carries the resolved sectionwide settings and one resolved entry per subsection.
 * <br>A section without subsections yields a node holding only the sectionwide result.
 */
public final class SubsectionSettings {

    private SubsectionSettings() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Subsection transform.
     */
    @FunctionalInterface
    public interface Transform {

        /**
         * Resolves one settings map.
         *
         * @param subsection  Subsection name, or null for the sectionwide settings.
         * @param sectionwide Resolved sectionwide settings, empty for the sectionwide call.
         * @param settings    Settings to resolve.
         * @return Resolved settings.
         */
        Map<String, Object> apply(String subsection, Map<String, Object> sectionwide, Map<String, Object> settings);
    }

    /**
     * Applies the transform to a section node.
     *
     * @param node      Section node.
     * @param transform Transform.
     * @return Resolved section node.
     */
    public static SectionNode update(SectionNode node, Transform transform) {
        Map<String, Object> sectionwide = transform.apply(null, ImmutableMap.of(), node.getSectionwide());

        Map<String, Map<String, Object>> subsections = new LinkedHashMap<>();
        node.getSubsections().forEach((name, settings) ->
                subsections.put(name, transform.apply(name, sectionwide, settings)));

        return new SectionNode(sectionwide, subsections);
    }
}
