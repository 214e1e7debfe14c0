package com.mimecast.pdbconf.config.section;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * One section of the coalesced tree.
 *
 * <p>Holds the sectionwide settings and the named subsections, each with its own settings map.
 * <p>Instances are immutable; subsection order follows document order.
 */
public final class SectionNode {

    private static final SectionNode EMPTY = new SectionNode(ImmutableMap.of(), ImmutableMap.of());

    private final Map<String, Object> sectionwide;
    private final Map<String, Map<String, Object>> subsections;

    /**
     * Constructs a new SectionNode instance.
     *
     * @param sectionwide Sectionwide settings.
     * @param subsections Subsection settings keyed by subsection name.
     */
    public SectionNode(Map<String, Object> sectionwide, Map<String, Map<String, Object>> subsections) {
        this.sectionwide = ImmutableMap.copyOf(sectionwide);
        ImmutableMap.Builder<String, Map<String, Object>> builder = ImmutableMap.builder();
        subsections.forEach((name, settings) -> builder.put(name, ImmutableMap.copyOf(settings)));
        this.subsections = builder.build();
    }

    /**
     * Node with sectionwide settings only.
     *
     * @param sectionwide Sectionwide settings.
     * @return SectionNode instance.
     */
    public static SectionNode of(Map<String, Object> sectionwide) {
        return new SectionNode(sectionwide, ImmutableMap.of());
    }

    /**
     * Empty node.
     *
     * @return SectionNode instance.
     */
    public static SectionNode empty() {
        return EMPTY;
    }

    /**
     * Gets sectionwide settings.
     *
     * @return Immutable map.
     */
    public Map<String, Object> getSectionwide() {
        return sectionwide;
    }

    /**
     * Gets subsections.
     *
     * @return Immutable map of subsection name to settings.
     */
    public Map<String, Map<String, Object>> getSubsections() {
        return subsections;
    }

    /**
     * Has subsections.
     *
     * @return Boolean.
     */
    public boolean hasSubsections() {
        return !subsections.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionNode)) return false;
        SectionNode that = (SectionNode) o;
        return sectionwide.equals(that.sectionwide) && subsections.equals(that.subsections);
    }

    @Override
    public int hashCode() {
        return 31 * sectionwide.hashCode() + subsections.hashCode();
    }

    @Override
    public String toString() {
        return "SectionNode{sectionwide=" + sectionwide + ", subsections=" + subsections + "}";
    }
}
