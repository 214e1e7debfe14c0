package com.mimecast.pdbconf.config.section;

import com.mimecast.pdbconf.config.ConfigException;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Git style section header.
 *
 * <p>Parses <code>[section]</code> and <code>[section "subsection"]</code> headers.
 * <br>Section names are letters, digits and hyphens.
 * <br>Subsections are double quoted and use backslash escapes, any <code>\X</code> reads as <code>X</code>.
 *
 * <p>Dotted section names are not accepted.
 */
public final class SectionName {

    private static final Pattern HEADER = Pattern.compile(
            "\\[([-0-9a-zA-Z]+)(?:[ \\t]+([\\p{IsLetter}\\p{Digit}\\p{Punct}\\p{Space}]+))?\\]");

    private static final Pattern TRAILING_BACKSLASHES = Pattern.compile("(\\\\+)\"$");

    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");

    private final String section;
    private final String subsection;

    /**
     * Constructs a new SectionName instance.
     *
     * @param section    Section name.
     * @param subsection Subsection name or null.
     */
    public SectionName(String section, String subsection) {
        this.section = Objects.requireNonNull(section, "section");
        this.subsection = subsection;
    }

    /**
     * Parses a bracketed header.
     *
     * @param header Header string, e.g. <code>[database "primary"]</code>.
     * @return SectionName instance.
     * @throws ConfigException GRAMMAR when the header is malformed.
     */
    public static SectionName parse(String header) {
        Matcher matcher = HEADER.matcher(header);
        if (!matcher.matches()) {
            throw grammar("error: invalid section name " + quote(header));
        }

        String name = matcher.group(1);
        String text = matcher.group(2);
        if (text == null) {
            return new SectionName(name, null);
        }

        if (!text.startsWith("\"")) {
            throw grammar("error: config subsection " + quote(header) + " must start with a double-quote");
        }
        if (text.length() < 2 || !text.endsWith("\"")) {
            throw grammar("error: config subsection " + quote(header) + " must end with an unescaped double-quote");
        }
        Matcher backslashes = TRAILING_BACKSLASHES.matcher(text);
        if (backslashes.find() && backslashes.group(1).length() % 2 != 0) {
            throw grammar("error: config subsection " + quote(header) + " must end with an unescaped double-quote");
        }

        String inner = text.substring(1, text.length() - 1);
        return new SectionName(name, ESCAPE.matcher(inner).replaceAll("$1"));
    }

    /**
     * Parses a document key as a header.
     * <p>Keys carry the header text without the surrounding brackets.
     *
     * @param key Document key, e.g. <code>database "primary"</code>.
     * @return SectionName instance.
     */
    public static SectionName fromKey(String key) {
        return parse("[" + key + "]");
    }

    /**
     * Gets section name.
     *
     * @return Section name.
     */
    public String getSection() {
        return section;
    }

    /**
     * Gets subsection name.
     *
     * @return Optional of subsection.
     */
    public Optional<String> getSubsection() {
        return Optional.ofNullable(subsection);
    }

    /**
     * Renders the header back to its bracketed form with escapes.
     *
     * @return Header string.
     */
    public String toHeader() {
        if (subsection == null) {
            return "[" + section + "]";
        }
        String escaped = subsection.replace("\\", "\\\\").replace("\"", "\\\"");
        return "[" + section + " \"" + escaped + "\"]";
    }

    private static ConfigException grammar(String message) {
        return new ConfigException(ConfigException.Kind.GRAMMAR, message);
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionName)) return false;
        SectionName that = (SectionName) o;
        return section.equals(that.section) && Objects.equals(subsection, that.subsection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, subsection);
    }

    @Override
    public String toString() {
        return toHeader();
    }
}
