/**
 * Section headers and subsections.
 *
 * <p>Section keys follow the git config header grammar: <code>[section]</code> or <code>[section "subsection"]</code>.
 * <br>Inside the quotes a backslash escapes the next character.
 *
 * <p>Keys sharing a section are coalesced into one {@link com.mimecast.pdbconf.config.section.SectionNode}
 * holding the sectionwide settings and the named subsections.
 */
package com.mimecast.pdbconf.config.section;
