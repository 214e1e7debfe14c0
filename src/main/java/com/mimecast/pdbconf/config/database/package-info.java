/**
 * Database sections.
 *
 * <p>Handles <code>[database]</code> with optional named write subsections and <code>[read-database]</code>.
 * <br>When no read section is configured it is derived from the sectionwide write settings and marked read only.
 */
package com.mimecast.pdbconf.config.database;
