/**
 * The entry point of configuration resolution.
 *
 * <h2>ConfigResolver</h2>
 * <p>Resolves a raw configuration document into a {@link com.mimecast.pdbconf.config.ResolvedConfig}.
 * <br>Retired settings are checked first; a fatal retirement stops resolution before any section is read.
 *
 * <h2>RawConfigReader</h2>
 * <p>Reads JSON5 documents of sections.
 * <br>Keys such as <code>database "primary"</code> carry a section and a quoted subsection.
 * <pre>
 * {
 *   database: {subname: "//localhost:5432/puppetdb", user: "puppetdb"},
 *   'database "replica"': {subname: "//replica:5432/puppetdb"}
 * }
 * </pre>
 *
 * <h2>Config</h2>
 * <p>Static container for the resolved configuration, set once at startup.
 */
package com.mimecast.pdbconf.main;
