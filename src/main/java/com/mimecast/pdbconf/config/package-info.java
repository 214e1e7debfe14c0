/**
 * Configuration foundation and the resolved configuration.
 *
 * <p>Every resolved section is exposed through a map backed typed view extending {@link com.mimecast.pdbconf.config.ConfigFoundation}.
 * <br>Invalid input surfaces as a {@link com.mimecast.pdbconf.config.ConfigException} carrying its kind.
 */
package com.mimecast.pdbconf.config;
