/**
 * Section schemas and conversion.
 *
 * <p>Each section has an incoming schema, describing what a user may write, and an outgoing schema,
 * describing the resolved form.
 * <br>Conversion strips unknown keys, applies defaults, converts every value and validates the result.
 */
package com.mimecast.pdbconf.config.schema;
