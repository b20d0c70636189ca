/**
 * Avro payload decoding and schema resolution.
 *
 * <p>Writer schemas are looked up by id through a {@link
 * io.arrowsource.formats.avro.SchemaResolver} and kept in an {@link
 * io.arrowsource.formats.avro.AvroSchemaCache}. Decoded records are converted to JSON by {@link
 * io.arrowsource.formats.avro.AvroJson} so they follow the same path into columns as JSON payloads.
 */
package io.arrowsource.formats.avro;
