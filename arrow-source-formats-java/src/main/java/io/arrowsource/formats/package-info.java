/**
 * Decoding of source payloads into Apache Arrow batches.
 *
 * <p>Main classes:
 *
 * <ul>
 *   <li>{@link io.arrowsource.formats.ArrowDeserializer} - Decodes payloads of a configured format
 *       into the columns of a {@link io.arrowsource.formats.TargetSchema}
 *   <li>{@link io.arrowsource.formats.ColumnBuilders} - Typed, append-only column builders
 *   <li>{@link io.arrowsource.formats.FramingIterator} - Splits a payload into records
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * TargetSchema schema = TargetSchema.unkeyed(new Schema(List.of(
 *     new Field("x", FieldType.nullable(new ArrowType.Int(64, true)), null),
 *     TargetSchema.timestampField())));
 *
 * try (BufferAllocator allocator = new RootAllocator();
 *      ColumnBuilders builders = ColumnBuilders.create(schema.schema(), allocator);
 *      ArrowDeserializer deserializer = ArrowDeserializer.builder(
 *              Format.Json.builder().build(), schema, allocator)
 *          .framing(Framing.newline())
 *          .build()) {
 *     deserializer.deserializeSlice(builders, payload, Instant.now(), QueueMetadata.disabled());
 *     try (VectorSchemaRoot batch = deserializer.flushBuffer().orElseThrow()) {
 *         // Process data
 *     }
 * }
 * }</pre>
 */
package io.arrowsource.formats;
