package io.arrowsource.formats.avro;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Resolves a single known id to a fixed schema; every other id fails. */
public final class FixedSchemaResolver implements SchemaResolver {
  private final int id;
  private final String schema;

  public FixedSchemaResolver(int id, String schema) {
    this.id = id;
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  public CompletableFuture<String> resolve(int id) {
    if (id != this.id) {
      return CompletableFuture.failedFuture(
          new SchemaResolutionException(
              id, "unexpected schema id, only " + this.id + " is configured"));
    }
    return CompletableFuture.completedFuture(schema);
  }
}
