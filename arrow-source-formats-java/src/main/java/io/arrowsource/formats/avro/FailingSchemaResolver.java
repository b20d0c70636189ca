package io.arrowsource.formats.avro;

import java.util.concurrent.CompletableFuture;

/** Used when no schema registry is configured; every lookup fails. */
public final class FailingSchemaResolver implements SchemaResolver {

  @Override
  public CompletableFuture<String> resolve(int id) {
    return CompletableFuture.failedFuture(
        new SchemaResolutionException(id, "schema registry is not configured"));
  }
}
