package io.arrowsource.formats.avro;

import java.util.concurrent.CompletableFuture;

/**
 * Maps a schema id embedded in a message to the text of an Avro schema.
 *
 * <p>Implementations may perform network requests. The returned future completes exceptionally with
 * a {@link SchemaResolutionException} if the id is unknown or the lookup fails.
 */
@FunctionalInterface
public interface SchemaResolver {

  /**
   * Resolves a schema id.
   *
   * @param id the schema id
   * @return a future of the schema as JSON text
   */
  CompletableFuture<String> resolve(int id);
}
