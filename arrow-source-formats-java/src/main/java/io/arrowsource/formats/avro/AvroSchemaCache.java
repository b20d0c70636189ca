package io.arrowsource.formats.avro;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolved writer schemas by id.
 *
 * <p>Entries are never evicted: schema ids of a topic are few and immutable, so the cache stays
 * small for the lifetime of a deserializer. Concurrent misses for the same id may resolve it twice;
 * the first parsed schema wins.
 */
public final class AvroSchemaCache {
  private static final Logger logger = LoggerFactory.getLogger(AvroSchemaCache.class);

  private final SchemaResolver resolver;
  private final Map<Integer, Schema> schemas = new ConcurrentHashMap<>();

  public AvroSchemaCache(SchemaResolver resolver) {
    this.resolver = resolver;
  }

  /**
   * Returns the schema for an id, resolving and caching it on a miss. A cached schema is returned
   * as an already completed future.
   */
  public CompletableFuture<Schema> get(int id) {
    Schema cached = schemas.get(id);
    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }
    return resolver
        .resolve(id)
        .thenApply(
            text -> {
              Schema schema;
              try {
                schema = new Schema.Parser().parse(text);
              } catch (SchemaParseException e) {
                throw new SchemaResolutionException(id, "invalid schema: " + e.getMessage(), e);
              }
              Schema previous = schemas.putIfAbsent(id, schema);
              if (previous != null) {
                return previous;
              }
              logger.info("Loaded Avro schema {}: {}", id, schema.getFullName());
              return schema;
            });
  }

  public int size() {
    return schemas.size();
  }

  public boolean contains(int id) {
    return schemas.containsKey(id);
  }
}
