package io.arrowsource.formats.avro;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves schema ids against a Confluent-compatible schema registry.
 *
 * <p>Requests are blocking and run on the resolver's executor, so {@link #resolve(int)} never
 * blocks the caller:
 *
 * <pre>{@code
 * try (ConfluentSchemaResolver resolver =
 *     ConfluentSchemaResolver.builder(URI.create("http://localhost:8081"))
 *         .credentials("user", "secret")
 *         .build()) {
 *   String schema = resolver.resolve(42).join();
 * }
 * }</pre>
 */
public final class ConfluentSchemaResolver implements SchemaResolver, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ConfluentSchemaResolver.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final URI endpoint;
  private final String authorization;
  private final CloseableHttpClient client;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  private ConfluentSchemaResolver(Builder builder) {
    String base = builder.endpoint.toString();
    this.endpoint = URI.create(base.endsWith("/") ? base : base + "/");
    this.authorization =
        builder.username == null
            ? null
            : "Basic "
                + Base64.getEncoder()
                    .encodeToString(
                        (builder.username + ":" + builder.password)
                            .getBytes(StandardCharsets.UTF_8));
    RequestConfig config =
        RequestConfig.custom()
            .setResponseTimeout(Timeout.ofMilliseconds(builder.timeoutMillis))
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(builder.timeoutMillis))
            .build();
    this.client = HttpClients.custom().setDefaultRequestConfig(config).build();
    if (builder.executor == null) {
      this.ownedExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread thread = new Thread(r, "schema-registry-resolver");
                thread.setDaemon(true);
                return thread;
              });
      this.executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
      this.executor = builder.executor;
    }
  }

  /** Returns a builder for a registry at the given base URL. */
  public static Builder builder(URI endpoint) {
    return new Builder(endpoint);
  }

  /** Fetches {@code GET /schemas/ids/{id}} and returns its {@code schema} member. */
  @Override
  public CompletableFuture<String> resolve(int id) {
    return CompletableFuture.supplyAsync(
        () -> {
          JsonNode body = get(id, "schemas/ids/" + id);
          JsonNode schema = body.get("schema");
          if (schema == null || !schema.isTextual()) {
            throw new SchemaResolutionException(id, "registry response has no schema: " + body);
          }
          logger.debug("Fetched schema {} from {}", id, endpoint);
          return schema.textValue();
        },
        executor);
  }

  /** Returns the id of the latest schema version registered under a subject. */
  public CompletableFuture<Integer> latestSchemaId(String subject) {
    String path =
        "subjects/" + URLEncoder.encode(subject, StandardCharsets.UTF_8) + "/versions/latest";
    return CompletableFuture.supplyAsync(
        () -> {
          JsonNode body = get(-1, path);
          JsonNode id = body.get("id");
          if (id == null || !id.canConvertToInt()) {
            throw new SchemaResolutionException(
                -1, "registry response for subject " + subject + " has no id: " + body);
          }
          return id.intValue();
        },
        executor);
  }

  private JsonNode get(int id, String path) {
    HttpGet request = new HttpGet(endpoint.resolve(path));
    request.setHeader(HttpHeaders.ACCEPT, "application/vnd.schemaregistry.v1+json");
    if (authorization != null) {
      request.setHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    try {
      return client.execute(
          request,
          response -> {
            String text =
                response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
            if (response.getCode() != 200) {
              throw new SchemaResolutionException(
                  id,
                  "GET " + request.getRequestUri() + " returned " + response.getCode() + ": "
                      + text);
            }
            return MAPPER.readTree(text);
          });
    } catch (IOException e) {
      throw new SchemaResolutionException(id, "request to " + endpoint + " failed", e);
    }
  }

  public URI endpoint() {
    return endpoint;
  }

  @Override
  public void close() throws IOException {
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
    client.close();
    logger.debug("Closed schema registry client for {}", endpoint);
  }

  /** Builder for {@link ConfluentSchemaResolver}. */
  public static final class Builder {
    private final URI endpoint;
    private String username;
    private String password;
    private Executor executor;
    private long timeoutMillis = 30_000;

    private Builder(URI endpoint) {
      this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    /** Sends HTTP basic credentials with every request. */
    public Builder credentials(String username, String password) {
      this.username = Objects.requireNonNull(username, "username");
      this.password = Objects.requireNonNull(password, "password");
      return this;
    }

    /** Runs requests on the given executor instead of a dedicated thread. */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder timeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public ConfluentSchemaResolver build() {
      return new ConfluentSchemaResolver(this);
    }
  }
}
