package io.arrowsource.formats.avro;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the resolver against a registry stub on the loopback interface. */
public class ConfluentSchemaResolverTest {
  private HttpServer server;
  private final List<String> authorizations = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext(
        "/schemas/ids/",
        exchange -> {
          String auth = exchange.getRequestHeaders().getFirst("Authorization");
          authorizations.add(auth == null ? "" : auth);
          if (exchange.getRequestURI().getPath().endsWith("/42")) {
            String schema = AvroMessageDecoderTest.EVENT_SCHEMA.replace("\"", "\\\"");
            respond(exchange, 200, "{\"schema\":\"" + schema + "\"}");
          } else {
            respond(exchange, 404, "{\"error_code\":40403,\"message\":\"Schema not found\"}");
          }
        });
    server.createContext(
        "/subjects/orders-value/versions/latest",
        exchange ->
            respond(exchange, 200, "{\"subject\":\"orders-value\",\"version\":3,\"id\":42}"));
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private URI endpoint() {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
  }

  @Test
  void testResolveWithCredentials() throws Exception {
    try (ConfluentSchemaResolver resolver =
        ConfluentSchemaResolver.builder(endpoint()).credentials("user", "pw").build()) {
      String schema = resolver.resolve(42).get(10, TimeUnit.SECONDS);
      assertEquals(AvroMessageDecoderTest.EVENT_SCHEMA, schema);
      assertEquals(List.of("Basic dXNlcjpwdw=="), authorizations);
      assertTrue(resolver.endpoint().toString().endsWith("/"));
    }
  }

  @Test
  void testMissingSchema() throws Exception {
    try (ConfluentSchemaResolver resolver = ConfluentSchemaResolver.builder(endpoint()).build()) {
      ExecutionException e =
          assertThrows(
              ExecutionException.class, () -> resolver.resolve(7).get(10, TimeUnit.SECONDS));
      SchemaResolutionException cause =
          assertInstanceOf(SchemaResolutionException.class, e.getCause());
      assertEquals(7, cause.getSchemaId());
      assertTrue(cause.getMessage().contains("404"));
      assertEquals(List.of(""), authorizations);
    }
  }

  @Test
  void testLatestSchemaId() throws Exception {
    try (ConfluentSchemaResolver resolver = ConfluentSchemaResolver.builder(endpoint()).build()) {
      assertEquals(42, resolver.latestSchemaId("orders-value").get(10, TimeUnit.SECONDS));
    }
  }

  @Test
  void testCacheOverRegistry() throws Exception {
    try (ConfluentSchemaResolver resolver = ConfluentSchemaResolver.builder(endpoint()).build()) {
      AvroSchemaCache cache = new AvroSchemaCache(resolver);
      assertEquals("Event", cache.get(42).get(10, TimeUnit.SECONDS).getName());
      assertEquals("Event", cache.get(42).get(10, TimeUnit.SECONDS).getName());
      assertEquals(1, authorizations.size());
    }
  }
}
