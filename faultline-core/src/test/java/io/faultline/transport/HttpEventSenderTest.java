package io.faultline.transport;

import com.sun.net.httpserver.HttpServer;
import io.faultline.Dsn;
import io.faultline.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpEventSenderTest {

  private HttpServer server;
  private final AtomicReference<String> path = new AtomicReference<>();
  private final AtomicReference<String> auth = new AtomicReference<>();
  private final AtomicReference<String> contentType = new AtomicReference<>();
  private final AtomicReference<String> body = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String retryAfter;
  private volatile String rateLimits;
  private boolean stopped;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      path.set(exchange.getRequestURI().getPath());
      auth.set(exchange.getRequestHeaders().getFirst(HttpEventSender.AUTH_HEADER));
      contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      try (InputStream in = exchange.getRequestBody()) {
        body.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
      if (retryAfter != null) {
        exchange.getResponseHeaders().add("Retry-After", retryAfter);
      }
      if (rateLimits != null) {
        exchange.getResponseHeaders().add(HttpEventSender.RATE_LIMITS_HEADER, rateLimits);
      }
      exchange.sendResponseHeaders(status, -1);
      exchange.close();
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    if (!stopped) {
      server.stop(0);
    }
  }

  private HttpEventSender sender(String userInfo) {
    Dsn dsn = Dsn.parse("http://" + userInfo + "@127.0.0.1:" + server.getAddress().getPort() + "/42");
    return new HttpEventSender(dsn, "faultline.java/0.1.0", Duration.ofSeconds(5));
  }

  @Test
  void postsEnvelopeToStoreEndpoint() throws IOException {
    HttpEventSender sender = sender("pub");
    Event event = Event.builder().eventId("abc").build();

    SendResponse response = sender.send(event, "{\"event_id\":\"abc\"}");

    assertTrue(response.isSuccess());
    assertEquals("/api/42/store/", path.get());
    assertEquals("application/json", contentType.get());
    assertEquals("{\"event_id\":\"abc\"}", body.get());
    assertEquals("Faultline faultline_version=1, faultline_client=faultline.java/0.1.0, faultline_key=pub",
        auth.get());
  }

  @Test
  void authHeaderIncludesSecretWhenPresent() throws IOException {
    sender("pub:sec").send(Event.builder().eventId("abc").build(), "{}");

    assertTrue(auth.get().endsWith(", faultline_key=pub, faultline_secret=sec"), auth.get());
  }

  @Test
  void reportsRateLimitHeaders() throws IOException {
    status = 429;
    retryAfter = "30";
    rateLimits = "60:error:key";

    SendResponse response = sender("pub").send(Event.builder().eventId("abc").build(), "{}");

    assertTrue(response.isRateLimited());
    assertEquals("30", response.retryAfter());
    assertEquals("60:error:key", response.rateLimits());
  }

  @Test
  void reportsServerErrors() throws IOException {
    status = 503;

    SendResponse response = sender("pub").send(Event.builder().eventId("abc").build(), "{}");

    assertTrue(response.isServerError());
    assertNull(response.retryAfter());
  }

  @Test
  void unreachableCollectorThrowsIOException() {
    HttpEventSender sender = sender("pub");
    server.stop(0);
    stopped = true;

    assertThrows(IOException.class, () -> sender.send(Event.builder().eventId("abc").build(), "{}"));
  }

  @Test
  void storeUriComesFromDsn() {
    HttpEventSender sender = new HttpEventSender(Dsn.parse("https://k@errors.example.com/team/7"), "c");

    assertEquals("https://errors.example.com/team/api/7/store/", sender.storeUri().toString());
  }
}
