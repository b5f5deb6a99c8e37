package io.faultline.transport;

import io.faultline.Dsn;
import io.faultline.Event;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts envelopes to the collector's store endpoint with the JDK {@link HttpClient}.
 *
 * <p>Every request carries {@code Content-Type: application/json} and an
 * {@value #AUTH_HEADER} header built from the DSN keys.
 */
public final class HttpEventSender implements EventSender {
  public static final String AUTH_HEADER = "X-Faultline-Auth";
  public static final String RATE_LIMITS_HEADER = "X-Faultline-Rate-Limits";
  public static final String PROTOCOL_VERSION = "1";

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final HttpClient httpClient;
  private final URI storeUri;
  private final String authHeader;
  private final Duration requestTimeout;

  public HttpEventSender(Dsn dsn, String clientName) {
    this(dsn, clientName, DEFAULT_TIMEOUT);
  }

  /**
   * @param dsn            destination and keys
   * @param clientName     client identification, e.g. {@code faultline-java/0.1.0}
   * @param requestTimeout connect and request timeout
   */
  public HttpEventSender(Dsn dsn, String clientName, Duration requestTimeout) {
    Objects.requireNonNull(dsn, "dsn");
    this.storeUri = dsn.storeUri();
    this.authHeader = authHeader(dsn, clientName);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(requestTimeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  static String authHeader(Dsn dsn, String clientName) {
    StringBuilder sb = new StringBuilder("Faultline faultline_version=").append(PROTOCOL_VERSION)
        .append(", faultline_client=").append(clientName)
        .append(", faultline_key=").append(dsn.publicKey());
    if (dsn.secretKey() != null) {
      sb.append(", faultline_secret=").append(dsn.secretKey());
    }
    return sb.toString();
  }

  public URI storeUri() {
    return storeUri;
  }

  @Override
  public SendResponse send(Event event, String envelope) throws IOException {
    HttpRequest request = HttpRequest.newBuilder(storeUri)
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .header(AUTH_HEADER, authHeader)
        .POST(HttpRequest.BodyPublishers.ofString(envelope, StandardCharsets.UTF_8))
        .build();
    HttpResponse<Void> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while sending event " + event.eventId());
    }
    return new SendResponse(response.statusCode(),
        response.headers().firstValue("Retry-After").orElse(null),
        response.headers().firstValue(RATE_LIMITS_HEADER).orElse(null));
  }
}
