package org.detectk.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic sender that posts a JSON string to a URL. Stateless apart from the shared client; the
 * caller decides what a response code means.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  private static final HttpWithJsonSender INSTANCE = withTimeout(DEFAULT_TIMEOUT);

  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  public static HttpWithJsonSender withTimeout(Duration timeout) {
    return new HttpWithJsonSender(
        new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .callTimeout(timeout)
            .build());
  }

  /** Posts the body and returns the HTTP status code of the response. */
  public HttpStatus send(String url, String jsonString) throws IOException {
    LOGGER.debug("Sending the following json string to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return new HttpStatus(response.code(), response.message());
    }
  }
}
