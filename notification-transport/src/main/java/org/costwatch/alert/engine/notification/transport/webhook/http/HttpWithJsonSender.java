package org.costwatch.alert.engine.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.costwatch.alert.engine.notification.transport.NotificationSenderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts a JSON string to a URL. Stateless apart from the shared OkHttp client. */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender create(NotificationSenderConfig config) {
    return new HttpWithJsonSender(
        new OkHttpClient.Builder()
            .connectTimeout(config.getHttpConnectTimeout())
            .readTimeout(config.getHttpReadTimeout())
            .build());
  }

  /** Returns the closed response; only its status line is meant to be read. */
  public Response send(String url, String jsonString) throws IOException {
    LOGGER.debug("Posting {} characters of json to {}", jsonString.length(), url);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return response;
    }
  }
}
