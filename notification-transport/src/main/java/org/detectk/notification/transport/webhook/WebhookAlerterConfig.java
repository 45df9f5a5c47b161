package org.detectk.notification.transport.webhook;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Optional;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.notification.transport.webhook.http.HttpWithJsonSender;

public class WebhookAlerterConfig {
  public static final String WEBHOOK_FORMAT_JSON = "json";
  public static final String WEBHOOK_FORMAT_TEXT = "text";

  private static final String URL = "url";
  private static final String FORMAT = "format";
  private static final String USERNAME = "username";
  private static final String CHANNEL = "channel";
  private static final String ICON_URL = "iconUrl";
  private static final String TIMEOUT = "timeout";
  private static final String DEFAULT_USERNAME = "DetectK";

  private final String url;
  private final WebhookFormat format;
  private final String username;
  private final String channel;
  private final String iconUrl;
  private final Duration timeout;

  public static WebhookAlerterConfig from(Config config) {
    if (!config.hasPath(URL)) {
      throw new ConfigurationException("Webhook alerter requires a url");
    }
    return new WebhookAlerterConfig(
        config.getString(URL),
        WebhookFormat.fromLabel(
            config.hasPath(FORMAT) ? config.getString(FORMAT) : WEBHOOK_FORMAT_JSON),
        config.hasPath(USERNAME) ? config.getString(USERNAME) : DEFAULT_USERNAME,
        config.hasPath(CHANNEL) ? config.getString(CHANNEL) : null,
        config.hasPath(ICON_URL) ? config.getString(ICON_URL) : null,
        config.hasPath(TIMEOUT)
            ? config.getDuration(TIMEOUT)
            : HttpWithJsonSender.DEFAULT_TIMEOUT);
  }

  public WebhookAlerterConfig(
      String url,
      WebhookFormat format,
      String username,
      String channel,
      String iconUrl,
      Duration timeout) {
    String trimmed = url == null ? "" : url.trim();
    if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
      throw new ConfigurationException(
          String.format("Invalid webhook url:%s, must start with http:// or https://", url));
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new ConfigurationException("Webhook timeout must be positive, got " + timeout);
    }
    this.url = trimmed;
    this.format = format;
    this.username = username;
    this.channel = channel;
    this.iconUrl = iconUrl;
    this.timeout = timeout;
  }

  public String getUrl() {
    return url;
  }

  public WebhookFormat getFormat() {
    return format;
  }

  public String getUsername() {
    return username;
  }

  public Optional<String> getChannel() {
    return Optional.ofNullable(channel);
  }

  public Optional<String> getIconUrl() {
    return Optional.ofNullable(iconUrl);
  }

  public Duration getTimeout() {
    return timeout;
  }
}
