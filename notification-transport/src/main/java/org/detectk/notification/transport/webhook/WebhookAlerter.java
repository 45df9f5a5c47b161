package org.detectk.notification.transport.webhook;

import org.detectk.metric.anomaly.datamodel.Alerter;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.exception.AlertException;
import org.detectk.notification.transport.webhook.chat.AlertMessageFormatter;
import org.detectk.notification.transport.webhook.chat.ChatMessage;
import org.detectk.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers anomalous detection results to an incoming webhook, either as the raw detection JSON or
 * as a chat message for Mattermost/Slack. Cooldown is not handled here; callers gate dispatch.
 */
public class WebhookAlerter implements Alerter {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookAlerter.class);

  private final WebhookAlerterConfig config;
  private final WebhookSender sender;
  private final AlertMessageFormatter formatter;

  public WebhookAlerter(WebhookAlerterConfig config) {
    this(
        config,
        new WebhookSender(HttpWithJsonSender.withTimeout(config.getTimeout())),
        new AlertMessageFormatter());
  }

  public WebhookAlerter(
      WebhookAlerterConfig config, WebhookSender sender, AlertMessageFormatter formatter) {
    this.config = config;
    this.sender = sender;
    this.formatter = formatter;
  }

  @Override
  public boolean send(DetectionResult result) throws AlertException {
    if (!result.isAnomaly()) {
      LOGGER.debug("Skipping alert for {}: not anomalous", result.getMetricName());
      return false;
    }
    sender.send(config.getUrl(), toPayload(result));
    LOGGER.info(
        "Alert sent for metric {} detector {} at {}",
        result.getMetricName(),
        result.getDetectorId(),
        result.getTimestamp());
    return true;
  }

  private Object toPayload(DetectionResult result) {
    switch (config.getFormat()) {
      case TEXT:
        return ChatMessage.builder()
            .text(formatter.format(result))
            .username(config.getUsername())
            .channel(config.getChannel().orElse(null))
            .iconUrl(config.getIconUrl().orElse(null))
            .build();
      case JSON:
        return DetectionPayload.from(result);
      default:
        throw new UnsupportedOperationException(
            "Unsupported webhook format: " + config.getFormat());
    }
  }
}
