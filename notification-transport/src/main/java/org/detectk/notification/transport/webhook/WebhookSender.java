package org.detectk.notification.transport.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import java.io.IOException;
import org.detectk.metric.anomaly.datamodel.exception.AlertException;
import org.detectk.notification.transport.webhook.http.HttpStatus;
import org.detectk.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a payload and delivers it to an incoming webhook, failing on any non-2xx reply. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public void send(String url, Object payload) throws AlertException {
    Preconditions.checkArgument(url != null);
    String jsonString;
    try {
      jsonString = PayloadMapper.toJson(payload);
    } catch (JsonProcessingException e) {
      throw new AlertException("Failed to serialize webhook payload: " + payload, e);
    }

    HttpStatus status;
    try {
      status = sender.send(url, jsonString);
    } catch (IOException e) {
      throw new AlertException("Unable to reach webhook at " + url, e);
    }

    if (!status.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook when attempting to send notification. "
              + "Response Code: {}, Response Message: {} \n Attempted Notification: {}",
          status.getCode(),
          status.getMessage(),
          jsonString);
      throw new AlertException(
          String.format(
              "Webhook responded with %d %s", status.getCode(), status.getMessage()));
    }
    LOGGER.debug("Webhook accepted notification with code {}", status.getCode());
  }
}
