package org.detectk.notification.transport.webhook;

import java.util.Arrays;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

public enum WebhookFormat {
  JSON("json"),
  TEXT("text");

  private final String label;

  WebhookFormat(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static WebhookFormat fromLabel(String label) {
    return Arrays.stream(values())
        .filter(format -> format.label.equalsIgnoreCase(label))
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigurationException(
                    String.format("Invalid webhook format:%s", label)));
  }
}
