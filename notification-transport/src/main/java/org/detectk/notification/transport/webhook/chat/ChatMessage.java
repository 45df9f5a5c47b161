package org.detectk.notification.transport.webhook.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Incoming-webhook message understood by Mattermost and Slack. */
@Value
@Builder
public class ChatMessage {
  String text;
  String username;
  String channel;
  String iconUrl;

  @JsonProperty("icon_url")
  public String getIconUrl() {
    return iconUrl;
  }
}
