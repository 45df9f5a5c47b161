package org.detectk.notification.transport.webhook.http;

import lombok.Value;

@Value
public class HttpStatus {
  int code;
  String message;

  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }
}
