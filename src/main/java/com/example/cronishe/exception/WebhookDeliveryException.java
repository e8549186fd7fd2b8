package com.example.cronishe.exception;

/**
 * A job webhook call that did not end in a 2xx or 3xx response
 */
public class WebhookDeliveryException extends RuntimeException {

    public WebhookDeliveryException(String url, int httpStatusCode) {
        super(String.format("Webhook %s answered HTTP %d", url, httpStatusCode));
    }

    public WebhookDeliveryException(String url, Throwable cause) {
        super(String.format("Webhook %s failed: %s", url, cause.getMessage()), cause);
    }
}
