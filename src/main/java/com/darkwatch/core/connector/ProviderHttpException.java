package com.darkwatch.core.connector;

/**
 * Provider answered with a non-success HTTP status.
 */
public class ProviderHttpException extends RuntimeException {

    private final int status;
    private final String body;

    public ProviderHttpException(int status, String body) {
        super("HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body)));
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
