package com.darkwatch.core.connector;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Maps a provider failure to an {@link ErrorKind}. Connectors may supply their own when a
 * vendor signals errors in the payload rather than the status line.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClassification classify(Throwable error);

    /**
     * Status-code based classification shared by all built-in connectors.
     */
    ErrorClassifier DEFAULT = error -> {
        if (error instanceof ProviderRateLimitException) {
            return new ErrorClassification(ErrorKind.RATE_LIMITED, "RATE_LIMITED");
        }
        if (error instanceof ProviderHttpException http) {
            int status = http.getStatus();
            String code = "HTTP_" + status;
            if (status == 401 || status == 403) {
                return new ErrorClassification(ErrorKind.AUTHENTICATION, code);
            }
            if (status == 429) {
                return new ErrorClassification(ErrorKind.RATE_LIMITED, code);
            }
            if (status >= 500 || status == 408) {
                return new ErrorClassification(ErrorKind.TRANSIENT, code);
            }
            if (status >= 400) {
                return new ErrorClassification(ErrorKind.CLIENT, code);
            }
        }
        if (error instanceof HttpTimeoutException) {
            return new ErrorClassification(ErrorKind.TRANSIENT, "TIMEOUT");
        }
        // malformed payloads are IOExceptions too, but a retry gets the same body back
        if (error instanceof JsonProcessingException) {
            return new ErrorClassification(ErrorKind.CLIENT, "INVALID_RESPONSE");
        }
        if (error instanceof IOException) {
            return new ErrorClassification(ErrorKind.TRANSIENT, "NETWORK_ERROR");
        }
        return new ErrorClassification(ErrorKind.TRANSIENT, "UNKNOWN_ERROR");
    };
}
