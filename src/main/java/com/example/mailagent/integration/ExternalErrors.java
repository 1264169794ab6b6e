package com.example.mailagent.integration;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised by HTTP and LLM clients onto the transient/permanent taxonomy.
 */
public final class ExternalErrors {

    private ExternalErrors() {
    }

    public static PortFailure classify(String operation, Throwable error) {
        String message = operation + " failed: " + describe(error);
        if (isTransient(error)) {
            return PortFailure.transientFailure(message);
        }
        return PortFailure.permanentFailure(message);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof RestClientResponseException responseException) {
            HttpStatusCode status = responseException.getStatusCode();
            return status.is5xxServerError() || status.value() == 429 || status.value() == 408;
        }
        if (error instanceof ResourceAccessException
                || error instanceof TimeoutException
                || error instanceof java.io.IOException
                || error instanceof TransientAiException) {
            return true;
        }
        if (error instanceof NonTransientAiException) {
            return false;
        }
        Throwable cause = error.getCause();
        return cause != null && cause != error && isTransient(cause);
    }

    private static String describe(Throwable error) {
        if (error instanceof RestClientResponseException responseException) {
            return responseException.getStatusCode().value() + " " + responseException.getStatusText();
        }
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
