package com.vibeloop.core.handlers;

import com.microsoft.playwright.TimeoutError;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies collaborator failures into transient (retry) and fatal (stop the run).
 * <p>
 * Transient: timeouts, connection failures, HTTP 408/429 and 5xx. Everything else, including
 * authentication errors, 402 (insufficient credits) and malformed responses, is fatal.
 */
public final class CollaboratorFailures {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    /** Spring AI formats HTTP errors as {@code "<status> - <body>"}. */
    private static final Pattern STATUS_PREFIX = Pattern.compile("^\\s*(\\d{3})\\s+-");

    private CollaboratorFailures() {}

    public static boolean isTransient(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof FatalCollaboratorException) {
                return false;
            }
            if (t instanceof TransientCollaboratorException
                    || t instanceof TransientAiException
                    || t instanceof ResourceAccessException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof TimeoutError) {
                return true;
            }
            if (t instanceof NonTransientAiException) {
                Integer status = statusOf(t.getMessage());
                return status != null && TRANSIENT_STATUSES.contains(status);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    static Integer statusOf(String message) {
        if (message == null) {
            return null;
        }
        Matcher m = STATUS_PREFIX.matcher(message);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }
}
