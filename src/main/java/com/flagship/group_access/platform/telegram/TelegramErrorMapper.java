package com.flagship.group_access.platform.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.group_access.access.PlatformCallException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Turns Bot API failures into {@link PlatformCallException}s.
 *
 * 429 and 5xx are retryable, honouring {@code parameters.retry_after}. Network errors are
 * retryable. Any other 4xx is fatal. A deactivated account is reported with its own code so
 * callers can stop trying for that user.
 */
public final class TelegramErrorMapper {

    private static final ObjectMapper OM = new ObjectMapper();

    private TelegramErrorMapper() {}

    public static PlatformCallException map(String method, Throwable e) {
        if (e instanceof PlatformCallException pce) {
            return pce;
        }
        if (e instanceof RestClientResponseException re) {
            ErrorBody body = parse(re.getResponseBodyAsString());
            int code = body.errorCode > 0 ? body.errorCode : re.getStatusCode().value();
            String description = body.description != null ? body.description : re.getStatusText();
            return fromResponse(method, code, description, body.retryAfter);
        }
        if (e instanceof ResourceAccessException || e instanceof IOException) {
            return wrap(PlatformCallException.Kind.RETRYABLE, "NETWORK_ERROR",
                    method + " failed: " + e.getMessage(), null, e);
        }
        if (e instanceof RestClientException) {
            return wrap(PlatformCallException.Kind.RETRYABLE, "CLIENT_ERROR",
                    method + " failed: " + e.getMessage(), null, e);
        }
        return wrap(PlatformCallException.Kind.FATAL, "UNKNOWN",
                method + " failed: " + e.getMessage(), null, e);
    }

    /**
     * Classifies an {@code ok=false} answer, whether it came with an HTTP error status or not.
     */
    public static PlatformCallException fromResponse(String method, int errorCode, String description,
                                                     Integer retryAfterSeconds) {
        String message = method + " failed: " + errorCode + " " + description;
        String lower = description == null ? "" : description.toLowerCase(Locale.ROOT);

        if (lower.contains("user is deactivated")) {
            return PlatformCallException.fatal(PlatformCallException.USER_DEACTIVATED, message);
        }
        if (errorCode == 429) {
            Duration retryAfter = retryAfterSeconds != null ? Duration.ofSeconds(retryAfterSeconds) : null;
            return PlatformCallException.retryable("RATE_LIMITED", message, retryAfter);
        }
        if (errorCode >= 500) {
            return PlatformCallException.retryable("UPSTREAM_" + errorCode, message, null);
        }
        return PlatformCallException.fatal(errorCodeFor(errorCode, lower), message);
    }

    private static String errorCodeFor(int errorCode, String lower) {
        if (lower.contains("hide_requester_missing")) {
            return "NO_JOIN_REQUEST";
        }
        if (errorCode == 401 || errorCode == 403) {
            return "FORBIDDEN";
        }
        return "BAD_REQUEST";
    }

    private static PlatformCallException wrap(PlatformCallException.Kind kind, String code, String message,
                                              Duration retryAfter, Throwable cause) {
        return new PlatformCallException(kind, code, message, retryAfter, cause);
    }

    private static ErrorBody parse(String raw) {
        ErrorBody body = new ErrorBody();
        if (raw == null || raw.isBlank()) {
            return body;
        }
        try {
            JsonNode node = OM.readTree(raw);
            body.errorCode = node.path("error_code").asInt(0);
            body.description = node.hasNonNull("description") ? node.get("description").asText() : null;
            JsonNode retryAfter = node.path("parameters").path("retry_after");
            body.retryAfter = retryAfter.isNumber() ? retryAfter.asInt() : null;
        } catch (IOException e) {
            // Not a Bot API error body; the HTTP status decides.
            body.description = raw.length() > 200 ? raw.substring(0, 200) : raw;
        }
        return body;
    }

    private static final class ErrorBody {
        int errorCode;
        String description;
        Integer retryAfter;
    }
}
