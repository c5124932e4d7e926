package org.example.blueprint.service;

import org.example.blueprint.model.FailureKind;
import org.example.blueprint.service.llm.LlmProviderException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed generation call is worth retrying. No I/O, no state.
 */
@Component
public class GenerationErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<String> TRANSIENT_MESSAGE_MARKERS = List.of(
            "timeout",
            "timed out",
            "connection refused",
            "connection reset",
            "connection closed",
            "broken pipe",
            "rate limit",
            "rate-limit",
            "ratelimit",
            "too many requests",
            "429",
            "temporarily unavailable",
            "service unavailable",
            "bad gateway",
            "gateway timeout",
            "overloaded",
            "500 internal server error",
            "502",
            "503",
            "504"
    );

    public FailureKind classify(Throwable failure) {
        if (failure == null) {
            return FailureKind.PERMANENT;
        }
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH && seen.add(current)) {
            if (isTransientType(current)) {
                return FailureKind.TRANSIENT;
            }
            Integer status = statusOf(current);
            if (status != null) {
                // An explicit HTTP status outranks whatever the message says.
                return isTransientStatus(status) ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
            }
            if (hasTransientMessage(current.getMessage())) {
                return FailureKind.TRANSIENT;
            }
            current = current.getCause();
            depth++;
        }
        return FailureKind.PERMANENT;
    }

    /**
     * Classifies a recorded error message, for failures loaded back from a state file.
     */
    public FailureKind classify(String errorMessage) {
        return hasTransientMessage(errorMessage) ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
    }

    public boolean isTransient(Throwable failure) {
        return classify(failure) == FailureKind.TRANSIENT;
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || (status >= 500 && status <= 599);
    }

    private boolean isTransientType(Throwable failure) {
        if (failure instanceof TimeoutException
                || failure instanceof SocketTimeoutException
                || failure instanceof HttpTimeoutException
                || failure instanceof ConnectException
                || failure instanceof NoRouteToHostException
                || failure instanceof WebClientRequestException) {
            return true;
        }
        if (failure instanceof SocketException) {
            return hasTransientMessage(failure.getMessage());
        }
        return false;
    }

    private Integer statusOf(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().value();
        }
        if (failure instanceof LlmProviderException providerException) {
            return providerException.getStatusCode();
        }
        return null;
    }

    private boolean hasTransientMessage(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MESSAGE_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
