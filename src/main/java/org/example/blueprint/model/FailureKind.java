package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classification of a generation failure.
 */
public enum FailureKind {
    /** Expected to resolve on retry: timeouts, dropped connections, rate limiting, 5xx. */
    @JsonProperty("transient")
    TRANSIENT,
    /** No retry can fix it: bad credentials, malformed request, rejected content. */
    @JsonProperty("permanent")
    PERMANENT
}
