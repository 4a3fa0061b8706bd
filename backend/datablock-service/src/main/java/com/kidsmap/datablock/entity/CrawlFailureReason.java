package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.exception.ConfigurationException;
import com.kidsmap.datablock.exception.DataBlockException;
import com.kidsmap.datablock.exception.ValidationException;

/**
 * Enum representing failure reasons for crawl jobs.
 * Stored as CrawlError.code for diagnostics and monitoring.
 */
public enum CrawlFailureReason {
    // Timeout / network
    TIMEOUT_HTTP_REQUEST("timeout_http_request", "Source API request timeout"),
    CONNECTION_REFUSED("connection_refused", "Connection refused by source API"),
    CONNECTION_TIMEOUT("connection_timeout", "Connection establishment timeout"),
    DNS_RESOLUTION_FAILED("dns_resolution_failed", "DNS resolution failed"),
    NETWORK_ERROR("network_error", "Transient network error, retries exhausted"),

    // Source API errors
    SERVICE_UNAVAILABLE("service_unavailable", "Source API unavailable"),
    SERVICE_OVERLOADED("service_overloaded", "Source API rate limited"),
    SOURCE_ERROR("source_error", "Source API rejected the request"),

    // Content errors
    PARSE_ERROR("parse_error", "Failed to parse source response"),

    // Job management
    INVALID_CONFIG("invalid_config", "Job configuration invalid"),
    CONFIGURATION_MISSING("configuration_missing", "Required configuration missing"),
    JOB_CANCELLED("job_cancelled", "Job was cancelled"),
    STUCK_TIMEOUT("stuck_timeout", "Job exceeded running timeout and was recovered"),

    UNKNOWN("unknown", "Unknown error occurred");

    private final String code;
    private final String description;

    CrawlFailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Get failure reason from exception type and message
     */
    public static CrawlFailureReason fromException(Throwable e) {
        if (e == null) return UNKNOWN;

        if (e instanceof ValidationException) return INVALID_CONFIG;
        if (e instanceof ConfigurationException) return CONFIGURATION_MISSING;
        if (e instanceof DataBlockException dbe && "SOURCE_ERROR".equals(dbe.getErrorCode())) {
            return SOURCE_ERROR;
        }

        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        String className = e.getClass().getSimpleName().toLowerCase();

        if (className.contains("timeout") || message.contains("timeout") || message.contains("timed out")) {
            if (message.contains("connect")) return CONNECTION_TIMEOUT;
            return TIMEOUT_HTTP_REQUEST;
        }
        if (message.contains("connection refused") || className.contains("connectexception")) {
            return CONNECTION_REFUSED;
        }
        if (message.contains("dns") || message.contains("unknown host") || message.contains("unresolved")) {
            return DNS_RESOLUTION_FAILED;
        }
        if (message.contains("503") || message.contains("service unavailable")) {
            return SERVICE_UNAVAILABLE;
        }
        if (message.contains("429") || message.contains("rate limit") || message.contains("too many requests")) {
            return SERVICE_OVERLOADED;
        }
        if (message.contains("parse") || message.contains("json") || message.contains("malformed")) {
            return PARSE_ERROR;
        }
        if (message.contains("unreachable") || message.contains("network")) {
            return NETWORK_ERROR;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
