package com.di.logsift.aspect;

import com.di.logsift.store.StoreException;
import com.di.logsift.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories used in operation events.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    STORE_UNAVAILABLE("Store unavailable", "Document store not reachable within the connection policy"),
    RATE_LIMITED("Rate limited", "Document store rejected the request with 429"),
    CONFLICT("Version conflict", "Document already exists or was modified concurrently"),
    STORE_ERROR("Store error", "Document store returned a server-side error"),
    REQUEST_REJECTED("Request rejected", "Document store rejected the request as invalid"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    SERIALIZATION_ERROR("Serialization error", "Document could not be written as JSON"),
    MALFORMED_INPUT("Malformed input", "Input could not be parsed"),
    VALIDATION_ERROR("Validation error", "Input validation or argument violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isMalformedInput, MALFORMED_INPUT);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof StoreException storeException) {
            return categorizeStoreException(storeException);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeStoreException(StoreException e) {
        if (e instanceof StoreUnavailableException) {
            return STORE_UNAVAILABLE;
        }
        if (e.isRateLimited()) {
            return RATE_LIMITED;
        }
        if (e.isConflict()) {
            return CONFLICT;
        }
        if (e.getStatus() >= 500) {
            return STORE_ERROR;
        }
        if (e.getStatus() >= 400) {
            return REQUEST_REJECTED;
        }
        Throwable cause = e.getCause();
        if (cause != null && isTimeoutError(cause)) {
            return TIMEOUT_ERROR;
        }
        return NETWORK_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonGenerationException
                || t instanceof com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
    }

    private static boolean isMalformedInput(Throwable t) {
        return t instanceof JsonProcessingException
                || t instanceof java.util.zip.ZipException
                || t instanceof java.nio.charset.CharacterCodingException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
