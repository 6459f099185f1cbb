package com.pathway.aggregator.aggregate.util;

import com.pathway.aggregator.aggregate.model.HttpFetchResult;

import java.util.Locale;

public final class ProviderFailureReasons {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INTERRUPTED = "interrupted";
    public static final String INVALID_URL = "invalid_url";
    public static final String MALFORMED_PAYLOAD = "malformed_payload";
    public static final String UNEXPECTED_ERROR = "unexpected_error";
    private static final String HTTP_PREFIX = "http_";

    private ProviderFailureReasons() {}

    public static String fromHttpStatus(int status) {
        if (status == 408) {
            return TIMEOUT;
        }
        return HTTP_PREFIX + status;
    }

    public static String fromFetch(HttpFetchResult result) {
        if (result == null) {
            return UNEXPECTED_ERROR;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            String code = errorCode.toLowerCase(Locale.ROOT);
            if (code.contains("timeout")) {
                return TIMEOUT;
            }
            return switch (code) {
                case IO_ERROR, INTERRUPTED, INVALID_URL -> code;
                default -> UNEXPECTED_ERROR;
            };
        }
        if (result.statusCode() < 200 || result.statusCode() >= 300) {
            return fromHttpStatus(result.statusCode());
        }
        if (result.body() == null || result.body().isBlank()) {
            return MALFORMED_PAYLOAD;
        }
        return UNEXPECTED_ERROR;
    }
}
