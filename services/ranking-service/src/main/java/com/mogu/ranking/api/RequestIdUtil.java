package com.mogu.ranking.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        Object resolved = request.getAttribute(headerName);
        if (resolved instanceof String value && !value.isBlank()) {
            return value;
        }
        return resolveOrGenerate(request.getHeader(headerName));
    }
}
