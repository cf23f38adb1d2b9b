package com.fieldlink.api;

import com.fieldlink.resolver.ResolutionResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Envelope returned by {@code GET /query}. Failures carry {@code success=false}, a message and empty data.
 */
@Data
@Builder
public class QueryResponse {
    private boolean success;
    private String message;
    private Map<String, List<String>> data;

    public static QueryResponse from(ResolutionResult result) {
        return QueryResponse.builder()
                .success(result.isSuccess())
                .message(result.getMessage())
                .data(result.getData())
                .build();
    }

    public static QueryResponse failure(String message) {
        return QueryResponse.builder()
                .success(false)
                .message(message)
                .data(new TreeMap<>())
                .build();
    }
}
