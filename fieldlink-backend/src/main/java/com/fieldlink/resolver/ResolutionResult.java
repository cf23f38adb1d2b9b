package com.fieldlink.resolver;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one resolution: either the discovered values or a failure message with no data.
 */
@Value
public class ResolutionResult {
    boolean success;
    String message;
    SortedMap<String, List<String>> data;

    public static ResolutionResult success(String message, SortedMap<String, List<String>> data) {
        return new ResolutionResult(true, message, Collections.unmodifiableSortedMap(data));
    }

    public static ResolutionResult failure(String message) {
        return new ResolutionResult(false, message, Collections.unmodifiableSortedMap(new TreeMap<>()));
    }
}
