package com.fieldlink.resolver;

import lombok.Value;

/**
 * One traversal step: look up {@code value} of {@code fieldId} in {@code relation}.
 * Also the deduplication key guaranteeing each step runs at most once per request.
 */
@Value
public class LookupUnit {
    String relation;
    String fieldId;
    String value;

    @Override
    public String toString() {
        return relation + "/" + fieldId + "=" + value;
    }
}
