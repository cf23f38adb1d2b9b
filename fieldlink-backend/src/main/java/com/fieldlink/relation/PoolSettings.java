package com.fieldlink.relation;

import lombok.Builder;
import lombok.Value;

/**
 * HikariCP sizing applied to every relation pool.
 */
@Value
@Builder
public class PoolSettings {
    @Builder.Default
    int maximumPoolSize = 5;
    @Builder.Default
    int minimumIdle = 1;
    @Builder.Default
    long connectionTimeoutMs = 5000;
    @Builder.Default
    int validationTimeoutSec = 5;
}
