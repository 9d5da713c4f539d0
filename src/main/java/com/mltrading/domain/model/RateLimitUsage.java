package com.mltrading.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Budget consumption of one category in its current hour and day windows.
 */
@Value
@Builder
public class RateLimitUsage {

    int hourCount;
    int hourlyLimit;
    Instant hourWindowStart;
    int dayCount;
    int dailyLimit;
    Instant dayWindowStart;

    public boolean isExhausted() {
        return hourCount >= hourlyLimit || dayCount >= dailyLimit;
    }
}
