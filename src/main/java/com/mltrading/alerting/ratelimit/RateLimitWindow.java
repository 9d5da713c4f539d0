package com.mltrading.alerting.ratelimit;

import com.mltrading.domain.model.RateLimitUsage;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Hour and day budget of one alert category.
 *
 * <p>Windows are aligned to the wall clock: the hour window starts at {@code :00},
 * the day window at local midnight of the configured zone. A window is rolled over
 * lazily, by the first {@link #tryAcquire} that sees its boundary has passed.
 *
 * <p>All state is guarded by this instance's monitor, held only for the
 * check-and-increment.
 */
class RateLimitWindow {

    private int hourCount;
    private Instant hourWindowStart;
    private int dayCount;
    private Instant dayWindowStart;

    RateLimitWindow(Instant now, ZoneId zone) {
        this.hourWindowStart = hourStart(now, zone);
        this.dayWindowStart = dayStart(now, zone);
    }

    /**
     * Takes one unit of budget if both windows have room.
     *
     * @return false, leaving both counters untouched, when either limit is reached
     */
    synchronized boolean tryAcquire(Instant now, ZoneId zone, int maxPerHour, int maxPerDay) {
        rollOver(now, zone);
        if (hourCount >= maxPerHour || dayCount >= maxPerDay) {
            return false;
        }
        hourCount++;
        dayCount++;
        return true;
    }

    synchronized RateLimitUsage usage(Instant now, ZoneId zone, int maxPerHour, int maxPerDay) {
        rollOver(now, zone);
        return RateLimitUsage.builder()
                .hourCount(hourCount)
                .hourlyLimit(maxPerHour)
                .hourWindowStart(hourWindowStart)
                .dayCount(dayCount)
                .dailyLimit(maxPerDay)
                .dayWindowStart(dayWindowStart)
                .build();
    }

    private void rollOver(Instant now, ZoneId zone) {
        Instant currentHour = hourStart(now, zone);
        if (currentHour.isAfter(hourWindowStart)) {
            hourCount = 0;
            hourWindowStart = currentHour;
        }
        Instant currentDay = dayStart(now, zone);
        if (currentDay.isAfter(dayWindowStart)) {
            dayCount = 0;
            dayWindowStart = currentDay;
        }
    }

    private static Instant hourStart(Instant now, ZoneId zone) {
        return ZonedDateTime.ofInstant(now, zone).truncatedTo(ChronoUnit.HOURS).toInstant();
    }

    private static Instant dayStart(Instant now, ZoneId zone) {
        return ZonedDateTime.ofInstant(now, zone).toLocalDate().atStartOfDay(zone).toInstant();
    }
}
