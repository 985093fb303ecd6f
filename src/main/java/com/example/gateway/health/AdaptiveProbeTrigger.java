package com.example.gateway.health;

import com.example.gateway.config.GatewayProperties;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Schedules health probes more often when weddings are likely: twice as often from Friday to
 * Sunday and a quarter more often from May to September. Both factors combine.
 */
public class AdaptiveProbeTrigger implements Trigger {

    private final GatewayProperties.Health health;
    private final Clock clock;
    private final ZoneId zoneId;

    public AdaptiveProbeTrigger(GatewayProperties properties, Clock clock) {
        this.health = properties.getHealth();
        this.clock = clock;
        this.zoneId = properties.getZoneId();
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant last = triggerContext.lastCompletion();
        Instant base = last != null ? last : clock.instant();
        return base.plus(intervalAt(base.atZone(zoneId)));
    }

    Duration intervalAt(ZonedDateTime at) {
        double multiplier = 1.0;
        DayOfWeek day = at.getDayOfWeek();
        if (health.isWeddingWeekendMode()
                && (day == DayOfWeek.FRIDAY || day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)) {
            multiplier *= 0.5;
        }
        int month = at.getMonthValue();
        if (health.isPeakSeasonMode() && month >= 5 && month <= 9) {
            multiplier *= 0.75;
        }
        long millis = (long) Math.floor(health.getProbeInterval().toMillis() * multiplier);
        return Duration.ofMillis(Math.max(1L, millis));
    }
}
