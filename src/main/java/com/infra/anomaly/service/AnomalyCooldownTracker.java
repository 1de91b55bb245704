package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Last time each container+metric was flagged. A pair flagged within
 * {@code anomaly.cooldown-minutes} is suppressed; expired entries are swept
 * every 15 minutes.
 */
@Component
public class AnomalyCooldownTracker {

    private static final Logger log = LoggerFactory.getLogger(AnomalyCooldownTracker.class);

    private final Map<String, Long> lastFlagged = new ConcurrentHashMap<>();
    private final AnomalyDetectionConfig config;
    private final Clock clock;

    @Autowired
    public AnomalyCooldownTracker(AnomalyDetectionConfig config) {
        this(config, Clock.systemUTC());
    }

    AnomalyCooldownTracker(AnomalyDetectionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Records the pair as flagged now unless it is still cooling down.
     *
     * @return false when the pair was flagged less than the cooldown ago
     */
    public boolean tryFlag(String containerId, String metricType) {
        long cooldownMs = cooldownMillis();
        if (cooldownMs <= 0) return true;

        long now = clock.millis();
        boolean[] flagged = {false};
        lastFlagged.compute(key(containerId, metricType), (k, last) -> {
            if (last != null && now - last < cooldownMs) {
                return last;
            }
            flagged[0] = true;
            return now;
        });
        return flagged[0];
    }

    @Scheduled(fixedRate = 15, initialDelay = 15, timeUnit = TimeUnit.MINUTES)
    public int sweepExpired() {
        long cooldownMs = cooldownMillis();
        long now = clock.millis();
        int before = lastFlagged.size();
        lastFlagged.values().removeIf(last -> now - last >= cooldownMs);
        int swept = before - lastFlagged.size();
        if (swept > 0) {
            log.debug("Swept {} expired anomaly cooldowns, {} remaining", swept, lastFlagged.size());
        }
        return swept;
    }

    public void clear() {
        lastFlagged.clear();
    }

    public int size() {
        return lastFlagged.size();
    }

    private long cooldownMillis() {
        return config.getCooldownMinutes() * 60_000L;
    }

    private static String key(String containerId, String metricType) {
        return containerId + ":" + metricType;
    }
}
