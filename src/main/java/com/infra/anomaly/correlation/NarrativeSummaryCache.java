package com.infra.anomaly.correlation;

import com.infra.anomaly.config.CorrelationConfig;
import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Insight;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Narratives keyed by correlation type and the sorted member ids of a group,
 * so the same group is not re-summarized on every cycle. Entries expire after
 * the configured TTL and are purged on every write.
 */
@Component
public class NarrativeSummaryCache {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public NarrativeSummaryCache(CorrelationConfig config) {
        this(Duration.ofSeconds(config.getIncidentSummary().getCacheTtlSeconds()), Clock.systemUTC());
    }

    NarrativeSummaryCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<String> get(List<Insight> insights, CorrelationType type) {
        String key = key(insights, type);
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (entry.expiresAt <= clock.millis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.summary);
    }

    /**
     * Stores a narrative and drops every expired entry.
     */
    public void put(List<Insight> insights, CorrelationType type, String summary) {
        long now = clock.millis();
        entries.values().removeIf(e -> e.expiresAt <= now);
        entries.put(key(insights, type), new Entry(summary, now + ttl.toMillis()));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    static String key(List<Insight> insights, CorrelationType type) {
        return type.getTag() + ":" + insights.stream()
                .map(Insight::getId)
                .sorted()
                .collect(Collectors.joining(","));
    }

    private static final class Entry {
        private final String summary;
        private final long expiresAt;

        private Entry(String summary, long expiresAt) {
            this.summary = summary;
            this.expiresAt = expiresAt;
        }
    }
}
