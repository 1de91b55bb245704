package com.infra.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.anomaly.config.AerospikeConfig;
import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read side of the metric store. The collector keeps one record per
 * container+metric; the {@code values} bin holds the newest samples (oldest
 * first) as a JSON array, {@code lastValue}/{@code lastTs} the latest reading.
 */
@Repository
public class MetricSampleRepository {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public MetricSampleRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Mean and population standard deviation over the newest {@code windowSize} samples.
     *
     * @return null when no samples exist for the pair
     */
    public AnomalyStats getMovingAverage(String containerId, String metricType, int windowSize) {
        Record record = client.get(readPolicy, key(containerId, metricType));
        if (record == null) return null;

        List<Double> values = deserializeValues(record.getString("values"));
        if (values.size() > windowSize) {
            values = values.subList(values.size() - windowSize, values.size());
        }
        return summarize(values);
    }

    /**
     * Latest reading of every container+metric updated at or after {@code sinceMillis},
     * oldest first.
     */
    public List<MetricSample> findLatestSamples(long sinceMillis) {
        List<MetricSample> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METRIC_SAMPLES,
                (key, record) -> {
                    try {
                        if (record.getLong("lastTs") < sinceMillis) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read metric sample record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(MetricSample::getTimestamp));
        return results;
    }

    static AnomalyStats summarize(List<Double> values) {
        if (values.isEmpty()) return null;

        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / values.size();

        double squared = 0.0;
        for (double v : values) {
            squared += (v - mean) * (v - mean);
        }
        double variance = squared / values.size();

        return AnomalyStats.builder()
                .mean(mean)
                .stdDev(Math.sqrt(Math.max(0.0, variance)))
                .sampleCount(values.size())
                .build();
    }

    private Key key(String containerId, String metricType) {
        return new Key(namespace, AerospikeConfig.SET_METRIC_SAMPLES, containerId + "|" + metricType);
    }

    private MetricSample mapRecord(Record record) {
        Object endpointId = record.getValue("endpointId");
        return MetricSample.builder()
                .containerId(record.getString("containerId"))
                .containerName(record.getString("containerName"))
                .endpointId(endpointId != null ? ((Number) endpointId).longValue() : null)
                .endpointName(record.getString("endpointName"))
                .metricType(record.getString("metricType"))
                .value(record.getDouble("lastValue"))
                .timestamp(record.getLong("lastTs"))
                .build();
    }

    private List<Double> deserializeValues(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<ArrayList<Double>>() {});
        } catch (Exception e) {
            log.warn("Discarding unreadable sample history: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
