package com.infra.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.infra.anomaly.config.AerospikeConfig;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.InsightCategory;
import com.infra.anomaly.model.Severity;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class InsightRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final BatchPolicy batchPolicy;

    public InsightRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.batchPolicy = batchPolicy;
    }

    public void save(Insight insight) {
        Key key = new Key(namespace, AerospikeConfig.SET_INSIGHTS, insight.getId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", insight.getId()),
                new Bin("severity", insight.getSeverity().getTag()),
                new Bin("category", insight.getCategory().getTag()),
                new Bin("title", insight.getTitle()),
                new Bin("createdAt", insight.getCreatedAt()),
                new Bin("acked", insight.isAcknowledged())));

        if (insight.getEndpointId() != null) {
            bins.add(new Bin("endpointId", insight.getEndpointId().longValue()));
        }
        if (insight.getEndpointName() != null) {
            bins.add(new Bin("endpointName", insight.getEndpointName()));
        }
        if (insight.getContainerId() != null) {
            bins.add(new Bin("containerId", insight.getContainerId()));
        }
        if (insight.getContainerName() != null) {
            bins.add(new Bin("containerName", insight.getContainerName()));
        }
        if (insight.getMetricType() != null) {
            bins.add(new Bin("metricType", insight.getMetricType()));
        }
        if (insight.getDescription() != null) {
            bins.add(new Bin("description", insight.getDescription()));
        }
        if (insight.getSuggestedAction() != null) {
            bins.add(new Bin("suggestedAction", insight.getSuggestedAction()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    /**
     * Batch read. Missing ids are skipped; order follows {@code ids}.
     */
    public List<Insight> findByIds(List<String> ids) {
        if (ids.isEmpty()) return List.of();

        Key[] keys = ids.stream()
                .map(id -> new Key(namespace, AerospikeConfig.SET_INSIGHTS, id))
                .toArray(Key[]::new);
        Record[] records = client.get(batchPolicy, keys);

        List<Insight> results = new ArrayList<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                results.add(mapRecord(ids.get(i), records[i]));
            }
        }
        return results;
    }

    private Insight mapRecord(String id, Record record) {
        Object endpointId = record.getValue("endpointId");
        return Insight.builder()
                .id(id)
                .endpointId(endpointId != null ? ((Number) endpointId).longValue() : null)
                .endpointName(record.getString("endpointName"))
                .containerId(record.getString("containerId"))
                .containerName(record.getString("containerName"))
                .severity(Severity.fromTag(record.getString("severity")))
                .category(InsightCategory.fromTag(record.getString("category")))
                .metricType(record.getString("metricType"))
                .title(record.getString("title"))
                .description(record.getString("description"))
                .suggestedAction(record.getString("suggestedAction"))
                .createdAt(record.getLong("createdAt"))
                .acknowledged(record.getBoolean("acked"))
                .build();
    }
}
