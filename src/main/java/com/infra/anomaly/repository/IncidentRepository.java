package com.infra.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.anomaly.config.AerospikeConfig;
import com.infra.anomaly.model.CorrelationConfidence;
import com.infra.anomaly.model.CorrelationType;
import com.infra.anomaly.model.Incident;
import com.infra.anomaly.model.IncidentInsert;
import com.infra.anomaly.model.IncidentStatus;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Incident store. This service only creates incidents and appends insights
 * to them; resolving happens elsewhere.
 */
@Repository
public class IncidentRepository {

    private static final Logger log = LoggerFactory.getLogger(IncidentRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final InsightRepository insightRepository;
    private final ObjectMapper objectMapper;

    public IncidentRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy,
                              InsightRepository insightRepository) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.insightRepository = insightRepository;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Write a new incident with status ACTIVE.
     *
     * @throws IncidentPersistenceException if the store rejects the write
     */
    public void insertIncident(IncidentInsert incident) {
        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, incident.getId());
        long now = System.currentTimeMillis();

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", incident.getId()),
                new Bin("title", incident.getTitle()),
                new Bin("severity", incident.getSeverity().getTag()),
                new Bin("status", IncidentStatus.ACTIVE.name()),
                new Bin("rootCauseId", incident.getRootCauseInsightId()),
                new Bin("relatedIds", serializeList(incident.getRelatedInsightIds())),
                new Bin("containers", serializeList(incident.getAffectedContainers())),
                new Bin("corrType", incident.getCorrelationType().getTag()),
                new Bin("confidence", incident.getCorrelationConfidence().name()),
                new Bin("insightCount", incident.getInsightCount()),
                new Bin("createdAt", now),
                new Bin("updatedAt", now),
                new Bin("resolvedAt", 0L)));
        if (incident.getEndpointId() != null) {
            bins.add(new Bin("endpointId", incident.getEndpointId().longValue()));
        }
        if (incident.getEndpointName() != null) {
            bins.add(new Bin("endpointName", incident.getEndpointName()));
        }
        if (incident.getSummary() != null) {
            bins.add(new Bin("summary", incident.getSummary()));
        }

        try {
            client.put(writePolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            throw new IncidentPersistenceException("Failed to insert incident " + incident.getId(), e);
        }
        log.debug("Incident {} stored with {} insights", incident.getId(), incident.getInsightCount());
    }

    /**
     * Attach an insight to an existing incident. Ids and container names are
     * appended only if absent. No-op when the incident does not exist.
     *
     * @throws IncidentPersistenceException if the store rejects the write
     */
    public void addInsightToIncident(String incidentId, String insightId, String containerName) {
        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, incidentId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return;

            List<String> relatedIds = deserializeList(record.getString("relatedIds"));
            if (!relatedIds.contains(insightId)) {
                relatedIds.add(insightId);
            }

            List<String> containers = deserializeList(record.getString("containers"));
            if (containerName != null && !containers.contains(containerName)) {
                containers.add(containerName);
            }

            client.put(writePolicy, key,
                    new Bin("relatedIds", serializeList(relatedIds)),
                    new Bin("containers", serializeList(containers)),
                    new Bin("insightCount", relatedIds.size() + 1),
                    new Bin("updatedAt", System.currentTimeMillis()));
        } catch (AerospikeException e) {
            throw new IncidentPersistenceException(
                    "Failed to add insight " + insightId + " to incident " + incidentId, e);
        }
    }

    /**
     * Newest active incident created within the last {@code withinMinutes} whose
     * root-cause or related insights belong to {@code containerId}. Incidents
     * without an endpoint are never matched.
     *
     * @return the incident, or null if none matches
     */
    public Incident getActiveIncidentForContainer(String containerId, int withinMinutes) {
        long cutoff = System.currentTimeMillis() - withinMinutes * 60_000L;
        List<Incident> candidates = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_INCIDENTS,
                (key, record) -> {
                    try {
                        if (!IncidentStatus.ACTIVE.name().equals(record.getString("status"))) return;
                        if (record.getLong("createdAt") < cutoff) return;
                        synchronized (candidates) {
                            candidates.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read incident record: {}", e.getMessage());
                    }
                });

        candidates.sort(Comparator.comparingLong(Incident::getCreatedAt).reversed());

        for (Incident incident : candidates) {
            if (incident.getEndpointId() == null) continue;

            List<String> ids = incident.allInsightIds();
            if (ids.isEmpty()) continue;

            for (Insight insight : insightRepository.findByIds(ids)) {
                if (containerId.equals(insight.getContainerId())) {
                    return incident;
                }
            }
        }
        return null;
    }

    private Incident mapRecord(Record record) {
        Object endpointId = record.getValue("endpointId");
        return Incident.builder()
                .id(record.getString("id"))
                .title(record.getString("title"))
                .severity(Severity.fromTag(record.getString("severity")))
                .status(IncidentStatus.valueOf(record.getString("status")))
                .rootCauseInsightId(record.getString("rootCauseId"))
                .relatedInsightIds(deserializeList(record.getString("relatedIds")))
                .affectedContainers(deserializeList(record.getString("containers")))
                .endpointId(endpointId != null ? ((Number) endpointId).longValue() : null)
                .endpointName(record.getString("endpointName"))
                .correlationType(CorrelationType.fromTag(record.getString("corrType")))
                .correlationConfidence(CorrelationConfidence.valueOf(record.getString("confidence")))
                .insightCount(record.getInt("insightCount"))
                .summary(record.getString("summary"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .resolvedAt(record.getLong("resolvedAt"))
                .build();
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : List.of());
        } catch (Exception e) {
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<ArrayList<String>>() {});
        } catch (Exception e) {
            return new ArrayList<>();
        }
    }
}
