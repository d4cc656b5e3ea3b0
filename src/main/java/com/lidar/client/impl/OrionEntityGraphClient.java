package com.lidar.client.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.client.EntityGraphClient;
import com.lidar.config.LidarProperties;
import com.lidar.model.DetectedTree;
import com.lidar.model.PipelineResult;
import com.lidar.model.ProcessingJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts NGSI-LD entities into an Orion-LD context broker: one PointCloudLayer per job
 * and an AgriTree per detected tree, up to the configured cap.
 */
@Slf4j
@Component
public class OrionEntityGraphClient implements EntityGraphClient {

    static final String UPSERT_PATH = "/ngsi-ld/v1/entityOperations/upsert";
    static final String CORE_CONTEXT = "https://uri.etsi.org/ngsi-ld/v1/ngsi-ld-core-context.jsonld";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LidarProperties properties;

    public OrionEntityGraphClient(HttpClient httpClient, ObjectMapper objectMapper, LidarProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void publishResult(ProcessingJob job, PipelineResult result) {
        LidarProperties.EntityGraph config = properties.getEntityGraph();
        if (!config.isEnabled()) {
            log.debug("Entity graph disabled, not publishing job {}", job.getId());
            return;
        }
        try {
            List<Map<String, Object>> entities = buildEntities(job, result, config.getTreeBatchLimit());
            HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(config.getUrl() + UPSERT_PATH))
                    .timeout(config.getTimeout())
                    .header("Content-Type", "application/ld+json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(entities)));
            if (job.getTenantId() != null) {
                request.header("NGSILD-Tenant", job.getTenantId());
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("Context broker rejected entities of job {}: HTTP {} {}",
                        job.getId(), response.statusCode(), response.body());
                return;
            }
            log.info("Published {} entities for job {}", entities.size(), job.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing job {} to the context broker", job.getId());
        } catch (Exception e) {
            log.warn("Could not publish job {} to the context broker: {}", job.getId(), e.getMessage());
        }
    }

    List<Map<String, Object>> buildEntities(ProcessingJob job, PipelineResult result, int treeLimit) {
        List<Map<String, Object>> entities = new ArrayList<>();
        String layerId = "urn:ngsi-ld:PointCloudLayer:" + job.getId();

        Map<String, Object> layer = entity(layerId, "PointCloudLayer");
        layer.put("tilesetUrl", property(result.getTilesetUrl()));
        layer.put("source", property(job.getConfig().getSource() != null ? job.getConfig().getSource() : "upload"));
        layer.put("dateObserved", property(Instant.now().toString()));
        layer.put("processingStatus", property("completed"));
        layer.put("pointCount", property(result.getPointCount()));
        layer.put("treeCount", property(result.getTreeCount()));
        if (job.getParcelId() != null) {
            layer.put("refAgriParcel", relationship(job.getParcelId()));
        }
        entities.add(layer);

        List<DetectedTree> trees = result.getTrees();
        int published = Math.min(trees.size(), treeLimit);
        if (published < trees.size()) {
            log.info("Job {} found {} trees, publishing the first {}", job.getId(), trees.size(), published);
        }
        for (DetectedTree tree : trees.subList(0, published)) {
            Map<String, Object> agriTree = entity(
                    "urn:ngsi-ld:AgriTree:" + job.getId() + ":" + tree.getId(), "AgriTree");
            Map<String, Object> location = new LinkedHashMap<>();
            location.put("type", "GeoProperty");
            location.put("value", tree.getLocation());
            agriTree.put("location", location);
            agriTree.put("height", property(tree.getHeight()));
            agriTree.put("crownDiameter", property(tree.getCrownDiameter()));
            agriTree.put("crownArea", property(tree.getCrownArea()));
            agriTree.put("refPointCloudLayer", relationship(layerId));
            if (job.getParcelId() != null) {
                agriTree.put("refAgriParcel", relationship(job.getParcelId()));
            }
            entities.add(agriTree);
        }
        return entities;
    }

    private static Map<String, Object> entity(String id, String type) {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", id);
        entity.put("type", type);
        entity.put("@context", List.of(CORE_CONTEXT));
        return entity;
    }

    private static Map<String, Object> property(Object value) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "Property");
        property.put("value", value);
        return property;
    }

    private static Map<String, Object> relationship(String object) {
        Map<String, Object> relationship = new LinkedHashMap<>();
        relationship.put("type", "Relationship");
        relationship.put("object", object);
        return relationship;
    }
}
