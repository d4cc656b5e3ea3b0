package com.lidar.repository.data.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.config.LidarProperties;
import com.lidar.model.SourceTile;
import com.lidar.repository.data.GeoJsonFeatureParser;
import com.lidar.repository.data.SeedRecordReader;
import com.lidar.repository.data.SeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads footprints from an OGC WFS GetFeature endpoint that can answer in GeoJSON
 */
@Component
public class WfsSeedReader implements SeedRecordReader {

    private static final Logger logger = LoggerFactory.getLogger(WfsSeedReader.class);

    @Autowired
    private HttpClient httpClient;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GeoJsonFeatureParser featureParser;

    @Autowired
    private LidarProperties properties;

    @Override
    public List<SourceTile> read(SeedSource source) throws IOException {
        URI uri = getFeatureUri(source);
        logger.info("Fetching coverage footprints from WFS: {}", uri);

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(properties.getDownload().getRasterTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while querying WFS " + source.getLocation());
        }

        if (response.statusCode() != 200) {
            throw new IOException("WFS request failed with HTTP " + response.statusCode());
        }

        JsonNode root = objectMapper.readTree(response.body());
        return featureParser.parse(root, source);
    }

    @Override
    public boolean supports(SeedSource.SeedSourceType type) {
        return type == SeedSource.SeedSourceType.WFS_GEOJSON;
    }

    static URI getFeatureUri(SeedSource source) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("service", "WFS");
        params.put("version", "2.0.0");
        params.put("request", "GetFeature");
        params.put("typeName", source.getTypeName());
        params.put("outputFormat", "application/json");
        params.put("srsName", "EPSG:4326");
        if (source.getBbox() != null && !source.getBbox().isBlank()) {
            params.put("bbox", source.getBbox());
        }

        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        String base = source.getLocation();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }
}
