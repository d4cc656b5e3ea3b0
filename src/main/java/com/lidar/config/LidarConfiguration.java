package com.lidar.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Geometry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lidar.config.serializer.GeometrySerializer;
import com.lidar.config.serializer.GeometryDeserializer;

import java.net.http.HttpClient;

/**
 * Application configuration for the LiDAR pipeline
 */
@Configuration
public class LidarConfiguration {

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public ObjectMapper objectMapper(GeometryFactory geometryFactory) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // Geometry travels as GeoJSON out, WKT or GeoJSON in
        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addSerializer(Geometry.class, new GeometrySerializer());
        geometryModule.addDeserializer(Geometry.class, new GeometryDeserializer(geometryFactory));
        mapper.registerModule(geometryModule);

        return mapper;
    }

    /**
     * Shared client for origin downloads, WFS seeding and the context broker
     */
    @Bean
    public HttpClient httpClient(LidarProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getDownload().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Worker pool running one pipeline job per task
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(LidarProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorker().getPoolSize());
        executor.setMaxPoolSize(properties.getWorker().getPoolSize());
        executor.setQueueCapacity(properties.getWorker().getQueueCapacity());
        executor.setThreadNamePrefix("lidar-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
