package com.crowd.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.crowd.config.serializer.GeometrySerializer;
import com.crowd.model.Event;
import com.crowd.model.Signal;
import com.crowd.repository.DocumentStore;
import com.crowd.repository.impl.InMemoryDocumentStore;

import java.util.ArrayList;

/**
 * Application configuration for the crowd geo service
 */
@Configuration
@EnableConfigurationProperties(CrowdGeoProperties.class)
public class CrowdGeoConfiguration {
    
    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }
    
    @Bean
    public WKTWriter wktWriter() {
        return new WKTWriter();
    }
    
    @Bean
    public ObjectMapper objectMapper(WKTWriter wktWriter) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        
        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addSerializer(Geometry.class, new GeometrySerializer(wktWriter));
        mapper.registerModule(geometryModule);
        
        return mapper;
    }
    
    /**
     * Executor serving every store call; its threads are the suspension points of queries and batches
     */
    @Bean
    public ThreadPoolTaskExecutor storeExecutor(CrowdGeoProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getStoreThreads());
        executor.setMaxPoolSize(properties.getStoreThreads());
        executor.setThreadNamePrefix("crowd-store-");
        executor.setDaemon(true);
        
        // Let in-flight batches commit before the stores go away
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
    
    @Bean
    public DocumentStore<Event> eventStore(ThreadPoolTaskExecutor storeExecutor, CrowdGeoProperties properties) {
        return new InMemoryDocumentStore<>("events", storeExecutor,
                event -> event.toBuilder()
                        .tags(event.getTags() == null ? null : new ArrayList<>(event.getTags()))
                        .build(),
                properties.getMaxBatchSize());
    }
    
    @Bean
    public DocumentStore<Signal> signalStore(ThreadPoolTaskExecutor storeExecutor, CrowdGeoProperties properties) {
        return new InMemoryDocumentStore<>("signals", storeExecutor,
                signal -> signal.toBuilder().build(),
                properties.getMaxBatchSize());
    }
}
