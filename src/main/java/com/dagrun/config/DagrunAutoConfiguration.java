package com.dagrun.config;

import com.dagrun.core.events.EventBus;
import com.dagrun.core.graph.GraphBuilder;
import com.dagrun.core.metrics.DagrunMetrics;
import com.dagrun.core.resources.ResourcePool;
import com.dagrun.core.scheduler.RunReportWriter;
import com.dagrun.core.scheduler.RunSummaryLogger;
import com.dagrun.core.scheduler.Scheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes the graph builder, scheduler and their collaborators as beans.
 * Every bean can be replaced by declaring one of the same type.
 */
@AutoConfiguration
@EnableConfigurationProperties(DagrunProperties.class)
public class DagrunAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DagrunAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public GraphBuilder graphBuilder() {
        return new GraphBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus dagrunEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public DagrunMetrics dagrunMetrics(ObjectProvider<MeterRegistry> registry, DagrunProperties properties) {
        MeterRegistry shared = registry.getIfAvailable();
        if (shared != null && properties.getMetrics().isEnabled()) {
            return new DagrunMetrics(shared);
        }
        return DagrunMetrics.standalone();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunSummaryLogger runSummaryLogger() {
        return new RunSummaryLogger();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunReportWriter runReportWriter(ObjectProvider<ObjectMapper> objectMapper) {
        return new RunReportWriter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourcePool resourcePool(DagrunProperties properties) {
        log.info("Resource pool capacity: {}", properties.getResources());
        return new ResourcePool(properties.getResources());
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(EventBus eventBus, DagrunMetrics metrics,
                               RunSummaryLogger summaryLogger, DagrunProperties properties) {
        return new Scheduler(eventBus, metrics,
                properties.getSummary().isEnabled() ? summaryLogger : null,
                properties.getScheduler().isCleanupRoots());
    }
}
