package com.eainde.breakdown.config;

import com.eainde.breakdown.job.JobManager;
import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.knowledge.KnowledgeBaseLoader;
import com.eainde.breakdown.thread.MdcAwareExecutor;
import com.eainde.breakdown.workflow.PipelineSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the pipeline and job infrastructure from {@code breakdown.*} properties.
 *
 * <p>Three pools are kept apart: scene workers block on their analyzers, and job workers
 * block on whole runs, so sharing a pool could starve it.</p>
 */
@Configuration
public class BreakdownConfig {

    @Value("${breakdown.jobs.max-concurrent:5}")
    private int maxConcurrentJobs;

    @Value("${breakdown.jobs.cache-ttl-seconds:3600}")
    private long cacheTtlSeconds;

    @Value("${breakdown.jobs.retention-seconds:86400}")
    private long retentionSeconds;

    @Value("${breakdown.pipeline.scene-batch-size:8}")
    private int sceneBatchSize;

    @Value("${breakdown.pipeline.analyzer-threads:4}")
    private int analyzerThreads;

    @Value("${breakdown.pipeline.enable-wardrobe-inference:true}")
    private boolean enableWardrobeInference;

    @Value("${breakdown.pipeline.enable-legal-alerts:true}")
    private boolean enableLegalAlerts;

    @Value("${breakdown.knowledge-base:classpath:knowledge-base.json}")
    private Resource knowledgeBaseResource;

    @Bean
    public KnowledgeBase knowledgeBase(ObjectMapper objectMapper) {
        return new KnowledgeBaseLoader(objectMapper).load(knowledgeBaseResource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return new PipelineSettings(sceneBatchSize, enableWardrobeInference, enableLegalAlerts);
    }

    @Bean(name = "sceneExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor sceneExecutor() {
        return new MdcAwareExecutor("scene", sceneBatchSize);
    }

    @Bean(name = "analyzerExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor analyzerExecutor() {
        return new MdcAwareExecutor("analyzer", analyzerThreads);
    }

    @Bean(name = "jobExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor jobExecutor() {
        return new MdcAwareExecutor("job", maxConcurrentJobs);
    }

    @Bean
    public JobManager jobManager(Clock clock) {
        return new JobManager(maxConcurrentJobs, Duration.ofSeconds(cacheTtlSeconds), Duration.ofSeconds(retentionSeconds), clock);
    }
}
