package com.shipyard.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Phase-flow settings, bound from {@code shipyard.pipeline.*}.
 */
@ConfigurationProperties(prefix = "shipyard.pipeline")
public class PipelineProperties {

    /** QA rejections per story sent back to implementing before the pipeline pauses for an operator. */
    private int maxQaIterations = 3;

    public int getMaxQaIterations() { return maxQaIterations; }
    public void setMaxQaIterations(int maxQaIterations) { this.maxQaIterations = maxQaIterations; }
}
