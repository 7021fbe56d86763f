package com.leadharvest.jobs;

public interface PipelineJob {
    String name();
}
