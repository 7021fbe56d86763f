package com.leadharvest.jobs;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class JobDispatcher {
    private final Map<Class<?>, JobHandler<?>> handlers = new HashMap<>();

    public JobDispatcher(List<JobHandler<?>> handlers) {
        for (JobHandler<?> handler : handlers) {
            JobHandler<?> previous = this.handlers.put(handler.jobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + handler.jobType().getSimpleName());
            }
        }
    }

    public List<FollowUpJob> dispatch(PipelineJob job) {
        JobHandler<?> handler = handlers.get(job.getClass());
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for job " + job.name());
        }
        return dispatchTo(handler, job);
    }

    private static <J extends PipelineJob> List<FollowUpJob> dispatchTo(JobHandler<J> handler, PipelineJob job) {
        return handler.handle(handler.jobType().cast(job));
    }
}
