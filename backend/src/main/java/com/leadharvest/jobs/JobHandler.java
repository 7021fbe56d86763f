package com.leadharvest.jobs;

import java.util.List;

public interface JobHandler<J extends PipelineJob> {
    Class<J> jobType();

    /**
     * Runs the job. Returned follow-ups are enqueued by the queue; an exception is
     * reported on the queue's failure channel.
     */
    List<FollowUpJob> handle(J job);
}
