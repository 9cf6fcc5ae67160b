package io.triggerlens.core.job;

import java.util.List;
import com.google.common.collect.Lists;
import io.triggerlens.client.api.RestJobSummary;
import io.triggerlens.client.api.RestJobSummaryCollection;
import io.triggerlens.client.api.RestTriggerSummary;

public final class RestModels
{
    private RestModels()
    { }

    public static RestJobSummaryCollection jobCollection(List<JobSummary> jobs)
    {
        return RestJobSummaryCollection.of(Lists.transform(jobs, RestModels::job));
    }

    public static RestJobSummary job(JobSummary job)
    {
        return RestJobSummary.builder()
            .name(job.getName())
            .group(job.getGroup())
            .description(job.getDescription())
            .jobType(job.getJobType())
            .concurrentExecutionDisallowed(job.getConcurrentExecutionDisallowed())
            .durable(job.getDurable())
            .persistJobDataAfterExecution(job.getPersistJobDataAfterExecution())
            .requestsRecovery(job.getRequestsRecovery())
            .lastFireTime(job.getLastFireTime())
            .nextFireTime(job.getNextFireTime())
            .triggers(Lists.transform(job.getTriggers(), RestModels::trigger))
            .build();
    }

    public static RestTriggerSummary trigger(TriggerSummary trigger)
    {
        return RestTriggerSummary.builder()
            .name(trigger.getName())
            .group(trigger.getGroup())
            .type(trigger.getKind().getName())
            .scheduleDescription(trigger.getScheduleDescription())
            .previousFireTime(trigger.getPreviousFireTime())
            .nextFireTime(trigger.getNextFireTime())
            .build();
    }
}
