package io.triggerlens.core.job;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.inject.Inject;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only queries of a Quartz {@link Scheduler}, returned as summaries.
 *
 * Each call reads the scheduler's current state. Nothing is cached or
 * retried; a {@link SchedulerException} from the job store propagates to the
 * caller as is.
 */
public class SchedulerInspector
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerInspector.class);

    private final Scheduler scheduler;
    private final JobSummaryAssembler assembler;

    @Inject
    public SchedulerInspector(Scheduler scheduler, JobSummaryAssembler assembler)
    {
        this.scheduler = scheduler;
        this.assembler = assembler;
    }

    public List<String> listJobGroups()
        throws SchedulerException
    {
        return Ordering.natural().immutableSortedCopy(scheduler.getJobGroupNames());
    }

    public List<JobSummary> listJobs()
        throws SchedulerException
    {
        ImmutableList.Builder<JobSummary> builder = ImmutableList.builder();
        for (String group : listJobGroups()) {
            builder.addAll(listJobs(group));
        }
        return builder.build();
    }

    public List<JobSummary> listJobs(String group)
        throws SchedulerException
    {
        List<JobKey> keys = Ordering.natural().immutableSortedCopy(
                scheduler.getJobKeys(GroupMatcher.jobGroupEquals(group)));
        logger.debug("Listing {} jobs of group {}", keys.size(), group);

        ImmutableList.Builder<JobSummary> builder = ImmutableList.builder();
        for (JobKey key : keys) {
            // a job may be deleted between getJobKeys and getJobDetail
            Optional<JobSummary> job = getJob(key);
            if (job.isPresent()) {
                builder.add(job.get());
            }
        }
        return builder.build();
    }

    public Optional<JobSummary> getJob(JobKey key)
        throws SchedulerException
    {
        JobDetail detail = scheduler.getJobDetail(key);
        if (detail == null) {
            logger.debug("Job {} does not exist", key);
            return Optional.absent();
        }
        List<? extends Trigger> triggers = scheduler.getTriggersOfJob(key);
        return Optional.of(assembler.assemble(detail, triggers));
    }

    public List<TriggerSummary> listTriggers(JobKey key)
        throws SchedulerException
    {
        ImmutableList.Builder<TriggerSummary> builder = ImmutableList.builder();
        for (Trigger trigger : scheduler.getTriggersOfJob(key)) {
            builder.add(assembler.summarize(trigger));
        }
        return builder.build();
    }

    public Optional<TriggerSummary> getTrigger(TriggerKey key)
        throws SchedulerException
    {
        Trigger trigger = scheduler.getTrigger(key);
        if (trigger == null) {
            logger.debug("Trigger {} does not exist", key);
            return Optional.absent();
        }
        return Optional.of(assembler.summarize(trigger));
    }
}
