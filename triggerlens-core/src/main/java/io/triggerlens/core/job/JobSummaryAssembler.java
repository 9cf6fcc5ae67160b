package io.triggerlens.core.job;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.triggerlens.core.schedule.ScheduleDescriber;
import io.triggerlens.core.schedule.TriggerDescriptor;
import io.triggerlens.core.schedule.TriggerDescriptors;
import org.quartz.JobDetail;
import org.quartz.Trigger;

/**
 * Projects Quartz job details and triggers into {@link JobSummary} and
 * {@link TriggerSummary}. Flags are copied as the job detail reports them.
 */
public class JobSummaryAssembler
{
    private final TriggerDescriptors descriptors;
    private final ScheduleDescriber describer;

    @Inject
    public JobSummaryAssembler(TriggerDescriptors descriptors, ScheduleDescriber describer)
    {
        this.descriptors = descriptors;
        this.describer = describer;
    }

    public JobSummary assemble(JobDetail job, List<? extends Trigger> triggers)
    {
        ImmutableJobSummary.Builder builder = JobSummary.builder()
            .name(job.getKey().getName())
            .group(job.getKey().getGroup())
            .description(Optional.fromNullable(job.getDescription()))
            .jobType(job.getJobClass().getName())
            .concurrentExecutionDisallowed(job.isConcurrentExectionDisallowed())
            .durable(job.isDurable())
            .persistJobDataAfterExecution(job.isPersistJobDataAfterExecution())
            .requestsRecovery(job.requestsRecovery());

        Optional<Trigger> relevant = mostRelevantTrigger(triggers);
        if (relevant.isPresent()) {
            builder.lastFireTime(toInstant(relevant.get().getPreviousFireTime()));
            builder.nextFireTime(toInstant(relevant.get().getNextFireTime()));
        }

        for (Trigger trigger : triggers) {
            builder.addTriggers(summarize(trigger));
        }
        return builder.build();
    }

    public TriggerSummary summarize(Trigger trigger)
    {
        TriggerDescriptor descriptor = descriptors.of(trigger);
        return TriggerSummary.builder()
            .name(trigger.getKey().getName())
            .group(trigger.getKey().getGroup())
            .kind(descriptor.getKind())
            .scheduleDescription(describer.describe(descriptor))
            .previousFireTime(toInstant(trigger.getPreviousFireTime()))
            .nextFireTime(toInstant(trigger.getNextFireTime()))
            .build();
    }

    /**
     * The trigger that fires next, or if none will fire again, the one that
     * fired last. Absent if no trigger has fired or will fire.
     */
    static Optional<Trigger> mostRelevantTrigger(List<? extends Trigger> triggers)
    {
        Trigger firesNext = null;
        Trigger firedLast = null;
        for (Trigger trigger : triggers) {
            Date next = trigger.getNextFireTime();
            if (next != null && (firesNext == null || next.before(firesNext.getNextFireTime()))) {
                firesNext = trigger;
            }
            Date previous = trigger.getPreviousFireTime();
            if (previous != null && (firedLast == null || previous.after(firedLast.getPreviousFireTime()))) {
                firedLast = trigger;
            }
        }
        return Optional.fromNullable(firesNext != null ? firesNext : firedLast);
    }

    private static Optional<Instant> toInstant(Date date)
    {
        return Optional.fromNullable(date).transform(Date::toInstant);
    }
}
