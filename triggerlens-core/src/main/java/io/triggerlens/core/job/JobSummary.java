package io.triggerlens.core.job;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A read-only view of a scheduled job, built from the scheduler's job detail
 * and the triggers of the job at the time of the query.
 */
@Value.Immutable
public interface JobSummary
{
    String getName();

    String getGroup();

    Optional<String> getDescription();

    String getJobType();

    boolean getConcurrentExecutionDisallowed();

    boolean getDurable();

    boolean getPersistJobDataAfterExecution();

    boolean getRequestsRecovery();

    Optional<Instant> getLastFireTime();

    Optional<Instant> getNextFireTime();

    List<TriggerSummary> getTriggers();

    static ImmutableJobSummary.Builder builder()
    {
        return ImmutableJobSummary.builder();
    }
}
