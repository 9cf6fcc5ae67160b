package io.triggerlens.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import java.time.Instant;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableRestJobSummary.class)
@JsonDeserialize(as = ImmutableRestJobSummary.class)
public interface RestJobSummary
{
    String getName();

    String getGroup();

    Optional<String> getDescription();

    /**
     * Fully qualified class name of the job implementation.
     */
    String getJobType();

    /**
     * True if at most one instance of this job definition may run at a time.
     */
    boolean getConcurrentExecutionDisallowed();

    /**
     * True if the job is kept by the scheduler after its last trigger is gone.
     */
    boolean getDurable();

    /**
     * True if the job data map is stored back after each successful run.
     */
    boolean getPersistJobDataAfterExecution();

    /**
     * True if the job is re-executed after a hard shutdown interrupted it.
     */
    boolean getRequestsRecovery();

    Optional<Instant> getLastFireTime();

    Optional<Instant> getNextFireTime();

    List<RestTriggerSummary> getTriggers();

    static ImmutableRestJobSummary.Builder builder()
    {
        return ImmutableRestJobSummary.builder();
    }
}
