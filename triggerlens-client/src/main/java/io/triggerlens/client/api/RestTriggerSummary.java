package io.triggerlens.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableRestTriggerSummary.class)
@JsonDeserialize(as = ImmutableRestTriggerSummary.class)
public interface RestTriggerSummary
{
    String getName();

    String getGroup();

    /**
     * One of Cron, Daily, Simple, Calendar or Unknown.
     */
    String getType();

    /**
     * English description of when the trigger fires. Absent for triggers of
     * an Unknown type.
     */
    Optional<String> getScheduleDescription();

    Optional<Instant> getPreviousFireTime();

    Optional<Instant> getNextFireTime();

    static ImmutableRestTriggerSummary.Builder builder()
    {
        return ImmutableRestTriggerSummary.builder();
    }
}
