package io.triggerlens.core.job;

import java.time.Instant;
import com.google.common.base.Optional;
import io.triggerlens.core.schedule.TriggerKind;
import org.immutables.value.Value;

@Value.Immutable
public interface TriggerSummary
{
    String getName();

    String getGroup();

    TriggerKind getKind();

    Optional<String> getScheduleDescription();

    Optional<Instant> getPreviousFireTime();

    Optional<Instant> getNextFireTime();

    static ImmutableTriggerSummary.Builder builder()
    {
        return ImmutableTriggerSummary.builder();
    }
}
