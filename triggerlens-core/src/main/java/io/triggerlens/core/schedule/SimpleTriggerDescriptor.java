package io.triggerlens.core.schedule;

import java.time.Duration;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public abstract class SimpleTriggerDescriptor
        implements TriggerDescriptor
{
    public static final int REPEAT_INDEFINITELY = -1;

    public abstract Duration getRepeatInterval();

    /**
     * Number of repeats after the first firing, or {@link #REPEAT_INDEFINITELY}.
     */
    public abstract int getRepeatCount();

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.SIMPLE;
    }

    public static SimpleTriggerDescriptor of(Duration repeatInterval, int repeatCount)
    {
        return ImmutableSimpleTriggerDescriptor.builder()
            .repeatInterval(repeatInterval)
            .repeatCount(repeatCount)
            .build();
    }

    @Value.Check
    protected void check()
    {
        checkState(!getRepeatInterval().isNegative(), "repeatInterval must not be negative: %s", getRepeatInterval());
        checkState(getRepeatCount() >= REPEAT_INDEFINITELY, "repeatCount must be %s or larger: %s", REPEAT_INDEFINITELY, getRepeatCount());
    }
}
