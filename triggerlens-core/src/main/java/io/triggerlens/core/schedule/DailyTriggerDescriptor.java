package io.triggerlens.core.schedule;

import java.time.LocalTime;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * Fires every interval between a start and end time of day, on selected days
 * of the week.
 */
@Value.Immutable
public abstract class DailyTriggerDescriptor
        implements TriggerDescriptor
{
    public static final int REPEAT_INDEFINITELY = -1;

    public abstract int getRepeatInterval();

    public abstract IntervalUnit getRepeatIntervalUnit();

    @Value.Default
    public int getRepeatCount()
    {
        return REPEAT_INDEFINITELY;
    }

    public abstract LocalTime getStartTimeOfDay();

    public abstract LocalTime getEndTimeOfDay();

    @Value.Default
    public DayOfWeekSet getDaysOfWeek()
    {
        return DayOfWeekSet.allOn();
    }

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.DAILY;
    }

    public static ImmutableDailyTriggerDescriptor.Builder builder()
    {
        return ImmutableDailyTriggerDescriptor.builder();
    }

    @Value.Check
    protected void check()
    {
        checkState(getRepeatInterval() >= 1, "repeatInterval must be positive: %s", getRepeatInterval());
        checkState(getRepeatCount() >= REPEAT_INDEFINITELY, "repeatCount must be %s or larger: %s", REPEAT_INDEFINITELY, getRepeatCount());
        checkState(getDaysOfWeek().size() > 0, "daysOfWeek must not be empty");
    }
}
