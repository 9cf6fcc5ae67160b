package io.triggerlens.core.schedule;

import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public abstract class CalendarTriggerDescriptor
        implements TriggerDescriptor
{
    public abstract int getRepeatInterval();

    public abstract IntervalUnit getRepeatIntervalUnit();

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.CALENDAR;
    }

    public static CalendarTriggerDescriptor of(int repeatInterval, IntervalUnit repeatIntervalUnit)
    {
        return ImmutableCalendarTriggerDescriptor.builder()
            .repeatInterval(repeatInterval)
            .repeatIntervalUnit(repeatIntervalUnit)
            .build();
    }

    @Value.Check
    protected void check()
    {
        checkState(getRepeatInterval() >= 1, "repeatInterval must be positive: %s", getRepeatInterval());
    }
}
