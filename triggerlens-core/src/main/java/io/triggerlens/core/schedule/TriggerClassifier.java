package io.triggerlens.core.schedule;

import org.quartz.CalendarIntervalTrigger;
import org.quartz.CronTrigger;
import org.quartz.DailyTimeIntervalTrigger;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;

public class TriggerClassifier
{
    /**
     * Maps a Quartz trigger to its kind.
     *
     * A trigger class may implement more than one of the Quartz trigger
     * interfaces. Interfaces are checked in the order Cron, Daily, Simple,
     * Calendar and the first match wins. This order is relied on by
     * {@link TriggerDescriptors#of(Trigger)}.
     */
    public TriggerKind classify(Trigger trigger)
    {
        if (trigger instanceof CronTrigger) {
            return TriggerKind.CRON;
        }
        else if (trigger instanceof DailyTimeIntervalTrigger) {
            return TriggerKind.DAILY;
        }
        else if (trigger instanceof SimpleTrigger) {
            return TriggerKind.SIMPLE;
        }
        else if (trigger instanceof CalendarIntervalTrigger) {
            return TriggerKind.CALENDAR;
        }
        else {
            return TriggerKind.UNKNOWN;
        }
    }

    public TriggerKind classify(TriggerDescriptor descriptor)
    {
        return descriptor.getKind();
    }
}
