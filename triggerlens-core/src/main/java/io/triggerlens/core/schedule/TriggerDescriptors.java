package io.triggerlens.core.schedule;

import java.time.Duration;
import com.google.inject.Inject;
import org.quartz.CalendarIntervalTrigger;
import org.quartz.CronTrigger;
import org.quartz.DailyTimeIntervalTrigger;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads Quartz triggers into {@link TriggerDescriptor}s.
 *
 * This is where scheduler data enters the core, so field values are
 * validated here and an invalid trigger fails with
 * {@link IllegalStateException} or {@link IllegalArgumentException}.
 */
public class TriggerDescriptors
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerDescriptors.class);

    private final TriggerClassifier classifier;

    @Inject
    public TriggerDescriptors(TriggerClassifier classifier)
    {
        this.classifier = classifier;
    }

    public TriggerDescriptor of(Trigger trigger)
    {
        TriggerKind kind = classifier.classify(trigger);
        switch (kind) {
        case CRON:
            return CronTriggerDescriptor.of(((CronTrigger) trigger).getCronExpression());
        case DAILY:
            return dailyOf((DailyTimeIntervalTrigger) trigger);
        case SIMPLE:
            SimpleTrigger simple = (SimpleTrigger) trigger;
            return SimpleTriggerDescriptor.of(
                    Duration.ofMillis(simple.getRepeatInterval()),
                    simple.getRepeatCount());
        case CALENDAR:
            CalendarIntervalTrigger calendar = (CalendarIntervalTrigger) trigger;
            return CalendarTriggerDescriptor.of(
                    calendar.getRepeatInterval(),
                    IntervalUnit.fromQuartz(calendar.getRepeatIntervalUnit()));
        case UNKNOWN:
        default:
            logger.warn("Trigger {} of type {} is not a cron, daily, simple or calendar trigger",
                    trigger.getKey(), trigger.getClass().getName());
            return UnknownTriggerDescriptor.of(trigger.getClass().getName());
        }
    }

    private static DailyTriggerDescriptor dailyOf(DailyTimeIntervalTrigger trigger)
    {
        return DailyTriggerDescriptor.builder()
            .repeatInterval(trigger.getRepeatInterval())
            .repeatIntervalUnit(IntervalUnit.fromQuartz(trigger.getRepeatIntervalUnit()))
            .repeatCount(trigger.getRepeatCount())
            .startTimeOfDay(TimeOfDays.fromQuartz(trigger.getStartTimeOfDay()))
            .endTimeOfDay(TimeOfDays.fromQuartz(trigger.getEndTimeOfDay()))
            .daysOfWeek(DayOfWeekSet.fromCalendarDays(trigger.getDaysOfWeek()))
            .build();
    }
}
