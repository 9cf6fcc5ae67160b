package io.triggerlens.core.schedule;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import org.quartz.Trigger;

/**
 * Renders an English description of when a trigger fires, such as
 * "Repeat every hour from 8:00 to 17:00 only on Weekdays".
 *
 * Cron expressions are described by cron-utils. Other kinds are rendered
 * here. Output depends only on the trigger and {@link DescriberConfig}.
 */
public class ScheduleDescriber
{
    private static final Joiner DAY_JOINER = Joiner.on(", ");

    private final TriggerDescriptors descriptors;
    private final CronParser cronParser;
    private final CronDescriptor cronDescriptor;

    @Inject
    public ScheduleDescriber(TriggerDescriptors descriptors, DescriberConfig config)
    {
        this.descriptors = descriptors;
        this.cronParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(config.getCronType()));
        this.cronDescriptor = CronDescriptor.instance(config.getLocale());
    }

    public Optional<String> describe(Trigger trigger)
    {
        return describe(descriptors.of(trigger));
    }

    /**
     * Returns the description, or absent for {@link TriggerKind#UNKNOWN}.
     *
     * @throws IllegalArgumentException if a cron expression can't be parsed
     */
    public Optional<String> describe(TriggerDescriptor trigger)
    {
        switch (trigger.getKind()) {
        case CRON:
            return Optional.of(describeCron((CronTriggerDescriptor) trigger));
        case DAILY:
            return Optional.of(describeDaily((DailyTriggerDescriptor) trigger));
        case SIMPLE:
            return Optional.of(describeSimple((SimpleTriggerDescriptor) trigger));
        case CALENDAR:
            CalendarTriggerDescriptor calendar = (CalendarTriggerDescriptor) trigger;
            return Optional.of(describeInterval(calendar.getRepeatInterval(), calendar.getRepeatIntervalUnit(), 0));
        case UNKNOWN:
        default:
            return Optional.absent();
        }
    }

    private String describeCron(CronTriggerDescriptor trigger)
    {
        return cronDescriptor.describe(cronParser.parse(trigger.getCronExpression()));
    }

    private static String describeSimple(SimpleTriggerDescriptor trigger)
    {
        return repeatPrefix(trigger.getRepeatCount())
            + DurationPartitioner.format(trigger.getRepeatInterval());
    }

    private static String describeDaily(DailyTriggerDescriptor trigger)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(describeInterval(trigger.getRepeatInterval(), trigger.getRepeatIntervalUnit(), trigger.getRepeatCount()));
        sb.append(" from ").append(TimeOfDays.toShortFormat(trigger.getStartTimeOfDay()));
        sb.append(" to ").append(TimeOfDays.toShortFormat(trigger.getEndTimeOfDay()));

        DayOfWeekSet days = trigger.getDaysOfWeek();
        if (!days.isAllDays()) {
            if (days.isWeekdaysOnly()) {
                sb.append(" only on Weekdays");
            }
            else if (days.isWeekendOnly()) {
                sb.append(" only on Weekends");
            }
            else {
                sb.append(" on ").append(DAY_JOINER.join(days.selectedNames()));
            }
        }
        return sb.toString();
    }

    static String describeInterval(int repeatInterval, IntervalUnit unit, int repeatCount)
    {
        String prefix = repeatPrefix(repeatCount);
        if (repeatInterval == 1) {
            return prefix + unit.getName();
        }
        else {
            return prefix + repeatInterval + " " + unit.getName() + "s";
        }
    }

    // a count of 0 or REPEAT_INDEFINITELY has no count clause
    private static String repeatPrefix(int repeatCount)
    {
        if (repeatCount > 0) {
            return "Repeat " + repeatCount + " times every ";
        }
        else {
            return "Repeat every ";
        }
    }
}
