package io.triggerlens.core.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Calendar;
import java.util.Locale;
import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.quartz.Trigger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;
import static org.quartz.CalendarIntervalScheduleBuilder.calendarIntervalSchedule;
import static org.quartz.CronScheduleBuilder.cronSchedule;
import static org.quartz.DailyTimeIntervalScheduleBuilder.dailyTimeIntervalSchedule;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TimeOfDay.hourAndMinuteOfDay;
import static org.quartz.TriggerBuilder.newTrigger;

public class ScheduleDescriberTest
{
    private final ScheduleDescriber describer = newDescriber(DescriberConfig.defaultBuilder().build());

    private static ScheduleDescriber newDescriber(DescriberConfig config)
    {
        return new ScheduleDescriber(new TriggerDescriptors(new TriggerClassifier()), config);
    }

    private String describe(Trigger trigger)
    {
        return describer.describe(trigger).get();
    }

    @Test
    public void simpleWithCount()
    {
        Trigger trigger = newTrigger()
            .withSchedule(simpleSchedule().withIntervalInMinutes(1).withRepeatCount(3))
            .build();
        assertThat(describe(trigger), is("Repeat 3 times every 1 minute"));
    }

    @Test
    public void simpleForever()
    {
        Trigger trigger = newTrigger()
            .withSchedule(simpleSchedule().withIntervalInSeconds(90).repeatForever())
            .build();
        assertThat(describe(trigger), is("Repeat every 1 minute, 30 seconds"));
    }

    @Test
    public void simpleZeroCountHasNoCountClause()
    {
        assertThat(describer.describe(SimpleTriggerDescriptor.of(Duration.ofHours(2), 0)),
                is(Optional.of("Repeat every 2 hours")));
    }

    @Test
    public void simpleMultipleUnits()
    {
        Duration interval = Duration.ofDays(1).plusHours(2).plusMillis(5);
        assertThat(describer.describe(SimpleTriggerDescriptor.of(interval, 10)),
                is(Optional.of("Repeat 10 times every 1 day, 2 hours, 5 milliseconds")));
    }

    @Test
    public void calendarSingleUnit()
    {
        Trigger trigger = newTrigger()
            .withSchedule(calendarIntervalSchedule().withIntervalInDays(1))
            .build();
        assertThat(describe(trigger), is("Repeat every day"));
    }

    @Test
    public void calendarPlural()
    {
        Trigger trigger = newTrigger()
            .withSchedule(calendarIntervalSchedule().withIntervalInDays(2))
            .build();
        assertThat(describe(trigger), is("Repeat every 2 days"));
    }

    @Test
    public void calendarUnitIsNotConverted()
    {
        Trigger trigger = newTrigger()
            .withSchedule(calendarIntervalSchedule().withIntervalInMinutes(120))
            .build();
        assertThat(describe(trigger), is("Repeat every 120 minutes"));
    }

    @Test
    public void dailyWeekdays()
    {
        Trigger trigger = newTrigger()
            .withSchedule(dailyTimeIntervalSchedule()
                    .onMondayThroughFriday()
                    .startingDailyAt(hourAndMinuteOfDay(8, 0))
                    .endingDailyAt(hourAndMinuteOfDay(17, 0))
                    .withIntervalInHours(1))
            .build();
        assertThat(describe(trigger), is("Repeat every hour from 8:00 to 17:00 only on Weekdays"));
    }

    @Test
    public void dailyWeekend()
    {
        Trigger trigger = newTrigger()
            .withSchedule(dailyTimeIntervalSchedule()
                    .onSaturdayAndSunday()
                    .startingDailyAt(hourAndMinuteOfDay(10, 30))
                    .endingDailyAt(hourAndMinuteOfDay(12, 0))
                    .withIntervalInMinutes(15))
            .build();
        assertThat(describe(trigger), is("Repeat every 15 minutes from 10:30 to 12:00 only on Weekends"));
    }

    @Test
    public void dailySelectedDays()
    {
        Trigger trigger = newTrigger()
            .withSchedule(dailyTimeIntervalSchedule()
                    .onDaysOfTheWeek(Calendar.FRIDAY, Calendar.MONDAY, Calendar.WEDNESDAY)
                    .startingDailyAt(hourAndMinuteOfDay(9, 0))
                    .endingDailyAt(hourAndMinuteOfDay(9, 30))
                    .withIntervalInMinutes(5))
            .build();
        assertThat(describe(trigger), is("Repeat every 5 minutes from 9:00 to 9:30 on Monday, Wednesday, Friday"));
    }

    @Test
    public void dailyEveryDayHasNoQualifier()
    {
        Trigger trigger = newTrigger()
            .withSchedule(dailyTimeIntervalSchedule()
                    .onEveryDay()
                    .startingDailyAt(hourAndMinuteOfDay(6, 0))
                    .endingDailyAt(hourAndMinuteOfDay(22, 0))
                    .withIntervalInHours(2))
            .build();
        assertThat(describe(trigger), is("Repeat every 2 hours from 6:00 to 22:00"));
    }

    @Test
    public void dailyDefaults()
    {
        Trigger trigger = newTrigger()
            .withSchedule(dailyTimeIntervalSchedule())
            .build();
        assertThat(describe(trigger), is("Repeat every minute from 0:00 to 23:59:59"));
    }

    @Test
    public void dailyWithCount()
    {
        DailyTriggerDescriptor descriptor = DailyTriggerDescriptor.builder()
            .repeatInterval(2)
            .repeatIntervalUnit(IntervalUnit.HOUR)
            .repeatCount(5)
            .startTimeOfDay(LocalTime.of(8, 0))
            .endTimeOfDay(LocalTime.of(17, 0, 30))
            .daysOfWeek(DayOfWeekSet.fromCollection(ImmutableList.of(DayOfWeek.SUNDAY)))
            .build();
        assertThat(describer.describe(descriptor),
                is(Optional.of("Repeat 5 times every 2 hours from 8:00 to 17:00:30 on Sunday")));
    }

    @Test
    public void cronIsDescribedByCronUtils()
    {
        String expression = "0 15 10 ? * MON-FRI";
        CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));
        String expected = CronDescriptor.instance(Locale.ENGLISH).describe(parser.parse(expression));

        Trigger trigger = newTrigger()
            .withSchedule(cronSchedule(expression))
            .build();
        assertThat(describe(trigger), is(expected));
    }

    @Test
    public void cronTypeFromConfig()
    {
        String expression = "30 6 * * 1";
        CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
        String expected = CronDescriptor.instance(Locale.ENGLISH).describe(parser.parse(expression));

        ScheduleDescriber unix = newDescriber(DescriberConfig.defaultBuilder().cronType(CronType.UNIX).build());
        assertThat(unix.describe(CronTriggerDescriptor.of(expression)), is(Optional.of(expected)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedCron()
    {
        describer.describe(CronTriggerDescriptor.of("every tuesday"));
    }

    @Test
    public void unknownIsAbsent()
    {
        assertThat(describer.describe(mock(Trigger.class)), is(Optional.<String>absent()));
        assertThat(describer.describe(UnknownTriggerDescriptor.of("x.Y")), is(Optional.<String>absent()));
    }

    @Test
    public void describeInterval()
    {
        assertThat(ScheduleDescriber.describeInterval(1, IntervalUnit.WEEK, -1), is("Repeat every week"));
        assertThat(ScheduleDescriber.describeInterval(3, IntervalUnit.MONTH, 2), is("Repeat 2 times every 3 months"));
    }
}
