package io.triggerlens.core.schedule;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Calendar;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.THURSDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class DayOfWeekSetTest
{
    @Test
    public void emptyCollection()
    {
        DayOfWeekSet days = DayOfWeekSet.fromCollection(ImmutableList.of());
        assertThat(days.isWeekdaysOnly(), is(false));
        assertThat(days.isWeekendOnly(), is(false));
        assertThat(days.isAllDays(), is(false));
        assertThat(days.selected(), is(empty()));
        assertThat(days.size(), is(0));
    }

    @Test
    public void allOn()
    {
        DayOfWeekSet days = DayOfWeekSet.allOn();
        assertThat(days.selected(), contains(MONDAY, TUESDAY, WEDNESDAY, THURSDAY, FRIDAY, SATURDAY, SUNDAY));
        assertThat(days.isAllDays(), is(true));
        assertThat(days.isWeekdaysOnly(), is(false));
        assertThat(days.isWeekendOnly(), is(false));
        assertThat(DayOfWeekSet.fromCollection(Arrays.asList(DayOfWeek.values())), is(days));
    }

    @Test
    public void weekdaysOnly()
    {
        DayOfWeekSet days = DayOfWeekSet.fromCollection(ImmutableList.of(FRIDAY, THURSDAY, WEDNESDAY, TUESDAY, MONDAY));
        assertThat(days.isWeekdaysOnly(), is(true));
        assertThat(days.isWeekendOnly(), is(false));

        // missing Friday
        assertThat(DayOfWeekSet.fromCollection(ImmutableList.of(MONDAY, TUESDAY, WEDNESDAY, THURSDAY)).isWeekdaysOnly(), is(false));
        // with Saturday
        assertThat(DayOfWeekSet.fromCollection(ImmutableList.of(MONDAY, TUESDAY, WEDNESDAY, THURSDAY, FRIDAY, SATURDAY)).isWeekdaysOnly(), is(false));
    }

    @Test
    public void weekendOnly()
    {
        DayOfWeekSet days = DayOfWeekSet.fromCollection(ImmutableList.of(SUNDAY, SATURDAY));
        assertThat(days.isWeekendOnly(), is(true));
        assertThat(days.isWeekdaysOnly(), is(false));
        assertThat(DayOfWeekSet.fromCollection(ImmutableList.of(SUNDAY)).isWeekendOnly(), is(false));
    }

    @Test
    public void selectedIsDistinctAndMondayFirst()
    {
        DayOfWeekSet days = DayOfWeekSet.fromCollection(ImmutableList.of(SUNDAY, WEDNESDAY, SUNDAY, MONDAY, WEDNESDAY));
        assertThat(days.selected(), contains(MONDAY, WEDNESDAY, SUNDAY));
        assertThat(days.selectedNames(), contains("Monday", "Wednesday", "Sunday"));
        assertThat(days.size(), is(3));

        // restartable
        assertThat(days.selected(), is(days.selected()));
    }

    @Test
    public void fromCalendarDays()
    {
        DayOfWeekSet days = DayOfWeekSet.fromCalendarDays(ImmutableList.of(Calendar.SUNDAY, Calendar.MONDAY, Calendar.SATURDAY));
        assertThat(days.selected(), contains(MONDAY, SATURDAY, SUNDAY));

        DayOfWeekSet weekdays = DayOfWeekSet.fromCalendarDays(ImmutableList.of(
                    Calendar.MONDAY, Calendar.TUESDAY, Calendar.WEDNESDAY, Calendar.THURSDAY, Calendar.FRIDAY));
        assertThat(weekdays.isWeekdaysOnly(), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsCalendarDayBelowRange()
    {
        DayOfWeekSet.fromCalendarDays(ImmutableList.of(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsCalendarDayAboveRange()
    {
        DayOfWeekSet.fromCalendarDays(ImmutableList.of(Calendar.MONDAY, 8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNullDay()
    {
        DayOfWeekSet.fromCollection(Arrays.asList(MONDAY, null));
    }
}
