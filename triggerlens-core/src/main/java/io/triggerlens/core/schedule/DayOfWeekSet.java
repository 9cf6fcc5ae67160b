package io.triggerlens.core.schedule;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.ENGLISH;

/**
 * An immutable set of days of the week, one flag per day.
 */
public final class DayOfWeekSet
{
    private static final int ALL_DAYS = 0b111_1111;
    private static final int WEEKDAYS = maskOf(DayOfWeek.MONDAY) | maskOf(DayOfWeek.TUESDAY)
        | maskOf(DayOfWeek.WEDNESDAY) | maskOf(DayOfWeek.THURSDAY) | maskOf(DayOfWeek.FRIDAY);
    private static final int WEEKEND = maskOf(DayOfWeek.SATURDAY) | maskOf(DayOfWeek.SUNDAY);

    private static final DayOfWeekSet ALL_ON = new DayOfWeekSet(ALL_DAYS);

    public static DayOfWeekSet allOn()
    {
        return ALL_ON;
    }

    public static DayOfWeekSet fromCollection(Iterable<DayOfWeek> days)
    {
        int bits = 0;
        for (DayOfWeek day : days) {
            checkArgument(day != null, "Day of week must not be null");
            bits |= maskOf(day);
        }
        return new DayOfWeekSet(bits);
    }

    /**
     * Builds a set from {@link java.util.Calendar} day constants, where
     * 1 is Sunday and 7 is Saturday. Quartz stores daily trigger days this way.
     */
    public static DayOfWeekSet fromCalendarDays(Iterable<Integer> calendarDays)
    {
        ImmutableList.Builder<DayOfWeek> days = ImmutableList.builder();
        for (Integer calendarDay : calendarDays) {
            checkArgument(calendarDay != null && calendarDay >= 1 && calendarDay <= 7,
                    "Calendar day of week must be within 1..7 but got %s", calendarDay);
            days.add(calendarDay == 1 ? DayOfWeek.SUNDAY : DayOfWeek.of(calendarDay - 1));
        }
        return fromCollection(days.build());
    }

    private static int maskOf(DayOfWeek day)
    {
        return 1 << day.ordinal();
    }

    private final int bits;

    private DayOfWeekSet(int bits)
    {
        this.bits = bits;
    }

    public boolean contains(DayOfWeek day)
    {
        return (bits & maskOf(day)) != 0;
    }

    /**
     * Members of this set, Monday first.
     */
    public List<DayOfWeek> selected()
    {
        ImmutableList.Builder<DayOfWeek> builder = ImmutableList.builder();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (contains(day)) {
                builder.add(day);
            }
        }
        return builder.build();
    }

    /**
     * English names of the members, Monday first, such as
     * {@code ["Monday", "Wednesday"]}.
     */
    public List<String> selectedNames()
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (DayOfWeek day : selected()) {
            builder.add(day.getDisplayName(TextStyle.FULL, ENGLISH));
        }
        return builder.build();
    }

    public int size()
    {
        return Integer.bitCount(bits);
    }

    public boolean isAllDays()
    {
        return bits == ALL_DAYS;
    }

    public boolean isWeekdaysOnly()
    {
        return bits == WEEKDAYS;
    }

    public boolean isWeekendOnly()
    {
        return bits == WEEKEND;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof DayOfWeekSet)) {
            return false;
        }
        return bits == ((DayOfWeekSet) other).bits;
    }

    @Override
    public int hashCode()
    {
        return bits;
    }

    @Override
    public String toString()
    {
        return "DayOfWeekSet" + selected();
    }
}
