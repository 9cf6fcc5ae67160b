package io.triggerlens.core.schedule;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import org.quartz.TimeOfDay;

import static java.util.Locale.ROOT;

/**
 * Conversions of a wall-clock time of day.
 *
 * Times are {@link LocalTime} values truncated to seconds. Hour, minute and
 * second are expected in range, which {@link LocalTime} guarantees.
 */
public final class TimeOfDays
{
    private static final DateTimeFormatter HOURS_MINUTES = DateTimeFormatter.ofPattern("H:mm", ROOT);
    private static final DateTimeFormatter HOURS_MINUTES_SECONDS = DateTimeFormatter.ofPattern("H:mm:ss", ROOT);

    private TimeOfDays()
    { }

    public static LocalTime fromQuartz(TimeOfDay timeOfDay)
    {
        return LocalTime.of(timeOfDay.getHour(), timeOfDay.getMinute(), timeOfDay.getSecond());
    }

    public static Duration toDuration(LocalTime timeOfDay)
    {
        return Duration.ofSeconds(timeOfDay.getHour() * 3600L + timeOfDay.getMinute() * 60L + timeOfDay.getSecond());
    }

    /**
     * Renders {@code 8:00}, {@code 17:30}, or {@code 8:00:15} when seconds are set.
     */
    public static String toShortFormat(LocalTime timeOfDay)
    {
        if (timeOfDay.getSecond() == 0) {
            return HOURS_MINUTES.format(timeOfDay);
        }
        else {
            return HOURS_MINUTES_SECONDS.format(timeOfDay);
        }
    }
}
