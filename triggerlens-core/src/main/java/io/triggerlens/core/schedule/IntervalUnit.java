package io.triggerlens.core.schedule;

import org.quartz.DateBuilder;

import static java.util.Locale.ENGLISH;

public enum IntervalUnit
{
    MILLISECOND,
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR;

    /**
     * Singular, lower-case English name such as {@code "day"}.
     */
    public String getName()
    {
        return name().toLowerCase(ENGLISH);
    }

    public static IntervalUnit fromQuartz(DateBuilder.IntervalUnit unit)
    {
        switch (unit) {
        case MILLISECOND:
            return MILLISECOND;
        case SECOND:
            return SECOND;
        case MINUTE:
            return MINUTE;
        case HOUR:
            return HOUR;
        case DAY:
            return DAY;
        case WEEK:
            return WEEK;
        case MONTH:
            return MONTH;
        case YEAR:
            return YEAR;
        default:
            throw new IllegalArgumentException("Unsupported interval unit: " + unit);
        }
    }
}
