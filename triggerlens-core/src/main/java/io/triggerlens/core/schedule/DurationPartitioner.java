package io.triggerlens.core.schedule;

import java.time.Duration;
import java.util.List;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Splits a millisecond duration into days, hours, minutes, seconds and
 * milliseconds for display, e.g. 90000 ms into "1 minute, 30 seconds".
 */
public final class DurationPartitioner
{
    private static final class Unit
    {
        final String singular;
        final String plural;
        final long millis;

        Unit(String singular, long millis)
        {
            this.singular = singular;
            this.plural = singular + "s";
            this.millis = millis;
        }
    }

    // largest first
    private static final List<Unit> UNITS = ImmutableList.of(
            new Unit("day", 1000L * 60 * 60 * 24),
            new Unit("hour", 1000L * 60 * 60),
            new Unit("minute", 1000L * 60),
            new Unit("second", 1000L),
            new Unit("millisecond", 1L));

    private static final Joiner JOINER = Joiner.on(", ");

    public static final class Part
    {
        private final long value;
        private final Unit unit;

        private Part(long value, Unit unit)
        {
            this.value = value;
            this.unit = unit;
        }

        public long getValue()
        {
            return value;
        }

        /**
         * Singular or plural unit name matching {@link #getValue()}.
         */
        public String getUnitName()
        {
            return value == 1 ? unit.singular : unit.plural;
        }

        @Override
        public boolean equals(Object other)
        {
            if (!(other instanceof Part)) {
                return false;
            }
            Part o = (Part) other;
            return value == o.value && unit == o.unit;
        }

        @Override
        public int hashCode()
        {
            return Long.hashCode(value) * 31 + unit.singular.hashCode();
        }

        @Override
        public String toString()
        {
            return value + " " + getUnitName();
        }
    }

    private DurationPartitioner()
    { }

    public static List<Part> partition(Duration duration)
    {
        return partition(duration.toMillis());
    }

    /**
     * Returns the non-zero parts of {@code totalMillis}, largest unit first.
     * The list is empty for 0.
     *
     * @throws IllegalArgumentException if {@code totalMillis} is negative
     */
    public static List<Part> partition(long totalMillis)
    {
        checkArgument(totalMillis >= 0, "Duration must not be negative: %s ms", totalMillis);

        ImmutableList.Builder<Part> builder = ImmutableList.builder();
        long remaining = totalMillis;
        for (Unit unit : UNITS) {
            long value = remaining / unit.millis;
            remaining -= value * unit.millis;
            if (value >= 1) {
                builder.add(new Part(value, unit));
            }
        }
        return builder.build();
    }

    public static String format(Duration duration)
    {
        return format(duration.toMillis());
    }

    public static String format(long totalMillis)
    {
        return JOINER.join(partition(totalMillis));
    }
}
