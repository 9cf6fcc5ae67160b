package io.triggerlens.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TriggerKind
{
    CRON("Cron"),
    DAILY("Daily"),
    SIMPLE("Simple"),
    CALENDAR("Calendar"),
    UNKNOWN("Unknown");

    private final String displayName;

    TriggerKind(String displayName)
    {
        this.displayName = displayName;
    }

    @JsonValue
    public String getName()
    {
        return displayName;
    }

    @JsonCreator
    public static TriggerKind fromName(String name)
    {
        for (TriggerKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown trigger kind: " + name);
    }

    @Override
    public String toString()
    {
        return displayName;
    }
}
