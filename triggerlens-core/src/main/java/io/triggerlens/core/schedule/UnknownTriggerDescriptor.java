package io.triggerlens.core.schedule;

import org.immutables.value.Value;

@Value.Immutable
public abstract class UnknownTriggerDescriptor
        implements TriggerDescriptor
{
    /**
     * Class name of the trigger that matched no known shape.
     */
    public abstract String getTriggerType();

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.UNKNOWN;
    }

    public static UnknownTriggerDescriptor of(String triggerType)
    {
        return ImmutableUnknownTriggerDescriptor.builder()
            .triggerType(triggerType)
            .build();
    }
}
