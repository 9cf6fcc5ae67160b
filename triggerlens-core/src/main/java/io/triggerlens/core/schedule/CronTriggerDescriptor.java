package io.triggerlens.core.schedule;

import org.immutables.value.Value;

@Value.Immutable
public abstract class CronTriggerDescriptor
        implements TriggerDescriptor
{
    public abstract String getCronExpression();

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.CRON;
    }

    public static CronTriggerDescriptor of(String cronExpression)
    {
        return ImmutableCronTriggerDescriptor.builder()
            .cronExpression(cronExpression)
            .build();
    }
}
