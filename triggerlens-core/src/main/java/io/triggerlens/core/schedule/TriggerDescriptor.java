package io.triggerlens.core.schedule;

/**
 * A snapshot of a scheduler trigger reduced to the fields that describe when
 * it fires. The concrete type is decided once, when the trigger is read from
 * the scheduler, and {@link #getKind()} names it.
 *
 * @see TriggerDescriptors#of(org.quartz.Trigger)
 */
public interface TriggerDescriptor
{
    TriggerKind getKind();
}
