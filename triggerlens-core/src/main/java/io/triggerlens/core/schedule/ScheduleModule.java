package io.triggerlens.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DescriberConfig.class).toProvider(DescriberConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(TriggerClassifier.class).in(Scopes.SINGLETON);
        binder.bind(TriggerDescriptors.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleDescriber.class).in(Scopes.SINGLETON);
    }
}
