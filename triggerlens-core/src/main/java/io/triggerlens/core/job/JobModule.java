package io.triggerlens.core.job;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class JobModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(JobSummaryAssembler.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerInspector.class).in(Scopes.SINGLETON);
    }
}
