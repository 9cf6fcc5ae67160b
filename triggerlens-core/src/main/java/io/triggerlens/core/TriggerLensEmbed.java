package io.triggerlens.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import io.triggerlens.client.api.JacksonTimeModule;
import io.triggerlens.client.config.Config;
import io.triggerlens.client.config.ConfigElement;
import io.triggerlens.client.config.ConfigFactory;
import io.triggerlens.core.config.QuartzSchedulerProvider;
import io.triggerlens.core.job.JobModule;
import io.triggerlens.core.job.SchedulerInspector;
import io.triggerlens.core.schedule.ScheduleDescriber;
import io.triggerlens.core.schedule.ScheduleModule;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TriggerLensEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerLensEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private Scheduler scheduler = null;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        /**
         * Inspects an existing scheduler instead of creating one from the
         * {@code org.quartz.*} parameters. The embed does not shut it down.
         */
        public Bootstrap setScheduler(Scheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public TriggerLensEmbed initialize()
        {
            List<Module> modules = standardModules();
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(modules);
            return new TriggerLensEmbed(injector, scheduler == null);
        }

        private List<Module> standardModules()
        {
            return ImmutableList.of(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JacksonTimeModule()),
                    new ScheduleModule(),
                    new JobModule(),
                    (binder) -> {
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                        if (scheduler != null) {
                            binder.bind(Scheduler.class).toInstance(scheduler);
                        }
                        else {
                            binder.bind(QuartzSchedulerProvider.class).in(Scopes.SINGLETON);
                            binder.bind(Scheduler.class).toProvider(QuartzSchedulerProvider.class).in(Scopes.SINGLETON);
                        }
                    });
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            // callers may mutate what they get
            return systemConfig.deepCopy();
        }
    }

    private final Injector injector;
    private final boolean ownsScheduler;

    TriggerLensEmbed(Injector injector, boolean ownsScheduler)
    {
        this.injector = injector;
        this.ownsScheduler = ownsScheduler;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public ObjectMapper getObjectMapper()
    {
        return injector.getInstance(ObjectMapper.class);
    }

    public Scheduler getScheduler()
    {
        return injector.getInstance(Scheduler.class);
    }

    public ScheduleDescriber getScheduleDescriber()
    {
        return injector.getInstance(ScheduleDescriber.class);
    }

    public SchedulerInspector getSchedulerInspector()
    {
        return injector.getInstance(SchedulerInspector.class);
    }

    /**
     * Shuts down the scheduler if this embed created it. A scheduler handed
     * to {@link Bootstrap#setScheduler(Scheduler)} is left running.
     */
    @Override
    public void close()
        throws SchedulerException
    {
        if (!ownsScheduler) {
            return;
        }
        Optional<Scheduler> created = injector.getInstance(QuartzSchedulerProvider.class).getCreatedScheduler();
        if (created.isPresent()) {
            logger.debug("Shutting down scheduler {}", created.get().getSchedulerName());
            created.get().shutdown();
        }
    }
}
