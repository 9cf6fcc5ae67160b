package io.triggerlens.core.config;

import java.util.Map;
import java.util.Properties;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.triggerlens.client.config.Config;
import io.triggerlens.client.config.ConfigException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.SchedulerRepository;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a Quartz scheduler from the {@code org.quartz.*} keys of the system
 * config. The scheduler is not started.
 */
public class QuartzSchedulerProvider
    implements Provider<Scheduler>
{
    private static final Logger logger = LoggerFactory.getLogger(QuartzSchedulerProvider.class);

    static final String PREFIX = "org.quartz.";

    static final String INSTANCE_NAME = "org.quartz.scheduler.instanceName";

    static final Map<String, String> DEFAULTS = ImmutableMap.of(
            INSTANCE_NAME, "TriggerLensScheduler",
            "org.quartz.scheduler.instanceId", "NON_CLUSTERED",
            "org.quartz.threadPool.class", "org.quartz.simpl.SimpleThreadPool",
            "org.quartz.threadPool.threadCount", "10",
            "org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore");

    private final Properties properties;
    private Scheduler created = null;

    @Inject
    public QuartzSchedulerProvider(Config systemConfig)
    {
        this.properties = toProperties(systemConfig);
    }

    static Properties toProperties(Config systemConfig)
    {
        Properties props = new Properties();
        props.putAll(DEFAULTS);
        props.putAll(systemConfig.getStringsWithPrefix(PREFIX));
        return props;
    }

    /**
     * Creates the scheduler on the first call and returns the same instance
     * afterwards.
     *
     * @throws ConfigException if a running scheduler in this JVM already uses
     * the configured instance name, or Quartz rejects the parameters
     */
    @Override
    public synchronized Scheduler get()
    {
        if (created != null) {
            return created;
        }
        String name = properties.getProperty(INSTANCE_NAME);
        SchedulerRepository repository = SchedulerRepository.getInstance();
        try {
            // StdSchedulerFactory returns an existing scheduler of the same name
            synchronized (repository) {
                Scheduler existing = repository.lookup(name);
                if (existing != null && !existing.isShutdown()) {
                    throw new ConfigException("Quartz scheduler '" + name + "' already exists in this JVM. Set a different " + INSTANCE_NAME);
                }
                created = new StdSchedulerFactory(properties).getScheduler();
            }
            logger.info("Created Quartz scheduler {} ({})", created.getSchedulerName(), created.getSchedulerInstanceId());
            return created;
        }
        catch (SchedulerException ex) {
            throw new ConfigException("Failed to create Quartz scheduler from " + PREFIX + "* parameters: " + ex.getMessage(), ex);
        }
    }

    /**
     * The scheduler created by {@link #get()}, or absent if it was never called.
     */
    public synchronized Optional<Scheduler> getCreatedScheduler()
    {
        return Optional.fromNullable(created);
    }
}
