package io.triggerlens.core.schedule;

import java.util.Locale;
import com.cronutils.model.CronType;
import com.google.common.base.Optional;
import io.triggerlens.client.config.Config;
import io.triggerlens.client.config.ConfigException;
import org.immutables.value.Value;

import static java.util.Locale.ENGLISH;

@Value.Immutable
public interface DescriberConfig
{
    /**
     * Dialect used to parse cron expressions. Quartz triggers use the
     * Quartz dialect, with seconds and an optional year.
     */
    CronType getCronType();

    /**
     * Language of cron descriptions.
     */
    Locale getLocale();

    static ImmutableDescriberConfig.Builder defaultBuilder()
    {
        return ImmutableDescriberConfig.builder()
            .cronType(CronType.QUARTZ)
            .locale(ENGLISH);
    }

    static DescriberConfig convertFrom(Config config)
    {
        ImmutableDescriberConfig.Builder builder = defaultBuilder();
        String cronType = config.get("describer.cron_type", String.class, "quartz");
        try {
            builder.cronType(CronType.valueOf(cronType.toUpperCase(ENGLISH)));
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Parameter 'describer.cron_type' must be one of quartz, unix, cron4j or spring but got '" + cronType + "'", ex);
        }
        Optional<String> locale = config.getOptional("describer.locale", String.class);
        if (locale.isPresent()) {
            builder.locale(Locale.forLanguageTag(locale.get()));
        }
        return builder.build();
    }
}
