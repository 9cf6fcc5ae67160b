package io.triggerlens.core.schedule;

import java.util.Locale;
import com.cronutils.model.CronType;
import io.triggerlens.client.TriggerLensJson;
import io.triggerlens.client.config.Config;
import io.triggerlens.client.config.ConfigException;
import io.triggerlens.client.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class DescriberConfigTest
{
    private final ConfigFactory configFactory = new ConfigFactory(TriggerLensJson.objectMapper());

    @Test
    public void defaults()
    {
        DescriberConfig config = DescriberConfig.convertFrom(configFactory.create());
        assertThat(config.getCronType(), is(CronType.QUARTZ));
        assertThat(config.getLocale(), is(Locale.ENGLISH));
    }

    @Test
    public void overrides()
    {
        Config system = configFactory.create()
            .set("describer.cron_type", "Unix")
            .set("describer.locale", "de");
        DescriberConfig config = DescriberConfig.convertFrom(system);
        assertThat(config.getCronType(), is(CronType.UNIX));
        assertThat(config.getLocale(), is(Locale.GERMAN));
    }

    @Test
    public void invalidCronType()
    {
        Config system = configFactory.create().set("describer.cron_type", "vixie");
        try {
            DescriberConfig.convertFrom(system);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("describer.cron_type"));
            assertThat(ex.getMessage(), containsString("vixie"));
        }
    }
}
