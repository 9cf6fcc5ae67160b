package io.triggerlens.core.schedule;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.triggerlens.client.config.Config;

public class DescriberConfigProvider
    implements Provider<DescriberConfig>
{
    private final DescriberConfig config;

    @Inject
    public DescriberConfigProvider(Config systemConfig)
    {
        this.config = DescriberConfig.convertFrom(systemConfig);
    }

    @Override
    public DescriberConfig get()
    {
        return config;
    }
}
