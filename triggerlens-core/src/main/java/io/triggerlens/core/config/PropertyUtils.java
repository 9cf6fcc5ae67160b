package io.triggerlens.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.triggerlens.client.config.ConfigElement;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    public static ConfigElement loadConfigElement(Path file)
        throws IOException
    {
        return ConfigElement.ofProperties(loadFile(file));
    }
}
