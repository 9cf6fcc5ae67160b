package io.triggerlens.client.config;

import java.util.Map;
import java.util.Properties;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An immutable snapshot of a {@link Config}, used to hand system configuration
 * to the injector without sharing a mutable object.
 */
public class ConfigElement
{
    public static ConfigElement copyOf(Config mutableConfig)
    {
        return new ConfigElement(mutableConfig.object);
    }

    @JsonCreator
    public static ConfigElement of(ObjectNode node)
    {
        return new ConfigElement(node);
    }

    public static ConfigElement ofProperties(Properties props)
    {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (String key : props.stringPropertyNames()) {
            node.put(key, props.getProperty(key));
        }
        return new ConfigElement(node);
    }

    public static ConfigElement ofMap(Map<String, String> map)
    {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, String> pair : map.entrySet()) {
            node.put(pair.getKey(), pair.getValue());
        }
        return new ConfigElement(node);
    }

    public static ConfigElement empty()
    {
        return new ConfigElement(JsonNodeFactory.instance.objectNode());
    }

    private final ObjectNode object;  // never exposed without a copy

    private ConfigElement(ObjectNode node)
    {
        this.object = node.deepCopy();
    }

    public Config toConfig(ConfigFactory factory)
    {
        return new Config(factory.objectMapper, object.deepCopy());
    }

    @JsonValue
    @Deprecated  // only for ObjectMapper
    public ObjectNode getObjectNode()
    {
        return object;
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof ConfigElement)) {
            return false;
        }
        return object.equals(((ConfigElement) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
