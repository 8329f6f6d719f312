package io.nodelog.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.nodelog.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * Flat key-value configuration backed by a Jackson object node.
 *
 * Keys are dotted names such as {@code log.rpc-timeout}. Values are converted
 * on read, so a value loaded from a properties file as the string "30" can be
 * read as an int.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new ConfigException("Expected object but got " + object);
        }
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(type, value, key);
    }

    private JsonNode writeObject(Object obj)
    {
        try {
            return mapper.valueToTree(obj);
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Unsupported config value: " + obj, ex);
        }
    }

    private <E> E readObject(Class<E> type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            throw propagateConvertException(ex, typeNameOf(type), value, key);
        }
    }

    private ConfigException propagateConvertException(Exception ex, String typeName, JsonNode value, String key)
    {
        ThrowablesUtil.propagateIfInstanceOf(ex, ConfigException.class);
        String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                typeName, key, jsonSample(value), typeNameOf(value));
        return new ConfigException(message, ex);
    }

    private static String typeNameOf(Class<?> type)
    {
        if (type.equals(String.class)) {
            return "string type";
        }
        else if (type.equals(int.class) || type.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (type.equals(long.class) || type.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (type.equals(boolean.class) || type.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        return type.toString();
    }

    private static String typeNameOf(JsonNode value)
    {
        switch (value.getNodeType()) {
        case NULL:
            return "null";
        case BOOLEAN:
            return "boolean";
        case NUMBER:
            return "number";
        case ARRAY:
            return "array";
        case OBJECT:
            return "object";
        case STRING:
            return "string";
        default:
            return value.getNodeType().toString();
        }
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        else {
            return json.substring(0, 97) + "...";
        }
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
