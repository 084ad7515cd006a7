package io.elephant.core.config;

import java.util.List;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Flat key-value system configuration, for example "database.type" or "schedule.max_workers".
 *
 * Values loaded from a properties file are strings; they are converted to the
 * requested type by Jackson on read.
 */
public class Config
{
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            object.remove(key);
        }
        else {
            object.set(key, mapper.valueToTree(v));
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return readValue(key, value, type);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readValue(key, value, type);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    /**
     * Reads a comma-separated string value as a list. Blank entries are dropped.
     */
    public List<String> getListOrEmpty(String key)
    {
        Optional<String> value = getOptional(key, String.class);
        if (!value.isPresent()) {
            return ImmutableList.of();
        }
        return LIST_SPLITTER.splitToList(value.get());
    }

    private <E> E readValue(String key, JsonNode value, Class<E> type)
    {
        try {
            return mapper.treeToValue(value, type);
        }
        catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ConfigException("Parameter '" + key + "' is not a valid " + type.getSimpleName() + ": " + value, ex);
        }
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) {
            return true;
        }
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

    @Override
    public String toString()
    {
        return object.toString();
    }
}
