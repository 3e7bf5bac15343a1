package org.zalando.rxkafka.gson;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Reads topic configuration properties from JSON objects.
 */
public final class TopicConfigs {

    private TopicConfigs() {
        throw new UnsupportedOperationException("The class TopicConfigs shall not be instantiated!");
    }

    /**
     * Parses a flat JSON object into configuration properties. Strings are taken as is, numbers and booleans are
     * converted to their JSON representation.
     *
     * @param   json  a JSON object, such as <code>{"acks": 1, "partitioner": "murmur2"}</code>
     *
     * @return  the properties, in the order they appear in {@code json}
     *
     * @throws  NullPointerException      if {@code json} is {@code null}
     * @throws  IllegalArgumentException  if {@code json} is not a JSON object, or one of its values is not a string,
     *                                    number or boolean
     */
    public static Map<String, String> fromJson(final String json) {
        requireNonNull(json);

        final JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (final JsonParseException e) {
            throw new IllegalArgumentException("Configuration data is not valid JSON: " + e.getMessage(), e);
        }

        checkArgument(element.isJsonObject(), "Configuration data must be specified as a JSON object: %s", json);
        return fromJson(element.getAsJsonObject());
    }

    /**
     * @see  #fromJson(String)
     */
    public static Map<String, String> fromJson(final JsonObject object) {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (final Map.Entry<String, JsonElement> entry : object.entrySet()) {
            final JsonElement value = entry.getValue();
            checkArgument(value.isJsonPrimitive(),
                "Configuration value for \"%s\" must be a string, number or boolean: %s", entry.getKey(), value);

            final JsonPrimitive primitive = value.getAsJsonPrimitive();
            builder.put(entry.getKey(), primitive.isString() ? primitive.getAsString() : primitive.toString());
        }

        return builder.build();
    }
}
