package org.zalando.rxkafka;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.zalando.rxkafka.gson.TopicConfigs;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * Describes a topic to be created: its name, its own configuration properties, and whether the owning connection must
 * be established at creation time.
 */
public final class TopicDescriptor {

    private final TopicName name;
    private final Map<String, String> config;
    private final boolean validatedEagerly;

    public static final class Builder {
        final TopicName name;
        final Map<String, String> config = new LinkedHashMap<>();
        boolean validatedEagerly;

        Builder(final TopicName name) {
            this.name = requireNonNull(name);
        }

        /**
         * Adds a configuration property.
         *
         * @throws  NullPointerException  if at least one of the parameters is {@code null}
         */
        public Builder config(final String key, final String value) {
            config.put(requireNonNull(key), requireNonNull(value));
            return this;
        }

        /**
         * Adds all given configuration properties.
         *
         * @throws  NullPointerException  if {@code config} is or contains {@code null}
         */
        public Builder config(final Map<String, String> config) {
            config.forEach(this::config);
            return this;
        }

        /**
         * Adds all configuration properties of the given JSON object.
         *
         * @throws  IllegalArgumentException  if {@code json} is not a JSON object of scalar values
         *
         * @see     TopicConfigs#fromJson(String)
         */
        public Builder jsonConfig(final String json) {
            return config(TopicConfigs.fromJson(json));
        }

        /**
         * Requires the owning connection to be established when the topic is created. By default, the connection is
         * only checked when the topic is first used.
         */
        public Builder validateEagerly() {
            this.validatedEagerly = true;
            return this;
        }

        public TopicDescriptor build() {
            return new TopicDescriptor(this);
        }
    }

    private TopicDescriptor(final Builder builder) {
        this.name = builder.name;
        this.config = ImmutableMap.copyOf(builder.config);
        this.validatedEagerly = builder.validatedEagerly;
    }

    /**
     * @throws  NullPointerException      if {@code name} is {@code null}
     * @throws  IllegalArgumentException  if {@code name} is empty
     */
    public static Builder named(final String name) {
        return named(TopicName.of(name));
    }

    public static Builder named(final TopicName name) {
        return new Builder(name);
    }

    public TopicName getName() {
        return name;
    }

    /**
     * @return  the configuration properties, in the order they were added
     */
    public Map<String, String> getConfig() {
        return config;
    }

    public boolean isValidatedEagerly() {
        return validatedEagerly;
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }

        if (obj instanceof TopicDescriptor) {
            final TopicDescriptor other = (TopicDescriptor) obj;
            return name.equals(other.name) && config.equals(other.config)
                    && validatedEagerly == other.validatedEagerly;
        }

        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, config, validatedEagerly);
    }

    @Override
    public String toString() {
        return
            MoreObjects.toStringHelper(this)                    //
                       .add("name", name)                       //
                       .add("config", config)                   //
                       .add("validatedEagerly", validatedEagerly) //
                       .toString();
    }
}
