package org.zalando.rxkafka.conf;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;

/**
 * The topic-level configuration properties understood by the client.
 */
public enum ConfProperty {

    REQUEST_REQUIRED_ACKS("request.required.acks", ImmutableSet.of("acks"), Type.integer(-1, 1000)),

    REQUEST_TIMEOUT_MS("request.timeout.ms", ImmutableSet.of(), Type.integer(1, 900_000)),

    MESSAGE_TIMEOUT_MS("message.timeout.ms", ImmutableSet.of("delivery.timeout.ms"),
        Type.integer(0, Integer.MAX_VALUE)),

    QUEUING_STRATEGY("queuing.strategy", ImmutableSet.of(), Type.oneOf("fifo", "lifo")),

    PARTITIONER("partitioner", ImmutableSet.of(),
        Type.oneOf("random", "consistent", "consistent_random", "murmur2", "murmur2_random", "fnv1a",
            "fnv1a_random")),

    COMPRESSION_CODEC("compression.codec", ImmutableSet.of("compression.type"),
        Type.oneOf("none", "gzip", "snappy", "lz4", "zstd", "inherit")),

    COMPRESSION_LEVEL("compression.level", ImmutableSet.of(), Type.integer(-1, 12)),

    AUTO_COMMIT_ENABLE("auto.commit.enable", ImmutableSet.of("enable.auto.commit"), Type.oneOf("true", "false")),

    AUTO_COMMIT_INTERVAL_MS("auto.commit.interval.ms", ImmutableSet.of(), Type.integer(10, 86_400_000)),

    AUTO_OFFSET_RESET("auto.offset.reset", ImmutableSet.of(),
        Type.oneOf("smallest", "earliest", "beginning", "largest", "latest", "end", "error")),

    OFFSET_STORE_METHOD("offset.store.method", ImmutableSet.of(), Type.oneOf("file", "broker")),

    CONSUME_CALLBACK_MAX_MESSAGES("consume.callback.max.messages", ImmutableSet.of(), Type.integer(0, 1_000_000));

    private static final Map<String, ConfProperty> BY_NAME;

    static {
        final ImmutableMap.Builder<String, ConfProperty> builder = ImmutableMap.builder();
        for (final ConfProperty property : values()) {
            builder.put(property.name, property);
            property.aliases.forEach(alias -> builder.put(alias, property));
        }

        BY_NAME = builder.build();
    }

    private final String name;
    private final Set<String> aliases;
    private final Type type;

    ConfProperty(final String name, final Set<String> aliases, final Type type) {
        this.name = name;
        this.aliases = aliases;
        this.type = type;
    }

    /**
     * Looks up a property by its canonical name or one of its aliases.
     *
     * @throws  NullPointerException  if {@code name} is {@code null}
     */
    public static Optional<ConfProperty> forName(final String name) {
        return Optional.ofNullable(BY_NAME.get(requireNonNull(name)));
    }

    /**
     * @return  the canonical name of this property
     */
    public String getName() {
        return name;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    /**
     * Checks {@code value} against the type of this property.
     *
     * @return  a description of the problem, or {@link Optional#empty() empty} if {@code value} is valid
     */
    public Optional<String> validate(final String value) {
        return type.validate(this, requireNonNull(value));
    }

    @Override
    public String toString() {
        return name;
    }

    private abstract static class Type {

        abstract Optional<String> validate(ConfProperty property, String value);

        static Type integer(final int min, final int max) {
            final Range<Integer> range = Range.closed(min, max);
            return new Type() {
                @Override
                Optional<String> validate(final ConfProperty property, final String value) {
                    final Integer parsed = Ints.tryParse(value.trim());
                    if (parsed == null) {
                        return Optional.of(String.format("Invalid value \"%s\" for property \"%s\": not a number",
                                    value, property));
                    }

                    if (!range.contains(parsed)) {
                        return Optional.of(String.format(
                                    "Invalid value %s for property \"%s\": allowed range is %d..%d", parsed, property,
                                    min, max));
                    }

                    return Optional.empty();
                }
            };
        }

        static Type oneOf(final String... allowed) {
            final Set<String> values = ImmutableSet.copyOf(allowed);
            return new Type() {
                @Override
                Optional<String> validate(final ConfProperty property, final String value) {
                    if (values.contains(value)) {
                        return Optional.empty();
                    }

                    return Optional.of(String.format("Invalid value \"%s\" for property \"%s\": expected one of %s",
                                value, property, Joiner.on(", ").join(values)));
                }
            };
        }
    }
}
