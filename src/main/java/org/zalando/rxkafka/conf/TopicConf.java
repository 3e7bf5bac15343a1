package org.zalando.rxkafka.conf;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;

/**
 * Topic configuration: an immutable overlay of topic-level properties, resolved against the defaults inherited from
 * the owning connection.
 *
 * <p>The overlay is validated once, at creation. Inherited defaults are not owned by this configuration; they are
 * passed in on every lookup and validated at that point, so a lookup may report a property as
 * {@link ConfResult#INVALID invalid} even though the configuration was valid when it was created.</p>
 */
public final class TopicConf {

    private static final Map<String, Range<Integer>> COMPRESSION_LEVELS = ImmutableMap.of( //
            "gzip", Range.closed(-1, 9),                                                   //
            "snappy", Range.closed(-1, 0),                                                 //
            "lz4", Range.closed(-1, 12),                                                   //
            "zstd", Range.closed(-1, 12));

    private final ImmutableMap<ConfProperty, String> overlay;

    private TopicConf(final ImmutableMap<ConfProperty, String> overlay) {
        this.overlay = overlay;
    }

    /**
     * Creates a topic configuration.
     *
     * @param   config     topic-level properties, keyed by canonical name or alias
     * @param   inherited  the defaults currently inherited from the owning connection
     *
     * @return  the validated configuration
     *
     * @throws  NullPointerException    if at least one of the parameters is {@code null}
     * @throws  InvalidConfigException  if a property is unknown, has an invalid value, or conflicts with the
     *                                  inherited defaults
     */
    public static TopicConf create(final Map<String, String> config, final Map<String, String> inherited) {
        requireNonNull(config);
        requireNonNull(inherited);

        final Map<ConfProperty, String> overlay = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : config.entrySet()) {
            final String key = requireNonNull(entry.getKey(), "configuration key");
            final String value = entry.getValue();
            checkArgument(value != null, "Configuration value for \"%s\" must not be null", key);

            final ConfProperty property = ConfProperty.forName(key).orElseThrow(() ->
                        new InvalidConfigException(key, ConfResult.UNKNOWN,
                            String.format("No such configuration property: \"%s\"", key)));

            final Optional<String> problem = property.validate(value);
            if (problem.isPresent()) {
                throw new InvalidConfigException(key, ConfResult.INVALID, problem.get());
            }

            final String previous = overlay.put(property, value);
            if (previous != null && !previous.equals(value)) {
                throw new InvalidConfigException(key, ConfResult.INVALID,
                    String.format("Property \"%s\" given twice with different values: \"%s\" and \"%s\"", property,
                        previous, value));
            }
        }

        final TopicConf conf = new TopicConf(ImmutableMap.copyOf(overlay));
        final String level = conf.effectiveCompressionLevel(inherited);
        if (level != null) {
            final Optional<String> problem = conf.checkCompressionLevel(level, inherited);
            if (problem.isPresent()) {
                throw new InvalidConfigException(ConfProperty.COMPRESSION_LEVEL.getName(), ConfResult.INVALID,
                    problem.get());
            }
        }

        return conf;
    }

    /**
     * Looks up a single property.
     *
     * @param   key        canonical name or alias of the property
     * @param   inherited  the defaults currently inherited from the owning connection
     *
     * @return  {@link ConfResult#UNKNOWN} if {@code key} isn't a topic property or has no value,
     *          {@link ConfResult#INVALID} if the resolved value isn't valid in the current state, or
     *          {@link ConfResult#OK} along with the resolved value
     *
     * @throws  NullPointerException  if at least one of the parameters is {@code null}
     */
    public ConfLookup get(final String key, final Map<String, String> inherited) {
        requireNonNull(key);
        requireNonNull(inherited);

        return ConfProperty.forName(key)                            //
                           .map(property -> lookup(property, inherited)) //
                           .orElse(ConfLookup.unknown());
    }

    /**
     * Resolves every property that has a value, either from the overlay or inherited. Overlay properties come first,
     * in the order they were given.
     */
    public Map<ConfProperty, ConfLookup> dump(final Map<String, String> inherited) {
        requireNonNull(inherited);

        final Map<ConfProperty, ConfLookup> dump = new LinkedHashMap<>();
        overlay.keySet().forEach(property -> dump.put(property, lookup(property, inherited)));
        for (final ConfProperty property : ConfProperty.values()) {
            if (!dump.containsKey(property) && inheritedValue(property, inherited) != null) {
                dump.put(property, lookup(property, inherited));
            }
        }

        return dump;
    }

    /**
     * @return  the properties set on this configuration, keyed by canonical name, in the order they were given
     */
    public Map<String, String> getOverlay() {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        overlay.forEach((property, value) -> builder.put(property.getName(), value));
        return builder.build();
    }

    private ConfLookup lookup(final ConfProperty property, final Map<String, String> inherited) {
        String value = overlay.get(property);
        if (value == null) {
            value = inheritedValue(property, inherited);
            if (value == null) {
                return ConfLookup.unknown();
            }

            final Optional<String> problem = property.validate(value);
            if (problem.isPresent()) {
                return ConfLookup.invalid(problem.get());
            }
        }

        if (property == ConfProperty.COMPRESSION_LEVEL) {
            final Optional<String> problem = checkCompressionLevel(value, inherited);
            if (problem.isPresent()) {
                return ConfLookup.invalid(problem.get());
            }
        }

        return ConfLookup.ok(value);
    }

    // only constraints involving the overlay are checked at creation, inherited pairs are checked on lookup
    private String effectiveCompressionLevel(final Map<String, String> inherited) {
        final String own = overlay.get(ConfProperty.COMPRESSION_LEVEL);
        if (own != null) {
            return own;
        }

        if (!overlay.containsKey(ConfProperty.COMPRESSION_CODEC)) {
            return null;
        }

        final String level = inheritedValue(ConfProperty.COMPRESSION_LEVEL, inherited);
        return level == null || ConfProperty.COMPRESSION_LEVEL.validate(level).isPresent() ? null : level;
    }

    private Optional<String> checkCompressionLevel(final String level, final Map<String, String> inherited) {
        String codec = overlay.get(ConfProperty.COMPRESSION_CODEC);
        if (codec == null) {
            codec = inheritedValue(ConfProperty.COMPRESSION_CODEC, inherited);
        }

        final Range<Integer> range = codec == null ? null : COMPRESSION_LEVELS.get(codec);
        final Integer parsed = Ints.tryParse(level.trim());
        if (range == null || parsed == null || range.contains(parsed)) {
            return Optional.empty();
        }

        return Optional.of(String.format("Invalid value %s for property \"%s\": allowed range for codec %s is %s",
                    parsed, ConfProperty.COMPRESSION_LEVEL, codec, range));
    }

    private static String inheritedValue(final ConfProperty property, final Map<String, String> inherited) {
        final String value = inherited.get(property.getName());
        if (value != null) {
            return value;
        }

        for (final String alias : property.getAliases()) {
            final String aliased = inherited.get(alias);
            if (aliased != null) {
                return aliased;
            }
        }

        return null;
    }

    @Override
    public boolean equals(final Object obj) {
        return obj == this || (obj instanceof TopicConf && overlay.equals(((TopicConf) obj).overlay));
    }

    @Override
    public int hashCode() {
        return overlay.hashCode();
    }

    @Override
    public String toString() {
        return "TopicConf" + getOverlay();
    }
}
