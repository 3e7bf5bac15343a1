package org.zalando.rxkafka.conf;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Result of looking up a single property in a {@link TopicConf}.
 */
public final class ConfLookup {

    private static final ConfLookup UNKNOWN = new ConfLookup(ConfResult.UNKNOWN, null, null);

    private final ConfResult result;
    private final String value;
    private final String problem;

    private ConfLookup(final ConfResult result, final String value, final String problem) {
        this.result = result;
        this.value = value;
        this.problem = problem;
    }

    static ConfLookup ok(final String value) {
        return new ConfLookup(ConfResult.OK, requireNonNull(value), null);
    }

    static ConfLookup unknown() {
        return UNKNOWN;
    }

    static ConfLookup invalid(final String problem) {
        return new ConfLookup(ConfResult.INVALID, null, requireNonNull(problem));
    }

    public ConfResult getResult() {
        return result;
    }

    /**
     * @throws  IllegalStateException  if the result is not {@link ConfResult#OK}
     */
    public String getValue() {
        checkState(result == ConfResult.OK, "No value for %s lookup.", result);
        return value;
    }

    /**
     * @throws  IllegalStateException  if the result is not {@link ConfResult#INVALID}
     */
    public String getProblem() {
        checkState(result == ConfResult.INVALID, "No problem for %s lookup.", result);
        return problem;
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }

        if (obj instanceof ConfLookup) {
            final ConfLookup other = (ConfLookup) obj;
            return result == other.result && Objects.equals(value, other.value)
                    && Objects.equals(problem, other.problem);
        }

        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, value, problem);
    }

    @Override
    public String toString() {
        return
            MoreObjects.toStringHelper(this)  //
                       .omitNullValues()      //
                       .add("result", result) //
                       .add("value", value)   //
                       .add("problem", problem) //
                       .toString();
    }
}
