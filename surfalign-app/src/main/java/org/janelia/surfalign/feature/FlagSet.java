package org.janelia.surfalign.feature;

import java.io.Reader;
import java.io.Serializable;
import java.util.Arrays;

import org.janelia.surfalign.json.JsonUtils;

/**
 * Per element validity flags that parallel a {@link FeatureSet}.
 * Values lie in [0, 1] and are conceptually binary (1 = valid geometry, 0 = invalid geometry such as a border).
 */
public class FlagSet
        implements Serializable {

    public static final double VALID = 1.0;
    public static final double INVALID = 0.0;

    private final double[] flags;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FlagSet() {
        this.flags = null;
    }

    /**
     * @param  flags  flag values (not copied, the set takes ownership of the array).
     *
     * @throws IllegalArgumentException
     *   if any value is outside [0, 1].
     */
    public FlagSet(final double[] flags)
            throws IllegalArgumentException {
        this.flags = flags;
        validate();
    }

    public static FlagSet allValid(final int size) {
        final double[] flags = new double[size];
        Arrays.fill(flags, VALID);
        return new FlagSet(flags);
    }

    public int size() {
        return flags.length;
    }

    public double get(final int index) {
        return flags[index];
    }

    public boolean isValid(final int index) {
        return flags[index] >= 0.5;
    }

    public int getValidCount() {
        int count = 0;
        for (int i = 0; i < flags.length; i++) {
            if (isValid(i)) {
                count++;
            }
        }
        return count;
    }

    public double[] toArray() {
        return flags.clone();
    }

    public void validate()
            throws IllegalArgumentException {

        if (flags == null) {
            throw new IllegalArgumentException("flags must be specified");
        }

        for (int i = 0; i < flags.length; i++) {
            if (! ((flags[i] >= 0.0) && (flags[i] <= 1.0))) {
                throw new IllegalArgumentException("flag " + i + " has value " + flags[i] + " outside [0, 1]");
            }
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static FlagSet fromJson(final String json) {
        final FlagSet flagSet = JSON_HELPER.fromJson(json);
        flagSet.validate();
        return flagSet;
    }

    public static FlagSet fromJson(final Reader json) {
        final FlagSet flagSet = JSON_HELPER.fromJson(json);
        flagSet.validate();
        return flagSet;
    }

    @Override
    public String toString() {
        return "{ size: " + size() + ", validCount: " + getValidCount() + " }";
    }

    private static final JsonUtils.Helper<FlagSet> JSON_HELPER =
            new JsonUtils.Helper<>(FlagSet.class);

}
