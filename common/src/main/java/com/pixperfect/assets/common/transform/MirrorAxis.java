package com.pixperfect.assets.common.transform;

import com.pixperfect.assets.common.exception.InvalidParameterException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The two mirror directions accepted from callers. The names are kept as clients
 * send them: {@code horizontal} turns the image upside down (top-to-bottom),
 * {@code vertical} swaps left and right.
 */
public enum MirrorAxis {
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String value;

    MirrorAxis(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MirrorAxis parse(String rawAxis) {
        if (rawAxis == null || rawAxis.isBlank()) {
            throw new InvalidParameterException("Mirror direction is required");
        }
        for (MirrorAxis axis : values()) {
            if (axis.value.equals(rawAxis.trim())) {
                return axis;
            }
        }
        throw new InvalidParameterException("Invalid mirror direction: " + rawAxis + ", expected one of "
                + Arrays.stream(values()).map(MirrorAxis::getValue).collect(Collectors.joining(", ")));
    }
}
