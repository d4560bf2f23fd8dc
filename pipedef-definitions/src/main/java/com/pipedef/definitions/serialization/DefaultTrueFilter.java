package com.pipedef.definitions.serialization;

/**
 * Jackson value filter for boolean properties that default to {@code true}: the property is omitted when
 * its value is {@code true}. Use with {@code @JsonInclude(value = Include.CUSTOM, valueFilter = DefaultTrueFilter.class)}.
 */
public final class DefaultTrueFilter {

    @Override
    public boolean equals(Object other) {
        return Boolean.TRUE.equals(other);
    }

    @Override
    public int hashCode() {
        return Boolean.TRUE.hashCode();
    }
}
