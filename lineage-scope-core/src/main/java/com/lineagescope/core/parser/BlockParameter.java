package com.lineagescope.core.parser;

import java.util.Objects;

/**
 * A typed parameter decoded from a parameter section.
 *
 * @param index positional index as written
 * @param type declared type
 * @param name parameter name without its marker character
 * @param value parameter value, empty if absent
 */
public record BlockParameter(String index, String type, String name, String value) {

    public BlockParameter {
        Objects.requireNonNull(name, "name must not be null");
        index = index == null ? "" : index;
        type = type == null ? "" : type;
        value = value == null ? "" : value;
    }
}
