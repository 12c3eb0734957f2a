package org.abstractica.frontend;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value stored in a session's settings.
 *
 * <p>Settings carry no declared schema, so a value is one of a fixed set of
 * shapes: string, integral number, floating point number, boolean, nested
 * mapping or sequence. All shapes are immutable, which makes copying a
 * settings map a deep copy.</p>
 */
public sealed interface SettingValue extends Serializable
{
    /**
     * A string value.
     *
     * @param value the string
     */
    record StringValue(String value) implements SettingValue
    {
        public StringValue
        {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * An integral number.
     *
     * @param value the number
     */
    record LongValue(long value) implements SettingValue {}

    /**
     * A floating point number.
     *
     * @param value the number
     */
    record DoubleValue(double value) implements SettingValue {}

    /**
     * A boolean value.
     *
     * @param value the flag
     */
    record BooleanValue(boolean value) implements SettingValue {}

    /**
     * A nested mapping; iteration order is insertion order.
     *
     * @param entries the entries
     */
    record MapValue(Map<String, SettingValue> entries) implements SettingValue
    {
        public MapValue
        {
            Objects.requireNonNull(entries, "entries");
            Map<String, SettingValue> copy = new LinkedHashMap<>();
            entries.forEach((key, value) -> copy.put(
                    Objects.requireNonNull(key, "key"),
                    Objects.requireNonNull(value, "value")));
            entries = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * A sequence of values.
     *
     * @param elements the elements
     */
    record ListValue(List<SettingValue> elements) implements SettingValue
    {
        public ListValue
        {
            Objects.requireNonNull(elements, "elements");
            List<SettingValue> copy = new ArrayList<>(elements.size());
            for (SettingValue element : elements)
            {
                copy.add(Objects.requireNonNull(element, "element"));
            }
            elements = Collections.unmodifiableList(copy);
        }
    }

    static SettingValue of(String value)
    {
        return new StringValue(value);
    }

    static SettingValue of(long value)
    {
        return new LongValue(value);
    }

    static SettingValue of(double value)
    {
        return new DoubleValue(value);
    }

    static SettingValue of(boolean value)
    {
        return new BooleanValue(value);
    }

    static SettingValue of(Map<String, SettingValue> entries)
    {
        return new MapValue(entries);
    }

    static SettingValue of(List<SettingValue> elements)
    {
        return new ListValue(elements);
    }
}
