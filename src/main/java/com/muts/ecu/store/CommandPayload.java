package com.muts.ecu.store;

import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandPayload
 * -----------------------------------------------------------------------------
 * Immutable key/value payload of a {@link Command} with typed accessors.
 *
 * <p>Every {@code require*} accessor throws
 * {@link CommandRejectedException} with kind {@code INVALID_COMMAND} when the
 * key is missing or the value has the wrong type, so handlers never see a
 * {@link ClassCastException}.</p>
 */
public final class CommandPayload
{
    private static final CommandPayload EMPTY = new CommandPayload(Map.of());

    private final Map<String, Object> values;

    private CommandPayload(Map<String, ?> values)
    {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CommandPayload empty()
    {
        return EMPTY;
    }

    public static CommandPayload of(Map<String, ?> values)
    {
        Objects.requireNonNull(values, "values");
        return values.isEmpty() ? EMPTY : new CommandPayload(values);
    }

    public static CommandPayload of(String key, Object value)
    {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(key, value);
        return new CommandPayload(m);
    }

    public CommandPayload with(String key, Object value)
    {
        Map<String, Object> m = new LinkedHashMap<>(values);
        m.put(key, value);
        return new CommandPayload(m);
    }

    public Map<String, Object> asMap()
    {
        return values;
    }

    public boolean has(String key)
    {
        return values.get(key) != null;
    }

    public String requireString(String key)
    {
        Object v = require(key);
        if (v instanceof String s && !s.isBlank()) {
            return s;
        }
        throw CommandRejectedException.invalid("'" + key + "' must be a non-empty string");
    }

    public Optional<String> optionalString(String key)
    {
        return has(key) ? Optional.of(requireString(key)) : Optional.empty();
    }

    /**
     * {@code true} only for {@link Boolean#TRUE} or the string {@code "true"}.
     */
    public boolean flag(String key)
    {
        Object v = values.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        return v instanceof String s && Boolean.parseBoolean(s.trim());
    }

    public long requireLong(String key)
    {
        Object v = require(key);
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v instanceof String s) {
            try {
                String t = s.trim();
                return t.startsWith("0x") || t.startsWith("0X")
                    ? Long.parseLong(t.substring(2), 16)
                    : Long.parseLong(t);
            } catch (NumberFormatException e) {
                throw CommandRejectedException.invalid("'" + key + "' is not a number: " + s);
            }
        }
        throw CommandRejectedException.invalid("'" + key + "' must be a number");
    }

    /**
     * Accepts a {@code byte[]} or a hex string.
     */
    public byte[] requireBytes(String key)
    {
        return toBytes(key, require(key));
    }

    public List<?> requireList(String key)
    {
        Object v = require(key);
        if (v instanceof List<?> list) {
            return list;
        }
        throw CommandRejectedException.invalid("'" + key + "' must be a list");
    }

    static byte[] toBytes(String key, Object v)
    {
        if (v instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (v instanceof String s) {
            try {
                return HexFormat.of().parseHex(s.trim());
            } catch (IllegalArgumentException e) {
                throw CommandRejectedException.invalid("'" + key + "' is not valid hex");
            }
        }
        throw CommandRejectedException.invalid("'" + key + "' must be bytes or a hex string");
    }

    private Object require(String key)
    {
        Object v = values.get(key);
        if (v == null) {
            throw CommandRejectedException.invalid("missing '" + key + "'");
        }
        return v;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof CommandPayload other && values.equals(other.values);
    }

    @Override
    public int hashCode()
    {
        return values.hashCode();
    }

    @Override
    public String toString()
    {
        return "CommandPayload" + values.keySet();
    }
}
