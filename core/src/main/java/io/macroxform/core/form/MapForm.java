package io.macroxform.core.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A map literal, kept as an ordered sequence of key/value pairs. Order is
 * significant for printing and for the order in which construction expressions
 * evaluate their holes.
 */
public record MapForm(List<Entry> entries) implements Form {

    public static final MapForm EMPTY = new MapForm(List.of());

    /** One key/value pair. */
    public record Entry(Form key, Form value) {
        public Entry {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public MapForm {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries must not be null"));
    }

    /**
     * Builds a map from alternating keys and values.
     *
     * @throws IllegalArgumentException if the number of forms is odd
     */
    public static MapForm ofPairs(List<Form> keysAndValues) {
        if (keysAndValues.size() % 2 != 0) {
            throw new IllegalArgumentException(
                    "map literal needs an even number of forms, got " + keysAndValues.size());
        }
        List<Entry> entries = new ArrayList<>(keysAndValues.size() / 2);
        for (int i = 0; i < keysAndValues.size(); i += 2) {
            entries.add(new Entry(keysAndValues.get(i), keysAndValues.get(i + 1)));
        }
        return new MapForm(entries);
    }

    /** Keys and values interleaved, in entry order. */
    public List<Form> flatten() {
        List<Form> result = new ArrayList<>(entries.size() * 2);
        for (Entry entry : entries) {
            result.add(entry.key());
            result.add(entry.value());
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return print();
    }
}
