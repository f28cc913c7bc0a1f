package io.macroxform.core.form;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered, possibly empty list. Lists are the only forms that can be calls,
 * so they also carry the reader's {@link SourceLocation}. The location is
 * diagnostic metadata and takes no part in equality.
 *
 * @param elements the elements, copied into an unmodifiable list
 * @param location where the reader found this list, or {@code null}
 */
public record ListForm(List<Form> elements, SourceLocation location) implements Form {

    public static final ListForm EMPTY = new ListForm(List.of(), null);

    public ListForm {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public ListForm(List<Form> elements) {
        this(elements, null);
    }

    public static ListForm of(Form... elements) {
        return new ListForm(Arrays.asList(elements), null);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    public Form get(int index) {
        return elements.get(index);
    }

    /** The head form, or empty for {@code ()}. */
    public Optional<Form> head() {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    /**
     * The head as a symbol, or empty if the list is empty or its head is not a
     * symbol.
     */
    public Optional<Symbol> headSymbol() {
        return head().filter(Symbol.class::isInstance).map(Symbol.class::cast);
    }

    /** All elements after the head. */
    public List<Form> tail() {
        return elements.isEmpty() ? List.of() : elements.subList(1, elements.size());
    }

    /**
     * Returns a copy with {@code first} prepended, keeping this list's
     * location.
     */
    public ListForm cons(Form first) {
        List<Form> result = new ArrayList<>(elements.size() + 1);
        result.add(first);
        result.addAll(elements);
        return new ListForm(result, location);
    }

    /** Returns a list with the same location and the given elements. */
    public ListForm withElements(List<Form> newElements) {
        return new ListForm(newElements, location);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ListForm other && elements.equals(other.elements));
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return print();
    }
}
