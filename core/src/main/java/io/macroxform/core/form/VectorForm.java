package io.macroxform.core.form;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** An ordered vector of forms. */
public record VectorForm(List<Form> elements) implements Form {

    public static final VectorForm EMPTY = new VectorForm(List.of());

    public VectorForm {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public static VectorForm of(Form... elements) {
        return new VectorForm(Arrays.asList(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return print();
    }
}
