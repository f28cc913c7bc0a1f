package io.macroxform.core.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Engine configuration. Immutable; build with {@link #builder()} or load with
 * {@link ConfigLoader}.
 *
 * @param maxSteps          macro steps allowed per top-level form
 * @param rejectMacroValues whether a macro name in a value position is an error
 * @param specialForms      extra head symbols reserved by the evaluator
 * @param libraries         macro library files loaded when the engine starts
 */
public record ExpanderConfig(
        int maxSteps, boolean rejectMacroValues, Set<String> specialForms, List<String> libraries) {

    /**
     * Defaults: 1000 steps, macro values rejected, no extra special forms, no
     * libraries.
     */
    public static final ExpanderConfig DEFAULT = builder().build();

    public ExpanderConfig {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        specialForms = Set.copyOf(specialForms);
        libraries = List.copyOf(libraries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ExpanderConfig}. Every field has a default. */
    public static final class Builder {
        private int maxSteps = 1000;
        private boolean rejectMacroValues = true;
        private final Set<String> specialForms = new LinkedHashSet<>();
        private final List<String> libraries = new ArrayList<>();

        private Builder() {}

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder rejectMacroValues(boolean rejectMacroValues) {
            this.rejectMacroValues = rejectMacroValues;
            return this;
        }

        public Builder specialForm(String name) {
            this.specialForms.add(name);
            return this;
        }

        public Builder specialForms(List<String> names) {
            this.specialForms.clear();
            this.specialForms.addAll(names);
            return this;
        }

        public Builder library(String path) {
            this.libraries.add(path);
            return this;
        }

        public Builder libraries(List<String> paths) {
            this.libraries.clear();
            this.libraries.addAll(paths);
            return this;
        }

        public ExpanderConfig build() {
            return new ExpanderConfig(maxSteps, rejectMacroValues, specialForms, libraries);
        }
    }
}
