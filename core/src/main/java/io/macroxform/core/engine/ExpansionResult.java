package io.macroxform.core.engine;

import io.macroxform.core.form.Form;

/**
 * A fully expanded top-level form together with the number of macro steps it
 * took.
 *
 * @param form  the expanded form, free of macro calls
 * @param steps how many times a transformer was applied
 */
public record ExpansionResult(Form form, int steps) {}
