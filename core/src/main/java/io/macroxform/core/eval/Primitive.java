package io.macroxform.core.eval;

import io.macroxform.core.form.Form;
import java.util.List;

/**
 * A function callable from construction expressions. Arguments arrive
 * evaluated. Implementations signal bad input with
 * {@link IllegalArgumentException}; the evaluator reports it against the
 * calling form.
 */
@FunctionalInterface
public interface Primitive {

    Form apply(List<Form> args);
}
