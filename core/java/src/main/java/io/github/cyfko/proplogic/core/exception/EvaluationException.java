package io.github.cyfko.proplogic.core.exception;

import java.util.Objects;

/**
 * Exception thrown when an expression cannot be reduced to a truth value.
 * <p>
 * The only evaluation failure of the language is a reference to a variable that no
 * assignment bound. Resolution happens at evaluation time, so the reported name is the first
 * unbound variable met in left-to-right evaluation order.
 * </p>
 *
 * <pre>{@code
 * interpreter.evaluate("p v q");
 * // → "Evaluation error: variable 'p' is not bound"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends LogicException {

    public enum Kind {
        UNBOUND_VARIABLE
    }

    private final Kind kind;
    private final String name;

    private EvaluationException(Kind kind, String name, String message) {
        super(Stage.EVAL, message);
        this.kind = kind;
        this.name = name;
    }

    public static EvaluationException unboundVariable(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return new EvaluationException(Kind.UNBOUND_VARIABLE, name,
                "Evaluation error: variable '" + name + "' is not bound");
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
