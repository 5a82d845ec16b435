package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.exception.LogicException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running one statement: either a truth value or the error that stopped the pipeline,
 * never both.
 * <p>
 * Instances are immutable and created via {@link #success(boolean, Node, Map)} and
 * {@link #failure(LogicException)}.
 * </p>
 *
 * <pre>{@code
 * EvaluationResult result = interpreter.run(source);
 * if (result.isSuccess()) {
 *     System.out.println(result.getValue() ? "1" : "0");
 * } else {
 *     System.err.println(result.getStage().orElseThrow() + ": " + result.getError().orElseThrow().getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final boolean value;
    private final Node expression;
    private final Map<String, Boolean> bindings;
    private final LogicException error;

    private EvaluationResult(boolean value, Node expression, Map<String, Boolean> bindings, LogicException error) {
        this.value = value;
        this.expression = expression;
        this.bindings = bindings;
        this.error = error;
    }

    /**
     * @param value      truth value of the expression
     * @param expression the evaluated syntax tree
     * @param bindings   the variable bindings in effect, copied
     * @return a successful result
     */
    public static EvaluationResult success(boolean value, Node expression, Map<String, Boolean> bindings) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(bindings, "bindings cannot be null");
        return new EvaluationResult(value, expression, Map.copyOf(bindings), null);
    }

    /**
     * @param error the failure that stopped the pipeline
     * @return a failed result
     */
    public static EvaluationResult failure(LogicException error) {
        Objects.requireNonNull(error, "error cannot be null");
        return new EvaluationResult(false, null, Map.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the truth value of the statement
     * @throws IllegalStateException if this result is a failure; the original error is attached as cause
     */
    public boolean getValue() {
        if (error != null) {
            throw new IllegalStateException("No value: statement failed at stage " + error.getStage(), error);
        }
        return value;
    }

    /**
     * @return the evaluated syntax tree, empty on failure
     */
    public Optional<Node> getExpression() {
        return Optional.ofNullable(expression);
    }

    /**
     * @return the variable bindings of the run, empty on failure
     */
    public Map<String, Boolean> getBindings() {
        return bindings;
    }

    public Optional<LogicException> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<LogicException.Stage> getStage() {
        return getError().map(LogicException::getStage);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EvaluationResult[success=true, value=" + value + "]"
                : "EvaluationResult[success=false, stage=" + error.getStage() + ", error=" + error.getMessage() + "]";
    }
}
