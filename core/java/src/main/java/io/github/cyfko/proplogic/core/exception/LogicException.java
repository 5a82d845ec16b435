package io.github.cyfko.proplogic.core.exception;

import java.util.Objects;

/**
 * Base type of every failure raised while lexing, parsing or evaluating a statement.
 * <p>
 * Each failure is terminal for the current run: the pipeline stops at the stage where it
 * occurred and no partial result is produced. The {@link #getStage() stage} tells the caller
 * which part of the pipeline rejected the input, which is enough to pick an exit code or
 * a response status without inspecting concrete subclasses.
 * </p>
 *
 * <pre>{@code
 * try {
 *     boolean value = interpreter.evaluate(source);
 * } catch (LogicException e) {
 *     log.warning(() -> e.getStage() + " failure: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LexicalException
 * @see SyntaxException
 * @see EvaluationException
 */
public abstract class LogicException extends RuntimeException {

    /**
     * Pipeline stage at which a failure happened.
     */
    public enum Stage {
        LEX,
        PARSE,
        EVAL
    }

    private final Stage stage;

    protected LogicException(Stage stage, String message) {
        super(message);
        this.stage = Objects.requireNonNull(stage, "stage cannot be null");
    }

    public Stage getStage() {
        return stage;
    }
}
