package io.github.cyfko.proplogic.core.parser;

import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.env.Environment;

import java.util.Objects;

/**
 * Outcome of parsing one statement: the final expression and the bindings its assignment lines produced.
 *
 * @param expression  root of the final expression's syntax tree
 * @param environment bindings recorded from the assignment lines, in scope for this run only
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Program(Node expression, Environment environment) {

    public Program {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(environment, "environment cannot be null");
    }
}
