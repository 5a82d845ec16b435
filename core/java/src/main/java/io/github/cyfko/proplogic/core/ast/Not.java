package io.github.cyfko.proplogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Negation, written {@code ~operand}.
 */
public record Not(Node operand) implements Node {

    public Not {
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public List<Node> children() {
        return List.of(operand);
    }
}
