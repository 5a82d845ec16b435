package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Biconditional, written {@code left <=> right}; true when both sides share the same truth value.
 */
public record Iff(Node left, Node right) implements BinaryNode {

    public Iff {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIff(this);
    }
}
