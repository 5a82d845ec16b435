package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Material implication, written {@code left => right}; false only when the left side holds and the right does not.
 */
public record Implies(Node left, Node right) implements BinaryNode {

    public Implies {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImplies(this);
    }
}
