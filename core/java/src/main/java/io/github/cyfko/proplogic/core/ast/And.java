package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Conjunction, written {@code left ^ right}.
 */
public record And(Node left, Node right) implements BinaryNode {

    public And {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
