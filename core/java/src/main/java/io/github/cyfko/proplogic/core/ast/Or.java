package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Disjunction, written {@code left v right}.
 */
public record Or(Node left, Node right) implements BinaryNode {

    public Or {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
