package io.github.cyfko.proplogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a named variable, resolved against the environment only when evaluated.
 */
public record Variable(String name) implements Node {

    public Variable {
        Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
