package io.github.cyfko.proplogic.core.ast;

import java.util.List;

/**
 * Boolean constant, written {@code 1} or {@code 0} in source.
 */
public record Literal(boolean value) implements Node {

    public static final Literal TRUE = new Literal(true);
    public static final Literal FALSE = new Literal(false);

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
