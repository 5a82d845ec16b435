package io.github.cyfko.proplogic.core.ast;

import java.util.List;

/**
 * Node applying a binary connective to two operands.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface BinaryNode extends Node permits And, Or, Implies, Iff {

    Node left();

    Node right();

    @Override
    default List<Node> children() {
        return List.of(left(), right());
    }
}
