package io.github.cyfko.proplogic.core.export;

import io.github.cyfko.proplogic.core.ast.Node;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serializes a syntax tree into a graph description consumed by an external rendering tool.
 * <p>
 * The description contains one node entry per tree node and one edge per parent/child pair. It is a
 * structural dump only: nothing is evaluated, so unbound variables export like any other leaf.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see DotGraphExporter
 */
public interface GraphExporter {

    /**
     * @param root root of the tree to export
     * @return the graph description
     */
    String export(Node root);

    /**
     * Writes the graph description of {@code root} to {@code target} as UTF-8, replacing any existing file.
     *
     * @param root   root of the tree to export
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    default void export(Node root, Path target) throws IOException {
        Objects.requireNonNull(target, "target cannot be null");
        Files.writeString(target, export(root), StandardCharsets.UTF_8);
    }
}
