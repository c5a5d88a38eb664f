package dev.roshin.complexityscanner.analysis.ast;

import java.util.List;

/**
 * A node of the syntax tree supplied by a frontend.
 * The analyzer only needs the node's kind and a way to enumerate its direct children.
 */
public interface SyntaxNode {

    /**
     * Classification of this node. May be {@code null} for nodes the frontend cannot describe,
     * which the analyzer treats like {@link NodeKind#OTHER}.
     */
    NodeKind kind();

    /**
     * Direct structural children, in source order. Entries may be {@code null}.
     */
    List<? extends SyntaxNode> children();
}
