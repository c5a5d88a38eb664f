package dev.roshin.complexityscanner.analysis.ast;

/**
 * A function-like declaration: method, constructor, free function or closure.
 */
public interface FunctionDeclaration extends SyntaxNode {

    /**
     * Unqualified name used as the key in the complexity report.
     */
    String displayName();

    /**
     * Where the declaration is defined, or {@code null} if the frontend has no usable position.
     */
    DeclarationLocation location();

    /**
     * Whether this is a definition rather than a bare declaration.
     */
    boolean hasBody();

    /**
     * Root statement of the body. Normally non-null when {@link #hasBody()} is true.
     */
    SyntaxNode body();
}
