package dev.roshin.complexityscanner.analysis.ast;

/**
 * One unit of analysis handed over by the frontend once its tree is fully built.
 */
public interface TranslationUnit {

    /**
     * Human readable name, used for logging only.
     */
    String name();

    SyntaxNode root();
}
