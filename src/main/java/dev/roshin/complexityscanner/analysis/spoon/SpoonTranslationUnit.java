package dev.roshin.complexityscanner.analysis.spoon;

import dev.roshin.complexityscanner.analysis.ast.SyntaxNode;
import dev.roshin.complexityscanner.analysis.ast.TranslationUnit;
import spoon.reflect.CtModel;

/**
 * All sources of a Spoon model analyzed as one translation unit, rooted at the model's root package.
 */
public class SpoonTranslationUnit implements TranslationUnit {

    private final String name;
    private final CtModel model;

    public SpoonTranslationUnit(String name, CtModel model) {
        this.name = name;
        this.model = model;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SyntaxNode root() {
        return SpoonSyntaxNode.wrap(model.getRootPackage());
    }

    public CtModel model() {
        return model;
    }
}
