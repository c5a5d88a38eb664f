package dev.roshin.complexityscanner.analysis.spoon;

import dev.roshin.complexityscanner.analysis.ast.NodeKind;
import dev.roshin.complexityscanner.analysis.ast.SyntaxNode;
import spoon.reflect.code.CtAbstractSwitch;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtCase;
import spoon.reflect.code.CtConditional;
import spoon.reflect.code.CtDo;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtFor;
import spoon.reflect.code.CtForEach;
import spoon.reflect.code.CtIf;
import spoon.reflect.code.CtLambda;
import spoon.reflect.code.CtReturn;
import spoon.reflect.code.CtWhile;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtModule;
import spoon.reflect.declaration.CtPackage;
import spoon.reflect.declaration.CtType;

import java.util.List;

/**
 * Exposes a Spoon {@link CtElement} through the analyzer's {@link SyntaxNode} contract.
 */
public class SpoonSyntaxNode implements SyntaxNode {

    protected final CtElement element;

    SpoonSyntaxNode(CtElement element) {
        this.element = element;
    }

    /**
     * Wraps an element, using {@link SpoonFunctionDeclaration} for methods, constructors and lambdas.
     * Returns null for a null element.
     */
    public static SpoonSyntaxNode wrap(CtElement element) {
        if (element == null) {
            return null;
        }
        if (element instanceof CtMethod<?> || element instanceof CtConstructor<?> || element instanceof CtLambda<?>) {
            return new SpoonFunctionDeclaration((CtExecutable<?>) element);
        }
        return new SpoonSyntaxNode(element);
    }

    /**
     * Maps a Spoon element type to the analyzer's node kinds.
     * Enhanced for loops map to {@link NodeKind#FOR}; switch expressions to {@link NodeKind#SWITCH}.
     */
    static NodeKind classify(CtElement element) {
        if (element instanceof CtIf) {
            return NodeKind.IF;
        }
        if (element instanceof CtAbstractSwitch<?>) {
            return NodeKind.SWITCH;
        }
        if (element instanceof CtCase<?>) {
            return NodeKind.CASE;
        }
        if (element instanceof CtFor || element instanceof CtForEach) {
            return NodeKind.FOR;
        }
        if (element instanceof CtWhile) {
            return NodeKind.WHILE;
        }
        if (element instanceof CtDo) {
            return NodeKind.DO_WHILE;
        }
        if (element instanceof CtConditional<?>) {
            return NodeKind.CONDITIONAL;
        }
        if (element instanceof CtExecutable<?>) {
            return NodeKind.FUNCTION;
        }
        if (element instanceof CtBlock<?>) {
            return NodeKind.BLOCK;
        }
        if (element instanceof CtReturn<?>) {
            return NodeKind.RETURN;
        }
        if (element instanceof CtType<?>) {
            return NodeKind.TYPE;
        }
        if (element instanceof CtPackage || element instanceof CtModule) {
            return NodeKind.CONTAINER;
        }
        if (element instanceof CtExpression<?>) {
            return NodeKind.EXPRESSION;
        }
        return NodeKind.OTHER;
    }

    @Override
    public NodeKind kind() {
        return classify(element);
    }

    @Override
    public List<SyntaxNode> children() {
        return element.getDirectChildren().stream()
                .map(SpoonSyntaxNode::wrap)
                .map(SyntaxNode.class::cast)
                .toList();
    }

    /**
     * The wrapped Spoon element.
     */
    public CtElement element() {
        return element;
    }

    @Override
    public String toString() {
        return kind() + "[" + element.getClass().getSimpleName() + "]";
    }
}
