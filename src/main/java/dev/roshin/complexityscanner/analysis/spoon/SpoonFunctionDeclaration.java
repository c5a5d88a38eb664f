package dev.roshin.complexityscanner.analysis.spoon;

import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;
import dev.roshin.complexityscanner.analysis.ast.FunctionDeclaration;
import dev.roshin.complexityscanner.analysis.ast.SyntaxNode;
import spoon.reflect.code.CtLambda;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtShadowable;
import spoon.reflect.declaration.CtType;

import java.io.File;

/**
 * A Spoon method, constructor or lambda seen as a {@link FunctionDeclaration}.
 */
public class SpoonFunctionDeclaration extends SpoonSyntaxNode implements FunctionDeclaration {

    private final CtExecutable<?> executable;

    SpoonFunctionDeclaration(CtExecutable<?> executable) {
        super(executable);
        this.executable = executable;
    }

    /**
     * Simple method name; the declaring class name for constructors; Spoon's
     * generated {@code lambda$N} name for lambdas.
     */
    @Override
    public String displayName() {
        if (executable instanceof CtConstructor<?> constructor) {
            CtType<?> declaringType = constructor.getDeclaringType();
            if (declaringType != null) {
                return declaringType.getSimpleName();
            }
        }
        return executable.getSimpleName();
    }

    /**
     * Null for implicit (compiler-generated) executables and for elements without a source file.
     */
    @Override
    public DeclarationLocation location() {
        if (executable.isImplicit()) {
            return null;
        }
        SourcePosition position = executable.getPosition();
        if (position == null || !position.isValidPosition()) {
            return null;
        }
        File file = position.getFile();
        if (file == null) {
            return null;
        }
        return new DeclarationLocation(file.getPath(), position.getLine(), position.getColumn(), isShadow());
    }

    @Override
    public boolean hasBody() {
        if (executable.getBody() != null) {
            return true;
        }
        return executable instanceof CtLambda<?> lambda && lambda.getExpression() != null;
    }

    /**
     * The body block, or the expression of an expression-bodied lambda.
     */
    @Override
    public SyntaxNode body() {
        if (executable.getBody() != null) {
            return wrap(executable.getBody());
        }
        if (executable instanceof CtLambda<?> lambda) {
            return wrap(lambda.getExpression());
        }
        return null;
    }

    /**
     * Shadow elements are built from compiled classpath types, not from analyzed sources.
     */
    private boolean isShadow() {
        return executable instanceof CtShadowable shadowable && shadowable.isShadow();
    }

    @Override
    public String toString() {
        return "Function[" + displayName() + "]";
    }
}
