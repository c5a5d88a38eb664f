package dev.roshin.complexityscanner.analysis.complexity;

import dev.roshin.complexityscanner.analysis.ast.NodeKind;
import dev.roshin.complexityscanner.analysis.ast.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Computes the cyclomatic complexity of a function body.
 * <p>
 * Complexity is {@code 1 + d}, where {@code d} is the number of decision constructs
 * anywhere in the body: if, switch, for, while, do-while and the ternary conditional.
 * Each construct counts once no matter how many arms it has, so a switch with ten
 * cases adds 1. Nested constructs are counted independently.
 */
public class ComplexityCalculator {
    private static final Logger log = LoggerFactory.getLogger(ComplexityCalculator.class);

    /**
     * Returned for a missing body. Never a valid complexity, which is at least 1.
     */
    public static final int NO_BODY = 0;

    /**
     * Computes the complexity of the body rooted at {@code body}.
     *
     * @param body root statement of a function body
     * @return complexity (at least 1), or {@link #NO_BODY} if {@code body} is null
     */
    public int calculate(SyntaxNode body) {
        if (body == null) {
            log.debug("Null statement encountered where a function body was expected");
            return NO_BODY;
        }
        return Math.addExact(1, countDecisionPoints(body));
    }

    /**
     * Counts decision constructs in the subtree rooted at {@code root}, root included.
     * Uses an explicit stack so deeply nested expressions cannot overflow the call stack.
     */
    public int countDecisionPoints(SyntaxNode root) {
        int count = 0;
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            count = Math.addExact(count, weight(node.kind()));

            List<? extends SyntaxNode> children = node.children();
            if (children == null) {
                continue;
            }
            for (SyntaxNode child : children) {
                if (child != null) {
                    pending.push(child);
                }
            }
        }
        return count;
    }

    /**
     * Contribution of a single node, not counting its children.
     */
    static int weight(NodeKind kind) {
        if (kind == null) {
            return 0;
        }
        return switch (kind) {
            case IF, SWITCH, FOR, WHILE, DO_WHILE, CONDITIONAL -> 1;
            default -> 0;
        };
    }
}
