package dev.roshin.complexityscanner.analysis.complexity;

import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;
import dev.roshin.complexityscanner.analysis.ast.FunctionDeclaration;
import dev.roshin.complexityscanner.analysis.ast.SyntaxNode;
import dev.roshin.complexityscanner.analysis.ast.TranslationUnit;
import dev.roshin.complexityscanner.analysis.diagnostics.DiagnosticId;
import dev.roshin.complexityscanner.analysis.diagnostics.Diagnostics;
import dev.roshin.complexityscanner.analysis.diagnostics.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Walks a translation unit, finds every function declaration and records the
 * complexity of each eligible definition.
 * <p>
 * Nested declarations (closures, methods of local and anonymous classes) are visited
 * as functions of their own. A failure on one declaration is logged and skipped so
 * the rest of the unit is still analyzed.
 */
public class FunctionWalker {
    private static final Logger log = LoggerFactory.getLogger(FunctionWalker.class);

    public static final String COMPLEXITY_TEMPLATE = "Cyclomatic Complexity: {}";

    private final ComplexityCalculator calculator;
    private final HeaderFilter headerFilter;
    private final Diagnostics diagnostics;
    private final DiagnosticId complexityRemark;

    public FunctionWalker(ComplexityCalculator calculator, HeaderFilter headerFilter, Diagnostics diagnostics) {
        this.calculator = calculator;
        this.headerFilter = headerFilter;
        this.diagnostics = diagnostics;
        this.complexityRemark = diagnostics.registerCustomMessage(Severity.REMARK, COMPLEXITY_TEMPLATE);
    }

    /**
     * Walks the unit and records results into {@code complexities}.
     *
     * @param unit         translation unit to analyze
     * @param complexities map owned by the current run
     * @return counters describing what was visited
     */
    public WalkSummary walk(TranslationUnit unit, ComplexityMap complexities) {
        log.debug("Walking translation unit {}", unit.name());
        Counters counters = new Counters();

        Deque<SyntaxNode> pending = new ArrayDeque<>();
        SyntaxNode root = unit.root();
        if (root != null) {
            pending.push(root);
        }

        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();

            if (node instanceof FunctionDeclaration function) {
                try {
                    visitFunction(function, complexities, counters);
                } catch (RuntimeException e) {
                    log.warn("Skipping declaration after error: {}", e.getMessage());
                    counters.warnings.add("Function analysis failed: " + e.getMessage());
                }
            }

            pushChildren(node, pending, counters);
        }

        WalkSummary summary = counters.toSummary();
        log.debug("Finished {}: {}", unit.name(), summary);
        return summary;
    }

    private void visitFunction(FunctionDeclaration function, ComplexityMap complexities, Counters counters) {
        if (headerFilter.isExcluded(function)) {
            counters.excluded++;
            return;
        }
        if (!function.hasBody()) {
            counters.withoutBody++;
            return;
        }

        String name = function.displayName();
        int complexity = calculator.calculate(function.body());
        if (complexity == ComplexityCalculator.NO_BODY) {
            log.debug("Function {} has no body to analyze", name);
            counters.anomalies++;
            return;
        }

        // A failed report must leave the map and counters untouched
        DeclarationLocation location = function.location();
        diagnostics.report(location, complexityRemark, complexity);

        OptionalInt previous = complexities.record(name, complexity);
        if (previous.isPresent()) {
            log.debug("Complexity of {} replaced: {} -> {}", name, previous.getAsInt(), complexity);
            counters.overwritten++;
        }
        counters.analyzed++;
    }

    private void pushChildren(SyntaxNode node, Deque<SyntaxNode> pending, Counters counters) {
        List<? extends SyntaxNode> children;
        try {
            children = node.children();
        } catch (RuntimeException e) {
            log.warn("Could not enumerate children of {} node: {}", node.kind(), e.getMessage());
            counters.warnings.add("Child enumeration failed: " + e.getMessage());
            return;
        }
        if (children == null) {
            return;
        }
        // Reverse push keeps source order when popping
        for (int i = children.size() - 1; i >= 0; i--) {
            SyntaxNode child = children.get(i);
            if (child != null) {
                pending.push(child);
            }
        }
    }

    private static final class Counters {
        int analyzed;
        int excluded;
        int withoutBody;
        int anomalies;
        int overwritten;
        final List<String> warnings = new ArrayList<>();

        WalkSummary toSummary() {
            return new WalkSummary(analyzed, excluded, withoutBody, anomalies, overwritten, List.copyOf(warnings));
        }
    }
}
