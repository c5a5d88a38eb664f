package dev.roshin.complexityscanner.analysis.spoon;

import dev.roshin.complexityscanner.analysis.complexity.ComplexityRun;
import dev.roshin.complexityscanner.analysis.complexity.RunResult;
import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import dev.roshin.complexityscanner.analysis.diagnostics.LoggingDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import spoon.reflect.CtModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the analyzer over real Java sources parsed by Spoon.
 */
class SpoonComplexityTest {

    @TempDir
    Path dir;

    private SortedMap<String, Integer> analyze(String className, String source) throws IOException {
        return run(className, source).complexities();
    }

    private RunResult run(String className, String source) throws IOException {
        Path sources = dir.resolve("src");
        Path file = sources.resolve("demo").resolve(className + ".java");
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);

        AnalysisConfig config = AnalysisConfig.DEFAULT.withReportPath(dir.resolve("results.cy"));
        CtModel model = new SpoonModelBuilder().build(List.of(sources), config);
        return new ComplexityRun(config, new LoggingDiagnostics()).execute(new SpoonTranslationUnit("demo", model));
    }

    @Test
    void straightLineMethodHasComplexityOne() throws IOException {
        SortedMap<String, Integer> result = analyze("Calc", """
                package demo;

                public class Calc {
                    public int add(int a, int b) {
                        int sum = a + b;
                        return sum;
                    }
                }
                """);

        assertEquals(Map.of("add", 1), result);
    }

    @Test
    void elseIfChainCountsEveryIf() throws IOException {
        SortedMap<String, Integer> result = analyze("Calc", """
                package demo;

                public class Calc {
                    public int combine(int a, int b) {
                        if (a > b) return a + b;
                        else if (a < b) return a - b;
                        else return a * b;
                    }
                }
                """);

        assertEquals(3, result.get("combine"));
    }

    @Test
    void ifInsideLoopAddsToTheLoop() throws IOException {
        SortedMap<String, Integer> result = analyze("Calc", """
                package demo;

                public class Calc {
                    public int sumEven(int n) {
                        int s = 0;
                        for (int i = 0; i < n; i++) {
                            if (i % 2 == 0) {
                                s += i;
                            }
                        }
                        return s;
                    }
                }
                """);

        assertEquals(3, result.get("sumEven"));
    }

    @Test
    void switchWithManyArmsCountsOnce() throws IOException {
        SortedMap<String, Integer> result = analyze("Days", """
                package demo;

                public class Days {
                    public String name(int day) {
                        switch (day) {
                            case 1: return "mon";
                            case 2: return "tue";
                            case 3: return "wed";
                            case 4: return "thu";
                            default: return "weekend";
                        }
                    }
                }
                """);

        assertEquals(2, result.get("name"));
    }

    @Test
    void loopsTernaryAndSwitchExpressionAreAllDecisions() throws IOException {
        SortedMap<String, Integer> result = analyze("Mixed", """
                package demo;

                import java.util.List;

                public class Mixed {
                    public int run(List<Integer> values, int mode) {
                        int total = 0;
                        for (int v : values) {
                            total += v > 0 ? v : -v;
                        }
                        while (total > 100) {
                            total /= 2;
                        }
                        do {
                            total++;
                        } while (total < 3);
                        return switch (mode) {
                            case 0 -> total;
                            default -> -total;
                        };
                    }
                }
                """);

        // for-each, ternary, while, do-while, switch expression
        assertEquals(6, result.get("run"));
    }

    @Test
    void logicalOperatorsAndCatchDoNotCount() throws IOException {
        SortedMap<String, Integer> result = analyze("Guard", """
                package demo;

                public class Guard {
                    public boolean check(String s) {
                        try {
                            return s != null && !s.isEmpty() || s.length() > 3;
                        } catch (RuntimeException e) {
                            return false;
                        }
                    }
                }
                """);

        assertEquals(1, result.get("check"));
    }

    @Test
    void overloadsShareOneEntryHoldingTheLastValue() throws IOException {
        SortedMap<String, Integer> result = analyze("Shapes", """
                package demo;

                public class Shapes {
                    public double area(double r) {
                        if (r < 0) {
                            return 0;
                        }
                        return Math.PI * r * r;
                    }

                    public double area(double w, double h) {
                        return w * h;
                    }
                }
                """);

        assertEquals(Map.of("area", 1), result);
    }

    @Test
    void constructorsUseTheClassNameAndAbstractMethodsAreSkipped() throws IOException {
        RunResult result = run("Account", """
                package demo;

                public abstract class Account {
                    private int balance;

                    public Account(int initial) {
                        balance = initial < 0 ? 0 : initial;
                    }

                    public abstract int fee();
                }
                """);

        assertEquals(Map.of("Account", 2), result.complexities());
        assertEquals(1, result.summary().declarationsWithoutBody());
    }

    @Test
    void implicitDefaultConstructorIsNotReported() throws IOException {
        SortedMap<String, Integer> result = analyze("Plain", """
                package demo;

                public class Plain {
                    public void noop() {
                    }
                }
                """);

        assertEquals(Map.of("noop", 1), result);
    }

    @Test
    void lambdasAreReportedSeparatelyAndCountInsideTheirEnclosingMethod() throws IOException {
        SortedMap<String, Integer> result = analyze("Streams", """
                package demo;

                import java.util.List;

                public class Streams {
                    public long positives(List<Integer> xs) {
                        return xs.stream().filter(x -> x > 0 ? true : false).count();
                    }
                }
                """);

        assertEquals(2, result.get("positives"));
        List<Map.Entry<String, Integer>> others = result.entrySet().stream()
                .filter(e -> !e.getKey().equals("positives"))
                .toList();
        assertEquals(1, others.size());
        assertEquals(2, others.get(0).getValue());
    }

    @Test
    void lambdasInDifferentClassesShareGeneratedNames() throws IOException {
        Path sources = dir.resolve("src/demo");
        Files.createDirectories(sources);
        Files.writeString(sources.resolve("A.java"), """
                package demo;

                import java.util.function.IntUnaryOperator;

                public class A {
                    IntUnaryOperator r() {
                        return x -> {
                            if (x > 0) {
                                return x;
                            }
                            return 0;
                        };
                    }
                }
                """);
        Files.writeString(sources.resolve("B.java"), """
                package demo;

                import java.util.function.IntUnaryOperator;

                public class B {
                    IntUnaryOperator s() {
                        return x -> {
                            while (x > 10) {
                                x--;
                            }
                            if (x < 0) {
                                return 0;
                            }
                            return x;
                        };
                    }
                }
                """);

        AnalysisConfig config = AnalysisConfig.DEFAULT.withReportPath(dir.resolve("results.cy"));
        CtModel model = new SpoonModelBuilder().build(List.of(dir.resolve("src")), config);
        RunResult result = new ComplexityRun(config, new LoggingDiagnostics())
                .execute(new SpoonTranslationUnit("demo", model));

        assertEquals(2, result.complexities().get("r"));
        assertEquals(3, result.complexities().get("s"));
        // Both lambdas are keyed by the same generated name; only one entry survives
        assertEquals(3, result.complexities().size());
        assertEquals(1, result.summary().overwrittenNames());
        assertEquals(4, result.summary().functionsAnalyzed());
    }

    @Test
    void methodsOfNestedTypesAreAnalyzed() throws IOException {
        SortedMap<String, Integer> result = analyze("Outer", """
                package demo;

                public class Outer {
                    static class Inner {
                        int clamp(int v) {
                            while (v > 10) {
                                v--;
                            }
                            return v;
                        }
                    }

                    int top() {
                        return 0;
                    }
                }
                """);

        assertEquals(Map.of("clamp", 2, "top", 1), result);
    }

    @Test
    void reportIsWrittenInNameOrder() throws IOException {
        RunResult result = run("Order", """
                package demo;

                public class Order {
                    void zulu() {
                    }

                    void alpha(boolean b) {
                        if (b) {
                            alpha(false);
                        }
                    }

                    void mike() {
                    }
                }
                """);

        assertTrue(result.reportWritten());
        assertEquals(List.of(
                "Function: alpha, Cyclomatic Complexity: 2",
                "Function: mike, Cyclomatic Complexity: 1",
                "Function: zulu, Cyclomatic Complexity: 1"), Files.readAllLines(result.reportPath()));
    }

    @Test
    void declarationsInSystemDirectoriesAreExcluded() throws IOException {
        Path generated = dir.resolve("generated/demo/Generated.java");
        Path user = dir.resolve("src/demo/User.java");
        Files.createDirectories(generated.getParent());
        Files.createDirectories(user.getParent());
        Files.writeString(generated, "package demo; public class Generated { int g(int x) { return x > 0 ? 1 : 0; } }");
        Files.writeString(user, "package demo; public class User { int u() { return 1; } }");

        AnalysisConfig config = AnalysisConfig.DEFAULT
                .withReportPath(dir.resolve("results.cy"))
                .withSystemDirectories(List.of(dir.resolve("generated")));
        CtModel model = new SpoonModelBuilder().build(List.of(dir.resolve("src"), dir.resolve("generated")), config);
        RunResult result = new ComplexityRun(config, new LoggingDiagnostics())
                .execute(new SpoonTranslationUnit("demo", model));

        assertEquals(Map.of("u", 1), result.complexities());
        assertFalse(result.complexities().containsKey("g"));
    }
}
