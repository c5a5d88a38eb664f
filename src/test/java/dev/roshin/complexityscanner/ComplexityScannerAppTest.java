package dev.roshin.complexityscanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ComplexityScannerAppTest {

    @TempDir
    Path dir;

    @Test
    void wrongArgumentCountIsAUsageError() {
        assertEquals(ComplexityScannerApp.EXIT_USAGE, ComplexityScannerApp.run(new String[0]));
        assertEquals(ComplexityScannerApp.EXIT_USAGE, ComplexityScannerApp.run(new String[]{"a", "b", "c"}));
    }

    @Test
    void missingSourceIsAUsageError() {
        assertEquals(ComplexityScannerApp.EXIT_USAGE,
                ComplexityScannerApp.run(new String[]{dir.resolve("nope").toString()}));
    }

    @Test
    void writesReportToGivenPath() throws IOException {
        Path source = Files.writeString(dir.resolve("Tool.java"), """
                public class Tool {
                    int loop(int n) {
                        while (n > 0) {
                            n--;
                        }
                        return n;
                    }
                }
                """);
        Path report = dir.resolve("tool.cy");

        int exit = ComplexityScannerApp.run(new String[]{source.toString(), report.toString()});

        assertEquals(ComplexityScannerApp.EXIT_OK, exit);
        assertEquals(List.of("Function: loop, Cyclomatic Complexity: 2"), Files.readAllLines(report));
    }

    @Test
    void unwritableReportFails() throws IOException {
        Path source = Files.writeString(dir.resolve("Tool.java"), "public class Tool { void f() { } }");

        assertEquals(ComplexityScannerApp.EXIT_FAILED,
                ComplexityScannerApp.run(new String[]{source.toString(), dir.toString()}));
    }
}
