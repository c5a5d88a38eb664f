package dev.roshin.complexityscanner.analysis.diagnostics;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics engine that renders messages in compiler style
 * ({@code file:line:column: remark: message}) and writes them through SLF4J.
 * Every emitted diagnostic is also retained so the host can inspect them after the run.
 */
public class LoggingDiagnostics implements Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnostics.class);

    private final Map<String, DiagnosticId> registered = new HashMap<>();
    private final List<Diagnostic> emitted = new ArrayList<>();

    @Override
    public DiagnosticId registerCustomMessage(Severity severity, String template) {
        Preconditions.checkNotNull(severity, "severity");
        Preconditions.checkNotNull(template, "template");

        String key = severity + "|" + template;
        return registered.computeIfAbsent(key, k -> {
            DiagnosticId id = new DiagnosticId(registered.size() + 1, severity, template);
            log.debug("Registered diagnostic #{} [{}] '{}'", id.id(), severity.label(), template);
            return id;
        });
    }

    @Override
    public void report(DeclarationLocation location, DiagnosticId id, Object... arguments) {
        Preconditions.checkNotNull(id, "id");
        if (!registered.containsValue(id)) {
            throw new IllegalArgumentException("Diagnostic #" + id.id() + " was not registered with this engine");
        }

        String message = MessageFormatter.arrayFormat(id.template(), arguments).getMessage();
        Diagnostic diagnostic = new Diagnostic(location, id.severity(), message);
        emitted.add(diagnostic);

        switch (id.severity()) {
            case ERROR -> log.error("{}", diagnostic);
            case WARNING -> log.warn("{}", diagnostic);
            default -> log.info("{}", diagnostic);
        }
    }

    /**
     * Diagnostics emitted so far, in emission order.
     */
    public List<Diagnostic> emitted() {
        return ImmutableList.copyOf(emitted);
    }
}
