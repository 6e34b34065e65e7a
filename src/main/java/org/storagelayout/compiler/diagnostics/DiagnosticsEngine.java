package org.storagelayout.compiler.diagnostics;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the layout pass.
 * <p>
 * This decouples error reporting from the actual layout logic. The engine only
 * records what is reported and where; rendering is left to the caller.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The code of the error.
     * @param message The error message.
     * @param source  The location of the error.
     * @return The recorded diagnostic, so that notes can be attached.
     */
    public Diagnostic reportError(CompilerErrorCode code, String message, SourceInfo source) {
        return add(new Diagnostic(Diagnostic.Type.ERROR, code, message, source));
    }

    /**
     * Reports a warning.
     *
     * @param code    The code of the warning.
     * @param message The warning message.
     * @param source  The location of the warning.
     * @return The recorded diagnostic, so that notes can be attached.
     */
    public Diagnostic reportWarning(CompilerErrorCode code, String message, SourceInfo source) {
        return add(new Diagnostic(Diagnostic.Type.WARNING, code, message, source));
    }

    private Diagnostic add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        CompilerLogger.debug("Reported " + diagnostic);
        return diagnostic;
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns all diagnostics with the given code.
     *
     * @param code The code to filter by.
     * @return The matching diagnostics in reporting order.
     */
    public List<Diagnostic> withCode(CompilerErrorCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
