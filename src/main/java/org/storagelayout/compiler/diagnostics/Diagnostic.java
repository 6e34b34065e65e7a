package org.storagelayout.compiler.diagnostics;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the layout pass.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The testable code of the diagnostic.
 * @param message The diagnostic message.
 * @param source The primary source location, may be null.
 * @param notes Notes pointing at secondary locations.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceInfo source,
        List<Note> notes
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * A message attached to a diagnostic, citing a secondary location.
     *
     * @param message The note text.
     * @param source The secondary location, may be null.
     */
    public record Note(String message, SourceInfo source) {}

    /**
     * Creates a diagnostic without notes.
     * @param type The type of the diagnostic.
     * @param code The code of the diagnostic.
     * @param message The message.
     * @param source The primary location.
     */
    public Diagnostic(Type type, CompilerErrorCode code, String message, SourceInfo source) {
        this(type, code, message, source, new ArrayList<>());
    }

    /**
     * Attaches a note that cites a secondary location.
     * @param message The note text.
     * @param source The secondary location.
     * @return This diagnostic, for chaining.
     */
    public Diagnostic attachNote(String message, SourceInfo source) {
        notes.add(new Note(message, source));
        return this;
    }

    @Override
    public List<Note> notes() {
        return Collections.unmodifiableList(notes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%s] %s: %s", type, location(source), message));
        for (Note note : notes) {
            sb.append(String.format("%n  %s: note: %s", location(note.source()), note.message()));
        }
        return sb.toString();
    }

    private static String location(SourceInfo source) {
        return source != null ? source.fileName() + ":" + source.lineNumber() : "<unknown>";
    }
}
