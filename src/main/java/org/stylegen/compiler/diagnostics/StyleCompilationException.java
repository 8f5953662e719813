package org.stylegen.compiler.diagnostics;

/**
 * Base class of every error raised while compiling style sources.
 * <p>
 * All compile errors are deterministic and non-retryable: the compiler stops at the first
 * one and reports its code, location and message. This is a RuntimeException because the
 * errors surface deep inside recursive resolution and are only handled at the top level.
 */
public abstract class StyleCompilationException extends RuntimeException {

    private final CompilerErrorCode code;
    private final SourceLocation location;

    /**
     * @param code     The error code.
     * @param location Where the error was detected.
     * @param message  Human-readable description, without the location prefix.
     */
    protected StyleCompilationException(CompilerErrorCode code, SourceLocation location, String message) {
        super(message);
        this.code = code;
        this.location = location;
    }

    /**
     * @param code     The error code.
     * @param location Where the error was detected.
     * @param message  Human-readable description, without the location prefix.
     * @param cause    The underlying exception.
     */
    protected StyleCompilationException(CompilerErrorCode code, SourceLocation location, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.location = location;
    }

    public CompilerErrorCode code() {
        return code;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Formats the error the way the command line reports it,
     * e.g. {@code ui/basic.style:12:5: error[TYPE_MISMATCH]: ...}.
     *
     * @return The formatted report line.
     */
    public String format() {
        String where = location != null ? location.toString() : "<unknown>";
        return where + ": error[" + code + "]: " + getMessage();
    }
}
