package com.carbonlang.semantics;

public class CompilationError extends RuntimeException {
    public enum Kind {
        // A jump with nothing to jump to: return outside a function, break or continue outside a loop.
        STRUCTURAL,
        // A return whose value presence disagrees with the function's return term.
        CONTRACT_MISMATCH,
        // More than one return in a function with an `auto` return type.
        CONTRACT_VIOLATION
    }

    final Kind kind;
    final SourceLocation location;

    CompilationError(Kind kind, SourceLocation location, String message) {
        super(message);
        this.kind = kind;
        this.location = location;
    }

    public Kind kind() {
        return kind;
    }

    public SourceLocation location() {
        return location;
    }
}
