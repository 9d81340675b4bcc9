package com.carbonlang.semantics;

/**
 * Pipeline entry for the control-flow stage. Callers check {@link #hadError}
 * before handing the tree on to evaluation.
 */
public class Carbon {
    static boolean hadError = false;

    public static void resolveControlFlow(Ast ast) {
        try {
            new ControlFlowResolver().resolveControlFlow(ast);
        } catch (CompilationError error) {
            compilationError(error);
        }
    }

    public static boolean hadError() {
        return hadError;
    }

    public static void resetErrors() {
        hadError = false;
    }

    static void compilationError(CompilationError error) {
        report(error.location(), error.getMessage());
    }

    private static void report(SourceLocation location, String message) {
        System.err.println("COMPILATION ERROR: " + location + ": " + message);
        hadError = true;
    }
}
