package com.carbonlang.semantics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CarbonTest {
    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
    private PrintStream originalErr;

    @BeforeEach
    public void captureErrors() {
        Carbon.resetErrors();
        originalErr = System.err;
        System.setErr(new PrintStream(errors, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restoreErrors() {
        System.setErr(originalErr);
        Carbon.resetErrors();
    }

    @Test
    public void reportsBreakOutsideLoop() {
        SourceLocation location = new SourceLocation("main.carbon", 4);
        Ast ast = new Ast(List.of(new Declaration.Function("Main",
                ReturnTerm.omitted(), new Stmt.Block(location, List.of(new Stmt.Break(location))))));

        Carbon.resolveControlFlow(ast);

        assertTrue(Carbon.hadError());
        assertEquals("COMPILATION ERROR: main.carbon:4: break is not within a loop body",
                errors.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    public void validProgramReportsNothing() {
        SourceLocation location = new SourceLocation("main.carbon", 1);
        Stmt.Return ret = new Stmt.Return(location, new Expr.Literal(location, 0));
        Ast ast = new Ast(List.of(new Declaration.Function("Main",
                ReturnTerm.auto(), new Stmt.Block(location, List.of(ret)))));

        Carbon.resolveControlFlow(ast);

        assertFalse(Carbon.hadError());
        assertEquals("", errors.toString(StandardCharsets.UTF_8));
        assertTrue(ret.isResolved());
    }
}
