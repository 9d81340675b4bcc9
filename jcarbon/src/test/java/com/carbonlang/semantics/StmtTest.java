package com.carbonlang.semantics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StmtTest {
    private static final SourceLocation LOC = new SourceLocation("stmt.carbon", 3);

    private static Stmt.While emptyLoop() {
        return new Stmt.While(LOC, new Expr.Literal(LOC, true), new Stmt.Block(LOC, List.of()));
    }

    @Test
    public void unresolvedJumpHasNoLoop() {
        Stmt.Break stmt = new Stmt.Break(LOC);
        assertFalse(stmt.isResolved());
        IllegalStateException error = assertThrows(IllegalStateException.class, stmt::loop);
        assertEquals("break at stmt.carbon:3 has not been resolved", error.getMessage());
    }

    @Test
    public void loopIsSetOnce() {
        Stmt.While loop = emptyLoop();
        Stmt.Continue stmt = new Stmt.Continue(LOC);
        stmt.setLoop(loop);
        assertTrue(stmt.isResolved());
        assertSame(loop, stmt.loop());

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> stmt.setLoop(emptyLoop()));
        assertEquals("continue at stmt.carbon:3 is already resolved", error.getMessage());
        assertSame(loop, stmt.loop());
    }

    @Test
    public void functionIsSetOnce() {
        Declaration.Function function = new Declaration.Function("F", ReturnTerm.omitted());
        Stmt.Return stmt = new Stmt.Return(LOC);
        assertThrows(IllegalStateException.class, stmt::function);

        stmt.setFunction(function);
        assertSame(function, stmt.function());
        IllegalStateException error = assertThrows(IllegalStateException.class, () -> stmt.setFunction(function));
        assertEquals("return at stmt.carbon:3 is already resolved to F", error.getMessage());
    }

    @Test
    public void omittedReturnCarriesEmptyTuple() {
        Stmt.Return stmt = new Stmt.Return(LOC);
        assertTrue(stmt.isOmittedExpression());
        assertTrue(stmt.value instanceof Expr.Tuple tuple && tuple.fields.isEmpty());
        assertFalse(new Stmt.Return(LOC, new Expr.Tuple(LOC, List.of())).isOmittedExpression());
    }
}
