package com.carbonlang.semantics;

/**
 * Links every return to the function it returns from and every break and
 * continue to the loop it jumps out of, rejecting jumps that have no valid
 * target. Runs after name resolution and before evaluation; the first
 * violation aborts with a {@link CompilationError}.
 */
public class ControlFlowResolver implements Declaration.Visitor<Void> {

    public void resolveControlFlow(Ast ast) {
        for (Declaration declaration : ast.declarations()) {
            resolveControlFlow(declaration);
        }
    }

    public void resolveControlFlow(Declaration declaration) {
        declaration.accept(this);
    }

    @Override
    public Void visitFunctionDeclaration(Declaration.Function declaration) {
        if (declaration.body != null) {
            resolve(declaration.body, null, new FunctionData(declaration));
        }
        return null;
    }

    @Override
    public Void visitClassDeclaration(Declaration.Class declaration) {
        // Each member starts over with its own function data.
        for (Declaration member : declaration.members) {
            resolveControlFlow(member);
        }
        return null;
    }

    @Override
    public Void visitChoiceDeclaration(Declaration.Choice declaration) {
        return null;
    }

    @Override
    public Void visitVariableDeclaration(Declaration.Variable declaration) {
        return null;
    }

    private static void resolve(Stmt stmt, Stmt.While loop, FunctionData function) {
        stmt.accept(new StatementResolver(loop, function));
    }

    // Aggregate information about the function whose body is being resolved.
    private static final class FunctionData {
        final Declaration.Function declaration;

        // Only meaningful when the return term is auto.
        boolean sawReturnInAuto = false;

        FunctionData(Declaration.Function declaration) {
            this.declaration = declaration;
        }
    }

    /**
     * Resolves the statements of one control region. {@code loop} is the
     * innermost loop statically enclosing the statements, or null if there is
     * none. {@code function} is null when the statements do not belong to a
     * function body, for example inside a continuation.
     */
    private static final class StatementResolver implements Stmt.Visitor<Void> {
        private final Stmt.While loop;
        private final FunctionData function;

        StatementResolver(Stmt.While loop, FunctionData function) {
            this.loop = loop;
            this.function = function;
        }

        @Override
        public Void visitReturnStmt(Stmt.Return stmt) {
            if (function == null) {
                throw new CompilationError(CompilationError.Kind.STRUCTURAL, stmt.location,
                        "return is not within a function body");
            }
            ReturnTerm returnTerm = function.declaration.returnTerm();
            if (returnTerm.isAuto()) {
                if (function.sawReturnInAuto) {
                    throw new CompilationError(CompilationError.Kind.CONTRACT_VIOLATION, stmt.location,
                            "Only one return is allowed in a function with an `auto` return type.");
                }
                function.sawReturnInAuto = true;
            }
            stmt.setFunction(function.declaration);
            if (stmt.isOmittedExpression() != returnTerm.isOmitted()) {
                throw new CompilationError(CompilationError.Kind.CONTRACT_MISMATCH, stmt.location,
                        new AstPrinter().print(stmt) + " should" + (returnTerm.isOmitted() ? " not" : "")
                                + " provide a return value, to match the function's signature.");
            }
            return null;
        }

        @Override
        public Void visitBreakStmt(Stmt.Break stmt) {
            bindToLoop(stmt);
            return null;
        }

        @Override
        public Void visitContinueStmt(Stmt.Continue stmt) {
            bindToLoop(stmt);
            return null;
        }

        private void bindToLoop(Stmt.Jump stmt) {
            if (loop == null) {
                throw new CompilationError(CompilationError.Kind.STRUCTURAL, stmt.location,
                        stmt.keyword() + " is not within a loop body");
            }
            stmt.setLoop(loop);
        }

        @Override
        public Void visitIfStmt(Stmt.If stmt) {
            stmt.thenBlock.accept(this);
            if (stmt.elseBlock != null) {
                stmt.elseBlock.accept(this);
            }
            return null;
        }

        @Override
        public Void visitBlockStmt(Stmt.Block stmt) {
            for (Stmt statement : stmt.statements) {
                statement.accept(this);
            }
            return null;
        }

        @Override
        public Void visitWhileStmt(Stmt.While stmt) {
            resolve(stmt.body, stmt, function);
            return null;
        }

        @Override
        public Void visitMatchStmt(Stmt.Match stmt) {
            // Clauses open neither a loop nor a function.
            for (Stmt.Match.Clause clause : stmt.clauses) {
                clause.statement().accept(this);
            }
            return null;
        }

        @Override
        public Void visitContinuationStmt(Stmt.Continuation stmt) {
            // A continuation body is its own control region: nothing outside it can be jumped to.
            resolve(stmt.body, null, null);
            return null;
        }

        @Override
        public Void visitExpressionStmt(Stmt.ExpressionStatement stmt) {
            return null;
        }

        @Override
        public Void visitAssignStmt(Stmt.Assign stmt) {
            return null;
        }

        @Override
        public Void visitVariableDefinitionStmt(Stmt.VariableDefinition stmt) {
            return null;
        }

        @Override
        public Void visitRunStmt(Stmt.Run stmt) {
            return null;
        }

        @Override
        public Void visitAwaitStmt(Stmt.Await stmt) {
            return null;
        }
    }
}
