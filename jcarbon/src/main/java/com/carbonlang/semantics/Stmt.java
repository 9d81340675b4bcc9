package com.carbonlang.semantics;

import java.util.List;

public abstract class Stmt {
    interface Visitor<R> {
        R visitReturnStmt(Return stmt);
        R visitBreakStmt(Break stmt);
        R visitContinueStmt(Continue stmt);
        R visitIfStmt(If stmt);
        R visitBlockStmt(Block stmt);
        R visitWhileStmt(While stmt);
        R visitMatchStmt(Match stmt);
        R visitContinuationStmt(Continuation stmt);
        R visitExpressionStmt(ExpressionStatement stmt);
        R visitAssignStmt(Assign stmt);
        R visitVariableDefinitionStmt(VariableDefinition stmt);
        R visitRunStmt(Run stmt);
        R visitAwaitStmt(Await stmt);
    }

    final SourceLocation location;

    Stmt(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation location() {
        return location;
    }

    abstract <R> R accept(Visitor<R> visitor);

    public static class Return extends Stmt {
        private Declaration.Function function;

        // `return;` carries the empty tuple so evaluation always has a value.
        public Return(SourceLocation location) {
            this(location, Expr.Tuple.empty(location), true);
        }

        public Return(SourceLocation location, Expr value) {
            this(location, value, false);
        }

        private Return(SourceLocation location, Expr value, boolean omittedExpression) {
            super(location);
            this.value = value;
            this.omittedExpression = omittedExpression;
        }

        public boolean isOmittedExpression() {
            return omittedExpression;
        }

        public boolean isResolved() {
            return function != null;
        }

        /** The function this statement returns from. Only available once control flow is resolved. */
        public Declaration.Function function() {
            if (function == null) {
                throw new IllegalStateException("return at " + location + " has not been resolved");
            }
            return function;
        }

        void setFunction(Declaration.Function function) {
            if (this.function != null) {
                throw new IllegalStateException(
                        "return at " + location + " is already resolved to " + this.function.name());
            }
            this.function = function;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturnStmt(this);
        }

        final Expr value;
        final boolean omittedExpression;
    }

    /** Shared by break and continue: both jump relative to the innermost enclosing loop. */
    public abstract static class Jump extends Stmt {
        private While loop;

        Jump(SourceLocation location) {
            super(location);
        }

        public boolean isResolved() {
            return loop != null;
        }

        public While loop() {
            if (loop == null) {
                throw new IllegalStateException(keyword() + " at " + location + " has not been resolved");
            }
            return loop;
        }

        void setLoop(While loop) {
            if (this.loop != null) {
                throw new IllegalStateException(keyword() + " at " + location + " is already resolved");
            }
            this.loop = loop;
        }

        abstract String keyword();
    }

    public static class Break extends Jump {
        public Break(SourceLocation location) {
            super(location);
        }

        @Override
        String keyword() {
            return "break";
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreakStmt(this);
        }
    }

    public static class Continue extends Jump {
        public Continue(SourceLocation location) {
            super(location);
        }

        @Override
        String keyword() {
            return "continue";
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinueStmt(this);
        }
    }

    public static class If extends Stmt {
        public If(SourceLocation location, Expr condition, Block thenBlock, Stmt elseBlock) {
            super(location);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public If(SourceLocation location, Expr condition, Block thenBlock) {
            this(location, condition, thenBlock, null);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStmt(this);
        }

        final Expr condition;
        final Block thenBlock;
        // Either a Block or, for `else if`, another If. Null when there is no else.
        final Stmt elseBlock;
    }

    public static class Block extends Stmt {
        public Block(SourceLocation location, List<Stmt> statements) {
            super(location);
            this.statements = List.copyOf(statements);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlockStmt(this);
        }

        final List<Stmt> statements;
    }

    public static class While extends Stmt {
        public While(SourceLocation location, Expr condition, Block body) {
            super(location);
            this.condition = condition;
            this.body = body;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileStmt(this);
        }

        final Expr condition;
        final Block body;
    }

    public static class Match extends Stmt {
        public record Clause(Expr pattern, Stmt statement) {
        }

        public Match(SourceLocation location, Expr expression, List<Clause> clauses) {
            super(location);
            this.expression = expression;
            this.clauses = List.copyOf(clauses);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatchStmt(this);
        }

        final Expr expression;
        final List<Clause> clauses;
    }

    public static class Continuation extends Stmt {
        public Continuation(SourceLocation location, String name, Block body) {
            super(location);
            this.name = name;
            this.body = body;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinuationStmt(this);
        }

        final String name;
        final Block body;
    }

    public static class ExpressionStatement extends Stmt {
        public ExpressionStatement(Expr expression) {
            super(expression.location());
            this.expression = expression;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStmt(this);
        }

        final Expr expression;
    }

    public static class Assign extends Stmt {
        public Assign(SourceLocation location, Expr lhs, Expr rhs) {
            super(location);
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignStmt(this);
        }

        final Expr lhs;
        final Expr rhs;
    }

    public static class VariableDefinition extends Stmt {
        public VariableDefinition(SourceLocation location, String name, Expr init) {
            super(location);
            this.name = name;
            this.init = init;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableDefinitionStmt(this);
        }

        final String name;
        final Expr init;
    }

    public static class Run extends Stmt {
        public Run(SourceLocation location, Expr argument) {
            super(location);
            this.argument = argument;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitRunStmt(this);
        }

        final Expr argument;
    }

    public static class Await extends Stmt {
        public Await(SourceLocation location) {
            super(location);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwaitStmt(this);
        }
    }
}
