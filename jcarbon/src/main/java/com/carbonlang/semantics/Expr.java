package com.carbonlang.semantics;

import java.util.List;

public abstract class Expr {
    interface Visitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitCallExpr(Call expr);
        R visitTupleExpr(Tuple expr);
    }

    final SourceLocation location;

    Expr(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation location() {
        return location;
    }

    abstract <R> R accept(Visitor<R> visitor);

    public static class Literal extends Expr {
        public Literal(SourceLocation location, Object value) {
            super(location);
            this.value = value;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        final Object value;
    }

    public static class Identifier extends Expr {
        public Identifier(SourceLocation location, String name) {
            super(location);
            this.name = name;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        final String name;
    }

    public static class Binary extends Expr {
        public Binary(Expr left, String operator, Expr right) {
            super(left.location);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        final Expr left;
        final String operator;
        final Expr right;
    }

    public static class Call extends Expr {
        public Call(Expr callee, List<Expr> arguments) {
            super(callee.location);
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        final Expr callee;
        final List<Expr> arguments;
    }

    public static class Tuple extends Expr {
        public Tuple(SourceLocation location, List<Expr> fields) {
            super(location);
            this.fields = List.copyOf(fields);
        }

        // The `()` value, used where a return omits its expression.
        static Tuple empty(SourceLocation location) {
            return new Tuple(location, List.of());
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitTupleExpr(this);
        }

        final List<Expr> fields;
    }
}
