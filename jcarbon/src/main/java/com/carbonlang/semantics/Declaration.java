package com.carbonlang.semantics;

import java.util.List;

public abstract class Declaration {
    interface Visitor<R> {
        R visitFunctionDeclaration(Function declaration);
        R visitClassDeclaration(Class declaration);
        R visitChoiceDeclaration(Choice declaration);
        R visitVariableDeclaration(Variable declaration);
    }

    final String name;

    Declaration(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    abstract <R> R accept(Visitor<R> visitor);

    public static class Function extends Declaration {
        public Function(String name, ReturnTerm returnTerm, Stmt.Block body) {
            super(name);
            this.returnTerm = returnTerm;
            this.body = body;
        }

        // Forward declaration, e.g. an interface method with no body.
        public Function(String name, ReturnTerm returnTerm) {
            this(name, returnTerm, null);
        }

        public ReturnTerm returnTerm() {
            return returnTerm;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDeclaration(this);
        }

        final ReturnTerm returnTerm;
        final Stmt.Block body;
    }

    public static class Class extends Declaration {
        public Class(String name, List<Declaration> members) {
            super(name);
            this.members = List.copyOf(members);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitClassDeclaration(this);
        }

        final List<Declaration> members;
    }

    public static class Choice extends Declaration {
        public Choice(String name) {
            super(name);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoiceDeclaration(this);
        }
    }

    public static class Variable extends Declaration {
        public Variable(String name) {
            super(name);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableDeclaration(this);
        }
    }
}
