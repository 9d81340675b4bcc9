package com.carbonlang.semantics;

import java.util.List;

/** Renders expressions and statements back to source form, on a single line. */
public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
    public String print(Expr expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        if (expr.value == null) return "()";
        if (expr.value instanceof String string) {
            return "\"" + string.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return expr.value.toString();
    }

    @Override
    public String visitIdentifierExpr(Expr.Identifier expr) {
        return expr.name;
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return operand(expr.left) + " " + expr.operator + " " + operand(expr.right);
    }

    // Nested binaries are always grouped so the printed text keeps the tree's shape.
    private String operand(Expr expr) {
        if (expr instanceof Expr.Binary) return "(" + print(expr) + ")";
        return print(expr);
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        return print(expr.callee) + parenthesize(expr.arguments);
    }

    @Override
    public String visitTupleExpr(Expr.Tuple expr) {
        // A one-element tuple needs the trailing comma to stay distinct from grouping.
        if (expr.fields.size() == 1) {
            return "(" + print(expr.fields.get(0)) + ",)";
        }
        return parenthesize(expr.fields);
    }

    @Override
    public String visitReturnStmt(Stmt.Return stmt) {
        if (stmt.isOmittedExpression()) return "return;";
        return "return " + print(stmt.value) + ";";
    }

    @Override
    public String visitBreakStmt(Stmt.Break stmt) {
        return "break;";
    }

    @Override
    public String visitContinueStmt(Stmt.Continue stmt) {
        return "continue;";
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append("if (").append(print(stmt.condition)).append(") ").append(print(stmt.thenBlock));
        if (stmt.elseBlock != null) {
            builder.append(" else ").append(print(stmt.elseBlock));
        }
        return builder.toString();
    }

    @Override
    public String visitBlockStmt(Stmt.Block stmt) {
        if (stmt.statements.isEmpty()) return "{ }";
        StringBuilder builder = new StringBuilder("{");
        for (Stmt statement : stmt.statements) {
            builder.append(' ').append(print(statement));
        }
        builder.append(" }");
        return builder.toString();
    }

    @Override
    public String visitWhileStmt(Stmt.While stmt) {
        return "while (" + print(stmt.condition) + ") " + print(stmt.body);
    }

    @Override
    public String visitMatchStmt(Stmt.Match stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append("match (").append(print(stmt.expression)).append(") {");
        for (Stmt.Match.Clause clause : stmt.clauses) {
            builder.append(" case ").append(print(clause.pattern()))
                    .append(" => ").append(print(clause.statement()));
        }
        builder.append(" }");
        return builder.toString();
    }

    @Override
    public String visitContinuationStmt(Stmt.Continuation stmt) {
        return "__continuation " + stmt.name + " " + print(stmt.body);
    }

    @Override
    public String visitExpressionStmt(Stmt.ExpressionStatement stmt) {
        return print(stmt.expression) + ";";
    }

    @Override
    public String visitAssignStmt(Stmt.Assign stmt) {
        return print(stmt.lhs) + " = " + print(stmt.rhs) + ";";
    }

    @Override
    public String visitVariableDefinitionStmt(Stmt.VariableDefinition stmt) {
        return "var " + stmt.name + " = " + print(stmt.init) + ";";
    }

    @Override
    public String visitRunStmt(Stmt.Run stmt) {
        return "__run " + print(stmt.argument) + ";";
    }

    @Override
    public String visitAwaitStmt(Stmt.Await stmt) {
        return "__await;";
    }

    private String parenthesize(List<Expr> exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append('(');
        for (int i = 0; i < exprs.size(); ++i) {
            if (i > 0) builder.append(", ");
            builder.append(print(exprs.get(i)));
        }
        builder.append(')');
        return builder.toString();
    }
}
