package com.carbonlang.semantics;

/**
 * The return contract a function declares: no `->` clause at all, `-> auto`,
 * or `-> T` for some type. The type itself is checked elsewhere; only the
 * presence of a value matters to control flow.
 */
public record ReturnTerm(Kind kind) {
    public enum Kind { OMITTED, AUTO, EXPRESSION }

    public static ReturnTerm omitted() {
        return new ReturnTerm(Kind.OMITTED);
    }

    public static ReturnTerm auto() {
        return new ReturnTerm(Kind.AUTO);
    }

    public static ReturnTerm explicit() {
        return new ReturnTerm(Kind.EXPRESSION);
    }

    public boolean isOmitted() {
        return kind == Kind.OMITTED;
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }
}
