package com.carbonlang.semantics;

import java.util.List;

/** The top-level declarations of one compilation unit, in source order. */
public record Ast(List<Declaration> declarations) {
    public Ast {
        declarations = List.copyOf(declarations);
    }
}
