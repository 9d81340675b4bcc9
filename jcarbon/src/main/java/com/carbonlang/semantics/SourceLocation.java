package com.carbonlang.semantics;

public record SourceLocation(
        String filename,
        int line
) {
    public String toString() {
        return filename + ":" + line;
    }
}
