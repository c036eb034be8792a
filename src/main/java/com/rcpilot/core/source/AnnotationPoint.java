package com.rcpilot.core.source;

import java.util.Objects;

/**
 * A place in a C file where an annotation may legally be inserted.
 *
 * Points are derived from the current text and are only valid against that text.
 * Any insertion invalidates every point computed before it.
 */
public final class AnnotationPoint {

    public enum Context {
        FUNCTION,
        LOOP,
        BLOCK
    }

    private final int     line;     // 1-based, annotation goes immediately before it
    private final Context context;
    private final String  name;     // function name, null for loops and blocks
    private final int     indent;
    private final int     declarationLine;  // function header line, below any #include or // preamble

    public AnnotationPoint(int line, Context context, String name, int indent) {
        this(line, context, name, indent, line);
    }

    public AnnotationPoint(int line, Context context, String name, int indent, int declarationLine) {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be 1-based: " + line);
        }
        if (context == Context.FUNCTION && (name == null || name.isBlank())) {
            throw new IllegalArgumentException("Function points require a name");
        }
        this.line    = line;
        this.context = context;
        this.name    = name;
        this.indent  = indent;
        this.declarationLine = Math.max(line, declarationLine);
    }

    public int     getLine()    { return line; }
    public Context getContext() { return context; }
    public String  getName()    { return name; }
    public int     getIndent()  { return indent; }
    public int     getDeclarationLine() { return declarationLine; }

    public boolean isFunction() {
        return context == Context.FUNCTION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotationPoint)) return false;
        AnnotationPoint that = (AnnotationPoint) o;
        return line == that.line && indent == that.indent
                && declarationLine == that.declarationLine
                && context == that.context && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, context, name, indent, declarationLine);
    }

    @Override
    public String toString() {
        return String.format("AnnotationPoint{line=%d, context=%s, name=%s, indent=%d, declarationLine=%d}",
                line, context, name, indent, declarationLine);
    }
}
