package com.rcpilot.core.insertion;

import com.rcpilot.core.source.AnnotationPoint;
import com.rcpilot.core.source.CSourceScanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * InsertionEngine — places annotation strings at annotation points of a C file.
 *
 * Resolution order per annotation:
 *   1. explicit hint   → function name, else literal line number
 *   2. no hint         → first function (pre-order, first definition of a name)
 *                        whose name occurs in the text; several annotations may
 *                        share a function
 *   3. nothing resolved → reported unplaced, never dropped
 *
 * An annotation is skipped (reported alreadyPresent) when the same text was
 * already resolved to the same line in this request, or when the annotation
 * block around its point already carries it. Literal line hints are only valid
 * against the text the generator saw, so for those any verbatim occurrence in
 * the file counts as present.
 *
 * When the text has no annotation points at all, every annotation goes to the
 * top of the file in input order.
 *
 * Insertions are applied bottom-up (descending target line) so earlier line
 * numbers stay valid while later ones are inserted. Annotations targeting the
 * same line keep their input order.
 */
@Component
public class InsertionEngine {

    private static final Logger log = LoggerFactory.getLogger(InsertionEngine.class);

    private final CSourceScanner scanner;

    public InsertionEngine(CSourceScanner scanner) {
        this.scanner = scanner;
    }

    // =========================================================================
    // PUBLIC API
    // =========================================================================

    public InsertionResult insert(String text, List<AnnotationRequest> annotations) {

        String source = text != null ? text : "";
        List<AnnotationRequest> placed         = new ArrayList<>();
        List<AnnotationRequest> alreadyPresent = new ArrayList<>();
        List<AnnotationRequest> unplaced       = new ArrayList<>();

        String[]              lines  = source.split("\n", -1);
        List<AnnotationPoint> points = scanner.findAnnotationPoints(source);

        // ------------------------------------------------------------
        // No structure at all: top-of-file fallback
        // ------------------------------------------------------------
        if (points.isEmpty()) {
            List<AnnotationRequest> pending = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (AnnotationRequest a : annotations) {
                if (!seen.add(a.getText()) || source.contains(a.getText())) {
                    alreadyPresent.add(a);
                } else {
                    pending.add(a);
                }
            }
            if (pending.isEmpty()) {
                return new InsertionResult(source, placed, alreadyPresent, unplaced,
                        locate(source, alreadyPresent));
            }
            log.info("[Insertion] No annotation points, {} annotations go to top of file", pending.size());
            List<String> texts = new ArrayList<>();
            for (AnnotationRequest a : pending) texts.add(a.getText());
            String result = prependToTop(source, texts);
            placed.addAll(pending);
            List<AnnotationRequest> all = new ArrayList<>(pending);
            all.addAll(alreadyPresent);
            return new InsertionResult(result, placed, alreadyPresent, unplaced, locate(result, all));
        }

        // ------------------------------------------------------------
        // Resolve targets, then drop duplicates per (text, line)
        // ------------------------------------------------------------
        // a trailing newline leaves an empty last element; nothing goes after it
        int maxTarget = lines[lines.length - 1].isEmpty() ? lines.length : lines.length + 1;

        List<Insertion> insertions = new ArrayList<>();
        Set<String>     seen       = new HashSet<>();
        int seq = 0;

        for (AnnotationRequest a : annotations) {
            Target target = a.hasHint()
                    ? resolveHint(a.getHint(), points, lines, maxTarget)
                    : matchByName(a.getText(), points);

            if (target == null) {
                if (source.contains(a.getText())) {
                    alreadyPresent.add(a);
                } else {
                    log.debug("[Insertion] Unplaced: {}", a);
                    unplaced.add(a);
                }
                continue;
            }

            boolean present = target.byLine
                    ? source.contains(a.getText())
                    : presentAt(lines, target, a.getText());

            if (!seen.add(target.line + "\n" + a.getText()) || present) {
                alreadyPresent.add(a);
                continue;
            }
            insertions.add(new Insertion(target.line, seq++, a, target.indent));
            placed.add(a);
        }

        if (insertions.isEmpty()) {
            return new InsertionResult(source, placed, alreadyPresent, unplaced,
                    locate(source, alreadyPresent));
        }

        String result = apply(lines, insertions);

        Map<String, Integer> locations = locateInserted(insertions);
        locate(result, alreadyPresent).forEach(locations::putIfAbsent);

        log.info("[Insertion] placed={}, alreadyPresent={}, unplaced={}",
                placed.size(), alreadyPresent.size(), unplaced.size());

        return new InsertionResult(result, placed, alreadyPresent, unplaced, locations);
    }

    /**
     * Literal top-of-file insertion. Lines end up in the given order, before
     * the first existing line. Texts already present are skipped.
     */
    public String prependToTop(String text, List<String> annotations) {
        String source = text != null ? text : "";
        Set<String> fresh = new LinkedHashSet<>();
        for (String a : annotations) {
            if (a != null && !a.isBlank() && !source.contains(a)) {
                fresh.add(a);
            }
        }
        if (fresh.isEmpty()) {
            return source;
        }
        StringBuilder sb = new StringBuilder();
        for (String a : fresh) {
            sb.append(a).append("\n");
        }
        return sb.append(source).toString();
    }

    /**
     * Top-of-file form of an annotation that could not be placed: structured
     * [[...]] tokens and comments stay as they are, anything else becomes a
     * line comment.
     */
    public static String normalizeForTop(String annotation) {
        String trimmed = annotation.strip();
        if (trimmed.startsWith("[[") || trimmed.startsWith("//")) {
            return trimmed;
        }
        StringBuilder sb = new StringBuilder();
        for (String line : trimmed.split("\n", -1)) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(line.startsWith("//") ? line : "// " + line);
        }
        return sb.toString();
    }

    // =========================================================================
    // TARGET RESOLUTION
    // =========================================================================

    private Target resolveHint(InsertionHint hint, List<AnnotationPoint> points,
                               String[] lines, int maxTarget) {
        boolean after = hint.getPosition() == InsertionHint.Position.AFTER;

        for (AnnotationPoint p : points) {
            if (p.isFunction() && p.getName().equals(hint.getLocation())) {
                if (!after) {
                    return new Target(p.getLine(), p.getIndent(), p.getDeclarationLine(), false);
                }
                int line = Math.min(p.getDeclarationLine() + 1, maxTarget);
                return new Target(line, indentOf(lines, line), line, false);
            }
        }

        try {
            int line = Integer.parseInt(hint.getLocation()) + (after ? 1 : 0);
            if (line >= 1 && line <= maxTarget) {
                return new Target(line, indentOf(lines, line), line, true);
            }
            log.warn("[Insertion] Hint line {} outside file ({} lines)", hint.getLocation(), lines.length);
        } catch (NumberFormatException e) {
            log.debug("[Insertion] Hint '{}' is neither a function nor a line", hint.getLocation());
        }
        return null;
    }

    private Target matchByName(String annotation, List<AnnotationPoint> points) {
        Set<String> seenNames = new HashSet<>();
        for (AnnotationPoint p : points) {
            if (!p.isFunction() || !seenNames.add(p.getName())) {
                continue;
            }
            if (annotation.contains(p.getName())) {
                return new Target(p.getLine(), p.getIndent(), p.getDeclarationLine(), false);
            }
        }
        return null;
    }

    /**
     * Whether the annotation block around a target already holds the text:
     * the non-code lines directly above the target, the preamble lines between
     * a function's insertion line and its declaration, and any comment or
     * attribute lines starting at the target. Compared with indentation
     * stripped from every line.
     */
    private static boolean presentAt(String[] lines, Target target, String annotation) {
        List<String> block = new ArrayList<>();
        for (int i = target.line - 2; i >= 0 && i < lines.length && !endsBlock(lines[i]); i--) {
            block.add(0, lines[i].strip());
        }
        for (int i = target.line - 1; i < lines.length
                && (i < target.declarationLine - 1 || isAnnotationLine(lines[i])); i++) {
            block.add(lines[i].strip());
        }
        return String.join("\n", block).contains(stripLines(annotation));
    }

    private static boolean endsBlock(String line) {
        String t = line.strip();
        if (t.isEmpty()) return true;
        if (isAnnotationLine(t)) return false;
        return t.endsWith(";") || t.endsWith("{") || t.endsWith("}");
    }

    private static boolean isAnnotationLine(String line) {
        String t = line.strip();
        return t.startsWith("//") || t.startsWith("[[");
    }

    private static String stripLines(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(line.strip());
        }
        return sb.toString();
    }

    private int indentOf(String[] lines, int line) {
        return line > lines.length ? 0 : CSourceScanner.indentAt(lines, line);
    }

    // =========================================================================
    // APPLY
    // =========================================================================

    private String apply(String[] lines, List<Insertion> insertions) {
        List<String> out = new ArrayList<>(List.of(lines));

        List<Insertion> ordered = new ArrayList<>(insertions);
        ordered.sort(Comparator.comparingInt((Insertion i) -> i.line)
                .thenComparingInt(i -> i.seq)
                .reversed());

        for (Insertion ins : ordered) {
            out.add(ins.line - 1, indent(ins.request.getText(), ins.indent));
        }
        return String.join("\n", out);
    }

    private static String indent(String text, int width) {
        if (width <= 0) {
            return text;
        }
        String pad = " ".repeat(width);
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(line.isEmpty() ? line : pad + line);
        }
        return sb.toString();
    }

    /**
     * Final line of each inserted annotation: its target line shifted by every
     * inserted line that lands above it.
     */
    private Map<String, Integer> locateInserted(List<Insertion> insertions) {
        Map<String, Integer> locations = new LinkedHashMap<>();
        for (Insertion a : insertions) {
            int shift = 0;
            for (Insertion b : insertions) {
                if (b.line < a.line || (b.line == a.line && b.seq < a.seq)) {
                    shift += b.lineCount();
                }
            }
            locations.merge(a.request.getText(), a.line + shift, Math::min);
        }
        return locations;
    }

    /** 1-based line of the first occurrence of each annotation's text; absent ones are left out. */
    public Map<String, Integer> locate(String text, List<AnnotationRequest> annotations) {
        Map<String, Integer> locations = new LinkedHashMap<>();
        for (AnnotationRequest a : annotations) {
            int idx = text.indexOf(a.getText());
            if (idx >= 0) {
                int line = 1;
                for (int i = 0; i < idx; i++) {
                    if (text.charAt(i) == '\n') line++;
                }
                locations.put(a.getText(), line);
            }
        }
        return locations;
    }

    // =========================================================================
    // Inner classes
    // =========================================================================

    private static final class Target {
        final int     line;
        final int     indent;
        final int     declarationLine;  // preamble between line and this belongs to the point
        final boolean byLine;

        Target(int line, int indent, int declarationLine, boolean byLine) {
            this.line            = line;
            this.indent          = indent;
            this.declarationLine = declarationLine;
            this.byLine          = byLine;
        }
    }

    private static final class Insertion {
        final int               line;
        final int               seq;
        final AnnotationRequest request;
        final int               indent;

        Insertion(int line, int seq, AnnotationRequest request, int indent) {
            this.line    = line;
            this.seq     = seq;
            this.request = request;
            this.indent  = indent;
        }

        int lineCount() {
            return request.getText().split("\n", -1).length;
        }
    }
}
