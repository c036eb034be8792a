package com.rcpilot.core.diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DiagnosticClassifier — triages raw verifier output into a {@link DiagnosticSet}.
 *
 * Line-oriented. For each line the first matching rule wins:
 *
 *   1. front-end error            → InvalidAnnotation, location from "[...]" prefix,
 *                                   reason from up to the next 3 lines
 *   2. "invalid annotation"       → InvalidAnnotation, reason from the next line
 *   3. "annotations on function X are invalid"
 *                                 → InvalidAnnotation{function X}
 *   4. "unexpected token"         → InvalidAnnotation, location from this line's
 *                                   or the previous line's "[...]" prefix
 *   5. failed / unverified / cannot solve side condition
 *                                 → ProofFailure, symbol from "function X"
 *
 * Best-effort only. The verifier's exit code decides success, never this class.
 */
@Component
public class DiagnosticClassifier {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticClassifier.class);

    private static final int REASON_LOOKAHEAD = 3;

    private static final Pattern BRACKET_PREFIX =
        Pattern.compile("^\\s*\\[([^\\]\\n]+)\\]");

    private static final Pattern FRONTEND_ERROR =
        Pattern.compile("front-?end error", Pattern.CASE_INSENSITIVE);

    private static final Pattern INVALID_ANNOTATION =
        Pattern.compile("invalid annotation", Pattern.CASE_INSENSITIVE);

    private static final Pattern FUNCTION_ANNOTATIONS_INVALID =
        Pattern.compile("annotations on function\\s+[`'\"]?([A-Za-z_]\\w*)[`'\"]?\\s+are invalid",
                Pattern.CASE_INSENSITIVE);

    private static final Pattern UNEXPECTED_TOKEN =
        Pattern.compile("unexpected token", Pattern.CASE_INSENSITIVE);

    private static final Pattern PROOF_FAILURE =
        Pattern.compile("\\bfailed\\b|\\bunverified\\b|cannot solve side condition",
                Pattern.CASE_INSENSITIVE);

    private static final Pattern FUNCTION_NAME =
        Pattern.compile("\\bfunction\\s+[`'\"]?([A-Za-z_]\\w*)", Pattern.CASE_INSENSITIVE);

    public DiagnosticSet classify(String rawOutput) {

        if (rawOutput == null || rawOutput.isBlank()) {
            return DiagnosticSet.empty();
        }

        String[]         lines       = rawOutput.split("\\r?\\n", -1);
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) continue;

            // Rule 1
            if (FRONTEND_ERROR.matcher(line).find()) {
                diagnostics.add(new Diagnostic.InvalidAnnotation(
                        bracketPrefix(line), followingLines(lines, i, REASON_LOOKAHEAD), line));
                continue;
            }

            // Rule 2
            if (INVALID_ANNOTATION.matcher(line).find()) {
                diagnostics.add(new Diagnostic.InvalidAnnotation(
                        bracketPrefix(line), followingLines(lines, i, 1), line));
                continue;
            }

            // Rule 3
            Matcher fn = FUNCTION_ANNOTATIONS_INVALID.matcher(line);
            if (fn.find()) {
                diagnostics.add(new Diagnostic.InvalidAnnotation(
                        "function " + fn.group(1), line.trim(), line));
                continue;
            }

            // Rule 4
            if (UNEXPECTED_TOKEN.matcher(line).find()) {
                String location = bracketPrefix(line);
                if ("unknown".equals(location) && i > 0) {
                    location = bracketPrefix(lines[i - 1]);
                }
                diagnostics.add(new Diagnostic.InvalidAnnotation(location, line.trim(), line));
                continue;
            }

            // Rule 5
            if (PROOF_FAILURE.matcher(line).find()) {
                Matcher name = FUNCTION_NAME.matcher(line);
                String symbol = name.find() ? name.group(1) : "unknown";
                diagnostics.add(new Diagnostic.ProofFailure(symbol, line.trim(), line));
            }
        }

        DiagnosticSet result = new DiagnosticSet(diagnostics);
        log.info("[Classifier] {} lines → {}", lines.length, result.getSummary());
        return result;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private String bracketPrefix(String line) {
        Matcher m = BRACKET_PREFIX.matcher(line);
        return m.find() ? m.group(1).trim() : "unknown";
    }

    private String followingLines(String[] lines, int index, int max) {
        StringBuilder sb = new StringBuilder();
        for (int j = index + 1; j < lines.length && j <= index + max; j++) {
            String next = lines[j].trim();
            if (next.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(next);
        }
        return sb.toString();
    }
}
