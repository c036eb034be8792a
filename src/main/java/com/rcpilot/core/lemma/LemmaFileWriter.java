package com.rcpilot.core.lemma;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a file's helper lemmas as a Coq source file:
 *
 * <pre>
 * Require Import refinedc.typing.typing.
 *
 * Lemma foo_nonneg: forall n, 0 &lt;= foo n.
 * Proof.
 *   intros. lia.
 * Qed.
 * </pre>
 *
 * Lemmas without a proof body end in {@code Admitted.} instead.
 */
@Component
public class LemmaFileWriter {

    public String render(List<String> imports, List<HelperLemma> lemmas) {
        StringBuilder sb = new StringBuilder();

        Set<String> unique = new LinkedHashSet<>();
        for (String imp : imports) {
            if (imp != null && !imp.isBlank()) unique.add(requireLine(imp.trim()));
        }
        for (String line : unique) {
            sb.append(line).append("\n");
        }
        if (!unique.isEmpty()) {
            sb.append("\n");
        }

        for (HelperLemma lemma : lemmas) {
            sb.append("Lemma ").append(lemma.getName()).append(": ")
              .append(stripPeriod(lemma.getStatement())).append(".\n");
            sb.append("Proof.\n");
            if (lemma.isAdmitted()) {
                sb.append("Admitted.\n");
            } else {
                for (String line : lemma.getProofBody().split("\n")) {
                    sb.append("  ").append(line.strip()).append("\n");
                }
                sb.append("Qed.\n");
            }
            sb.append("\n");
        }

        return sb.toString();
    }

    /** File name of the companion lemma file for a C file stem. */
    public static String fileName(String stem) {
        return moduleName(stem) + ".v";
    }

    /** Coq module name of the companion lemma file, as used by the import directive. */
    public static String moduleName(String stem) {
        return stem + "_lemmas";
    }

    // Accept both bare module paths and complete "From X Require Import Y." lines
    private static String requireLine(String imp) {
        if (imp.startsWith("Require ") || imp.startsWith("From ")) {
            return imp.endsWith(".") ? imp : imp + ".";
        }
        return "Require Import " + stripPeriod(imp) + ".";
    }

    private static String stripPeriod(String s) {
        String t = s.strip();
        while (t.endsWith(".")) {
            t = t.substring(0, t.length() - 1).stripTrailing();
        }
        return t;
    }
}
