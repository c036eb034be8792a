package com.rcpilot.core.lemma;

/**
 * The {@code //@rc::import} line binding a C file to its companion lemma file.
 * Goes after any existing {@code //@rc::} directives, otherwise at the top.
 */
public final class LemmaImportDirective {

    static final String DIRECTIVE_PREFIX = "//@rc::";

    private LemmaImportDirective() {}

    public static String forFile(String stem, String coqRoot) {
        return DIRECTIVE_PREFIX + "import " + LemmaFileWriter.moduleName(stem) + " from " + coqRoot;
    }

    /** Returns {@code text} with the directive inserted once. */
    public static String insertInto(String text, String directive) {
        String source = text != null ? text : "";
        String[] lines = source.split("\n", -1);

        int lastDirective = -1;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.equals(directive)) {
                return source;
            }
            if (trimmed.startsWith(DIRECTIVE_PREFIX)) {
                lastDirective = i;
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i == lastDirective + 1) {
                sb.append(directive).append("\n");
            }
            sb.append(lines[i]);
            if (i < lines.length - 1) sb.append("\n");
        }
        if (lastDirective == lines.length - 1) {
            sb.append("\n").append(directive);
        }
        return sb.toString();
    }
}
