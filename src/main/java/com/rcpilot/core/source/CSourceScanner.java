package com.rcpilot.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CSourceScanner — finds annotation points in C source text.
 *
 * A lightweight structural scanner, not a full C parser. It tokenizes the text
 * (dropping comments, string/char literals and preprocessor lines), tracks brace
 * nesting, and reports in source pre-order:
 *
 *   FUNCTION — every function definition, positioned at the first line of its
 *              declaration, then moved up over a contiguous run of #include or
 *              line-comment lines directly above it.
 *   LOOP     — for / while / do headers inside function bodies. The trailing
 *              while of a do-while is not a separate loop.
 *   BLOCK    — compound statements inside function bodies, including the body
 *              itself. Brace initializers and struct bodies are not blocks.
 *
 * C2x attribute groups ([[...]]) are kept as opaque tokens so previously
 * inserted annotations do not confuse name detection.
 */
@Component
public class CSourceScanner {

    private static final Logger log = LoggerFactory.getLogger(CSourceScanner.class);

    private static final Set<String> ATTRIBUTE_KEYWORDS = Set.of(
            "__attribute__", "__declspec", "_Alignas", "alignas", "__asm__", "asm");

    private static final Set<String> NON_FUNCTION_NAMES = Set.of(
            "if", "while", "for", "switch", "return", "sizeof", "_Generic", "do", "else");

    // previous tokens after which '{' opens a compound statement
    private static final Set<String> BLOCK_OPENERS = Set.of(
            ")", ";", "{", "}", ":", "else", "do");

    private enum TokenType { IDENT, PUNCT, LITERAL, ATTRIBUTE, DIRECTIVE }

    private enum BraceKind { FUNCTION_BODY, BLOCK, OTHER }

    private static final class Token {
        final TokenType type;
        final String    text;
        final int       line;
        Token(TokenType type, String text, int line) {
            this.type = type;
            this.text = text;
            this.line = line;
        }
        boolean is(String s) { return type == TokenType.PUNCT && text.equals(s); }
        boolean isIdent(String s) { return type == TokenType.IDENT && text.equals(s); }
    }

    // =========================================================================
    // PUBLIC API
    // =========================================================================

    /**
     * Scan the text and return its annotation points in pre-order.
     * Returns an empty list for text without any recognizable construct.
     */
    public List<AnnotationPoint> findAnnotationPoints(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String[]    lines  = text.split("\n", -1);
        List<Token> tokens = tokenize(text);
        List<AnnotationPoint> points = new ArrayList<>();

        Deque<BraceKind> braces       = new ArrayDeque<>();
        Set<Integer>     doBraceDepth = new HashSet<>();
        Deque<Integer>   unbracedDo   = new ArrayDeque<>();
        boolean          expectDoTail = false;
        int              declStart    = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token   tok       = tokens.get(i);
            boolean doTailNow = expectDoTail;
            expectDoTail = false;

            // ------------------------------------------------------------
            // File scope
            // ------------------------------------------------------------
            if (braces.isEmpty()) {
                if (tok.is(";") || tok.type == TokenType.DIRECTIVE) {
                    declStart = i + 1;
                    continue;
                }
                if (tok.is("{")) {
                    if (looksLikeFunctionHeader(tokens, declStart, i)) {
                        String name = functionName(tokens, declStart, i);
                        if (name != null) {
                            int startLine = declStart < i ? tokens.get(declStart).line : tok.line;
                            int line      = climbOverPreamble(lines, startLine);
                            points.add(new AnnotationPoint(line, AnnotationPoint.Context.FUNCTION,
                                    name, indentAt(lines, line), headerLine(tokens, declStart, i)));
                        } else {
                            log.debug("[Scanner] Function body at line {} without a resolvable name", tok.line);
                        }
                        points.add(new AnnotationPoint(tok.line, AnnotationPoint.Context.BLOCK,
                                null, indentAt(lines, tok.line)));
                        braces.push(BraceKind.FUNCTION_BODY);
                    } else {
                        braces.push(BraceKind.OTHER);
                    }
                }
                continue;
            }

            // ------------------------------------------------------------
            // Inside braces
            // ------------------------------------------------------------
            boolean inCode = braces.peek() != BraceKind.OTHER;

            if (tok.is("{")) {
                Token prev = tokens.get(i - 1);
                boolean block = inCode && (prev.type == TokenType.ATTRIBUTE
                        || BLOCK_OPENERS.contains(prev.text));
                if (block) {
                    points.add(new AnnotationPoint(tok.line, AnnotationPoint.Context.BLOCK,
                            null, indentAt(lines, tok.line)));
                    braces.push(BraceKind.BLOCK);
                    if (prev.isIdent("do")) {
                        doBraceDepth.add(braces.size());
                    }
                } else {
                    braces.push(BraceKind.OTHER);
                }
                continue;
            }

            if (tok.is("}")) {
                int depth = braces.size();
                BraceKind closed = braces.pop();
                if (doBraceDepth.remove(depth)) {
                    expectDoTail = true;
                }
                if (closed == BraceKind.FUNCTION_BODY && braces.isEmpty()) {
                    declStart = i + 1;
                }
                continue;
            }

            if (!inCode) {
                continue;
            }

            if (tok.is(";") && !unbracedDo.isEmpty() && unbracedDo.peek() == braces.size()) {
                unbracedDo.pop();
                expectDoTail = true;
                continue;
            }

            if (tok.isIdent("while") && doTailNow) {
                continue;
            }

            if (tok.isIdent("for") || tok.isIdent("while") || tok.isIdent("do")) {
                points.add(new AnnotationPoint(tok.line, AnnotationPoint.Context.LOOP,
                        null, indentAt(lines, tok.line)));
                if (tok.isIdent("do") && (i + 1 >= tokens.size() || !tokens.get(i + 1).is("{"))) {
                    unbracedDo.push(braces.size());
                }
            }
        }

        log.debug("[Scanner] Found {} annotation points", points.size());
        return points;
    }

    // =========================================================================
    // FUNCTION HEADER DETECTION
    // =========================================================================

    /**
     * A '{' at file scope opens a function body when the declaration before it
     * ends with ')' (or an attribute) and has no '=' outside parentheses.
     */
    private boolean looksLikeFunctionHeader(List<Token> tokens, int from, int brace) {
        if (brace <= from) return false;

        Token last = tokens.get(brace - 1);
        if (!last.is(")") && last.type != TokenType.ATTRIBUTE) return false;

        int parens = 0;
        boolean sawParen = false;
        for (int i = from; i < brace; i++) {
            Token t = tokens.get(i);
            if (t.is("(")) { parens++; sawParen = true; }
            else if (t.is(")")) parens--;
            else if (t.is("=") && parens == 0) return false;
        }
        return sawParen;
    }

    /**
     * Identifier in front of the first top-level parameter list, skipping
     * attribute groups and __attribute__((...)) style specifiers.
     */
    private String functionName(List<Token> tokens, int from, int brace) {
        int i = from;
        while (i < brace) {
            Token t = tokens.get(i);
            if (t.is("(")) {
                Token prev = i > from ? tokens.get(i - 1) : null;
                if (prev != null && prev.type == TokenType.IDENT
                        && ATTRIBUTE_KEYWORDS.contains(prev.text)) {
                    i = skipParenGroup(tokens, i, brace);
                    continue;
                }
                if (prev != null && prev.type == TokenType.IDENT
                        && !NON_FUNCTION_NAMES.contains(prev.text)) {
                    return prev.text;
                }
                return null;
            }
            i++;
        }
        return null;
    }

    private int skipParenGroup(List<Token> tokens, int open, int limit) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            if (tokens.get(i).is("(")) depth++;
            else if (tokens.get(i).is(")")) {
                depth--;
                if (depth == 0) return i + 1;
            }
        }
        return limit;
    }

    // =========================================================================
    // LINE HELPERS
    // =========================================================================

    /** Line of the first declaration token that is not an attribute group. */
    private int headerLine(List<Token> tokens, int from, int brace) {
        for (int j = from; j < brace; j++) {
            if (tokens.get(j).type != TokenType.ATTRIBUTE) {
                return tokens.get(j).line;
            }
        }
        return tokens.get(brace).line;
    }

    /** Move a function's insertion line up over #include and // lines directly above it. */
    private int climbOverPreamble(String[] lines, int line) {
        int current = line;
        while (current > 1) {
            String above = lines[current - 2].trim();
            if (!(above.startsWith("#include") || above.startsWith("//"))) {
                break;
            }
            current--;
        }
        return current;
    }

    /** Leading whitespace width of the first non-blank, non-comment line at or after {@code line}. */
    public static int indentAt(String[] lines, int line) {
        for (int i = line - 1; i < lines.length; i++) {
            String raw     = lines[i];
            String trimmed = raw.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("/*")
                    || trimmed.startsWith("*")) {
                continue;
            }
            int width = 0;
            while (width < raw.length() && Character.isWhitespace(raw.charAt(width))) {
                width++;
            }
            return width;
        }
        return 0;
    }

    // =========================================================================
    // TOKENIZER
    // =========================================================================

    private List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int     n           = text.length();
        int     line        = 1;
        boolean atLineStart = true;
        int     i           = 0;

        while (i < n) {
            char c = text.charAt(i);

            if (c == '\n') {
                line++;
                atLineStart = true;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // Preprocessor directive, with backslash continuations
            if (c == '#' && atLineStart) {
                int startLine = line;
                while (i < n && text.charAt(i) != '\n') {
                    if (text.charAt(i) == '\\' && i + 1 < n && text.charAt(i + 1) == '\n') {
                        line++;
                        i += 2;
                        continue;
                    }
                    i++;
                }
                tokens.add(new Token(TokenType.DIRECTIVE, "#", startLine));
                continue;
            }
            atLineStart = false;

            // Comments
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                while (i < n && text.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                i += 2;
                while (i < n && !(text.charAt(i) == '*' && i + 1 < n && text.charAt(i + 1) == '/')) {
                    if (text.charAt(i) == '\n') line++;
                    i++;
                }
                i = Math.min(n, i + 2);
                continue;
            }

            // String and character literals
            if (c == '"' || c == '\'') {
                int startLine = line;
                i++;
                while (i < n && text.charAt(i) != c) {
                    if (text.charAt(i) == '\\' && i + 1 < n) {
                        if (text.charAt(i + 1) == '\n') line++;
                        i += 2;
                        continue;
                    }
                    if (text.charAt(i) == '\n') {
                        // unterminated literal, stop at end of line
                        break;
                    }
                    i++;
                }
                if (i < n && text.charAt(i) == c) i++;
                tokens.add(new Token(TokenType.LITERAL, "\"\"", startLine));
                continue;
            }

            // C2x attribute group: [[ ... ]]
            if (c == '[' && i + 1 < n && text.charAt(i + 1) == '[') {
                int startLine = line;
                int depth = 0;
                while (i < n) {
                    char a = text.charAt(i);
                    if (a == '\n') line++;
                    if (a == '"') {
                        i++;
                        while (i < n && text.charAt(i) != '"' && text.charAt(i) != '\n') {
                            if (text.charAt(i) == '\\') i++;
                            i++;
                        }
                    } else if (a == '[') {
                        depth++;
                    } else if (a == ']') {
                        depth--;
                        if (depth == 0) {
                            i++;
                            break;
                        }
                    }
                    i++;
                }
                tokens.add(new Token(TokenType.ATTRIBUTE, "[[", startLine));
                continue;
            }

            if (Character.isJavaIdentifierStart(c)) {
                int start = i;
                while (i < n && Character.isJavaIdentifierPart(text.charAt(i))) i++;
                tokens.add(new Token(TokenType.IDENT, text.substring(start, i), line));
                continue;
            }

            if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '.')) i++;
                tokens.add(new Token(TokenType.LITERAL, text.substring(start, i), line));
                continue;
            }

            // '::' inside attributes never reaches here; keep ':' distinct for labels
            tokens.add(new Token(TokenType.PUNCT, String.valueOf(c), line));
            i++;
        }

        return tokens;
    }
}
