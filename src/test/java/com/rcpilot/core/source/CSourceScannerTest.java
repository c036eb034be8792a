package com.rcpilot.core.source;

import com.rcpilot.core.source.AnnotationPoint.Context;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CSourceScannerTest {

    private final CSourceScanner scanner = new CSourceScanner();

    private static final String SOURCE = String.join("\n",
            "#include <stdio.h>",              // 1
            "// adds",                         // 2
            "int add(int a, int b) {",         // 3
            "    int s = 0;",                  // 4
            "    for (int i = 0; i < b; i++) {", // 5
            "        s++;",                    // 6
            "    }",                           // 7
            "    return a + s;",               // 8
            "}",                               // 9
            "",                                // 10
            "static int arr[] = { 1, 2 };",    // 11
            "",                                // 12
            "void spin(int x) {",              // 13
            "    do {",                        // 14
            "        x--;",                    // 15
            "    } while (x > 0);",            // 16
            "}",                               // 17
            "");

    @Test
    void testFindsFunctionsLoopsAndBlocksInPreOrder() {
        List<AnnotationPoint> points = scanner.findAnnotationPoints(SOURCE);

        assertEquals(List.of(
                new AnnotationPoint(1,  Context.FUNCTION, "add",  0, 3),
                new AnnotationPoint(3,  Context.BLOCK,    null,   0),
                new AnnotationPoint(5,  Context.LOOP,     null,   4),
                new AnnotationPoint(5,  Context.BLOCK,    null,   4),
                new AnnotationPoint(13, Context.FUNCTION, "spin", 0),
                new AnnotationPoint(13, Context.BLOCK,    null,   0),
                new AnnotationPoint(14, Context.LOOP,     null,   4),
                new AnnotationPoint(14, Context.BLOCK,    null,   4)
        ), points);
    }

    @Test
    void testSingleLineFunction() {
        List<AnnotationPoint> points = scanner.findAnnotationPoints("int add(int a,int b){return a+b;}");

        assertEquals(2, points.size());
        assertEquals(Context.FUNCTION, points.get(0).getContext());
        assertEquals("add", points.get(0).getName());
        assertEquals(1, points.get(0).getLine());
    }

    @Test
    void testCommentsAndStringsAreIgnored() {
        String text = String.join("\n",
                "/* int fake(void) { for (;;) {} } */",
                "const char *msg = \"while (1) { }\";",
                "int main(void) {",
                "    // for (;;) {",
                "    return 0;",
                "}");

        List<AnnotationPoint> points = scanner.findAnnotationPoints(text);

        assertEquals(2, points.size());
        assertEquals("main", points.get(0).getName());
        assertEquals(3, points.get(0).getLine());
    }

    @Test
    void testDeclarationsAndInitializersAreNotFunctions() {
        String text = String.join("\n",
                "int square(int x);",
                "struct point { int x; int y; };",
                "static int table[2] = { 1, 2 };");

        assertTrue(scanner.findAnnotationPoints(text).isEmpty());
    }

    @Test
    void testExistingAttributesDoNotHideFunctionName() {
        String text = String.join("\n",
                "[[rc::args(\"int<i32>\")]]",
                "[[rc::returns(\"int<i32>\")]]",
                "int id(int x) {",
                "    return x;",
                "}");

        List<AnnotationPoint> points = scanner.findAnnotationPoints(text);

        assertEquals("id", points.get(0).getName());
        assertEquals(1, points.get(0).getLine());
    }

    @Test
    void testStandaloneWhileIsALoop() {
        String text = String.join("\n",
                "void drain(int n) {",
                "    while (n > 0)",
                "        n--;",
                "}");

        List<AnnotationPoint> points = scanner.findAnnotationPoints(text);

        assertEquals(3, points.size());
        assertEquals(new AnnotationPoint(2, Context.LOOP, null, 4), points.get(2));
    }

    @Test
    void testEmptyTextHasNoPoints() {
        assertTrue(scanner.findAnnotationPoints("").isEmpty());
        assertTrue(scanner.findAnnotationPoints("x = 1;\n").isEmpty());
    }

    @Test
    void testIndentSkipsBlankAndCommentLines() {
        String[] lines = { "", "  // note", "    int x;" };

        assertEquals(4, CSourceScanner.indentAt(lines, 1));
        assertEquals(0, CSourceScanner.indentAt(lines, 4));
    }
}
