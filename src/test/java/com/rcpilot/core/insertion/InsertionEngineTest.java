package com.rcpilot.core.insertion;

import com.rcpilot.core.source.CSourceScanner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsertionEngineTest {

    private final InsertionEngine engine = new InsertionEngine(new CSourceScanner());

    private static final String TWO_FUNCTIONS = String.join("\n",
            "int add(int a, int b) {",   // 1
            "    return a + b;",         // 2
            "}",                         // 3
            "",                          // 4
            "int sub(int a, int b) {",   // 5
            "    return a - b;",         // 6
            "}",                         // 7
            "");

    @Test
    void testUnhintedAnnotationGoesAboveMatchingFunction() {
        InsertionResult result = engine.insert("int add(int a,int b){return a+b;}",
                List.of(AnnotationRequest.of("[[spec::add]]")));

        assertEquals("[[spec::add]]\nint add(int a,int b){return a+b;}", result.getText());
        assertEquals(1, result.getPlaced().size());
        assertEquals(1, result.getLocations().get("[[spec::add]]"));
    }

    @Test
    void testHintsResolveByFunctionNameThenLine() {
        AnnotationRequest returns = AnnotationRequest.at("[[rc::returns(\"int<i32>\")]]", InsertionHint.before("sub"));
        AnnotationRequest checked = AnnotationRequest.at("// checked", InsertionHint.after("1"));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(returns, checked));

        String expected = String.join("\n",
                "int add(int a, int b) {",
                "    // checked",
                "    return a + b;",
                "}",
                "",
                "[[rc::returns(\"int<i32>\")]]",
                "int sub(int a, int b) {",
                "    return a - b;",
                "}",
                "");
        assertEquals(expected, result.getText());
        assertEquals(2, result.getLocations().get("// checked"));
        assertEquals(6, result.getLocations().get(returns.getText()));
        assertFalse(result.hasUnplaced());
    }

    @Test
    void testUnresolvableHintsAreReportedUnplaced() {
        AnnotationRequest unknownFunction = AnnotationRequest.at("[[x]]", InsertionHint.before("mul"));
        AnnotationRequest outOfRange     = AnnotationRequest.at("[[y]]", InsertionHint.before("99"));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(unknownFunction, outOfRange));

        assertEquals(TWO_FUNCTIONS, result.getText());
        assertEquals(List.of(unknownFunction, outOfRange), result.getUnplaced());
        assertTrue(result.getPlaced().isEmpty());
    }

    @Test
    void testSeveralAnnotationsForOneFunctionKeepInputOrder() {
        List<AnnotationRequest> annotations = List.of(
                AnnotationRequest.of("// sub: parameters"),
                AnnotationRequest.of("// sub: returns"),
                AnnotationRequest.of("// add: returns"));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, annotations);
        String[] lines = result.getText().split("\n", -1);

        assertEquals("// add: returns",    lines[0]);
        assertEquals("int add(int a, int b) {", lines[1]);
        assertEquals("// sub: parameters", lines[5]);
        assertEquals("// sub: returns",    lines[6]);
        assertEquals("int sub(int a, int b) {", lines[7]);
        assertEquals(7, result.getLocations().get("// sub: returns"));
    }

    @Test
    void testUnmatchedUnhintedAnnotationIsUnplaced() {
        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(AnnotationRequest.of("[[rc::trust_me]]")));

        assertEquals(TWO_FUNCTIONS, result.getText());
        assertEquals(1, result.getUnplaced().size());
    }

    @Test
    void testInsertionIsIdempotent() {
        List<AnnotationRequest> annotations = List.of(
                AnnotationRequest.of("// add: spec"),
                AnnotationRequest.at("// checked", InsertionHint.after("1")));

        String once  = engine.insert(TWO_FUNCTIONS, annotations).getText();
        InsertionResult twice = engine.insert(once, annotations);

        assertEquals(once, twice.getText());
        assertEquals(2, twice.getAlreadyPresent().size());
        assertTrue(twice.getPlaced().isEmpty());
    }

    @Test
    void testDuplicatesWithinRequestAreInsertedOnce() {
        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(
                AnnotationRequest.of("// add: spec"),
                AnnotationRequest.of("// add: spec")));

        String text = result.getText();
        assertEquals(text.indexOf("// add: spec"), text.lastIndexOf("// add: spec"));
    }

    @Test
    void testSameTextIsPlacedAtEachHintedFunction() {
        String returns = "[[rc::returns(\"int<i32>\")]]";
        AnnotationRequest forAdd = AnnotationRequest.at(returns, InsertionHint.before("add"));
        AnnotationRequest forSub = AnnotationRequest.at(returns, InsertionHint.before("sub"));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(forAdd, forSub));
        String[] lines = result.getText().split("\n", -1);

        assertEquals(returns, lines[0]);
        assertEquals("int add(int a, int b) {", lines[1]);
        assertEquals(returns, lines[5]);
        assertEquals("int sub(int a, int b) {", lines[6]);
        assertEquals(List.of(forAdd, forSub), result.getPlaced());
        assertTrue(result.getAlreadyPresent().isEmpty());

        InsertionResult again = engine.insert(result.getText(), List.of(forAdd, forSub));
        assertEquals(result.getText(), again.getText());
        assertEquals(2, again.getAlreadyPresent().size());
    }

    @Test
    void testTextPresentAtAnotherFunctionIsStillInserted() {
        String annotated = "// spec\n" + TWO_FUNCTIONS;

        InsertionResult result = engine.insert(annotated,
                List.of(AnnotationRequest.at("// spec", InsertionHint.before("sub"))));

        assertEquals(1, result.getPlaced().size());
        assertEquals(6, result.getLocations().get("// spec"));
        assertEquals("// spec", result.getText().split("\n", -1)[5]);
    }

    @Test
    void testMultiLineAnnotationIsIndentedOnEveryLine() {
        AnnotationRequest invariant = AnnotationRequest.at("[[rc::exists(\"n: nat\")]]\n[[rc::inv_vars(\"a: n\")]]",
                InsertionHint.before("2"));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, List.of(invariant));
        String[] lines = result.getText().split("\n", -1);

        assertEquals("    [[rc::exists(\"n: nat\")]]", lines[1]);
        assertEquals("    [[rc::inv_vars(\"a: n\")]]", lines[2]);
        assertEquals("    return a + b;", lines[3]);
    }

    @Test
    void testAfterFunctionHintUsesDeclarationLine() {
        String text = String.join("\n",
                "#include <stdio.h>",        // 1
                "// adds",                   // 2
                "int add(int a, int b) {",   // 3
                "    return a + b;",         // 4
                "}",                         // 5
                "");
        AnnotationRequest body = AnnotationRequest.at("// body", InsertionHint.after("add"));

        InsertionResult result = engine.insert(text, List.of(body));

        String expected = String.join("\n",
                "#include <stdio.h>",
                "// adds",
                "int add(int a, int b) {",
                "    // body",
                "    return a + b;",
                "}",
                "");
        assertEquals(expected, result.getText());
        assertEquals(4, result.getLocations().get("// body"));

        assertEquals(expected, engine.insert(expected, List.of(body)).getText());
    }

    @Test
    void testNoPointsFallsBackToTopInInputOrder() {
        InsertionResult result = engine.insert("x = 1;\n", List.of(
                AnnotationRequest.of("[[a]]"),
                AnnotationRequest.of("[[b]]")));

        assertEquals("[[a]]\n[[b]]\nx = 1;\n", result.getText());
        assertEquals(2, result.getPlaced().size());
        assertEquals(2, result.getLocations().get("[[b]]"));
    }

    @Test
    void testUntouchedLinesKeepOrderAndContent() {
        List<AnnotationRequest> annotations = List.of(
                AnnotationRequest.of("// sub: spec"),
                AnnotationRequest.of("// add: spec"),
                AnnotationRequest.at("// inner", InsertionHint.before("6")),
                AnnotationRequest.at("// tail", InsertionHint.after("7")));

        InsertionResult result = engine.insert(TWO_FUNCTIONS, annotations);

        List<String> remaining = new ArrayList<>(Arrays.asList(result.getText().split("\n", -1)));
        remaining.removeIf(l -> l.trim().startsWith("// "));

        assertEquals(Arrays.asList(TWO_FUNCTIONS.split("\n", -1)), remaining);
        for (AnnotationRequest a : annotations) {
            assertTrue(result.getText().contains(a.getText()), "missing " + a.getText());
        }
    }

    @Test
    void testPrependToTopSkipsPresentLines() {
        String text = engine.prependToTop("// one\nint x;\n", List.of("// one", "// two", "// three"));

        assertEquals("// two\n// three\n// one\nint x;\n", text);
    }

    @Test
    void testNormalizeForTop() {
        assertEquals("[[rc::parameters(\"n: nat\")]]", InsertionEngine.normalizeForTop("  [[rc::parameters(\"n: nat\")]]"));
        assertEquals("// already", InsertionEngine.normalizeForTop("// already"));
        assertEquals("// rc::requires\n// more", InsertionEngine.normalizeForTop("rc::requires\nmore"));
    }
}
