package com.rcpilot.core.diagnostic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticClassifierTest {

    private final DiagnosticClassifier classifier = new DiagnosticClassifier();

    @Test
    void testInvalidAnnotationWinsOverProofFailure() {
        String output = """
            [add.c:3:1] invalid annotation
              bad syntax in rc::args
            function add failed to verify
            """;

        DiagnosticSet result = classifier.classify(output);

        assertTrue(result.hasSyntaxErrors());
        assertFalse(result.hasProofFailures());
        assertEquals(2, result.getDiagnostics().size());
        assertEquals("1 invalid annotation", result.getSummary());

        Diagnostic.InvalidAnnotation invalid = (Diagnostic.InvalidAnnotation) result.getDiagnostics().get(0);
        assertEquals("add.c:3:1", invalid.getLocation());
        assertEquals("bad syntax in rc::args", invalid.getReason());
    }

    @Test
    void testFrontendErrorReadsUpToThreeReasonLines() {
        String output = String.join("\n",
                "[add.c:5:3] Frontend error:",
                "  expected type",
                "  got nothing",
                "  in rc::returns",
                "  trailing noise");

        DiagnosticSet result = classifier.classify(output);

        Diagnostic.InvalidAnnotation invalid = (Diagnostic.InvalidAnnotation) result.getDiagnostics().get(0);
        assertEquals("add.c:5:3", invalid.getLocation());
        assertEquals("expected type got nothing in rc::returns", invalid.getReason());
        assertTrue(result.hasSyntaxErrors());
    }

    @Test
    void testFunctionAnnotationsInvalid() {
        DiagnosticSet result = classifier.classify("Annotations on function `swap` are invalid.");

        Diagnostic.InvalidAnnotation invalid = (Diagnostic.InvalidAnnotation) result.getDiagnostics().get(0);
        assertEquals("function swap", invalid.getLocation());
    }

    @Test
    void testUnexpectedTokenTakesLocationFromPreviousLine() {
        DiagnosticSet result = classifier.classify("[list.c:12:40]\nunexpected token ')'");

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic.InvalidAnnotation invalid = (Diagnostic.InvalidAnnotation) result.getDiagnostics().get(0);
        assertEquals("list.c:12:40", invalid.getLocation());
        assertEquals("unexpected token ')'", invalid.getReason());
    }

    @Test
    void testProofFailuresWithoutSyntaxErrors() {
        String output = """
            Cannot solve side condition in function sum
            Verification FAILED
            """;

        DiagnosticSet result = classifier.classify(output);

        assertFalse(result.hasSyntaxErrors());
        assertTrue(result.hasProofFailures());
        assertEquals("2 proof failures", result.getSummary());

        Diagnostic.ProofFailure first  = (Diagnostic.ProofFailure) result.getDiagnostics().get(0);
        Diagnostic.ProofFailure second = (Diagnostic.ProofFailure) result.getDiagnostics().get(1);
        assertEquals("sum", first.getSymbol());
        assertEquals("unknown", second.getSymbol());
    }

    @Test
    void testUnrecognizedOutputIsEmpty() {
        DiagnosticSet result = classifier.classify("Checking add.c ...\nsomething odd happened");

        assertTrue(result.isEmpty());
        assertFalse(result.hasSyntaxErrors());
        assertFalse(result.hasProofFailures());
        assertEquals("no classified diagnostics", result.getSummary());
    }

    @Test
    void testBlankOutput() {
        assertTrue(classifier.classify(null).isEmpty());
        assertTrue(classifier.classify("   ").isEmpty());
    }
}
