package com.rcpilot.core.lemma;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LemmaImportDirectiveTest {

    private static final String DIRECTIVE = LemmaImportDirective.forFile("fib", "refinedc.project");

    @Test
    void testDirectiveFormat() {
        assertEquals("//@rc::import fib_lemmas from refinedc.project", DIRECTIVE);
    }

    @Test
    void testInsertedAtTopWithoutExistingDirectives() {
        String text = LemmaImportDirective.insertInto("int x;\n", DIRECTIVE);

        assertEquals(DIRECTIVE + "\nint x;\n", text);
    }

    @Test
    void testInsertedAfterLastExistingDirective() {
        String source = "//@rc::import a from b\n//@rc::inlined\nint x;\n";

        String text = LemmaImportDirective.insertInto(source, DIRECTIVE);

        assertEquals("//@rc::import a from b\n//@rc::inlined\n" + DIRECTIVE + "\nint x;\n", text);
    }

    @Test
    void testDirectiveOnLastLine() {
        String text = LemmaImportDirective.insertInto("//@rc::inlined", DIRECTIVE);

        assertEquals("//@rc::inlined\n" + DIRECTIVE, text);
    }

    @Test
    void testInsertedOnlyOnce() {
        String once  = LemmaImportDirective.insertInto("int x;\n", DIRECTIVE);
        String twice = LemmaImportDirective.insertInto(once, DIRECTIVE);

        assertEquals(once, twice);
    }
}
