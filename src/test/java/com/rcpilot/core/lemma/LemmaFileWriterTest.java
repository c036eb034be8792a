package com.rcpilot.core.lemma;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LemmaFileWriterTest {

    private final LemmaFileWriter writer = new LemmaFileWriter();

    @Test
    void testRendersImportsProvedAndAdmittedLemmas() {
        List<HelperLemma> lemmas = List.of(
                new HelperLemma("sum_nonneg", "forall n, 0 <= sum n.", "intros.\nlia.", List.of()),
                new HelperLemma("sum_bound", "forall n, sum n <= n * n", "", List.of("sum_nonneg")));

        String rendered = writer.render(
                List.of("refinedc.typing.typing", "From stdpp Require Import list", "refinedc.typing.typing"),
                lemmas);

        String expected = String.join("\n",
                "Require Import refinedc.typing.typing.",
                "From stdpp Require Import list.",
                "",
                "Lemma sum_nonneg: forall n, 0 <= sum n.",
                "Proof.",
                "  intros.",
                "  lia.",
                "Qed.",
                "",
                "Lemma sum_bound: forall n, sum n <= n * n.",
                "Proof.",
                "Admitted.",
                "",
                "");
        assertEquals(expected, rendered);
    }

    @Test
    void testNoImports() {
        String rendered = writer.render(List.of(), List.of(new HelperLemma("t", "True", "exact I.", null)));

        assertTrue(rendered.startsWith("Lemma t: True.\n"));
    }

    @Test
    void testFileAndModuleNames() {
        assertEquals("fib_lemmas", LemmaFileWriter.moduleName("fib"));
        assertEquals("fib_lemmas.v", LemmaFileWriter.fileName("fib"));
    }
}
