package com.rcpilot.core.state;

/**
 * Phase graph of one file's repair flow.
 *
 * INIT → GENERATING_SPEC → VERIFYING ─┬→ SUCCESS
 *                                     ├→ REGENERATING_SPEC → VERIFYING
 *                                     └→ ESCALATING_TO_LEMMAS → GENERATING_LEMMA
 *                                           → VERIFYING_WITH_LEMMA ─┬→ SUCCESS
 *                                                                   └→ GENERATING_LEMMA
 * any failing phase with its budget spent → EXHAUSTED
 *
 * GENERATING_SPEC      — first spec generation, only when no annotations exist yet.
 * VERIFYING            — artifact written, verifier invoked, output classified.
 * REGENERATING_SPEC    — spec generator re-invoked with the last error and attempt history.
 * ESCALATING_TO_LEMMAS — spec budget spent (or proof failures with early escalation);
 *                        the lemma import directive is inserted.
 * GENERATING_LEMMA     — lemma generator invoked, new lemmas appended, lemma file written.
 * VERIFYING_WITH_LEMMA — verifier invoked against the text plus lemma file.
 */
public enum RepairPhase {
    INIT,
    GENERATING_SPEC,
    VERIFYING,
    REGENERATING_SPEC,
    ESCALATING_TO_LEMMAS,
    GENERATING_LEMMA,
    VERIFYING_WITH_LEMMA,
    SUCCESS,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXHAUSTED;
    }
}
