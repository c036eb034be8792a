package com.rcpilot.core.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.core.diagnostic.DiagnosticSet;
import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.insertion.AnnotationRequest;
import com.rcpilot.core.insertion.InsertionHint;
import com.rcpilot.core.lemma.HelperLemma;
import com.rcpilot.core.state.RepairAttempt;
import com.rcpilot.core.state.RepairPhase;
import com.rcpilot.core.state.RepairState;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RepairStateStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemManager artifacts;
    private RepairStateStore  store;

    @BeforeEach
    void setUp() {
        artifacts = new FileSystemManager(tempDir.toString());
        store     = new RepairStateStore(artifacts, new ArtifactPathResolver(), new ObjectMapper());
    }

    @Test
    void testSaveAndLoadKeepsEverythingNeededToResume() {
        RepairState state = new RepairState();
        state.replaceAnnotations(List.of(
                AnnotationRequest.of("[[rc::returns(\"int<i32>\")]]"),
                AnnotationRequest.at("// loop inv", InsertionHint.after("fib"))));
        state.recordSpecIteration();
        state.recordSpecIteration();
        state.enterLemmaPhase();
        state.appendLemmas(List.of(new HelperLemma("fib_pos", "forall n, 0 <= fib n", "", List.of())));
        state.addLemmaImports(List.of("stdpp.list"));
        state.recordLemmaIteration();
        state.setLastError("function fib failed");
        state.setPhase(RepairPhase.EXHAUSTED);
        state.addAttempt(RepairAttempt.builder(3, RepairAttempt.Outcome.of(DiagnosticSet.empty()))
                .phase(RepairPhase.VERIFYING_WITH_LEMMA)
                .diagnosticSummary("no classified diagnostics")
                .errorExcerpt("function fib failed")
                .annotationCount(2)
                .lemmaCount(1)
                .build());

        store.save("proj", "src/fib.c", state);
        Optional<RepairState> loaded = store.load("proj", "src/fib.c");

        assertTrue(loaded.isPresent());
        RepairState restored = loaded.get();
        assertEquals(3, restored.getIterationsUsed());
        assertEquals(1, restored.getLemmaIterationsUsed());
        assertEquals(2, restored.getSpecIterationsUsed());
        assertTrue(restored.isLemmaPhaseEntered());
        assertEquals(state.getCurrentAnnotations(), restored.getCurrentAnnotations());
        assertEquals(state.getHelperLemmas(), restored.getHelperLemmas());
        assertEquals(List.of("stdpp.list"), restored.getLemmaImports());
        assertEquals("function fib failed", restored.getLastError());
        assertEquals(RepairPhase.EXHAUSTED, restored.getPhase());
        assertEquals(1, restored.getAttempts().size());
        assertEquals(RepairPhase.VERIFYING_WITH_LEMMA, restored.getAttempts().get(0).getPhase());
    }

    @Test
    void testNotGeneratedAnnotationsStayNull() {
        store.save("proj", "a.c", new RepairState());

        assertFalse(store.load("proj", "a.c").orElseThrow().hasAnnotations());
    }

    @Test
    void testMissingStateIsEmpty() {
        assertTrue(store.load("proj", "never.c").isEmpty());
    }

    @Test
    void testUnreadableStateIsRejected() throws Exception {
        Path file = tempDir.resolve("proj/_rcpilot/state/broken.c.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        RepairConfigurationException e = assertThrows(RepairConfigurationException.class,
                () -> store.load("proj", "broken.c"));
        assertEquals("broken.c", e.getPath());
        assertTrue(e.getMessage().contains("unreadable"));
    }
}
