package com.rcpilot.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairConfigTest {

    @Test
    void testDefaults() {
        RepairConfig config = RepairConfig.builder().build();

        assertEquals(5, config.getSpecMaxIterations());
        assertTrue(config.isLemmaEnabled());
        assertEquals(3, config.getLemmaMaxIterations());
        assertFalse(config.isEscalateOnProofFailure());
        assertEquals("refinedc check", config.getVerifierCommand());
        assertEquals(List.of("refinedc.typing.typing"), config.getLemmaImports());
        assertEquals(Duration.ofSeconds(300), config.getIterationTimeout());
        assertEquals(8, config.getTotalIterationBudget());
    }

    @Test
    void testBudgetWithoutLemmas() {
        RepairConfig config = RepairConfig.builder().specMaxIterations(2).lemmaEnabled(false).build();

        assertEquals(2, config.getTotalIterationBudget());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RepairConfig.builder().specMaxIterations(0).build());
        assertThrows(IllegalArgumentException.class, () -> RepairConfig.builder().maxFlows(0).build());
        assertThrows(IllegalArgumentException.class, () -> RepairConfig.builder().verifierCommand(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> RepairConfig.builder().flowTimeout(Duration.ZERO).build());
    }

    @Test
    void testImportListSplitting() {
        assertEquals(List.of("refinedc.typing.typing", "stdpp.list"),
                RcPilotConfiguration.splitList(" refinedc.typing.typing, ,stdpp.list "));
        assertTrue(RcPilotConfiguration.splitList("").isEmpty());
    }
}
