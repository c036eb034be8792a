package com.rcpilot.controller;

import com.rcpilot.config.RepairConfig;
import com.rcpilot.core.verifier.StubVerifier;
import com.rcpilot.core.verifier.Verifier;
import com.rcpilot.llm.LLMClient;
import com.rcpilot.llm.MockLLMClient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "mock", "stub"})
class RepairControllerTest {

    private static final String MAIN_SOURCE = "int main(void) {\n    return 0;\n}\n";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RepairConfig config;

    @Autowired
    private LLMClient llmClient;

    @Autowired
    private Verifier verifier;

    @BeforeEach
    void setUp() throws Exception {
        Path project = Path.of(config.getSourcesDir(), "demo");
        Files.createDirectories(project);
        Files.writeString(project.resolve("main.c"), MAIN_SOURCE);
    }

    @Test
    void testProfilesSelectOfflineBackEnds() {
        assertTrue(llmClient instanceof MockLLMClient);
        assertTrue(verifier instanceof StubVerifier);
        assertEquals(2, config.getMaxFlows());
    }

    @Test
    void testRepairProject() throws Exception {
        mockMvc.perform(post("/repair/project")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\": \"demo\", \"resume\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.project").value("demo"))
                .andExpect(jsonPath("$.outcomes[0].path").value("main.c"))
                .andExpect(jsonPath("$.outcomes[0].report.success").value(true))
                .andExpect(jsonPath("$.outcomes[0].persisted").value(true));

        String written = Files.readString(Path.of(config.getOutputDir(), "demo", "main.c"));
        assertEquals("[[rc::returns(\"int<i32>\")]]\n" + MAIN_SOURCE, written);
    }

    @Test
    void testRepairFile() throws Exception {
        mockMvc.perform(post("/repair/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\": \"demo\", \"path\": \"main.c\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.iterationsTotal").value(1));
    }

    @Test
    void testBlankProjectIsBadRequest() throws Exception {
        mockMvc.perform(post("/repair/project")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\": \"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUnknownProjectIsBadRequest() throws Exception {
        mockMvc.perform(post("/repair/project")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\": \"no-such-project\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("RepairConfigurationException"));
    }

    @Test
    void testEscapingFilePathIsBadRequest() throws Exception {
        mockMvc.perform(post("/repair/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\": \"demo\", \"path\": \"../other/main.c\"}"))
                .andExpect(status().isBadRequest());
    }
}
