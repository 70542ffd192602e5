package com.codeswarm.controller;

import com.codeswarm.core.filesystem.FileSystemManager;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "codeswarm.sandbox.root=target/test-sandbox")
@AutoConfigureMockMvc
@ActiveProfiles("mock")
class RefactorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FileSystemManager fileSystem;

    @Test
    void testMissingTargetIsBadRequest() throws Exception {
        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("targetDir is required"));
    }

    @Test
    void testTargetOutsideSandboxIsBadRequest() throws Exception {
        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDir\": \"../../etc\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUnknownTargetIsBadRequest() throws Exception {
        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDir\": \"does-not-exist\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testInvalidBudgetIsBadRequest() throws Exception {
        Files.createDirectories(fileSystem.getSandboxRoot().resolve("budget-proj"));

        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDir\": \"budget-proj\", \"maxIterations\": \"many\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDir\": \"budget-proj\", \"maxIterations\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testTargetWithoutPythonFilesSucceeds() throws Exception {
        Files.createDirectories(fileSystem.getSandboxRoot().resolve("empty-proj"));

        mockMvc.perform(post("/refactor/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDir\": \"empty-proj\", \"maxIterations\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.terminalState").value("SUCCESS"))
                .andExpect(jsonPath("$.iterations").value(1))
                .andExpect(jsonPath("$.maxIterations").value(2))
                .andExpect(jsonPath("$.exitCode").value(0))
                .andExpect(jsonPath("$.uncertain").value(false));
    }

    @Test
    void testCancelWithoutActiveRuns() throws Exception {
        mockMvc.perform(post("/refactor/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(0));

        mockMvc.perform(post("/refactor/cancel").param("runId", "nope"))
                .andExpect(status().isNotFound());
    }
}
