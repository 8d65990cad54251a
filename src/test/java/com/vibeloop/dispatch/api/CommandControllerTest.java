package com.vibeloop.dispatch.api;

import com.vibeloop.core.contracts.Actor;
import com.vibeloop.core.contracts.ControlAction;
import com.vibeloop.core.contracts.ControlCommand;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.Route;
import com.vibeloop.core.engine.RunManager;
import com.vibeloop.core.engine.RunNotActiveException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CommandController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CommandControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RunManager runManager;

    // ── POST /api/control ────────────────────────────────────────────

    @Test
    @DisplayName("POST /control pause returns ok and forwards the command")
    void pause() throws Exception {
        mockMvc.perform(post("/api/control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"pause\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(runManager).control(new ControlCommand(ControlAction.PAUSE));
    }

    @Test
    @DisplayName("POST /control with an unknown action returns 400")
    void unknownAction() throws Exception {
        mockMvc.perform(post("/api/control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"stop\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error", containsString("stop")));

        verify(runManager, never()).control(any());
    }

    @Test
    @DisplayName("POST /control without an action returns 400")
    void missingAction() throws Exception {
        mockMvc.perform(post("/api/control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("action is required"));
    }

    @Test
    @DisplayName("POST /control with malformed JSON returns 400")
    void malformedJson() throws Exception {
        mockMvc.perform(post("/api/control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok").value(false));
    }

    @Test
    @DisplayName("POST /control without an active run returns 409")
    void noActiveRun() throws Exception {
        doThrow(new RunNotActiveException("No run has been started")).when(runManager).control(any());

        mockMvc.perform(post("/api/control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"resume\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("No run has been started"));
    }

    // ── POST /api/prompt ─────────────────────────────────────────────

    @Test
    @DisplayName("POST /prompt enqueues the prompt with its content verbatim")
    void prompt() throws Exception {
        mockMvc.perform(post("/api/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"user\",\"route_to\":\"code\",\"content\":[\"add a button\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(runManager).prompt(new PromptCommand(Actor.USER, Route.CODE, List.of("add a button")));
    }

    @Test
    @DisplayName("POST /prompt keeps structured parts as parsed JSON")
    void structuredPrompt() throws Exception {
        mockMvc.perform(post("/api/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actor":"vision","route_to":"code",
                                 "content":[{"type":"text","text":"bigger title"}]}
                                """))
                .andExpect(status().isOk());

        verify(runManager).prompt(new PromptCommand(Actor.VISION, Route.CODE,
                List.of(Map.of("type", "text", "text", "bigger title"))));
    }

    @Test
    @DisplayName("POST /prompt with an unknown route returns 400")
    void unknownRoute() throws Exception {
        mockMvc.perform(post("/api/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"user\",\"route_to\":\"user\",\"content\":[\"x\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("route_to")));

        verify(runManager, never()).prompt(any());
    }

    @Test
    @DisplayName("POST /prompt with empty content returns 400")
    void emptyContent() throws Exception {
        mockMvc.perform(post("/api/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"user\",\"route_to\":\"code\",\"content\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /prompt without an active run returns 409")
    void promptNoActiveRun() throws Exception {
        doThrow(new RunNotActiveException("Run r has stopped; start a new run")).when(runManager).prompt(any());

        mockMvc.perform(post("/api/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"user\",\"route_to\":\"code\",\"content\":[\"x\"]}"))
                .andExpect(status().isConflict());
    }
}
