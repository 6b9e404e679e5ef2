package com.forgemind.dispatch.api;

import com.forgemind.core.Fixtures;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.InvalidTransitionException;
import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.error.PromotionBlockedException;
import com.forgemind.core.error.ValidationException;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.model.TriggerKind;
import com.forgemind.core.registry.BehaviorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BehaviorController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class BehaviorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BehaviorRegistry registry;

    private static final Behavior SUMMARIZER = Fixtures.behavior("summarizer").registeredAt(Fixtures.T0);

    // ── POST /api/v1/behaviors ───────────────────────────────────────

    @Test
    @DisplayName("POST /behaviors registers a DRAFT behavior and returns 201")
    void register() throws Exception {
        when(registry.register(any())).thenReturn(SUMMARIZER);

        String body = """
                {
                  "id": "summarizer",
                  "name": "Summarizer",
                  "description": "Summarizes documents",
                  "tier": "APPLICATION",
                  "actions": [{"name": "summarize", "instructionTemplate": "Summarize {{query}}",
                               "inputSchema": {"query": "string"}, "outputSchema": {"answer": "string"},
                               "timeoutMs": 5000}],
                  "triggers": [{"kind": "COMMAND", "pattern": "/summarize", "priority": 5}],
                  "domain_tags": ["docs"]
                }
                """;

        mockMvc.perform(post("/api/v1/behaviors").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("summarizer"))
                .andExpect(jsonPath("$.lifecycle").value("DRAFT"))
                .andExpect(jsonPath("$.version").value("1.0.0"));

        verify(registry).register(argThat(b -> b.evolvable() && b.domainTags().equals(List.of("docs"))
                && b.actions().get(0).instructionTemplate().equals("Summarize {{query}}")));
    }

    @Test
    @DisplayName("POST /behaviors with an invalid definition returns 400")
    void registerInvalid() throws Exception {
        when(registry.register(any())).thenThrow(new ValidationException("Behavior must declare at least one action"));

        mockMvc.perform(post("/api/v1/behaviors").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"empty\", \"name\": \"Empty\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"))
                .andExpect(jsonPath("$.message").value("Behavior must declare at least one action"));
    }

    // ── GET ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /behaviors/{id} returns 404 for an unknown behavior")
    void getUnknown() throws Exception {
        when(registry.get("missing")).thenThrow(new NotFoundException("Behavior missing not found"));

        mockMvc.perform(get("/api/v1/behaviors/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    @DisplayName("GET /behaviors/match resolves triggers")
    void match() throws Exception {
        when(registry.findByTrigger(TriggerKind.COMMAND, "/summarize")).thenReturn(List.of(SUMMARIZER));

        mockMvc.perform(get("/api/v1/behaviors/match").param("kind", "COMMAND").param("probe", "/summarize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("summarizer"));
    }

    @Test
    @DisplayName("GET /behaviors/search ranks by query")
    void search() throws Exception {
        when(registry.search("release notes", 5)).thenReturn(List.of(SUMMARIZER));

        mockMvc.perform(get("/api/v1/behaviors/search").param("q", "release notes").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Summarizer summarizer"));
    }

    // ── POST /{id}/promote ───────────────────────────────────────────

    @Test
    @DisplayName("promote returns the promoted behavior")
    void promote() throws Exception {
        when(registry.promote("summarizer", LifecycleState.STAGING))
                .thenReturn(SUMMARIZER.withLifecycle(LifecycleState.STAGING, Fixtures.T0));

        mockMvc.perform(post("/api/v1/behaviors/summarizer/promote").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"STAGING\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lifecycle").value("STAGING"));
    }

    @Test
    @DisplayName("promote without a target returns 400")
    void promoteWithoutTarget() throws Exception {
        mockMvc.perform(post("/api/v1/behaviors/summarizer/promote").contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("target is required"));
    }

    @Test
    @DisplayName("a blocked promotion returns 400 promotion_blocked")
    void promotionBlocked() throws Exception {
        when(registry.promote(eq("summarizer"), eq(LifecycleState.ACTIVE)))
                .thenThrow(new PromotionBlockedException("summarizer", "soak period not elapsed"));

        mockMvc.perform(post("/api/v1/behaviors/summarizer/promote").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"ACTIVE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("promotion_blocked"));
    }

    @Test
    @DisplayName("an invalid transition returns 400 invalid_transition")
    void invalidTransition() throws Exception {
        when(registry.promote(eq("summarizer"), eq(LifecycleState.ACTIVE)))
                .thenThrow(new InvalidTransitionException("summarizer", LifecycleState.DRAFT, LifecycleState.ACTIVE));

        mockMvc.perform(post("/api/v1/behaviors/summarizer/promote").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"ACTIVE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_transition"));
    }

    @Test
    @DisplayName("promotion during evolution returns 409")
    void promotionDuringEvolution() throws Exception {
        when(registry.promote(eq("summarizer"), eq(LifecycleState.ACTIVE)))
                .thenThrow(new ConcurrencyException("Behavior summarizer is being evolved"));

        mockMvc.perform(post("/api/v1/behaviors/summarizer/promote").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"ACTIVE\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("concurrency"));
    }

    @Test
    @DisplayName("rollback-flag records the reason")
    void rollbackFlag() throws Exception {
        when(registry.flagRollback("summarizer", "regressed after 1.1.0"))
                .thenReturn(SUMMARIZER.withRollbackReason("regressed after 1.1.0", Fixtures.T0));

        mockMvc.perform(post("/api/v1/behaviors/summarizer/rollback-flag").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"regressed after 1.1.0\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rollbackReason").value("regressed after 1.1.0"));
    }
}
