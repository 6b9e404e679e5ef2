package com.forgemind.dispatch.api;

import com.forgemind.core.Fixtures;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.EvolutionJobStatus;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.JobState;
import com.forgemind.core.model.RunStatus;
import com.forgemind.core.model.VersionComparison;
import com.forgemind.core.model.VersionFitness;
import com.forgemind.core.trigger.EvolutionTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EvolutionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EvolutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EvolutionService evolutionService;

    @MockitoBean
    private EvolutionTrigger evolutionTrigger;

    private static EvolutionJobStatus jobStatus(JobState state) {
        return new EvolutionJobStatus("job-1", "summarizer", "summarize", state, "manual", -1, 0.0,
                Fixtures.T0, null, null);
    }

    private static EvolutionJob job(EvolutionResult result) {
        EvolutionJob job = mock(EvolutionJob.class);
        when(job.jobId()).thenReturn("job-1");
        when(job.status()).thenReturn(jobStatus(JobState.PENDING));
        when(job.result()).thenReturn(CompletableFuture.completedFuture(result));
        return job;
    }

    // ── POST /api/v1/evolution/{behaviorId} ──────────────────────────

    @Test
    @DisplayName("POST /evolution/{id} returns 202 with the queued job")
    void submit() throws Exception {
        EvolutionJob job = job(null);
        when(evolutionService.evolveAsync(any())).thenReturn(job);

        mockMvc.perform(post("/api/v1/evolution/summarizer").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"max_generations\": 4, \"target_fitness\": 0.9, \"seed\": 7}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.state").value("PENDING"));

        verify(evolutionService).evolveAsync(argThat(r -> r.behaviorId().equals("summarizer")
                && r.maxGenerations() == 4 && r.targetFitness() == 0.9 && r.seed() == 7L
                && "manual".equals(r.triggerReason())));
    }

    @Test
    @DisplayName("POST /evolution/{id}?wait=true returns the finished result")
    void submitAndWait() throws Exception {
        EvolutionResult result = new EvolutionResult("job-1", "summarizer", "summarize", RunStatus.COMPLETED, true,
                0.89, 0.87, 0.70, 3, "+ Summarize in three sentences.", "1.0.0", "1.1.0", "prompt", List.of(), List.of());
        EvolutionJob job = job(result);
        when(evolutionService.evolveAsync(any())).thenReturn(job);

        mockMvc.perform(post("/api/v1/evolution/summarizer").param("wait", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.improved").value(true))
                .andExpect(jsonPath("$.new_version").value("1.1.0"))
                .andExpect(jsonPath("$.holdout_fitness").value(0.87));
    }

    @Test
    @DisplayName("POST /evolution/{id} while a run is active returns 409")
    void submitWhileRunning() throws Exception {
        when(evolutionService.evolveAsync(any()))
                .thenThrow(new ConcurrencyException("Evolution of summarizer already in progress (job job-0)"));

        mockMvc.perform(post("/api/v1/evolution/summarizer"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("concurrency"));
    }

    // ── status, history, jobs ────────────────────────────────────────

    @Test
    @DisplayName("GET /evolution/status lists active jobs")
    void activeJobs() throws Exception {
        when(evolutionService.getEvolutionStatus("summarizer")).thenReturn(List.of(jobStatus(JobState.RUNNING)));

        mockMvc.perform(get("/api/v1/evolution/status").param("behavior_id", "summarizer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].state").value("RUNNING"));
    }

    @Test
    @DisplayName("GET /evolution/jobs/{id} returns 404 for an unknown job")
    void unknownJob() throws Exception {
        when(evolutionService.getJob("job-x")).thenThrow(new NotFoundException("Evolution job job-x not found"));

        mockMvc.perform(get("/api/v1/evolution/jobs/job-x"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /evolution/jobs/{id} cancels the job")
    void cancel() throws Exception {
        when(evolutionService.cancelEvolution("job-1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/evolution/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    @DisplayName("GET should-evolve reports the trigger decision")
    void shouldEvolve() throws Exception {
        when(evolutionTrigger.shouldEvolve("summarizer"))
                .thenReturn(EvolutionDecision.evolve(EvolutionTrigger.SUCCESS_RATE_BELOW_THRESHOLD));

        mockMvc.perform(get("/api/v1/evolution/summarizer/should-evolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.should_evolve").value(true))
                .andExpect(jsonPath("$.reason").value(EvolutionTrigger.SUCCESS_RATE_BELOW_THRESHOLD));
    }

    @Test
    @DisplayName("GET compare returns the recommendation")
    void compare() throws Exception {
        when(evolutionService.compareVersions("summarizer", "1.0.0", "1.1.0")).thenReturn(new VersionComparison(
                "summarizer", new VersionFitness("1.0.0", 40, 0.7, 200, null),
                new VersionFitness("1.1.0", 30, 0.9, 180, 0.89), "@@ summarize",
                VersionComparison.Recommendation.PREFER_B, "success rate"));

        mockMvc.perform(get("/api/v1/evolution/summarizer/compare").param("a", "1.0.0").param("b", "1.1.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendation").value("PREFER_B"))
                .andExpect(jsonPath("$.versionB.evolvedFitness").value(0.89));
    }
}
