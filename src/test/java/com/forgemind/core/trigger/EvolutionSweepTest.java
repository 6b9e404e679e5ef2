package com.forgemind.core.trigger;

import com.forgemind.core.Fixtures;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.evolution.EvolutionRequest;
import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.registry.BehaviorFilter;
import com.forgemind.core.registry.BehaviorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EvolutionSweepTest {

    private BehaviorRegistry registry;
    private EvolutionTrigger trigger;
    private EvolutionService evolutionService;
    private TriggerProperties properties;
    private EvolutionSweep sweep;

    @BeforeEach
    void setUp() {
        registry = mock(BehaviorRegistry.class);
        trigger = mock(EvolutionTrigger.class);
        evolutionService = mock(EvolutionService.class);
        properties = new TriggerProperties();
        sweep = new EvolutionSweep(registry, trigger, evolutionService, properties);
    }

    private static Behavior active(String id) {
        return Fixtures.behavior(id).registeredAt(Fixtures.T0).withLifecycle(LifecycleState.ACTIVE, Fixtures.T0);
    }

    @Test
    @DisplayName("submits one job per triggered behavior with the trigger reason")
    void submitsTriggered() {
        when(registry.list(any(BehaviorFilter.class))).thenReturn(List.of(active("a"), active("b")));
        when(trigger.shouldEvolve("a")).thenReturn(EvolutionDecision.evolve(EvolutionTrigger.EXECUTION_VOLUME_REACHED));
        when(trigger.shouldEvolve("b")).thenReturn(EvolutionDecision.skip(EvolutionTrigger.INSUFFICIENT_EXECUTIONS));
        EvolutionJob job = mock(EvolutionJob.class);
        when(evolutionService.evolveAsync(any())).thenReturn(job);

        List<EvolutionJob> submitted = sweep.runOnce();

        assertEquals(List.of(job), submitted);
        ArgumentCaptor<EvolutionRequest> request = ArgumentCaptor.forClass(EvolutionRequest.class);
        verify(evolutionService).evolveAsync(request.capture());
        assertEquals("a", request.getValue().behaviorId());
        assertEquals(EvolutionTrigger.EXECUTION_VOLUME_REACHED, request.getValue().triggerReason());
    }

    @Test
    @DisplayName("only ACTIVE behaviors are considered")
    void activeOnly() {
        when(registry.list(any(BehaviorFilter.class))).thenReturn(List.of());

        sweep.runOnce();

        ArgumentCaptor<BehaviorFilter> filter = ArgumentCaptor.forClass(BehaviorFilter.class);
        verify(registry).list(filter.capture());
        assertEquals(LifecycleState.ACTIVE, filter.getValue().lifecycle());
        verifyNoInteractions(trigger, evolutionService);
    }

    @Test
    @DisplayName("a failed submission does not stop the sweep")
    void continuesAfterFailure() {
        when(registry.list(any(BehaviorFilter.class))).thenReturn(List.of(active("a"), active("b")));
        when(trigger.shouldEvolve(any())).thenReturn(EvolutionDecision.evolve(EvolutionTrigger.EXECUTION_VOLUME_REACHED));
        EvolutionJob job = mock(EvolutionJob.class);
        when(evolutionService.evolveAsync(any()))
                .thenThrow(new ConcurrencyException("Evolution already running for a"))
                .thenReturn(job);

        assertEquals(List.of(job), sweep.runOnce());
        verify(evolutionService, times(2)).evolveAsync(any());
    }

    @Test
    @DisplayName("the scheduled hook does nothing unless enabled")
    void scheduledHook() {
        sweep.scheduledSweep();
        verifyNoInteractions(registry);

        properties.setSweepEnabled(true);
        when(registry.list(any(BehaviorFilter.class))).thenReturn(List.of());
        sweep.scheduledSweep();
        verify(registry).list(any(BehaviorFilter.class));
    }
}
