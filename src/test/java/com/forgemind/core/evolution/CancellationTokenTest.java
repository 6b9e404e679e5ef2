package com.forgemind.core.evolution;

import com.forgemind.core.Fixtures;
import com.forgemind.core.MutableClock;
import com.forgemind.core.model.RunStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    private final MutableClock clock = new MutableClock(Fixtures.T0);

    @Test
    @DisplayName("checkpoint passes until cancelled")
    void cancel() {
        CancellationToken token = CancellationToken.open(clock);
        token.checkpoint();

        token.cancel();

        var e = assertThrows(EvolutionInterruptedException.class, token::checkpoint);
        assertEquals(RunStatus.CANCELLED, e.getStatus());
    }

    @Test
    @DisplayName("checkpoint times out at the deadline")
    void deadline() {
        CancellationToken token = CancellationToken.until(Fixtures.T0.plusSeconds(60), clock);
        assertEquals(Duration.ofSeconds(60), token.remaining());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(token.isExpired());
        assertEquals(Duration.ZERO, token.remaining());
        assertEquals(RunStatus.TIMED_OUT, assertThrows(EvolutionInterruptedException.class, token::checkpoint).getStatus());
    }

    @Test
    @DisplayName("a child shares cancellation and keeps the earlier deadline")
    void child() {
        CancellationToken parent = CancellationToken.until(Fixtures.T0.plusSeconds(30), clock);
        CancellationToken child = parent.child(Fixtures.T0.plusSeconds(120));

        assertEquals(Duration.ofSeconds(30), child.remaining());
        parent.cancel();
        assertTrue(child.isCancelled());
    }

    @Test
    @DisplayName("a child timeout starts from the token's own clock")
    void childTimeout() {
        CancellationToken child = CancellationToken.open(clock).child(Duration.ofMinutes(10));

        assertEquals(Duration.ofMinutes(10), child.remaining());
        clock.advance(Duration.ofMinutes(10));
        assertEquals(RunStatus.TIMED_OUT, assertThrows(EvolutionInterruptedException.class, child::checkpoint).getStatus());
    }

    @Test
    @DisplayName("cap limits a budget to the remaining time")
    void cap() {
        CancellationToken token = CancellationToken.until(Fixtures.T0.plusSeconds(5), clock);

        assertEquals(Duration.ofSeconds(5), token.cap(Duration.ofSeconds(30)));
        assertEquals(Duration.ofSeconds(2), token.cap(Duration.ofSeconds(2)));
        assertEquals(Duration.ofSeconds(30), CancellationToken.open(clock).cap(Duration.ofSeconds(30)));
        assertNull(CancellationToken.none().remaining());
    }
}
