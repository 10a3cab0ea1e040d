package com.questrail.debounce.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ManualMonotonicClockTest {

    @Test
    void advancesOnlyWhenTold() {
        ManualMonotonicClock clock = new ManualMonotonicClock(0);

        assertEquals(0, clock.nowNanos());
        clock.advance(Duration.ofMillis(3));
        clock.advanceMillis(2);
        assertEquals(5_000_000L, clock.nowNanos());
    }

    @Test
    void refusesToRunBackwards() {
        ManualMonotonicClock clock = new ManualMonotonicClock();

        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofNanos(-1)));
    }
}
