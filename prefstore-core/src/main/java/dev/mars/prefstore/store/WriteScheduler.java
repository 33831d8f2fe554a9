/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.prefstore.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Debounce state machine deciding when a deferred write reaches disk.
 * <pre>
 *            defer()                 onTimer(): due
 *   IDLE ───────────→ SCHEDULED ───────────────────→ FIRING
 *    ↑                 │  ↑   │                         │
 *    │     cancel()    │  └───┘ defer(): deadline       │ fired()
 *    └─────────────────┘        moves to now + delay    │
 *    └──────────────────────────────────────────────────┘
 * </pre>
 * Only one timer is ever outstanding: {@link #defer()} asks the caller to
 * arm one when leaving IDLE, and later deferrals just move the deadline.
 * When the timer elapses early (deadline moved) {@link #onTimer()} answers
 * {@link TimerAction#REARM} with {@link #remaining()} left to wait.
 * <p>
 * Time comes from the injected {@link Clock}, so the machine can be driven
 * deterministically. Not thread-safe: confined to the store's writer thread.
 */
public final class WriteScheduler {

    public enum Phase {
        IDLE,
        SCHEDULED,
        FIRING
    }

    /** What to do when the debounce timer elapses. */
    public enum TimerAction {
        /** Deadline reached: the caller performs the write, then calls {@link #fired()}. */
        FIRE,
        /** Deadline moved: arm a new timer for {@link #remaining()}. */
        REARM,
        /** Nothing pending any more (cancelled or already written). */
        IGNORE
    }

    private final Clock clock;
    private final Duration delay;

    private Phase phase = Phase.IDLE;
    private Instant deadline;

    public WriteScheduler(Clock clock, Duration delay) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
    }

    public Phase phase() {
        return phase;
    }

    public Duration delay() {
        return delay;
    }

    /** Deadline of the pending write, present only while SCHEDULED. */
    public Optional<Instant> deadline() {
        return phase == Phase.SCHEDULED ? Optional.of(deadline) : Optional.empty();
    }

    /**
     * Records a deferred write, (re)setting the deadline to now + delay.
     *
     * @return true if the caller must arm a timer for {@link #delay()}
     */
    public boolean defer() {
        deadline = clock.instant().plus(delay);
        if (phase == Phase.SCHEDULED) {
            return false;
        }
        phase = Phase.SCHEDULED;
        return true;
    }

    /**
     * Handles an elapsed timer.
     */
    public TimerAction onTimer() {
        if (phase != Phase.SCHEDULED) {
            return TimerAction.IGNORE;
        }
        if (remaining().isZero()) {
            phase = Phase.FIRING;
            return TimerAction.FIRE;
        }
        return TimerAction.REARM;
    }

    /**
     * Time left until the pending write is due; zero when due or when nothing is pending.
     */
    public Duration remaining() {
        if (phase != Phase.SCHEDULED) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** Marks the write started by {@link TimerAction#FIRE} as finished. */
    public void fired() {
        if (phase == Phase.FIRING) {
            phase = Phase.IDLE;
            deadline = null;
        }
    }

    /**
     * Drops the pending write, if any.
     *
     * @return true if a write was scheduled
     */
    public boolean cancel() {
        boolean wasScheduled = phase == Phase.SCHEDULED;
        if (phase != Phase.FIRING) {
            phase = Phase.IDLE;
            deadline = null;
        }
        return wasScheduled;
    }
}
