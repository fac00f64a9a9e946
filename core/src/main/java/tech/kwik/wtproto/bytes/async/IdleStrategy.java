/*
 * Copyright © 2025 Peter Doornbosch
 *
 * This file is part of Wtproto, a WebTransport protocol Java library
 *
 * Wtproto is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Wtproto is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.wtproto.bytes.async;

import java.time.Duration;
import java.util.concurrent.locks.LockSupport;

/**
 * Determines what a {@link TaskRunner} does between two polls of a task that is pending.
 */
@FunctionalInterface
public interface IdleStrategy {

    /**
     * Called after a task has returned pending.
     * @param pendingPolls  number of consecutive pending polls so far (starts at 1)
     */
    void idle(long pendingPolls);

    static IdleStrategy spin() {
        return pendingPolls -> Thread.onSpinWait();
    }

    static IdleStrategy yielding() {
        return pendingPolls -> Thread.yield();
    }

    /**
     * Parks the current thread for the given period; an interrupt ends the park early (and leaves the interrupt
     * status set).
     * @param period  time to wait between polls
     * @return the strategy
     */
    static IdleStrategy sleeping(Duration period) {
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        long nanos = period.toNanos();
        return pendingPolls -> LockSupport.parkNanos(nanos);
    }
}
