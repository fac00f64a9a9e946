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

import tech.kwik.core.log.Logger;
import tech.kwik.core.log.NullLogger;

import java.util.concurrent.CancellationException;

/**
 * Drives a {@link Task} to completion on the calling thread. Errors raised by the task are rethrown unchanged.
 */
public class TaskRunner {

    private final IdleStrategy idleStrategy;
    private final long maxPendingPolls;
    private final Logger log;

    private TaskRunner(Builder builder) {
        idleStrategy = builder.idleStrategy;
        maxPendingPolls = builder.maxPendingPolls;
        log = builder.log;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Polls the task until it completes.
     * @param task  the task to run
     * @return the result of the task
     * @throws E  when the task fails
     * @throws TaskTimeoutException  when the task is still pending after the maximum number of pending polls
     * @throws CancellationException  when the calling thread is interrupted while the task is pending
     */
    public <T, E extends Exception> T run(Task<T, E> task) throws E {
        long pendingPolls = 0;
        while (true) {
            Poll<T> result = task.poll();
            if (result.isReady()) {
                if (pendingPolls > 0) {
                    log.debug("Task completed after " + pendingPolls + " pending polls");
                }
                return result.get();
            }
            pendingPolls++;
            if (pendingPolls > maxPendingPolls) {
                log.warn("Giving up on task after " + maxPendingPolls + " pending polls");
                throw new TaskTimeoutException(maxPendingPolls);
            }
            idleStrategy.idle(pendingPolls);
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Interrupted while waiting for task");
            }
        }
    }

    public static class Builder {

        private IdleStrategy idleStrategy = IdleStrategy.spin();
        private long maxPendingPolls = Long.MAX_VALUE;
        private Logger log = new NullLogger();

        public Builder idleStrategy(IdleStrategy idleStrategy) {
            this.idleStrategy = idleStrategy;
            return this;
        }

        public Builder maxPendingPolls(long maxPendingPolls) {
            if (maxPendingPolls < 0) {
                throw new IllegalArgumentException("maxPendingPolls must not be negative");
            }
            this.maxPendingPolls = maxPendingPolls;
            return this;
        }

        public Builder logger(Logger log) {
            this.log = log;
            return this;
        }

        public TaskRunner build() {
            return new TaskRunner(this);
        }
    }
}
