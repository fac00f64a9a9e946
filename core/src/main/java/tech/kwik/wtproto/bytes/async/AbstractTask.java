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

/**
 * Base class for tasks that may be used only once: after a task has yielded its result (or has failed), it cannot be
 * polled anymore.
 */
public abstract class AbstractTask<T, E extends Exception> implements Task<T, E> {

    private boolean completed;

    @Override
    public final Poll<T> poll() throws E {
        if (completed) {
            throw new IllegalStateException("task already completed");
        }
        boolean suspended = false;
        try {
            Poll<T> result = resume();
            suspended = result.isPending();
            return result;
        }
        finally {
            completed = !suspended;
        }
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Continues the task from where the previous poll left off.
     * @return the result when completed, or pending
     * @throws E  when the task failed
     */
    protected abstract Poll<T> resume() throws E;
}
