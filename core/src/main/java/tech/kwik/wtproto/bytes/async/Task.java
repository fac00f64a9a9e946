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
 * An operation that makes progress each time it is polled, until it completes. Polling never blocks (unless the
 * underlying source or sink does); when no progress is possible, pending is returned and the task should be polled
 * again later.
 * @param <T>  type of the result
 * @param <E>  type of the error that terminates the task
 */
public interface Task<T, E extends Exception> {

    /**
     * Resumes the task.
     * @return the result when completed, or pending
     * @throws E  when the task failed
     */
    Poll<T> poll() throws E;
}
