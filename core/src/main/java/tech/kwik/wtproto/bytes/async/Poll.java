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

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Outcome of a non-blocking operation: either ready with a value, or pending (no progress possible at this moment).
 * @param <T>  type of the value
 */
public final class Poll<T> {

    private final boolean ready;
    private final T value;

    private Poll(boolean ready, T value) {
        this.ready = ready;
        this.value = value;
    }

    public static <T> Poll<T> ready(T value) {
        if (value == null) {
            throw new IllegalArgumentException("ready value must not be null");
        }
        return new Poll<>(true, value);
    }

    public static <T> Poll<T> pending() {
        return new Poll<>(false, null);
    }

    public boolean isReady() {
        return ready;
    }

    public boolean isPending() {
        return !ready;
    }

    /**
     * Returns the value.
     * @return the value
     * @throws NoSuchElementException  when pending
     */
    public T get() {
        if (isPending()) {
            throw new NoSuchElementException("pending");
        }
        return value;
    }

    public <U> Poll<U> map(Function<? super T, ? extends U> mapper) {
        if (isPending()) {
            return pending();
        }
        return ready(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isPending()? "Pending": "Ready[" + value + "]";
    }
}
