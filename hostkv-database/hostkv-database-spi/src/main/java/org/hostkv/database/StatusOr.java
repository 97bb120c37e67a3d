/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.hostkv.database;

import java.util.NoSuchElementException;
import javax.annotation.Nullable;

/**
 * A status paired with the value it produced, the value is only present when the status is ok.
 *
 * @param <T> the value type
 */
public final class StatusOr<T> {
    private final Status status;
    @Nullable
    private final T value;

    private StatusOr(Status status, @Nullable T value) {
        this.status = status;
        this.value = value;
    }

    public static <T> StatusOr<T> of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Value must not be null");
        }
        return new StatusOr<>(Status.ok(), value);
    }

    public static <T> StatusOr<T> error(Status status) {
        if (status.isOk()) {
            throw new IllegalArgumentException("Error status expected");
        }
        return new StatusOr<>(status, null);
    }

    public Status status() {
        return status;
    }

    public boolean isOk() {
        return status.isOk();
    }

    /**
     * The produced value.
     *
     * @return the value
     * @throws NoSuchElementException if the status is not ok
     */
    public T value() {
        if (!status.isOk()) {
            throw new NoSuchElementException("No value present: " + status);
        }
        return value;
    }

    @Override
    public String toString() {
        return status.isOk() ? "StatusOr[" + value + "]" : "StatusOr[" + status + "]";
    }
}
