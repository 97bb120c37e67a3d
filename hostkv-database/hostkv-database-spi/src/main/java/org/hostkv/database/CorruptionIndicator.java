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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-slot flag recording that the store has been observed as corrupted.
 *
 * <p>Setting and reading never block, so it is safe to flip from inside a storage engine callback running on
 * an arbitrary engine thread. The owner of the store consumes the flag when it closes the store.
 */
public final class CorruptionIndicator {
    private final AtomicBoolean corrupted = new AtomicBoolean(false);

    public boolean isCorrupted() {
        return corrupted.get();
    }

    public void setCorrupted() {
        setCorrupted(true);
    }

    public void setCorrupted(boolean corrupted) {
        this.corrupted.set(corrupted);
    }
}
