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
 * State shared between the database layer and the rest of the host process.
 *
 * <p>Every database plugin receives the context at construction. Plugins sharing a context observe the same
 * corruption signal, and any subsystem holding the context can request a repair without a reference to the
 * plugin owning the store.
 */
public final class DiagnosticsContext {
    private static final DiagnosticsContext PROCESS_WIDE = new DiagnosticsContext();

    private final CorruptionIndicator corruptionIndicator = new CorruptionIndicator();
    private final AtomicBoolean eventsDisabled = new AtomicBoolean(false);

    /**
     * The context shared by the whole process, for hosts running a single store.
     *
     * @return the process-wide context
     */
    public static DiagnosticsContext processWide() {
        return PROCESS_WIDE;
    }

    public CorruptionIndicator corruptionIndicator() {
        return corruptionIndicator;
    }

    /**
     * Signal event capture subsystems to stop producing data, used once the store degrades to read-only.
     */
    public void disableEvents() {
        eventsDisabled.set(true);
    }

    public boolean isEventsDisabled() {
        return eventsDisabled.get();
    }
}
