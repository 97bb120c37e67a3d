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

package org.hostkv.database.rocksdb;

import lombok.extern.slf4j.Slf4j;
import org.hostkv.database.CorruptionIndicator;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.Logger;

/**
 * Info log sink installed into RocksDB. Warnings and errors are forwarded to slf4j, and any line reporting
 * corruption flips the {@link CorruptionIndicator}.
 *
 * <p>RocksDB invokes the sink from inside its own API calls, which are not reentrant. The sink must never
 * call back into RocksDB, so it only records the corruption; the repair happens later when the store is
 * closed.
 */
@Slf4j
class RocksDBDiagnosticLogger extends Logger {
    static final String CORRUPTION_MARKER = "Corruption:";
    // spurious warning on first open
    private static final String SPURIOUS_WARNING = "Error when reading";

    private final CorruptionIndicator corruptionIndicator;

    RocksDBDiagnosticLogger(CorruptionIndicator corruptionIndicator) {
        super(InfoLogLevel.WARN_LEVEL);
        this.corruptionIndicator = corruptionIndicator;
    }

    @Override
    protected void log(InfoLogLevel infoLogLevel, String logMsg) {
        if (logMsg == null || !isReported(infoLogLevel)) {
            return;
        }
        if (!logMsg.contains(SPURIOUS_WARNING)) {
            log.info("RocksDB: {}", logMsg);
        }
        if (logMsg.contains(CORRUPTION_MARKER)) {
            corruptionIndicator.setCorrupted();
        }
    }

    private static boolean isReported(InfoLogLevel level) {
        return switch (level) {
            case WARN_LEVEL, ERROR_LEVEL, FATAL_LEVEL -> true;
            default -> false;
        };
    }
}
