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

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import org.hostkv.database.CorruptionIndicator;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class RocksDBDiagnosticLoggerTest {
    private CorruptionIndicator indicator;
    private RocksDBDiagnosticLogger logger;

    @BeforeClass
    public void loadLibrary() {
        RocksDB.loadLibrary();
    }

    @BeforeMethod
    public void setup() {
        indicator = new CorruptionIndicator();
        logger = new RocksDBDiagnosticLogger(indicator);
    }

    @AfterMethod
    public void teardown() {
        logger.close();
    }

    @Test
    public void warnCorruption() {
        logger.log(InfoLogLevel.WARN_LEVEL, "[db/version_set.cc:1234] Corruption: block checksum mismatch");
        assertTrue(indicator.isCorrupted());
    }

    @Test
    public void fatalCorruption() {
        logger.log(InfoLogLevel.FATAL_LEVEL, "Corruption: truncated record body");
        assertTrue(indicator.isCorrupted());
    }

    @Test
    public void lowLevelIgnored() {
        logger.log(InfoLogLevel.INFO_LEVEL, "Corruption: reported at info");
        logger.log(InfoLogLevel.DEBUG_LEVEL, "Corruption: reported at debug");
        logger.log(InfoLogLevel.HEADER_LEVEL, "Corruption: reported in header");
        assertFalse(indicator.isCorrupted());
    }

    @Test
    public void errorWithoutCorruption() {
        logger.log(InfoLogLevel.ERROR_LEVEL, "IO error: No space left on device");
        logger.log(InfoLogLevel.WARN_LEVEL, "Error when reading /tmp/db/IDENTITY");
        logger.log(InfoLogLevel.WARN_LEVEL, null);
        assertFalse(indicator.isCorrupted());
    }

    @Test
    public void suppressedLineStillDetectsCorruption() {
        logger.log(InfoLogLevel.ERROR_LEVEL, "Error when reading MANIFEST: Corruption: bad record length");
        assertTrue(indicator.isCorrupted());
    }
}
