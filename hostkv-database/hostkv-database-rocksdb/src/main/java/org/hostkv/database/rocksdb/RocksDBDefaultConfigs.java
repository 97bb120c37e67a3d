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

import com.google.protobuf.Struct;
import java.util.Map;
import org.hostkv.database.StructUtil;

/**
 * Default configuration of the RocksDB database plugin.
 */
public final class RocksDBDefaultConfigs {
    public static final String DB_PATH = "databasePath";
    // a failed read-write open is fatal instead of degrading to read-only
    public static final String REQUIRE_WRITE = "requireWrite";
    public static final String ALLOW_OPEN = "allowOpen";
    // quiet mode used when the host only checks the store
    public static final String CHECKING = "checking";
    public static final String BACKUP_SUFFIX = ".backup";
    public static final Struct DEFAULT = StructUtil.fromMap(Map.of(
        DB_PATH, "hostkv.db",
        REQUIRE_WRITE, false,
        ALLOW_OPEN, true,
        CHECKING, false));

    private RocksDBDefaultConfigs() {
    }
}
