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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.List;
import org.hostkv.database.Domains;
import org.hostkv.sysprops.props.RocksDBBackgroundFlushes;
import org.hostkv.sysprops.props.RocksDBBufferBlocks;
import org.hostkv.sysprops.props.RocksDBMergeNumber;
import org.hostkv.sysprops.props.RocksDBWriteBufferNumber;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.Logger;
import org.rocksdb.RocksDB;
import org.rocksdb.util.SizeUnit;

/**
 * Build RocksDB options for the host store. The store is small, so the options favour a low memory and file
 * footprint over throughput.
 */
final class RocksDBOptionsUtil {
    static final long BLOCK_SIZE = 4 * SizeUnit.KB;

    private RocksDBOptionsUtil() {
    }

    static DBOptions buildDBOptions(Logger infoLogger) {
        DBOptions opts = new DBOptions();
        opts.setCreateIfMissing(true)
            .setCreateMissingColumnFamilies(true)
            .setInfoLogLevel(InfoLogLevel.WARN_LEVEL)
            // info log file settings
            .setLogFileTimeToRoll(0)
            .setKeepLogFileNum(10)
            .setMaxLogFileSize(SizeUnit.MB)
            .setMaxOpenFiles(128)
            .setStatsDumpPeriodSec(0)
            .setMaxManifestFileSize(500 * SizeUnit.KB)
            .setMaxBackgroundFlushes(RocksDBBackgroundFlushes.INSTANCE.get());
        opts.setLogger(infoLogger);
        return opts;
    }

    static ColumnFamilyOptions buildCFOptions() {
        ColumnFamilyOptions cfOptions = new ColumnFamilyOptions();
        cfOptions.optimizeForSmallDb();
        cfOptions
            // use ZSTD_COMPRESSION to trade cpu for disk
            .setCompressionType(CompressionType.NO_COMPRESSION)
            .setCompactionStyle(CompactionStyle.LEVEL)
            .setArenaBlockSize(BLOCK_SIZE)
            .setWriteBufferSize(BLOCK_SIZE * RocksDBBufferBlocks.INSTANCE.get())
            .setMaxWriteBufferNumber(RocksDBWriteBufferNumber.INSTANCE.get())
            .setMinWriteBufferNumberToMerge(RocksDBMergeNumber.INSTANCE.get());
        return cfOptions;
    }

    /**
     * Descriptors of every column family the store is opened with: the engine's default column family first,
     * followed by one per domain in {@link Domains#ALL} order.
     */
    static List<ColumnFamilyDescriptor> buildCFDescriptors(ColumnFamilyOptions cfOptions) {
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>(Domains.ALL.size() + 1);
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        for (String domain : Domains.ALL) {
            descriptors.add(new ColumnFamilyDescriptor(domain.getBytes(UTF_8), cfOptions));
        }
        return descriptors;
    }
}
