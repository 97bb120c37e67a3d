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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.hostkv.database.DatabaseException;
import org.hostkv.database.Domains;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

/**
 * An open RocksDB instance together with the column family handle of every domain.
 */
class RocksDBHandle implements AutoCloseable {
    private final RocksDB db;
    // engine default column family, not addressable as a domain
    private final ColumnFamilyHandle defaultCF;
    private final ImmutableMap<String, ColumnFamilyHandle> domainCFs;

    /**
     * Bind the handles returned by the open call to their domains.
     *
     * @param db        the opened db
     * @param cfHandles handles in the order of {@link RocksDBOptionsUtil#buildCFDescriptors}
     */
    RocksDBHandle(RocksDB db, List<ColumnFamilyHandle> cfHandles) {
        if (cfHandles.size() != Domains.ALL.size() + 1) {
            throw new DatabaseException("Unexpected column family count: " + cfHandles.size());
        }
        ImmutableMap.Builder<String, ColumnFamilyHandle> builder = ImmutableMap.builder();
        for (int i = 0; i < Domains.ALL.size(); i++) {
            String domain = Domains.ALL.get(i);
            ColumnFamilyHandle cf = cfHandles.get(i + 1);
            checkName(cf, domain.getBytes(UTF_8));
            builder.put(domain, cf);
        }
        checkName(cfHandles.get(0), RocksDB.DEFAULT_COLUMN_FAMILY);
        this.db = db;
        this.defaultCF = cfHandles.get(0);
        this.domainCFs = builder.build();
    }

    private static void checkName(ColumnFamilyHandle cf, byte[] expected) {
        try {
            if (!Arrays.equals(cf.getName(), expected)) {
                throw new DatabaseException("Column family mismatch, expect: " + new String(expected, UTF_8)
                    + ", actual: " + new String(cf.getName(), UTF_8));
            }
        } catch (RocksDBException e) {
            throw new DatabaseException("Unable to read column family name", e);
        }
    }

    RocksDB db() {
        return db;
    }

    Optional<ColumnFamilyHandle> cf(String domain) {
        return Optional.ofNullable(domainCFs.get(domain));
    }

    /**
     * Release every column family handle, then the db itself.
     */
    @Override
    public void close() {
        domainCFs.values().forEach(ColumnFamilyHandle::close);
        defaultCF.close();
        db.close();
    }
}
