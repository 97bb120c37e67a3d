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

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

/**
 * Forward key iterator over one column family for one-shot scans: checksum verification is skipped and
 * visited blocks are kept out of the block cache.
 */
class RocksDBKeyIterator implements AutoCloseable {
    private final RocksIterator rocksIterator;
    private final ReadOptions readOptions;

    RocksDBKeyIterator(RocksDB db, ColumnFamilyHandle cfHandle) {
        readOptions = new ReadOptions().setVerifyChecksums(false).setFillCache(false);
        rocksIterator = db.newIterator(cfHandle, readOptions);
    }

    public String key() {
        return new String(rocksIterator.key(), UTF_8);
    }

    public boolean isValid() {
        return rocksIterator.isValid();
    }

    public void next() {
        rocksIterator.next();
    }

    public void seekToFirst() {
        rocksIterator.seekToFirst();
    }

    /**
     * Surface an error the iterator stopped on.
     *
     * @throws RocksDBException if the iteration did not reach the end cleanly
     */
    public void checkStatus() throws RocksDBException {
        rocksIterator.status();
    }

    @Override
    public void close() {
        rocksIterator.close();
        readOptions.close();
    }
}
