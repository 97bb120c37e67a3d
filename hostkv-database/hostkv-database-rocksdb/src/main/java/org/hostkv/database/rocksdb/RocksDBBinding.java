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

import java.util.ArrayList;
import java.util.List;
import org.hostkv.database.DatabaseException;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

/**
 * Opens RocksDB instances for the database plugin.
 */
class RocksDBBinding {
    static {
        RocksDB.loadLibrary();
    }

    /**
     * Open the db at the path with every given column family.
     *
     * @param dbOptions the db options
     * @param path      the db directory
     * @param cfDescs   the column families, the default one first
     * @return the handle
     * @throws RocksDBException if the engine fails to open the db, the exception carries the engine status
     */
    RocksDBHandle open(DBOptions dbOptions, String path, List<ColumnFamilyDescriptor> cfDescs)
        throws RocksDBException {
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>(cfDescs.size());
        RocksDB db = RocksDB.open(dbOptions, path, cfDescs, cfHandles);
        try {
            return new RocksDBHandle(db, cfHandles);
        } catch (DatabaseException e) {
            cfHandles.forEach(ColumnFamilyHandle::close);
            db.close();
            throw e;
        }
    }
}
