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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hostkv.database.Domains;
import org.hostkv.database.Status;
import org.mockito.Mockito;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.testng.annotations.Test;

public class RocksDBWritePathTest extends AbstractRocksDBPluginTest {
    private SpyingBinding binding;
    private RocksDBDatabasePlugin testPlugin;

    @Override
    protected void doSetup(Method method) {
        super.doSetup(method);
        binding = new SpyingBinding();
        testPlugin = newPlugin(conf(dbPath, true), diagnostics, binding);
        assertTrue(testPlugin.setUp().isOk());
    }

    @Test
    public void eventsSkipWriteAheadLog() throws Exception {
        AtomicBoolean walDisabled = new AtomicBoolean();
        AtomicBoolean synced = new AtomicBoolean();
        doAnswer(invocation -> {
            WriteOptions options = invocation.getArgument(0);
            walDisabled.set(options.disableWAL());
            synced.set(options.sync());
            return invocation.callRealMethod();
        }).when(binding.spiedDB).write(any(WriteOptions.class), any(WriteBatch.class));

        assertTrue(testPlugin.put(Domains.EVENTS, "e", "1").isOk());
        assertTrue(walDisabled.get());
        assertFalse(synced.get());

        assertTrue(testPlugin.put(Domains.QUERIES, "q", "1").isOk());
        assertFalse(walDisabled.get());
        assertTrue(synced.get());
    }

    @Test
    public void removeFollowsDomainDurability() throws Exception {
        AtomicBoolean walDisabled = new AtomicBoolean();
        AtomicBoolean synced = new AtomicBoolean();
        doAnswer(invocation -> {
            WriteOptions options = invocation.getArgument(1);
            walDisabled.set(options.disableWAL());
            synced.set(options.sync());
            return invocation.callRealMethod();
        }).when(binding.spiedDB).delete(any(ColumnFamilyHandle.class), any(WriteOptions.class), any(byte[].class));

        assertTrue(testPlugin.remove(Domains.EVENTS, "e").isOk());
        assertTrue(walDisabled.get());
        assertFalse(synced.get());

        assertTrue(testPlugin.remove(Domains.LOGS, "l").isOk());
        assertFalse(walDisabled.get());
        assertTrue(synced.get());
    }

    @Test
    public void removeRangeFollowsDomainDurability() throws Exception {
        AtomicBoolean walDisabled = new AtomicBoolean();
        AtomicBoolean synced = new AtomicBoolean();
        doAnswer(invocation -> {
            WriteOptions options = invocation.getArgument(1);
            walDisabled.set(options.disableWAL());
            synced.set(options.sync());
            return invocation.callRealMethod();
        }).when(binding.spiedDB).deleteRange(any(ColumnFamilyHandle.class), any(WriteOptions.class),
            any(byte[].class), any(byte[].class));

        assertTrue(testPlugin.removeRange(Domains.EVENTS, "a", "b").isOk());
        assertTrue(walDisabled.get());
        assertFalse(synced.get());

        assertTrue(testPlugin.removeRange(Domains.CARVES, "a", "b").isOk());
        assertFalse(walDisabled.get());
        assertTrue(synced.get());
    }

    @Test
    public void ioErrorDropsEngineDetails() throws Exception {
        String message = "IO error: While appending to file: /var/lib/hostkv.db/000012.log: No space left on device";
        doThrow(new RocksDBException(message,
            new org.rocksdb.Status(org.rocksdb.Status.Code.IOError, org.rocksdb.Status.SubCode.NoSpace, message)))
            .when(binding.spiedDB).write(any(WriteOptions.class), any(WriteBatch.class));

        Status status = testPlugin.put(Domains.QUERIES, "k", "v");
        assertEquals(status.code(), Status.Code.IOError);
        assertEquals(status.message(), "IOError: No space left on device");
    }

    @Test
    public void otherWriteErrorKeptAsIs() throws Exception {
        doThrow(new RocksDBException("Busy: try later",
            new org.rocksdb.Status(org.rocksdb.Status.Code.Busy, org.rocksdb.Status.SubCode.None, "try later")))
            .when(binding.spiedDB).write(any(WriteOptions.class), any(WriteBatch.class));

        Status status = testPlugin.putBatch(Domains.QUERIES, List.of(Map.entry("a", "1")));
        assertEquals(status.code(), Status.Code.Busy);
        assertEquals(status.message(), "Busy: try later");
    }

    @Test
    public void failedBatchLeavesNoEntry() throws Exception {
        doThrow(new RocksDBException("IO error: disk: failed"))
            .doCallRealMethod()
            .when(binding.spiedDB).write(any(WriteOptions.class), any(WriteBatch.class));

        Status failed = testPlugin.putBatch(Domains.QUERIES, List.of(Map.entry("a", "1"), Map.entry("b", "2")));
        assertFalse(failed.isOk());
        assertTrue(testPlugin.get(Domains.QUERIES, "a").status().isNotFound());
        assertTrue(testPlugin.get(Domains.QUERIES, "b").status().isNotFound());

        assertTrue(testPlugin.putBatch(Domains.QUERIES, List.of(Map.entry("a", "1"), Map.entry("b", "2"))).isOk());
        assertEquals(testPlugin.get(Domains.QUERIES, "a").value(), "1");
        assertEquals(testPlugin.get(Domains.QUERIES, "b").value(), "2");
    }

    @Test
    public void readErrorReported() throws Exception {
        doThrow(new RocksDBException("Incomplete: read",
            new org.rocksdb.Status(org.rocksdb.Status.Code.Incomplete, org.rocksdb.Status.SubCode.None, "read")))
            .when(binding.spiedDB).get(any(ColumnFamilyHandle.class), any(byte[].class));

        assertEquals(testPlugin.get(Domains.QUERIES, "k").status().code(), Status.Code.Incomplete);
    }

    private static class SpyingBinding extends RocksDBBinding {
        private RocksDB spiedDB;

        @Override
        RocksDBHandle open(DBOptions dbOptions, String path, List<ColumnFamilyDescriptor> cfDescs)
            throws RocksDBException {
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            spiedDB = Mockito.spy(RocksDB.open(dbOptions, path, cfDescs, cfHandles));
            return new RocksDBHandle(spiedDB, cfHandles);
        }
    }
}
