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
import static org.hostkv.database.StructUtil.boolVal;
import static org.hostkv.database.StructUtil.strVal;
import static org.hostkv.database.rocksdb.RocksDBDefaultConfigs.ALLOW_OPEN;
import static org.hostkv.database.rocksdb.RocksDBDefaultConfigs.BACKUP_SUFFIX;
import static org.hostkv.database.rocksdb.RocksDBDefaultConfigs.CHECKING;
import static org.hostkv.database.rocksdb.RocksDBDefaultConfigs.DB_PATH;
import static org.hostkv.database.rocksdb.RocksDBDefaultConfigs.REQUIRE_WRITE;
import static org.hostkv.database.rocksdb.RocksDBHelper.deleteDir;
import static org.hostkv.database.rocksdb.RocksDBHelper.isCorruption;
import static org.hostkv.database.rocksdb.RocksDBHelper.isReadable;
import static org.hostkv.database.rocksdb.RocksDBHelper.movePath;
import static org.hostkv.database.rocksdb.RocksDBHelper.pathExists;
import static org.hostkv.database.rocksdb.RocksDBHelper.restrictToOwner;
import static org.hostkv.database.rocksdb.RocksDBHelper.toStatus;
import static org.hostkv.database.rocksdb.RocksDBHelper.toWriteStatus;

import com.google.common.primitives.Ints;
import com.google.common.primitives.UnsignedBytes;
import com.google.protobuf.Struct;
import io.micrometer.core.instrument.Tags;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.hostkv.database.CorruptionIndicator;
import org.hostkv.database.DatabaseException;
import org.hostkv.database.DiagnosticsContext;
import org.hostkv.database.Domains;
import org.hostkv.database.IDatabasePlugin;
import org.hostkv.database.Status;
import org.hostkv.database.StatusOr;
import org.hostkv.database.StructUtil;
import org.hostkv.database.metrics.DatabaseOpMeters;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

/**
 * Backing storage of the host's internal key-value store, one RocksDB column family per domain.
 *
 * <p>If the store cannot be opened for writing and write access is not required, the plugin degrades to
 * read-only: event capture is disabled through the {@link DiagnosticsContext} and mutations report ok with a
 * notice instead of failing.
 *
 * <p>Corruption reported while opening is repaired right away and the open is retried once. Corruption
 * reported later by the engine's info log is recorded in the shared {@link CorruptionIndicator} and repaired
 * on the next {@link #close()}. A repair moves the store aside to {@code <path>.backup}, so the next open
 * starts from an empty store.
 *
 * <p>Reads and writes are not serialized against {@link #close()}, callers must not close the plugin while
 * operations are in flight.
 */
@Slf4j
public class RocksDBDatabasePlugin implements IDatabasePlugin {
    static final String READ_ONLY_NOTICE = "Database in readonly mode";
    static final String NOT_OPENED = "Database not opened";
    private static final AtomicInteger SEQ = new AtomicInteger();

    private final String id;
    private final Supplier<Struct> confSupplier;
    private final DiagnosticsContext diagnostics;
    private final RocksDBBinding binding;
    private volatile DatabaseOpMeters opMeters;
    private boolean metersReleased = false;
    // guards close, reopen and repair
    private final ReentrantLock closeLock = new ReentrantLock();
    private boolean initialized = false;
    private RocksDBDiagnosticLogger infoLogger;
    private DBOptions dbOptions;
    private ColumnFamilyOptions cfOptions;
    private List<ColumnFamilyDescriptor> cfDescs;
    private volatile Path path;
    private volatile RocksDBHandle handle;
    private volatile boolean readOnly = false;

    public RocksDBDatabasePlugin(Struct conf, DiagnosticsContext diagnostics) {
        this(() -> conf, diagnostics);
    }

    /**
     * Create the plugin. The config is read on every {@link #setUp()}, so a changed path takes effect on the
     * next reopen.
     *
     * @param confSupplier supplies the config, keys missing from it take the values of
     *                     {@link RocksDBDefaultConfigs#DEFAULT}
     * @param diagnostics  the context shared with the other subsystems of the host
     */
    public RocksDBDatabasePlugin(Supplier<Struct> confSupplier, DiagnosticsContext diagnostics) {
        this(confSupplier, diagnostics, new RocksDBBinding());
    }

    RocksDBDatabasePlugin(Supplier<Struct> confSupplier, DiagnosticsContext diagnostics, RocksDBBinding binding) {
        this.id = "rocksdb-" + SEQ.incrementAndGet();
        this.confSupplier = confSupplier;
        this.diagnostics = diagnostics;
        this.binding = binding;
        this.opMeters = new DatabaseOpMeters(id, Tags.of("engine", "rocksdb"));
    }

    @Override
    public Status setUp() {
        closeLock.lock();
        try {
            return doSetUp();
        } catch (Throwable e) {
            log.error("Failed to set up RocksDB database plugin", e);
            return Status.of(Status.Code.SetupFailure, "Failed to set up RocksDB: " + e.getMessage());
        } finally {
            closeLock.unlock();
        }
    }

    private Status doSetUp() {
        Struct conf = StructUtil.merge(RocksDBDefaultConfigs.DEFAULT, confSupplier.get());
        boolean checking = boolVal(conf, CHECKING);
        if (!boolVal(conf, ALLOW_OPEN)) {
            log.warn("Not allowed to set up database plugin");
        }
        if (!initialized) {
            initialize();
            initialized = true;
        }

        // consume the current path, a config change only affects the next setUp
        Path dbPath = Paths.get(strVal(conf, DB_PATH)).toAbsolutePath().normalize();
        if (pathExists(dbPath) && !isReadable(dbPath)) {
            return Status.of(Status.Code.SetupFailure, "Cannot read RocksDB path: " + dbPath);
        }
        if (!checking) {
            log.debug("Opening RocksDB handle: {}", dbPath);
        }

        // setUp may be called repeatedly, release the previous handle first. The path is set before, so a
        // pending corruption is repaired at the configured location
        path = dbPath;
        close();
        readOnly = false;

        OpenAttempt attempt = tryOpen(dbPath);
        if (attempt.corrupted()) {
            log.warn("RocksDB database is corrupted, repairing: {}", dbPath);
            repair();
            attempt = tryOpen(dbPath);
        }

        if (attempt.handle() == null) {
            log.info("RocksDB open failed ({}) {}", attempt.status().code(), attempt.status().message());
            if (boolVal(conf, REQUIRE_WRITE)) {
                return Status.of(Status.Code.SetupFailure, attempt.status().message());
            }
            if (!checking) {
                log.info("Opening RocksDB failed: Continuing with read-only support");
            }
            diagnostics.disableEvents();
            readOnly = true;
            opMeters.readOnlyFallbackCounter.increment();
            return Status.ok();
        }
        handle = attempt.handle();

        // RocksDB may not create the directory with acceptable permissions
        if (!restrictToOwner(dbPath)) {
            return Status.of(Status.Code.SetupFailure, "Cannot set permissions on RocksDB path: " + dbPath);
        }
        return Status.ok();
    }

    private void initialize() {
        if (metersReleased) {
            opMeters = new DatabaseOpMeters(id, Tags.of("engine", "rocksdb"));
            metersReleased = false;
        }
        infoLogger = new RocksDBDiagnosticLogger(diagnostics.corruptionIndicator());
        dbOptions = RocksDBOptionsUtil.buildDBOptions(infoLogger);
        cfOptions = RocksDBOptionsUtil.buildCFOptions();
        cfDescs = RocksDBOptionsUtil.buildCFDescriptors(cfOptions);
    }

    private OpenAttempt tryOpen(Path dbPath) {
        try {
            return new OpenAttempt(binding.open(dbOptions, dbPath.toString(), cfDescs), Status.ok(), false);
        } catch (RocksDBException e) {
            return new OpenAttempt(null, toStatus(e), isCorruption(e));
        } catch (DatabaseException e) {
            return new OpenAttempt(null, Status.failure(e.getMessage()), false);
        }
    }

    @Override
    public void tearDown() {
        closeLock.lock();
        try {
            close();
            if (initialized) {
                cfOptions.close();
                dbOptions.close();
                infoLogger.close();
                initialized = false;
            }
            if (!metersReleased) {
                opMeters.close();
                metersReleased = true;
            }
        } finally {
            closeLock.unlock();
        }
    }

    @Override
    public void close() {
        closeLock.lock();
        try {
            RocksDBHandle current = handle;
            handle = null;
            if (current != null) {
                current.close();
            }
            CorruptionIndicator corruptionIndicator = diagnostics.corruptionIndicator();
            if (path != null && corruptionIndicator.isCorrupted()) {
                repair();
                corruptionIndicator.setCorrupted(false);
            }
        } finally {
            closeLock.unlock();
        }
    }

    /**
     * Move the store to its backup location so that the next open creates an empty store. At most one backup
     * is kept, an older one is removed first. Nothing happens while the store is open.
     */
    public void repair() {
        closeLock.lock();
        try {
            Path dbPath = path;
            if (dbPath == null) {
                log.warn("RocksDB path not resolved, skip repair");
                return;
            }
            if (handle != null) {
                log.error("Cannot repair an open RocksDB database: {}", dbPath);
                return;
            }
            Path backupPath = Paths.get(dbPath + BACKUP_SUFFIX);
            if (pathExists(backupPath)) {
                try {
                    deleteDir(backupPath);
                    log.warn("Removed previous RocksDB database backup: {}", backupPath);
                } catch (IOException e) {
                    log.error("Cannot remove previous RocksDB database backup: {}", backupPath, e);
                    return;
                }
            }
            try {
                movePath(dbPath, backupPath);
                log.warn("Backing up RocksDB database: {}", backupPath);
            } catch (IOException e) {
                log.error("Cannot backup the RocksDB database: {}", backupPath, e);
                return;
            }
            opMeters.repairCounter.increment();
            log.warn("Destroying RocksDB database due to corruption");
        } finally {
            closeLock.unlock();
        }
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    public Optional<RocksDB> getDB() {
        RocksDBHandle current = handle;
        return current == null ? Optional.empty() : Optional.of(current.db());
    }

    /**
     * Look up the column family of a domain.
     *
     * @param domain the domain
     * @return empty if the domain is not registered or the store is not open
     */
    public Optional<ColumnFamilyHandle> getHandleForColumnFamily(String domain) {
        RocksDBHandle current = handle;
        return current == null ? Optional.empty() : current.cf(domain);
    }

    Path path() {
        return path;
    }

    String id() {
        return id;
    }

    @Override
    public StatusOr<String> get(String domain, String key) {
        return opMeters.getCallTimer.record(() -> doGet(domain, key));
    }

    private StatusOr<String> doGet(String domain, String key) {
        RocksDBHandle current = handle;
        if (current == null) {
            return StatusOr.error(Status.of(Status.Code.NotOpen, NOT_OPENED));
        }
        Optional<ColumnFamilyHandle> cf = current.cf(domain);
        if (cf.isEmpty()) {
            return StatusOr.error(unknownDomain(domain));
        }
        try {
            byte[] value = current.db().get(cf.get(), key.getBytes(UTF_8));
            if (value == null) {
                return StatusOr.error(Status.of(Status.Code.NotFound, "NotFound: " + key));
            }
            return StatusOr.of(new String(value, UTF_8));
        } catch (RocksDBException e) {
            return StatusOr.error(toStatus(e));
        }
    }

    @Override
    public StatusOr<Integer> getInt(String domain, String key) {
        StatusOr<String> result = get(domain, key);
        if (!result.isOk()) {
            return StatusOr.error(result.status());
        }
        Integer value = Ints.tryParse(result.value());
        if (value == null) {
            return StatusOr.error(Status.of(Status.Code.Deserialization, "Could not deserialize str to int"));
        }
        return StatusOr.of(value);
    }

    @Override
    public Status put(String domain, String key, String value) {
        return putBatch(domain, List.of(Map.entry(key, value)));
    }

    @Override
    public Status put(String domain, String key, int value) {
        return putBatch(domain, List.of(Map.entry(key, Integer.toString(value))));
    }

    @Override
    public Status putBatch(String domain, List<Map.Entry<String, String>> entries) {
        if (readOnly) {
            return Status.ok(READ_ONLY_NOTICE);
        }
        RocksDBHandle current = handle;
        if (current == null) {
            return Status.of(Status.Code.NotOpen, NOT_OPENED);
        }
        Optional<ColumnFamilyHandle> cf = current.cf(domain);
        if (cf.isEmpty()) {
            return unknownDomain(domain);
        }
        return opMeters.writeCallTimer.record(() -> {
            try (WriteOptions options = writeOptions(domain); WriteBatch batch = new WriteBatch()) {
                for (Map.Entry<String, String> entry : entries) {
                    batch.put(cf.get(), entry.getKey().getBytes(UTF_8), entry.getValue().getBytes(UTF_8));
                }
                opMeters.writeBatchSizeSummary.record(entries.size());
                current.db().write(options, batch);
                return Status.ok();
            } catch (RocksDBException e) {
                log.debug("Write to domain[{}] failed", domain, e);
                return toWriteStatus(e);
            }
        });
    }

    @Override
    public Status remove(String domain, String key) {
        if (readOnly) {
            return Status.ok(READ_ONLY_NOTICE);
        }
        RocksDBHandle current = handle;
        if (current == null) {
            return Status.of(Status.Code.NotOpen, NOT_OPENED);
        }
        Optional<ColumnFamilyHandle> cf = current.cf(domain);
        if (cf.isEmpty()) {
            return unknownDomain(domain);
        }
        return opMeters.deleteCallTimer.record(() -> {
            try (WriteOptions options = writeOptions(domain)) {
                current.db().delete(cf.get(), options, key.getBytes(UTF_8));
                return Status.ok();
            } catch (RocksDBException e) {
                return toStatus(e);
            }
        });
    }

    @Override
    public Status removeRange(String domain, String low, String high) {
        if (readOnly) {
            return Status.ok(READ_ONLY_NOTICE);
        }
        RocksDBHandle current = handle;
        if (current == null) {
            return Status.of(Status.Code.NotOpen, NOT_OPENED);
        }
        Optional<ColumnFamilyHandle> cf = current.cf(domain);
        if (cf.isEmpty()) {
            return unknownDomain(domain);
        }
        byte[] lowKey = low.getBytes(UTF_8);
        byte[] highKey = high.getBytes(UTF_8);
        return opMeters.deleteCallTimer.record(() -> {
            try (WriteOptions options = writeOptions(domain)) {
                // the native range delete excludes the upper bound
                current.db().deleteRange(cf.get(), options, lowKey, highKey);
                if (UnsignedBytes.lexicographicalComparator().compare(lowKey, highKey) <= 0) {
                    current.db().delete(cf.get(), options, highKey);
                }
                return Status.ok();
            } catch (RocksDBException e) {
                return toStatus(e);
            }
        });
    }

    @Override
    public StatusOr<List<String>> scan(String domain, String prefix, int max) {
        return opMeters.scanCallTimer.record(() -> doScan(domain, prefix, max));
    }

    private StatusOr<List<String>> doScan(String domain, String prefix, int max) {
        RocksDBHandle current = handle;
        if (current == null) {
            return StatusOr.error(Status.of(Status.Code.NotOpen, NOT_OPENED));
        }
        Optional<ColumnFamilyHandle> cf = current.cf(domain);
        if (cf.isEmpty()) {
            return StatusOr.error(unknownDomain(domain));
        }
        List<String> results = new ArrayList<>();
        // TODO: seek to the prefix instead of walking the whole domain
        try (RocksDBKeyIterator itr = new RocksDBKeyIterator(current.db(), cf.get())) {
            int count = 0;
            for (itr.seekToFirst(); itr.isValid(); itr.next()) {
                String key = itr.key();
                if (key.startsWith(prefix)) {
                    results.add(key);
                    if (max > 0 && ++count >= max) {
                        break;
                    }
                }
            }
            itr.checkStatus();
        } catch (RocksDBException e) {
            return StatusOr.error(toStatus(e));
        }
        return StatusOr.of(results);
    }

    /**
     * Log the estimated number of keys of every domain.
     */
    @Override
    public void dumpDatabase() {
        RocksDBHandle current = handle;
        if (current == null) {
            log.info("RocksDB database not opened: {}", path);
            return;
        }
        for (String domain : Domains.ALL) {
            current.cf(domain).ifPresent(cf -> {
                try {
                    log.info("Domain[{}] estimated keys: {}", domain,
                        current.db().getLongProperty(cf, "rocksdb.estimate-num-keys"));
                } catch (RocksDBException e) {
                    log.warn("Failed to estimate keys of domain[{}]", domain, e);
                }
            });
        }
    }

    private static WriteOptions writeOptions(String domain) {
        WriteOptions options = new WriteOptions();
        if (Domains.EVENTS.equals(domain)) {
            // events are high volume and tolerate loss on crash
            options.setDisableWAL(true);
        } else {
            options.setSync(true);
        }
        return options;
    }

    private static Status unknownDomain(String domain) {
        return Status.of(Status.Code.UnknownDomain, "Could not get column family for " + domain);
    }

    private record OpenAttempt(RocksDBHandle handle, Status status, boolean corrupted) {
    }
}
