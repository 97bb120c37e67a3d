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

import java.util.List;
import java.util.Map;

/**
 * The host's internal key-value store, partitioned into the fixed set of {@link Domains}.
 *
 * <p>None of the operations throw, every outcome is reported through the returned {@link Status}. When the
 * store could only be brought up read-only, mutations are skipped and report an ok status with a notice.
 */
public interface IDatabasePlugin {
    /**
     * Open the store, closing any store previously opened by this plugin first.
     *
     * @return ok if the store is usable, possibly in read-only mode
     */
    Status setUp();

    /**
     * Release the store when the plugin is removed from service.
     */
    void tearDown();

    /**
     * Release the store. Calling it on a closed plugin does nothing.
     */
    void close();

    /**
     * Whether mutations are disabled because the store could not be opened for writing.
     *
     * @return true in read-only mode
     */
    boolean isReadOnly();

    StatusOr<String> get(String domain, String key);

    /**
     * Get a value stored as a decimal integer.
     *
     * @param domain the domain
     * @param key    the key
     * @return the parsed value, or a {@link Status.Code#Deserialization} status if the value is not an integer
     */
    StatusOr<Integer> getInt(String domain, String key);

    Status put(String domain, String key, String value);

    Status put(String domain, String key, int value);

    /**
     * Write all entries to the domain as one atomic unit.
     *
     * @param domain  the domain
     * @param entries the ordered key/value pairs
     * @return the write status
     */
    Status putBatch(String domain, List<Map.Entry<String, String>> entries);

    Status remove(String domain, String key);

    /**
     * Remove every key {@code k} with {@code low <= k <= high}.
     *
     * @param domain the domain
     * @param low    the inclusive lower bound
     * @param high   the inclusive upper bound
     * @return the delete status
     */
    Status removeRange(String domain, String low, String high);

    /**
     * List keys of the domain starting with the prefix, in ascending byte order.
     *
     * @param domain the domain
     * @param prefix the key prefix, empty for all keys
     * @param max    the max number of keys to return, 0 for no limit
     * @return the matched keys
     */
    StatusOr<List<String>> scan(String domain, String prefix, int max);

    void dumpDatabase();
}
