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

/**
 * The fixed, ordered set of logical domains known to the database layer. Each domain is backed by its own
 * partition in the storage engine.
 */
public final class Domains {
    public static final String CONFIGURATIONS = "configurations";
    public static final String QUERIES = "queries";
    // high volume, written without the write-ahead log
    public static final String EVENTS = "events";
    public static final String CARVES = "carves";
    public static final String LOGS = "logs";

    public static final List<String> ALL = List.of(CONFIGURATIONS, QUERIES, EVENTS, CARVES, LOGS);

    private Domains() {
    }
}
