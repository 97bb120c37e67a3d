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

package org.hostkv.database.metrics;

import io.micrometer.core.instrument.Meter;

/**
 * Metrics emitted by the database layer.
 */
public enum DatabaseMetric {
    GetCallTimer("hostkv.db.get.time", Meter.Type.TIMER),
    WriteCallTimer("hostkv.db.write.time", Meter.Type.TIMER),
    DeleteCallTimer("hostkv.db.delete.time", Meter.Type.TIMER),
    ScanCallTimer("hostkv.db.scan.time", Meter.Type.TIMER),
    WriteBatchSize("hostkv.db.write.batchsize", Meter.Type.DISTRIBUTION_SUMMARY),
    RepairCounter("hostkv.db.repair.count", Meter.Type.COUNTER),
    ReadOnlyFallbackCounter("hostkv.db.readonly.count", Meter.Type.COUNTER);

    private final String metricName;
    private final Meter.Type meterType;

    DatabaseMetric(String metricName, Meter.Type meterType) {
        this.metricName = metricName;
        this.meterType = meterType;
    }

    public String metricName() {
        return metricName;
    }

    public Meter.Type meterType() {
        return meterType;
    }
}
