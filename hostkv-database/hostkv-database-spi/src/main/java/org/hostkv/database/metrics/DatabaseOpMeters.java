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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;

/**
 * Operation meters of one database plugin instance, registered in the global registry.
 */
public class DatabaseOpMeters {
    public final Timer getCallTimer;
    public final Timer writeCallTimer;
    public final Timer deleteCallTimer;
    public final Timer scanCallTimer;
    public final DistributionSummary writeBatchSizeSummary;
    public final Counter repairCounter;
    public final Counter readOnlyFallbackCounter;
    private final List<Meter> meters = new ArrayList<>();

    public DatabaseOpMeters(String id, Tags tags) {
        Tags meterTags = tags.and("db", id);
        getCallTimer = timer(DatabaseMetric.GetCallTimer, meterTags);
        writeCallTimer = timer(DatabaseMetric.WriteCallTimer, meterTags);
        deleteCallTimer = timer(DatabaseMetric.DeleteCallTimer, meterTags);
        scanCallTimer = timer(DatabaseMetric.ScanCallTimer, meterTags);
        writeBatchSizeSummary = register(DistributionSummary.builder(DatabaseMetric.WriteBatchSize.metricName())
            .tags(meterTags)
            .register(Metrics.globalRegistry));
        repairCounter = counter(DatabaseMetric.RepairCounter, meterTags);
        readOnlyFallbackCounter = counter(DatabaseMetric.ReadOnlyFallbackCounter, meterTags);
    }

    private Timer timer(DatabaseMetric metric, Tags tags) {
        assert metric.meterType() == Meter.Type.TIMER;
        return register(Timer.builder(metric.metricName()).tags(tags).register(Metrics.globalRegistry));
    }

    private Counter counter(DatabaseMetric metric, Tags tags) {
        assert metric.meterType() == Meter.Type.COUNTER;
        return register(Counter.builder(metric.metricName()).tags(tags).register(Metrics.globalRegistry));
    }

    private <M extends Meter> M register(M meter) {
        meters.add(meter);
        return meter;
    }

    /**
     * Unregister all meters of the instance.
     */
    public void close() {
        meters.forEach(Metrics.globalRegistry::remove);
        meters.clear();
    }
}
