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

package org.hostkv.sysprops;

import lombok.extern.slf4j.Slf4j;
import org.hostkv.sysprops.parser.PropParser;

/**
 * Base class of the typed system properties read by HostKV.
 *
 * <p>The value is resolved lazily on first access and cached for the lifetime of the process. A missing or
 * unparsable property falls back to the default value.
 *
 * @param <T> the value type
 * @param <P> the parser type
 */
@Slf4j
public abstract class HostKVSysProp<T, P extends PropParser<T>> {
    private final String propKey;
    private final T defaultValue;
    private final P parser;
    private volatile T value;

    protected HostKVSysProp(String propKey, T defaultValue, P parser) {
        this.propKey = propKey;
        this.defaultValue = defaultValue;
        this.parser = parser;
    }

    public final String propKey() {
        return propKey;
    }

    public final T defaultValue() {
        return defaultValue;
    }

    /**
     * Get the resolved value of the property.
     *
     * @return the parsed value or the default
     */
    public final T get() {
        T current = value;
        if (current == null) {
            synchronized (this) {
                current = value;
                if (current == null) {
                    current = resolve();
                    value = current;
                }
            }
        }
        return current;
    }

    /**
     * Drop the cached value so that the next {@link #get()} reads the system property again.
     */
    public final void reset() {
        synchronized (this) {
            value = null;
        }
    }

    private T resolve() {
        String strValue = System.getProperty(propKey);
        if (strValue == null) {
            return defaultValue;
        }
        try {
            return parser.parse(strValue);
        } catch (Throwable e) {
            log.warn("Invalid value for system property '{}': {}, fallback to default: {}",
                propKey, strValue, defaultValue);
            return defaultValue;
        }
    }
}
