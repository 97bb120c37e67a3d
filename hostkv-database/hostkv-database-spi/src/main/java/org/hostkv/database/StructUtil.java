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

import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import java.util.Map;

/**
 * Helpers for database configuration carried in a protobuf {@link Struct}.
 */
public class StructUtil {
    public static Struct fromMap(Map<String, Object> config) {
        Struct.Builder b = Struct.newBuilder();
        config.forEach((k, v) -> b.putFields(k, toValue(v)));
        return b.build();
    }

    /**
     * Overlay the user supplied fields on top of the defaults.
     *
     * @param defaults the complete default config
     * @param override the partial user config
     * @return the merged config
     * @throws IllegalArgumentException if the override contains an unknown key or a value of the wrong kind
     */
    public static Struct merge(Struct defaults, Struct override) {
        Struct.Builder b = defaults.toBuilder();
        override.getFieldsMap().forEach((k, v) -> {
            Value defaultValue = defaults.getFieldsMap().get(k);
            if (defaultValue == null) {
                throw new IllegalArgumentException("Unknown database config: " + k);
            }
            if (defaultValue.getKindCase() != v.getKindCase()) {
                throw new IllegalArgumentException("Invalid value type of database config: " + k);
            }
            b.putFields(k, v);
        });
        return b.build();
    }

    public static Value toValue(Object v) {
        if (v == null) {
            return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        }
        if (v instanceof Boolean) {
            return Value.newBuilder().setBoolValue((Boolean) v).build();
        }
        if (v instanceof Number) {
            return Value.newBuilder().setNumberValue(((Number) v).doubleValue()).build();
        }
        return Value.newBuilder().setStringValue(String.valueOf(v)).build();
    }

    public static boolean boolVal(Struct conf, String key) {
        return conf.getFieldsOrThrow(key).getBoolValue();
    }

    public static String strVal(Struct conf, String key) {
        return conf.getFieldsOrThrow(key).getStringValue();
    }
}
