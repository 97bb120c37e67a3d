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

package org.hostkv.sysprops.parser;

/**
 * Long parser with inclusive bounds.
 */
public final class LongParser implements PropParser<Long> {
    public static final LongParser POSITIVE = new LongParser(1, Long.MAX_VALUE);

    private final long lowerBound;
    private final long upperBound;

    private LongParser(long lowerBound, long upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static LongParser from(long lowerBound, long upperBound) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Lower bound must not be greater than upper bound");
        }
        return new LongParser(lowerBound, upperBound);
    }

    @Override
    public Long parse(String value) {
        long result = Long.parseLong(value.trim());
        if (result < lowerBound || result > upperBound) {
            throw new IllegalArgumentException("Value out of range [" + lowerBound + ", " + upperBound + "]");
        }
        return result;
    }
}
