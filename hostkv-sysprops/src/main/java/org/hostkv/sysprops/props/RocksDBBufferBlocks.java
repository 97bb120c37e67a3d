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

package org.hostkv.sysprops.props;

import org.hostkv.sysprops.HostKVSysProp;
import org.hostkv.sysprops.parser.LongParser;

/**
 * Size of a single write buffer, in 4 KiB blocks.
 */
public final class RocksDBBufferBlocks extends HostKVSysProp<Long, LongParser> {
    public static final RocksDBBufferBlocks INSTANCE = new RocksDBBufferBlocks();

    private RocksDBBufferBlocks() {
        super("rocksdb_buffer_blocks", 256L, LongParser.POSITIVE);
    }
}
