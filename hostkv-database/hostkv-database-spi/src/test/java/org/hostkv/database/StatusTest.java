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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.util.List;
import java.util.NoSuchElementException;
import org.testng.annotations.Test;

public class StatusTest {
    @Test
    public void okWithNotice() {
        Status status = Status.ok("Database in readonly mode");
        assertTrue(status.isOk());
        assertEquals(status.message(), "Database in readonly mode");
        assertEquals(Status.ok().message(), "OK");
    }

    @Test
    public void failure() {
        Status status = Status.failure("boom");
        assertFalse(status.isOk());
        assertEquals(status.code(), Status.Code.Failure);
        assertEquals(status.toString(), "Failure: boom");
    }

    @Test
    public void nullMessage() {
        assertEquals(Status.of(Status.Code.NotFound, null).message(), "");
        assertTrue(Status.of(Status.Code.NotFound, null).isNotFound());
        assertThrows(IllegalArgumentException.class, () -> Status.of(null, "x"));
    }

    @Test
    public void statusOrValue() {
        StatusOr<List<String>> result = StatusOr.of(List.of("a"));
        assertTrue(result.isOk());
        assertEquals(result.value(), List.of("a"));
    }

    @Test
    public void statusOrError() {
        StatusOr<String> result = StatusOr.error(Status.of(Status.Code.UnknownDomain, "no such domain"));
        assertFalse(result.isOk());
        assertEquals(result.status().code(), Status.Code.UnknownDomain);
        assertThrows(NoSuchElementException.class, result::value);
        assertThrows(IllegalArgumentException.class, () -> StatusOr.error(Status.ok()));
        assertThrows(IllegalArgumentException.class, () -> StatusOr.of(null));
    }
}
