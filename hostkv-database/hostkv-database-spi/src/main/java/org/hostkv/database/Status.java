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

/**
 * Outcome of a database operation.
 *
 * <p>Engine-reported outcomes keep the engine's code, failures raised by the database layer itself use the
 * layer codes. A status with code {@link Code#Ok} may still carry a notice, e.g. when a mutation is skipped
 * in read-only mode.
 *
 * @param code    the outcome code
 * @param message human-readable diagnostic, never null
 */
public record Status(Code code, String message) {
    private static final Status OK = new Status(Code.Ok, "OK");

    public Status {
        if (code == null) {
            throw new IllegalArgumentException("Status code must not be null");
        }
        if (message == null) {
            message = "";
        }
    }

    public static Status ok() {
        return OK;
    }

    public static Status ok(String notice) {
        return new Status(Code.Ok, notice);
    }

    public static Status failure(String message) {
        return new Status(Code.Failure, message);
    }

    public static Status of(Code code, String message) {
        return new Status(code, message);
    }

    public boolean isOk() {
        return code == Code.Ok;
    }

    public boolean isNotFound() {
        return code == Code.NotFound;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }

    public enum Code {
        // codes reported by the storage engine
        Ok,
        NotFound,
        Corruption,
        NotSupported,
        InvalidArgument,
        IOError,
        MergeInProgress,
        Incomplete,
        ShutdownInProgress,
        TimedOut,
        Aborted,
        Busy,
        Expired,
        TryAgain,
        // codes raised by the database layer
        Failure,
        SetupFailure,
        NotOpen,
        UnknownDomain,
        Deserialization
    }
}
