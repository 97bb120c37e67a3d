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

package org.hostkv.database.rocksdb;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;
import javax.annotation.Nullable;
import org.hostkv.database.Status;
import org.rocksdb.RocksDBException;

class RocksDBHelper {
    private static final String SEPARATOR = ": ";

    static boolean pathExists(Path path) {
        return Files.exists(path);
    }

    static boolean isReadable(Path path) {
        return Files.isReadable(path);
    }

    static void deleteDir(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void movePath(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    /**
     * Limit access of the path to its owner: read, write and execute.
     *
     * @param path the path
     * @return false if the permission could not be changed
     */
    static boolean restrictToOwner(Path path) {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwx------"));
            return true;
        } catch (UnsupportedOperationException e) {
            File file = path.toFile();
            return file.setReadable(false, false) && file.setReadable(true, true)
                && file.setWritable(false, false) && file.setWritable(true, true)
                && file.setExecutable(false, false) && file.setExecutable(true, true);
        } catch (IOException | SecurityException e) {
            return false;
        }
    }

    static boolean isCorruption(RocksDBException e) {
        return e.getStatus() != null && e.getStatus().getCode() == org.rocksdb.Status.Code.Corruption;
    }

    static Status toStatus(RocksDBException e) {
        return Status.of(toCode(e.getStatus()), e.getMessage());
    }

    /**
     * Convert a failed write into a status. The text of an I/O error is cut down to the part after the last
     * separator, which keeps internal file paths of the engine out of the message.
     *
     * @param e the engine exception
     * @return the status
     */
    static Status toWriteStatus(RocksDBException e) {
        Status status = toStatus(e);
        if (status.code() == Status.Code.IOError) {
            return Status.of(Status.Code.IOError, sanitizeIOError(status.message()));
        }
        return status;
    }

    static String sanitizeIOError(@Nullable String message) {
        if (message == null) {
            return "IOError: ";
        }
        int pos = message.lastIndexOf(SEPARATOR);
        if (pos < 0) {
            return message;
        }
        return "IOError: " + message.substring(pos + SEPARATOR.length());
    }

    static Status.Code toCode(@Nullable org.rocksdb.Status status) {
        if (status == null) {
            return Status.Code.Failure;
        }
        return switch (status.getCode()) {
            case Ok -> Status.Code.Ok;
            case NotFound -> Status.Code.NotFound;
            case Corruption -> Status.Code.Corruption;
            case NotSupported -> Status.Code.NotSupported;
            case InvalidArgument -> Status.Code.InvalidArgument;
            case IOError -> Status.Code.IOError;
            case MergeInProgress -> Status.Code.MergeInProgress;
            case Incomplete -> Status.Code.Incomplete;
            case ShutdownInProgress -> Status.Code.ShutdownInProgress;
            case TimedOut -> Status.Code.TimedOut;
            case Aborted -> Status.Code.Aborted;
            case Busy -> Status.Code.Busy;
            case Expired -> Status.Code.Expired;
            case TryAgain -> Status.Code.TryAgain;
            default -> Status.Code.Failure;
        };
    }
}
