/*
 * Copyright 2014-2026 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.blobfs;

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

@SuppressWarnings("serial")
public final class StorageException extends Exception {
    private final StorageErrorCode error;
    @Nullable
    private final String path;

    StorageException(StorageErrorCode error) {
        this(error, null, error.getMessage(), null);
    }

    StorageException(StorageErrorCode error, @Nullable String path) {
        this(error, path, error.getMessage(), null);
    }

    StorageException(StorageErrorCode error, @Nullable String path,
            String message) {
        this(error, path, message, null);
    }

    StorageException(StorageErrorCode error, @Nullable String path,
            String message, @Nullable Throwable cause) {
        super(requireNonNull(message), cause);
        this.error = requireNonNull(error);
        this.path = path;
    }

    public StorageErrorCode getError() {
        return error;
    }

    /** Relative path the failed operation was given, if known. */
    @Nullable
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        var builder = new StringBuilder().append(super.getMessage());
        if (path != null) {
            builder.append(": ").append(path);
        }
        return builder.toString();
    }
}
