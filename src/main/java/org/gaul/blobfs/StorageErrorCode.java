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

import com.google.common.base.CaseFormat;

/** Conditions reported by {@link StorageProvider} operations. */
public enum StorageErrorCode {
    INVALID_PATH("Path must be relative"),
    NOT_FOUND("The specified path does not exist"),
    ALREADY_EXISTS("The specified path already exists");

    private final String errorCode;
    private final String message;

    StorageErrorCode(String message) {
        this.errorCode = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL,
                name());
        this.message = requireNonNull(message);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getErrorCode() + " " + getMessage();
    }
}
