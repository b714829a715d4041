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

public final class BlobFileSystemConstants {
    /** Container backing the virtual namespace. */
    public static final String PROPERTY_CONTAINER =
            "blobfs.container";
    /**
     * Prefix inside the container under which all paths live, e.g.,
     * media/tenant1.  Empty or "/" maps the whole container.
     */
    public static final String PROPERTY_ROOT =
            "blobfs.root";
    /** When false, allow anonymous reads of the container. */
    public static final String PROPERTY_PRIVATE =
            "blobfs.private";
    /** Base address used to build public URLs. */
    public static final String PROPERTY_ENDPOINT =
            "blobfs.endpoint";
    /**
     * Semicolon-separated Key=Value pairs, e.g.,
     * AccountName=foo;AccountKey=bar;EndpointSuffix=core.windows.net.
     * Takes precedence over the jclouds provider properties.
     */
    public static final String PROPERTY_CONNECTION_STRING =
            "blobfs.connection-string";

    /** Hidden object that keeps an otherwise empty folder alive. */
    static final String FOLDER_MARKER = "$$$BLOBFS$$$.$$$";

    static final String SEPARATOR = "/";

    private BlobFileSystemConstants() {
        throw new AssertionError("intentionally unimplemented");
    }
}
