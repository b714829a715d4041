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

import java.util.Date;

/** Handle to a folder emulated over a key prefix. */
public interface StorageFolder {
    /** Path relative to the provider root; the root folder has path "". */
    String getPath();

    String getName();

    /** Total size of every object under this folder, recomputed per call. */
    long getSize();

    /** Stores do not track folder timestamps; always the epoch. */
    Date getLastUpdated();

    /**
     * Enclosing folder.  Top-level folders return the root folder.
     *
     * @throws StorageException NOT_FOUND when called on the root folder
     */
    StorageFolder getParent() throws StorageException;
}
