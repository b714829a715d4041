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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Date;

/**
 * Handle to a stored object.  Attributes are read from the store on each
 * call; the handle holds no copy of the content.
 */
public interface StorageFile {
    /** Path relative to the provider root, e.g., docs/a.txt. */
    String getPath();

    String getName();

    long getSize();

    Date getLastUpdated();

    /** Extension including the dot, e.g., .txt, or the empty string. */
    String getFileType();

    InputStream openRead() throws IOException;

    /**
     * Replace the content of this file.  Data is uploaded when the returned
     * stream is closed.
     */
    OutputStream openWrite() throws IOException;
}
