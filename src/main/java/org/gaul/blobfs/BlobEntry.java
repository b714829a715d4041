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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;

import org.jclouds.blobstore.domain.BlobMetadata;
import org.jclouds.blobstore.domain.StorageMetadata;

/** One level of a delimited listing: either an object or a sub-prefix. */
final class BlobEntry {
    enum Kind {
        FILE,
        FOLDER
    }

    private final Kind kind;
    private final String key;
    private final long size;

    private BlobEntry(Kind kind, String key, long size) {
        this.kind = requireNonNull(kind);
        this.key = requireNonNull(key);
        this.size = size;
    }

    /**
     * Classify a listing entry returned for the given prefix.  Folder keys
     * carry no trailing separator.  Returns null for container entries.
     */
    @Nullable
    static BlobEntry fromMetadata(String prefix, StorageMetadata metadata) {
        String name = metadata.getName();
        if (!name.startsWith(prefix)) {
            name = prefix + name;
        }
        switch (metadata.getType()) {
        case BLOB:
            return new BlobEntry(Kind.FILE, name, sizeOf(metadata));
        case FOLDER:
            // fallthrough
        case RELATIVE_PATH:
            return new BlobEntry(Kind.FOLDER,
                    CharMatcher.is('/').trimTrailingFrom(name), 0);
        default:
            return null;
        }
    }

    static long sizeOf(StorageMetadata metadata) {
        Long size = null;
        if (metadata instanceof BlobMetadata blobMetadata &&
                blobMetadata.getContentMetadata() != null) {
            size = blobMetadata.getContentMetadata().getContentLength();
        }
        if (size == null) {
            size = metadata.getSize();
        }
        return size == null ? 0 : size;
    }

    Kind getKind() {
        return kind;
    }

    /** Full store key, root prefix included. */
    String getKey() {
        return key;
    }

    /** Object size; always zero for folders. */
    long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("key", key)
                .add("size", size)
                .toString();
    }
}
