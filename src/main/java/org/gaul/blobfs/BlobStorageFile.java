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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Date;

import com.google.common.base.MoreObjects;

import org.jclouds.blobstore.KeyNotFoundException;
import org.jclouds.blobstore.domain.BlobMetadata;

final class BlobStorageFile implements StorageFile {
    private final BlobFileSystem fileSystem;
    private final String key;

    BlobStorageFile(BlobFileSystem fileSystem, String key) {
        this.fileSystem = requireNonNull(fileSystem);
        this.key = requireNonNull(key);
    }

    String getKey() {
        return key;
    }

    @Override
    public String getPath() {
        return BlobPaths.trimRoot(fileSystem.getRoot(), key);
    }

    @Override
    public String getName() {
        return BlobPaths.getName(key);
    }

    @Override
    public long getSize() {
        return BlobEntry.sizeOf(metadata());
    }

    @Override
    public Date getLastUpdated() {
        return metadata().getLastModified();
    }

    @Override
    public String getFileType() {
        return BlobPaths.getExtension(key);
    }

    @Override
    public InputStream openRead() throws IOException {
        return fileSystem.openRead(key);
    }

    @Override
    public OutputStream openWrite() throws IOException {
        return fileSystem.openWrite(key);
    }

    private BlobMetadata metadata() {
        BlobMetadata metadata = fileSystem.getBlobStore().blobMetadata(
                fileSystem.getContainerName(), key);
        if (metadata == null) {
            throw new KeyNotFoundException(fileSystem.getContainerName(), key,
                    "object no longer exists");
        }
        return metadata;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("container", fileSystem.getContainerName())
                .add("key", key)
                .toString();
    }
}
