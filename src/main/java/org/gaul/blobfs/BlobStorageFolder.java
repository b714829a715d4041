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

import java.util.Date;

import com.google.common.base.MoreObjects;

final class BlobStorageFolder implements StorageFolder {
    private final BlobFileSystem fileSystem;
    private final String path;

    /** @param path folder path relative to the root, "" for the root */
    BlobStorageFolder(BlobFileSystem fileSystem, String path) {
        this.fileSystem = requireNonNull(fileSystem);
        this.path = requireNonNull(path);
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getName() {
        return BlobPaths.getName(path);
    }

    @Override
    public long getSize() {
        return fileSystem.folderSize(
                BlobPaths.folderPrefix(fileSystem.getRoot(), path));
    }

    @Override
    public Date getLastUpdated() {
        return new Date(0);
    }

    @Override
    public StorageFolder getParent() throws StorageException {
        if (path.isEmpty()) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, path,
                    "Root folder does not have a parent folder");
        }
        return new BlobStorageFolder(fileSystem, BlobPaths.getParent(path));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("container", fileSystem.getContainerName())
                .add("path", path)
                .toString();
    }
}
