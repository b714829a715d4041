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

import javax.annotation.Nullable;

/**
 * File and folder operations over a storage backend.  All paths are
 * relative, use '/' as separator and must not start with '/' or a URL
 * scheme; such paths fail with {@link StorageErrorCode#INVALID_PATH}.
 *
 * Multi-step operations (renames, recursive deletes) are not atomic.  A
 * failure part way through surfaces to the caller and leaves the objects
 * processed so far in their new state.
 */
public interface StorageProvider {
    boolean fileExists(String path) throws StorageException;

    StorageFile getFile(String path) throws StorageException;

    /** Create an empty file; fails with ALREADY_EXISTS if present. */
    StorageFile createFile(String path) throws StorageException;

    void deleteFile(String path) throws StorageException;

    /**
     * Copy path to newPath and then delete path.  A failure between the
     * two steps leaves both objects in place.
     */
    void renameFile(String path, String newPath) throws StorageException;

    /** Files directly under path, fetched lazily page by page. */
    Iterable<StorageFile> listFiles(@Nullable String path)
            throws StorageException;

    /**
     * Immediate sub-folders of path.  Creates path when nothing exists
     * under it yet.
     */
    Iterable<StorageFolder> listFolders(@Nullable String path)
            throws StorageException;

    boolean folderExists(String path) throws StorageException;

    void createFolder(String path) throws StorageException;

    /** Create the folder unless it exists; returns whether it was created. */
    boolean tryCreateFolder(String path) throws StorageException;

    void deleteFolder(String path) throws StorageException;

    void renameFolder(String path, String newPath) throws StorageException;

    long getFolderSize(String path) throws StorageException;

    /**
     * Create a file from the given stream; fails if the file exists.  If
     * reading the stream fails nothing is stored.
     */
    void saveStream(String path, InputStream inputStream)
            throws StorageException, IOException;

    /** Like saveStream but reports failure as false. */
    boolean trySaveStream(String path, InputStream inputStream);

    String getPublicUrl(String path) throws StorageException;

    /**
     * Relative path addressed by a public URL of this provider, or null if
     * the URL lies outside it.
     */
    @Nullable
    String getStoragePath(String url);

    String combine(String path1, String path2);
}
