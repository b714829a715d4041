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

import static org.gaul.blobfs.BlobFileSystemConstants.FOLDER_MARKER;
import static org.gaul.blobfs.BlobFileSystemConstants.SEPARATOR;

import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/**
 * Maps relative virtual paths onto store keys.  A key is always the root
 * prefix followed by the relative path; the root prefix is either empty or
 * ends with the separator.
 */
final class BlobPaths {
    private static final CharMatcher SLASH = CharMatcher.is('/');
    private static final Pattern SCHEME = Pattern.compile(
            "^[A-Za-z][A-Za-z0-9+.-]*://");

    private BlobPaths() {
        throw new AssertionError("intentionally unimplemented");
    }

    /** Root prefix without a leading and with a trailing separator. */
    static String normalizeRoot(@Nullable String root) {
        String trimmed = SLASH.trimFrom(Strings.nullToEmpty(root));
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed + SEPARATOR;
    }

    static void ensureRelative(String path) throws StorageException {
        if (path.startsWith(SEPARATOR) || SCHEME.matcher(path).find()) {
            throw new StorageException(StorageErrorCode.INVALID_PATH, path);
        }
    }

    /** Store key for a file path. */
    static String toKey(String root, String path) throws StorageException {
        ensureRelative(path);
        return root + path;
    }

    /** Folder path without trailing separators; null means the root. */
    static String toFolderPath(@Nullable String path) throws StorageException {
        String folder = Strings.nullToEmpty(path);
        ensureRelative(folder);
        return SLASH.trimTrailingFrom(folder);
    }

    /** Listing prefix for a folder: empty folder paths map to the root. */
    static String folderPrefix(String root, String folder) {
        if (folder.isEmpty()) {
            return root;
        }
        return root + folder + SEPARATOR;
    }

    static String markerKey(String folderPrefix) {
        return folderPrefix + FOLDER_MARKER;
    }

    static boolean isMarker(String key) {
        return key.equals(FOLDER_MARKER) ||
                key.endsWith(SEPARATOR + FOLDER_MARKER);
    }

    static String trimRoot(String root, String key) {
        if (!root.isEmpty() && key.startsWith(root)) {
            return key.substring(root.length());
        }
        return key;
    }

    static String combine(String path1, String path2) {
        if (Strings.isNullOrEmpty(path1)) {
            return Strings.nullToEmpty(path2);
        }
        if (Strings.isNullOrEmpty(path2)) {
            return path1;
        }
        return SLASH.trimTrailingFrom(path1) + SEPARATOR +
                SLASH.trimLeadingFrom(path2);
    }

    static String getName(String path) {
        int index = path.lastIndexOf(SEPARATOR);
        return index == -1 ? path : path.substring(index + 1);
    }

    /** Parent path, or the empty string for top-level entries. */
    static String getParent(String path) {
        int index = path.lastIndexOf(SEPARATOR);
        return index == -1 ? "" : path.substring(0, index);
    }

    /** Extension including the leading dot, or the empty string. */
    static String getExtension(String path) {
        String name = getName(path);
        int index = name.lastIndexOf('.');
        return index == -1 ? "" : name.substring(index);
    }
}
