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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.io.ByteStreams;
import com.google.common.net.UrlEscapers;

import org.jclouds.blobstore.BlobStore;
import org.jclouds.blobstore.domain.Blob;
import org.jclouds.blobstore.domain.BlobMetadata;
import org.jclouds.blobstore.domain.ContainerAccess;
import org.jclouds.blobstore.domain.PageSet;
import org.jclouds.blobstore.domain.StorageMetadata;
import org.jclouds.blobstore.options.CopyOptions;
import org.jclouds.blobstore.options.ListContainerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StorageProvider} over a single container of a jclouds
 * {@link BlobStore}.
 *
 * The store offers a flat key space.  Folders are the common prefixes of
 * keys, split on '/', and an empty folder is kept alive by a hidden
 * zero-byte marker object directly under its prefix.  Renames copy and
 * then delete each object; nothing is atomic and nothing is cached, so
 * every call observes the store as it is.
 */
public final class BlobFileSystem implements StorageProvider {
    private static final Logger logger = LoggerFactory.getLogger(
            BlobFileSystem.class);
    private static final Escaper SEGMENT_ESCAPER =
            UrlEscapers.urlPathSegmentEscaper();

    private final BlobStore blobStore;
    private final String containerName;
    private final String root;
    @Nullable
    private final URI endpoint;

    private BlobFileSystem(Builder builder) {
        this.blobStore = requireNonNull(builder.blobStore);
        this.containerName = requireNonNull(builder.containerName);
        this.root = BlobPaths.normalizeRoot(builder.root);
        this.endpoint = builder.endpoint;
        bindContainer(builder.isPrivate);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BlobStore blobStore;
        private String containerName;
        private String root = "";
        private boolean isPrivate = true;
        @Nullable
        private URI endpoint;

        Builder() {
        }

        public static Builder fromProperties(Properties properties)
                throws URISyntaxException {
            var builder = new Builder();

            String container = properties.getProperty(
                    BlobFileSystemConstants.PROPERTY_CONTAINER);
            if (Strings.isNullOrEmpty(container)) {
                throw new IllegalArgumentException(
                        "Properties file must contain: " +
                        BlobFileSystemConstants.PROPERTY_CONTAINER);
            }
            builder.containerName(container);

            builder.root(Strings.nullToEmpty(properties.getProperty(
                    BlobFileSystemConstants.PROPERTY_ROOT)));

            String isPrivate = properties.getProperty(
                    BlobFileSystemConstants.PROPERTY_PRIVATE);
            if (isPrivate != null) {
                if (isPrivate.equalsIgnoreCase("true")) {
                    builder.isPrivate(true);
                } else if (isPrivate.equalsIgnoreCase("false")) {
                    builder.isPrivate(false);
                } else {
                    throw new IllegalArgumentException(
                            BlobFileSystemConstants.PROPERTY_PRIVATE +
                            " invalid value, was: " + isPrivate);
                }
            }

            String endpoint = properties.getProperty(
                    BlobFileSystemConstants.PROPERTY_ENDPOINT);
            if (!Strings.isNullOrEmpty(endpoint)) {
                builder.endpoint(new URI(endpoint));
            }

            return builder;
        }

        public Builder blobStore(BlobStore blobStore) {
            this.blobStore = requireNonNull(blobStore);
            return this;
        }

        public Builder containerName(String containerName) {
            this.containerName = requireNonNull(containerName);
            return this;
        }

        public Builder root(String root) {
            this.root = requireNonNull(root);
            return this;
        }

        public Builder isPrivate(boolean isPrivate) {
            this.isPrivate = isPrivate;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = requireNonNull(endpoint);
            return this;
        }

        @Nullable
        public URI getEndpoint() {
            return endpoint;
        }

        /** Bind to the container, creating it and applying its access. */
        public BlobFileSystem build() {
            checkState(blobStore != null, "Must provide a BlobStore");
            checkArgument(!Strings.isNullOrEmpty(containerName),
                    "Must provide a container name");
            return new BlobFileSystem(this);
        }
    }

    private void bindContainer(boolean isPrivate) {
        if (blobStore.createContainerInLocation(null, containerName)) {
            logger.info("Created container {}", containerName);
        }
        ContainerAccess access = isPrivate ?
                ContainerAccess.PRIVATE : ContainerAccess.PUBLIC_READ;
        blobStore.setContainerAccess(containerName, access);
        logger.debug("Bound container {} root '{}' with access {}",
                containerName, root, access);
    }

    public BlobStore getBlobStore() {
        return blobStore;
    }

    public String getContainerName() {
        return containerName;
    }

    /** Root prefix, empty or ending with '/'. */
    public String getRoot() {
        return root;
    }

    @Override
    public boolean fileExists(String path) throws StorageException {
        return blobStore.blobExists(containerName,
                BlobPaths.toKey(root, path));
    }

    @Override
    public StorageFile getFile(String path) throws StorageException {
        String key = BlobPaths.toKey(root, path);
        if (!blobStore.blobExists(containerName, key)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, path);
        }
        return new BlobStorageFile(this, key);
    }

    @Override
    public StorageFile createFile(String path) throws StorageException {
        String key = BlobPaths.toKey(root, path);
        if (blobStore.blobExists(containerName, key)) {
            throw new StorageException(StorageErrorCode.ALREADY_EXISTS, path);
        }
        touch(key);
        logger.debug("Created file {}", key);
        return new BlobStorageFile(this, key);
    }

    @Override
    public void deleteFile(String path) throws StorageException {
        String key = BlobPaths.toKey(root, path);
        if (!blobStore.blobExists(containerName, key)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, path);
        }
        blobStore.removeBlob(containerName, key);
        logger.debug("Deleted file {}", key);
    }

    @Override
    public void renameFile(String path, String newPath)
            throws StorageException {
        renameKey(BlobPaths.toKey(root, path), BlobPaths.toKey(root, newPath));
    }

    @Override
    public Iterable<StorageFile> listFiles(@Nullable String path)
            throws StorageException {
        String prefix = BlobPaths.folderPrefix(root,
                BlobPaths.toFolderPath(path));
        return FluentIterable.from(listEntries(prefix))
                .filter(entry -> entry.getKind() == BlobEntry.Kind.FILE &&
                        !BlobPaths.isMarker(entry.getKey()))
                .<StorageFile>transform(entry ->
                        new BlobStorageFile(this, entry.getKey()));
    }

    @Override
    public Iterable<StorageFolder> listFolders(@Nullable String path)
            throws StorageException {
        String folder = BlobPaths.toFolderPath(path);
        String prefix = BlobPaths.folderPrefix(root, folder);
        if (!prefixExists(prefix)) {
            logger.info("Creating missing folder '{}' on listing", folder);
            writeMarker(prefix);
        }

        var builder = ImmutableList.<StorageFolder>builder();
        for (BlobEntry entry : listEntries(prefix)) {
            if (entry.getKind() == BlobEntry.Kind.FOLDER) {
                builder.add(new BlobStorageFolder(this,
                        BlobPaths.trimRoot(root, entry.getKey())));
            }
        }
        return builder.build();
    }

    @Override
    public boolean folderExists(String path) throws StorageException {
        return prefixExists(BlobPaths.folderPrefix(root,
                BlobPaths.toFolderPath(path)));
    }

    @Override
    public void createFolder(String path) throws StorageException {
        String folder = BlobPaths.toFolderPath(path);
        String prefix = BlobPaths.folderPrefix(root, folder);
        if (prefixExists(prefix)) {
            throw new StorageException(StorageErrorCode.ALREADY_EXISTS,
                    folder);
        }
        writeMarker(prefix);
    }

    @Override
    public boolean tryCreateFolder(String path) throws StorageException {
        try {
            createFolder(path);
            return true;
        } catch (StorageException se) {
            if (se.getError() != StorageErrorCode.ALREADY_EXISTS) {
                throw se;
            }
            return false;
        }
    }

    @Override
    public void deleteFolder(String path) throws StorageException {
        String folder = BlobPaths.toFolderPath(path);
        String prefix = BlobPaths.folderPrefix(root, folder);
        if (!prefixExists(prefix)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, folder);
        }
        deletePrefix(prefix);
        logger.debug("Deleted folder {}", prefix);
    }

    @Override
    public void renameFolder(String path, String newPath)
            throws StorageException {
        String source = BlobPaths.toFolderPath(path);
        String target = BlobPaths.toFolderPath(newPath);
        if (source.isEmpty() || target.isEmpty()) {
            throw new StorageException(StorageErrorCode.INVALID_PATH,
                    source.isEmpty() ? path : newPath,
                    "Cannot rename the root folder");
        }
        if (target.equals(source) ||
                target.startsWith(source + BlobFileSystemConstants.SEPARATOR)) {
            throw new StorageException(StorageErrorCode.INVALID_PATH, newPath,
                    "Cannot move a folder into itself");
        }
        String sourcePrefix = BlobPaths.folderPrefix(root, source);
        if (!prefixExists(sourcePrefix)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, source);
        }
        renamePrefix(sourcePrefix, BlobPaths.folderPrefix(root, target));
        logger.debug("Renamed folder {} to {}", source, target);
    }

    @Override
    public long getFolderSize(String path) throws StorageException {
        return folderSize(BlobPaths.folderPrefix(root,
                BlobPaths.toFolderPath(path)));
    }

    @Override
    public void saveStream(String path, InputStream inputStream)
            throws StorageException, IOException {
        String key = BlobPaths.toKey(root, path);
        if (blobStore.blobExists(containerName, key)) {
            throw new StorageException(StorageErrorCode.ALREADY_EXISTS, path);
        }
        // publish only complete content; a failed copy leaves no object
        BlobOutputStream os = openWrite(key);
        try {
            ByteStreams.copy(inputStream, os);
        } catch (IOException | RuntimeException e) {
            os.abort();
            throw e;
        }
        os.close();
        logger.debug("Saved stream to {}", key);
    }

    @Override
    public boolean trySaveStream(String path, InputStream inputStream) {
        try {
            saveStream(path, inputStream);
            return true;
        } catch (StorageException | IOException e) {
            logger.warn("Could not save stream to {}", path, e);
            return false;
        }
    }

    @Override
    public String getPublicUrl(String path) throws StorageException {
        String key = BlobPaths.toKey(root, path);
        if (endpoint != null) {
            if (!blobStore.blobExists(containerName, key)) {
                throw new StorageException(StorageErrorCode.NOT_FOUND, path);
            }
            return baseUrl(endpoint) +
                    SEGMENT_ESCAPER.escape(containerName) +
                    BlobFileSystemConstants.SEPARATOR + escapeKey(key);
        }

        BlobMetadata metadata = blobStore.blobMetadata(containerName, key);
        if (metadata == null) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, path);
        }
        URI uri = metadata.getPublicUri() != null ?
                metadata.getPublicUri() : metadata.getUri();
        if (uri == null) {
            throw new IllegalStateException("No endpoint configured and " +
                    "provider does not report object URIs: " +
                    BlobFileSystemConstants.PROPERTY_ENDPOINT);
        }
        return uri.toString();
    }

    @Override
    @Nullable
    public String getStoragePath(String url) {
        if (endpoint == null) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException use) {
            logger.debug("Not a URI: {}", url);
            return null;
        }
        if (!Objects.equals(uri.getScheme(), endpoint.getScheme()) ||
                !Objects.equals(uri.getAuthority(), endpoint.getAuthority()) ||
                uri.getPath() == null) {
            return null;
        }
        String base = Strings.nullToEmpty(endpoint.getPath());
        if (!base.endsWith(BlobFileSystemConstants.SEPARATOR)) {
            base += BlobFileSystemConstants.SEPARATOR;
        }
        base += containerName + BlobFileSystemConstants.SEPARATOR + root;
        String path = uri.getPath();
        if (!path.startsWith(base)) {
            return null;
        }
        return path.substring(base.length());
    }

    @Override
    public String combine(String path1, String path2) {
        return BlobPaths.combine(path1, path2);
    }

    InputStream openRead(String key) throws IOException {
        Blob blob = blobStore.getBlob(containerName, key);
        if (blob == null) {
            throw new FileNotFoundException(containerName + "/" + key);
        }
        return blob.getPayload().openStream();
    }

    BlobOutputStream openWrite(String key) {
        return new BlobOutputStream(blobStore, containerName, key);
    }

    /** Recursive sum of object sizes under prefix, markers included. */
    long folderSize(String prefix) {
        long size = 0;
        for (BlobEntry entry : listEntries(prefix)) {
            switch (entry.getKind()) {
            case FILE:
                size += entry.getSize();
                break;
            case FOLDER:
                size += folderSize(entry.getKey() +
                        BlobFileSystemConstants.SEPARATOR);
                break;
            default:
                throw new IllegalStateException(
                        "Unknown entry: " + entry.getKind());
            }
        }
        return size;
    }

    private void touch(String key) {
        try (OutputStream os = openWrite(key)) {
            // closing the empty stream creates the object
        } catch (IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
    }

    private void writeMarker(String prefix) {
        String key = BlobPaths.markerKey(prefix);
        touch(key);
        logger.debug("Created folder marker {}", key);
    }

    /** Whether any object, marker or not, lives under prefix. */
    private boolean prefixExists(String prefix) {
        ListContainerOptions options = new ListContainerOptions().recursive();
        options.maxResults(1);
        if (!prefix.isEmpty()) {
            options.prefix(prefix);
        }
        return !blobStore.list(containerName, options).isEmpty();
    }

    private void renameKey(String source, String target)
            throws StorageException {
        if (!blobStore.blobExists(containerName, source)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND,
                    BlobPaths.trimRoot(root, source));
        }
        if (blobStore.blobExists(containerName, target)) {
            throw new StorageException(StorageErrorCode.ALREADY_EXISTS,
                    BlobPaths.trimRoot(root, target));
        }
        blobStore.copyBlob(containerName, source, containerName, target,
                CopyOptions.NONE);
        try {
            blobStore.removeBlob(containerName, source);
        } catch (RuntimeException re) {
            logger.warn("Copied {} to {} but could not remove the source",
                    source, target, re);
            throw re;
        }
        logger.debug("Renamed {} to {}", source, target);
    }

    private void renamePrefix(String sourcePrefix, String targetPrefix)
            throws StorageException {
        // materialize each level since renames mutate the listing
        for (BlobEntry entry : ImmutableList.copyOf(listEntries(
                sourcePrefix))) {
            String relative = entry.getKey().substring(sourcePrefix.length());
            switch (entry.getKind()) {
            case FILE:
                String target = targetPrefix + relative;
                if (BlobPaths.isMarker(entry.getKey()) &&
                        blobStore.blobExists(containerName, target)) {
                    blobStore.removeBlob(containerName, entry.getKey());
                } else {
                    renameKey(entry.getKey(), target);
                }
                break;
            case FOLDER:
                renamePrefix(
                        entry.getKey() + BlobFileSystemConstants.SEPARATOR,
                        targetPrefix + relative +
                        BlobFileSystemConstants.SEPARATOR);
                break;
            default:
                throw new IllegalStateException(
                        "Unknown entry: " + entry.getKind());
            }
        }
    }

    private void deletePrefix(String prefix) {
        for (BlobEntry entry : ImmutableList.copyOf(listEntries(prefix))) {
            switch (entry.getKind()) {
            case FILE:
                blobStore.removeBlob(containerName, entry.getKey());
                break;
            case FOLDER:
                deletePrefix(entry.getKey() +
                        BlobFileSystemConstants.SEPARATOR);
                break;
            default:
                throw new IllegalStateException(
                        "Unknown entry: " + entry.getKind());
            }
        }
    }

    /** Lazily page through the entries directly under prefix. */
    private Iterable<BlobEntry> listEntries(String prefix) {
        return () -> new AbstractIterator<BlobEntry>() {
            private Iterator<? extends StorageMetadata> page =
                    Collections.emptyIterator();
            @Nullable
            private String marker;
            private boolean exhausted;

            @Override
            protected BlobEntry computeNext() {
                while (true) {
                    if (page.hasNext()) {
                        BlobEntry entry = BlobEntry.fromMetadata(prefix,
                                page.next());
                        if (entry != null) {
                            return entry;
                        }
                        continue;
                    }
                    if (exhausted) {
                        return endOfData();
                    }
                    var options = new ListContainerOptions();
                    options.delimiter(BlobFileSystemConstants.SEPARATOR);
                    if (!prefix.isEmpty()) {
                        options.prefix(prefix);
                    }
                    if (marker != null) {
                        options.afterMarker(marker);
                    }
                    PageSet<? extends StorageMetadata> set = blobStore.list(
                            containerName, options);
                    page = set.iterator();
                    marker = set.getNextMarker();
                    exhausted = marker == null;
                }
            }
        };
    }

    private static String baseUrl(URI endpoint) {
        String base = endpoint.toString();
        if (!base.endsWith(BlobFileSystemConstants.SEPARATOR)) {
            base += BlobFileSystemConstants.SEPARATOR;
        }
        return base;
    }

    private static String escapeKey(String key) {
        var segments = ImmutableList.<String>builder();
        for (String segment : Splitter.on('/').split(key)) {
            segments.add(SEGMENT_ESCAPER.escape(segment));
        }
        return Joiner.on('/').join(segments.build());
    }
}
