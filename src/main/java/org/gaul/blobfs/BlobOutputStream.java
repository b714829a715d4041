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
import java.io.OutputStream;

import com.google.common.io.ByteSource;
import com.google.common.io.FileBackedOutputStream;

import org.jclouds.blobstore.BlobStore;
import org.jclouds.blobstore.domain.Blob;

/**
 * Buffers written bytes, in memory up to a threshold and in a temporary
 * file beyond it, and uploads them as a single blob on close.
 */
final class BlobOutputStream extends OutputStream {
    static final int MEMORY_THRESHOLD = 1024 * 1024;

    private final BlobStore blobStore;
    private final String containerName;
    private final String blobName;
    private final FileBackedOutputStream buffer =
            new FileBackedOutputStream(MEMORY_THRESHOLD, true);
    private boolean closed;

    BlobOutputStream(BlobStore blobStore, String containerName,
            String blobName) {
        this.blobStore = requireNonNull(blobStore);
        this.containerName = requireNonNull(containerName);
        this.blobName = requireNonNull(blobName);
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        buffer.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        buffer.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        buffer.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            buffer.close();
            ByteSource content = buffer.asByteSource();
            Blob blob = blobStore.blobBuilder(blobName)
                    .payload(content)
                    .contentLength(content.size())
                    .build();
            blobStore.putBlob(containerName, blob);
        } finally {
            buffer.reset();
        }
    }

    /** Discard buffered bytes without uploading; close becomes a no-op. */
    void abort() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        buffer.reset();
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream already closed");
        }
    }
}
