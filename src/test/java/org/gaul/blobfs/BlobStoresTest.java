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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.assertj.core.api.Assertions;
import org.jclouds.Constants;
import org.jclouds.blobstore.BlobStoreContext;
import org.jclouds.filesystem.reference.FilesystemConstants;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public final class BlobStoresTest {
    @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testResolveFromJcloudsProperties() {
        var properties = new Properties();
        properties.setProperty(Constants.PROPERTY_PROVIDER, "s3");
        properties.setProperty(Constants.PROPERTY_IDENTITY, "access");
        properties.setProperty(Constants.PROPERTY_CREDENTIAL, "sec;ret=");
        properties.setProperty(Constants.PROPERTY_ENDPOINT,
                "http://127.0.0.1:9000");

        ConnectionString connection =
                BlobStores.resolveConnection(properties);
        assertThat(connection.getProvider()).isEqualTo("s3");
        assertThat(connection.getIdentity()).isEqualTo("access");
        assertThat(connection.getCredential()).isEqualTo("sec;ret=");
        assertThat(connection.getEndpoint())
                .isEqualTo(URI.create("http://127.0.0.1:9000"));
    }

    @Test
    public void testConnectionStringTakesPrecedence() {
        var properties = new Properties();
        properties.setProperty(
                BlobFileSystemConstants.PROPERTY_CONNECTION_STRING,
                "UseDevelopmentStorage=true");
        properties.setProperty(Constants.PROPERTY_PROVIDER, "s3");

        ConnectionString connection =
                BlobStores.resolveConnection(properties);
        assertThat(connection.getProvider()).isEqualTo("azureblob");
        assertThat(connection.getEndpoint())
                .isEqualTo(ConnectionString.DEVELOPMENT_ENDPOINT);
    }

    @Test
    public void testMissingProvider() {
        try {
            BlobStores.resolveConnection(new Properties());
            Assertions.failBecauseExceptionWasNotThrown(
                    IllegalArgumentException.class);
        } catch (IllegalArgumentException iae) {
            assertThat(iae.getMessage()).contains(
                    BlobFileSystemConstants.PROPERTY_CONNECTION_STRING);
        }
    }

    @Test
    public void testTransientContext() throws Exception {
        String containerName = TestUtils.createRandomContainerName();
        var properties = new Properties();
        properties.setProperty(
                BlobFileSystemConstants.PROPERTY_CONNECTION_STRING,
                "Provider=transient");
        properties.setProperty(BlobFileSystemConstants.PROPERTY_CONTAINER,
                containerName);

        try (BlobStoreContext context =
                BlobStores.newBlobStoreContext(properties)) {
            BlobFileSystem fileSystem = BlobFileSystem.Builder
                    .fromProperties(properties)
                    .blobStore(context.getBlobStore())
                    .build();
            fileSystem.createFile("a.txt");
            assertThat(context.getBlobStore().blobExists(containerName,
                    "a.txt")).isTrue();
        }
    }

    @Test
    public void testFilesystemContext() throws Exception {
        String containerName = TestUtils.createRandomContainerName();
        File baseDir = temporaryFolder.newFolder();
        var properties = new Properties();
        properties.setProperty(
                BlobFileSystemConstants.PROPERTY_CONNECTION_STRING,
                "Provider=filesystem");
        properties.setProperty(FilesystemConstants.PROPERTY_BASEDIR,
                baseDir.getAbsolutePath());
        properties.setProperty(BlobFileSystemConstants.PROPERTY_CONTAINER,
                containerName);

        try (BlobStoreContext context =
                BlobStores.newBlobStoreContext(properties)) {
            BlobFileSystem fileSystem = BlobFileSystem.Builder
                    .fromProperties(properties)
                    .blobStore(context.getBlobStore())
                    .build();
            fileSystem.saveStream("docs/a.txt", new ByteArrayInputStream(
                    "hello".getBytes(StandardCharsets.UTF_8)));
            assertThat(fileSystem.getFolderSize("docs")).isEqualTo(5);
        }
        assertThat(new File(baseDir, containerName + "/docs/a.txt"))
                .hasContent("hello");
    }
}
