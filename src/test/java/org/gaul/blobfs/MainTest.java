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
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import org.jclouds.blobstore.BlobStoreContext;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public final class MainTest {
    private BlobStoreContext context;
    private String containerName;
    private BlobFileSystem fileSystem;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() throws Exception {
        containerName = TestUtils.createRandomContainerName();
        context = TestUtils.newTransientContext();
        fileSystem = BlobFileSystem.builder()
                .blobStore(context.getBlobStore())
                .containerName(containerName)
                .endpoint(URI.create("https://example.com"))
                .build();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @After
    public void tearDown() throws Exception {
        if (context != null) {
            context.getBlobStore().deleteContainer(containerName);
            context.close();
        }
    }

    @Test
    public void testPutGetAndList() throws Exception {
        assertThat(run("mkdir", "docs")).isZero();
        assertThat(run(new ByteArrayInputStream(
                "hello".getBytes(StandardCharsets.UTF_8)),
                "put", "docs/a.txt")).isZero();

        out.reset();
        assertThat(run("get", "docs/a.txt")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("hello");

        out.reset();
        assertThat(run("ls", "docs")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
                .isEqualTo("docs/a.txt\t5" + System.lineSeparator());

        out.reset();
        assertThat(run("lsdir")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
                .isEqualTo("docs/" + System.lineSeparator());

        out.reset();
        assertThat(run("du", "docs")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("5");

        out.reset();
        assertThat(run("url", "docs/a.txt")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8).trim()).isEqualTo(
                "https://example.com/" + containerName + "/docs/a.txt");
    }

    @Test
    public void testMoveAndRemove() throws Exception {
        fileSystem.createFile("a.txt");
        assertThat(run("mv", "a.txt", "b.txt")).isZero();
        assertThat(fileSystem.fileExists("b.txt")).isTrue();

        fileSystem.createFile("src/c.txt");
        assertThat(run("mvdir", "src", "dst")).isZero();
        assertThat(fileSystem.fileExists("dst/c.txt")).isTrue();

        assertThat(run("rm", "b.txt")).isZero();
        assertThat(run("rmdir", "dst")).isZero();
        assertThat(fileSystem.folderExists("dst")).isFalse();
    }

    @Test
    public void testStorageErrorReported() throws Exception {
        assertThat(run("rm", "missing.txt")).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("rm: NotFound ")
                .contains("missing.txt");
    }

    @Test
    public void testMissingOperand() throws Exception {
        assertThat(run("mkdir")).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("mkdir: missing operand");
    }

    @Test
    public void testUnknownCommand() throws Exception {
        assertThat(run("frobnicate")).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("Unknown command: frobnicate");
    }

    @Test
    public void testFileRemovedBeforeRead() throws Exception {
        fileSystem.createFile("a.txt");
        // delete the object between lookup and read
        StorageProvider provider = (StorageProvider) Proxy.newProxyInstance(
                StorageProvider.class.getClassLoader(),
                new Class<?>[] {StorageProvider.class},
                (proxy, method, args) -> {
                    Object result = method.invoke(fileSystem, args);
                    if (method.getName().equals("getFile")) {
                        fileSystem.deleteFile((String) args[0]);
                    }
                    return result;
                });

        int status = Main.run(provider, List.of("get", "a.txt"),
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(status).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("get: NotFound ")
                .contains("a.txt");
    }

    @Test
    public void testRunFromProperties() throws Exception {
        Properties properties = transientProperties();
        assertThat(Main.run(properties, List.of("mkdir", "docs"),
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)))
                .isZero();
    }

    @Test
    public void testMalformedEndpoint() throws Exception {
        Properties properties = transientProperties();
        properties.setProperty(BlobFileSystemConstants.PROPERTY_ENDPOINT,
                "http://bad host/");
        assertThat(Main.run(properties, List.of("ls"),
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)))
                .isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .startsWith("Invalid " +
                        BlobFileSystemConstants.PROPERTY_ENDPOINT);
    }

    @Test
    public void testMissingConfiguration() throws Exception {
        assertThat(Main.run(new Properties(), List.of("ls"),
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)))
                .isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .contains(BlobFileSystemConstants.PROPERTY_CONNECTION_STRING);
    }

    private Properties transientProperties() {
        var properties = new Properties();
        properties.setProperty(
                BlobFileSystemConstants.PROPERTY_CONNECTION_STRING,
                "Provider=transient");
        properties.setProperty(BlobFileSystemConstants.PROPERTY_CONTAINER,
                TestUtils.createRandomContainerName());
        return properties;
    }

    private int run(String... arguments) throws Exception {
        return run(new ByteArrayInputStream(new byte[0]), arguments);
    }

    private int run(InputStream in, String... arguments) throws Exception {
        return Main.run(fileSystem, List.of(arguments), in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }
}
