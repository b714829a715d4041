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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.io.ByteStreams;

import org.jclouds.blobstore.BlobStoreContext;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private Main() {
        throw new AssertionError("intentionally not implemented");
    }

    private static final class Options {
        @Option(name = "--properties",
                usage = "blobfs configuration (required)")
        private Path properties;

        @Option(name = "--version", usage = "display version")
        private boolean version;

        @Argument(metaVar = "COMMAND [ARGS...]", multiValued = true,
                usage = "ls [DIR] | lsdir [DIR] | mkdir DIR | rmdir DIR |" +
                " mvdir DIR NEWDIR | rm FILE | mv FILE NEWFILE |" +
                " put FILE [LOCALFILE] | get FILE | du [DIR] | url FILE")
        private List<String> arguments = new ArrayList<>();
    }

    public static void main(String[] args) throws Exception {
        var options = new Options();
        var parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException cle) {
            usage(parser);
        }

        if (options.version) {
            System.err.println(
                    Main.class.getPackage().getImplementationVersion());
            System.exit(0);
        } else if (options.properties == null || options.arguments.isEmpty()) {
            usage(parser);
        }

        var properties = new Properties();
        try (var is = Files.newInputStream(options.properties)) {
            properties.load(is);
        }
        properties.putAll(System.getProperties());

        System.exit(run(properties, options.arguments, System.in,
                System.out, System.err));
    }

    /** Connect using the given configuration and execute one command. */
    static int run(Properties properties, List<String> arguments,
            InputStream in, PrintStream out, PrintStream err)
            throws IOException {
        ConnectionString connection;
        BlobFileSystem.Builder builder;
        try {
            connection = BlobStores.resolveConnection(properties);
            builder = BlobFileSystem.Builder.fromProperties(properties);
        } catch (IllegalArgumentException iae) {
            err.println(iae.getMessage());
            return 1;
        } catch (URISyntaxException use) {
            err.println("Invalid " + BlobFileSystemConstants.PROPERTY_ENDPOINT +
                    ": " + use.getMessage());
            return 1;
        }
        if (builder.getEndpoint() == null &&
                connection.getEndpoint() != null) {
            builder.endpoint(connection.getEndpoint());
        }
        try (BlobStoreContext context = BlobStores.newBlobStoreContext(
                connection, properties)) {
            return run(builder.blobStore(context.getBlobStore()).build(),
                    arguments, in, out, err);
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    /** Execute one command; returns the process exit status. */
    static int run(StorageProvider provider, List<String> arguments,
            InputStream in, PrintStream out, PrintStream err)
            throws IOException {
        if (arguments.isEmpty()) {
            err.println("Missing command");
            return 1;
        }
        String command = arguments.get(0);
        List<String> operands = arguments.subList(1, arguments.size());
        try {
            switch (command) {
            case "ls":
                for (StorageFile file : provider.listFiles(
                        optional(operands, 0))) {
                    out.println(file.getPath() + "\t" + file.getSize());
                }
                break;
            case "lsdir":
                for (StorageFolder folder : provider.listFolders(
                        optional(operands, 0))) {
                    out.println(folder.getPath() + "/");
                }
                break;
            case "mkdir":
                provider.createFolder(required(operands, 0));
                break;
            case "rmdir":
                provider.deleteFolder(required(operands, 0));
                break;
            case "mvdir":
                provider.renameFolder(required(operands, 0),
                        required(operands, 1));
                break;
            case "rm":
                provider.deleteFile(required(operands, 0));
                break;
            case "mv":
                provider.renameFile(required(operands, 0),
                        required(operands, 1));
                break;
            case "put":
                String path = required(operands, 0);
                String localFile = optional(operands, 1);
                if (localFile == null) {
                    provider.saveStream(path, in);
                } else {
                    try (InputStream is = Files.newInputStream(
                            Paths.get(localFile))) {
                        provider.saveStream(path, is);
                    }
                }
                break;
            case "get":
                try (InputStream is = provider.getFile(
                        required(operands, 0)).openRead()) {
                    ByteStreams.copy(is, out);
                }
                out.flush();
                break;
            case "du":
                String folder = optional(operands, 0);
                out.println(provider.getFolderSize(
                        folder == null ? "" : folder));
                break;
            case "url":
                out.println(provider.getPublicUrl(required(operands, 0)));
                break;
            default:
                err.println("Unknown command: " + command);
                return 1;
            }
        } catch (StorageException se) {
            logger.debug("{} failed", command, se);
            err.println(command + ": " + se.getError().getErrorCode() + " " +
                    se.getMessage());
            return 1;
        } catch (FileNotFoundException fnfe) {
            logger.debug("{} failed", command, fnfe);
            err.println(command + ": " +
                    StorageErrorCode.NOT_FOUND.getErrorCode() + " " +
                    fnfe.getMessage());
            return 1;
        } catch (IllegalArgumentException iae) {
            err.println(command + ": " + iae.getMessage());
            return 1;
        }
        return 0;
    }

    private static String required(List<String> operands, int index) {
        if (operands.size() <= index) {
            throw new IllegalArgumentException("missing operand");
        }
        return operands.get(index);
    }

    @Nullable
    private static String optional(List<String> operands, int index) {
        return operands.size() <= index ? null : operands.get(index);
    }

    private static void usage(CmdLineParser parser) {
        System.err.println("Usage: blobfs --properties FILE COMMAND [ARGS...]");
        parser.printUsage(System.err);
        System.exit(1);
    }
}
