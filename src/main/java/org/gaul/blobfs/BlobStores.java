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

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.Strings;

import org.jclouds.Constants;
import org.jclouds.ContextBuilder;
import org.jclouds.JcloudsVersion;
import org.jclouds.blobstore.BlobStoreContext;
import org.jclouds.logging.slf4j.config.SLF4JLoggingModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates jclouds contexts from blobfs configuration properties. */
public final class BlobStores {
    private static final Logger logger = LoggerFactory.getLogger(
            BlobStores.class);

    private BlobStores() {
        throw new AssertionError("intentionally not implemented");
    }

    /**
     * Connection settings from blobfs.connection-string if present,
     * otherwise from the jclouds.provider, jclouds.identity,
     * jclouds.credential and jclouds.endpoint properties.
     *
     * @throws IllegalArgumentException if no usable credentials are given
     */
    public static ConnectionString resolveConnection(Properties properties) {
        String connectionString = properties.getProperty(
                BlobFileSystemConstants.PROPERTY_CONNECTION_STRING);
        if (!Strings.isNullOrEmpty(connectionString)) {
            return ConnectionString.parse(connectionString);
        }

        String provider = properties.getProperty(Constants.PROPERTY_PROVIDER);
        if (provider == null) {
            throw new IllegalArgumentException(
                    "Properties file must contain: " +
                    BlobFileSystemConstants.PROPERTY_CONNECTION_STRING +
                    " or " + Constants.PROPERTY_PROVIDER);
        }
        Map<String, String> entries =
                new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        entries.put("Provider", provider);
        putEntry(entries, "AccountName",
                properties.getProperty(Constants.PROPERTY_IDENTITY));
        putEntry(entries, "AccountKey",
                properties.getProperty(Constants.PROPERTY_CREDENTIAL));
        putEntry(entries, "BlobEndpoint",
                properties.getProperty(Constants.PROPERTY_ENDPOINT));
        return ConnectionString.fromEntries(entries);
    }

    public static BlobStoreContext newBlobStoreContext(
            ConnectionString connection, Properties properties) {
        var overrides = new Properties();
        overrides.putAll(properties);
        overrides.remove(Constants.PROPERTY_ENDPOINT);
        overrides.remove(BlobFileSystemConstants.PROPERTY_CONNECTION_STRING);
        overrides.setProperty(Constants.PROPERTY_USER_AGENT,
                String.format("blobfs/%s jclouds/%s java/%s",
                        BlobStores.class.getPackage()
                                .getImplementationVersion(),
                        JcloudsVersion.get(),
                        System.getProperty("java.version")));

        ContextBuilder builder = ContextBuilder
                .newBuilder(connection.getProvider())
                .credentials(connection.getIdentity(),
                        connection.getCredential())
                .modules(List.of(new SLF4JLoggingModule()))
                .overrides(overrides);
        URI endpoint = connection.getEndpoint();
        if (endpoint != null) {
            builder = builder.endpoint(endpoint.toString());
        }
        logger.debug("Connecting to {}", connection);
        return builder.build(BlobStoreContext.class);
    }

    public static BlobStoreContext newBlobStoreContext(Properties properties) {
        return newBlobStoreContext(resolveConnection(properties), properties);
    }

    private static void putEntry(Map<String, String> entries, String key,
            @Nullable String value) {
        if (!Strings.isNullOrEmpty(value)) {
            entries.put(key, value);
        }
    }
}
