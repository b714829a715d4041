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

import java.net.URI;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * Storage account settings in the Azure connection string format, e.g.,
 *   DefaultEndpointsProtocol=https;AccountName=foo;AccountKey=bar
 *
 * An optional Provider=&lt;jclouds provider id&gt; entry selects a backend
 * other than azureblob.
 */
public final class ConnectionString {
    static final String DEFAULT_PROVIDER = "azureblob";
    static final String DEVELOPMENT_ACCOUNT_NAME = "devstoreaccount1";
    static final String DEVELOPMENT_ACCOUNT_KEY =
            "Eby8vdM02xNOcqFlqUwJPLlmEtlCDXJ1OUzFT50uSRZ6IFsuFq2UVErCz4I6tq" +
            "/K1SZFPTOtr/KBHBeksoGMGw==";
    static final URI DEVELOPMENT_ENDPOINT =
            URI.create("http://127.0.0.1:10000/devstoreaccount1");

    /** Providers that keep data locally and need no credentials. */
    private static final Set<String> LOCAL_PROVIDERS = Set.of(
            "filesystem", "transient");
    private static final Splitter.MapSplitter SPLITTER = Splitter.on(';')
            .omitEmptyStrings()
            .trimResults()
            .withKeyValueSeparator(Splitter.on('=').limit(2).trimResults());

    private final String provider;
    private final String identity;
    private final String credential;
    @Nullable
    private final URI endpoint;

    private ConnectionString(String provider, String identity,
            String credential, @Nullable URI endpoint) {
        this.provider = requireNonNull(provider);
        this.identity = requireNonNull(identity);
        this.credential = requireNonNull(credential);
        this.endpoint = endpoint;
    }

    public static ConnectionString parse(String connectionString) {
        Map<String, String> entries =
                new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        try {
            entries.putAll(SPLITTER.split(
                    Strings.nullToEmpty(connectionString)));
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException(
                    "Malformed connection string: " + iae.getMessage(), iae);
        }
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Empty connection string");
        }
        return fromEntries(entries);
    }

    /** @param entries settings keyed case-insensitively */
    static ConnectionString fromEntries(Map<String, String> entries) {
        if ("true".equalsIgnoreCase(entries.get("UseDevelopmentStorage"))) {
            return new ConnectionString(DEFAULT_PROVIDER,
                    DEVELOPMENT_ACCOUNT_NAME, DEVELOPMENT_ACCOUNT_KEY,
                    DEVELOPMENT_ENDPOINT);
        }

        String provider = entries.getOrDefault("Provider", DEFAULT_PROVIDER);
        String accountName = entries.get("AccountName");
        String accountKey = entries.get("AccountKey");
        String blobEndpoint = entries.get("BlobEndpoint");

        if (LOCAL_PROVIDERS.contains(provider)) {
            return new ConnectionString(provider,
                    Strings.nullToEmpty(accountName),
                    Strings.nullToEmpty(accountKey),
                    Strings.isNullOrEmpty(blobEndpoint) ? null :
                            URI.create(blobEndpoint));
        }

        if (Strings.isNullOrEmpty(accountName) ||
                Strings.isNullOrEmpty(accountKey)) {
            throw new IllegalArgumentException(
                    "Connection string must contain: AccountName and " +
                    "AccountKey");
        }

        URI endpoint = null;
        if (!Strings.isNullOrEmpty(blobEndpoint)) {
            endpoint = URI.create(blobEndpoint);
        } else if (provider.equals(DEFAULT_PROVIDER)) {
            String protocol = entries.getOrDefault(
                    "DefaultEndpointsProtocol", "https");
            String suffix = entries.getOrDefault("EndpointSuffix",
                    "core.windows.net");
            endpoint = URI.create(protocol + "://" + accountName + ".blob." +
                    suffix);
        }
        return new ConnectionString(provider, accountName, accountKey,
                endpoint);
    }

    /** jclouds provider id. */
    public String getProvider() {
        return provider;
    }

    public String getIdentity() {
        return identity;
    }

    public String getCredential() {
        return credential;
    }

    /** Blob service endpoint, or null to use the provider default. */
    @Nullable
    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("provider", provider)
                .add("identity", identity)
                .add("endpoint", endpoint)
                .toString();
    }
}
