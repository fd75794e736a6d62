/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.hll.mongo;

import java.io.Closeable;
import java.util.concurrent.TimeUnit;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The {@code MongoConnection} abstracts connection to the {@code MongoDB}.
 */
public class MongoConnection implements Closeable {

    private static final int DEFAULT_SERVER_SELECTION_TIMEOUT_MS = 30000;

    private final ConnectionString uri;
    private final MongoClient mongo;

    /**
     * Constructs a new connection using the specified MongoDB connection
     * string. See also http://docs.mongodb.org/manual/reference/connection-string/
     *
     * @param uri the MongoDB URI, must contain a database name.
     * @throws IllegalArgumentException if the URI is invalid or has no database.
     */
    public MongoConnection(@NotNull String uri) {
        this(uri, DEFAULT_SERVER_SELECTION_TIMEOUT_MS);
    }

    /**
     * @param uri the MongoDB URI, must contain a database name.
     * @param serverSelectionTimeoutMillis how long to wait for a server
     *          before an operation fails.
     */
    public MongoConnection(@NotNull String uri, int serverSelectionTimeoutMillis) {
        this.uri = new ConnectionString(checkNotNull(uri));
        checkArgument(this.uri.getDatabase() != null, "no database in %s", uri);
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(this.uri)
                .applyToClusterSettings(b -> b.serverSelectionTimeout(
                        serverSelectionTimeoutMillis, TimeUnit.MILLISECONDS))
                .build();
        this.mongo = MongoClients.create(settings);
    }

    /**
     * @return the database named in the URI.
     */
    @NotNull
    public MongoDatabase getDatabase() {
        return mongo.getDatabase(uri.getDatabase());
    }

    /**
     * Closes the underlying Mongo instance
     */
    @Override
    public void close() {
        mongo.close();
    }

    @Override
    public String toString() {
        return "MongoConnection[" + uri.getHosts() + "/" + uri.getDatabase() + "]";
    }
}
