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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;

import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.apache.jackrabbit.hll.store.RegisterStore;
import org.apache.jackrabbit.hll.store.RegisterStoreException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A register store that uses MongoDB as the backend. Each key is one
 * document of the form <code>{_id: key, v: [r0, r1, ...]}</code> with
 * {@value RegisterArray#SIZE} integer registers. Registers are raised with
 * {@code $max}, so concurrent writers never lower a register.
 */
public class MongoRegisterStore implements RegisterStore {

    private static final Logger LOG = LoggerFactory.getLogger(MongoRegisterStore.class);

    public static final String DEFAULT_COLLECTION = "hyperloglog";

    static final String ID = "_id";

    static final String REGISTERS = "v";

    private final MongoCollection<Document> sketches;

    public MongoRegisterStore(@NotNull MongoDatabase db) {
        this(db, DEFAULT_COLLECTION);
    }

    public MongoRegisterStore(@NotNull MongoDatabase db, @NotNull String collectionName) {
        // the _id field is the primary key, no further index needed
        this.sketches = db.getCollection(checkNotNull(collectionName));
    }

    @Override
    public long maxUpdate(@NotNull String key, @NotNull Map<Integer, Integer> ranks) {
        checkNotNull(key);
        checkArgument(!ranks.isEmpty(), "no registers to update for %s", key);
        List<Bson> updates = new ArrayList<Bson>(ranks.size());
        for (Map.Entry<Integer, Integer> e : ranks.entrySet()) {
            updates.add(Updates.max(REGISTERS + "." + e.getKey(), e.getValue()));
        }
        try {
            UpdateResult result = sketches.updateOne(Filters.eq(ID, key), Updates.combine(updates));
            return result.getMatchedCount();
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "maxUpdate failed for " + key);
        }
    }

    @Override
    public void ensureExists(@NotNull String key, @NotNull RegisterArray empty) {
        checkNotNull(key);
        try {
            sketches.updateOne(Filters.eq(ID, key),
                    Updates.setOnInsert(REGISTERS, empty.toList()),
                    new UpdateOptions().upsert(true));
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                // concurrent upsert of the same key, the document exists now
                LOG.debug("Document for {} created concurrently", key);
                return;
            }
            throw RegisterStoreException.convert(e, "ensureExists failed for " + key);
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "ensureExists failed for " + key);
        }
    }

    @Nullable
    @Override
    public RegisterArray fetchOne(@NotNull String key) {
        checkNotNull(key);
        Document doc;
        try {
            doc = sketches.find(Filters.eq(ID, key)).first();
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "fetchOne failed for " + key);
        }
        return doc == null ? null : toRegisterArray(doc);
    }

    @NotNull
    @Override
    public Map<String, RegisterArray> fetchMany(@NotNull Collection<String> keys) {
        Map<String, RegisterArray> found = new HashMap<String, RegisterArray>();
        if (keys.isEmpty()) {
            return found;
        }
        try (MongoCursor<Document> cursor = sketches.find(Filters.in(ID, keys)).iterator()) {
            while (cursor.hasNext()) {
                Document doc = cursor.next();
                found.put(doc.getString(ID), toRegisterArray(doc));
            }
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "fetchMany failed for " + keys);
        }
        // in the order requested
        Map<String, RegisterArray> result = new LinkedHashMap<String, RegisterArray>();
        for (String key : keys) {
            RegisterArray registers = found.get(key);
            if (registers != null) {
                result.put(key, registers);
            }
        }
        return result;
    }

    /**
     * Removes the document for the given key. Does nothing if there is none.
     */
    public void remove(@NotNull String key) {
        try {
            sketches.deleteOne(Filters.eq(ID, key));
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "remove failed for " + key);
        }
    }

    /**
     * Drops the collection with all sketches.
     */
    public void drop() {
        try {
            sketches.drop();
        } catch (MongoException e) {
            throw RegisterStoreException.convert(e, "drop failed for " + sketches.getNamespace());
        }
    }

    @Override
    public String toString() {
        return "MongoRegisterStore[" + sketches.getNamespace() + "]";
    }

    @NotNull
    static RegisterArray toRegisterArray(@NotNull Document doc) {
        Object value = doc.get(REGISTERS);
        if (!(value instanceof List)) {
            throw new RegisterStoreException("Document " + doc.get(ID)
                    + " has no register array: " + value);
        }
        List<?> list = (List<?>) value;
        List<Number> registers = new ArrayList<Number>(list.size());
        for (Object o : list) {
            if (o == null || o instanceof Number) {
                registers.add((Number) o);
            } else {
                throw new RegisterStoreException("Document " + doc.get(ID)
                        + " has a non numeric register: " + o);
            }
        }
        try {
            return RegisterArray.fromList(registers);
        } catch (IllegalArgumentException e) {
            throw new RegisterStoreException("Document " + doc.get(ID)
                    + " has invalid registers: " + e.getMessage(), e);
        }
    }
}
