package me.zooventory.feeding.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.zooventory.feeding.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * A JSON array persisted as one workspace file. Reads and writes block until
 * the storage call completes; failures are translated by the owning adapter's
 * error factory.
 */
class JsonDocument<T> {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String fileName;
    private final TypeReference<List<T>> typeReference;
    private final BiFunction<String, Throwable, RuntimeException> errorFactory;

    JsonDocument(StoragePort storagePort, ObjectMapper objectMapper, String directory, String fileName,
            TypeReference<List<T>> typeReference, BiFunction<String, Throwable, RuntimeException> errorFactory) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.fileName = fileName;
        this.typeReference = typeReference;
        this.errorFactory = errorFactory;
    }

    /**
     * Read the document; a missing or blank file is an empty list.
     */
    List<T> read() {
        try {
            String json = storagePort.getText(directory, fileName).join();
            if (json == null || json.isBlank()) {
                return new ArrayList<>();
            }
            return new ArrayList<>(objectMapper.readValue(json, typeReference));
        } catch (IOException | RuntimeException e) {
            throw errorFactory.apply("Failed to read " + location(), e);
        }
    }

    void write(List<T> items) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(items);
            storagePort.putTextAtomic(directory, fileName, json, true).join();
        } catch (IOException | RuntimeException e) {
            throw errorFactory.apply("Failed to write " + location(), e);
        }
    }

    String location() {
        return directory + "/" + fileName;
    }
}
