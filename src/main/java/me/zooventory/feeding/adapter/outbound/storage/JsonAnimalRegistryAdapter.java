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

import me.zooventory.feeding.domain.model.Animal;
import me.zooventory.feeding.port.outbound.AnimalRegistryPort;
import me.zooventory.feeding.port.outbound.ScheduleStoreException;
import me.zooventory.feeding.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Animal profiles read from {@code feeding/animals.json}. The file is owned by
 * the record-keeping application, so it is read on every lookup rather than
 * cached.
 */
@Component
public class JsonAnimalRegistryAdapter implements AnimalRegistryPort {

    static final String ANIMALS_FILE = "animals.json";
    private static final TypeReference<List<Animal>> ANIMAL_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final JsonDocument<Animal> document;

    public JsonAnimalRegistryAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.document = new JsonDocument<>(storagePort, objectMapper, JsonScheduleStoreAdapter.DIRECTORY,
                ANIMALS_FILE, ANIMAL_LIST_TYPE_REF, ScheduleStoreException::new);
    }

    @Override
    public Optional<Animal> findAnimal(String subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        return document.read().stream()
                .filter(a -> subjectId.equals(a.getId()))
                .findFirst();
    }
}
