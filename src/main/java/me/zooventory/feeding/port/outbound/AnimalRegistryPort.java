package me.zooventory.feeding.port.outbound;

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

import java.util.Optional;

/**
 * Port resolving a schedule subject to its animal profile and owner. Backed by
 * the same store as the schedules, so failures are reported as
 * {@link ScheduleStoreException}.
 */
public interface AnimalRegistryPort {

    Optional<Animal> findAnimal(String subjectId);
}
