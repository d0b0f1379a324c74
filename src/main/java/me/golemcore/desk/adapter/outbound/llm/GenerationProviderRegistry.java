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

package me.golemcore.desk.adapter.outbound.llm;

import me.golemcore.desk.domain.model.GenerationProviderKind;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the active generation provider and an optional secondary provider.
 *
 * <p>
 * All adapters are Spring beans. Selection happens once in {@link #init()}
 * from {@code desk.generation.provider} and
 * {@code desk.generation.secondary-provider}. An unknown provider name falls
 * back to {@link GenerationProviderKind#LOCAL}. The secondary is ignored when it
 * is local or equal to the primary.
 *
 * @see GenerationProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationProviderRegistry {

    private final DeskProperties properties;
    private final List<GenerationProviderAdapter> adapters;

    private final Map<GenerationProviderKind, GenerationProviderAdapter> adaptersByKind = new EnumMap<>(
            GenerationProviderKind.class);
    private GenerationProviderAdapter primary;
    private GenerationProviderAdapter secondary;

    @PostConstruct
    public void init() {
        for (GenerationProviderAdapter adapter : adapters) {
            adaptersByKind.put(adapter.getKind(), adapter);
            log.debug("Registered generation adapter: {}", adapter.getKind().id());
        }

        GenerationProviderKind primaryKind = parseKind(properties.getGeneration().getProvider(), "provider");
        primary = adaptersByKind.get(primaryKind);
        if (primary == null) {
            primary = adaptersByKind.get(GenerationProviderKind.LOCAL);
        }

        String secondaryName = properties.getGeneration().getSecondaryProvider();
        if (secondaryName != null && !secondaryName.isBlank()) {
            GenerationProviderKind secondaryKind = parseKind(secondaryName, "secondary-provider");
            if (secondaryKind.isRemote() && secondaryKind != primaryKind) {
                secondary = adaptersByKind.get(secondaryKind);
            } else {
                log.warn("Ignoring secondary provider '{}' (primary is '{}')", secondaryName, primaryKind.id());
            }
        }

        log.info("Active generation provider: {} (model: {}, available: {}), secondary: {}",
                primaryKind.id(), primary != null ? primary.getModel() : "none",
                primary != null && primary.isAvailable(),
                secondary != null ? secondary.getKind().id() : "none");
    }

    public GenerationProviderAdapter getPrimary() {
        return primary;
    }

    public Optional<GenerationProviderAdapter> getSecondary() {
        return Optional.ofNullable(secondary);
    }

    /**
     * Per-provider settings, defaults when the provider has no configuration
     * block.
     */
    public DeskProperties.ProviderProperties settings(GenerationProviderKind kind) {
        DeskProperties.ProviderProperties config = properties.getGeneration().getProviders().get(kind.id());
        return config != null ? config : new DeskProperties.ProviderProperties();
    }

    private GenerationProviderKind parseKind(String name, String key) {
        try {
            return GenerationProviderKind.fromId(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown desk.generation.{} '{}', using local template", key, name);
            return GenerationProviderKind.LOCAL;
        }
    }
}
