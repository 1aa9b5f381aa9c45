package me.golemcore.deploy.domain.gateway;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Closed catalog of actions the gateway recognises, assembled once at startup
 * from every {@link ActionProvider}.
 */
@Component
@Slf4j
public class ActionCatalog {

    private static final Pattern ACTION_NAME = Pattern.compile("^[a-z0-9_]+$");

    private final Map<String, ActionDefinition> actions;

    public ActionCatalog(List<ActionProvider> providers) {
        Map<String, ActionDefinition> registry = new TreeMap<>();
        for (ActionProvider provider : providers) {
            for (ActionDefinition definition : provider.getActions()) {
                ActionDefinition previous = registry.putIfAbsent(definition.name(), definition);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate action in catalog: " + definition.name());
                }
            }
        }
        this.actions = Collections.unmodifiableMap(registry);
        log.info("[Catalog] Registered {} actions: {}", actions.size(), actions.keySet());
    }

    public Optional<ActionDefinition> find(String name) {
        if (name == null || !ACTION_NAME.matcher(name).matches()) {
            return Optional.empty();
        }
        return Optional.ofNullable(actions.get(name));
    }

    public List<String> names() {
        return List.copyOf(actions.keySet());
    }

    public List<ActionDefinition> definitions() {
        return List.copyOf(actions.values());
    }
}
