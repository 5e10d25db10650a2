package me.nova.companion.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code nova.llm.provider}.
 *
 * <p>
 * When the configured provider is unknown or not available (for example no API
 * key is set), the {@code mock} adapter answers instead and chat responses are
 * flagged with {@code mock: true}.
 *
 * @see OpenAiCompatibleLlmAdapter
 * @see MockLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private final NovaProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        LlmProviderAdapter configured = adaptersByProvider.get(provider);
        if (configured != null && configured.isAvailable()) {
            activeAdapter = configured;
            log.info("Active LLM provider: {}", provider);
            return;
        }

        activeAdapter = adaptersByProvider.get(MockLlmAdapter.PROVIDER_ID);
        if (activeAdapter == null && !adapters.isEmpty()) {
            activeAdapter = adapters.get(0);
        }
        log.warn("Provider '{}' not available, using: {}", provider,
                activeAdapter != null ? activeAdapter.getProviderId() : "none");
    }

    /**
     * Get the active LLM adapter.
     */
    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    /**
     * Whether replies come from canned responses rather than a real model.
     */
    public boolean isMock() {
        return activeAdapter == null || MockLlmAdapter.PROVIDER_ID.equals(activeAdapter.getProviderId());
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter available"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : "none";
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
