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

import lombok.RequiredArgsConstructor;
import me.nova.companion.domain.model.LlmRequest;
import me.nova.companion.domain.model.LlmResponse;
import me.nova.companion.domain.service.ReplyPicker;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Canned replies used when no model endpoint is configured. Replies still go
 * through the gate's post-processing, so counselor-speak in them is stripped
 * like any real model output.
 *
 * <p>
 * Provider ID: {@code "mock"}
 */
@Component
@RequiredArgsConstructor
public class MockLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "mock";

    static final List<String> RESPONSES = List.of(
            "I'm here with you. What's on your mind?",
            "That's a thoughtful observation. Tell me more about how that makes you feel.",
            "I appreciate you sharing that with me. It sounds like this is important to you.",
            "I'm curious about what led you to think about this. Would you like to explore it together?",
            "Thank you for trusting me with this. I'm listening.");

    private final ReplyPicker replyPicker;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(replyPicker.pick(RESPONSES))
                .model(PROVIDER_ID)
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
