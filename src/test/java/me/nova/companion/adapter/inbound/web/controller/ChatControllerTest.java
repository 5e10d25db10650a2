package me.nova.companion.adapter.inbound.web.controller;

import me.nova.companion.adapter.inbound.web.dto.ChatCompletionRequest;
import me.nova.companion.adapter.inbound.web.dto.ChatCompletionResponse;
import me.nova.companion.adapter.outbound.llm.LlmAdapterFactory;
import me.nova.companion.domain.gate.GatePipeline;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.model.VoiceMode;
import me.nova.companion.domain.model.VoiceSettings;
import me.nova.companion.domain.service.VoiceSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private static final String DEFAULT_PROMPT = "You are Nova.";

    private GatePipeline gatePipeline;
    private VoiceSettingsService voiceSettingsService;
    private LlmAdapterFactory llmAdapterFactory;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        gatePipeline = mock(GatePipeline.class);
        voiceSettingsService = mock(VoiceSettingsService.class);
        llmAdapterFactory = mock(LlmAdapterFactory.class);
        controller = new ChatController(gatePipeline, voiceSettingsService, llmAdapterFactory);

        when(voiceSettingsService.getSettings(any())).thenReturn(VoiceSettings.builder()
                .voiceMode(VoiceMode.ENGAGED)
                .allowMemoryReferences(true)
                .build());
        when(voiceSettingsService.resolveSystemPrompt(any())).thenReturn(DEFAULT_PROMPT);
        when(gatePipeline.evaluate(any())).thenReturn(GateOutcome.shortCircuit(GateStageKind.GREETING, "greeting",
                "Hey."));
    }

    private static ChatCompletionRequest.MessageDto message(String role, String content) {
        return ChatCompletionRequest.MessageDto.builder().role(role).content(content).build();
    }

    private static ChatCompletionRequest request(ChatCompletionRequest.MessageDto... messages) {
        return ChatCompletionRequest.builder().messages(new ArrayList<>(List.of(messages))).build();
    }

    private Turn capturedTurn() {
        ArgumentCaptor<Turn> captor = ArgumentCaptor.forClass(Turn.class);
        verify(gatePipeline).evaluate(captor.capture());
        return captor.getValue();
    }

    // ==================== Envelope ====================

    @Test
    void shouldWrapOutcomeInCompletionEnvelope() {
        when(llmAdapterFactory.isMock()).thenReturn(true);

        StepVerifier.create(controller.complete(null, request(message("user", "hey"))))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ChatCompletionResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isMock());
                    assertTrue(body.getVoiceEngine().isShortCircuited());
                    assertFalse(body.getVoiceEngine().isRewritten());
                    assertEquals("engaged", body.getVoiceEngine().getMode());
                    assertEquals(1, body.getChoices().size());
                    assertEquals("assistant", body.getChoices().get(0).getMessage().getRole());
                    assertEquals("Hey.", body.getChoices().get(0).getMessage().getContent());
                })
                .verifyComplete();
    }

    @Test
    void shouldBuildTurnFromHeaderAndSettings() {
        ChatCompletionRequest request = request(message("user", "hey"));
        request.setConversationId("conv-1");

        StepVerifier.create(controller.complete("alice", request))
                .expectNextCount(1)
                .verifyComplete();

        Turn turn = capturedTurn();
        assertEquals("alice", turn.getUserId());
        assertEquals("conv-1", turn.getConversationId());
        assertEquals(ChatController.ROUTE, turn.getRoute());
        assertEquals(VoiceMode.ENGAGED, turn.getVoiceMode());
        assertTrue(turn.isAllowMemoryReferences());
        verify(voiceSettingsService).getSettings("alice");
    }

    @Test
    void shouldDefaultUserAndConversation() {
        StepVerifier.create(controller.complete(" ", request(message("user", "hey"))))
                .expectNextCount(1)
                .verifyComplete();

        Turn turn = capturedTurn();
        assertEquals("local", turn.getUserId());
        assertEquals("default", turn.getConversationId());
    }

    // ==================== System prompt ====================

    @Test
    void requestSystemPromptShouldWin() {
        ChatCompletionRequest request = request(message("system", "From messages."), message("user", "hey"));
        request.setSystemPrompt("From request.");

        StepVerifier.create(controller.complete(null, request)).expectNextCount(1).verifyComplete();

        assertEquals("From request.", capturedTurn().getSystemPrompt());
    }

    @Test
    void systemMessageShouldBeUsedAndStrippedFromHistory() {
        StepVerifier.create(controller.complete(null,
                request(message("system", "From messages."), message("user", "hey"))))
                .expectNextCount(1)
                .verifyComplete();

        Turn turn = capturedTurn();
        assertEquals("From messages.", turn.getSystemPrompt());
        assertEquals(1, turn.getMessages().size());
        assertEquals("user", turn.getMessages().get(0).getRole());
    }

    @Test
    void shouldFallBackToSettingsPrompt() {
        StepVerifier.create(controller.complete(null, request(message("user", "hey"))))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals(DEFAULT_PROMPT, capturedTurn().getSystemPrompt());
    }

    // ==================== Validation ====================

    @Test
    void shouldRejectMissingMessages() {
        ChatCompletionRequest request = ChatCompletionRequest.builder().build();

        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.complete(null, request));

        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatusCode());
        assertTrue(thrown.getReason().startsWith("Invalid request"));
        verifyNoInteractions(gatePipeline);
    }

    @Test
    void shouldRejectEmptyMessages() {
        assertThrows(ResponseStatusException.class, () -> controller.complete(null, request()));
    }

    @Test
    void shouldRejectUnknownRole() {
        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.complete(null, request(message("tool", "x"), message("user", "hey"))));

        assertTrue(thrown.getReason().contains("messages[0].role"));
    }

    @Test
    void shouldRejectMissingContent() {
        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.complete(null, request(message("user", null))));

        assertTrue(thrown.getReason().contains("messages[0].content"));
    }

    @Test
    void shouldRequireAUserMessage() {
        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.complete(null, request(message("assistant", "Hi."))));

        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatusCode());
    }

    @Test
    void shouldRejectMalformedConversationId() {
        ChatCompletionRequest request = request(message("user", "hey"));
        request.setConversationId("../etc");

        ResponseStatusException thrown = assertThrows(ResponseStatusException.class,
                () -> controller.complete(null, request));

        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatusCode());
    }

    @Test
    void shouldRejectMalformedUserHeader() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.complete("bad user!", request(message("user", "hey"))));
    }
}
