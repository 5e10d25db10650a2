package me.nova.companion.adapter.inbound.web.controller;

import me.nova.companion.adapter.inbound.web.dto.VoiceSettingsDto;
import me.nova.companion.domain.model.VoiceMode;
import me.nova.companion.domain.model.VoiceSettings;
import me.nova.companion.domain.service.VoiceSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class VoiceSettingsControllerTest {

    private VoiceSettingsService voiceSettingsService;
    private VoiceSettingsController controller;

    @BeforeEach
    void setUp() {
        voiceSettingsService = mock(VoiceSettingsService.class);
        controller = new VoiceSettingsController(voiceSettingsService);

        when(voiceSettingsService.getSettings(any())).thenAnswer(invocation -> VoiceSettings.builder()
                .voiceMode(VoiceMode.MYTHIC)
                .systemPrompt("Custom prompt.")
                .build());
        when(voiceSettingsService.saveSettings(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));
        when(voiceSettingsService.resolveSystemPrompt(any())).thenAnswer(invocation -> {
            VoiceSettings settings = invocation.getArgument(0);
            return settings.getSystemPrompt() != null ? settings.getSystemPrompt() : "Default prompt.";
        });
    }

    private VoiceSettings savedSettings() {
        ArgumentCaptor<VoiceSettings> captor = ArgumentCaptor.forClass(VoiceSettings.class);
        verify(voiceSettingsService).saveSettings(eq("alice"), captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldReturnCurrentSettings() {
        StepVerifier.create(controller.getVoiceSettings("alice"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    VoiceSettingsDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("mythic", body.getVoiceMode());
                    assertFalse(body.getAllowMemoryReferences());
                    assertEquals("Custom prompt.", body.getSystemPrompt());
                })
                .verifyComplete();
    }

    @Test
    void shouldUpdateOnlyProvidedFields() {
        VoiceSettingsDto request = VoiceSettingsDto.builder().allowMemoryReferences(true).build();

        StepVerifier.create(controller.updateVoiceSettings("alice", request))
                .assertNext(response -> assertTrue(response.getBody().getAllowMemoryReferences()))
                .verifyComplete();

        VoiceSettings saved = savedSettings();
        assertTrue(saved.isAllowMemoryReferences());
        assertEquals(VoiceMode.MYTHIC, saved.getVoiceMode());
        assertEquals("Custom prompt.", saved.getSystemPrompt());
    }

    @Test
    void shouldParseVoiceModeCaseInsensitively() {
        VoiceSettingsDto request = VoiceSettingsDto.builder().voiceMode("Blunt").build();

        StepVerifier.create(controller.updateVoiceSettings("alice", request))
                .assertNext(response -> assertEquals("blunt", response.getBody().getVoiceMode()))
                .verifyComplete();

        assertEquals(VoiceMode.BLUNT, savedSettings().getVoiceMode());
    }

    @Test
    void blankSystemPromptShouldResetToDefault() {
        VoiceSettingsDto request = VoiceSettingsDto.builder().systemPrompt("  ").build();

        StepVerifier.create(controller.updateVoiceSettings("alice", request))
                .assertNext(response -> assertEquals("Default prompt.", response.getBody().getSystemPrompt()))
                .verifyComplete();

        assertNull(savedSettings().getSystemPrompt());
    }

    @Test
    void shouldRejectUnknownVoiceMode() {
        VoiceSettingsDto request = VoiceSettingsDto.builder().voiceMode("chatty").build();

        assertThrows(IllegalArgumentException.class, () -> controller.updateVoiceSettings("alice", request));
        verify(voiceSettingsService, never()).saveSettings(any(), any());
    }

    @Test
    void shouldSurfacePersistenceFailure() {
        when(voiceSettingsService.saveSettings(any(), any())).thenThrow(new IllegalStateException("disk full"));

        StepVerifier.create(controller.updateVoiceSettings("alice", VoiceSettingsDto.builder().build()))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
