package me.nova.companion.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Voice settings as read and written over HTTP. On update, null fields keep
 * their current value; an empty {@code systemPrompt} resets it to the default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoiceSettingsDto {
    private String voiceMode;
    private Boolean allowMemoryReferences;
    private String systemPrompt;
}
