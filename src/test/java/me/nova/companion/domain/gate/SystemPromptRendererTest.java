package me.nova.companion.domain.gate;

import me.nova.companion.domain.model.VoiceMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SystemPromptRendererTest {

    private final SystemPromptRenderer renderer = new SystemPromptRenderer();

    @Test
    void shouldAppendRulesForQuietMode() {
        String prompt = renderer.render("You are Nova.", VoiceMode.QUIET);

        assertTrue(prompt.startsWith("You are Nova."));
        assertTrue(prompt.contains("Default to 2 sentences maximum"));
        assertTrue(prompt.contains("\"Tell me how that makes you feel\""));
        assertTrue(prompt.contains("Only say \"As an AI...\""));
        assertTrue(prompt.contains("Do not ask questions on simple greetings"));
        assertTrue(prompt.contains("Warmth level: 40% - subtly warm"));
        assertTrue(prompt.endsWith("- Mode: Quiet"));
    }

    @Test
    void shouldAllowBriefQuestionsInEngagedMode() {
        String prompt = renderer.render("base", VoiceMode.ENGAGED);

        assertTrue(prompt.contains("Default to 4 sentences maximum"));
        assertTrue(prompt.contains("You may ask brief questions only when the user provides context."));
        assertTrue(prompt.contains("Warmth level: 70% - warm and engaged"));
    }

    @Test
    void shouldAddModeFlavorLines() {
        assertTrue(renderer.render("base", VoiceMode.MYTHIC).endsWith("as if each word matters."));
        assertTrue(renderer.render("base", VoiceMode.BLUNT).contains("Warmth level: 20% - cool and minimal"));
        assertTrue(renderer.render("base", VoiceMode.BLUNT).endsWith("- Be direct and minimal. No fluff."));
    }

    @Test
    void shouldTolerateMissingBasePrompt() {
        assertTrue(renderer.render(null, VoiceMode.QUIET).startsWith("\n\n**Voice Rules:**"));
    }
}
