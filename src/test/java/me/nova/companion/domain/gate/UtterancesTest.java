package me.nova.companion.domain.gate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtterancesTest {

    @Test
    void signatureShouldNormalizeAndCapAt140Chars() {
        assertEquals("so much to do", Utterances.signature("  So   MUCH\tto do "));
        assertEquals(140, Utterances.signature("a".repeat(300)).length());
    }

    @Test
    void shouldCountWords() {
        assertEquals(0, Utterances.wordCount("   "));
        assertEquals(3, Utterances.wordCount(" one  two three "));
    }

    @Test
    void shouldRecognizeGreetings() {
        assertTrue(Utterances.isGreeting("Hey!!"));
        assertTrue(Utterances.isGreeting("yo ,"));
        assertFalse(Utterances.isGreeting("hey there friend"));
        assertFalse(Utterances.isGreeting(null));
    }

    @Test
    void contextShouldComeFromLongMessageOrQuestion() {
        assertTrue(Utterances.hasUserProvidedContext(List.of("x".repeat(51))));
        assertTrue(Utterances.hasUserProvidedContext(List.of("why?")));
        assertFalse(Utterances.hasUserProvidedContext(List.of("tell me a story")));
        assertFalse(Utterances.hasUserProvidedContext(List.of()));
    }

    @Test
    void contextShouldComeFromTwoSubstantialMessages() {
        assertTrue(Utterances.hasUserProvidedContext(List.of(
                "work was a whole thing today", "my manager moved the deadline")));
        assertFalse(Utterances.hasUserProvidedContext(List.of("hey", "work was a whole thing today")));
    }

    @Test
    void onlyRecentMessagesCountForLongOrQuestion() {
        List<String> history = List.of("what happened?", "ok", "ok", "ok", "ok", "ok");

        assertFalse(Utterances.hasUserProvidedContext(history));
    }
}
