package me.nova.companion.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SentenceBudgetEnforcerTest {

    private SentenceBudgetEnforcer enforcer;

    @BeforeEach
    void setUp() {
        enforcer = new SentenceBudgetEnforcer();
    }

    @Test
    void shouldKeepFirstSentencesWithTheirTerminators() {
        String text = "First one. Second?! Third... Fourth. Fifth!";

        String truncated = enforcer.truncate(text, 2);

        assertEquals("First one. Second?!", truncated);
        assertEquals(2, enforcer.countSentences(truncated));
    }

    @Test
    void shouldReturnTextWithoutTerminatorsUnchanged() {
        String text = "  just a clause with no ending  ";

        assertSame(text, enforcer.truncate(text, 1));
        assertEquals(0, enforcer.countSentences(text));
    }

    @ParameterizedTest
    @ValueSource(strings = { "One.", "One. Two.", "One! Two? ", "Okay. Trailing clause" })
    void shouldLeaveTextWithinBudgetUnchangedModuloTrim(String text) {
        assertEquals(text.trim(), enforcer.truncate(text, 2));
    }

    @Test
    void shouldCountRepeatedTerminatorsOnce() {
        assertEquals(3, enforcer.countSentences("Wait... what?! Really."));
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> enforcer.truncate("Hi.", 0));
    }
}
