package me.nova.companion.domain.service;

import me.nova.companion.domain.model.ChatMessage;
import me.nova.companion.domain.model.CooldownEntry;
import me.nova.companion.domain.model.CooldownKey;
import me.nova.companion.domain.model.MemoryItem;
import me.nova.companion.domain.model.StageKind;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.service.MemoryContinuityScorer.ContinuityResult;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.MemoryPort;
import me.nova.companion.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MemoryContinuityScorerTest {

    private static final String USER = "alice";
    private static final String CONVERSATION = "c1";

    private MemoryPort memoryPort;
    private MutableClock clock;
    private CooldownStore cooldownStore;
    private MemoryContinuityScorer scorer;

    @BeforeEach
    void setUp() {
        memoryPort = mock(MemoryPort.class);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cooldownStore = new CooldownStore();
        scorer = new MemoryContinuityScorer(memoryPort, new NovaProperties(), clock);
    }

    private static Turn turn(String message, boolean optedIn) {
        return Turn.builder()
                .userId(USER)
                .conversationId(CONVERSATION)
                .message(ChatMessage.user(message))
                .allowMemoryReferences(optedIn)
                .build();
    }

    private static MemoryItem memory(String id, String content) {
        return MemoryItem.builder().id(id).content(content).build();
    }

    private ContinuityResult find(Turn turn) {
        return cooldownStore.withConversation(USER, CONVERSATION, cooldowns -> scorer.findContinuity(turn, cooldowns));
    }

    @Test
    void shouldNotReadMemoriesWithoutOptIn() {
        ContinuityResult result = find(turn("I'm so stressed about work", false));

        assertFalse(result.isPresent());
        assertEquals(0, result.memoryReadCount());
        verifyNoInteractions(memoryPort);
    }

    @Test
    void shouldNotReadMemoriesWithoutFocusTerm() {
        ContinuityResult result = find(turn("went for a walk by the river", true));

        assertFalse(result.isPresent());
        verifyNoInteractions(memoryPort);
    }

    @Test
    void shouldPickHighestScoringMemoryAndRecordIt() {
        when(memoryPort.listMemories(USER)).thenReturn(List.of(
                memory("m1", "Likes hiking on weekends"),
                memory("m2", "Work stress spikes before launches"),
                memory("m3", "Stress and feeling tired after long shifts at the hospital")));

        ContinuityResult result = find(turn("So tired and stressed today", true));

        assertTrue(result.isPresent());
        assertEquals("m3", result.memoryId());
        assertEquals(1, result.memoryReadCount());
        assertEquals("You mentioned \"stress and feeling tired after long shifts at the hospital\" before.",
                result.clause());
        assertEquals("m3", cooldownStore.get(new CooldownKey(USER, CONVERSATION, StageKind.CONTINUITY))
                .orElseThrow().getLastMemoryId());
    }

    @Test
    void shouldRespectContinuityCooldownAndExcludeLastMemory() {
        when(memoryPort.listMemories(USER)).thenReturn(List.of(
                memory("m1", "Stress at work"),
                memory("m2", "Stress about moving house")));

        assertEquals("m1", find(turn("stressed again", true)).memoryId());

        clock.advance(Duration.ofMinutes(5));
        ContinuityResult cooling = find(turn("still stressed", true));
        assertFalse(cooling.isPresent());
        assertEquals(0, cooling.memoryReadCount());

        clock.advance(Duration.ofMinutes(5));
        assertEquals("m2", find(turn("stressed out", true)).memoryId());
    }

    @Test
    void shouldFailTowardSilenceWhenMemoryStoreFails() {
        when(memoryPort.listMemories(USER)).thenThrow(new IllegalStateException("store down"));

        ContinuityResult result = find(turn("I'm worried about tomorrow", true));

        assertFalse(result.isPresent());
        assertEquals(1, result.memoryReadCount());
        assertTrue(cooldownStore.get(new CooldownKey(USER, CONVERSATION, StageKind.CONTINUITY)).isEmpty());
    }

    @Test
    void shouldReturnNothingWhenNoMemoryMatches() {
        when(memoryPort.listMemories(USER)).thenReturn(List.of(memory("m1", "Loves jazz")));

        assertFalse(find(turn("feeling lonely tonight", true)).isPresent());
    }

    @Test
    void snippetShouldBeLowercasedAndBounded() {
        String longContent = "My SISTER   and I " + "keep arguing about the house ".repeat(5) + "again.";

        String snippet = MemoryContinuityScorer.snippet(longContent);

        assertTrue(snippet.length() <= MemoryContinuityScorer.MAX_SNIPPET_LENGTH);
        assertTrue(snippet.startsWith("my sister and i keep"));
        assertTrue(snippet.endsWith("…"));
        assertEquals("short note", MemoryContinuityScorer.snippet("Short note."));
    }

    @Test
    void previousEntryShouldBeReadUnderLock() {
        cooldownStore.put(new CooldownKey(USER, CONVERSATION, StageKind.CONTINUITY),
                CooldownEntry.continuity(clock.instant(), "m1"));

        assertFalse(find(turn("stressed", true)).isPresent());
        verifyNoInteractions(memoryPort);
    }
}
