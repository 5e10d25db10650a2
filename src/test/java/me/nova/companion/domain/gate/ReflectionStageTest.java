package me.nova.companion.domain.gate;

import me.nova.companion.domain.model.ChatMessage;
import me.nova.companion.domain.model.GateOutcome;
import me.nova.companion.domain.model.GateStageKind;
import me.nova.companion.domain.model.MemoryItem;
import me.nova.companion.domain.model.Turn;
import me.nova.companion.domain.service.CooldownStore;
import me.nova.companion.domain.service.MemoryContinuityScorer;
import me.nova.companion.domain.service.ReplyPicker;
import me.nova.companion.infrastructure.config.NovaProperties;
import me.nova.companion.port.outbound.MemoryPort;
import me.nova.companion.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ReflectionStageTest {

    private static final String STRESSED = "I'm so stressed about work today";

    private MemoryPort memoryPort;
    private MutableClock clock;
    private ReflectionStage stage;
    private ReflectionBucket stress;

    @BeforeEach
    void setUp() {
        Random random = mock(Random.class);
        when(random.nextInt(anyInt())).thenReturn(0);
        memoryPort = mock(MemoryPort.class);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        NovaProperties properties = new NovaProperties();
        stage = new ReflectionStage(new CooldownStore(), new MemoryContinuityScorer(memoryPort, properties, clock),
                new ReplyPicker(random), properties, clock);
        stress = ReflectionBuckets.classify(STRESSED).orElseThrow();
    }

    private static Turn turn(boolean optedIn, String... userMessages) {
        Turn.TurnBuilder builder = Turn.builder()
                .userId("alice")
                .conversationId("c1")
                .allowMemoryReferences(optedIn);
        for (String message : userMessages) {
            builder.message(ChatMessage.user(message));
            builder.message(ChatMessage.assistant("Mm."));
        }
        return builder.build();
    }

    @Test
    void shouldClassifyBucketsInOrder() {
        assertEquals("stress", stress.key());
        assertEquals("tired", ReflectionBuckets.classify("so tired and stressed").orElseThrow().key());
        assertEquals("long_day", ReflectionBuckets.classify("what a brutal day").orElseThrow().key());
        assertEquals("loneliness", ReflectionBuckets.classify("nobody to talk to lately").orElseThrow().key());
        assertTrue(ReflectionBuckets.classify("the weather is nice").isEmpty());
    }

    @Test
    void shouldReflectFirstOccurrence() {
        GateOutcome outcome = stage.tryMatch(turn(false, STRESSED)).orElseThrow();

        assertEquals(stress.firstLines().get(0), outcome.getResponse());
        assertEquals(GateStageKind.REFLECTION, outcome.getStage());
        assertEquals("stress", outcome.getReason());
        assertTrue(outcome.isShortCircuited());
        assertEquals(0, outcome.getMemoryReadCount());
    }

    @Test
    void shouldRequireThreeWords() {
        assertTrue(stage.tryMatch(turn(false, "so stressed")).isEmpty());
    }

    @Test
    void shouldSkipSameMessageWithinCooldownAndAfterIt() {
        assertTrue(stage.tryMatch(turn(false, STRESSED)).isPresent());

        clock.advance(Duration.ofSeconds(10));
        assertTrue(stage.tryMatch(turn(false, STRESSED, STRESSED)).isEmpty());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(stage.tryMatch(turn(false, STRESSED, STRESSED, STRESSED)).isEmpty());
    }

    @Test
    void shouldSkipDifferentMessageWithinCooldown() {
        assertTrue(stage.tryMatch(turn(false, STRESSED)).isPresent());

        clock.advance(Duration.ofSeconds(44));
        assertTrue(stage.tryMatch(turn(false, STRESSED, "work is so stressful right now")).isEmpty());
    }

    @Test
    void shouldUseRepeatLinesWhenThemeKeepsComingBack() {
        assertTrue(stage.tryMatch(turn(false, STRESSED)).isPresent());
        clock.advance(Duration.ofSeconds(45));

        GateOutcome outcome = stage.tryMatch(turn(false, STRESSED, "still stressed out about it")).orElseThrow();

        assertEquals(stress.repeatLines().get(0), outcome.getResponse());
    }

    @Test
    void shouldPrefixContinuityClauseWhenOptedIn() {
        when(memoryPort.listMemories("alice")).thenReturn(List.of(
                MemoryItem.builder().id("m1").content("Work stress before the product launch.").build()));

        GateOutcome outcome = stage.tryMatch(turn(true, STRESSED)).orElseThrow();

        assertEquals("You mentioned \"work stress before the product launch\" before. "
                + stress.firstLines().get(0), outcome.getResponse());
        assertEquals("stress+continuity", outcome.getReason());
        assertEquals(1, outcome.getMemoryReadCount());
    }

    @Test
    void shouldFallBackToPlainLineWhenMemoryStoreFails() {
        when(memoryPort.listMemories("alice")).thenThrow(new IllegalStateException("store down"));

        Optional<GateOutcome> outcome = stage.tryMatch(turn(true, STRESSED));

        assertTrue(outcome.isPresent());
        assertEquals(stress.firstLines().get(0), outcome.get().getResponse());
        assertEquals("stress", outcome.get().getReason());
    }
}
