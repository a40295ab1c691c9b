package com.gamevault.game_library.outbox;

import com.gamevault.game_library.catalog.JdbcGameCatalog;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.library.LibraryTransitionService;
import com.gamevault.game_library.support.TestGames;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Dead letters in the outbox.
 *
 * These tests verify that:
 * - Dead letters at the head of the outbox do not stop newer events from being published
 * - Events queued behind a dead letter of the same pair stay unpublished
 */
@SpringBootTest
@Testcontainers
class OutboxDeadLetterTest {

    private static final int MAX_RETRIES = 2;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("game_library_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("outbox.publisher.max-retries", () -> String.valueOf(MAX_RETRIES));
        // one event per pass: a dead letter at the head would fill the whole batch
        registry.add("outbox.publisher.batch-size", () -> "1");
    }

    @MockBean
    private KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LibraryTransitionService transitionService;

    @Autowired
    private JdbcGameCatalog gameCatalog;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        doAnswer(invocation -> {
            String topic = invocation.getArgument(0);
            String key = invocation.getArgument(1);
            String value = invocation.getArgument(2);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
            return CompletableFuture.completedFuture(
                    new SendResult<>(new ProducerRecord<>(topic, key, value), metadata));
        }).when(kafkaTemplate).send(anyString(), anyString(), anyString());
    }

    private OutboxEvent deadLetter(UUID userId, long gameId) {
        OutboxEvent event = outboxService.getEventsForPair(userId, gameId).get(0);
        for (int i = 0; i < MAX_RETRIES; i++) {
            outboxService.markFailed(event.getId(), "broker down");
        }
        return event;
    }

    @Test
    @DisplayName("A dead letter at the head of the outbox does not block other pairs")
    void testDeadLetterDoesNotStallPublisher() {
        printTestHeader("Dead Letter Does Not Stall Publisher");

        UUID userId = UUID.randomUUID();
        long deadGame = TestGames.register(gameCatalog, "Outer Wilds");
        long freshGame = TestGames.register(gameCatalog, "Tunic");

        transitionService.transition(userId, deadGame, LibraryCategory.WISHLIST, null);
        OutboxEvent dead = deadLetter(userId, deadGame);
        transitionService.transition(userId, freshGame, LibraryCategory.COLLECTION, null);

        outboxPublisher.triggerPublish();

        assertTrue(outboxService.getEventsForPair(userId, freshGame).get(0).isPublished(),
                "the event behind the dead letter was published");
        assertFalse(outboxEventRepository.findById(dead.getId()).orElseThrow().toDomain().isPublished());
        verify(kafkaTemplate, never()).send(anyString(), eq(userId + ":" + deadGame), anyString());

        printSuccess("Publisher moved past the dead letter");
    }

    @Test
    @DisplayName("Events queued behind a dead letter of the same pair are held back")
    void testSamePairHeldBehindDeadLetter() {
        printTestHeader("Same Pair Held Behind Dead Letter");

        UUID userId = UUID.randomUUID();
        long deadGame = TestGames.register(gameCatalog, "Hollow Knight");
        long freshGame = TestGames.register(gameCatalog, "Inscryption");

        transitionService.transition(userId, deadGame, LibraryCategory.WISHLIST, null);
        deadLetter(userId, deadGame);
        transitionService.transition(userId, deadGame, LibraryCategory.STARTED, null);
        transitionService.transition(userId, freshGame, LibraryCategory.WISHLIST, null);

        outboxPublisher.triggerPublish();
        outboxPublisher.triggerPublish();

        List<OutboxEvent> held = outboxService.getEventsForPair(userId, deadGame);
        assertEquals(2, held.size());
        assertTrue(held.stream().noneMatch(OutboxEvent::isPublished), "nothing of the pair overtakes its dead letter");
        assertEquals(0, held.get(1).getRetryCount());
        assertTrue(outboxService.getEventsForPair(userId, freshGame).get(0).isPublished());
        verify(kafkaTemplate, times(1)).send(anyString(), anyString(), anyString());

        printSuccess("Pair order preserved behind its dead letter");
    }
}
