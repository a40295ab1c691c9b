package com.gamevault.game_library.library;

import com.gamevault.game_library.audit.AuditLedger;
import com.gamevault.game_library.catalog.JdbcGameCatalog;
import com.gamevault.game_library.library.exception.ConcurrentTransitionException;
import com.gamevault.game_library.library.exception.LibraryStorageException;
import com.gamevault.game_library.support.TestGames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Retry and error mapping around the transactional enforcer.
 */
@SpringBootTest
@Testcontainers
class LibraryTransitionRetryTest {

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
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("library.transition.retry.initial-delay-ms", () -> "10");
    }

    @SpyBean
    private TransitionEnforcer transitionEnforcer;

    @Autowired
    private LibraryTransitionService transitionService;

    @Autowired
    private LibraryQueryService queryService;

    @Autowired
    private AuditLedger auditLedger;

    @Autowired
    private JdbcGameCatalog gameCatalog;

    private UUID userId;
    private long gameId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        gameId = TestGames.register(gameCatalog, "Hades");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("Lock timeout is retried and the next attempt succeeds")
    void testLockTimeoutRetried() {
        printTestHeader("Lock Timeout Retried");

        doThrow(new CannotAcquireLockException("lock_timeout"))
                .doCallRealMethod()
                .when(transitionEnforcer).transition(eq(userId), eq(gameId), eq(LibraryCategory.COLLECTION), any());

        TransitionResult result = transitionService.transition(userId, gameId, LibraryCategory.COLLECTION, null);

        assertTrue(result.wasChanged());
        assertEquals(LibraryCategory.COLLECTION, queryService.getState(userId, gameId).getCategory());
        assertEquals(1, auditLedger.count(userId, gameId));
        verify(transitionEnforcer, times(2)).transition(eq(userId), eq(gameId), eq(LibraryCategory.COLLECTION), any());
    }

    @Test
    @DisplayName("Lost insert race surfaces as a retryable conflict once retries run out")
    void testRetriesExhausted() {
        printTestHeader("Retries Exhausted");

        doThrow(new DuplicateKeyException("pk_library_entries"))
                .when(transitionEnforcer).remove(userId, gameId);

        ConcurrentTransitionException e = assertThrows(ConcurrentTransitionException.class,
                () -> transitionService.remove(userId, gameId));

        assertTrue(e.isRetryable());
        assertInstanceOf(DuplicateKeyException.class, e.getCause());
        verify(transitionEnforcer, times(3)).remove(userId, gameId);
    }

    @Test
    @DisplayName("Other storage failures are not retried")
    void testStorageFailureNotRetried() {
        printTestHeader("Storage Failure Not Retried");

        doThrow(new DataIntegrityViolationException("check constraint"))
                .when(transitionEnforcer).transition(eq(userId), anyLong(), any(), any());

        LibraryStorageException e = assertThrows(LibraryStorageException.class,
                () -> transitionService.transition(userId, gameId, LibraryCategory.WISHLIST, null));

        assertFalse(e.isRetryable());
        verify(transitionEnforcer, times(1)).transition(eq(userId), anyLong(), any(), any());
    }
}
