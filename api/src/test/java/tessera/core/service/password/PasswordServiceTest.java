package tessera.core.service.password;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tessera.adapter.out.storage.memory.InMemoryPasswordRecordRepository;
import tessera.core.model.auth.PasswordRecord;
import tessera.core.service.session.SessionService;
import tessera.support.TestConfigs;

@DisplayName("PasswordService")
class PasswordServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private PasswordHasher hasher;
    private InMemoryPasswordRecordRepository records;
    private SessionService sessions;
    private PasswordService service;

    @BeforeEach
    void setUp() {
        hasher = new PasswordHasher(TestConfigs.password(4));
        records = new InMemoryPasswordRecordRepository();
        sessions = mock(SessionService.class);
        when(sessions.revokeAll(anyString(), anyString())).thenReturn(Uni.createFrom().item(2));
        service = new PasswordService(records, hasher, sessions);
    }

    private boolean matches(String subjectId, String secret) {
        final var record = records.findBySubjectId(subjectId).await().atMost(TIMEOUT).orElseThrow();
        return hasher.verify(secret, record.hash()).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("setPassword()")
    class SetPasswordTests {

        @Test
        @DisplayName("should store a hash with the current cost and version")
        void shouldStoreHash() {
            service.setPassword("alice", "first secret").await().atMost(TIMEOUT);

            final var record = records.findBySubjectId("alice").await().atMost(TIMEOUT).orElseThrow();
            assertEquals(4, record.costFactor());
            assertEquals("2b", record.algorithmVersion());
            assertTrue(matches("alice", "first secret"));
        }

        @Test
        @DisplayName("should keep the claims already stored for the subject")
        void shouldKeepClaims() {
            final var oldHash = hasher.hash("first secret").await().atMost(TIMEOUT);
            records.save(new PasswordRecord("alice", oldHash, 4, "2b", Map.of("role", "admin")))
                    .await()
                    .atMost(TIMEOUT);

            service.setPassword("alice", "second secret").await().atMost(TIMEOUT);

            final var record = records.findBySubjectId("alice").await().atMost(TIMEOUT).orElseThrow();
            assertEquals(Map.of("role", "admin"), record.claims());
            assertTrue(matches("alice", "second secret"));
        }

        @Test
        @DisplayName("should reject an empty secret")
        void shouldRejectEmptySecret() {
            assertThrows(
                    PasswordHasher.EmptySecretException.class,
                    () -> service.setPassword("alice", "").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject a blank subject")
        void shouldRejectBlankSubject() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.setPassword(" ", "secret").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("changePassword()")
    class ChangePasswordTests {

        @BeforeEach
        void storeInitialPassword() {
            service.setPassword("alice", "first secret").await().atMost(TIMEOUT);
        }

        @Test
        @DisplayName("should replace the hash and revoke every session")
        void shouldChangeAndRevoke() {
            final var changed = service.changePassword("alice", "first secret", "second secret")
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(changed);
            assertTrue(matches("alice", "second secret"));
            assertFalse(matches("alice", "first secret"));
            verify(sessions).revokeAll("alice", "password_change");
        }

        @Test
        @DisplayName("should refuse when the current password does not match")
        void shouldRefuseMismatch() {
            final var changed = service.changePassword("alice", "wrong", "second secret")
                    .await()
                    .atMost(TIMEOUT);

            assertFalse(changed);
            assertTrue(matches("alice", "first secret"));
            verify(sessions, never()).revokeAll(anyString(), anyString());
        }

        @Test
        @DisplayName("should refuse for a subject without a password")
        void shouldRefuseUnknownSubject() {
            assertFalse(service.changePassword("bob", "first secret", "x").await().atMost(TIMEOUT));
            assertFalse(service.changePassword("alice", "", "x").await().atMost(TIMEOUT));
        }
    }
}
