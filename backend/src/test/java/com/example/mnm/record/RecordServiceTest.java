package com.example.mnm.record;

import com.example.mnm.MutableClock;
import com.example.mnm.access.AccessControlEngine;
import com.example.mnm.access.AccessRules;
import com.example.mnm.access.ResourceCollection;
import com.example.mnm.auditlog.SecurityAuditService;
import com.example.mnm.auth.AuthService;
import com.example.mnm.auth.UserRole;
import com.example.mnm.config.AuthProps;
import com.example.mnm.config.ContractProps;
import com.example.mnm.contract.ContractPolicy;
import com.example.mnm.dto.AuthDtos.RegisterRequest;
import com.example.mnm.exceptions.ForbiddenException;
import com.example.mnm.exceptions.InvalidRecordException;
import com.example.mnm.exceptions.InvalidStatusException;
import com.example.mnm.exceptions.RecordNotFoundException;
import com.example.mnm.exceptions.UnauthenticatedException;
import com.example.mnm.security.AuthenticatedUser;
import com.example.mnm.security.JwtService;
import com.example.mnm.security.LoginRateLimiter;
import com.example.mnm.security.PasswordVerifier;
import com.example.mnm.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RecordServiceTest {

    private MutableClock clock;
    private InMemoryRecordStore store;
    private RecordService records;
    private Optional<AuthenticatedUser> client;
    private Optional<AuthenticatedUser> professional;
    private Optional<AuthenticatedUser> stranger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
        store = new InMemoryRecordStore();
        SecurityAuditService audit = mock(SecurityAuditService.class);
        RecordTimestamps timestamps = new RecordTimestamps(clock);
        AuthService authService = new AuthService(store, new PasswordVerifier(),
                new JwtService("test_secret_key_with_more_than_32_chars!!", 60, clock),
                new LoginRateLimiter(100, 100, clock), audit, timestamps, new AuthProps());
        records = new RecordService(store, new AccessControlEngine(new AccessRules(), audit), timestamps,
                authService, new ContractPolicy(new ContractProps()));

        client = register(authService, "client@example.com", "client", UserRole.CLIENT);
        professional = register(authService, "pro@example.com", "professional", UserRole.PROFESSIONAL);
        stranger = register(authService, "other@example.com", "client", UserRole.CLIENT);
    }

    @Test
    void createStampsTheOwnerAndEqualTimestamps() {
        Map<String, Object> created = records.create(ResourceCollection.FAVORITES,
                Map.of("professionalId", "2", "userId", "999", "id", "77"), client);

        assertThat(created)
                .containsEntry("id", "1")
                .containsEntry("userId", client.get().id());
        assertThat(created.get("createdAt")).isNotNull().isEqualTo(created.get("updatedAt"));
    }

    @Test
    void updatesKeepIdOwnerAndCreatedAtAndAdvanceUpdatedAt() {
        Map<String, Object> created = records.create(ResourceCollection.PROFESSIONALS,
                Map.of("name", "Joao", "specialty", "plumber"), professional);
        String id = created.get("id").toString();

        Map<String, Object> replacement = new HashMap<>();
        replacement.put("name", "Joao Silva");
        replacement.put("userId", stranger.get().id());
        replacement.put("createdAt", "1999-01-01T00:00:00.000Z");
        replacement.put("updatedAt", created.get("updatedAt"));
        Map<String, Object> replaced = records.replace(ResourceCollection.PROFESSIONALS, id, replacement, professional);

        assertThat(replaced)
                .containsEntry("id", id)
                .containsEntry("name", "Joao Silva")
                .containsEntry("userId", professional.get().id())
                .containsEntry("createdAt", created.get("createdAt"))
                .doesNotContainKey("specialty");
        assertThat(Instant.parse(replaced.get("updatedAt").toString()))
                .isAfter(Instant.parse(created.get("updatedAt").toString()));

        clock.advanceSeconds(5);
        Map<String, Object> patched = records.patch(ResourceCollection.PROFESSIONALS, id,
                Map.of("specialty", "electrician"), professional);
        assertThat(patched).containsEntry("name", "Joao Silva").containsEntry("specialty", "electrician");
        assertThat(patched.get("updatedAt")).isEqualTo("2024-05-01T09:00:05.000Z");
    }

    @Test
    void nonOwnerWritesAreForbiddenAndAnonymousWritesUnauthenticated() {
        String id = records.create(ResourceCollection.PORTFOLIOS, Map.of("title", "Kitchen"), professional)
                .get("id").toString();

        assertThatThrownBy(() -> records.patch(ResourceCollection.PORTFOLIOS, id, Map.of("title", "x"), stranger))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> records.delete(ResourceCollection.PORTFOLIOS, id, Optional.empty()))
                .isInstanceOf(UnauthenticatedException.class);
        assertThat(records.get(ResourceCollection.PORTFOLIOS, id, Optional.empty())).containsEntry("title", "Kitchen");
    }

    @Test
    void ownerOnlyListingsContainOnlyTheCallersRecords() {
        records.create(ResourceCollection.NOTIFICATIONS, Map.of("text", "for client"), client);
        records.create(ResourceCollection.NOTIFICATIONS, Map.of("text", "for pro"), professional);

        assertThat(records.list(ResourceCollection.NOTIFICATIONS, Map.of(), client))
                .extracting(n -> n.get("text")).containsExactly("for client");
        assertThatThrownBy(() -> records.list(ResourceCollection.NOTIFICATIONS, Map.of(), Optional.empty()))
                .isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    void userRecordsNeverExposeTheHashAndCannotBeDeleted() {
        String id = client.get().id();

        assertThat(records.get(ResourceCollection.USERS, id, client)).doesNotContainKey("passwordHash");
        assertThat(records.list(ResourceCollection.USERS, Map.of(), client))
                .singleElement()
                .satisfies(user -> assertThat(user).doesNotContainKey("passwordHash"));
        assertThatThrownBy(() -> records.delete(ResourceCollection.USERS, id, client))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> records.create(ResourceCollection.USERS, Map.of("email", "x@y.co"), client))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void newContractNeedsAProfessionalCounterpartAndStartsAsCriado() {
        assertThatThrownBy(() -> records.create(ResourceCollection.CONTRACTS, Map.of("description", "x"), client))
                .isInstanceOf(InvalidRecordException.class);
        assertThatThrownBy(() -> records.create(ResourceCollection.CONTRACTS,
                Map.of("professionalId", stranger.get().id()), client))
                .isInstanceOf(InvalidRecordException.class);
        assertThatThrownBy(() -> records.create(ResourceCollection.CONTRACTS,
                Map.of("professionalId", client.get().id()), professional))
                .isInstanceOf(ForbiddenException.class);

        Map<String, Object> contract = records.create(ResourceCollection.CONTRACTS,
                Map.of("professionalId", professional.get().id(), "status", "concluido", "rating", 5), client);

        assertThat(contract)
                .containsEntry("clientId", client.get().id())
                .containsEntry("professionalId", professional.get().id())
                .containsEntry("status", "criado")
                .doesNotContainKey("rating");
    }

    @Test
    void contractUpdatesValidateStatusAndKeepBothParties() {
        String id = records.create(ResourceCollection.CONTRACTS,
                Map.of("professionalId", professional.get().id(), "description", "Paint"), client).get("id").toString();

        assertThatThrownBy(() -> records.patch(ResourceCollection.CONTRACTS, id, Map.of("status", "foo"), professional))
                .isInstanceOf(InvalidStatusException.class);

        Map<String, Object> replaced = records.replace(ResourceCollection.CONTRACTS, id,
                Map.of("description", "Paint twice", "professionalId", stranger.get().id()), professional);
        assertThat(replaced)
                .containsEntry("professionalId", professional.get().id())
                .containsEntry("clientId", client.get().id())
                .containsEntry("status", "criado");

        Map<String, Object> accepted = records.patch(ResourceCollection.CONTRACTS, id, Map.of("status", "aceito"), professional);
        assertThat(accepted).containsEntry("acceptedAt", accepted.get("updatedAt"));

        assertThatThrownBy(() -> records.get(ResourceCollection.CONTRACTS, id, stranger))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void missingRecordsAreNotFound() {
        assertThatThrownBy(() -> records.get(ResourceCollection.CLIENTS, "404", client))
                .isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> records.patch(ResourceCollection.CLIENTS, "404", Map.of(), client))
                .isInstanceOf(RecordNotFoundException.class);
    }

    private Optional<AuthenticatedUser> register(AuthService authService, String email, String role, UserRole userRole) {
        String id = authService.register(new RegisterRequest(email, "s3cret", role, null)).user().id();
        return Optional.of(new AuthenticatedUser(id, userRole));
    }
}
