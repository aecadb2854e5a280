package com.aec.FileVault.service;

import com.aec.FileVault.Repository.AppUserRepository;
import com.aec.FileVault.dto.VerifiedIdentity;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.AppUser;
import com.aec.FileVault.support.InMemoryStorageConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(InMemoryStorageConfig.class)
class UserDirectoryServiceTest {

    @Autowired
    private UserDirectoryService users;

    @Autowired
    private AppUserRepository repo;

    @AfterEach
    void cleanUp() {
        repo.deleteAll();
    }

    private static VerifiedIdentity identity(String subject, String name, String email) {
        return VerifiedIdentity.builder().subject(subject).name(name).email(email).build();
    }

    @Test
    void concurrentFirstLoginsCreateExactlyOneUser() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AppUser>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return users.findOrCreate(identity("g-race", "Racer", "racer@example.com"));
                }));
            }
            start.countDown();

            Set<Long> ids = new java.util.HashSet<>();
            for (Future<AppUser> f : results) {
                ids.add(f.get(30, TimeUnit.SECONDS).getId());
            }

            assertThat(ids).hasSize(1);
            assertThat(repo.findAll().stream()
                    .filter(u -> "g-race".equals(u.getThirdPartyId()))
                    .collect(Collectors.toList()))
                    .hasSize(1)
                    .first()
                    .extracting(AppUser::getId)
                    .isEqualTo(ids.iterator().next());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void repeatedLoginReturnsSameUser() {
        AppUser first = users.findOrCreate(identity("g-1", "Grace", "grace@example.com"));
        AppUser second = users.findOrCreate(identity("g-1", "Grace", "grace@example.com"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(repo.count()).isEqualTo(1);
    }

    @Test
    void emailIsStoredLowerCased() {
        AppUser user = users.findOrCreate(identity("g-2", "Alan", "  Alan.Turing@Example.COM "));

        assertThat(user.getEmail()).isEqualTo("alan.turing@example.com");
        assertThat(user.getCreatedAt()).isNotNull();
    }

    @Test
    void laterLoginRefreshesDisplayName() {
        AppUser created = users.findOrCreate(identity("g-3", "Old Name", "name@example.com"));

        AppUser refreshed = users.findOrCreate(identity("g-3", "New Name", "name@example.com"));

        assertThat(refreshed.getId()).isEqualTo(created.getId());
        assertThat(users.getById(created.getId()).getName()).isEqualTo("New Name");
    }

    @Test
    void emailHeldByAnotherIdentityIsAConflict() {
        users.findOrCreate(identity("g-4", "Owner", "shared@example.com"));

        assertThatThrownBy(() -> users.findOrCreate(identity("g-5", "Intruder", "Shared@Example.com")))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.IDENTITY_CONFLICT);
        assertThat(repo.findByThirdPartyId("g-5")).isEmpty();
    }

    @Test
    void unknownIdIsNotFound() {
        assertThatThrownBy(() -> users.getById(987654L))
                .isInstanceOf(FileVaultException.class)
                .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }
}
