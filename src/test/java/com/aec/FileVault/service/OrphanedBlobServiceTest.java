package com.aec.FileVault.service;

import com.aec.FileVault.Repository.OrphanedBlobRepository;
import com.aec.FileVault.Repository.StoredFileRepository;
import com.aec.FileVault.exception.ErrorKind;
import com.aec.FileVault.exception.FileVaultException;
import com.aec.FileVault.model.OrphanedBlob;
import com.aec.FileVault.model.StoredFile;
import com.aec.FileVault.storage.ObjectStorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrphanedBlobServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");

    @Mock private OrphanedBlobRepository repo;
    @Mock private StoredFileRepository files;
    @Mock private ObjectStorageGateway storage;

    private OrphanedBlobService service;

    @BeforeEach
    void setUp() {
        service = new OrphanedBlobService(repo, files, storage, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OrphanedBlob orphan(String key) {
        return OrphanedBlob.builder().id(1L).storageKey(key).reason("test").detectedAt(NOW).attempts(0).build();
    }

    @Test
    void registerPersistsNewOrphan() {
        when(repo.findByStorageKey("k1")).thenReturn(Optional.empty());

        service.register("k1", "x".repeat(600));

        ArgumentCaptor<OrphanedBlob> saved = ArgumentCaptor.forClass(OrphanedBlob.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getStorageKey()).isEqualTo("k1");
        assertThat(saved.getValue().getReason()).hasSize(512);
        assertThat(saved.getValue().getDetectedAt()).isEqualTo(NOW);
    }

    @Test
    void registerIgnoresKnownKey() {
        when(repo.findByStorageKey("k1")).thenReturn(Optional.of(orphan("k1")));

        service.register("k1", "again");

        verify(repo, never()).save(any());
    }

    @Test
    void registerSurvivesStoreOutage() {
        when(repo.findByStorageKey("k1")).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> service.register("k1", "reason")).doesNotThrowAnyException();
    }

    @Test
    void reconcileDeletesBlobThenEntry() {
        OrphanedBlob o = orphan("k1");
        when(repo.findReconcileBatch(any(Pageable.class))).thenReturn(List.of(o));
        when(files.findByStorageKey("k1")).thenReturn(Optional.empty());

        service.reconcile();

        verify(storage).delete("k1");
        verify(repo).delete(o);
    }

    @Test
    void reconcileKeepsEntryWhenDeleteFailsAgain() {
        OrphanedBlob o = orphan("k1");
        when(repo.findReconcileBatch(any(Pageable.class))).thenReturn(List.of(o));
        when(files.findByStorageKey("k1")).thenReturn(Optional.empty());
        doThrow(new FileVaultException(ErrorKind.STORAGE_FAILURE, "still down")).when(storage).delete("k1");

        service.reconcile();

        verify(repo, never()).delete(any(OrphanedBlob.class));
        verify(repo).save(o);
        assertThat(o.getAttempts()).isEqualTo(1);
        assertThat(o.getLastAttemptAt()).isEqualTo(NOW);
    }

    @Test
    void reconcileNeverDeletesReferencedBlob() {
        OrphanedBlob o = orphan("k1");
        when(repo.findReconcileBatch(any(Pageable.class))).thenReturn(List.of(o));
        when(files.findByStorageKey("k1")).thenReturn(Optional.of(new StoredFile()));

        service.reconcile();

        verifyNoInteractions(storage);
        verify(repo).delete(o);
    }
}
