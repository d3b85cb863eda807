package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.LinkPrecedence;
import com.wadechandler.identity.repository.ContactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClusterMergerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ContactStore contactStore;

    private ClusterMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ClusterMerger(contactStore);
    }

    @Test
    void merge_demotesYoungerPrimariesAndRelinksTheirSecondaries() {
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(2L, T0.plusSeconds(5)), primary(1L, T0)));

        Long survivor = merger.merge(Set.of(1L, 2L));

        assertThat(survivor).isEqualTo(1L);
        ArgumentCaptor<ContactStore.Demotion> demotion = ArgumentCaptor.forClass(ContactStore.Demotion.class);
        ArgumentCaptor<ContactStore.Relink> relink = ArgumentCaptor.forClass(ContactStore.Relink.class);
        verify(contactStore).atomically(demotion.capture(), relink.capture());
        assertThat(demotion.getValue().ids()).containsExactly(2L);
        assertThat(demotion.getValue().newLinkedId()).isEqualTo(1L);
        assertThat(relink.getValue().oldLinkedIds()).containsExactly(2L);
        assertThat(relink.getValue().newLinkedId()).isEqualTo(1L);
    }

    @Test
    void merge_followsRootDemotedSinceMatching() {
        Contact alreadyDemoted = Contact.builder()
                .id(2L)
                .linkPrecedence(LinkPrecedence.SECONDARY)
                .linkedId(3L)
                .createdAt(T0.plusSeconds(5))
                .build();
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0.plusSeconds(1)), alreadyDemoted));
        when(contactStore.findByIds(Set.of(1L, 3L)))
                .thenReturn(List.of(primary(3L, T0), primary(1L, T0.plusSeconds(1))));

        Long survivor = merger.merge(Set.of(1L, 2L));

        assertThat(survivor).isEqualTo(3L);
        ArgumentCaptor<ContactStore.Demotion> demotion = ArgumentCaptor.forClass(ContactStore.Demotion.class);
        verify(contactStore).atomically(demotion.capture(), any());
        assertThat(demotion.getValue().ids()).containsExactly(1L);
    }

    @Test
    void merge_ofRootsThatConvergedOnOnePrimary_writesNothing() {
        Contact demoted = Contact.builder()
                .id(2L)
                .linkPrecedence(LinkPrecedence.SECONDARY)
                .linkedId(1L)
                .createdAt(T0.plusSeconds(5))
                .build();
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0), demoted));
        when(contactStore.findByIds(Set.of(1L)))
                .thenReturn(List.of(primary(1L, T0)));

        assertThat(merger.merge(Set.of(1L, 2L))).isEqualTo(1L);
        verify(contactStore, never()).atomically(any(), any());
    }

    @Test
    void merge_abortedByLockFailure_raisesMergeConflict() {
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0), primary(2L, T0.plusSeconds(1))));
        doThrow(new CannotAcquireLockException("deadlock detected"))
                .when(contactStore).atomically(any(), any());

        assertThatThrownBy(() -> merger.merge(Set.of(1L, 2L)))
                .isInstanceOf(MergeConflictException.class)
                .hasCauseInstanceOf(CannotAcquireLockException.class);
    }

    @Test
    void merge_abortedBecauseAnotherMergeWon_returnsThatPrimary() {
        Contact demoted = Contact.builder()
                .id(2L)
                .linkPrecedence(LinkPrecedence.SECONDARY)
                .linkedId(1L)
                .createdAt(T0.plusSeconds(1))
                .build();
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0), primary(2L, T0.plusSeconds(1))))
                .thenReturn(List.of(primary(1L, T0), demoted));
        when(contactStore.findByIds(Set.of(1L))).thenReturn(List.of(primary(1L, T0)));
        doThrow(new OptimisticLockingFailureException("Demoted 0 of 1 primaries"))
                .when(contactStore).atomically(any(), any());

        assertThat(merger.merge(Set.of(1L, 2L))).isEqualTo(1L);
        verify(contactStore).atomically(any(), any());
    }

    @Test
    void merge_withStoreDown_raisesStorageUnavailable() {
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0), primary(2L, T0.plusSeconds(1))));
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(contactStore).atomically(any(), any());

        assertThatThrownBy(() -> merger.merge(Set.of(1L, 2L)))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void merge_whenTransactionCannotStart_raisesStorageUnavailable() {
        when(contactStore.findByIds(Set.of(1L, 2L)))
                .thenReturn(List.of(primary(1L, T0), primary(2L, T0.plusSeconds(1))));
        doThrow(new CannotCreateTransactionException("pool exhausted"))
                .when(contactStore).atomically(any(), any());

        assertThatThrownBy(() -> merger.merge(Set.of(1L, 2L)))
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
    }

    @Test
    void merge_neverKeepsSoftDeletedPrimaryAsSurvivor() {
        Contact deletedOlder = primary(1L, T0);
        deletedOlder.setDeletedAt(T0.plusSeconds(60));
        when(contactStore.findByIds(Set.of(1L, 2L, 3L)))
                .thenReturn(List.of(deletedOlder, primary(2L, T0.plusSeconds(1)), primary(3L, T0.plusSeconds(2))));

        Long survivor = merger.merge(Set.of(1L, 2L, 3L));

        assertThat(survivor).isEqualTo(2L);
        ArgumentCaptor<ContactStore.Demotion> demotion = ArgumentCaptor.forClass(ContactStore.Demotion.class);
        verify(contactStore).atomically(demotion.capture(), any());
        assertThat(demotion.getValue().ids()).containsExactly(3L);
    }

    @Test
    void merge_whenNoRootIsLiveAnymore_raisesMergeConflict() {
        Contact gone = primary(1L, T0);
        gone.setDeletedAt(T0.plusSeconds(60));
        when(contactStore.findByIds(Set.of(1L, 2L))).thenReturn(List.of(gone));

        assertThatThrownBy(() -> merger.merge(Set.of(1L, 2L)))
                .isInstanceOf(MergeConflictException.class)
                .isInstanceOf(ReconciliationException.class)
                .hasMessageContaining("no longer live primaries");
        verify(contactStore, never()).atomically(any(), any());
    }

    private static Contact primary(Long id, Instant createdAt) {
        return Contact.builder().id(id).createdAt(createdAt).build();
    }
}
