package dev.receiptly.processor.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.api.gax.grpc.GrpcStatusCode;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.PermissionDeniedException;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.WriteBatch;
import com.google.cloud.firestore.WriteResult;
import dev.receiptly.receipts.DuplicateReceiptException;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptStatus;
import io.grpc.Status;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FirestoreReceiptRepositoryTest {

    private static final String HASH = "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

    private final Firestore firestore = mock(Firestore.class);
    private final CollectionReference receipts = mock(CollectionReference.class);
    private final CollectionReference items = mock(CollectionReference.class);
    private final CollectionReference hashes = mock(CollectionReference.class);
    private final DocumentReference receiptDocument = mock(DocumentReference.class);
    private final DocumentReference itemDocument = mock(DocumentReference.class);
    private final DocumentReference claimDocument = mock(DocumentReference.class);
    private final WriteBatch batch = mock(WriteBatch.class);

    private FirestoreReceiptRepository repository;

    @BeforeEach
    void setUp() {
        when(firestore.collection("receipts")).thenReturn(receipts);
        when(firestore.collection("receiptItems")).thenReturn(items);
        when(firestore.collection("receiptHashes")).thenReturn(hashes);
        when(receipts.document(anyString())).thenReturn(receiptDocument);
        when(items.document(anyString())).thenReturn(itemDocument);
        when(hashes.document(anyString())).thenReturn(claimDocument);
        when(firestore.batch()).thenReturn(batch);
        repository = new FirestoreReceiptRepository(firestore, "receipts", "receiptItems", "receiptHashes",
            Clock.fixed(Instant.parse("2024-03-07T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createWritesClaimReceiptAndItemsInOneBatch() {
        when(batch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));
        Receipt receipt = receipt();

        assertThat(repository.create(receipt)).isEqualTo(receipt);

        verify(hashes).document(FirestoreReceiptRepository.hashClaimId("user-1", HASH));
        verify(receipts).document(receipt.id().toString());
        verify(items).document(receipt.id() + "_0");
        verify(items).document(receipt.id() + "_1");
        verify(batch).create(eq(claimDocument), anyMap());
        verify(batch).create(eq(receiptDocument), anyMap());
        verify(batch, times(2)).set(eq(itemDocument), anyMap());
        verify(batch).commit();
    }

    @Test
    void createReportsExistingReceiptWhenHashIsClaimed() {
        UUID existingId = UUID.randomUUID();
        when(batch.commit()).thenReturn(ApiFutures.immediateFailedFuture(new AlreadyExistsException(
            new IllegalStateException("Document already exists"), GrpcStatusCode.of(Status.Code.ALREADY_EXISTS),
            false)));
        DocumentSnapshot claim = mock(DocumentSnapshot.class);
        when(claim.exists()).thenReturn(true);
        when(claim.getString("receiptId")).thenReturn(existingId.toString());
        when(claimDocument.get()).thenReturn(ApiFutures.immediateFuture(claim));

        assertThatThrownBy(() -> repository.create(receipt()))
            .isInstanceOfSatisfying(DuplicateReceiptException.class, ex -> {
                assertThat(ex.getExistingReceiptId()).isEqualTo(existingId);
                assertThat(ex.getContentHash()).isEqualTo(HASH);
            });
    }

    @Test
    void createWrapsOtherFailures() {
        when(batch.commit()).thenReturn(ApiFutures.immediateFailedFuture(new PermissionDeniedException(
            new IllegalStateException("denied"), GrpcStatusCode.of(Status.Code.PERMISSION_DENIED), false)));

        assertThatThrownBy(() -> repository.create(receipt()))
            .isInstanceOf(ReceiptPersistenceException.class)
            .hasMessageContaining("Failed to store receipt");
    }

    @Test
    void createSplitsLargeReceiptsIntoBatchesOfFiveHundredWrites() {
        when(batch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));
        Receipt receipt = receipt(manyItems(600));

        assertThat(repository.create(receipt)).isEqualTo(receipt);

        verify(firestore, times(2)).batch();
        verify(batch, times(2)).commit();
        verify(batch).create(eq(claimDocument), anyMap());
        verify(batch).create(eq(receiptDocument), anyMap());
        verify(batch, times(600)).set(eq(itemDocument), anyMap());
        verify(items).document(receipt.id() + "_497");
        verify(items).document(receipt.id() + "_599");
    }

    @Test
    void createRemovesWrittenDocumentsWhenLaterBatchFails() {
        when(batch.commit()).thenReturn(
            ApiFutures.immediateFuture(List.<WriteResult>of()),
            ApiFutures.immediateFailedFuture(new IllegalStateException("deadline exceeded")),
            ApiFutures.immediateFuture(List.<WriteResult>of()));

        assertThatThrownBy(() -> repository.create(receipt(manyItems(600))))
            .isInstanceOf(ReceiptPersistenceException.class)
            .hasMessageContaining("Failed to store items of receipt");

        verify(batch, times(600)).delete(itemDocument);
        verify(batch).delete(receiptDocument);
        verify(batch).delete(claimDocument);
        verify(batch, times(4)).commit();
    }

    @Test
    void updateRejectsMovingStatusBackwards() {
        storedReceipt(receipt(), List.of());
        Receipt pending = receipt().toBuilder().status(ReceiptStatus.PENDING_VALIDATION).build();

        assertThatThrownBy(() -> repository.update(pending))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cannot move from VALIDATED to PENDING_VALIDATION");

        verify(batch, never()).commit();
    }

    @Test
    void updateRewritesItemsAndDeletesOnlyStaleOnes() {
        Receipt stored = receipt();
        DocumentReference kept = mock(DocumentReference.class);
        DocumentReference stale = mock(DocumentReference.class);
        storedReceipt(stored, List.of(itemSnapshot(kept, stored.id() + "_1"), itemSnapshot(stale, stored.id() + "_2")));
        when(batch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));

        Receipt updated = repository.update(stored.toBuilder().requiresManualReview(true).build());

        assertThat(updated.requiresManualReview()).isTrue();
        assertThat(updated.updatedAt()).isEqualTo(Instant.parse("2024-03-07T12:00:00Z"));
        verify(batch, times(2)).set(eq(itemDocument), anyMap());
        verify(batch).set(eq(receiptDocument), anyMap());
        verify(batch).delete(stale);
        verify(batch, never()).delete(kept);
        verify(batch).commit();
    }

    @Test
    void findByIdReturnsEmptyForMissingDocument() {
        DocumentSnapshot missing = mock(DocumentSnapshot.class);
        when(missing.exists()).thenReturn(false);
        when(receiptDocument.get()).thenReturn(ApiFutures.immediateFuture(missing));

        assertThat(repository.findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    void alreadyExistsIsDetectedThroughCauseChain() {
        AlreadyExistsException alreadyExists = new AlreadyExistsException(new IllegalStateException("exists"),
            GrpcStatusCode.of(Status.Code.ALREADY_EXISTS), false);

        assertThat(FirestoreReceiptRepository.isAlreadyExists(new ExecutionException(alreadyExists))).isTrue();
        assertThat(FirestoreReceiptRepository.isAlreadyExists(new ExecutionException(new RuntimeException("x"))))
            .isFalse();
    }

    @Test
    void hashClaimIdIsStablePerUserAndContent() {
        String first = FirestoreReceiptRepository.hashClaimId("user-1", HASH);

        assertThat(FirestoreReceiptRepository.hashClaimId("user-1", HASH)).isEqualTo(first);
        assertThat(FirestoreReceiptRepository.hashClaimId("user-2", HASH)).isNotEqualTo(first);
        assertThat(first).hasSize(32).doesNotContain("-");
    }

    private void storedReceipt(Receipt receipt, List<QueryDocumentSnapshot> itemSnapshots) {
        DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getData()).thenReturn(ReceiptDocumentMapper.toDocument(receipt));
        when(receiptDocument.get()).thenReturn(ApiFutures.immediateFuture(snapshot));

        Query query = mock(Query.class);
        QuerySnapshot querySnapshot = mock(QuerySnapshot.class);
        when(items.whereEqualTo(anyString(), any())).thenReturn(query);
        when(query.get()).thenReturn(ApiFutures.immediateFuture(querySnapshot));
        when(querySnapshot.getDocuments()).thenReturn(itemSnapshots);
    }

    private static QueryDocumentSnapshot itemSnapshot(DocumentReference reference, String id) {
        when(reference.getId()).thenReturn(id);
        QueryDocumentSnapshot snapshot = mock(QueryDocumentSnapshot.class);
        when(snapshot.getReference()).thenReturn(reference);
        when(snapshot.getData()).thenReturn(Map.of());
        return snapshot;
    }

    private static List<ReceiptItem> manyItems(int count) {
        List<ReceiptItem> items = new ArrayList<>(count);
        IntStream.range(0, count)
            .forEach(index -> items.add(new ReceiptItem("Item " + index, 1, new BigDecimal("1.00"))));
        return items;
    }

    private static Receipt receipt() {
        return receipt(List.of(new ReceiptItem("Coffee", 1, new BigDecimal("3.50")),
            new ReceiptItem("Bagel", 1, new BigDecimal("2.00"))));
    }

    private static Receipt receipt(List<ReceiptItem> items) {
        Instant now = Instant.parse("2024-03-07T12:00:00Z");
        return Receipt.builder()
            .id(UUID.fromString("7f1c5a8e-1f0e-4b7a-9a57-2b0f7f0d4c11"))
            .userId("user-1")
            .contentHash(HASH)
            .items(items)
            .status(ReceiptStatus.VALIDATED)
            .createdAt(now)
            .processedAt(now)
            .updatedAt(now)
            .build();
    }
}
