package dev.receiptly.processor.persistence;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreException;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import dev.receiptly.receipts.DuplicateReceiptException;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptRepository;
import io.grpc.Status;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores receipts in Firestore. A receipt, its items and a create-only claim document keyed by
 * user and content hash are written in one batch, so a second receipt with the same content for
 * the same user fails the whole batch.
 *
 * <p>Firestore batches hold at most 500 writes. Items that do not fit next to the claim and the
 * receipt document are written in follow-up batches; a failed follow-up batch removes what the
 * create had already written.
 */
public class FirestoreReceiptRepository implements ReceiptRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreReceiptRepository.class);

    static final int MAX_BATCH_WRITES = 500;

    private final Firestore firestore;
    private final String receiptsCollection;
    private final String itemsCollection;
    private final String hashesCollection;
    private final Clock clock;

    public FirestoreReceiptRepository(Firestore firestore, String receiptsCollection, String itemsCollection,
        String hashesCollection, Clock clock) {

        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.receiptsCollection = Objects.requireNonNull(receiptsCollection, "receiptsCollection");
        this.itemsCollection = Objects.requireNonNull(itemsCollection, "itemsCollection");
        this.hashesCollection = Objects.requireNonNull(hashesCollection, "hashesCollection");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOGGER.info("FirestoreReceiptRepository initialized with collections receipts='{}', items='{}', hashes='{}'",
            receiptsCollection, itemsCollection, hashesCollection);
    }

    @Override
    public Receipt create(Receipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        DocumentReference claim = hashClaim(receipt.userId(), receipt.contentHash());
        List<ReceiptItem> items = receipt.items();
        int firstBatchItems = Math.min(items.size(), MAX_BATCH_WRITES - 2);

        WriteBatch batch = firestore.batch();
        Map<String, Object> claimDocument = new HashMap<>();
        claimDocument.put(ReceiptDocumentMapper.FIELD_RECEIPT_ID, receipt.id().toString());
        claimDocument.put(ReceiptDocumentMapper.FIELD_USER_ID, receipt.userId());
        claimDocument.put(ReceiptDocumentMapper.FIELD_CONTENT_HASH, receipt.contentHash());
        batch.create(claim, claimDocument);
        batch.create(receiptDocument(receipt.id()), ReceiptDocumentMapper.toDocument(receipt));
        for (int index = 0; index < firstBatchItems; index++) {
            batch.set(itemDocument(receipt.id(), index), ReceiptDocumentMapper.toItemDocument(receipt, index,
                items.get(index)));
        }

        try {
            batch.commit().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReceiptPersistenceException("Interrupted while storing receipt " + receipt.id(), ex);
        } catch (ExecutionException ex) {
            if (isAlreadyExists(ex)) {
                UUID existing = claimedReceiptId(claim);
                LOGGER.info("Content hash {} of user {} is already claimed by receipt {}", receipt.contentHash(),
                    receipt.userId(), existing);
                throw new DuplicateReceiptException(
                    "Receipt with hash %s already exists for user %s".formatted(receipt.contentHash(), receipt.userId()),
                    existing, receipt.contentHash(), ex.getCause());
            }
            LOGGER.error("Failed to store receipt {} in Firestore", receipt.id(), ex);
            throw new ReceiptPersistenceException("Failed to store receipt " + receipt.id(), ex);
        }

        if (firstBatchItems < items.size()) {
            List<BatchWrite> remainingItems = new ArrayList<>();
            for (int index = firstBatchItems; index < items.size(); index++) {
                remainingItems.add(itemWrite(receipt, index));
            }
            try {
                commitAll(remainingItems, "store items of receipt " + receipt.id());
            } catch (ReceiptPersistenceException ex) {
                discardPartialCreate(receipt, claim);
                throw ex;
            }
        }
        LOGGER.info("Stored receipt {} with {} items in Firestore", receipt.id(), items.size());
        return receipt;
    }

    @Override
    public Optional<Receipt> findById(UUID id) {
        DocumentSnapshot snapshot = await(receiptDocument(id).get(), "load receipt " + id);
        if (!snapshot.exists() || snapshot.getData() == null) {
            return Optional.empty();
        }
        return Optional.of(ReceiptDocumentMapper.fromDocument(snapshot.getData(), loadItems(id)));
    }

    @Override
    public Optional<Receipt> findByContentHash(String userId, String contentHash) {
        DocumentSnapshot claim = await(hashClaim(userId, contentHash).get(), "load hash claim");
        if (!claim.exists()) {
            return Optional.empty();
        }
        String receiptId = claim.getString(ReceiptDocumentMapper.FIELD_RECEIPT_ID);
        return receiptId != null ? findById(UUID.fromString(receiptId)) : Optional.empty();
    }

    @Override
    public List<Receipt> findByUser(String userId) {
        List<QueryDocumentSnapshot> receiptDocuments = await(firestore.collection(receiptsCollection)
            .whereEqualTo(ReceiptDocumentMapper.FIELD_USER_ID, userId)
            .get(), "list receipts of user " + userId).getDocuments();
        List<QueryDocumentSnapshot> itemDocuments = await(firestore.collection(itemsCollection)
            .whereEqualTo(ReceiptDocumentMapper.FIELD_USER_ID, userId)
            .get(), "list receipt items of user " + userId).getDocuments();

        Map<String, List<Map<String, Object>>> itemsByReceipt = new HashMap<>();
        for (QueryDocumentSnapshot item : itemDocuments) {
            String receiptId = item.getString(ReceiptDocumentMapper.FIELD_RECEIPT_ID);
            itemsByReceipt.computeIfAbsent(receiptId, key -> new ArrayList<>()).add(item.getData());
        }

        List<Receipt> receipts = new ArrayList<>(receiptDocuments.size());
        for (QueryDocumentSnapshot document : receiptDocuments) {
            String receiptId = document.getString(ReceiptDocumentMapper.FIELD_RECEIPT_ID);
            receipts.add(ReceiptDocumentMapper.fromDocument(document.getData(),
                itemsByReceipt.getOrDefault(receiptId, List.of())));
        }
        receipts.sort(Comparator.comparing(Receipt::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return receipts;
    }

    @Override
    public Receipt update(Receipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        Receipt current = findById(receipt.id())
            .orElseThrow(() -> new IllegalArgumentException("Receipt %s does not exist".formatted(receipt.id())));
        if (!current.userId().equals(receipt.userId()) || !current.contentHash().equals(receipt.contentHash())) {
            throw new IllegalArgumentException("Owner and content hash of receipt %s are immutable".formatted(receipt.id()));
        }
        if (current.status() != receipt.status() && !current.status().canTransitionTo(receipt.status())) {
            throw new IllegalStateException("Receipt %s cannot move from %s to %s"
                .formatted(receipt.id(), current.status(), receipt.status()));
        }

        Receipt updated = receipt.withUpdatedAt(Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
        List<BatchWrite> writes = new ArrayList<>();
        for (int index = 0; index < updated.items().size(); index++) {
            writes.add(itemWrite(updated, index));
        }
        Set<String> keptItemIds = new HashSet<>();
        for (int index = 0; index < updated.items().size(); index++) {
            keptItemIds.add(itemDocumentId(updated.id(), index));
        }
        for (DocumentReference item : itemReferences(receipt.id())) {
            if (!keptItemIds.contains(item.getId())) {
                writes.add(batch -> batch.delete(item));
            }
        }
        DocumentReference receiptReference = receiptDocument(updated.id());
        Map<String, Object> receiptData = ReceiptDocumentMapper.toDocument(updated);
        writes.add(batch -> batch.set(receiptReference, receiptData));
        commitAll(writes, "update receipt " + updated.id());
        LOGGER.info("Updated receipt {} in Firestore", updated.id());
        return updated;
    }

    @Override
    public boolean delete(UUID id) {
        DocumentSnapshot snapshot = await(receiptDocument(id).get(), "load receipt " + id);
        if (!snapshot.exists()) {
            return false;
        }
        List<BatchWrite> writes = new ArrayList<>();
        for (DocumentReference item : itemReferences(id)) {
            writes.add(batch -> batch.delete(item));
        }
        String userId = snapshot.getString(ReceiptDocumentMapper.FIELD_USER_ID);
        String contentHash = snapshot.getString(ReceiptDocumentMapper.FIELD_CONTENT_HASH);
        if (userId != null && contentHash != null) {
            DocumentReference claim = hashClaim(userId, contentHash);
            writes.add(batch -> batch.delete(claim));
        }
        DocumentReference receiptReference = snapshot.getReference();
        writes.add(batch -> batch.delete(receiptReference));
        commitAll(writes, "delete receipt " + id);
        LOGGER.info("Deleted receipt {} from Firestore", id);
        return true;
    }

    static String hashClaimId(String userId, String contentHash) {
        byte[] key = (userId + ":" + contentHash).getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(key).toString().replace("-", "");
    }

    static boolean isAlreadyExists(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ApiException apiException
                && apiException.getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            if (current instanceof FirestoreException firestoreException
                && firestoreException.getStatus() != null
                && firestoreException.getStatus().getCode() == Status.Code.ALREADY_EXISTS) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    private BatchWrite itemWrite(Receipt receipt, int index) {
        DocumentReference reference = itemDocument(receipt.id(), index);
        Map<String, Object> data = ReceiptDocumentMapper.toItemDocument(receipt, index, receipt.items().get(index));
        return batch -> batch.set(reference, data);
    }

    private void discardPartialCreate(Receipt receipt, DocumentReference claim) {
        List<BatchWrite> writes = new ArrayList<>();
        for (int index = 0; index < receipt.items().size(); index++) {
            DocumentReference item = itemDocument(receipt.id(), index);
            writes.add(batch -> batch.delete(item));
        }
        DocumentReference receiptReference = receiptDocument(receipt.id());
        writes.add(batch -> batch.delete(receiptReference));
        writes.add(batch -> batch.delete(claim));
        try {
            commitAll(writes, "discard partially stored receipt " + receipt.id());
        } catch (ReceiptPersistenceException ex) {
            LOGGER.error("Receipt {} is left partially stored in Firestore", receipt.id(), ex);
        }
    }

    private void commitAll(List<BatchWrite> writes, String operation) {
        for (int from = 0; from < writes.size(); from += MAX_BATCH_WRITES) {
            WriteBatch batch = firestore.batch();
            for (BatchWrite write : writes.subList(from, Math.min(writes.size(), from + MAX_BATCH_WRITES))) {
                write.addTo(batch);
            }
            commit(batch, operation);
        }
    }

    private List<Map<String, Object>> loadItems(UUID receiptId) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (QueryDocumentSnapshot document : itemSnapshots(receiptId)) {
            items.add(document.getData());
        }
        return items;
    }

    private List<DocumentReference> itemReferences(UUID receiptId) {
        List<DocumentReference> references = new ArrayList<>();
        for (QueryDocumentSnapshot document : itemSnapshots(receiptId)) {
            references.add(document.getReference());
        }
        return references;
    }

    private List<QueryDocumentSnapshot> itemSnapshots(UUID receiptId) {
        return await(firestore.collection(itemsCollection)
            .whereEqualTo(ReceiptDocumentMapper.FIELD_RECEIPT_ID, receiptId.toString())
            .get(), "load items of receipt " + receiptId).getDocuments();
    }

    private UUID claimedReceiptId(DocumentReference claim) {
        try {
            DocumentSnapshot snapshot = claim.get().get();
            String receiptId = snapshot.exists() ? snapshot.getString(ReceiptDocumentMapper.FIELD_RECEIPT_ID) : null;
            return receiptId != null ? UUID.fromString(receiptId) : null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReceiptPersistenceException("Interrupted while reading hash claim " + claim.getId(), ex);
        } catch (ExecutionException ex) {
            LOGGER.warn("Could not read hash claim {}", claim.getId(), ex);
            return null;
        }
    }

    private void commit(WriteBatch batch, String operation) {
        await(batch.commit(), operation);
    }

    private <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReceiptPersistenceException("Interrupted while trying to " + operation, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Firestore failed to {}", operation, ex);
            throw new ReceiptPersistenceException("Failed to " + operation, ex);
        }
    }

    private DocumentReference receiptDocument(UUID id) {
        return firestore.collection(receiptsCollection).document(id.toString());
    }

    private DocumentReference itemDocument(UUID receiptId, int index) {
        return firestore.collection(itemsCollection).document(itemDocumentId(receiptId, index));
    }

    private static String itemDocumentId(UUID receiptId, int index) {
        return receiptId + "_" + index;
    }

    private DocumentReference hashClaim(String userId, String contentHash) {
        return firestore.collection(hashesCollection).document(hashClaimId(userId, contentHash));
    }

    @FunctionalInterface
    private interface BatchWrite {

        void addTo(WriteBatch batch);
    }
}
