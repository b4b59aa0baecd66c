package dev.receiptly.receipts;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map backed repository used for local runs and tests. The hash index is updated under the same
 * lock as the receipt map so concurrent creates for the same content resolve to one winner.
 */
public class InMemoryReceiptRepository implements ReceiptRepository {

    private final Map<UUID, Receipt> receipts = new ConcurrentHashMap<>();
    private final Map<String, UUID> hashIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReceiptRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryReceiptRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Receipt create(Receipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        String key = hashKey(receipt.userId(), receipt.contentHash());
        UUID existing = hashIndex.get(key);
        if (existing != null) {
            throw new DuplicateReceiptException(
                "Receipt with hash %s already exists for user %s".formatted(receipt.contentHash(), receipt.userId()),
                existing, receipt.contentHash());
        }
        if (receipts.containsKey(receipt.id())) {
            throw new IllegalArgumentException("Receipt %s already exists".formatted(receipt.id()));
        }
        receipts.put(receipt.id(), receipt);
        hashIndex.put(key, receipt.id());
        return receipt;
    }

    @Override
    public Optional<Receipt> findById(UUID id) {
        return Optional.ofNullable(receipts.get(id));
    }

    @Override
    public Optional<Receipt> findByContentHash(String userId, String contentHash) {
        UUID id = hashIndex.get(hashKey(userId, contentHash));
        return id != null ? findById(id) : Optional.empty();
    }

    @Override
    public List<Receipt> findByUser(String userId) {
        return receipts.values().stream()
            .filter(receipt -> receipt.userId().equals(userId))
            .sorted(Comparator.comparing(Receipt::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized Receipt update(Receipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        Receipt current = receipts.get(receipt.id());
        if (current == null) {
            throw new IllegalArgumentException("Receipt %s does not exist".formatted(receipt.id()));
        }
        if (!current.userId().equals(receipt.userId()) || !current.contentHash().equals(receipt.contentHash())) {
            throw new IllegalArgumentException("Owner and content hash of receipt %s are immutable".formatted(receipt.id()));
        }
        if (current.status() != receipt.status() && !current.status().canTransitionTo(receipt.status())) {
            throw new IllegalStateException("Receipt %s cannot move from %s to %s"
                .formatted(receipt.id(), current.status(), receipt.status()));
        }
        Receipt updated = receipt.withUpdatedAt(Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
        receipts.put(updated.id(), updated);
        return updated;
    }

    @Override
    public synchronized boolean delete(UUID id) {
        Receipt removed = receipts.remove(id);
        if (removed == null) {
            return false;
        }
        hashIndex.remove(hashKey(removed.userId(), removed.contentHash()));
        return true;
    }

    private static String hashKey(String userId, String contentHash) {
        return userId + ":" + contentHash;
    }
}
