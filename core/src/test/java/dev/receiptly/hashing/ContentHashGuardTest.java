package dev.receiptly.hashing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptRepository;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentHashGuardTest {

    // echo -n "hello world" | sha256sum
    private static final String HELLO_WORLD_SHA256 =
        "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

    private ReceiptRepository repository;
    private ContentHashGuard guard;

    @BeforeEach
    void setUp() {
        repository = mock(ReceiptRepository.class);
        guard = new ContentHashGuard(repository);
    }

    @Test
    void computesLowercaseHexSha256() {
        String hash = guard.computeHash(stream("hello world"));

        assertThat(hash).isEqualTo(HELLO_WORLD_SHA256);
        assertThat(ContentHashGuard.isValidSha256Hash(hash)).isTrue();
    }

    @Test
    void resetsStreamSoContentCanBeReadAgain() throws Exception {
        InputStream content = stream("hello world");

        guard.computeHash(content);

        assertThat(new String(content.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello world");
    }

    @Test
    void sameBytesProduceSameHash() {
        assertThat(guard.computeHash(stream("receipt"))).isEqualTo(guard.computeHash(stream("receipt")));
        assertThat(guard.computeHash(stream("receipt"))).isNotEqualTo(guard.computeHash(stream("receipt2")));
    }

    @Test
    void rejectsStreamsWithoutMarkSupport() {
        InputStream unmarkable = new FilterInputStream(stream("data")) {
            @Override
            public boolean markSupported() {
                return false;
            }
        };

        assertThatThrownBy(() -> guard.computeHash(unmarkable))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("mark/reset");
    }

    @Test
    void lookupDelegatesToRepository() {
        Receipt existing = Receipt.builder()
            .id(UUID.randomUUID())
            .userId("user-1")
            .contentHash(HELLO_WORLD_SHA256)
            .build();
        when(repository.findByContentHash("user-1", HELLO_WORLD_SHA256)).thenReturn(Optional.of(existing));

        assertThat(guard.lookup("user-1", HELLO_WORLD_SHA256)).contains(existing);
    }

    @Test
    void lookupIgnoresMalformedHashes() {
        assertThat(guard.lookup("user-1", "ABC")).isEmpty();
        assertThat(guard.lookup("user-1", HELLO_WORLD_SHA256.toUpperCase())).isEmpty();

        verifyNoInteractions(repository);
    }

    private static InputStream stream(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.UTF_8));
    }
}
