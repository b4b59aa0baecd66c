package dev.receiptly.processor;

import com.google.cloud.ServiceOptions;
import dev.receiptly.receipts.ReceiptCollections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore location of the receipt collections, resolved from the process environment.
 */
public record ReceiptProcessingSettings(
    String projectId,
    String databaseId,
    String receiptsCollection,
    String receiptItemsCollection,
    String receiptHashesCollection
) {

    static final String DEFAULT_DATABASE_ID = "(default)";
    private static final String DEFAULT_LOCAL_PROJECT_ID = "receiptly-local";

    public static ReceiptProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static ReceiptProcessingSettings fromEnvironment(Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String collection = env.getOrDefault(
            "RECEIPT_FIRESTORE_COLLECTION",
            ReceiptCollections.DEFAULT_RECEIPTS_COLLECTION);
        String itemCollection = env.getOrDefault(
            "RECEIPT_FIRESTORE_ITEM_COLLECTION",
            ReceiptCollections.DEFAULT_RECEIPT_ITEMS_COLLECTION);
        String hashCollection = env.getOrDefault(
            "RECEIPT_FIRESTORE_HASH_COLLECTION",
            ReceiptCollections.DEFAULT_RECEIPT_HASHES_COLLECTION);
        String databaseId = firstNonEmpty(
            env.get("FIRESTORE_DATABASE_ID"),
            env.get("FIRESTORE_DATABASE_NAME"),
            DEFAULT_DATABASE_ID);
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);

        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while running on"
                + " Cloud Run. Update the deployment environment to use the production project id.", projectId));
        }

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new ReceiptProcessingSettings(projectId, databaseId, collection, itemCollection, hashCollection);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
