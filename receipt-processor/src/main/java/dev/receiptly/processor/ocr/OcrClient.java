package dev.receiptly.processor.ocr;

import dev.receiptly.processor.concurrent.CancellationSignal;

public interface OcrClient {

    /**
     * Analyses the image behind a signed URL.
     *
     * @throws OcrProcessingException when the service fails or rejects the image
     * @throws java.util.concurrent.CancellationException when the signal fires between attempts
     */
    OcrAnalysis analyze(String imageUrl, CancellationSignal cancellationSignal);
}
