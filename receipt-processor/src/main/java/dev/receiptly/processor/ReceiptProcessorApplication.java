package dev.receiptly.processor;

import dev.receiptly.processor.ingestion.IngestionProperties;
import dev.receiptly.processor.ocr.OcrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot application entry point for the receipt ingestion service.
 */
@SpringBootApplication(scanBasePackages = "dev.receiptly")
@EnableConfigurationProperties({OcrProperties.class, IngestionProperties.class})
public class ReceiptProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptProcessorApplication.class, args);
    }
}
