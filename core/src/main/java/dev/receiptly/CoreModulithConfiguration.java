package dev.receiptly;

import org.springframework.modulith.Modulithic;

/**
 * Anchor for the module model of the shared core library.
 */
@Modulithic(systemName = "receiptly-core")
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
