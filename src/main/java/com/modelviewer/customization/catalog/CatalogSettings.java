package com.modelviewer.customization.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Switches that influence catalog construction.
 */
@Value
@Builder(toBuilder = true)
public class CatalogSettings {

    /**
     * Load character customization tables when the data version ships them.
     */
    @Builder.Default
    boolean enableCharacterCustomization = true;

    public static CatalogSettings defaults() {
        return CatalogSettings.builder().build();
    }
}
