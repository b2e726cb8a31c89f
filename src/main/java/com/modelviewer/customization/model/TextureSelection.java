package com.modelviewer.customization.model;

import lombok.Builder;
import lombok.Value;

/**
 * Single texture chosen for a customization choice. Placement is left to the caller via the raw section mask.
 */
@Value
@Builder
public class TextureSelection {
    int materialId;
    int textureType;
    int fileDataId;
    int sectionBitMask;

    /**
     * True when no binding matched the current selections and the first binding was used instead.
     */
    boolean fallback;
}
