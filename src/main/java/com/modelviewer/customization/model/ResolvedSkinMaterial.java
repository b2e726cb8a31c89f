package com.modelviewer.customization.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A texture to draw into one destination layer of the skin atlas.
 */
@Value
@Builder
public class ResolvedSkinMaterial {

    /**
     * Section type reported for whole-atlas placements.
     */
    public static final int WHOLE_ATLAS_SECTION = -1;

    int layer;

    /**
     * Layout section the rectangle comes from, or {@link #WHOLE_ATLAS_SECTION}.
     */
    int sectionType;

    int textureType;
    int fileDataId;

    @NonNull
    AtlasRect rect;
}
