package com.modelviewer.customization.model;

import lombok.Builder;
import lombok.Value;

/**
 * How one texture target is painted into a texture layout.
 */
@Value
@Builder
public class TextureLayer {

    /**
     * Bit-mask value meaning "whole atlas, no sections".
     */
    public static final int WHOLE_ATLAS_MASK = -1;

    int layerId;
    int layoutId;
    int textureTarget;
    int textureType;

    /**
     * Destination layer ordinal (z-order).
     */
    int layer;

    int sectionBitMask;

    public boolean isWholeAtlas() {
        return sectionBitMask == WHOLE_ATLAS_MASK;
    }

    /**
     * Whether the mask selects the section. Section types outside 0..31 have no bit and are never painted.
     */
    public boolean paintsSection(int sectionType) {
        if (sectionType < 0 || sectionType >= Integer.SIZE) {
            return false;
        }
        return (sectionBitMask & (1 << sectionType)) != 0;
    }
}
