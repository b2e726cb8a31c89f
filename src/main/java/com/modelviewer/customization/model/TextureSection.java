package com.modelviewer.customization.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One authored region of a texture layout's atlas.
 */
@Value
public class TextureSection {
    int layoutId;
    int sectionType;

    @NonNull
    AtlasRect rect;
}
