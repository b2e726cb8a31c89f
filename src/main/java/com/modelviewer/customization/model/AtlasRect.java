package com.modelviewer.customization.model;

import lombok.Value;

/**
 * Destination rectangle inside a composite texture atlas, in pixels.
 */
@Value
public class AtlasRect {

    /**
     * Placement used by layers that cover the whole atlas rather than authored sections.
     */
    public static final AtlasRect FULL_ATLAS = new AtlasRect(0, 0, 1024, 512);

    int x;
    int y;
    int width;
    int height;
}
