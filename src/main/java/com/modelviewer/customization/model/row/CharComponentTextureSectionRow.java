package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * CharComponentTextureSections: one rectangle of a texture layout's atlas.
 */
@Value
@Builder
public class CharComponentTextureSectionRow {
    int id;
    int charComponentTextureLayoutId;
    int sectionType;
    int x;
    int y;
    int width;
    int height;
}
