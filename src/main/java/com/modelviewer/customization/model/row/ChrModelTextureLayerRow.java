package com.modelviewer.customization.model.row;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * ChrModelTextureLayer: how a texture target is painted into a texture layout.
 */
@Value
@Builder
public class ChrModelTextureLayerRow {
    int id;
    int textureType;
    int layer;
    int textureSectionTypeBitMask;

    @NonNull
    @Singular
    List<Integer> chrModelTextureTargetIds;

    int charComponentTextureLayoutsId;

    /**
     * First entry of the target list, the one the layer is indexed under. Zero when the list is empty.
     */
    public int getPrimaryTextureTargetId() {
        return chrModelTextureTargetIds.isEmpty() ? 0 : chrModelTextureTargetIds.get(0);
    }
}
