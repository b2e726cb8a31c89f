package com.modelviewer.customization.model.row;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * CreatureDisplayInfo: a texture variant of a creature model.
 */
@Value
@Builder
public class CreatureDisplayInfoRow {
    int id;
    int modelId;

    /**
     * Raw texture variation slots; unused slots are zero.
     */
    @NonNull
    @Singular
    List<Integer> textureVariationFileDataIds;
}
