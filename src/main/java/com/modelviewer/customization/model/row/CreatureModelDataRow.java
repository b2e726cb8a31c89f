package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * CreatureModelData: binds a model id to its mesh file.
 */
@Value
@Builder
public class CreatureModelDataRow {
    int id;
    int fileDataId;

    /**
     * Non-zero when displays of this model carry extra geoset data.
     */
    int creatureGeosetDataId;
}
