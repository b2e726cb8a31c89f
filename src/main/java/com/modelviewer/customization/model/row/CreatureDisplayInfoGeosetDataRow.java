package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * CreatureDisplayInfoGeosetData: an extra geoset enabled for a creature display.
 */
@Value
@Builder
public class CreatureDisplayInfoGeosetDataRow {
    int id;
    int creatureDisplayInfoId;
    int geosetIndex;
    int geosetValue;
}
