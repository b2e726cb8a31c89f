package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChrCustomizationGeosetRow {
    int id;
    int geosetType;
    int geosetId;
}
