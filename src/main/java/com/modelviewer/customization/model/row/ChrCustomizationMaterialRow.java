package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChrCustomizationMaterialRow {
    int id;
    int chrModelTextureTargetId;
    int materialResourcesId;
}
