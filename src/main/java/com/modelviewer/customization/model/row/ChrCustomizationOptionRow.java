package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChrCustomizationOptionRow {
    int id;
    String name;
    int chrModelId;
}
