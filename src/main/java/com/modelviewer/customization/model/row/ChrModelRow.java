package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChrModelRow {
    int id;
    int displayId;
    int charComponentTextureLayoutId;
}
