package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * TextureFileData: maps a material resource to a texture file. The row id is the file data id.
 */
@Value
@Builder
public class TextureFileDataRow {

    public static final int USAGE_DEFAULT = 0;

    int fileDataId;
    int usageType;
    int materialResourcesId;
}
