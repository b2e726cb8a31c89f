package com.modelviewer.customization.model;

import lombok.Value;

/**
 * Flattened customization material: which texture target it fills and with which material resource.
 */
@Value
public class CustomizationMaterial {
    int materialId;
    int textureTarget;
    int materialResourcesId;
}
