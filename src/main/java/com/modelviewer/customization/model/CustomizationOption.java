package com.modelviewer.customization.model;

import lombok.Value;

/**
 * A named category of choices for a character model (e.g. Skin Color).
 */
@Value
public class CustomizationOption {
    int id;
    String name;
}
