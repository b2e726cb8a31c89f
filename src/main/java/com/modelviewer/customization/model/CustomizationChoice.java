package com.modelviewer.customization.model;

import lombok.Value;

/**
 * One selectable value of an option, with its display label.
 */
@Value
public class CustomizationChoice {
    int id;
    String label;
}
