package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChrCustomizationChoiceRow {
    int id;

    /**
     * Localized name; frequently empty in shipped data.
     */
    String name;

    int chrCustomizationOptionId;
    int orderIndex;
}
