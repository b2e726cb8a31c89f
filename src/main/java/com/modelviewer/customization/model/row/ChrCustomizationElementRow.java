package com.modelviewer.customization.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * ChrCustomizationElement: what a choice switches on. Zero references are absent.
 */
@Value
@Builder
public class ChrCustomizationElementRow {
    int id;
    int chrCustomizationChoiceId;

    /**
     * Choice in another option this element depends on (e.g. the skin color a face material is painted for).
     */
    int relatedChrCustomizationChoiceId;

    int chrCustomizationGeosetId;
    int chrCustomizationMaterialId;
}
