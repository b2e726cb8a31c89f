package com.modelviewer.customization.model;

import lombok.Builder;
import lombok.Value;

/**
 * A customization element that binds a choice to a material.
 */
@Value
@Builder
public class MaterialBinding {

    int elementId;
    int choiceId;
    int materialId;

    /**
     * Choice in another option this binding applies to; zero when unconditional.
     */
    int relatedChoiceId;

    public boolean isRelatedTo(int selectedChoiceId) {
        return relatedChoiceId != 0 && relatedChoiceId == selectedChoiceId;
    }
}
