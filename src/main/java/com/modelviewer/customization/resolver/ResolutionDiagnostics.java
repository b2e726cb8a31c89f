package com.modelviewer.customization.resolver;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Resolution conditions accumulated across queries.
 *
 * Pure structure only: no logging, no formatting beyond the message text. Not thread-safe.
 */
@Getter
public class ResolutionDiagnostics implements ResolutionListener {

    private final List<String> fallbacks = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    @Override
    public void onFallbackMaterial(int choiceId, int materialId) {
        fallbacks.add("Choice " + choiceId + " fell back to material " + materialId);
    }

    @Override
    public void onMissingTextureLayer(int layoutId, int textureTarget) {
        warnings.add("Layout " + layoutId + " has no layer for texture target " + textureTarget);
    }

    @Override
    public void onUnresolvedTextureResource(int materialResourcesId) {
        warnings.add("Material resource " + materialResourcesId + " has no texture file");
    }

    public boolean hasFallbacks() {
        return !fallbacks.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
