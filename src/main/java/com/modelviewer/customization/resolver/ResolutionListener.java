package com.modelviewer.customization.resolver;

import java.util.List;

/**
 * Receives recoverable conditions met while resolving textures. Resolution continues after every callback.
 */
public interface ResolutionListener {

    ResolutionListener NONE = new ResolutionListener() {
    };

    /**
     * No binding of the choice matched the current selections; the first binding was used.
     */
    default void onFallbackMaterial(int choiceId, int materialId) {
    }

    /**
     * The texture layout has no layer for a material's texture target.
     */
    default void onMissingTextureLayer(int layoutId, int textureTarget) {
    }

    /**
     * A material resource has no default-usage texture file.
     */
    default void onUnresolvedTextureResource(int materialResourcesId) {
    }

    static ResolutionListener composite(ResolutionListener... listeners) {
        List<ResolutionListener> all = List.of(listeners);
        return new ResolutionListener() {
            @Override
            public void onFallbackMaterial(int choiceId, int materialId) {
                all.forEach(l -> l.onFallbackMaterial(choiceId, materialId));
            }

            @Override
            public void onMissingTextureLayer(int layoutId, int textureTarget) {
                all.forEach(l -> l.onMissingTextureLayer(layoutId, textureTarget));
            }

            @Override
            public void onUnresolvedTextureResource(int materialResourcesId) {
                all.forEach(l -> l.onUnresolvedTextureResource(materialResourcesId));
            }
        };
    }
}
