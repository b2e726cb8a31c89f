package com.modelviewer.customization.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports resolution conditions through SLF4J.
 */
public class LoggingResolutionListener implements ResolutionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingResolutionListener.class);

    @Override
    public void onFallbackMaterial(int choiceId, int materialId) {
        log.warn("Unable to find matching choice/related choice combo for choice {}, falling back to material {}",
                choiceId, materialId);
    }

    @Override
    public void onMissingTextureLayer(int layoutId, int textureTarget) {
        log.debug("Texture target {} not found in texture layers of layout {}", textureTarget, layoutId);
    }

    @Override
    public void onUnresolvedTextureResource(int materialResourcesId) {
        log.debug("No texture file for material resource {}", materialResourcesId);
    }
}
