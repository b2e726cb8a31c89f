package com.modelviewer.customization.resolver;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import com.modelviewer.customization.catalog.CustomizationCatalog;
import com.modelviewer.customization.model.CustomizationMaterial;
import com.modelviewer.customization.model.MaterialBinding;
import com.modelviewer.customization.model.TextureLayer;
import com.modelviewer.customization.model.TextureSelection;

/**
 * Picks the one texture a choice contributes, disambiguating between its material bindings with the
 * choices currently selected in other options (e.g. the face material painted for the chosen skin color).
 */
public class MaterialSelector {

    private final CustomizationCatalog catalog;
    private final ResolutionListener listener;

    public MaterialSelector(CustomizationCatalog catalog, ResolutionListener listener) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @param currentSelections choice ids currently selected across all options, in caller order
     */
    public Optional<TextureSelection> resolveTexture(int meshFileId, int choiceId, Collection<Integer> currentSelections) {
        if (!catalog.isCustomizationAvailable()) {
            return Optional.empty();
        }

        List<MaterialBinding> bindings = catalog.findMaterialBindings(choiceId);
        if (bindings.isEmpty()) {
            return Optional.empty();
        }

        Optional<MaterialBinding> match = findRelatedBinding(bindings, currentSelections);
        MaterialBinding binding = match.orElse(bindings.get(0));
        boolean fallback = match.isEmpty();
        if (fallback) {
            listener.onFallbackMaterial(choiceId, binding.getMaterialId());
        }

        Optional<CustomizationMaterial> material = catalog.findMaterial(binding.getMaterialId());
        if (material.isEmpty()) {
            return Optional.empty();
        }

        OptionalInt layoutId = catalog.findTextureLayoutForMesh(meshFileId);
        if (layoutId.isEmpty()) {
            return Optional.empty();
        }

        int textureTarget = material.get().getTextureTarget();
        Optional<TextureLayer> layer = catalog.findTextureLayer(layoutId.getAsInt(), textureTarget);
        if (layer.isEmpty()) {
            listener.onMissingTextureLayer(layoutId.getAsInt(), textureTarget);
            return Optional.empty();
        }

        int resourcesId = material.get().getMaterialResourcesId();
        OptionalInt fileDataId = catalog.findTextureFile(resourcesId);
        if (fileDataId.isEmpty()) {
            listener.onUnresolvedTextureResource(resourcesId);
            return Optional.empty();
        }

        return Optional.of(TextureSelection.builder()
                .materialId(binding.getMaterialId())
                .textureType(layer.get().getTextureType())
                .fileDataId(fileDataId.getAsInt())
                .sectionBitMask(layer.get().getSectionBitMask())
                .fallback(fallback)
                .build());
    }

    /**
     * First binding related to a current selection, scanning selections in order.
     */
    private static Optional<MaterialBinding> findRelatedBinding(List<MaterialBinding> bindings,
                                                                Collection<Integer> currentSelections) {
        if (currentSelections == null) {
            return Optional.empty();
        }
        for (Integer selected : currentSelections) {
            if (selected == null) {
                continue;
            }
            for (MaterialBinding binding : bindings) {
                if (binding.isRelatedTo(selected)) {
                    return Optional.of(binding);
                }
            }
        }
        return Optional.empty();
    }
}
