package com.modelviewer.customization.resolver;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

import com.modelviewer.customization.catalog.CustomizationCatalog;
import com.modelviewer.customization.model.AtlasRect;
import com.modelviewer.customization.model.CustomizationMaterial;
import com.modelviewer.customization.model.MaterialBinding;
import com.modelviewer.customization.model.ResolvedSkinMaterial;
import com.modelviewer.customization.model.TextureLayer;
import com.modelviewer.customization.model.TextureSection;

/**
 * Resolves every texture a choice paints into a character's skin atlas, with its placement rectangle.
 *
 * Output slots are (destination layer, section); a later material painting the same slot replaces the
 * earlier one. Stateless apart from the catalog it reads, so safe to share between threads.
 */
public class SkinLayerResolver {

    private static final Comparator<Slot> SLOT_ORDER =
            Comparator.comparingInt(Slot::layer).thenComparingInt(Slot::sectionType);

    private final CustomizationCatalog catalog;
    private final ResolutionListener listener;

    public SkinLayerResolver(CustomizationCatalog catalog, ResolutionListener listener) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Resolve the skin materials for a choice on the given mesh.
     *
     * @return materials ordered by destination layer then section type, or empty when the mesh is not a
     *         customizable character, the choice binds no materials, or the layout has no sections
     */
    public Optional<List<ResolvedSkinMaterial>> resolveSkinLayers(int meshFileId, int choiceId) {
        if (!catalog.isCustomizationAvailable()) {
            return Optional.empty();
        }

        OptionalInt layoutId = catalog.findTextureLayoutForMesh(meshFileId);
        if (layoutId.isEmpty()) {
            return Optional.empty();
        }

        List<MaterialBinding> bindings = catalog.findMaterialBindings(choiceId);
        if (bindings.isEmpty()) {
            return Optional.empty();
        }

        SortedMap<Integer, TextureSection> sections = catalog.findSections(layoutId.getAsInt());
        if (sections.isEmpty()) {
            return Optional.empty();
        }

        SortedMap<Slot, ResolvedSkinMaterial> resolved = new TreeMap<>(SLOT_ORDER);
        for (MaterialBinding binding : bindings) {
            Optional<CustomizationMaterial> material = catalog.findMaterial(binding.getMaterialId());
            if (material.isEmpty()) {
                continue;
            }

            int textureTarget = material.get().getTextureTarget();
            Optional<TextureLayer> layer = catalog.findTextureLayer(layoutId.getAsInt(), textureTarget);
            if (layer.isEmpty()) {
                // Known to happen for some models (e.g. Orc Male HD)
                listener.onMissingTextureLayer(layoutId.getAsInt(), textureTarget);
                continue;
            }

            int resourcesId = material.get().getMaterialResourcesId();
            OptionalInt fileDataId = catalog.findTextureFile(resourcesId);
            if (fileDataId.isEmpty()) {
                listener.onUnresolvedTextureResource(resourcesId);
                continue;
            }

            paint(layer.get(), fileDataId.getAsInt(), sections, resolved);
        }

        return Optional.of(List.copyOf(resolved.values()));
    }

    private void paint(TextureLayer layer, int fileDataId, SortedMap<Integer, TextureSection> sections,
                       SortedMap<Slot, ResolvedSkinMaterial> resolved) {
        if (layer.isWholeAtlas()) {
            put(resolved, layer, fileDataId, ResolvedSkinMaterial.WHOLE_ATLAS_SECTION, AtlasRect.FULL_ATLAS);
            return;
        }
        for (TextureSection section : sections.values()) {
            if (layer.paintsSection(section.getSectionType())) {
                put(resolved, layer, fileDataId, section.getSectionType(), section.getRect());
            }
        }
    }

    private static void put(SortedMap<Slot, ResolvedSkinMaterial> resolved, TextureLayer layer, int fileDataId,
                            int sectionType, AtlasRect rect) {
        resolved.put(new Slot(layer.getLayer(), sectionType), ResolvedSkinMaterial.builder()
                .layer(layer.getLayer())
                .sectionType(sectionType)
                .textureType(layer.getTextureType())
                .fileDataId(fileDataId)
                .rect(rect)
                .build());
    }

    private record Slot(int layer, int sectionType) {
    }
}
