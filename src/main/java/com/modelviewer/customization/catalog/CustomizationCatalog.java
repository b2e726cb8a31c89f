package com.modelviewer.customization.catalog;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;

import com.modelviewer.customization.model.CreatureDisplay;
import com.modelviewer.customization.model.CustomizationChoice;
import com.modelviewer.customization.model.CustomizationMaterial;
import com.modelviewer.customization.model.CustomizationOption;
import com.modelviewer.customization.model.MaterialBinding;
import com.modelviewer.customization.model.TextureLayer;
import com.modelviewer.customization.model.TextureSection;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Read-only lookup structures for one loaded data version.
 *
 * Built once by {@link CatalogBuilder}; every collection is unmodifiable. Absent relations are reported
 * as empty results, never as exceptions.
 */
@Value
@Builder(toBuilder = true)
public class CustomizationCatalog {

    /**
     * False when customization tables were disabled or absent; only creature data is present then.
     */
    boolean customizationAvailable;

    // Always-on creature and texture indices

    @NonNull
    Map<Integer, List<CreatureDisplay>> creatureDisplaysByMesh;

    /**
     * Material resource id -> texture file data id (default usage only).
     */
    @NonNull
    Map<Integer, Integer> textureFileByResource;

    // Character customization indices

    @NonNull
    Map<Integer, Integer> modelByMesh;

    @NonNull
    Map<Integer, Integer> layoutByModel;

    @NonNull
    Map<Integer, List<CustomizationOption>> optionsByModel;

    @NonNull
    Map<Integer, List<CustomizationChoice>> choicesByOption;

    /**
     * Choice id -> customization geoset row id.
     */
    @NonNull
    Map<Integer, Integer> geosetByChoice;

    /**
     * Geoset row id -> encoded geoset key.
     */
    @NonNull
    Map<Integer, Integer> geosetKeys;

    @NonNull
    Map<Integer, List<MaterialBinding>> materialsByChoice;

    @NonNull
    Map<Integer, CustomizationMaterial> materials;

    /**
     * Layout id -> texture target -> layer.
     */
    @NonNull
    Map<Integer, Map<Integer, TextureLayer>> layersByLayout;

    /**
     * Layout id -> section type -> section, ordered by section type.
     */
    @NonNull
    Map<Integer, SortedMap<Integer, TextureSection>> sectionsByLayout;

    public static CustomizationCatalog empty() {
        return CustomizationCatalog.builder()
                .customizationAvailable(false)
                .creatureDisplaysByMesh(Map.of())
                .textureFileByResource(Map.of())
                .modelByMesh(Map.of())
                .layoutByModel(Map.of())
                .optionsByModel(Map.of())
                .choicesByOption(Map.of())
                .geosetByChoice(Map.of())
                .geosetKeys(Map.of())
                .materialsByChoice(Map.of())
                .materials(Map.of())
                .layersByLayout(Map.of())
                .sectionsByLayout(Map.of())
                .build();
    }

    public List<CreatureDisplay> findCreatureDisplays(int meshFileId) {
        return creatureDisplaysByMesh.getOrDefault(meshFileId, List.of());
    }

    public OptionalInt findTextureFile(int materialResourcesId) {
        Integer fileDataId = textureFileByResource.get(materialResourcesId);
        return fileDataId == null ? OptionalInt.empty() : OptionalInt.of(fileDataId);
    }

    public OptionalInt findModelId(int meshFileId) {
        Integer modelId = modelByMesh.get(meshFileId);
        return modelId == null ? OptionalInt.empty() : OptionalInt.of(modelId);
    }

    public OptionalInt findTextureLayout(int modelId) {
        Integer layoutId = layoutByModel.get(modelId);
        return layoutId == null ? OptionalInt.empty() : OptionalInt.of(layoutId);
    }

    /**
     * Layout for the model rendered by a mesh; empty if either hop is missing.
     */
    public OptionalInt findTextureLayoutForMesh(int meshFileId) {
        OptionalInt modelId = findModelId(meshFileId);
        return modelId.isPresent() ? findTextureLayout(modelId.getAsInt()) : OptionalInt.empty();
    }

    public List<CustomizationOption> findOptions(int modelId) {
        return optionsByModel.getOrDefault(modelId, List.of());
    }

    public List<CustomizationChoice> findChoices(int optionId) {
        return choicesByOption.getOrDefault(optionId, List.of());
    }

    public OptionalInt findGeosetKey(int choiceId) {
        Integer geosetId = geosetByChoice.get(choiceId);
        if (geosetId == null) {
            return OptionalInt.empty();
        }
        Integer key = geosetKeys.get(geosetId);
        return key == null ? OptionalInt.empty() : OptionalInt.of(key);
    }

    public List<MaterialBinding> findMaterialBindings(int choiceId) {
        return materialsByChoice.getOrDefault(choiceId, List.of());
    }

    public Optional<CustomizationMaterial> findMaterial(int materialId) {
        return Optional.ofNullable(materials.get(materialId));
    }

    public Optional<TextureLayer> findTextureLayer(int layoutId, int textureTarget) {
        Map<Integer, TextureLayer> byTarget = layersByLayout.get(layoutId);
        return byTarget == null ? Optional.empty() : Optional.ofNullable(byTarget.get(textureTarget));
    }

    public SortedMap<Integer, TextureSection> findSections(int layoutId) {
        SortedMap<Integer, TextureSection> sections = sectionsByLayout.get(layoutId);
        return sections == null ? Collections.emptySortedMap() : sections;
    }
}
