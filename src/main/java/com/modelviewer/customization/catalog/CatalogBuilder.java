package com.modelviewer.customization.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelviewer.customization.model.AtlasRect;
import com.modelviewer.customization.model.CreatureDisplay;
import com.modelviewer.customization.model.CustomizationChoice;
import com.modelviewer.customization.model.CustomizationMaterial;
import com.modelviewer.customization.model.CustomizationOption;
import com.modelviewer.customization.model.MaterialBinding;
import com.modelviewer.customization.model.TextureLayer;
import com.modelviewer.customization.model.TextureSection;
import com.modelviewer.customization.model.row.CharComponentTextureSectionRow;
import com.modelviewer.customization.model.row.ChrCustomizationChoiceRow;
import com.modelviewer.customization.model.row.ChrCustomizationElementRow;
import com.modelviewer.customization.model.row.ChrCustomizationGeosetRow;
import com.modelviewer.customization.model.row.ChrCustomizationMaterialRow;
import com.modelviewer.customization.model.row.ChrCustomizationOptionRow;
import com.modelviewer.customization.model.row.ChrModelRow;
import com.modelviewer.customization.model.row.ChrModelTextureLayerRow;
import com.modelviewer.customization.model.row.CreatureDisplayInfoGeosetDataRow;
import com.modelviewer.customization.model.row.CreatureDisplayInfoRow;
import com.modelviewer.customization.model.row.CreatureModelDataRow;
import com.modelviewer.customization.model.row.TextureFileDataRow;
import com.modelviewer.customization.table.TableLoader;
import com.modelviewer.customization.table.TableName;
import com.modelviewer.customization.table.TableSchemas;
import com.modelviewer.customization.util.GeosetKeys;

/**
 * Builds a {@link CustomizationCatalog} from the source tables in a single sequential pass.
 *
 * Joins are best-effort: rows with missing or zero foreign keys are skipped. A table that fails to load
 * aborts the build with {@link com.modelviewer.customization.table.TableLoadException}.
 */
public class CatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    private final TableLoader loader;
    private final CatalogSettings settings;

    public CatalogBuilder(TableLoader loader, CatalogSettings settings) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CustomizationCatalog build() {
        CustomizationCatalog.CustomizationCatalogBuilder catalog = CustomizationCatalog.empty().toBuilder();

        log.info("Loading creature textures...");
        Map<Integer, CreatureDisplayInfoRow> displayRows = loader.load(TableSchemas.CREATURE_DISPLAY_INFO);
        Map<Integer, CreatureModelDataRow> modelDataRows = loader.load(TableSchemas.CREATURE_MODEL_DATA);

        Map<Integer, List<CreatureDisplay>> displaysByMesh = indexCreatureDisplays(displayRows, modelDataRows);
        catalog.creatureDisplaysByMesh(freezeLists(displaysByMesh));
        log.info("Loaded textures for {} creatures", displaysByMesh.size());

        catalog.textureFileByResource(freeze(indexTextureFiles()));

        if (!isCustomizationEnabled()) {
            return catalog.build();
        }

        log.info("Loading character customization tables...");
        buildCustomization(catalog, displayRows, modelDataRows);
        log.info("Loaded character customization tables");

        return catalog.customizationAvailable(true).build();
    }

    private boolean isCustomizationEnabled() {
        if (!settings.isEnableCharacterCustomization()) {
            log.debug("Character customization disabled by settings");
            return false;
        }
        if (!loader.hasTable(TableName.CHR_MODEL)) {
            log.info("{} not available in this data version, character customization disabled",
                    TableName.CHR_MODEL.getClientPath());
            return false;
        }
        return true;
    }

    // ---- creature displays ----

    private Map<Integer, List<CreatureDisplay>> indexCreatureDisplays(Map<Integer, CreatureDisplayInfoRow> displayRows,
                                                                     Map<Integer, CreatureModelDataRow> modelDataRows) {
        // Display id -> encoded geosets, used only when the display's model carries geoset data
        Map<Integer, List<Integer>> extraGeosets = new LinkedHashMap<>();
        for (CreatureDisplayInfoGeosetDataRow row : loader.load(TableSchemas.CREATURE_DISPLAY_INFO_GEOSET_DATA).values()) {
            extraGeosets.computeIfAbsent(row.getCreatureDisplayInfoId(), k -> new ArrayList<>())
                    .add(GeosetKeys.encodeCreatureGeoset(row.getGeosetIndex(), row.getGeosetValue()));
        }

        Map<Integer, List<Integer>> displayIdsByModel = new LinkedHashMap<>();
        for (CreatureDisplayInfoRow row : displayRows.values()) {
            displayIdsByModel.computeIfAbsent(row.getModelId(), k -> new ArrayList<>()).add(row.getId());
        }

        Map<Integer, List<CreatureDisplay>> displaysByMesh = new LinkedHashMap<>();
        for (CreatureModelDataRow modelRow : modelDataRows.values()) {
            List<Integer> displayIds = displayIdsByModel.get(modelRow.getId());
            if (displayIds == null) {
                continue;
            }
            boolean hasExtraGeosets = modelRow.getCreatureGeosetDataId() > 0;

            for (int displayId : displayIds) {
                CreatureDisplayInfoRow displayRow = displayRows.get(displayId);
                List<Integer> textures = displayRow.getTextureVariationFileDataIds().stream()
                        .filter(fileDataId -> fileDataId > 0)
                        .toList();

                CreatureDisplay display = CreatureDisplay.builder()
                        .displayId(displayId)
                        .modelId(modelRow.getId())
                        .textures(textures)
                        .extraGeosets(hasExtraGeosets ? List.copyOf(extraGeosets.getOrDefault(displayId, List.of())) : null)
                        .build();

                displaysByMesh.computeIfAbsent(modelRow.getFileDataId(), k -> new ArrayList<>()).add(display);
            }
        }
        return displaysByMesh;
    }

    private Map<Integer, Integer> indexTextureFiles() {
        Map<Integer, Integer> textureFileByResource = new LinkedHashMap<>();
        int skipped = 0;
        for (TextureFileDataRow row : loader.load(TableSchemas.TEXTURE_FILE_DATA).values()) {
            // TODO: index non-default usage types once callers can ask for a specific usage
            if (row.getUsageType() != TextureFileDataRow.USAGE_DEFAULT) {
                skipped++;
                continue;
            }
            textureFileByResource.put(row.getMaterialResourcesId(), row.getFileDataId());
        }
        log.debug("Indexed {} texture files, skipped {} with non-default usage", textureFileByResource.size(), skipped);
        return textureFileByResource;
    }

    // ---- character customization ----

    private void buildCustomization(CustomizationCatalog.CustomizationCatalogBuilder catalog,
                                    Map<Integer, CreatureDisplayInfoRow> displayRows,
                                    Map<Integer, CreatureModelDataRow> modelDataRows) {
        Map<Integer, ChrModelRow> chrModels = loader.load(TableSchemas.CHR_MODEL);
        Map<Integer, ChrCustomizationOptionRow> optionRows = loader.load(TableSchemas.CHR_CUSTOMIZATION_OPTION);
        Map<Integer, ChrCustomizationChoiceRow> choiceRows = loader.load(TableSchemas.CHR_CUSTOMIZATION_CHOICE);

        Map<Integer, Integer> modelByMesh = new LinkedHashMap<>();
        Map<Integer, Integer> layoutByModel = new LinkedHashMap<>();
        for (ChrModelRow chrModel : chrModels.values()) {
            CreatureDisplayInfoRow displayRow = displayRows.get(chrModel.getDisplayId());
            CreatureModelDataRow modelDataRow = displayRow == null ? null : modelDataRows.get(displayRow.getModelId());
            if (modelDataRow != null) {
                modelByMesh.put(modelDataRow.getFileDataId(), chrModel.getId());
            } else {
                log.debug("ChrModel {} has no mesh (display {})", chrModel.getId(), chrModel.getDisplayId());
            }
            if (chrModel.getCharComponentTextureLayoutId() != 0) {
                layoutByModel.put(chrModel.getId(), chrModel.getCharComponentTextureLayoutId());
            }
        }

        Map<Integer, List<CustomizationOption>> optionsByModel = new LinkedHashMap<>();
        for (ChrCustomizationOptionRow row : optionRows.values()) {
            if (!chrModels.containsKey(row.getChrModelId())) {
                continue;
            }
            optionsByModel.computeIfAbsent(row.getChrModelId(), k -> new ArrayList<>())
                    .add(new CustomizationOption(row.getId(), row.getName()));
        }

        Map<Integer, List<CustomizationChoice>> choicesByOption = new LinkedHashMap<>();
        for (List<CustomizationOption> options : optionsByModel.values()) {
            for (CustomizationOption option : options) {
                choicesByOption.put(option.getId(), new ArrayList<>());
            }
        }
        for (ChrCustomizationChoiceRow row : choiceRows.values()) {
            List<CustomizationChoice> choices = choicesByOption.get(row.getChrCustomizationOptionId());
            if (choices != null) {
                choices.add(new CustomizationChoice(row.getId(), choiceLabel(row)));
            }
        }

        catalog.modelByMesh(freeze(modelByMesh))
                .layoutByModel(freeze(layoutByModel))
                .optionsByModel(freezeLists(optionsByModel))
                .choicesByOption(freezeLists(choicesByOption));

        indexElements(catalog);
        catalog.geosetKeys(freeze(indexGeosets()))
                .layersByLayout(freezeNested(indexTextureLayers()))
                .sectionsByLayout(freezeSorted(indexTextureSections()));
    }

    static String choiceLabel(ChrCustomizationChoiceRow row) {
        if (row.getName() != null && !row.getName().isEmpty()) {
            return row.getName();
        }
        return "Choice " + row.getOrderIndex();
    }

    private void indexElements(CustomizationCatalog.CustomizationCatalogBuilder catalog) {
        Map<Integer, ChrCustomizationMaterialRow> materialRows = loader.load(TableSchemas.CHR_CUSTOMIZATION_MATERIAL);
        Map<Integer, ChrCustomizationElementRow> elementRows = loader.load(TableSchemas.CHR_CUSTOMIZATION_ELEMENT);

        Map<Integer, Integer> geosetByChoice = new LinkedHashMap<>();
        Map<Integer, List<MaterialBinding>> materialsByChoice = new LinkedHashMap<>();
        Map<Integer, CustomizationMaterial> materials = new LinkedHashMap<>();

        for (ChrCustomizationElementRow element : elementRows.values()) {
            int choiceId = element.getChrCustomizationChoiceId();

            if (element.getChrCustomizationGeosetId() != 0) {
                geosetByChoice.put(choiceId, element.getChrCustomizationGeosetId());
            }

            if (element.getChrCustomizationMaterialId() != 0) {
                materialsByChoice.computeIfAbsent(choiceId, k -> new ArrayList<>())
                        .add(MaterialBinding.builder()
                                .elementId(element.getId())
                                .choiceId(choiceId)
                                .materialId(element.getChrCustomizationMaterialId())
                                .relatedChoiceId(element.getRelatedChrCustomizationChoiceId())
                                .build());

                ChrCustomizationMaterialRow material = materialRows.get(element.getChrCustomizationMaterialId());
                if (material == null) {
                    log.debug("Element {} references missing material {}", element.getId(),
                            element.getChrCustomizationMaterialId());
                    continue;
                }
                materials.put(material.getId(), new CustomizationMaterial(material.getId(),
                        material.getChrModelTextureTargetId(), material.getMaterialResourcesId()));
            }
        }

        catalog.geosetByChoice(freeze(geosetByChoice))
                .materialsByChoice(freezeLists(materialsByChoice))
                .materials(freeze(materials));
    }

    private Map<Integer, Integer> indexGeosets() {
        Map<Integer, Integer> geosetKeys = new LinkedHashMap<>();
        for (ChrCustomizationGeosetRow row : loader.load(TableSchemas.CHR_CUSTOMIZATION_GEOSET).values()) {
            OptionalInt key = GeosetKeys.encodeCustomizationGeoset(row.getGeosetType(), row.getGeosetId());
            if (key.isEmpty()) {
                log.debug("Skipping geoset {} with unencodable group/variant ({}, {})", row.getId(),
                        row.getGeosetType(), row.getGeosetId());
                continue;
            }
            geosetKeys.put(row.getId(), key.getAsInt());
        }
        return geosetKeys;
    }

    private Map<Integer, Map<Integer, TextureLayer>> indexTextureLayers() {
        Map<Integer, Map<Integer, TextureLayer>> layersByLayout = new LinkedHashMap<>();
        for (ChrModelTextureLayerRow row : loader.load(TableSchemas.CHR_MODEL_TEXTURE_LAYER).values()) {
            int target = row.getPrimaryTextureTargetId();
            List<Integer> targets = row.getChrModelTextureTargetIds();
            if (targets.size() > 1 && targets.get(1) != 0 && targets.get(1) != target) {
                log.debug("Texture layer {} also lists target {}, indexed under {} only", row.getId(), targets.get(1), target);
            }

            TextureLayer layer = TextureLayer.builder()
                    .layerId(row.getId())
                    .layoutId(row.getCharComponentTextureLayoutsId())
                    .textureTarget(target)
                    .textureType(row.getTextureType())
                    .layer(row.getLayer())
                    .sectionBitMask(row.getTextureSectionTypeBitMask())
                    .build();

            layersByLayout.computeIfAbsent(row.getCharComponentTextureLayoutsId(), k -> new LinkedHashMap<>())
                    .put(target, layer);
        }
        return layersByLayout;
    }

    private Map<Integer, SortedMap<Integer, TextureSection>> indexTextureSections() {
        Map<Integer, SortedMap<Integer, TextureSection>> sectionsByLayout = new LinkedHashMap<>();
        for (CharComponentTextureSectionRow row : loader.load(TableSchemas.CHAR_COMPONENT_TEXTURE_SECTIONS).values()) {
            AtlasRect rect = new AtlasRect(row.getX(), row.getY(), row.getWidth(), row.getHeight());
            sectionsByLayout.computeIfAbsent(row.getCharComponentTextureLayoutId(), k -> new TreeMap<>())
                    .put(row.getSectionType(), new TextureSection(row.getCharComponentTextureLayoutId(), row.getSectionType(), rect));
        }
        return sectionsByLayout;
    }

    // ---- immutability ----

    private static <V> Map<Integer, V> freeze(Map<Integer, V> map) {
        return Collections.unmodifiableMap(map);
    }

    private static <V> Map<Integer, List<V>> freezeLists(Map<Integer, List<V>> map) {
        Map<Integer, List<V>> frozen = new LinkedHashMap<>();
        map.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    private static <V> Map<Integer, Map<Integer, V>> freezeNested(Map<Integer, Map<Integer, V>> map) {
        Map<Integer, Map<Integer, V>> frozen = new LinkedHashMap<>();
        map.forEach((key, inner) -> frozen.put(key, Collections.unmodifiableMap(inner)));
        return Collections.unmodifiableMap(frozen);
    }

    private static <V> Map<Integer, SortedMap<Integer, V>> freezeSorted(Map<Integer, SortedMap<Integer, V>> map) {
        Map<Integer, SortedMap<Integer, V>> frozen = new LinkedHashMap<>();
        map.forEach((key, inner) -> frozen.put(key, Collections.unmodifiableSortedMap(inner)));
        return Collections.unmodifiableMap(frozen);
    }
}
