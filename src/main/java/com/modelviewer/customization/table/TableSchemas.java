package com.modelviewer.customization.table;

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

import lombok.experimental.UtilityClass;

/**
 * Column layouts of the consumed tables. Column names follow the client database definitions.
 */
@UtilityClass
public class TableSchemas {

    public static final TableSchema<CreatureDisplayInfoRow> CREATURE_DISPLAY_INFO =
            TableSchema.<CreatureDisplayInfoRow>builder()
                    .table(TableName.CREATURE_DISPLAY_INFO)
                    .rowType(CreatureDisplayInfoRow.class)
                    .decoder((id, r) -> CreatureDisplayInfoRow.builder()
                            .id(id)
                            .modelId(r.getInt("ModelID"))
                            .textureVariationFileDataIds(r.getIntArray("TextureVariationFileDataID", 4))
                            .build())
                    .build();

    public static final TableSchema<CreatureDisplayInfoGeosetDataRow> CREATURE_DISPLAY_INFO_GEOSET_DATA =
            TableSchema.<CreatureDisplayInfoGeosetDataRow>builder()
                    .table(TableName.CREATURE_DISPLAY_INFO_GEOSET_DATA)
                    .rowType(CreatureDisplayInfoGeosetDataRow.class)
                    .decoder((id, r) -> CreatureDisplayInfoGeosetDataRow.builder()
                            .id(id)
                            .creatureDisplayInfoId(r.getInt("CreatureDisplayInfoID"))
                            .geosetIndex(r.getInt("GeosetIndex"))
                            .geosetValue(r.getInt("GeosetValue"))
                            .build())
                    .build();

    public static final TableSchema<CreatureModelDataRow> CREATURE_MODEL_DATA =
            TableSchema.<CreatureModelDataRow>builder()
                    .table(TableName.CREATURE_MODEL_DATA)
                    .rowType(CreatureModelDataRow.class)
                    .decoder((id, r) -> CreatureModelDataRow.builder()
                            .id(id)
                            .fileDataId(r.getInt("FileDataID"))
                            .creatureGeosetDataId(r.getInt("CreatureGeosetDataID"))
                            .build())
                    .build();

    public static final TableSchema<TextureFileDataRow> TEXTURE_FILE_DATA =
            TableSchema.<TextureFileDataRow>builder()
                    .table(TableName.TEXTURE_FILE_DATA)
                    .rowType(TextureFileDataRow.class)
                    .decoder((id, r) -> TextureFileDataRow.builder()
                            .fileDataId(id)
                            .usageType(r.getInt("UsageType"))
                            .materialResourcesId(r.getInt("MaterialResourcesID"))
                            .build())
                    .build();

    public static final TableSchema<ChrModelRow> CHR_MODEL =
            TableSchema.<ChrModelRow>builder()
                    .table(TableName.CHR_MODEL)
                    .rowType(ChrModelRow.class)
                    .decoder((id, r) -> ChrModelRow.builder()
                            .id(id)
                            .displayId(r.getInt("DisplayID"))
                            .charComponentTextureLayoutId(r.getInt("CharComponentTextureLayoutID"))
                            .build())
                    .build();

    public static final TableSchema<ChrCustomizationOptionRow> CHR_CUSTOMIZATION_OPTION =
            TableSchema.<ChrCustomizationOptionRow>builder()
                    .table(TableName.CHR_CUSTOMIZATION_OPTION)
                    .rowType(ChrCustomizationOptionRow.class)
                    .decoder((id, r) -> ChrCustomizationOptionRow.builder()
                            .id(id)
                            .name(r.getString("Name_lang"))
                            .chrModelId(r.getInt("ChrModelID"))
                            .build())
                    .build();

    public static final TableSchema<ChrCustomizationChoiceRow> CHR_CUSTOMIZATION_CHOICE =
            TableSchema.<ChrCustomizationChoiceRow>builder()
                    .table(TableName.CHR_CUSTOMIZATION_CHOICE)
                    .rowType(ChrCustomizationChoiceRow.class)
                    .decoder((id, r) -> ChrCustomizationChoiceRow.builder()
                            .id(id)
                            .name(r.getString("Name_lang"))
                            .chrCustomizationOptionId(r.getInt("ChrCustomizationOptionID"))
                            .orderIndex(r.getInt("OrderIndex"))
                            .build())
                    .build();

    public static final TableSchema<ChrCustomizationElementRow> CHR_CUSTOMIZATION_ELEMENT =
            TableSchema.<ChrCustomizationElementRow>builder()
                    .table(TableName.CHR_CUSTOMIZATION_ELEMENT)
                    .rowType(ChrCustomizationElementRow.class)
                    .decoder((id, r) -> ChrCustomizationElementRow.builder()
                            .id(id)
                            .chrCustomizationChoiceId(r.getInt("ChrCustomizationChoiceID"))
                            .relatedChrCustomizationChoiceId(r.getInt("RelatedChrCustomizationChoiceID"))
                            .chrCustomizationGeosetId(r.getInt("ChrCustomizationGeosetID"))
                            .chrCustomizationMaterialId(r.getInt("ChrCustomizationMaterialID"))
                            .build())
                    .build();

    public static final TableSchema<ChrCustomizationMaterialRow> CHR_CUSTOMIZATION_MATERIAL =
            TableSchema.<ChrCustomizationMaterialRow>builder()
                    .table(TableName.CHR_CUSTOMIZATION_MATERIAL)
                    .rowType(ChrCustomizationMaterialRow.class)
                    .decoder((id, r) -> ChrCustomizationMaterialRow.builder()
                            .id(id)
                            .chrModelTextureTargetId(r.getInt("ChrModelTextureTargetID"))
                            .materialResourcesId(r.getInt("MaterialResourcesID"))
                            .build())
                    .build();

    public static final TableSchema<ChrCustomizationGeosetRow> CHR_CUSTOMIZATION_GEOSET =
            TableSchema.<ChrCustomizationGeosetRow>builder()
                    .table(TableName.CHR_CUSTOMIZATION_GEOSET)
                    .rowType(ChrCustomizationGeosetRow.class)
                    .decoder((id, r) -> ChrCustomizationGeosetRow.builder()
                            .id(id)
                            .geosetType(r.getInt("GeosetType"))
                            .geosetId(r.getInt("GeosetID"))
                            .build())
                    .build();

    public static final TableSchema<ChrModelTextureLayerRow> CHR_MODEL_TEXTURE_LAYER =
            TableSchema.<ChrModelTextureLayerRow>builder()
                    .table(TableName.CHR_MODEL_TEXTURE_LAYER)
                    .rowType(ChrModelTextureLayerRow.class)
                    .decoder((id, r) -> ChrModelTextureLayerRow.builder()
                            .id(id)
                            .textureType(r.getInt("TextureType"))
                            .layer(r.getInt("Layer"))
                            .textureSectionTypeBitMask(r.getInt("TextureSectionTypeBitMask"))
                            .chrModelTextureTargetIds(r.getIntArray("ChrModelTextureTargetID", 2))
                            .charComponentTextureLayoutsId(r.getInt("CharComponentTextureLayoutsID"))
                            .build())
                    .build();

    public static final TableSchema<CharComponentTextureSectionRow> CHAR_COMPONENT_TEXTURE_SECTIONS =
            TableSchema.<CharComponentTextureSectionRow>builder()
                    .table(TableName.CHAR_COMPONENT_TEXTURE_SECTIONS)
                    .rowType(CharComponentTextureSectionRow.class)
                    .decoder((id, r) -> CharComponentTextureSectionRow.builder()
                            .id(id)
                            .charComponentTextureLayoutId(r.getInt("CharComponentTextureLayoutID"))
                            .sectionType(r.getInt("SectionType"))
                            .x(r.getInt("X"))
                            .y(r.getInt("Y"))
                            .width(r.getInt("Width"))
                            .height(r.getInt("Height"))
                            .build())
                    .build();
}
