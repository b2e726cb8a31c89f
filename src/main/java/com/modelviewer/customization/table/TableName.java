package com.modelviewer.customization.table;

/**
 * Client database tables consumed by the catalog builder.
 */
public enum TableName {

    CREATURE_DISPLAY_INFO("CreatureDisplayInfo"),
    CREATURE_DISPLAY_INFO_GEOSET_DATA("CreatureDisplayInfoGeosetData"),
    CREATURE_MODEL_DATA("CreatureModelData"),
    TEXTURE_FILE_DATA("TextureFileData"),

    CHR_MODEL("ChrModel"),
    CHR_CUSTOMIZATION_OPTION("ChrCustomizationOption"),
    CHR_CUSTOMIZATION_CHOICE("ChrCustomizationChoice"),
    CHR_CUSTOMIZATION_ELEMENT("ChrCustomizationElement"),
    CHR_CUSTOMIZATION_MATERIAL("ChrCustomizationMaterial"),
    CHR_CUSTOMIZATION_GEOSET("ChrCustomizationGeoset"),
    CHR_MODEL_TEXTURE_LAYER("ChrModelTextureLayer"),
    CHAR_COMPONENT_TEXTURE_SECTIONS("CharComponentTextureSections");

    private final String tableName;

    TableName(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Name of the table as it appears in the client database (e.g. ChrModel).
     */
    public String getTableName() {
        return tableName;
    }

    /**
     * Path of the table inside the client file system (e.g. DBFilesClient/ChrModel.db2).
     */
    public String getClientPath() {
        return "DBFilesClient/" + tableName + ".db2";
    }

    @Override
    public String toString() {
        return tableName;
    }
}
