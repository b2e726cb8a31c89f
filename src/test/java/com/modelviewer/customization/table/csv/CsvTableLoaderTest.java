package com.modelviewer.customization.table.csv;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelviewer.customization.model.row.ChrCustomizationChoiceRow;
import com.modelviewer.customization.model.row.ChrModelRow;
import com.modelviewer.customization.model.row.ChrModelTextureLayerRow;
import com.modelviewer.customization.model.row.CreatureDisplayInfoRow;
import com.modelviewer.customization.model.row.TextureFileDataRow;
import com.modelviewer.customization.table.TableLoadException;
import com.modelviewer.customization.table.TableName;
import com.modelviewer.customization.table.TableSchemas;

/**
 * Unit tests for CsvTableLoader.
 */
class CsvTableLoaderTest {

    @TempDir
    Path dataDir;

    private void write(String fileName, String... lines) throws IOException {
        Files.write(dataDir.resolve(fileName), List.of(lines));
    }

    @Test
    void testLoadsRowsInFileOrder() throws IOException {
        write("ChrCustomizationChoice.csv",
                "ID,Name_lang,ChrCustomizationOptionID,OrderIndex",
                "9,Light,11,4",
                "5,,11,3",
                "6,\"Pale, freckled\",11,1");

        Map<Integer, ChrCustomizationChoiceRow> rows =
                new CsvTableLoader(dataDir).load(TableSchemas.CHR_CUSTOMIZATION_CHOICE);

        assertThat(rows.keySet()).containsExactly(9, 5, 6);
        assertThat(rows.get(5).getName()).isEmpty();
        assertThat(rows.get(6).getName()).isEqualTo("Pale, freckled");
        assertThat(rows.get(9).getChrCustomizationOptionId()).isEqualTo(11);
        assertThat(rows.get(9).getOrderIndex()).isEqualTo(4);
    }

    @Test
    void testReadsIndexedArrayColumns() throws IOException {
        write("CreatureDisplayInfo.csv",
                "ID,ModelID,TextureVariationFileDataID[0],TextureVariationFileDataID[1],"
                        + "TextureVariationFileDataID[2],TextureVariationFileDataID[3]",
                "20,200,5001,0,5002,0");

        CreatureDisplayInfoRow row = new CsvTableLoader(dataDir).load(TableSchemas.CREATURE_DISPLAY_INFO).get(20);

        assertThat(row.getModelId()).isEqualTo(200);
        assertThat(row.getTextureVariationFileDataIds()).containsExactly(5001, 0, 5002, 0);
    }

    @Test
    void testUnsignedMaskIsReadAsNegativeInt() throws IOException {
        write("ChrModelTextureLayer.csv",
                "ID,TextureType,Layer,TextureSectionTypeBitMask,ChrModelTextureTargetID[0],"
                        + "ChrModelTextureTargetID[1],CharComponentTextureLayoutsID",
                "1,1,0,4294967295,1,0,50",
                "2,2,1,5,2,3,50");

        Map<Integer, ChrModelTextureLayerRow> rows =
                new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL_TEXTURE_LAYER);

        assertThat(rows.get(1).getTextureSectionTypeBitMask()).isEqualTo(-1);
        assertThat(rows.get(2).getTextureSectionTypeBitMask()).isEqualTo(5);
        assertThat(rows.get(2).getChrModelTextureTargetIds()).containsExactly(2, 3);
        assertThat(rows.get(2).getPrimaryTextureTargetId()).isEqualTo(2);
    }

    @Test
    void testFileNameMatchedCaseInsensitively() throws IOException {
        write("texturefiledata.CSV",
                "ID,UsageType,MaterialResourcesID",
                "7001,0,501");

        CsvTableLoader loader = new CsvTableLoader(dataDir);

        assertThat(loader.hasTable(TableName.TEXTURE_FILE_DATA)).isTrue();
        TextureFileDataRow row = loader.load(TableSchemas.TEXTURE_FILE_DATA).get(7001);
        assertThat(row.getFileDataId()).isEqualTo(7001);
        assertThat(row.getMaterialResourcesId()).isEqualTo(501);
    }

    @Test
    void testMissingFileIsReported() {
        CsvTableLoader loader = new CsvTableLoader(dataDir);

        assertThat(loader.hasTable(TableName.CHR_MODEL)).isFalse();
        assertThatThrownBy(() -> loader.load(TableSchemas.CHR_MODEL))
                .isInstanceOfSatisfying(TableLoadException.class,
                        e -> assertThat(e.getTable()).isEqualTo(TableName.CHR_MODEL));
    }

    @Test
    void testMissingColumnIsReported() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID",
                "1,10");

        assertThatThrownBy(() -> new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("CharComponentTextureLayoutID");
    }

    @Test
    void testMissingIdColumnIsReported() throws IOException {
        write("ChrModel.csv",
                "DisplayID,CharComponentTextureLayoutID",
                "10,50");

        assertThatThrownBy(() -> new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("Missing column ID");
    }

    @Test
    void testNonNumericValueIsReported() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID,CharComponentTextureLayoutID",
                "1,ten,50");

        assertThatThrownBy(() -> new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("DisplayID")
                .hasMessageContaining("ten");
    }

    @Test
    void testValueBeyondUnsignedRangeIsRejected() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID,CharComponentTextureLayoutID",
                "1,4294967297,50");

        assertThatThrownBy(() -> new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL))
                .isInstanceOfSatisfying(TableLoadException.class,
                        e -> assertThat(e.getTable()).isEqualTo(TableName.CHR_MODEL))
                .hasMessageContaining("Line 1")
                .hasMessageContaining("DisplayID")
                .hasMessageContaining("4294967297");
    }

    @Test
    void testNegativeValueBelowIntRangeIsRejected() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID,CharComponentTextureLayoutID",
                "1,10,-2147483649");

        assertThatThrownBy(() -> new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("CharComponentTextureLayoutID");
    }

    @Test
    void testEmptyCellsReadAsZero() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID,CharComponentTextureLayoutID",
                "1,10,",
                "",
                "2,11,51");

        Map<Integer, ChrModelRow> rows =
                new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).getCharComponentTextureLayoutId()).isZero();
    }

    @Test
    void testLoadedRowsAreReadOnly() throws IOException {
        write("ChrModel.csv",
                "ID,DisplayID,CharComponentTextureLayoutID",
                "1,10,50");

        Map<Integer, ?> rows = new CsvTableLoader(dataDir).load(TableSchemas.CHR_MODEL);

        assertThatThrownBy(rows::clear).isInstanceOf(UnsupportedOperationException.class);
    }
}
