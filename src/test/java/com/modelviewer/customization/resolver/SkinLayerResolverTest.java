package com.modelviewer.customization.resolver;

import static com.modelviewer.customization.catalog.CustomizationTestData.CHARACTER_MESH;
import static com.modelviewer.customization.catalog.CustomizationTestData.CREATURE_MESH;
import static com.modelviewer.customization.catalog.CustomizationTestData.LAYOUT;
import static com.modelviewer.customization.catalog.CustomizationTestData.SECTION_A;
import static com.modelviewer.customization.catalog.CustomizationTestData.SECTION_B;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.modelviewer.customization.catalog.CatalogBuilder;
import com.modelviewer.customization.catalog.CatalogSettings;
import com.modelviewer.customization.catalog.CustomizationCatalog;
import com.modelviewer.customization.catalog.CustomizationTestData;
import com.modelviewer.customization.model.AtlasRect;
import com.modelviewer.customization.model.ResolvedSkinMaterial;
import com.modelviewer.customization.table.InMemoryTableLoader;
import com.modelviewer.customization.table.TableName;

/**
 * Unit tests for SkinLayerResolver.
 */
class SkinLayerResolverTest {

    private ResolutionDiagnostics diagnostics;
    private SkinLayerResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new ResolutionDiagnostics();
        resolver = resolverFor(CustomizationTestData.standard());
    }

    private SkinLayerResolver resolverFor(InMemoryTableLoader loader) {
        CustomizationCatalog catalog = new CatalogBuilder(loader, CatalogSettings.defaults()).build();
        return new SkinLayerResolver(catalog, diagnostics);
    }

    @Test
    void testWholeAtlasLayerEmitsSingleFullRect() {
        List<ResolvedSkinMaterial> layers = resolver.resolveSkinLayers(CHARACTER_MESH, 5).orElseThrow();

        // Layout has three sections; the whole-atlas layer still yields one entry
        assertThat(layers).hasSize(1);
        ResolvedSkinMaterial material = layers.get(0);
        assertThat(material.getRect()).isEqualTo(new AtlasRect(0, 0, 1024, 512));
        assertThat(material.getSectionType()).isEqualTo(ResolvedSkinMaterial.WHOLE_ATLAS_SECTION);
        assertThat(material.getLayer()).isZero();
        assertThat(material.getTextureType()).isEqualTo(1);
    }

    @Test
    void testLaterMaterialForSameSlotWins() {
        // Choice 5 binds materials 10 and 11, both painting target 1
        ResolvedSkinMaterial material = resolver.resolveSkinLayers(CHARACTER_MESH, 5).orElseThrow().get(0);

        assertThat(material.getFileDataId()).isEqualTo(7002);
    }

    @Test
    void testBitMaskSelectsMatchingSectionsOnly() {
        List<ResolvedSkinMaterial> layers = resolver.resolveSkinLayers(CHARACTER_MESH, 6).orElseThrow();

        assertThat(layers).extracting(ResolvedSkinMaterial::getRect).containsExactly(SECTION_A, SECTION_B);
        assertThat(layers).extracting(ResolvedSkinMaterial::getSectionType).containsExactly(0, 2);
        assertThat(layers).allSatisfy(m -> {
            assertThat(m.getLayer()).isEqualTo(1);
            assertThat(m.getFileDataId()).isEqualTo(7003);
        });
    }

    @Test
    void testMissingLayerForTargetIsSkippedAndReported() {
        resolver.resolveSkinLayers(CHARACTER_MESH, 6);

        assertThat(diagnostics.getWarnings())
                .containsExactly("Layout " + LAYOUT + " has no layer for texture target 7");
    }

    @Test
    void testUnresolvedTextureAndMissingMaterialYieldEmptyResult() {
        Optional<List<ResolvedSkinMaterial>> layers = resolver.resolveSkinLayers(CHARACTER_MESH, 9);

        assertThat(layers).hasValue(List.of());
        assertThat(diagnostics.getWarnings()).containsExactly("Material resource 999 has no texture file");
    }

    @Test
    void testChoiceWithoutMaterialsIsUnavailable() {
        assertThat(resolver.resolveSkinLayers(CHARACTER_MESH, 7)).isEmpty();
        assertThat(resolver.resolveSkinLayers(CHARACTER_MESH, 8)).isEmpty();
        assertThat(resolver.resolveSkinLayers(CHARACTER_MESH, 12345)).isEmpty();
    }

    @Test
    void testNonCharacterMeshIsUnavailable() {
        assertThat(resolver.resolveSkinLayers(CREATURE_MESH, 5)).isEmpty();
        assertThat(resolver.resolveSkinLayers(404, 5)).isEmpty();
    }

    @Test
    void testLayoutWithoutSectionsIsUnavailable() {
        InMemoryTableLoader loader = CustomizationTestData.standard()
                .removeTable(TableName.CHAR_COMPONENT_TEXTURE_SECTIONS);

        assertThat(resolverFor(loader).resolveSkinLayers(CHARACTER_MESH, 5)).isEmpty();
    }

    @Test
    void testMaskWithNoMatchingSectionEmitsNothing() {
        InMemoryTableLoader loader = CustomizationTestData.standard()
                .row(TableName.CHR_CUSTOMIZATION_MATERIAL, 15, CustomizationTestData.material(15, 4, 501))
                .row(TableName.CHR_CUSTOMIZATION_ELEMENT, 8, CustomizationTestData.element(8, 8, 0, 0, 15));

        assertThat(resolverFor(loader).resolveSkinLayers(CHARACTER_MESH, 8)).hasValue(List.of());
    }

    @Test
    void testSectionTypeBeyondMaskWidthIsNotPainted() {
        // Target 4 paints section 1 only; section 33 must not alias onto that bit
        InMemoryTableLoader loader = CustomizationTestData.standard()
                .row(TableName.CHAR_COMPONENT_TEXTURE_SECTIONS, 4,
                        CustomizationTestData.section(4, LAYOUT, 33, new AtlasRect(0, 256, 256, 256)))
                .row(TableName.CHR_CUSTOMIZATION_MATERIAL, 15, CustomizationTestData.material(15, 4, 501))
                .row(TableName.CHR_CUSTOMIZATION_ELEMENT, 8, CustomizationTestData.element(8, 8, 0, 0, 15));

        assertThat(resolverFor(loader).resolveSkinLayers(CHARACTER_MESH, 8)).hasValue(List.of());
    }

    @Test
    void testEntriesOrderedByDestinationLayer() {
        InMemoryTableLoader loader = CustomizationTestData.standard()
                .row(TableName.CHR_CUSTOMIZATION_MATERIAL, 15, CustomizationTestData.material(15, 3, 502))
                .row(TableName.CHR_CUSTOMIZATION_ELEMENT, 8, CustomizationTestData.element(8, 8, 0, 0, 15))
                .row(TableName.CHR_CUSTOMIZATION_ELEMENT, 9, CustomizationTestData.element(9, 8, 0, 0, 12))
                .row(TableName.CHR_CUSTOMIZATION_ELEMENT, 10, CustomizationTestData.element(10, 8, 0, 0, 10));

        List<ResolvedSkinMaterial> layers = resolverFor(loader).resolveSkinLayers(CHARACTER_MESH, 8).orElseThrow();

        assertThat(layers).extracting(ResolvedSkinMaterial::getLayer).containsExactly(0, 1, 1, 2);
        assertThat(layers.get(3).getRect()).isEqualTo(CustomizationTestData.SECTION_C);
    }

    @Test
    void testRepeatedCallsReturnEqualResults() {
        assertThat(resolver.resolveSkinLayers(CHARACTER_MESH, 6))
                .isEqualTo(resolver.resolveSkinLayers(CHARACTER_MESH, 6));
    }

    @Test
    void testUnavailableWhenCustomizationDisabled() {
        CustomizationCatalog catalog = new CatalogBuilder(CustomizationTestData.standard(),
                CatalogSettings.builder().enableCharacterCustomization(false).build()).build();

        assertThat(new SkinLayerResolver(catalog, diagnostics).resolveSkinLayers(CHARACTER_MESH, 5)).isEmpty();
    }
}
