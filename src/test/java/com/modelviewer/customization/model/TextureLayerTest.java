package com.modelviewer.customization.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextureLayer.
 */
class TextureLayerTest {

    private TextureLayer layerWithMask(int mask) {
        return TextureLayer.builder().layerId(1).layoutId(50).textureTarget(2).textureType(2).layer(1)
                .sectionBitMask(mask).build();
    }

    @Test
    void testMaskSelectsMatchingSectionBits() {
        TextureLayer layer = layerWithMask(0b101);

        assertThat(layer.paintsSection(0)).isTrue();
        assertThat(layer.paintsSection(1)).isFalse();
        assertThat(layer.paintsSection(2)).isTrue();
        assertThat(layer.isWholeAtlas()).isFalse();
    }

    @Test
    void testHighestBitIsUsable() {
        assertThat(layerWithMask(1 << 31).paintsSection(31)).isTrue();
    }

    @Test
    void testSectionTypesOutsideMaskWidthAreNeverPainted() {
        TextureLayer layer = layerWithMask(0b11);

        // 32 and 33 would alias to bits 0 and 1 if shifted unchecked
        assertThat(layer.paintsSection(32)).isFalse();
        assertThat(layer.paintsSection(33)).isFalse();
        assertThat(layer.paintsSection(-1)).isFalse();
        assertThat(layerWithMask(TextureLayer.WHOLE_ATLAS_MASK).paintsSection(40)).isFalse();
    }
}
