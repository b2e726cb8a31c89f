package com.modelviewer.customization.model;

import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * A skin variant of a creature mesh, independent of character customization.
 */
@Value
@Builder
public class CreatureDisplay {

    int displayId;
    int modelId;

    /**
     * Candidate texture file data ids, zero slots removed.
     */
    @NonNull
    List<Integer> textures;

    /**
     * Encoded geosets to enable, {@code (geosetIndex + 1) * 100 + geosetValue}.
     * Null when the display's model carries no extra geoset data.
     */
    @Getter(AccessLevel.NONE)
    List<Integer> extraGeosets;

    public Optional<List<Integer>> getExtraGeosets() {
        return Optional.ofNullable(extraGeosets);
    }
}
