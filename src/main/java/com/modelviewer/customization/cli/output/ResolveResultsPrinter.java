package com.modelviewer.customization.cli.output;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelviewer.customization.cli.model.ResolveOptions;
import com.modelviewer.customization.cli.model.ValidatedResolveOptions;
import com.modelviewer.customization.model.AtlasRect;
import com.modelviewer.customization.model.CreatureDisplay;
import com.modelviewer.customization.model.CustomizationChoice;
import com.modelviewer.customization.model.CustomizationOption;
import com.modelviewer.customization.model.ResolvedSkinMaterial;
import com.modelviewer.customization.model.TextureSelection;
import com.modelviewer.customization.resolver.ResolutionDiagnostics;

/**
 * Responsible only for printing CLI output for the "resolve" command.
 * No validation, no execution.
 */
public class ResolveResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResolveResultsPrinter.class);

    public void printBanner(ResolveOptions o, ValidatedResolveOptions v) {
        log.info("=================================================");
        log.info("Character Customization Resolver");
        log.info("=================================================");
        log.info("Data Directory: {}", v.getNormalizedDataDir());
        log.info("Mesh: {}", o.getMeshFileId() != null ? o.getMeshFileId() : "None");
        log.info("Choices: {}", v.getChoiceIds().isEmpty() ? "None" : v.getChoiceIds());
        log.info("Current Selections: {}", v.getSelectedChoiceIds().isEmpty() ? "None" : v.getSelectedChoiceIds());
        log.info("Character Customization: {}", v.getSettings().isEnableCharacterCustomization() ? "enabled" : "disabled");
        log.info("=================================================");
    }

    public void printCreatureDisplays(int meshFileId, List<CreatureDisplay> displays) {
        log.info("");
        log.info("Creature displays for mesh {}: {}", meshFileId, displays.size());
        for (CreatureDisplay display : displays) {
            log.info("  Display {} (model {}): textures {}{}", display.getDisplayId(), display.getModelId(),
                    display.getTextures(),
                    display.getExtraGeosets().map(g -> ", extra geosets " + g).orElse(""));
        }
    }

    public void printModel(int meshFileId, OptionalInt modelId, OptionalInt layoutId) {
        log.info("");
        if (modelId.isEmpty()) {
            log.info("Mesh {} is not a customizable character model", meshFileId);
            return;
        }
        log.info("Character model: {} (texture layout {})", modelId.getAsInt(),
                layoutId.isPresent() ? layoutId.getAsInt() : "none");
    }

    public void printOption(CustomizationOption option, List<CustomizationChoice> choices) {
        log.info("  Option {} \"{}\": {} choices", option.getId(), option.getName(), choices.size());
        for (CustomizationChoice choice : choices) {
            log.info("    Choice {}: {}", choice.getId(), choice.getLabel());
        }
    }

    public void printCustomizationUnavailable() {
        log.info("");
        log.info("Character customization is not available for this data");
    }

    public void printChoice(int choiceId, OptionalInt geosetKey, Optional<List<ResolvedSkinMaterial>> skinLayers,
                            Optional<TextureSelection> texture) {
        log.info("");
        log.info("-------------------------------------------------");
        log.info("Choice {}", choiceId);
        log.info("-------------------------------------------------");
        log.info("Geoset: {}", geosetKey.isPresent() ? geosetKey.getAsInt() : "none");

        if (skinLayers.isEmpty()) {
            log.info("Skin layers: unavailable");
        } else {
            log.info("Skin layers: {}", skinLayers.get().size());
            for (ResolvedSkinMaterial material : skinLayers.get()) {
                log.info("  Layer {} section {}: texture type {}, file {} at {}", material.getLayer(),
                        material.getSectionType() == ResolvedSkinMaterial.WHOLE_ATLAS_SECTION ? "*" : material.getSectionType(),
                        material.getTextureType(), material.getFileDataId(), formatRect(material.getRect()));
            }
        }

        if (texture.isEmpty()) {
            log.info("Texture: unavailable");
        } else {
            TextureSelection t = texture.get();
            log.info("Texture: file {} (texture type {}, material {}, section mask {}){}", t.getFileDataId(),
                    t.getTextureType(), t.getMaterialId(), t.getSectionBitMask(), t.isFallback() ? " [fallback]" : "");
        }
    }

    public void printDiagnostics(ResolutionDiagnostics diagnostics) {
        if (!diagnostics.hasFallbacks() && !diagnostics.hasWarnings()) {
            return;
        }
        log.info("");
        log.info("Diagnostics:");
        diagnostics.getFallbacks().forEach(message -> log.info("  {}", message));
        diagnostics.getWarnings().forEach(message -> log.info("  {}", message));
    }

    private String formatRect(AtlasRect rect) {
        return "(" + rect.getX() + ", " + rect.getY() + ") " + rect.getWidth() + "x" + rect.getHeight();
    }
}
