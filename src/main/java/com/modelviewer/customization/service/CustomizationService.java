package com.modelviewer.customization.service;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelviewer.customization.catalog.CatalogBuilder;
import com.modelviewer.customization.catalog.CatalogSettings;
import com.modelviewer.customization.catalog.CustomizationCatalog;
import com.modelviewer.customization.model.CreatureDisplay;
import com.modelviewer.customization.model.CustomizationChoice;
import com.modelviewer.customization.model.CustomizationOption;
import com.modelviewer.customization.model.ResolvedSkinMaterial;
import com.modelviewer.customization.model.TextureSelection;
import com.modelviewer.customization.resolver.MaterialSelector;
import com.modelviewer.customization.resolver.ResolutionListener;
import com.modelviewer.customization.resolver.SkinLayerResolver;
import com.modelviewer.customization.table.TableLoader;

/**
 * Query surface for renderers and exporters.
 *
 * Until {@link #load()} completes every query reports "unavailable". A load builds the whole catalog before
 * publishing it, so concurrent readers see either the previous catalog or the new one, never a partial one.
 */
public class CustomizationService {

    private static final Logger log = LoggerFactory.getLogger(CustomizationService.class);

    private final TableLoader loader;
    private final CatalogSettings settings;
    private final ResolutionListener listener;

    private volatile Snapshot snapshot;

    public CustomizationService(TableLoader loader, CatalogSettings settings, ResolutionListener listener) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.snapshot = new Snapshot(CustomizationCatalog.empty(), listener);
    }

    /**
     * Build and publish the catalog for the loader's data version.
     *
     * @throws com.modelviewer.customization.table.TableLoadException if a table fails to load; the previously
     *         published catalog stays in place
     */
    public synchronized CustomizationCatalog load() {
        long started = System.currentTimeMillis();
        CustomizationCatalog catalog = new CatalogBuilder(loader, settings).build();
        snapshot = new Snapshot(catalog, listener);
        log.info("Catalog published in {} ms (customization {})", System.currentTimeMillis() - started,
                catalog.isCustomizationAvailable() ? "available" : "unavailable");
        return catalog;
    }

    public CompletableFuture<CustomizationCatalog> loadAsync(Executor executor) {
        return CompletableFuture.supplyAsync(this::load, executor);
    }

    public CustomizationCatalog getCatalog() {
        return snapshot.catalog;
    }

    public boolean isCustomizationAvailable() {
        return snapshot.catalog.isCustomizationAvailable();
    }

    public List<CreatureDisplay> getCreatureDisplays(int meshFileId) {
        return snapshot.catalog.findCreatureDisplays(meshFileId);
    }

    public OptionalInt getModelIdForMesh(int meshFileId) {
        return snapshot.catalog.findModelId(meshFileId);
    }

    public boolean isCustomizableMesh(int meshFileId) {
        return getModelIdForMesh(meshFileId).isPresent();
    }

    public OptionalInt getTextureLayout(int modelId) {
        return snapshot.catalog.findTextureLayout(modelId);
    }

    public List<CustomizationOption> listOptions(int modelId) {
        return snapshot.catalog.findOptions(modelId);
    }

    public List<CustomizationChoice> listChoices(int optionId) {
        return snapshot.catalog.findChoices(optionId);
    }

    public OptionalInt getGeosetKey(int choiceId) {
        return snapshot.catalog.findGeosetKey(choiceId);
    }

    public OptionalInt getTextureTarget(int materialId) {
        return snapshot.catalog.findMaterial(materialId)
                .map(material -> OptionalInt.of(material.getTextureTarget()))
                .orElse(OptionalInt.empty());
    }

    public OptionalInt getTextureFileForResource(int materialResourcesId) {
        return snapshot.catalog.findTextureFile(materialResourcesId);
    }

    public Optional<List<ResolvedSkinMaterial>> resolveSkinLayers(int meshFileId, int choiceId) {
        return snapshot.skinLayerResolver.resolveSkinLayers(meshFileId, choiceId);
    }

    public Optional<TextureSelection> resolveTexture(int meshFileId, int choiceId, Collection<Integer> currentSelections) {
        return snapshot.materialSelector.resolveTexture(meshFileId, choiceId, currentSelections);
    }

    /**
     * A published catalog together with the resolvers reading it, swapped as one unit.
     */
    private static final class Snapshot {
        private final CustomizationCatalog catalog;
        private final SkinLayerResolver skinLayerResolver;
        private final MaterialSelector materialSelector;

        private Snapshot(CustomizationCatalog catalog, ResolutionListener listener) {
            this.catalog = catalog;
            this.skinLayerResolver = new SkinLayerResolver(catalog, listener);
            this.materialSelector = new MaterialSelector(catalog, listener);
        }
    }
}
