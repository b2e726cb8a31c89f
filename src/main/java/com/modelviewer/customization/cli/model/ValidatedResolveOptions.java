package com.modelviewer.customization.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.modelviewer.customization.catalog.CatalogSettings;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ResolveCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedResolveOptions {
    Path normalizedDataDir;
    CatalogSettings settings;

    /**
     * Choices to resolve, duplicates removed, in command-line order.
     */
    List<Integer> choiceIds;

    List<Integer> selectedChoiceIds;
}
