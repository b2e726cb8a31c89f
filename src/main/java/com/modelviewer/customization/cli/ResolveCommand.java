package com.modelviewer.customization.cli;

import java.util.OptionalInt;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelviewer.customization.cli.exception.OptionsValidationException;
import com.modelviewer.customization.cli.model.ResolveOptions;
import com.modelviewer.customization.cli.model.ValidatedResolveOptions;
import com.modelviewer.customization.cli.output.ResolveResultsPrinter;
import com.modelviewer.customization.cli.validation.ResolveOptionsValidator;
import com.modelviewer.customization.model.CustomizationOption;
import com.modelviewer.customization.resolver.LoggingResolutionListener;
import com.modelviewer.customization.resolver.ResolutionDiagnostics;
import com.modelviewer.customization.resolver.ResolutionListener;
import com.modelviewer.customization.service.CustomizationService;
import com.modelviewer.customization.table.TableLoadException;
import com.modelviewer.customization.table.csv.CsvTableLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that loads a CSV table export and prints how customization choices resolve to textures.
 */
@Command(
        name = "resolve",
        mixinStandardHelpOptions = true,
        version = "chr-customization-resolver 1.0.0",
        description = "Resolves character customization choices to skin texture layers and atlas rectangles."
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Mixin
    private ResolveOptions options = new ResolveOptions();

    private final ResolveOptionsValidator validator = new ResolveOptionsValidator();
    private final ResolveResultsPrinter printer = new ResolveResultsPrinter();

    @Override
    public Integer call() {
        ValidatedResolveOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
        CustomizationService service = new CustomizationService(
                new CsvTableLoader(validated.getNormalizedDataDir()),
                validated.getSettings(),
                ResolutionListener.composite(new LoggingResolutionListener(), diagnostics));

        try {
            service.load();
        } catch (TableLoadException e) {
            log.error("Failed to load table {}", e.getTable(), e);
            return 1;
        }

        if (options.getMeshFileId() != null) {
            printMesh(service, options.getMeshFileId(), validated);
        }

        printer.printDiagnostics(diagnostics);
        return 0;
    }

    private void printMesh(CustomizationService service, int meshFileId, ValidatedResolveOptions validated) {
        printer.printCreatureDisplays(meshFileId, service.getCreatureDisplays(meshFileId));

        if (!service.isCustomizationAvailable()) {
            printer.printCustomizationUnavailable();
            return;
        }

        OptionalInt modelId = service.getModelIdForMesh(meshFileId);
        OptionalInt layoutId = modelId.isPresent() ? service.getTextureLayout(modelId.getAsInt()) : OptionalInt.empty();
        printer.printModel(meshFileId, modelId, layoutId);

        if (options.isListOptions() && modelId.isPresent()) {
            for (CustomizationOption option : service.listOptions(modelId.getAsInt())) {
                printer.printOption(option, service.listChoices(option.getId()));
            }
        }

        for (int choiceId : validated.getChoiceIds()) {
            printer.printChoice(choiceId,
                    service.getGeosetKey(choiceId),
                    service.resolveSkinLayers(meshFileId, choiceId),
                    service.resolveTexture(meshFileId, choiceId, validated.getSelectedChoiceIds()));
        }
    }
}
