package com.modelviewer.customization.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.modelviewer.customization.catalog.CatalogSettings;
import com.modelviewer.customization.cli.exception.OptionsValidationException;
import com.modelviewer.customization.cli.exception.OptionsValidationException.OptionError;
import com.modelviewer.customization.cli.model.ResolveOptions;
import com.modelviewer.customization.cli.model.ValidatedResolveOptions;

public class ResolveOptionsValidator {

	public ValidatedResolveOptions validate(ResolveOptions o) {
		List<OptionError> errors = new ArrayList<>();

		if (o.getDataDir() == null) {
			errors.add(new OptionError("--data-dir", "Data directory is required (--data-dir / -d)."));
		} else if (!existsDirectory(o.getDataDir())) {
			errors.add(new OptionError("--data-dir", "Data directory does not exist or is not a directory: " + o.getDataDir()));
		}

		if (o.getMeshFileId() != null && o.getMeshFileId() <= 0) {
			errors.add(new OptionError("--mesh", "Mesh file data id must be positive. Got: " + o.getMeshFileId()));
		}

		List<Integer> choiceIds = positiveIds(o.getChoiceIds(), "--choice", "Choice", errors);
		List<Integer> selectedChoiceIds = positiveIds(o.getSelectedChoiceIds(), "--selected", "Selected choice", errors);

		if (o.getMeshFileId() == null) {
			if (!choiceIds.isEmpty()) {
				errors.add(new OptionError("--choice", "Resolving choices requires a mesh (--mesh / -m)."));
			}
			if (o.isListOptions()) {
				errors.add(new OptionError("--list-options", "--list-options requires a mesh (--mesh / -m)."));
			}
		}

		if (o.isNoCustomization() && (!choiceIds.isEmpty() || o.isListOptions())) {
			errors.add(new OptionError("--no-customization", "--no-customization cannot be combined with --choice or --list-options."));
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		CatalogSettings settings = CatalogSettings.builder()
				.enableCharacterCustomization(!o.isNoCustomization())
				.build();

		return new ValidatedResolveOptions(o.getDataDir().toAbsolutePath().normalize(), settings, choiceIds,
				selectedChoiceIds);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static List<Integer> positiveIds(List<Integer> raw, String option, String label, List<OptionError> errors) {
		if (raw == null || raw.isEmpty()) {
			return List.of();
		}
		LinkedHashSet<Integer> ids = new LinkedHashSet<>();
		for (Integer id : raw) {
			if (id == null || id <= 0) {
				errors.add(new OptionError(option, label + " id must be positive. Got: " + id));
			} else {
				ids.add(id);
			}
		}
		return List.copyOf(ids);
	}
}
