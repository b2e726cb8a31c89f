package com.modelviewer.customization.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "resolve" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ResolveOptions {

	@Option(names = { "--data-dir", "-d" }, required = true,
			description = "Directory containing the client database tables exported as CSV (<TableName>.csv)")
	private Path dataDir;

	@Option(names = { "--mesh", "-m" }, description = "File data id of the model mesh")
	private Integer meshFileId;

	@Option(names = { "--choice", "-c" }, split = ",",
			description = "Customization choice id(s) to resolve (repeatable or comma-separated)")
	private List<Integer> choiceIds = new ArrayList<>();

	@Option(names = { "--selected", "-s" }, split = ",",
			description = "Choice ids currently selected in other options, used to pick related materials")
	private List<Integer> selectedChoiceIds = new ArrayList<>();

	@Option(names = { "--list-options" }, description = "List the customization options and choices of the mesh's model")
	private boolean listOptions;

	@Option(names = { "--no-customization" },
			description = "Skip character customization tables (creature displays only)")
	private boolean noCustomization;

}
