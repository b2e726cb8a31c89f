package com.modelviewer.customization.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * All problems found in one set of "resolve" options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final transient List<OptionError> optionErrors;

	public OptionsValidationException(List<OptionError> optionErrors) {
		super(optionErrors.stream().map(OptionError::getMessage).collect(Collectors.joining(System.lineSeparator())));
		this.optionErrors = List.copyOf(optionErrors);
	}

	public List<OptionError> getOptionErrors() {
		return optionErrors;
	}

	public List<String> getErrors() {
		return optionErrors.stream().map(OptionError::getMessage).collect(Collectors.toList());
	}

	/**
	 * A rejected option and the reason, e.g. {@code --mesh}: "must be positive".
	 */
	@Value
	public static class OptionError {
		String option;
		String message;
	}
}
