package com.modelviewer.customization;

import com.modelviewer.customization.cli.ResolveCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Character Customization Resolver.
 * Loads client database tables exported as CSV and prints how customization
 * choices resolve to skin textures and atlas placements.
 */
public class CustomizationApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ResolveCommand()).execute(args);
        System.exit(exitCode);
    }
}
