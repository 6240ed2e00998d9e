package com.amannmalik.monetra.cli;

import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

public final class Entrypoint {
    private Entrypoint() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        var commandLine = new CommandLine(new RootCommand());
        commandLine.addSubcommand("parse", new ParseCommand());
        commandLine.addSubcommand("round", new RoundCommand());
        commandLine.addSubcommand("multiply", new ScaleCommand.Multiply());
        commandLine.addSubcommand("divide", new ScaleCommand.Divide());
        commandLine.addSubcommand("allocate", new AllocateCommand());
        return commandLine;
    }

    @Command(
            name = "monetra",
            description = "Exact minor-unit money arithmetic",
            mixinStandardHelpOptions = true,
            versionProvider = ManifestVersionProvider.class)
    static final class RootCommand implements Runnable {
        @Spec
        private CommandSpec spec;

        RootCommand() {
        }

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    public static final class ManifestVersionProvider implements IVersionProvider {
        public ManifestVersionProvider() {
        }

        @Override
        public String[] getVersion() {
            var version = Entrypoint.class.getPackage().getImplementationVersion();
            if (version == null || version.isBlank()) {
                version = "development";
            }
            return new String[]{"monetra " + version};
        }
    }
}
