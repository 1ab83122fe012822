package com.vidnyan.dokita.adapter.in.cli;

import java.nio.file.Path;

/**
 * Parsed command line: {@code [dokita] [-p|--project-path <path>] [-f|--format human|json]}.
 * Spring property overrides ({@code --name=value}) are left to Spring and ignored here.
 */
public record CliArguments(Path projectPath, OutputFormat format, String rawFormat) {

    public static final String SUBCOMMAND = "dokita";
    public static final String DEFAULT_PROJECT_PATH = "./";
    public static final String USAGE =
            "Usage: dokita [-p|--project-path <path>] [-f|--format human|json]";

    /**
     * @throws IllegalArgumentException on an unknown option or a missing option value
     */
    public static CliArguments parse(String... args) {
        String projectPath = DEFAULT_PROJECT_PATH;
        String format = "human";

        int i = 0;
        if (args.length > 0 && SUBCOMMAND.equals(args[0])) {
            i++;
        }
        for (; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--project-path=")) {
                projectPath = arg.substring("--project-path=".length());
            } else if (arg.startsWith("--format=")) {
                format = arg.substring("--format=".length());
            } else if (arg.equals("-p") || arg.equals("--project-path")) {
                projectPath = value(args, ++i, arg);
            } else if (arg.equals("-f") || arg.equals("--format")) {
                format = value(args, ++i, arg);
            } else if (arg.startsWith("--") && arg.contains("=")) {
                // Spring property override
                continue;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        return new CliArguments(Path.of(projectPath), OutputFormat.fromOption(format), format);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
