package com.williamcallahan.statuteindex.cli;

import java.util.Locale;

/**
 * Parsed command line for the ingestion entry point.
 *
 * @param command {@code ingest} or {@code check-updates}
 * @param limit maximum documents to ingest, or null for all; {@code 0} also means all
 * @param skipDiscovery reuse the cached catalog index
 */
public record IngestionArguments(String command, Integer limit, boolean skipDiscovery) {

    public static final String COMMAND_INGEST = "ingest";
    public static final String COMMAND_CHECK_UPDATES = "check-updates";

    private static final String LIMIT_FLAG = "--limit";
    private static final String SKIP_DISCOVERY_FLAG = "--skip-discovery";

    public IngestionArguments {
        if (!COMMAND_INGEST.equals(command) && !COMMAND_CHECK_UPDATES.equals(command)) {
            throw new IllegalArgumentException("Unknown command: " + command);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("--limit must not be negative: " + limit);
        }
        if (limit != null && limit == 0) {
            limit = null;
        }
    }

    /**
     * Parses raw arguments. The command defaults to {@code ingest}; Spring property overrides
     * ({@code --name=value}) are ignored.
     *
     * @throws IllegalArgumentException for an unknown command or a malformed limit
     */
    public static IngestionArguments parse(String... args) {
        String command = null;
        Integer limit = null;
        boolean skipDiscovery = false;

        for (int index = 0; index < args.length; index++) {
            String argument = args[index];
            if (LIMIT_FLAG.equals(argument)) {
                if (index + 1 >= args.length) {
                    throw new IllegalArgumentException("--limit requires a value");
                }
                limit = parseLimit(args[++index]);
            } else if (argument.startsWith(LIMIT_FLAG + "=")) {
                limit = parseLimit(argument.substring(LIMIT_FLAG.length() + 1));
            } else if (SKIP_DISCOVERY_FLAG.equals(argument)) {
                skipDiscovery = true;
            } else if (argument.startsWith("--")) {
                // Spring property override
                continue;
            } else if (command == null) {
                command = argument.toLowerCase(Locale.ROOT);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + argument);
            }
        }
        return new IngestionArguments(command == null ? COMMAND_INGEST : command, limit, skipDiscovery);
    }

    private static Integer parseLimit(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException malformed) {
            throw new IllegalArgumentException("--limit expects a number: " + value, malformed);
        }
    }
}
