// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.tools.cli;

import com.amazon.civiltime.CivilTimeException;
import com.amazon.civiltime.Instant;
import com.amazon.civiltime.InvalidInstantException;
import com.amazon.civiltime.Timestamp;
import com.amazon.civiltime.TimestampReader;
import com.amazon.civiltime.system.TimestampReaderBuilder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.math.BigDecimal;

/**
 * Command line access to the timestamp conversions. Each subcommand reads its
 * arguments as timestamps (or epoch seconds), prints one line per argument to
 * standard output, and stops at the first argument that is not valid.
 */
@Command(
        name = CivilTimeCli.NAME,
        version = CivilTimeCli.VERSION,
        subcommands = {HelpCommand.class},
        mixinStandardHelpOptions = true
)
class CivilTimeCli {

    public static final String NAME = "civiltime";
    public static final String VERSION = "2026-10-18";

    /** Exit code for arguments that are not valid timestamps or numbers. */
    public static final int INVALID_INPUT = 1;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new CivilTimeCli())
                .setUsageHelpAutoWidth(true);
    }

    @Spec
    CommandSpec spec;

    @Option(names = {"--no-leap-seconds"},
            description = "Reject timestamps whose seconds field is 60 or more.",
            scope = CommandLine.ScopeType.INHERIT)
    boolean noLeapSeconds;

    @Command(name = "normalize",
            description = "print each TIMESTAMP in UTC",
            mixinStandardHelpOptions = true)
    int normalize(@Parameters(paramLabel = "TIMESTAMP", arity = "1..*") String... texts) {
        TimestampReader reader = newReader();
        for (String text : texts) {
            try {
                out().println(reader.read(text).toZString());
            } catch (CivilTimeException e) {
                return invalid(e);
            }
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "inspect",
            description = "print the UTC-relative fields and the local and UTC views of each TIMESTAMP",
            mixinStandardHelpOptions = true)
    int inspect(@Parameters(paramLabel = "TIMESTAMP", arity = "1..*") String... texts) {
        TimestampReader reader = newReader();
        for (String text : texts) {
            try {
                Timestamp ts = reader.read(text);
                Instant instant = ts.toInstant();
                out().println(instant
                        + " local=" + ts.getLocalDate() + "T" + ts.getLocalTimeOfDay()
                        + (ts.getLocalOffsetMinutes() == null ? "-00:00" : ts.getLocalOffset().toString())
                        + " utc=" + ts.getUtcDate() + "T" + ts.getUtcTimeOfDay() + "Z"
                        + " leapSecond=" + ts.inLeapSecond());
            } catch (CivilTimeException e) {
                return invalid(e);
            }
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "epoch",
            description = "print the seconds from 2000-01-01T00:00:00Z to each TIMESTAMP, ignoring leap seconds",
            mixinStandardHelpOptions = true)
    int epoch(@Parameters(paramLabel = "TIMESTAMP", arity = "1..*") String... texts) {
        TimestampReader reader = newReader();
        for (String text : texts) {
            try {
                out().println(reader.read(text).toEpochSeconds().toPlainString());
            } catch (CivilTimeException e) {
                return invalid(e);
            }
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "from-epoch",
            description = "print the UTC timestamp that is SECONDS from 2000-01-01T00:00:00Z",
            mixinStandardHelpOptions = true)
    int fromEpoch(@Parameters(paramLabel = "SECONDS", arity = "1..*") String... values) {
        for (String value : values) {
            BigDecimal seconds;
            try {
                seconds = new BigDecimal(value);
            } catch (NumberFormatException e) {
                err().println("invalid number of seconds: " + value);
                return INVALID_INPUT;
            }
            try {
                out().println(Timestamp.fromEpochSeconds(seconds));
            } catch (InvalidInstantException e) {
                err().println(e.getMessage());
                return INVALID_INPUT;
            }
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "diff",
            description = "print END minus START in seconds, ignoring leap seconds",
            mixinStandardHelpOptions = true)
    int diff(@Parameters(index = "0", paramLabel = "END") String end,
             @Parameters(index = "1", paramLabel = "START") String start) {
        TimestampReader reader = newReader();
        try {
            BigDecimal seconds = Timestamp.subtract(reader.read(end), reader.read(start));
            out().println(seconds.toPlainString());
        } catch (CivilTimeException e) {
            return invalid(e);
        }
        return CommandLine.ExitCode.OK;
    }

    private TimestampReader newReader() {
        return TimestampReaderBuilder.standard()
                .withLeapSecondsAllowed(!noLeapSeconds)
                .build();
    }

    private int invalid(CivilTimeException e) {
        err().println(e.getKind() + ": " + e.getMessage());
        return INVALID_INPUT;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
