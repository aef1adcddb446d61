package com.askbetter.dispatch.cli;

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * ANSI-aware terminal output for the interactive parts of the CLI. Everything here
 * goes to the error stream; standard output carries only the JSON document.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void prompt(PrintWriter err, String message) {
        err.print(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(cyan) " + message + "|@"));
        err.flush();
    }

    public static void warn(PrintWriter err, String message) {
        err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
        err.flush();
    }
}
