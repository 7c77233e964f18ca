package com.agentide.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) AGENTIDE v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [AGENTIDE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    public static void component(String component, String message) {
        System.out.println(ansi("@|fg(blue) [" + component + "]|@ " + message));
    }

    public static void review(String message) {
        System.out.println(ansi("@|bold,fg(magenta) [REVIEW]|@ " + message));
    }

    public static void fileChange(String artifactId) {
        System.out.println(ansi("  @|fg(green) ~|@ " + artifactId));
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
