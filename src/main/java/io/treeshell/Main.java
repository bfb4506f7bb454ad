package io.treeshell;

import io.treeshell.cli.TreeShellCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TreeShellCommand()).execute(args);
        System.exit(code);
    }
}
