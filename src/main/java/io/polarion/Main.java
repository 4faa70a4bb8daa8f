package io.polarion;

import io.polarion.cli.PolarionCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PolarionCommand()).execute(args);
        System.exit(code);
    }
}
