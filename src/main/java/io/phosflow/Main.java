package io.phosflow;

import io.phosflow.cli.PhosFlowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PhosFlowCommand()).execute(args);
        System.exit(code);
    }
}
