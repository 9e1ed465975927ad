package io.sealrelay;

import io.sealrelay.cli.SealRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SealRelayCommand()).execute(args);
        System.exit(code);
    }
}
