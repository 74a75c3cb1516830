package io.tierkeeper;

import io.tierkeeper.cli.TierKeeperCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TierKeeperCommand()).execute(args);
        System.exit(code);
    }
}
