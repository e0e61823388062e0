package io.tagprofile.cli;

import picocli.CommandLine.Command;

@Command(name = "tagprofile", mixinStandardHelpOptions = true, description = "Per-user tag profile engine")
public final class TagProfileCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
