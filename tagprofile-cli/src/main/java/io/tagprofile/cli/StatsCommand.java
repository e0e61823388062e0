package io.tagprofile.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "stats", description = "Show profile statistics of a user")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(CliJson.pretty(context.profileService().stats(userId)));
            return 0;
        } catch (Exception e) {
            System.err.println("Stats failed: " + e.getMessage());
            return 1;
        }
    }
}
