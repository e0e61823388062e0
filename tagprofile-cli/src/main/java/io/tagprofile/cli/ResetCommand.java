package io.tagprofile.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "reset", description = "Replace a user's profile with an empty one, keeping the timeline")
public final class ResetCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    public ResetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.profileService().reset(userId);
            System.out.println("Reset profile: " + userId);
            return 0;
        } catch (Exception e) {
            System.err.println("Reset failed: " + e.getMessage());
            return 1;
        }
    }
}
