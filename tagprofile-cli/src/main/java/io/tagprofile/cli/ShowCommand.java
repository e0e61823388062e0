package io.tagprofile.cli;

import io.tagprofile.core.model.DimensionSummary;
import io.tagprofile.core.model.UserProfile;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show a user's profile")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    @Option(names = "--json", description = "Print the full profile as JSON")
    boolean json;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            UserProfile profile = context.profileService().getProfile(userId);
            if (json) {
                System.out.println(CliJson.pretty(profile));
                return 0;
            }
            System.out.println("User: " + profile.userId());
            System.out.println("Interactions: " + profile.totalInteractions());
            System.out.println("Maturity: " + String.format(Locale.ROOT, "%.2f", profile.profileMaturity()));
            System.out.println("Last updated: " + profile.lastUpdated());
            if (profile.dimensionSummaries().isEmpty()) {
                System.out.println("No tags yet");
            }
            for (DimensionSummary summary : profile.dimensionSummaries()) {
                System.out.println(
                    summary.dimensionName() + "." + summary.subdimensionName() + ": " + summary.dominantTag()
                        + " (" + String.format(Locale.ROOT, "%.2f", summary.confidence()) + ", " + summary.tagCount() + " tags)"
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Show failed: " + e.getMessage());
            return 1;
        }
    }
}
