package io.tagprofile.cli;

import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.model.UserProfile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "apply", description = "Apply an observation batch to a user's profile")
public final class ApplyCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    @Option(names = {"-f", "--file"}, required = true, description = "JSON file with observations keyed by category")
    Path file;

    public ApplyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, List<TagObservation>> batch = context.observationSource().extract(Files.readString(file));
            UserProfile profile = context.profileService().applyObservations(userId, batch);
            int observations = batch.values().stream().mapToInt(List::size).sum();
            System.out.println("Applied " + observations + " observations to " + profile.userId());
            System.out.println("Interactions: " + profile.totalInteractions());
            System.out.println("Maturity: " + String.format(Locale.ROOT, "%.2f", profile.profileMaturity()));
            return 0;
        } catch (Exception e) {
            System.err.println("Apply failed: " + e.getMessage());
            return 1;
        }
    }
}
