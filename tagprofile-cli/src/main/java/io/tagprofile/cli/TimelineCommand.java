package io.tagprofile.cli;

import io.tagprofile.core.model.TimelineEvent;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "timeline", description = "Show the most recent timeline events of a user")
public final class TimelineCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "Number of events to show (default: ${DEFAULT-VALUE})")
    int limit;

    public TimelineCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (limit < 1) {
                throw new IllegalArgumentException("--limit must be >= 1");
            }
            List<TimelineEvent> events = context.profileService().getTimeline(userId);
            List<TimelineEvent> recent = events.subList(Math.max(0, events.size() - limit), events.size());
            if (recent.isEmpty()) {
                System.out.println("No timeline events for " + userId);
            }
            for (TimelineEvent event : recent) {
                String categories = event.extractedTags().entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue().size())
                    .collect(Collectors.joining(", "));
                System.out.println(event.timestamp() + " " + event.eventType() + " [" + categories + "]");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Timeline failed: " + e.getMessage());
            return 1;
        }
    }
}
