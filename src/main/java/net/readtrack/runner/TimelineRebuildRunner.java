package net.readtrack.runner;

import java.util.List;
import java.util.Locale;
import net.readtrack.application.timeline.RebuildSummary;
import net.readtrack.application.timeline.TimelineRebuildService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs a full timeline rebuild at startup when launched with {@code --timeline.rebuild}.
 * Add {@code --timeline.rebuild.resume} to continue after an interrupted run.
 */
@Component
public class TimelineRebuildRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(TimelineRebuildRunner.class);

    static final String REBUILD_OPTION = "timeline.rebuild";
    static final String RESUME_OPTION = "timeline.rebuild.resume";

    private final ApplicationArguments arguments;
    private final TimelineRebuildService timelineRebuildService;

    public TimelineRebuildRunner(ApplicationArguments arguments, TimelineRebuildService timelineRebuildService) {
        this.arguments = arguments;
        this.timelineRebuildService = timelineRebuildService;
    }

    @Override
    public void run(String... args) {
        if (!arguments.containsOption(REBUILD_OPTION)) {
            return;
        }
        boolean resume = parseFlag(RESUME_OPTION);
        log.info("Starting timeline rebuild from the command line (resume={}).", resume);
        RebuildSummary summary = timelineRebuildService.rebuildAll(resume);
        log.info("Timeline rebuild finished: scanned={}, updated={}, orphaned={}, errors={}, cancelled={}",
            summary.scanned(), summary.updated(), summary.orphaned(), summary.errors(), summary.cancelled());
    }

    private boolean parseFlag(String option) {
        if (!arguments.containsOption(option)) {
            return false;
        }
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String raw = values.get(0).trim().toLowerCase(Locale.ROOT);
        if (raw.equals("true") || raw.isEmpty()) {
            return true;
        }
        if (raw.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for --" + option + ": " + values.get(0));
    }
}
