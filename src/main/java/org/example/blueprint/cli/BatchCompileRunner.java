package org.example.blueprint.cli;

import org.example.blueprint.model.BatchConfigSnapshot;
import org.example.blueprint.model.BatchState;
import org.example.blueprint.model.BatchSummary;
import org.example.blueprint.model.BatchSummary.JobFailure;
import org.example.blueprint.service.BatchCompilationService;
import org.example.blueprint.service.BatchResumeService;
import org.example.blueprint.service.BatchStatePersistenceException;
import org.example.blueprint.service.BatchStateStore;
import org.example.blueprint.service.BatchStateUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Command-line entry point for batch compilation of character seeds.
 *
 * Run with: java -jar target/blueprint-batch.jar --input seeds.txt [--concurrency 3] [--continue-on-error]
 * Resume:   java -jar target/blueprint-batch.jar --resume [--batch-id <id>]
 */
@Component
public class BatchCompileRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchCompileRunner.class);

    private static final String HELP_FLAG = "--help";
    private static final String INPUT_FLAG = "--input";
    private static final String RESUME_FLAG = "--resume";
    private static final String BATCH_ID_FLAG = "--batch-id";
    private static final String CONTINUE_ON_ERROR_FLAG = "--continue-on-error";
    private static final String CONCURRENCY_FLAG = "--concurrency";
    private static final String RATE_LIMIT_FLAG = "--rate-limit";
    private static final String MAX_RETRIES_FLAG = "--max-retries";
    private static final String MODE_FLAG = "--mode";
    private static final String MODEL_FLAG = "--model";
    private static final String CLEAN_FLAG = "--clean-batch-state";
    private static final String DAYS_FLAG = "--days";
    private static final String LIST_FLAG = "--list";

    private static final Set<String> BOOLEAN_FLAGS = Set.of(
            HELP_FLAG, RESUME_FLAG, CONTINUE_ON_ERROR_FLAG, CLEAN_FLAG, LIST_FLAG
    );

    private static final Set<String> VALUE_OPTIONS = Set.of(
            INPUT_FLAG, BATCH_ID_FLAG, CONCURRENCY_FLAG, RATE_LIMIT_FLAG, MAX_RETRIES_FLAG,
            MODE_FLAG, MODEL_FLAG, DAYS_FLAG
    );

    private final BatchCompilationService compilationService;
    private final BatchResumeService resumeService;
    private final BatchStateStore stateStore;
    private final int defaultConcurrency;
    private final double defaultCallsPerSecond;
    private final int defaultMaxRetries;
    private final boolean defaultContinueOnError;
    private final int defaultRetentionDays;
    private final long shutdownGraceSeconds;

    private int exitCode;

    public BatchCompileRunner(
            BatchCompilationService compilationService,
            BatchResumeService resumeService,
            BatchStateStore stateStore,
            @Value("${batch.concurrency:3}") int defaultConcurrency,
            @Value("${batch.rate-limit.calls-per-second:1.0}") double defaultCallsPerSecond,
            @Value("${batch.max-retries:3}") int defaultMaxRetries,
            @Value("${batch.continue-on-error:false}") boolean defaultContinueOnError,
            @Value("${batch.state.retention-days:7}") int defaultRetentionDays,
            @Value("${batch.cli.shutdown-grace-seconds:120}") long shutdownGraceSeconds) {
        this.compilationService = compilationService;
        this.resumeService = resumeService;
        this.stateStore = stateStore;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultCallsPerSecond = defaultCallsPerSecond;
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultContinueOnError = defaultContinueOnError;
        this.defaultRetentionDays = defaultRetentionDays;
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args, PrintStream out, PrintStream err) {
        ParsedArgs parsed;
        try {
            parsed = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Argument error: " + e.getMessage());
            printUsage(err);
            return 1;
        }

        if (parsed.flags().contains(HELP_FLAG) || parsed.isEmpty()) {
            printUsage(out);
            return 0;
        }

        try {
            if (parsed.flags().contains(CLEAN_FLAG)) {
                int days = parsed.optionValue(DAYS_FLAG).map(Integer::parseInt).orElse(defaultRetentionDays);
                int deleted = stateStore.cleanup(Duration.ofDays(Math.max(0, days)));
                out.println("Cleaned up " + deleted + " old batch state file(s)");
                return 0;
            }
            if (parsed.flags().contains(LIST_FLAG)) {
                printStates(stateStore.listStates(), out);
                return 0;
            }
            if (parsed.flags().contains(RESUME_FLAG)) {
                return resume(parsed, out, err);
            }
            return startNew(parsed, out, err);
        } catch (NumberFormatException e) {
            err.println("Argument error: expected a number (" + e.getMessage() + ")");
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Argument error: " + e.getMessage());
            return 1;
        } catch (BatchStateUnavailableException e) {
            err.println("Cannot resume: " + e.getMessage());
            return 1;
        } catch (BatchStatePersistenceException e) {
            err.println("Batch state could not be saved: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return 1;
        }
    }

    private int startNew(ParsedArgs parsed, PrintStream out, PrintStream err) throws IOException {
        Path inputPath = parsed.optionValue(INPUT_FLAG)
                .map(Path::of)
                .orElseThrow(() -> new IllegalArgumentException("--input <file> is required (or use --resume)"));
        if (!Files.isRegularFile(inputPath)) {
            err.println("Input file not found: " + inputPath);
            return 1;
        }
        List<String> seeds = readSeeds(inputPath);
        if (seeds.isEmpty()) {
            err.println("No seeds found in " + inputPath);
            return 1;
        }

        BatchConfigSnapshot config = new BatchConfigSnapshot(
                parsed.optionValue(CONCURRENCY_FLAG).map(Integer::parseInt).orElse(defaultConcurrency),
                parsed.optionValue(RATE_LIMIT_FLAG).map(Double::parseDouble).orElse(defaultCallsPerSecond),
                parsed.optionValue(MAX_RETRIES_FLAG).map(Integer::parseInt).orElse(defaultMaxRetries),
                parsed.flags().contains(CONTINUE_ON_ERROR_FLAG) || defaultContinueOnError,
                parsed.optionValue(MODE_FLAG).orElse(null),
                parsed.optionValue(MODEL_FLAG).orElse(null)
        );

        out.println("Batch compiling " + seeds.size() + " seeds");
        out.println("  Mode: " + Optional.ofNullable(config.mode()).orElse("Auto"));
        out.println("  Concurrency: " + config.concurrency() + ", rate limit: " + config.callsPerSecond() + "/s");
        out.println("  Continue on error: " + config.continueOnError());

        BatchSummary summary = compilationService.startBatch(seeds, config, inputPath.toAbsolutePath().toString());
        printSummary(summary, out);
        return summary.allSucceeded() ? 0 : 1;
    }

    private int resume(ParsedArgs parsed, PrintStream out, PrintStream err) throws IOException {
        BatchState state = parsed.optionValue(BATCH_ID_FLAG)
                .map(resumeService::loadState)
                .orElseGet(resumeService::loadMostRecentResumable);

        Optional<Path> inputPath = parsed.optionValue(INPUT_FLAG).map(Path::of)
                .or(() -> Optional.ofNullable(state.getInputFile()).map(Path::of));
        if (inputPath.isEmpty()) {
            err.println("Cannot resume: batch " + state.getBatchId() + " has no recorded input file; pass --input <file>");
            return 1;
        }
        if (!Files.isRegularFile(inputPath.get())) {
            err.println("Original input file not found: " + inputPath.get());
            return 1;
        }

        List<String> seeds = readSeeds(inputPath.get());
        out.println("Resuming batch: " + state.getBatchId());
        out.println("  Started: " + state.getStartTime());
        out.println("  Progress: " + state.getSucceededCount() + "/" + state.getTotalJobCount() + " completed");
        out.println("  Failed: " + state.getFailedCount());
        out.println("  Remaining: " + state.remainingInputs(seeds).size() + " seeds");

        BatchSummary summary = resumeService.resume(state, seeds);
        printSummary(summary, out);
        return summary.allSucceeded() ? 0 : 1;
    }

    static List<String> readSeeds(Path inputPath) throws IOException {
        return Files.readAllLines(inputPath, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Runs on context close (Ctrl-C goes through Spring Boot's shutdown hook), before any bean is
     * destroyed: stop dispatching and give in-flight jobs the grace period to be recorded.
     */
    @EventListener(ContextClosedEvent.class)
    public void cancelActiveBatches() {
        Set<String> active = compilationService.activeBatchIds();
        if (active.isEmpty()) {
            return;
        }
        active.forEach(compilationService::cancel);
        log.warn("Shutdown requested; waiting up to {}s for in-flight jobs of {} batch(es) to be recorded",
                shutdownGraceSeconds, active.size());
        long deadline = System.currentTimeMillis() + shutdownGraceSeconds * 1000L;
        while (!compilationService.activeBatchIds().isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(100L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (!compilationService.activeBatchIds().isEmpty()) {
            log.warn("Grace period elapsed with jobs still in flight; they stay unrecorded and will rerun on resume");
        }
    }

    private static void printSummary(BatchSummary summary, PrintStream out) {
        out.println("");
        out.println("============================================================");
        out.println("Batch " + summary.batchId() + " " + summary.status().name().toLowerCase());
        out.println("  Succeeded: " + summary.succeeded() + "/" + summary.total());
        out.println("  Failed: " + summary.failed());
        out.println("  Skipped: " + summary.skipped());
        if (!summary.failures().isEmpty()) {
            out.println("");
            out.println("Failed (" + summary.failures().size() + "):");
            for (JobFailure failure : summary.failures()) {
                String seed = failure.input().length() > 60 ? failure.input().substring(0, 60) + "..." : failure.input();
                out.println("  - " + seed + " -> [" + failure.kind().name().toLowerCase() + ", "
                        + failure.attempts() + " attempt(s)] " + failure.errorMessage());
            }
        }
        if (summary.skipped() > 0) {
            out.println("");
            out.println("Resume with: --resume --batch-id " + summary.batchId());
        }
    }

    private static void printStates(List<BatchState> states, PrintStream out) {
        if (states.isEmpty()) {
            out.println("No saved batch states");
            return;
        }
        for (BatchState state : states) {
            out.println(state.getBatchId() + "  " + state.getStatus().name().toLowerCase()
                    + "  started " + state.getStartTime()
                    + "  " + state.getSucceededCount() + "/" + state.getTotalJobCount() + " completed, "
                    + state.getFailedCount() + " failed");
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  blueprint-batch --input <seeds.txt> [--concurrency <n>] [--rate-limit <calls/sec>] [--max-retries <n>]");
        out.println("                  [--continue-on-error] [--mode <mode>] [--model <model>]");
        out.println("  blueprint-batch --resume [--batch-id <id>] [--input <seeds.txt>]");
        out.println("  blueprint-batch --list");
        out.println("  blueprint-batch --clean-batch-state [--days <n>]");
        out.println("");
        out.println("Notes:");
        out.println("  Seed files hold one seed per line; blank lines are ignored.");
        out.println("  --resume without --batch-id picks the most recent unfinished batch.");
        out.println("  --rate-limit 0 disables rate limiting.");
    }

    static ParsedArgs parseArgs(String[] args) {
        Map<String, String> values = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        if (args == null) {
            return new ParsedArgs(values, flags);
        }

        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (token.startsWith("--spring.") || token.startsWith("--logging.")) {
                continue;
            }
            if (!token.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + token);
            }
            String option = token;
            String value = null;
            int equalsIndex = token.indexOf('=');
            if (equalsIndex > 0) {
                option = token.substring(0, equalsIndex);
                value = token.substring(equalsIndex + 1);
            }

            if (BOOLEAN_FLAGS.contains(option)) {
                if (value != null) {
                    throw new IllegalArgumentException(option + " does not take a value");
                }
                flags.add(option);
            } else if (VALUE_OPTIONS.contains(option)) {
                if (value == null) {
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        throw new IllegalArgumentException(option + " requires a value");
                    }
                    value = args[++i];
                }
                values.put(option, value);
            } else {
                throw new IllegalArgumentException("Unsupported option: " + option);
            }
        }
        return new ParsedArgs(values, flags);
    }

    record ParsedArgs(Map<String, String> values, Set<String> flags) {

        Optional<String> optionValue(String key) {
            return Optional.ofNullable(values.get(key));
        }

        boolean isEmpty() {
            return values.isEmpty() && flags.isEmpty();
        }
    }
}
