package app;

import examples.build.BuildResult;
import examples.build.BuildStepRunner;
import examples.build.StepDefinition;
import examples.build.StepOutcome;
import examples.build.StepResult;
import fakedb.FakeStepsConnector;
import fakedb.StepModel;
import fakedb.UrlModel;
import fakedb.VirtualClock;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class App {
    private static final Pattern NUMBER_PATTERN = Pattern.compile("^[0-9]{1,10}$");
    private static final Pattern STEP_PATTERN = Pattern.compile("^[A-Za-z_-][A-Za-z0-9_-]{0,49}$");
    private static final Set<String> ALLOWED_OPTIONS = Set.of("build-id", "steps", "start-time", "step-seconds", "help");
    private static final String DEFAULT_STEPS = "checkout,compile,test,test";
    private static final long DEFAULT_STEP_SECONDS = 10L;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> argMap;
        int buildId;
        long startTime;
        long stepSeconds;
        List<String> stepNames;
        try {
            argMap = parseArgs(args);
            if (argMap.containsKey("help")) {
                printUsage(System.out);
                return;
            }
            buildId = (int) parseNumber("build-id", argMap.getOrDefault("build-id", "1"), Integer.MAX_VALUE);
            startTime = parseNumber("start-time", argMap.getOrDefault("start-time", "1304262222"), Long.MAX_VALUE);
            stepSeconds = parseNumber(
                    "step-seconds", argMap.getOrDefault("step-seconds", String.valueOf(DEFAULT_STEP_SECONDS)), 86_400L);
            stepNames = parseStepNames(argMap.getOrDefault("steps", DEFAULT_STEPS));
        } catch (IllegalArgumentException invalid) {
            System.err.println("Invalid arguments: " + invalid.getMessage());
            printUsage(System.err);
            throw invalid;
        }

        System.out.println("Build ID        : " + buildId);
        System.out.println("Start time      : " + startTime);
        System.out.println("Steps           : " + String.join(", ", stepNames));

        runBuild(buildId, startTime, stepSeconds, stepNames);
    }

    private static void runBuild(int buildId, long startTime, long stepSeconds, List<String> stepNames)
            throws Exception {
        VirtualClock clock = new VirtualClock(startTime);
        FakeStepsConnector steps = new FakeStepsConnector(clock);
        BuildStepRunner runner = new BuildStepRunner(steps, clock::seconds);

        List<StepDefinition> definitions = new ArrayList<>();
        for (String name : stepNames) {
            definitions.add(StepDefinition.of(name, stepId -> {
                clock.advance(stepSeconds);
                return StepOutcome.success(new UrlModel("log", "memory://steps/" + stepId + "/log"));
            }));
        }

        BuildResult result = runner.runAndWait(buildId, definitions);
        System.out.println("Build finished  : " + result.result().label());
        for (StepModel step : steps.getSteps(buildId).join()) {
            StepResult stepResult = StepResult.fromCode(step.results());
            System.out.printf("  #%d %-20s id=%d started=%s complete=%s result=%s urls=%d%n",
                    step.number(),
                    step.name(),
                    step.id(),
                    step.startedAt(),
                    step.completeAt(),
                    stepResult == null ? "<none>" : stepResult.label(),
                    step.urls().size());
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> parsed = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                parsed.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for argument: " + arg);
            }
            String key = arg.substring(2);
            if (!ALLOWED_OPTIONS.contains(key)) {
                throw new IllegalArgumentException("Unsupported argument: " + arg);
            }
            if (parsed.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate argument provided: " + arg);
            }

            String value = args[++i];
            if (value.length() > 512) {
                throw new IllegalArgumentException("Argument too long for " + arg);
            }
            if (containsControlChars(value)) {
                throw new IllegalArgumentException("Invalid control characters in " + arg);
            }
            parsed.put(key, value.trim());
        }
        return parsed;
    }

    static long parseNumber(String fieldName, String value, long max) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        if (!NUMBER_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid format for " + fieldName);
        }
        long parsed = Long.parseLong(value);
        if (parsed > max) {
            throw new IllegalArgumentException(fieldName + " exceeds max value " + max);
        }
        return parsed;
    }

    static List<String> parseStepNames(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("steps must not be blank");
        }
        List<String> names = new ArrayList<>();
        for (String raw : value.split(",")) {
            String name = raw.trim();
            if (!STEP_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid step name: " + name);
            }
            names.add(name);
        }
        return names;
    }

    private static boolean containsControlChars(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  mvn -q -pl app exec:java -Dexec.args=\"[options]\"");
        out.println();
        out.println("Options:");
        out.println("  --build-id <n>          Build the steps belong to (default: 1)");
        out.println("  --steps <a,b,...>       Step names, repeated names are disambiguated");
        out.println("  --start-time <epoch>    Virtual clock start in epoch seconds");
        out.println("  --step-seconds <n>      Virtual seconds each step takes (default: 10)");
    }
}
