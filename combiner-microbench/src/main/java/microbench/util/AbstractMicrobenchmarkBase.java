package microbench.util;

import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

/**
 * Base of the combiner benchmarks. Each benchmark class is also a TestNG test whose
 * {@link #run()} launches JMH for that class only.
 * <p>
 * Tuning through system properties: {@code warmupIterations}, {@code measureIterations},
 * {@code forks} and {@code perfReportDir} (JSON results, one file per class).
 */
@Warmup(iterations = AbstractMicrobenchmarkBase.DEFAULT_WARMUP_ITERATIONS)
@Measurement(iterations = AbstractMicrobenchmarkBase.DEFAULT_MEASURE_ITERATIONS)
@State(Scope.Thread) public abstract class AbstractMicrobenchmarkBase {
    protected static final int DEFAULT_WARMUP_ITERATIONS = 5;
    protected static final int DEFAULT_MEASURE_ITERATIONS = 5;
    protected static final String[] BASE_JVM_ARGS =
        {"-server", "-dsa", "-da", "-XX:+OptimizeStringConcat", "-XX:+HeapDumpOnOutOfMemoryError"};

    protected ChainedOptionsBuilder newOptionsBuilder() throws IOException {
        String className = getClass().getSimpleName();

        ChainedOptionsBuilder runnerOptions =
            new OptionsBuilder().include(".*" + className + ".*").jvmArgs(jvmArgs());

        int warmupIterations = intProperty("warmupIterations");
        if (warmupIterations > 0) {
            runnerOptions.warmupIterations(warmupIterations);
        }
        int measureIterations = intProperty("measureIterations");
        if (measureIterations > 0) {
            runnerOptions.measurementIterations(measureIterations);
        }

        String reportDir = System.getProperty("perfReportDir");
        if (reportDir != null) {
            File report = new File(reportDir, className + ".json");
            if (!report.getParentFile().isDirectory() && !report.getParentFile().mkdirs()) {
                throw new IOException("cannot create report directory " + reportDir);
            }
            runnerOptions.resultFormat(ResultFormatType.JSON);
            runnerOptions.result(report.getPath());
        }
        return runnerOptions;
    }

    protected abstract String[] jvmArgs();

    protected static String[] withoutAssertions(String[] jvmArgs) {
        return Arrays.stream(jvmArgs).filter(arg -> !arg.startsWith("-ea")).toArray(String[]::new);
    }

    protected static int intProperty(String name) {
        return Integer.parseInt(System.getProperty(name, "-1").trim());
    }

    @Test public void run() throws Exception {
        new Runner(newOptionsBuilder().build()).run();
    }
}
