package microbench.util;

import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;

import java.io.IOException;

/**
 * Forked benchmark with a small fixed heap; the combiner allocates per message only.
 */
@Fork(AbstractMicrobenchmark.DEFAULT_FORKS) public abstract class AbstractMicrobenchmark
    extends AbstractMicrobenchmarkBase {
    protected static final int DEFAULT_FORKS = 1;

    private final String[] jvmArgs;

    public AbstractMicrobenchmark() {
        this(false);
    }

    public AbstractMicrobenchmark(boolean disableAssertions) {
        String[] customArgs = new String[] {"-Xms256m", "-Xmx256m"};
        String[] args = new String[BASE_JVM_ARGS.length + customArgs.length];
        System.arraycopy(BASE_JVM_ARGS, 0, args, 0, BASE_JVM_ARGS.length);
        System.arraycopy(customArgs, 0, args, BASE_JVM_ARGS.length, customArgs.length);
        this.jvmArgs = disableAssertions ? withoutAssertions(args) : args;
    }

    @Override protected String[] jvmArgs() {
        return jvmArgs;
    }

    @Override protected ChainedOptionsBuilder newOptionsBuilder() throws IOException {
        ChainedOptionsBuilder runnerOptions = super.newOptionsBuilder();
        int forks = intProperty("forks");
        if (forks > 0) {
            runnerOptions.forks(forks);
        }
        return runnerOptions;
    }
}
