package software.amazon.event.automaton.jmh;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Timeout;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import software.amazon.event.automaton.Configuration;
import software.amazon.event.automaton.FieldMatcher;
import software.amazon.event.automaton.Patterns;
import software.amazon.event.automaton.ValueMatcher;

import java.nio.charset.StandardCharsets;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Compares nondeterministic traversal with traversal of the determinized automaton over the same patterns.
 */
@BenchmarkMode(Mode.Throughput)
@Fork(value = 2, jvmArgsAppend = { "-Xmx2g", "-Xms2g", "-XX:+UseSerialGC" })
@Timeout(time = 90, timeUnit = SECONDS)
@OperationsPerInvocation(TraversalJmhBenchmarks.VALUE_COUNT)
public class TraversalJmhBenchmarks {

    static final int VALUE_COUNT = 1000;

    @State(Scope.Benchmark)
    public static class Matchers {

        ValueMatcher nfa;
        ValueMatcher dfa;
        byte[][] values;

        @Setup(Level.Trial)
        public void setup() {
            nfa = build(Configuration.builder().withDeterminization(false).build());
            dfa = build(Configuration.builder().build());
            values = new byte[VALUE_COUNT][];
            for (int i = 0; i < VALUE_COUNT; i++) {
                String value = "\"" + "/var/log/service-" + (i % 37) + "/part-" + i + (i % 3 == 0 ? ".json" : ".gz") + "\"";
                values[i] = value.getBytes(StandardCharsets.UTF_8);
            }
        }

        private static ValueMatcher build(Configuration configuration) {
            ValueMatcher matcher = new ValueMatcher(configuration);
            matcher.addPattern(Patterns.shellStyleMatch("\"*.json\""), new FieldMatcher("json"));
            matcher.addPattern(Patterns.wildcardMatch("\"/var/*/service-1*\""), new FieldMatcher("service-1"));
            matcher.addPattern(Patterns.regexpMatch("/var/log/[a-z]+-[0-9]+/part-[0-9]{1,3}~.gz"),
                    new FieldMatcher("short-gz"));
            matcher.addPattern(Patterns.prefixMatch("\"/var/log/\""), new FieldMatcher("logs"));
            matcher.addPattern(Patterns.equalsIgnoreCaseMatch("\"/VAR/LOG\""), new FieldMatcher("root"));
            return matcher;
        }
    }

    @Benchmark
    @Warmup(iterations = 3, batchSize = 1, time = 10, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 10, timeUnit = SECONDS)
    public void nondeterministic(Matchers matchers, Blackhole blackhole) {
        run(matchers.nfa, matchers.values, blackhole);
    }

    @Benchmark
    @Warmup(iterations = 3, batchSize = 1, time = 10, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 10, timeUnit = SECONDS)
    public void determinized(Matchers matchers, Blackhole blackhole) {
        run(matchers.dfa, matchers.values, blackhole);
    }

    private void run(ValueMatcher matcher, byte[][] values, Blackhole blackhole) {
        for (byte[] value : values) {
            blackhole.consume(matcher.transitionOn(value));
        }
    }
}
