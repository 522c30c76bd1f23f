package nl.infomedics.perio.metrics;

import java.time.Duration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Feature-flagged timers and counters around the records file and statistics.
 * Disabled by default; enable with diagnostics.metrics.enabled=true.
 */
@Component
public class DiagnosticsRecorder {

    public static final String RECORDS_LOAD = "perio.records.load";
    public static final String RECORDS_SAVE = "perio.records.save";
    public static final String RECORDS_SKIPPED = "perio.records.skipped";
    public static final String STATS_TALLY = "perio.stats.tally";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Autowired
    public DiagnosticsRecorder(ObjectProvider<MeterRegistry> registryProvider,
                               @Value("${diagnostics.metrics.enabled:false}") boolean enabled) {
        this(registryProvider.getIfAvailable(SimpleMeterRegistry::new), enabled);
    }

    public DiagnosticsRecorder(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    /** A recorder that records nothing. */
    public static DiagnosticsRecorder disabled() {
        return new DiagnosticsRecorder(new SimpleMeterRegistry(), false);
    }

    public SampleTimer start(String name, String... tags) {
        if (!enabled) {
            return SampleTimer.NOOP;
        }
        return new SampleTimer(name, Tags.of(tags), registry, true);
    }

    public void count(String name, long amount) {
        if (enabled && amount > 0) {
            registry.counter(name).increment(amount);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public static final class SampleTimer implements AutoCloseable {
        private static final SampleTimer NOOP = new SampleTimer(null, Tags.empty(), null, false);

        private final String name;
        private final Tags tags;
        private final MeterRegistry registry;
        private final long startNanos;
        private final boolean active;

        private SampleTimer(String name, Tags tags, MeterRegistry registry, boolean active) {
            this.name = name;
            this.tags = tags;
            this.registry = registry;
            this.startNanos = active ? System.nanoTime() : 0L;
            this.active = active;
        }

        @Override
        public void close() {
            if (!active) {
                return;
            }
            registry.timer(name, tags).record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
