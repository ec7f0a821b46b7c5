package io.github.flameyossnowy.skeletal.api.integrity;

import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicLong;

public class LoggingIntegrityMonitor implements IntegrityMonitor {
    private final AtomicLong reported = new AtomicLong();

    @Override
    public void report(@NotNull IntegrityWarning warning) {
        reported.incrementAndGet();
        Logging.critical("Detected database corruption! " + warning);
    }

    public long reportedCount() {
        return reported.get();
    }
}
