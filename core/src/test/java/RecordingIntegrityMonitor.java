import io.github.flameyossnowy.skeletal.api.integrity.IntegrityMonitor;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

class RecordingIntegrityMonitor implements IntegrityMonitor {
    final List<IntegrityWarning> warnings = new ArrayList<>();

    @Override
    public synchronized void report(@NotNull IntegrityWarning warning) {
        warnings.add(warning);
    }

    synchronized boolean has(IntegrityWarning.Type type) {
        for (IntegrityWarning warning : warnings) {
            if (warning.type() == type) return true;
        }
        return false;
    }
}
