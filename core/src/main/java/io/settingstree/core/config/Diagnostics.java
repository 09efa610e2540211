package io.settingstree.core.config;

import io.settingstree.core.error.SettingsTreeException;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Routes non-fatal findings to the log or, when escalated, to an exception. */
public final class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final Set<DiagnosticKind> escalated;

    public Diagnostics(Set<DiagnosticKind> escalated) {
        Objects.requireNonNull(escalated, "escalated must not be null");
        this.escalated = escalated.isEmpty() ? EnumSet.noneOf(DiagnosticKind.class) : EnumSet.copyOf(escalated);
    }

    /** Diagnostics that never fail the build. */
    public static Diagnostics lenient() {
        return new Diagnostics(Set.of());
    }

    public boolean isEscalated(DiagnosticKind kind) {
        return escalated.contains(kind);
    }

    /**
     * Reports a finding.
     *
     * @param kind    the finding's kind
     * @param message human-readable description
     * @param error   builds the exception thrown when {@code kind} is escalated
     */
    public void report(DiagnosticKind kind, String message, Supplier<? extends SettingsTreeException> error) {
        if (escalated.contains(kind)) {
            throw error.get();
        }
        LOG.warn("{}: {}", kind.optionName(), message);
    }
}
