package io.settingstree.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.settingstree.core.error.MergeException;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("Diagnostics")
class DiagnosticsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger diagnosticsLogger;

    @BeforeEach
    void setUp() {
        diagnosticsLogger = (Logger) LoggerFactory.getLogger(Diagnostics.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        diagnosticsLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        diagnosticsLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("a finding that is not escalated is logged as a warning")
    void loggedWhenNotEscalated() {
        Diagnostics.lenient().report(DiagnosticKind.UNKNOWN_VENDOR, "schema 'xyz,foo' has unknown vendor",
                () -> new MergeException("unused", "/"));

        assertThat(logAppender.list).hasSize(1);
        ILoggingEvent event = logAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).isEqualTo("unknown-vendor: schema 'xyz,foo' has unknown vendor");
    }

    @Test
    @DisplayName("an escalated finding throws and logs nothing")
    void thrownWhenEscalated() {
        Diagnostics diagnostics = new Diagnostics(Set.of(DiagnosticKind.UNKNOWN_VENDOR));

        assertThatThrownBy(() -> diagnostics.report(DiagnosticKind.UNKNOWN_VENDOR, "bad vendor",
                        () -> new MergeException("bad vendor", "/soc")))
                .isInstanceOf(MergeException.class)
                .hasMessage("bad vendor");
        assertThat(logAppender.list).isEmpty();
        assertThat(diagnostics.isEscalated(DiagnosticKind.DEPRECATED_PROPERTY)).isFalse();
    }

    @Test
    @DisplayName("option names are kebab case and round trip")
    void optionNames() {
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            assertThat(DiagnosticKind.fromOptionName(kind.optionName())).isSameAs(kind);
        }
        assertThat(DiagnosticKind.ENUM_NOT_TOKENIZABLE.optionName()).isEqualTo("enum-not-tokenizable");
    }
}
