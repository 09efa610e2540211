package io.settingstree.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.settingstree.core.binding.BindingParser;
import io.settingstree.core.binding.BindingRegistry;
import io.settingstree.core.binding.IncludeResolver;
import io.settingstree.core.config.DiagnosticKind;
import io.settingstree.core.config.Diagnostics;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.SourceKind;
import io.settingstree.core.source.HardwareTreeReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.slf4j.LoggerFactory;

/** Tests for {@link PartialTree} built from hardware descriptions. */
@DisplayName("PartialTree (hardware)")
class HardwareTreeTest {

    private static Path fixturePath(String relative) {
        return Path.of("src/test/resources/" + relative);
    }

    private static TreeOptions boardOptions() {
        return TreeOptions.builder().bindingDirs(List.of(fixturePath("bindings/hardware"))).build();
    }

    private static PartialTree inline(String yaml, TreeOptions options) {
        PartialTree tree = new PartialTree(
                SourceKind.HARDWARE, HardwareTreeReader.read(yaml, "inline.yaml"), BindingRegistry.empty(), options);
        tree.process();
        return tree;
    }

    @Nested
    @DisplayName("Board fixture")
    @TestInstance(TestInstance.Lifecycle.PER_CLASS)
    class Board {

        private PartialTree board;

        @BeforeAll
        void load() {
            board = PartialTree.fromBindingDirs(
                    SourceKind.HARDWARE, HardwareTreeReader.read(fixturePath("trees/board.yaml")), boardOptions());
            board.process();
        }

        @Test
        @DisplayName("bindings are matched by compatible")
        void matchesBindings() {
            PartialTreeNode intc = board.node("/soc/interrupt-controller@100");

            assertThat(intc.matchingSchemas()).containsExactly("vnd,intc");
            assertThat(intc.bindingOrigins()).singleElement().asString().endsWith("vnd,intc.yaml");
            assertThat(intc.specifierCells("interrupt")).containsExactly("irq", "priority");
            assertThat(board.node("/soc").bindings()).isEmpty();
        }

        @Test
        @DisplayName("registers are read with the parent cell sizes")
        void registers() {
            assertThat(board.node("/soc/gpio@1000").registers())
                    .containsExactly(new Register(null, 0x1000L, 0x100L));
            assertThat(board.node("/soc/i2c@2000/sensor@76").registers())
                    .containsExactly(new Register(null, 0x76L, null));
            assertThat(board.node("/soc/gpio@1000").unitAddress()).isEqualTo(0x1000L);
        }

        @Test
        @DisplayName("interrupts are resolved through interrupt-parent and named by the controller binding")
        void interrupts() {
            PartialTreeNode gpio = board.node("/soc/gpio@1000");
            PartialTreeNode intc = board.node("/soc/interrupt-controller@100");

            assertThat(gpio.interrupts()).singleElement().satisfies(interrupt -> {
                assertThat(interrupt.controller()).isSameAs(intc);
                assertThat(interrupt.data()).containsExactly(Map.entry("irq", 6L), Map.entry("priority", 1L));
                assertThat(interrupt.basename()).isEqualTo("interrupt");
                assertThat(interrupt.nodePath()).isEqualTo("/soc/gpio@1000");
            });
            assertThat(gpio.sourceDependencies()).containsExactly(intc);
        }

        @Test
        @DisplayName("a node on a bus picks the bus-specific binding variant")
        void busVariant() {
            PartialTreeNode sensor = board.node("/soc/i2c@2000/sensor@76");
            PartialTreeNode aux = board.node("/sensor@9000");

            assertThat(sensor.busNode().path()).isEqualTo("/soc/i2c@2000");
            assertThat(sensor.onBuses()).containsExactly("i2c");
            assertThat(sensor.bindings()).singleElement().satisfies(b -> assertThat(b.variant()).isEqualTo("i2c"));
            assertThat(sensor.property("mode").asString()).isEqualTo("normal");

            assertThat(aux.onBuses()).isEmpty();
            assertThat(aux.bindings()).singleElement().satisfies(b -> assertThat(b.variant()).isNull());
            assertThat(aux.property("mode")).isNull();
        }

        @Test
        @DisplayName("status drives enablement")
        void status() {
            assertThat(board.node("/sensor@9000").enabled()).isFalse();
            assertThat(board.node("/sensor@9000").status()).isEqualTo("disabled");
            assertThat(board.node("/soc/gpio@1000").enabled()).isTrue();
            assertThat(board.node("/soc/gpio@1000").status()).isEqualTo("okay");
        }

        @Test
        @DisplayName("phandle-array properties resolve to controller and named cells")
        void phandleArray() {
            PartialTreeNode led = board.node("/leds/led_0");

            List<ControllerAndData> gpios = led.property("gpios").asSpecifiers();
            assertThat(gpios).singleElement().satisfies(element -> {
                assertThat(element.controller().path()).isEqualTo("/soc/gpio@1000");
                assertThat(element.data()).containsExactly(Map.entry("pin", 13L), Map.entry("flags", 1L));
                assertThat(element.basename()).isEqualTo("gpio");
            });
            assertThat(led.property("label").asString()).isEqualTo("Green LED");
        }

        @Test
        @DisplayName("defaults apply and explicit values win")
        void defaults() {
            PartialTreeNode i2c = board.node("/soc/i2c@2000");

            assertThat(i2c.property("clock-frequency").asLong()).isEqualTo(400000L);
            assertThat(i2c.buses()).containsExactly("i2c");
            assertThat(board.node("/soc/gpio@1000").property("gpio-controller").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("unbound nodes get the generic property types")
        void defaultSpecs() {
            PartialTreeNode soc = board.node("/soc");

            assertThat(soc.property("compatible").asStrings()).containsExactly("simple-bus");
            assertThat(soc.property("ranges")).isNull();
            assertThat(board.root().property("compatible").asStrings()).containsExactly("vnd,board");
            assertThat(board.root().property("model")).isNull();
        }

        @Test
        @DisplayName("labels map to their nodes")
        void labels() {
            assertThat(board.labels()).containsKeys("intc", "gpio0", "i2c0", "bme", "aux", "led0");
            assertThat(board.labels().get("bme").path()).isEqualTo("/soc/i2c@2000/sensor@76");
            assertThat(board.node("/soc/gpio@1000").labels()).containsExactly("gpio0");
        }

        @Test
        @DisplayName("only schemas used by the tree are loaded")
        void usedSchemas() {
            assertThat(board.binding("vnd,gpio", null)).isNotNull();
            assertThat(board.binding("vnd,sensor", "i2c")).isNotNull();
            assertThat(board.binding("vnd,i2c", null)).isNotNull();
            assertThat(board.binding("vnd,board", null)).isNull();
        }
    }

    @Nested
    @DisplayName("Address translation")
    class Translation {

        @Test
        @DisplayName("registers are translated through parent ranges")
        void translatesThroughRanges() {
            PartialTree tree = inline("""
                    "#address-cells": 1
                    "#size-cells": 1
                    soc:
                      "#address-cells": 1
                      "#size-cells": 1
                      ranges: [0, 1073741824, 65536]
                      "uart@100":
                        reg: [256, 16, 512, 16]
                        reg-names: [data, control]
                    """, TreeOptions.defaults());

            assertThat(tree.node("/soc/uart@100").registers()).containsExactly(
                    new Register("data", 0x4000_0100L, 16L),
                    new Register("control", 0x4000_0200L, 16L));
            assertThat(tree.node("/soc").ranges())
                    .containsExactly(new AddressRange(1, 0L, 1, 0x4000_0000L, 1, 0x10000L));
        }

        @Test
        @DisplayName("reg must divide evenly into entries")
        void unevenReg() {
            assertThatThrownBy(() -> inline("""
                    "#address-cells": 1
                    "#size-cells": 1
                    "uart@100":
                      reg: [256, 16, 512]
                    """, TreeOptions.defaults()))
                    .isInstanceOf(PropertyException.class)
                    .hasMessageContaining("not evenly divisible by 2");
        }

        @Test
        @DisplayName("reg-names must match the number of registers")
        void regNamesCount() {
            assertThatThrownBy(() -> inline("""
                    "#address-cells": 1
                    "#size-cells": 1
                    "uart@100":
                      reg: [256, 16]
                      reg-names: [a, b]
                    """, TreeOptions.defaults()))
                    .isInstanceOf(PropertyException.class)
                    .hasMessageContaining("has 2 strings, expected 1 strings");
        }
    }

    @Nested
    @DisplayName("Register diagnostics")
    class RegisterDiagnostics {

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

        private static final String MISMATCH = """
                "#address-cells": 1
                "#size-cells": 1
                "uart@4000":
                  reg: [8192, 0]
                """;

        @Test
        @DisplayName("a unit address that differs from reg and a zero size are warnings")
        void warns() {
            inline(MISMATCH, TreeOptions.defaults());

            assertThat(logAppender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anyMatch(message -> message.startsWith("register-mismatch:")
                            && message.contains("don't match for /uart@4000"))
                    .anyMatch(message -> message.contains("zero-sized 'reg' in /uart@4000"));
        }

        @Test
        @DisplayName("escalated register diagnostics fail the tree")
        void escalated() {
            TreeOptions options = TreeOptions.builder().escalate(DiagnosticKind.REGISTER_MISMATCH).build();

            assertThatThrownBy(() -> inline(MISMATCH, options))
                    .isInstanceOf(PropertyException.class)
                    .hasMessageContaining("/uart@4000");
        }
    }

    @Nested
    @DisplayName("Node checks")
    class NodeChecks {

        @Test
        @DisplayName("a phandles list accepts raw phandle numbers next to labels")
        void numericPhandles() {
            BindingParser parser = new BindingParser(SourceKind.HARDWARE, IncludeResolver.none());
            BindingRegistry registry = BindingRegistry.builder()
                    .registerWithChildren(parser.resolve("""
                            description: Clock consumer
                            compatible: "vnd,consumer"
                            properties:
                              clocks:
                                type: phandles
                              clock:
                                type: phandle
                            """, "vnd,consumer.yaml"))
                    .build();
            PartialTree tree = new PartialTree(SourceKind.HARDWARE, HardwareTreeReader.read("""
                    "osc: oscillator":
                      phandle: 7
                    consumer:
                      compatible: "vnd,consumer"
                      clocks: ["&osc", 7]
                      clock: 7
                    """, "inline.yaml"), registry, TreeOptions.defaults());
            tree.process();

            PartialTreeNode consumer = tree.node("/consumer");
            PartialTreeNode oscillator = tree.node("/oscillator");
            assertThat(consumer.property("clocks").asNodes()).containsExactly(oscillator, oscillator);
            assertThat(consumer.property("clock").asNode()).isSameAs(oscillator);
        }

        @Test
        @DisplayName("an unknown status value is rejected")
        void unknownStatus() {
            TreeOptions options = TreeOptions.builder().defaultPropertyTypes(false).build();

            assertThatThrownBy(() -> inline("""
                    uart:
                      status: broken
                    """, options))
                    .isInstanceOf(PropertyException.class)
                    .hasMessageContaining("unknown 'status' value \"broken\" in /uart");
        }

        @Test
        @DisplayName("status 'ok' reads as 'okay'")
        void okStatus() {
            PartialTree tree = inline("""
                    uart:
                      status: ok
                    """, TreeOptions.defaults());

            assertThat(tree.node("/uart").status()).isEqualTo("okay");
            assertThat(tree.node("/uart").enabled()).isTrue();
        }

        @Test
        @DisplayName("a binding is inferred from the properties of configured paths")
        void inferredBinding() {
            TreeOptions options = TreeOptions.builder().inferBindingForPaths(List.of("/chosen")).build();
            PartialTree tree = inline("""
                    "console: uart": {}
                    chosen:
                      stdout: "&console"
                      baud: 115200
                      banner: "hello"
                      windows: [1, 2]
                      quiet: true
                    """, options);

            PartialTreeNode chosen = tree.node("/chosen");
            assertThat(chosen.bindingOrigins()).containsExactly("<inferred>");
            assertThat(chosen.property("stdout").asNode().path()).isEqualTo("/uart");
            assertThat(chosen.property("baud").asLong()).isEqualTo(115200L);
            assertThat(chosen.property("banner").asString()).isEqualTo("hello");
            assertThat(chosen.property("windows").asLongs()).containsExactly(1L, 2L);
            assertThat(chosen.property("quiet").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("a node with an inferred binding may not carry a compatible")
        void inferredWithCompatible() {
            TreeOptions options = TreeOptions.builder().inferBindingForPaths(List.of("/chosen")).build();

            assertThatThrownBy(() -> inline("""
                    chosen:
                      compatible: "vnd,chosen"
                    """, options))
                    .isInstanceOf(PropertyException.class)
                    .hasMessageContaining("compatible in node with inferred binding: /chosen");
        }
    }
}
