package io.settingstree.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.settingstree.core.binding.BindingParser;
import io.settingstree.core.binding.BindingRegistry;
import io.settingstree.core.binding.IncludeResolver;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.SourceKind;
import io.settingstree.core.source.HardwareTreeReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SpecifierResolver")
class SpecifierResolverTest {

    private static final String GPIO_BINDING = """
            description: GPIO controller
            compatible: "vnd,gpio"
            properties:
              reg:
                type: array
              gpio-controller:
                type: boolean
            gpio-cells: [pin, flags]
            """;

    private static final String CTRL_BINDING = """
            description: Interrupt controller
            compatible: "vnd,ctrl"
            interrupt-cells: [irq, level]
            """;

    private static final String USER_BINDING = """
            description: Device using GPIOs and interrupts
            compatible: "vnd,user"
            properties:
              power-gpios:
                type: phandle-array
              interrupts:
                type: phandle-array
              interrupt-names:
                type: string-array
            """;

    private static final String CONTROLLERS = """
            "#address-cells": 1
            "#size-cells": 1
            "gpio0: gpio@100":
              compatible: "vnd,gpio"
              reg: [256, 16]
              gpio-controller: true
              "#gpio-cells": 2
            "conn: connector":
              "#gpio-cells": 2
              gpio-map: [0, 0, "&gpio0", 12, 0, 1, 0, "&gpio0", 14, 0]
              gpio-map-mask: [4294967295, 0]
              gpio-map-pass-thru: [0, 63]
            "ctrl: interrupt-controller":
              compatible: "vnd,ctrl"
              interrupt-controller: true
              "#interrupt-cells": 2
              "#address-cells": 0
            "bare: gpio-bare":
              "#gpio-cells": 2
            """;

    private static PartialTree tree(String devices) {
        BindingParser parser = new BindingParser(SourceKind.HARDWARE, IncludeResolver.none());
        BindingRegistry registry = BindingRegistry.builder()
                .registerWithChildren(parser.resolve(GPIO_BINDING, "vnd,gpio.yaml"))
                .registerWithChildren(parser.resolve(CTRL_BINDING, "vnd,ctrl.yaml"))
                .registerWithChildren(parser.resolve(USER_BINDING, "vnd,user.yaml"))
                .build();
        PartialTree tree = new PartialTree(
                SourceKind.HARDWARE,
                HardwareTreeReader.read(CONTROLLERS + devices, "board.yaml"),
                registry,
                TreeOptions.defaults());
        tree.process();
        return tree;
    }

    @Test
    @DisplayName("an indexed reference names its cells after the controller binding")
    void indexedReference() {
        PartialTree tree = tree("""
                device:
                  compatible: "vnd,user"
                  interrupts: ["&ctrl", 1, 2]
                  interrupt-names: [wake]
                """);

        PartialTreeNode device = tree.node("/device");
        ControllerAndData expected = new ControllerAndData(
                "/device", tree.node("/interrupt-controller"), Map.of("irq", 1L, "level", 2L), "wake", "interrupt");
        assertThat(device.property("interrupts").asSpecifiers()).containsExactly(expected);
        assertThat(device.interrupts()).containsExactly(expected);
    }

    @Test
    @DisplayName("a nexus map routes the specifier with mask and pass-thru applied")
    void nexusMap() {
        PartialTree tree = tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: ["&conn", 1, 5]
                """);

        List<ControllerAndData> gpios = tree.node("/device").property("power-gpios").asSpecifiers();
        assertThat(gpios).singleElement().satisfies(element -> {
            assertThat(element.controller()).isSameAs(tree.node("/gpio@100"));
            assertThat(element.data()).containsExactly(Map.entry("pin", 14L), Map.entry("flags", 5L));
        });
    }

    @Test
    @DisplayName("a zero reference leaves an empty slot")
    void unspecifiedElement() {
        PartialTree tree = tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: [0, "&gpio0", 3, 0]
                """);

        List<ControllerAndData> gpios = tree.node("/device").property("power-gpios").asSpecifiers();
        assertThat(gpios).hasSize(2);
        assertThat(gpios.get(0)).isNull();
        assertThat(gpios.get(1).data()).containsEntry("pin", 3L);
    }

    @Test
    @DisplayName("interrupts are routed through interrupt-map using the child unit address")
    void interruptMap() {
        PartialTree tree = tree("""
                "pci: pci":
                  "#address-cells": 1
                  "#size-cells": 1
                  "#interrupt-cells": 1
                  interrupt-map: [256, 1, "&ctrl", 7, 3]
                  interrupt-map-mask: [4294967295, 7]
                  "dev@100":
                    reg: [256, 16]
                    interrupts: [1]
                    interrupt-parent: "&pci"
                """);

        assertThat(tree.node("/pci/dev@100").interrupts()).singleElement().satisfies(interrupt -> {
            assertThat(interrupt.controller()).isSameAs(tree.node("/interrupt-controller"));
            assertThat(interrupt.data()).containsExactly(Map.entry("irq", 7L), Map.entry("level", 3L));
        });
    }

    @Test
    @DisplayName("a specifier missing from the map is an error")
    void unmappedSpecifier() {
        assertThatThrownBy(() -> tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: ["&conn", 2, 0]
                """))
                .isInstanceOf(PropertyException.class)
                .hasMessageContaining("does not appear in 'gpio-map' on /connector");
    }

    @Test
    @DisplayName("a controller without the cells property is an error")
    void missingCells() {
        assertThatThrownBy(() -> tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: ["&ctrl", 1, 2]
                """))
                .isInstanceOf(PropertyException.class)
                .hasMessageContaining("expected '#gpio-cells' property on /interrupt-controller");
    }

    @Test
    @DisplayName("a controller without a binding cannot name its cells")
    void controllerWithoutBinding() {
        assertThatThrownBy(() -> tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: ["&bare", 1, 2]
                """))
                .isInstanceOf(PropertyException.class)
                .hasMessageContaining("gpio controller /gpio-bare for /device lacks binding");
    }

    @Test
    @DisplayName("too few cells after a reference is an error")
    void truncated() {
        assertThatThrownBy(() -> tree("""
                device:
                  compatible: "vnd,user"
                  power-gpios: ["&gpio0", 1]
                """))
                .isInstanceOf(PropertyException.class)
                .hasMessageContaining("missing data after reference /gpio@100");
    }
}
