package io.settingstree.core.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.settingstree.core.error.SourceException;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.RawTree;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HardwareTreeReader")
class HardwareTreeReaderTest {

    private static Path fixturePath(String relative) {
        return Path.of("src/test/resources/" + relative);
    }

    @Test
    @DisplayName("mappings become nodes and other values become properties")
    void readsNodesAndProperties() {
        RawTree tree = HardwareTreeReader.read(fixturePath("trees/board.yaml"));

        assertThat(tree.source()).endsWith("board.yaml");
        assertThat(tree.root().property("model").asText()).isEqualTo("Test board");
        assertThat(tree.root().childNames()).containsExactly("soc", "sensor@9000", "leds");

        RawNode gpio = tree.node("/soc/gpio@1000");
        assertThat(gpio.parentPath()).isEqualTo("/soc");
        assertThat(gpio.property("reg")).hasSize(2);
        assertThat(gpio.property("gpio-controller").asBoolean()).isTrue();
        assertThat(gpio.property("#gpio-cells").asInt()).isEqualTo(2);
        assertThat(tree.node("/soc/i2c@2000/sensor@76")).isNotNull();
    }

    @Test
    @DisplayName("labels in front of a node name are split off")
    void readsLabels() {
        RawTree tree = HardwareTreeReader.read("""
                soc:
                  "uart0: console: serial@4000":
                    current-speed: 115200
                """, "inline");

        RawNode uart = tree.node("/soc/serial@4000");
        assertThat(uart.name()).isEqualTo("serial@4000");
        assertThat(uart.labels()).containsExactly("uart0", "console");
        assertThat(tree.node("/soc").labels()).isEmpty();
    }

    @Test
    @DisplayName("an empty document is a lone root")
    void emptyDocument() {
        RawTree tree = HardwareTreeReader.read("", "empty");

        assertThat(tree.size()).isEqualTo(1);
        assertThat(tree.root().isRoot()).isTrue();
    }

    @Test
    @DisplayName("a document that is not a mapping is rejected")
    void notAMapping() {
        assertThatThrownBy(() -> HardwareTreeReader.read("- a\n- b\n", "list"))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("Expected a mapping");
    }

    @Test
    @DisplayName("empty labels are rejected")
    void emptyLabel() {
        assertThatThrownBy(() -> HardwareTreeReader.read("\": uart\":\n  x: 1\n", "bad"))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("Empty label");
    }

    @Test
    @DisplayName("an unreadable file is reported with its path")
    void missingFile() {
        assertThatThrownBy(() -> HardwareTreeReader.read(fixturePath("trees/missing.yaml")))
                .isInstanceOf(SourceException.class)
                .satisfies(e -> assertThat(((SourceException) e).source()).endsWith("missing.yaml"));
    }
}
