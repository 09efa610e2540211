package io.settingstree.core.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BindingScanner")
class BindingScannerTest {

    private static Path fixturePath(String relative) {
        return Path.of("src/test/resources/" + relative);
    }

    @Test
    @DisplayName("only bindings for used schemas are registered, includes resolve by file name")
    void registersUsedSchemas() {
        BindingRegistry registry = BindingScanner.scan(
                SourceKind.HARDWARE,
                List.of(fixturePath("bindings/hardware")),
                Set.of("vnd,gpio", "vnd,sensor"),
                TreeOptions.defaults());

        assertThat(registry.schemas()).containsExactlyInAnyOrder("vnd,gpio", "vnd,sensor");
        assertThat(registry.binding("vnd,sensor", "i2c")).isNotNull();
        assertThat(registry.binding("vnd,sensor", null)).isNotNull();
        assertThat(registry.binding("vnd,i2c", null)).isNull();

        Binding gpio = registry.binding("vnd,gpio", null);
        assertThat(gpio.propertySpecs()).containsKeys("reg", "interrupts", "label", "gpio-controller");
        assertThat(gpio.propertySpecs().get("reg").origin()).endsWith("base.yaml");
        assertThat(gpio.specifierCells("gpio")).containsExactly("pin", "flags");
    }

    @Test
    @DisplayName("nothing is registered when no schema is used")
    void noUsedSchemas() {
        BindingRegistry registry = BindingScanner.scan(
                SourceKind.CONFIG, List.of(fixturePath("bindings/config")), Set.of(), TreeOptions.defaults());

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("a missing binding directory is an error")
    void missingDirectory() {
        assertThatThrownBy(() -> BindingScanner.scan(
                        SourceKind.CONFIG, List.of(fixturePath("bindings/nowhere")), Set.of("x"), TreeOptions.defaults()))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Binding directory not found");
    }
}
