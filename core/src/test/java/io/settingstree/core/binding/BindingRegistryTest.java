package io.settingstree.core.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BindingRegistry")
class BindingRegistryTest {

    private final BindingParser parser = new BindingParser(SourceKind.HARDWARE, IncludeResolver.none());

    private Binding binding(String schema, String onBus, String origin) {
        String text = "description: Test\ncompatible: \"" + schema + "\"\n"
                + (onBus == null ? "" : "on-bus: " + onBus + "\n");
        return parser.resolve(text, origin);
    }

    @Test
    @DisplayName("bindings are keyed by schema and bus variant")
    void keyedBySchemaAndVariant() {
        Binding plain = binding("vnd,sensor", null, "sensor.yaml");
        Binding onI2c = binding("vnd,sensor", "i2c", "sensor-i2c.yaml");

        BindingRegistry registry = BindingRegistry.builder().register(plain).register(onI2c).build();

        assertThat(registry.binding("vnd,sensor", null)).isSameAs(plain);
        assertThat(registry.binding("vnd,sensor", "i2c")).isSameAs(onI2c);
        assertThat(registry.binding("vnd,sensor", "spi")).isNull();
        assertThat(registry.schemas()).containsExactly("vnd,sensor");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("a second binding for the same schema and variant is rejected")
    void duplicateRegistration() {
        BindingRegistry.Builder builder = BindingRegistry.builder()
                .register(binding("vnd,sensor", "i2c", "first.yaml"));

        assertThatThrownBy(() -> builder.register(binding("vnd,sensor", "i2c", "second.yaml")))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("both first.yaml and second.yaml have schema 'vnd,sensor'")
                .hasMessageContaining("i2c");
    }

    @Test
    @DisplayName("anonymous child bindings are not registered")
    void childBindingsWithoutSchema() {
        Binding parent = parser.resolve("""
                description: LEDs
                compatible: "gpio-leds"
                child-binding:
                  description: LED
                """, "leds.yaml");

        BindingRegistry registry = BindingRegistry.builder().registerWithChildren(parent).build();

        assertThat(registry.size()).isEqualTo(1);
        assertThat(BindingRegistry.empty().isEmpty()).isTrue();
    }
}
