package io.settingstree.core.binding;

import static org.assertj.core.api.Assertions.assertThat;

import io.settingstree.core.model.SourceKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Filters applied by a caller when resolving a binding directly. */
class IncludeFilterTest {

    private static final String DOCUMENT = """
            description: Display panel
            compatible: "vnd,panel"
            properties:
              width:
                type: int
              height:
                type: int
              "timing-.*":
                type: int
            child-binding:
              description: Backlight
              properties:
                brightness:
                  type: int
                pwms:
                  type: phandle-array
            """;

    private final BindingParser parser = new BindingParser(SourceKind.HARDWARE, IncludeResolver.none());

    @Test
    @DisplayName("allow turns a matching pattern into an exact entry")
    void allowlistNarrowsPatterns() {
        Binding binding = parser.resolve(DOCUMENT, "panel.yaml", IncludeFilter.allow(List.of("width", "timing-h")));

        assertThat(binding.propertySpecs()).containsOnlyKeys("width", "timing-h");
        assertThat(binding.childBindings()).containsKey(".*");
    }

    @Test
    @DisplayName("block excludes a name from a pattern that covers it")
    void blocklistCarvesPatterns() {
        Binding binding = parser.resolve(DOCUMENT, "panel.yaml", IncludeFilter.block(List.of("height", "timing-v")));

        assertThat(binding.propertySpecs()).containsKey("width").doesNotContainKey("height");
        PropertySpec timing = binding.propertySpecs().values().stream()
                .filter(spec -> spec.name().contains("timing-"))
                .findFirst()
                .orElseThrow();
        assertThat(timing.matches("timing-h")).isTrue();
        assertThat(timing.matches("timing-v")).isFalse();
    }

    @Test
    @DisplayName("a child filter reaches child bindings only")
    void childFilter() {
        IncludeFilter filter = IncludeFilter.none().withChild(IncludeFilter.allow(List.of("brightness")));

        Binding binding = parser.resolve(DOCUMENT, "panel.yaml", filter);

        assertThat(binding.propertySpecs()).containsOnlyKeys("width", "height", "timing-.*");
        Binding child = binding.childBindings().get(".*").bindings().get(0);
        assertThat(child.propertySpecs()).containsOnlyKeys("brightness");
    }

    @Test
    @DisplayName("an empty filter keeps everything")
    void emptyFilter() {
        assertThat(IncludeFilter.none().isEmpty()).isTrue();
        assertThat(IncludeFilter.allow(List.of()).isEmpty()).isFalse();
    }
}
