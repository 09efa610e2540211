package io.settingstree.core.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link BindingParser}: document structure, includes and property filters. */
@DisplayName("BindingParser")
class BindingParserTest {

    @TempDir
    Path tempDir;

    private BindingParser hardware;
    private BindingParser config;

    @BeforeEach
    void setUp() {
        IncludeResolver resolver = name -> Files.exists(tempDir.resolve(name)) ? tempDir.resolve(name) : null;
        hardware = new BindingParser(SourceKind.HARDWARE, resolver);
        config = new BindingParser(SourceKind.CONFIG, resolver);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Property specs")
    class PropertySpecs {

        @Test
        @DisplayName("types, flags, enum and default are read from each property")
        void readsPropertyDeclarations() {
            Binding binding = config.resolve("""
                    description: Uart settings
                    schema: "vnd,uart"
                    properties:
                      baud:
                        type: uint32
                        description: "  Line speed  "
                        default: 115200
                      parity:
                        type: string
                        enum: [none, even, odd]
                      port:
                        type: string
                        required: true
                      legacy-flow:
                        type: boolean
                        deprecated: true
                    """, "uart.yaml");

            assertThat(binding.schema()).isEqualTo("vnd,uart");
            assertThat(binding.kind()).isEqualTo(SourceKind.CONFIG);
            assertThat(binding.propertySpecs()).containsOnlyKeys("baud", "parity", "port", "legacy-flow");

            PropertySpec baud = binding.propertySpecs().get("baud");
            assertThat(baud.type()).isEqualTo(PropertyType.UINT32);
            assertThat(baud.defaultValue().asLong()).isEqualTo(115200L);
            assertThat(baud.origin()).isEqualTo("uart.yaml");

            assertThat(binding.propertySpecs().get("parity").enumValues()).hasSize(3);
            assertThat(binding.propertySpecs().get("port").required()).isTrue();
            assertThat(binding.propertySpecs().get("legacy-flow").deprecated()).isTrue();
        }

        @Test
        @DisplayName("hardware bindings carry bus, on-bus and specifier cell names")
        void readsHardwareKeys() {
            Binding binding = hardware.resolve("""
                    description: SPI controller
                    compatible: "vnd,spi"
                    bus: spi
                    on-bus: apb
                    gpio-cells: [pin, flags]
                    properties:
                      cs-gpios:
                        type: phandle-array
                    """, "spi.yaml");

            assertThat(binding.schema()).isEqualTo("vnd,spi");
            assertThat(binding.buses()).containsExactly("spi");
            assertThat(binding.variant()).isEqualTo("apb");
            assertThat(binding.specifierCells("gpio")).containsExactly("pin", "flags");
            assertThat(binding.propertySpecs().get("cs-gpios").type()).isEqualTo(PropertyType.PHANDLE_ARRAY);
        }

        @Test
        @DisplayName("child-binding becomes a child binding matching every child name")
        void childBindingIsNotAPropertySpec() {
            Binding binding = hardware.resolve("""
                    description: Buttons
                    compatible: "gpio-keys"
                    child-binding:
                      description: One button
                      properties:
                        gpios:
                          type: phandle-array
                          required: true
                    """, "keys.yaml");

            assertThat(binding.propertySpecs()).isEmpty();
            assertThat(binding.childBindings()).containsOnlyKeys(".*");
            ChildBinding child = binding.childBindings().get(".*");
            assertThat(child.matches("button_0")).isTrue();
            assertThat(child.bindings()).hasSize(1);
            assertThat(child.bindings().get(0).isChild()).isTrue();
            assertThat(child.bindings().get(0).propertySpecs()).containsOnlyKeys("gpios");
        }

        @Test
        @DisplayName("a property of type node binds children whose name matches the property name")
        void nodeTypedPropertyBindsNamedChildren() {
            Binding binding = config.resolve("""
                    description: Server
                    schema: "vnd,server"
                    properties:
                      "listener-[0-9]+":
                        type: node
                        properties:
                          port:
                            type: uint16
                    """, "server.yaml");

            ChildBinding child = binding.childBindings().get("listener-[0-9]+");
            assertThat(child.matches("listener-1")).isTrue();
            assertThat(child.matches("listener-x")).isFalse();
        }
    }

    @Nested
    @DisplayName("Includes")
    class Includes {

        @Test
        @DisplayName("an allowlist keeps only the listed properties, even required ones are dropped")
        void allowlistKeepsOnlyListedProperties() throws IOException {
            write("b.yaml", """
                    description: Base
                    properties:
                      x:
                        type: int
                        default: 0
                      y:
                        type: int
                        required: true
                    """);
            Binding binding = config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include:
                      - name: b.yaml
                        property-allowlist: [x]
                    """, "a.yaml");

            assertThat(binding.propertySpecs()).containsOnlyKeys("x");
            assertThat(binding.propertySpecs().get("x").origin()).endsWith("b.yaml");
        }

        @Test
        @DisplayName("a blocklist removes the listed properties")
        void blocklistRemovesListedProperties() throws IOException {
            write("b.yaml", """
                    properties:
                      x:
                        type: int
                      y:
                        type: int
                    """);
            Binding binding = config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include:
                      - name: b.yaml
                        property-blocklist: [x]
                    """, "a.yaml");

            assertThat(binding.propertySpecs()).containsOnlyKeys("y");
        }

        @Test
        @DisplayName("allowlist and blocklist together fail before the include is loaded")
        void allowAndBlockTogetherFail() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include:
                      - name: does-not-exist.yaml
                        property-allowlist: [x]
                        property-blocklist: [y]
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("should not specify both");
        }

        @Test
        @DisplayName("a caller filter with both lists is rejected")
        void callerFilterWithBothListsFails() {
            IncludeFilter both = new IncludeFilter(List.of("x"), List.of("y"), null);

            assertThatThrownBy(() -> config.resolve("""
                    description: Plain
                    schema: "vnd,a"
                    """, "a.yaml", both))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("both 'property-allowlist:' and 'property-blocklist:'");
        }

        @Test
        @DisplayName("child-binding filters apply to the included child binding")
        void childBindingFilter() throws IOException {
            write("keys-base.yaml", """
                    child-binding:
                      description: Key
                      properties:
                        gpios:
                          type: phandle-array
                        label:
                          type: string
                    """);
            Binding binding = hardware.resolve("""
                    description: Keys
                    compatible: "vnd,keys"
                    include:
                      - name: keys-base.yaml
                        child-binding:
                          property-allowlist: [gpios]
                    """, "keys.yaml");

            Binding child = binding.childBindings().get(".*").bindings().get(0);
            assertThat(child.propertySpecs()).containsOnlyKeys("gpios");
        }

        @Test
        @DisplayName("required from an include cannot be relaxed by the includer")
        void requiredCannotBeRelaxed() throws IOException {
            write("b.yaml", """
                    properties:
                      y:
                        type: int
                        required: true
                    """);

            assertThatThrownBy(() -> config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    properties:
                      y:
                        required: false
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("overwritten");
        }

        @Test
        @DisplayName("the includer may make an included property required")
        void includerMayRequire() throws IOException {
            write("b.yaml", """
                    properties:
                      y:
                        type: int
                    """);
            Binding binding = config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    properties:
                      y:
                        required: true
                    """, "a.yaml");

            assertThat(binding.propertySpecs().get("y").required()).isTrue();
            assertThat(binding.propertySpecs().get("y").type()).isEqualTo(PropertyType.INT);
            assertThat(binding.propertySpecs().get("y").origin()).isEqualTo("a.yaml");
        }

        @Test
        @DisplayName("conflicting types between includer and include fail")
        void conflictingTypesFail() throws IOException {
            write("b.yaml", """
                    properties:
                      y:
                        type: int
                    """);

            assertThatThrownBy(() -> config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    properties:
                      y:
                        type: string
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("'type' from included file overwritten");
        }

        @Test
        @DisplayName("nested includes are resolved depth first")
        void nestedIncludes() throws IOException {
            write("c.yaml", """
                    properties:
                      z:
                        type: string
                    """);
            write("b.yaml", """
                    include: c.yaml
                    properties:
                      y:
                        type: int
                    """);
            Path a = write("a.yaml", """
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    """);

            Binding binding = config.parse(a);

            assertThat(binding.propertySpecs()).containsOnlyKeys("y", "z");
            assertThat(binding.propertySpecs().get("z").origin()).endsWith("c.yaml");
        }

        @Test
        @DisplayName("an include cycle is reported")
        void includeCycle() throws IOException {
            write("b.yaml", "include: c.yaml\n");
            write("c.yaml", "include: b.yaml\n");

            assertThatThrownBy(() -> config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("include cycle");
        }

        @Test
        @DisplayName("a missing include is reported")
        void missingInclude() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: nowhere.yaml
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("'nowhere.yaml' included from a.yaml not found");
        }

        @Test
        @DisplayName("overridable keys can be configured")
        void configuredOverridableKeys() throws IOException {
            write("b.yaml", """
                    description: Base
                    """);
            BindingParser strict = new BindingParser(
                    SourceKind.CONFIG,
                    name -> tempDir.resolve(name),
                    TreeOptions.builder().overridableKeys(Set.of("schema")).build());

            assertThatThrownBy(() -> strict.resolve("""
                    description: Derived
                    schema: "vnd,a"
                    include: b.yaml
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("'description' from included file overwritten");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("unknown top-level keys are rejected")
        void unknownTopLevelKey() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Bad
                    schema: "vnd,a"
                    flavour: mint
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("Unknown key in a.yaml: [flavour]");
        }

        @Test
        @DisplayName("legacy keys point at their replacement")
        void legacyKey() {
            assertThatThrownBy(() -> hardware.resolve("""
                    title: Old
                    compatible: "vnd,a"
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("legacy 'title:'");
        }

        @Test
        @DisplayName("a missing schema id is rejected unless not required")
        void missingSchema() {
            assertThatThrownBy(() -> hardware.resolve("description: Anonymous\n", "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("missing 'compatible' property in a.yaml");

            BindingParser lenient = new BindingParser(
                    SourceKind.HARDWARE, IncludeResolver.none(), TreeOptions.builder().requireSchema(false).build());
            assertThat(lenient.resolve("description: Anonymous\n", "a.yaml").schema()).isNull();
        }

        @Test
        @DisplayName("a property without type is rejected")
        void missingType() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Bad
                    schema: "vnd,a"
                    properties:
                      x:
                        required: true
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("missing 'type:' for 'x'");
        }

        @Test
        @DisplayName("types are checked against the source kind")
        void typeNotAvailableForKind() {
            assertThatThrownBy(() -> hardware.resolve("""
                    description: Bad
                    compatible: "vnd,a"
                    properties:
                      target:
                        type: pointer
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("unknown type 'pointer'");
        }

        @Test
        @DisplayName("a default that does not fit the type is rejected")
        void invalidDefault() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Bad
                    schema: "vnd,a"
                    properties:
                      level:
                        type: uint8
                        default: 300
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("'default: 300' is invalid for 'level'");
        }

        @Test
        @DisplayName("a byte-array default with an element outside 0..255 is rejected")
        void byteArrayDefaultOutOfRange() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Bad
                    schema: "vnd,a"
                    properties:
                      key:
                        type: uint8-array
                        default: [1, 300]
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("is invalid for 'key'");
        }

        @Test
        @DisplayName("const is only allowed on literal types")
        void constOnBoolean() {
            assertThatThrownBy(() -> hardware.resolve("""
                    description: Bad
                    compatible: "vnd,a"
                    properties:
                      flag:
                        type: boolean
                        const: true
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("const in a.yaml for property 'flag'");
        }

        @Test
        @DisplayName("required and deprecated together are rejected")
        void requiredAndDeprecated() {
            assertThatThrownBy(() -> config.resolve("""
                    description: Bad
                    schema: "vnd,a"
                    properties:
                      old:
                        type: int
                        required: true
                        deprecated: true
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("should not have both 'deprecated' and 'required' set");
        }

        @Test
        @DisplayName("a phandle-array name must end in 's' unless a specifier space is given")
        void phandleArrayNaming() {
            assertThatThrownBy(() -> hardware.resolve("""
                    description: Bad
                    compatible: "vnd,a"
                    properties:
                      pwm:
                        type: phandle-array
                    """, "a.yaml"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("does not end in 's'");

            Binding binding = hardware.resolve("""
                    description: Good
                    compatible: "vnd,a"
                    properties:
                      pwm:
                        type: phandle-array
                        specifier-space: pwm
                    """, "a.yaml");
            assertThat(binding.propertySpecs().get("pwm").specifierSpace()).isEqualTo("pwm");
        }

        @Test
        @DisplayName("malformed YAML is reported as a schema error")
        void malformedYaml() {
            assertThatThrownBy(() -> config.resolve("description: [unclosed", "a.yaml"))
                    .isInstanceOf(SchemaException.class);
        }
    }
}
