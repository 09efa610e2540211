package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.BindingParser;
import io.settingstree.core.binding.IncludeResolver;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.binding.PropertyType;
import io.settingstree.core.config.DiagnosticKind;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Hardware description rules: status, buses, registers, address translation and interrupts. */
final class HardwareDriver implements SourceDriver {

    static final String INFERRED_ORIGIN = "<inferred>";

    private static final Set<String> STATUS_VALUES = Set.of("ok", "okay", "disabled", "reserved", "fail", "fail-sss");

    private static final Set<String> IMPLICIT = Set.of(
            "compatible", "status", "phandle", "interrupt-parent", "interrupts-extended", "device_type", "ranges");

    private static final Map<String, PropertySpec> DEFAULT_SPECS = defaultSpecs(
            "compatible", PropertyType.STRING_ARRAY,
            "status", PropertyType.STRING,
            "ranges", PropertyType.COMPOUND,
            "reg", PropertyType.ARRAY,
            "reg-names", PropertyType.STRING_ARRAY,
            "label", PropertyType.STRING,
            "interrupts", PropertyType.ARRAY,
            "interrupts-extended", PropertyType.COMPOUND,
            "interrupt-names", PropertyType.STRING_ARRAY,
            "interrupt-controller", PropertyType.BOOLEAN);

    private final PartialTree tree;

    HardwareDriver(PartialTree tree) {
        this.tree = tree;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.HARDWARE;
    }

    @Override
    public List<String> schemas(RawNode raw) {
        JsonNode compatible = raw.property("compatible");
        List<String> schemas = new ArrayList<>();
        for (JsonNode element : Cells.flatten(compatible)) {
            if (!element.isTextual()) {
                throw new PropertyException(
                        "expected 'compatible' on " + raw.path() + " to be a string or a list of strings, not '"
                                + compatible + "'",
                        raw.path(),
                        "compatible");
            }
            schemas.add(element.asText());
        }
        return schemas;
    }

    @Override
    public boolean enabled(RawNode raw) {
        return "okay".equals(status(raw));
    }

    /** The node's status; absent and {@code ok} both read as {@code okay}. */
    static String status(RawNode raw) {
        JsonNode status = raw.property("status");
        if (status == null) {
            return "okay";
        }
        String text = status.asText();
        return "ok".equals(text) ? "okay" : text;
    }

    @Override
    public boolean isImplicitlyDeclared(String propertyName) {
        return IMPLICIT.contains(propertyName) || propertyName.endsWith("-controller") || propertyName.startsWith("#");
    }

    // --- binding selection ---

    @Override
    public void beforeBindings(PartialTreeNode node) {
        node.setBusNode(busNode(node));
    }

    private PartialTreeNode busNode(PartialTreeNode node) {
        PartialTreeNode parent = node.parent();
        if (parent == null) {
            return null;
        }
        if (tree.options().fixedPartitionsOnAnyBus() && node.schemas().contains("fixed-partitions")) {
            return null;
        }
        if (!parent.buses().isEmpty()) {
            return parent;
        }
        return parent.busNode();
    }

    @Override
    public Binding bindingFor(PartialTreeNode node, String schema) {
        for (String bus : node.onBuses()) {
            Binding binding = tree.registry().binding(schema, bus);
            if (binding != null) {
                return binding;
            }
        }
        return tree.registry().binding(schema, null);
    }

    @Override
    public Binding inferredBinding(PartialTreeNode node) {
        if (!tree.options().inferBindingForPaths().contains(node.path())) {
            return null;
        }
        if (!node.schemas().isEmpty()) {
            throw new PropertyException(
                    "compatible in node with inferred binding: " + node.path(), node.path(), "compatible");
        }
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("description", "Inferred binding from properties.");
        ObjectNode properties = document.putObject("properties");
        node.raw().properties().forEach((name, value) ->
                properties.putObject(name).put("type", inferType(node, name, value).tag()));
        BindingParser parser = new BindingParser(SourceKind.HARDWARE, IncludeResolver.none(), tree.options());
        return parser.resolveSynthesized(document, INFERRED_ORIGIN);
    }

    private static PropertyType inferType(PartialTreeNode node, String name, JsonNode value) {
        if (value.isBinary()) {
            return PropertyType.UINT8_ARRAY;
        }
        List<JsonNode> elements = Cells.flatten(value);
        if (elements.isEmpty()) {
            return PropertyType.BOOLEAN;
        }
        boolean allInts = elements.stream().allMatch(JsonNode::isIntegralNumber);
        boolean allReferences = elements.stream().allMatch(Cells::isReference);
        boolean allText = elements.stream().allMatch(JsonNode::isTextual);
        boolean referencesAndInts =
                elements.stream().allMatch(e -> e.isIntegralNumber() || Cells.isReference(e));
        if (!value.isArray()) {
            if (allInts) {
                return PropertyType.INT;
            }
            if (allText) {
                String text = value.asText();
                return text.startsWith("/") ? PropertyType.PATH
                        : text.startsWith("&") ? PropertyType.PHANDLE : PropertyType.STRING;
            }
        } else if (allInts) {
            return PropertyType.ARRAY;
        } else if (allReferences) {
            return PropertyType.PHANDLES;
        } else if (allText) {
            return PropertyType.STRING_ARRAY;
        } else if (referencesAndInts) {
            return PropertyType.PHANDLE_ARRAY;
        }
        throw new PropertyException(
                "cannot infer binding from property '" + name + "' on " + node.path() + " with value " + value,
                node.path(),
                name);
    }

    @Override
    public Map<String, PropertySpec> defaultSpecs() {
        return DEFAULT_SPECS;
    }

    // --- node extras ---

    @Override
    public void afterBindings(PartialTreeNode node) {
        Set<String> buses = new LinkedHashSet<>();
        node.bindings().forEach(binding -> buses.addAll(binding.buses()));
        node.setBuses(List.copyOf(buses));
        node.setRegisters(registers(node));
        node.setRanges(ranges(node));
    }

    @Override
    public void resolveCrossReferences(PartialTreeNode node) {
        node.setInterrupts(tree.specifiers().interrupts(node));
    }

    @Override
    public void check(PartialTreeNode node) {
        JsonNode status = node.raw().property("status");
        if (status != null && (!status.isTextual() || !STATUS_VALUES.contains(status.asText()))) {
            throw new PropertyException(
                    "unknown 'status' value " + status + " in " + node.path() + " in " + node.source()
                            + ", expected one of " + String.join(", ", new TreeSet<>(STATUS_VALUES)),
                    node.path(),
                    "status");
        }
    }

    @Override
    public List<Node> sourceDependencies(PartialTreeNode node) {
        List<Node> controllers = new ArrayList<>();
        node.interrupts().forEach(interrupt -> controllers.add(interrupt.controller()));
        return controllers;
    }

    // --- registers and ranges ---

    /** {@code #address-cells} governing {@code reg} of {@code node}: its parent's, default 2. */
    static int addressCells(PartialTreeNode node) {
        PartialTreeNode parent = node.parent();
        Long cells = parent == null ? null : parent.rawInt("#address-cells");
        return cells == null ? 2 : cells.intValue();
    }

    /** {@code #size-cells} governing {@code reg} of {@code node}: its parent's, default 1. */
    static int sizeCells(PartialTreeNode node) {
        PartialTreeNode parent = node.parent();
        Long cells = parent == null ? null : parent.rawInt("#size-cells");
        return cells == null ? 1 : cells.intValue();
    }

    private List<Register> registers(PartialTreeNode node) {
        JsonNode reg = node.raw().property("reg");
        if (reg == null) {
            return List.of();
        }
        int addressCells = addressCells(node);
        int sizeCells = sizeCells(node);
        long[] cells = rawCells(node, "reg", reg);
        List<long[]> entries = slice(node, "reg", cells, addressCells + sizeCells,
                "<#address-cells> (= " + addressCells + ") + <#size-cells> (= " + sizeCells + ")");

        boolean pci = node.onBuses().contains("pcie");
        List<Register> registers = new ArrayList<>();
        Long first = null;
        for (long[] entry : entries) {
            Long untranslated = addressCells == 0 ? null : Cells.toNumber(entry, 0, addressCells);
            if (registers.isEmpty()) {
                first = untranslated;
            }
            Long address = untranslated == null ? null : translate(untranslated, node);
            Long size = sizeCells == 0 ? null : Cells.toNumber(entry, addressCells, sizeCells);
            if (size != null && size == 0 && !pci) {
                String message = "zero-sized 'reg' in " + node.path() + " seems meaningless (maybe you want a size"
                        + " of one or #size-cells = 0 instead)";
                tree.diagnostics().report(DiagnosticKind.REGISTER_MISMATCH, message,
                        () -> new PropertyException(message, node.path(), "reg"));
            }
            registers.add(new Register(null, address, size));
        }

        List<String> names = names(node, "reg", registers.size());
        if (names != null) {
            for (int i = 0; i < registers.size(); i++) {
                registers.set(i, registers.get(i).withName(names.get(i)));
            }
        }

        Long unitAddress = node.unitAddress();
        if (unitAddress != null && first != null && !first.equals(unitAddress) && !pci) {
            String message = "unit address and first address in 'reg' (0x" + Long.toHexString(first)
                    + ") don't match for " + node.path();
            tree.diagnostics().report(DiagnosticKind.REGISTER_MISMATCH, message,
                    () -> new PropertyException(message, node.path(), "reg"));
        }
        return Collections.unmodifiableList(registers);
    }

    /** Translates {@code address} on {@code node} to the root address space through parent {@code ranges}. */
    private long translate(long address, PartialTreeNode node) {
        PartialTreeNode parent = node.parent();
        if (parent == null || parent.raw().property("ranges") == null) {
            return address;
        }
        long[] ranges = rawCells(parent, "ranges", parent.raw().property("ranges"));
        if (ranges.length == 0) {
            // identity mapping
            return translate(address, parent);
        }
        int childAddressCells = addressCells(node);
        int parentAddressCells = addressCells(parent);
        int childSizeCells = sizeCells(node);
        for (long[] entry : slice(parent, "ranges", ranges, childAddressCells + parentAddressCells + childSizeCells,
                "<#address-cells> (= " + childAddressCells + ") + <#address-cells for parent> (= "
                        + parentAddressCells + ") + <#size-cells> (= " + childSizeCells + ")")) {
            long childAddress = Cells.toNumber(entry, 0, childAddressCells);
            long parentAddress = Cells.toNumber(entry, childAddressCells, parentAddressCells);
            long length = Cells.toNumber(entry, childAddressCells + parentAddressCells, childSizeCells);
            if (childAddress <= address && address - childAddress < length) {
                return translate(parentAddress + address - childAddress, parent);
            }
        }
        return address;
    }

    private List<AddressRange> ranges(PartialTreeNode node) {
        JsonNode value = node.raw().property("ranges");
        if (value == null) {
            return List.of();
        }
        Long ownAddressCells = node.rawInt("#address-cells");
        Long ownSizeCells = node.rawInt("#size-cells");
        int childAddressCells = ownAddressCells == null ? 2 : ownAddressCells.intValue();
        int parentAddressCells = addressCells(node);
        int childSizeCells = ownSizeCells == null ? 1 : ownSizeCells.intValue();
        int entryCells = childAddressCells + parentAddressCells + childSizeCells;
        long[] cells = rawCells(node, "ranges", value);
        if (cells.length == 0) {
            return List.of();
        }
        if (entryCells == 0) {
            throw new PropertyException(
                    "'ranges' should be empty in " + node.path() + " since <#address-cells> = " + childAddressCells
                            + ", <#address-cells for parent> = " + parentAddressCells + " and <#size-cells> = "
                            + childSizeCells,
                    node.path(),
                    "ranges");
        }
        List<AddressRange> ranges = new ArrayList<>();
        for (long[] entry : slice(node, "ranges", cells, entryCells,
                "<#address-cells> (= " + childAddressCells + ") + <#address-cells for parent> (= "
                        + parentAddressCells + ") + <#size-cells> (= " + childSizeCells + ")")) {
            ranges.add(new AddressRange(
                    childAddressCells,
                    childAddressCells == 0 ? null : Cells.toNumber(entry, 0, childAddressCells),
                    parentAddressCells,
                    parentAddressCells == 0 ? null : Cells.toNumber(entry, childAddressCells, parentAddressCells),
                    childSizeCells,
                    childSizeCells == 0
                            ? null
                            : Cells.toNumber(entry, childAddressCells + parentAddressCells, childSizeCells)));
        }
        return Collections.unmodifiableList(ranges);
    }

    private static long[] rawCells(PartialTreeNode node, String property, JsonNode value) {
        long[] cells = Cells.numbers(Cells.flatten(value));
        if (cells == null) {
            throw new PropertyException(
                    "expected '" + property + " = < ... >;' in " + node.path() + " in " + node.source() + ", not '"
                            + value + "'",
                    node.path(),
                    property);
        }
        return cells;
    }

    private static List<long[]> slice(PartialTreeNode node, String property, long[] cells, int size, String hint) {
        if (size == 0 || cells.length % size != 0) {
            throw new PropertyException(
                    "'" + property + "' property in " + node.path() + " has " + cells.length
                            + " cells, which is not evenly divisible by " + size + " (= " + hint + ")",
                    node.path(),
                    property);
        }
        List<long[]> chunks = new ArrayList<>();
        for (int i = 0; i < cells.length; i += size) {
            chunks.add(Arrays.copyOfRange(cells, i, i + size));
        }
        return chunks;
    }

    /**
     * Reads {@code <ident>-names} from {@code node}.
     *
     * @return the names, or null if the node has no such property
     * @throws PropertyException if the number of names differs from {@code expected}
     */
    static List<String> names(PartialTreeNode node, String ident, int expected) {
        String property = ident + "-names";
        JsonNode value = node.raw().property(property);
        if (value == null) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (JsonNode element : Cells.flatten(value)) {
            names.add(element.asText());
        }
        if (names.size() != expected) {
            throw new PropertyException(
                    property + " property in " + node.path() + " in " + node.source() + " has " + names.size()
                            + " strings, expected " + expected + " strings",
                    node.path(),
                    property);
        }
        return names;
    }

    private static Map<String, PropertySpec> defaultSpecs(Object... nameTypePairs) {
        Map<String, PropertySpec> specs = new LinkedHashMap<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            String name = (String) nameTypePairs[i];
            PropertyType type = (PropertyType) nameTypePairs[i + 1];
            List<JsonNode> enumValues = null;
            if ("status".equals(name)) {
                enumValues = new ArrayList<>();
                for (String value : List.of("ok", "okay", "disabled", "reserved", "fail", "fail-sss")) {
                    enumValues.add(JsonNodeFactory.instance.textNode(value));
                }
            }
            specs.put(name, new PropertySpec(
                    name, Pattern.compile(Pattern.quote(name)), type, null, false, false, enumValues, null, null,
                    null, "<default>"));
        }
        return Collections.unmodifiableMap(specs);
    }
}
