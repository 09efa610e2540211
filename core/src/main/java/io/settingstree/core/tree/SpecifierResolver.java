package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.error.PropertyException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Resolves indexed reference lists ({@code phandle-array}) and interrupts of hardware nodes.
 *
 * <p>
 * Each element is a reference followed by as many cells as the referenced node's
 * {@code #<ns>-cells} says. Elements are then routed through any {@code <ns>-map} on the way to the
 * final controller, honouring {@code <ns>-map-mask} and {@code <ns>-map-pass-thru}.
 */
final class SpecifierResolver {

    private final PartialTree tree;

    SpecifierResolver(PartialTree tree) {
        this.tree = tree;
    }

    /** A controller and the specifier cells addressed to it. */
    private record Target(PartialTreeNode controller, long[] cells) {}

    /** Specifier space of a phandle-array property: explicit, {@code gpio} for gpios, else the name minus 's'. */
    static String specifierSpace(PropertySpec spec) {
        if (spec.specifierSpace() != null) {
            return spec.specifierSpace();
        }
        if (spec.name().endsWith("gpios")) {
            return "gpio";
        }
        return spec.name().substring(0, spec.name().length() - 1);
    }

    // --- phandle-array ---

    List<ControllerAndData> resolve(PartialTreeNode node, PropertySpec spec, JsonNode raw) {
        String space = specifierSpace(spec);
        String cellsName = "#" + space + "-cells";
        List<JsonNode> elements = Cells.flatten(raw);
        List<ControllerAndData> result = new ArrayList<>();
        int i = 0;
        while (i < elements.size()) {
            JsonNode reference = elements.get(i++);
            if (reference.isIntegralNumber() && reference.asLong() == 0) {
                // unspecified element
                result.add(null);
                continue;
            }
            PartialTreeNode controller = tree.referencedNode(reference);
            if (controller == null) {
                throw new PropertyException(
                        "bad reference '" + reference.asText() + "' in property '" + spec.name() + "' on "
                                + node.path(),
                        node.path(),
                        spec.name());
            }
            int count = requiredCells(controller, cellsName, node);
            if (elements.size() - i < count) {
                throw new PropertyException(
                        "missing data after reference " + controller.path() + " in property '" + spec.name()
                                + "' on " + node.path(),
                        node.path(),
                        spec.name());
            }
            long[] cells = cells(elements.subList(i, i + count), node, spec.name());
            i += count;
            Target target = map(space, node, controller, cells, c -> requiredCells(c, cellsName, node), false);
            result.add(new ControllerAndData(
                    node.path(), target.controller(), namedCells(node, target.controller(), target.cells(), space),
                    null, space));
        }
        return Collections.unmodifiableList(withNames(node, space, result));
    }

    // --- interrupts ---

    /** The interrupts generated by {@code node}, from {@code interrupts-extended} or {@code interrupts}. */
    List<ControllerAndData> interrupts(PartialTreeNode node) {
        List<Target> targets = new ArrayList<>();
        JsonNode extended = node.raw().property("interrupts-extended");
        JsonNode plain = node.raw().property("interrupts");
        if (extended != null) {
            targets.addAll(extendedInterrupts(node, "interrupts-extended", Cells.flatten(extended)));
        } else if (plain != null) {
            List<JsonNode> elements = Cells.flatten(plain);
            if (!elements.isEmpty() && Cells.isReference(elements.get(0))) {
                targets.addAll(extendedInterrupts(node, "interrupts", elements));
            } else {
                PartialTreeNode parent = interruptParent(node);
                int count = interruptCells(parent);
                long[] cells = cells(elements, node, "interrupts");
                if (count == 0 || cells.length % count != 0) {
                    throw new PropertyException(
                            "'interrupts' property in " + node.path() + " has " + cells.length
                                    + " cells, which is not evenly divisible by " + count
                                    + " (= <#interrupt-cells> of " + parent.path() + ")",
                            node.path(),
                            "interrupts");
                }
                for (int i = 0; i < cells.length; i += count) {
                    targets.add(mapInterrupt(node, parent, Arrays.copyOfRange(cells, i, i + count)));
                }
            }
        }

        List<ControllerAndData> result = new ArrayList<>();
        for (Target target : targets) {
            result.add(new ControllerAndData(
                    node.path(),
                    target.controller(),
                    namedCells(node, target.controller(), target.cells(), "interrupt"),
                    null,
                    "interrupt"));
        }
        return Collections.unmodifiableList(withNames(node, "interrupt", result));
    }

    private List<Target> extendedInterrupts(PartialTreeNode node, String property, List<JsonNode> elements) {
        List<Target> targets = new ArrayList<>();
        int i = 0;
        while (i < elements.size()) {
            JsonNode reference = elements.get(i++);
            PartialTreeNode parent = tree.referencedNode(reference);
            if (parent == null) {
                throw new PropertyException(
                        "node '" + node.path() + "' " + property + " property has an empty or unresolvable"
                                + " element '" + reference.asText() + "'",
                        node.path(),
                        property);
            }
            int count = interruptCells(parent);
            if (elements.size() - i < count) {
                throw new PropertyException(
                        "missing data after reference " + parent.path() + " in '" + property + "' on "
                                + node.path(),
                        node.path(),
                        property);
            }
            long[] cells = cells(elements.subList(i, i + count), node, property);
            i += count;
            targets.add(mapInterrupt(node, parent, cells));
        }
        return targets;
    }

    private Target mapInterrupt(PartialTreeNode child, PartialTreeNode parent, long[] childSpec) {
        if (parent.raw().property("interrupt-controller") != null) {
            return new Target(parent, childSpec);
        }
        ToIntFunction<PartialTreeNode> specLength = n -> ownAddressCells(n) + interruptCells(n);
        Target target = map(
                "interrupt", child, parent, Cells.concat(rawUnitAddress(child), childSpec), specLength, true);
        long[] cells = target.cells();
        int addressCells = ownAddressCells(target.controller());
        // strip the parent unit address
        return new Target(target.controller(), Arrays.copyOfRange(cells, addressCells, cells.length));
    }

    private PartialTreeNode interruptParent(PartialTreeNode start) {
        for (PartialTreeNode node = start; node != null; node = node.parent()) {
            JsonNode reference = node.raw().property("interrupt-parent");
            if (reference != null) {
                PartialTreeNode parent = tree.referencedNode(Cells.flatten(reference).get(0));
                if (parent == null) {
                    throw new PropertyException(
                            "bad 'interrupt-parent' reference " + reference + " on " + node.path(),
                            node.path(),
                            "interrupt-parent");
                }
                return parent;
            }
        }
        throw new PropertyException(
                start.path() + " has an 'interrupts' property, but neither the node nor any of its parents"
                        + " has an 'interrupt-parent' property",
                start.path(),
                "interrupts");
    }

    private static int interruptCells(PartialTreeNode node) {
        Long cells = node.rawInt("#interrupt-cells");
        if (cells == null) {
            throw new PropertyException(node.path() + " lacks #interrupt-cells", node.path(), "#interrupt-cells");
        }
        return cells.intValue();
    }

    private static int ownAddressCells(PartialTreeNode node) {
        Long cells = node.rawInt("#address-cells");
        if (cells == null) {
            throw new PropertyException(
                    "missing #address-cells on " + node.path() + " (while handling interrupt-map)",
                    node.path(),
                    "#address-cells");
        }
        return cells.intValue();
    }

    private static long[] rawUnitAddress(PartialTreeNode node) {
        JsonNode reg = node.raw().property("reg");
        if (reg == null) {
            throw new PropertyException(
                    node.path() + " lacks 'reg' property (needed for 'interrupt-map' unit address lookup)",
                    node.path(),
                    "reg");
        }
        long[] cells = cells(Cells.flatten(reg), node, "reg");
        int addressCells = HardwareDriver.addressCells(node);
        if (cells.length < addressCells) {
            throw new PropertyException(
                    node.path() + " has too short 'reg' property (while doing 'interrupt-map' unit address lookup)",
                    node.path(),
                    "reg");
        }
        return Arrays.copyOf(cells, addressCells);
    }

    // --- <ns>-map ---

    /**
     * Routes {@code childSpec}, sent from {@code child} to {@code parent}, through any
     * {@code <prefix>-map} until it reaches a node without one.
     */
    private Target map(
            String prefix,
            PartialTreeNode child,
            PartialTreeNode parent,
            long[] childSpec,
            ToIntFunction<PartialTreeNode> specLength,
            boolean requireController) {
        String mapName = prefix + "-map";
        JsonNode mapValue = parent.raw().property(mapName);
        if (mapValue == null) {
            if (requireController && parent.raw().property(prefix + "-controller") == null) {
                throw new PropertyException(
                        "expected '" + prefix + "-controller' property on " + parent.path() + " (referenced by "
                                + child.path() + ")",
                        parent.path(),
                        prefix + "-controller");
            }
            return new Target(parent, childSpec);
        }

        long[] masked = mask(prefix, child, parent, childSpec);
        List<JsonNode> rows = Cells.flatten(mapValue);
        int i = 0;
        while (i < rows.size()) {
            if (rows.size() - i < childSpec.length) {
                throw badMap(parent, mapName, "missing/truncated child data");
            }
            long[] entry = cells(rows.subList(i, i + childSpec.length), parent, mapName);
            i += childSpec.length;
            if (i >= rows.size()) {
                throw badMap(parent, mapName, "missing/truncated reference");
            }
            JsonNode reference = rows.get(i++);
            PartialTreeNode mapParent = tree.referencedNode(reference);
            if (mapParent == null) {
                throw badMap(parent, mapName, "bad reference (" + reference.asText() + ")");
            }
            int parentLength = specLength.applyAsInt(mapParent);
            if (rows.size() - i < parentLength) {
                throw badMap(parent, mapName, "missing/truncated parent data");
            }
            long[] parentSpec = cells(rows.subList(i, i + parentLength), parent, mapName);
            i += parentLength;

            if (Arrays.equals(entry, masked)) {
                long[] passed = passThru(prefix, child, parent, childSpec, parentSpec);
                return map(prefix, parent, mapParent, passed, specLength, requireController);
            }
        }
        throw new PropertyException(
                "child specifier for " + child.path() + " (" + Arrays.toString(childSpec) + ") does not appear in '"
                        + mapName + "' on " + parent.path(),
                parent.path(),
                mapName);
    }

    private static long[] mask(String prefix, PartialTreeNode child, PartialTreeNode parent, long[] childSpec) {
        String maskName = prefix + "-map-mask";
        JsonNode maskValue = parent.raw().property(maskName);
        if (maskValue == null) {
            return childSpec;
        }
        long[] mask = cells(Cells.flatten(maskValue), parent, maskName);
        if (mask.length != childSpec.length) {
            throw new PropertyException(
                    child.path() + ": expected '" + maskName + "' in " + parent.path() + " to be "
                            + childSpec.length + " cells, is " + mask.length + " cells",
                    parent.path(),
                    maskName);
        }
        return Cells.and(childSpec, mask);
    }

    private static long[] passThru(
            String prefix, PartialTreeNode child, PartialTreeNode parent, long[] childSpec, long[] parentSpec) {
        String passThruName = prefix + "-map-pass-thru";
        JsonNode passThruValue = parent.raw().property(passThruName);
        if (passThruValue == null) {
            return parentSpec;
        }
        long[] passThru = cells(Cells.flatten(passThruValue), parent, passThruName);
        if (passThru.length != childSpec.length) {
            throw new PropertyException(
                    child.path() + ": expected '" + passThruName + "' in " + parent.path() + " to be "
                            + childSpec.length + " cells, is " + passThru.length + " cells",
                    parent.path(),
                    passThruName);
        }
        long[] combined = Cells.or(Cells.and(childSpec, passThru), Cells.and(parentSpec, Cells.not(passThru)));
        return Cells.tail(combined, parentSpec.length);
    }

    private static PropertyException badMap(PartialTreeNode parent, String mapName, String detail) {
        return new PropertyException(
                "bad value for '" + mapName + "' on " + parent.path() + ", " + detail, parent.path(), mapName);
    }

    // --- naming ---

    private static Map<String, Long> namedCells(
            PartialTreeNode node, PartialTreeNode controller, long[] cells, String basename) {
        if (controller.bindings().isEmpty()) {
            throw new PropertyException(
                    basename + " controller " + controller.path() + " for " + node.path() + " lacks binding",
                    node.path(),
                    basename);
        }
        List<String> names = controller.specifierCells(basename);
        if (names.size() != cells.length) {
            throw new PropertyException(
                    "unexpected '" + basename + "-cells:' length in binding for " + controller.path() + " - "
                            + names.size() + " instead of " + cells.length,
                    node.path(),
                    basename);
        }
        Map<String, Long> data = new LinkedHashMap<>();
        for (int i = 0; i < cells.length; i++) {
            data.put(names.get(i), cells[i]);
        }
        return data;
    }

    /** Applies the {@code <ident>-names} property of {@code node} to {@code elements}. */
    private static List<ControllerAndData> withNames(
            PartialTreeNode node, String ident, List<ControllerAndData> elements) {
        List<String> names = HardwareDriver.names(node, ident, elements.size());
        if (names == null) {
            return elements;
        }
        List<ControllerAndData> named = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            ControllerAndData element = elements.get(i);
            named.add(element == null ? null : element.withName(names.get(i)));
        }
        return named;
    }

    private static int requiredCells(PartialTreeNode controller, String cellsName, PartialTreeNode referrer) {
        Long cells = controller.rawInt(cellsName);
        if (cells == null) {
            throw new PropertyException(
                    "expected '" + cellsName + "' property on " + controller.path() + " (referenced by "
                            + referrer.path() + ")",
                    referrer.path(),
                    cellsName);
        }
        return cells.intValue();
    }

    private static long[] cells(List<JsonNode> elements, PartialTreeNode node, String property) {
        long[] cells = Cells.numbers(elements);
        if (cells == null) {
            throw new PropertyException(
                    "expected 32-bit cells in '" + property + "' on " + node.path() + ", got " + elements,
                    node.path(),
                    property);
        }
        return cells;
    }
}
