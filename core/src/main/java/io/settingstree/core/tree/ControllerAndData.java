package io.settingstree.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One element of an indexed reference list or of a node's interrupts, e.g. {@code <&gpio0 4 0>}.
 *
 * @param nodePath   path of the node carrying the property
 * @param controller the controller the element resolves to, after any {@code <ns>-map} lookups
 * @param data       cell values keyed by the controller binding's {@code <ns>-cells} names
 * @param name       element name from the {@code <ns>-names} property, or null
 * @param basename   specifier space, e.g. {@code gpio} or {@code interrupt}
 */
public record ControllerAndData(
        String nodePath, Node controller, Map<String, Long> data, String name, String basename) {

    public ControllerAndData {
        Objects.requireNonNull(nodePath, "nodePath must not be null");
        Objects.requireNonNull(controller, "controller must not be null");
        data = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(data, "data must not be null")));
    }

    /** Returns a copy that points at {@code newController}. */
    public ControllerAndData withController(Node newController) {
        return new ControllerAndData(nodePath, newController, data, name, basename);
    }

    /** Returns a copy carrying {@code newName}. */
    ControllerAndData withName(String newName) {
        return new ControllerAndData(nodePath, controller, data, newName, basename);
    }
}
