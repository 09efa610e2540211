package io.settingstree.core.tree;

/**
 * One entry of a node's {@code reg} property.
 *
 * @param name    name from {@code reg-names}, or null
 * @param address start address in the root address space, or null when {@code #address-cells} is 0
 * @param size    length in bytes, or null when {@code #size-cells} is 0
 */
public record Register(String name, Long address, Long size) {

    Register withName(String newName) {
        return new Register(newName, address, size);
    }
}
