package io.settingstree.core.tree;

/**
 * One translation of a node's {@code ranges} property.
 *
 * @param childBusCells     cells of a child bus address
 * @param childBusAddress   child bus address, or null when the child has no address cells
 * @param parentBusCells    cells of a parent bus address
 * @param parentBusAddress  parent bus address, or null when the parent has no address cells
 * @param lengthCells       cells of the length
 * @param length            size of the range, or null when the child has no size cells
 */
public record AddressRange(
        int childBusCells,
        Long childBusAddress,
        int parentBusCells,
        Long parentBusAddress,
        int lengthCells,
        Long length) {}
