package im.arun.mathmarkup.model;

import lombok.Value;

import java.util.List;

/**
 * A named child sequence of a node. Grid cells carry their coordinates,
 * every other slot has row and column -1.
 */
@Value
public class Slot {
    SlotName name;
    int row;
    int col;
    List<Node> nodes;

    public static Slot of(SlotName name, List<Node> nodes) {
        return new Slot(name, -1, -1, nodes);
    }

    public static Slot cell(int row, int col, List<Node> nodes) {
        return new Slot(SlotName.CELL, row, col, nodes);
    }
}
