package im.arun.mathmarkup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Common shape of matrices, stacks and cases: a rows by cols grid where
 * every cell is present, even when empty.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class GridNode extends Node {

    @JsonProperty("rows")
    private int rows;

    @JsonProperty("cols")
    private int cols;

    @JsonProperty("cells")
    private List<List<List<Node>>> cells = new ArrayList<>();

    protected GridNode(String id, int rows, int cols) {
        super(id);
        this.rows = rows;
        this.cols = cols;
        for (int r = 0; r < rows; r++) {
            List<List<Node>> row = new ArrayList<>();
            for (int c = 0; c < cols; c++) {
                row.add(new ArrayList<>());
            }
            cells.add(row);
        }
    }

    public List<Node> getCell(int row, int col) {
        return cells.get(row).get(col);
    }

    @Override
    public List<Slot> getSlots() {
        List<Slot> slots = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                slots.add(Slot.cell(r, c, getCell(r, c)));
            }
        }
        return slots;
    }
}
