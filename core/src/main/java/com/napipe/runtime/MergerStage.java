package com.napipe.runtime;

import com.napipe.data.InMemoryDataset;
import com.napipe.schema.Field;
import com.napipe.schema.SchemaView;
import com.napipe.stage.MergeColumn;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;
import com.napipe.stage.TaggedSource;
import com.napipe.types.DataType;
import com.napipe.types.TypeMapper;
import com.napipe.types.VectorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates tagged columns of one item type into a vector column.
 *
 * <p>The output length is the sum of the part lengths (a scalar counts as one),
 * or unknown if any part has unknown length. Known-length outputs get slot names:
 * the tag for a scalar part, and {@code tag.<slot>} for each slot of a vector
 * part, where {@code <slot>} is the part's own slot name or else its index.
 */
public class MergerStage extends InMemoryStage<MergeColumn> {

    public MergerStage() {
        super(StageKind.MERGER);
    }

    @Override
    protected Field outputField(SchemaView input, MergeColumn instruction) {
        DataType itemType = null;
        int size = 0;
        boolean knownSize = true;
        List<String> slotNames = new ArrayList<>();

        for (TaggedSource part : instruction.sources()) {
            Field source = sourceField(input, part.source());
            DataType partItem = source.dataType().itemType();
            if (itemType == null) {
                itemType = partItem;
            } else if (!itemType.equals(partItem)) {
                throw new StageException(kind(), "cannot merge '" + part.source() + "' of item type "
                    + TypeMapper.toRawKind(partItem) + " into '" + instruction.name() + "' of item type "
                    + TypeMapper.toRawKind(itemType));
            }

            if (source.dataType() instanceof VectorType vector) {
                if (!vector.isKnownSize()) {
                    knownSize = false;
                    continue;
                }
                size += vector.size();
                for (int slot = 0; slot < vector.size(); slot++) {
                    String slotLabel = source.slotNames().isEmpty()
                        ? Integer.toString(slot)
                        : source.slotNames().get(slot);
                    slotNames.add(part.tag() + "." + slotLabel);
                }
            } else {
                size += 1;
                slotNames.add(part.tag());
            }
        }

        if (!knownSize) {
            return new Field(instruction.name(), new VectorType(itemType));
        }
        return new Field(instruction.name(), new VectorType(itemType, size), slotNames);
    }

    @Override
    protected List<Object> computeCells(InMemoryDataset input, MergeColumn instruction, Field output) {
        List<Object> result = new ArrayList<>(input.rowCount());
        for (int row = 0; row < input.rowCount(); row++) {
            List<Object> merged = new ArrayList<>();
            for (TaggedSource part : instruction.sources()) {
                Object cell = input.column(part.source()).get(row);
                if (cell instanceof List<?> items) {
                    merged.addAll(items);
                } else {
                    merged.add(cell);
                }
            }
            result.add(merged);
        }
        return result;
    }
}
