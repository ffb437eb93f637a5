package com.napipe.runtime;

import com.napipe.data.InMemoryDataset;
import com.napipe.data.MissingValues;
import com.napipe.schema.Field;
import com.napipe.schema.SchemaView;
import com.napipe.stage.IndicatorColumn;
import com.napipe.stage.StageKind;
import com.napipe.types.BooleanType;
import com.napipe.types.DataType;
import com.napipe.types.VectorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks absent values with {@code true}.
 *
 * <p>A scalar source yields a boolean column; a vector source yields a boolean
 * vector of the same length, one flag per slot.
 */
public class IndicatorStage extends InMemoryStage<IndicatorColumn> {

    public IndicatorStage() {
        super(StageKind.INDICATOR);
    }

    @Override
    protected Field outputField(SchemaView input, IndicatorColumn instruction) {
        Field source = sourceField(input, instruction.source());
        DataType type = source.dataType() instanceof VectorType vector
            ? new VectorType(BooleanType.get(), vector.size())
            : BooleanType.get();
        return new Field(instruction.name(), type, source.slotNames());
    }

    @Override
    protected List<Object> computeCells(InMemoryDataset input, IndicatorColumn instruction, Field output) {
        boolean vector = output.dataType().isVector();
        List<Object> result = new ArrayList<>(input.rowCount());
        for (Object cell : input.column(instruction.source())) {
            if (vector) {
                List<Object> flags = new ArrayList<>();
                for (Object item : (List<?>) cell) {
                    flags.add(MissingValues.isMissing(item));
                }
                result.add(flags);
            } else {
                result.add(MissingValues.isMissing(cell));
            }
        }
        return result;
    }
}
