package com.napipe.runtime;

import com.napipe.data.InMemoryDataset;
import com.napipe.schema.Field;
import com.napipe.schema.SchemaView;
import com.napipe.stage.CoerceColumn;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;
import com.napipe.types.DataType;
import com.napipe.types.TypeCompatibility;
import com.napipe.types.TypeMapper;
import com.napipe.types.VectorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-types columns using the standard conversions of {@link TypeCompatibility}.
 */
public class CoercerStage extends InMemoryStage<CoerceColumn> {

    public CoercerStage() {
        super(StageKind.COERCER);
    }

    @Override
    protected Field outputField(SchemaView input, CoerceColumn instruction) {
        Field source = sourceField(input, instruction.source());
        DataType sourceType = source.dataType();
        if (!TypeCompatibility.canConvert(sourceType.itemType(), instruction.resultType()).possible()) {
            throw new StageException(kind(), "no conversion from " + TypeMapper.toRawKind(sourceType.itemType())
                + " to " + TypeMapper.toRawKind(instruction.resultType()) + " for column '" + source.name() + "'");
        }
        DataType type = sourceType instanceof VectorType vector
            ? new VectorType(instruction.resultType(), vector.size())
            : instruction.resultType();
        return new Field(instruction.name(), type, source.slotNames());
    }

    @Override
    protected List<Object> computeCells(InMemoryDataset input, CoerceColumn instruction, Field output) {
        DataType from = input.schema().fieldByName(instruction.source()).dataType().itemType();
        DataType to = instruction.resultType();
        boolean vector = output.dataType().isVector();

        List<Object> result = new ArrayList<>(input.rowCount());
        for (Object cell : input.column(instruction.source())) {
            if (vector) {
                List<Object> items = new ArrayList<>();
                for (Object item : (List<?>) cell) {
                    items.add(ValueConverter.convert(item, from, to));
                }
                result.add(items);
            } else {
                result.add(ValueConverter.convert(cell, from, to));
            }
        }
        return result;
    }
}
