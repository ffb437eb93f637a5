package com.napipe.runtime;

import com.napipe.data.InMemoryDataset;
import com.napipe.data.MissingValues;
import com.napipe.schema.Field;
import com.napipe.schema.SchemaView;
import com.napipe.stage.ReplaceColumn;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;
import com.napipe.types.ColumnTypeDescriptor;
import com.napipe.types.DataType;
import com.napipe.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills absent values with the default, mean, minimum or maximum.
 *
 * <p>Replacement values are computed per slot for known-length vectors when
 * {@link ReplaceColumn#imputeBySlot()} is set, and over every item of the column
 * otherwise. Mean, minimum and maximum are rejected for text and boolean items.
 */
public class ReplacerStage extends InMemoryStage<ReplaceColumn> {

    public ReplacerStage() {
        super(StageKind.REPLACER);
    }

    @Override
    protected Field outputField(SchemaView input, ReplaceColumn instruction) {
        Field source = sourceField(input, instruction.source());
        ColumnTypeDescriptor type = ColumnTypeDescriptor.of(source.dataType());
        if (instruction.strategy().requiresOrderedItems() && !type.itemType().itemKind().isOrdered()) {
            throw new StageException(kind(), "cannot perform " + instruction.strategy()
                + " imputation on column '" + source.name() + "' of type " + TypeMapper.toRawKind(source.dataType()));
        }
        if (instruction.imputeBySlot() && type.isVariableLengthVector()) {
            throw new StageException(kind(), "cannot impute by slot on column '" + source.name()
                + "' of variable-length type " + TypeMapper.toRawKind(source.dataType()));
        }
        return new Field(instruction.name(), source.dataType(), source.slotNames());
    }

    @Override
    protected List<Object> computeCells(InMemoryDataset input, ReplaceColumn instruction, Field output) {
        List<Object> cells = input.column(instruction.source());
        ColumnTypeDescriptor type = ColumnTypeDescriptor.of(output.dataType());
        DataType itemType = type.itemType();

        if (!type.isVector()) {
            Object replacement = ReplacementValues.compute(instruction.strategy(), itemType, cells);
            List<Object> result = new ArrayList<>(cells.size());
            for (Object cell : cells) {
                result.add(MissingValues.isMissing(cell) ? replacement : cell);
            }
            return result;
        }

        List<Object> replacements = new ArrayList<>();
        if (instruction.imputeBySlot()) {
            for (int slot = 0; slot < type.vectorSize(); slot++) {
                List<Object> slotItems = new ArrayList<>(cells.size());
                for (Object cell : cells) {
                    slotItems.add(((List<?>) cell).get(slot));
                }
                replacements.add(ReplacementValues.compute(instruction.strategy(), itemType, slotItems));
            }
        } else {
            List<Object> allItems = new ArrayList<>();
            for (Object cell : cells) {
                allItems.addAll((List<?>) cell);
            }
            replacements.add(ReplacementValues.compute(instruction.strategy(), itemType, allItems));
        }

        List<Object> result = new ArrayList<>(cells.size());
        for (Object cell : cells) {
            List<?> items = (List<?>) cell;
            List<Object> filled = new ArrayList<>(items.size());
            for (int slot = 0; slot < items.size(); slot++) {
                Object item = items.get(slot);
                Object replacement = replacements.get(instruction.imputeBySlot() ? slot : 0);
                filled.add(MissingValues.isMissing(item) ? replacement : item);
            }
            result.add(filled);
        }
        return result;
    }
}
