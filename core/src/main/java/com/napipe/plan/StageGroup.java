package com.napipe.plan;

import com.napipe.stage.StageKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered instructions for one stage collaborator, instantiated as a single stage
 * operating on every column that needs it.
 *
 * <p>Groups are immutable; they are accumulated through a {@link Builder} and
 * finalized once.
 *
 * @param <T> the instruction type
 */
public final class StageGroup<T> {

    private final StageKind kind;
    private final List<T> instructions;

    private StageGroup(StageKind kind, List<T> instructions) {
        this.kind = kind;
        this.instructions = List.copyOf(instructions);
    }

    /**
     * Starts accumulating a group.
     *
     * @param kind the stage kind
     * @param <T> the instruction type
     * @return an empty builder
     */
    public static <T> Builder<T> builder(StageKind kind) {
        return new Builder<>(kind);
    }

    public StageKind kind() {
        return kind;
    }

    /**
     * Returns the instructions in request order.
     *
     * @return an unmodifiable list
     */
    public List<T> instructions() {
        return instructions;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageGroup<?> that)) return false;
        return kind == that.kind && instructions.equals(that.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, instructions);
    }

    @Override
    public String toString() {
        return kind.displayName() + instructions;
    }

    /**
     * Accumulates instructions for a {@link StageGroup}.
     *
     * @param <T> the instruction type
     */
    public static final class Builder<T> {

        private final StageKind kind;
        private final List<T> instructions = new ArrayList<>();
        private boolean built;

        private Builder(StageKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder<T> add(T instruction) {
            if (built) {
                throw new IllegalStateException(kind.displayName() + " group already built");
            }
            instructions.add(Objects.requireNonNull(instruction, "instruction must not be null"));
            return this;
        }

        public StageGroup<T> build() {
            built = true;
            return new StageGroup<>(kind, instructions);
        }
    }
}
