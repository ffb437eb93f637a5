package com.napipe.stage;

import java.util.Objects;

/**
 * One collaborator per stage kind, used to instantiate the stage groups of a
 * composed pipeline.
 */
public record StageCollaborators(
        StageCollaborator<IndicatorColumn> indicator,
        StageCollaborator<CoerceColumn> coercer,
        StageCollaborator<ReplaceColumn> replacer,
        StageCollaborator<MergeColumn> merger,
        StageCollaborator<String> dropper) {

    public StageCollaborators {
        Objects.requireNonNull(indicator, "indicator must not be null");
        Objects.requireNonNull(coercer, "coercer must not be null");
        Objects.requireNonNull(replacer, "replacer must not be null");
        Objects.requireNonNull(merger, "merger must not be null");
        Objects.requireNonNull(dropper, "dropper must not be null");
    }
}
