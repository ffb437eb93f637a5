package com.napipe.runtime;

import com.napipe.stage.StageCollaborators;

/**
 * Factory for the in-memory reference collaborators.
 */
public final class InMemoryStages {

    private InMemoryStages() {}

    /**
     * Returns one in-memory collaborator per stage kind.
     *
     * @return the collaborators
     */
    public static StageCollaborators collaborators() {
        return new StageCollaborators(
            new IndicatorStage(),
            new CoercerStage(),
            new ReplacerStage(),
            new MergerStage(),
            new DropperStage());
    }
}
