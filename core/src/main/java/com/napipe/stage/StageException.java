package com.napipe.stage;

/**
 * Exception thrown by a stage collaborator that cannot accept its instructions
 * or fails while transforming data.
 */
public class StageException extends RuntimeException {

    private final StageKind stageKind;

    public StageException(StageKind stageKind, String message) {
        super(stageKind.displayName() + " stage: " + message);
        this.stageKind = stageKind;
    }

    public StageException(StageKind stageKind, String message, Throwable cause) {
        super(stageKind.displayName() + " stage: " + message, cause);
        this.stageKind = stageKind;
    }

    /**
     * Returns the kind of stage that raised this exception.
     *
     * @return the stage kind
     */
    public StageKind getStageKind() {
        return stageKind;
    }
}
