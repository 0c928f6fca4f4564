package dev.postrelay.model;

/**
 * How an approved item reaches the target: picked by the publish job, or only by an operator.
 */
public enum ApprovalMode {
    AUTO,
    MANUAL;

    public static ApprovalMode of(boolean autoPostEnabled) {
        return autoPostEnabled ? AUTO : MANUAL;
    }
}
