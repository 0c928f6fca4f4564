package dev.postrelay.dto;

import lombok.Data;

@Data
public class ApprovalRequest {

    /**
     * True to let the publish job pick the item, false for manual publishing only.
     */
    private boolean autoPost = true;

    /**
     * Publish priority, higher goes first. Null keeps the current value.
     */
    private Integer priority;
}
