package dev.postrelay.model;

import java.util.EnumSet;
import java.util.Set;

import static dev.postrelay.model.LifecycleState.*;

/**
 * Legal transitions of the content lifecycle and the states each one may start from.
 */
public enum LifecycleTransition {

    GENERATE_MEDIA(EnumSet.of(SCRAPED)),
    APPROVE(EnumSet.of(MEDIA_GENERATED, APPROVED, REJECTED)),
    REJECT(EnumSet.of(MEDIA_GENERATED, APPROVED, REJECTED)),
    PUBLISH(EnumSet.of(APPROVED)),
    DOWNLOAD(EnumSet.of(PUBLISHED, DOWNLOADED)),
    DELETE(EnumSet.complementOf(EnumSet.of(APPROVED)));

    private final Set<LifecycleState> allowedFrom;

    LifecycleTransition(Set<LifecycleState> allowedFrom) {
        this.allowedFrom = allowedFrom;
    }

    public boolean isAllowedFrom(LifecycleState state) {
        return allowedFrom.contains(state);
    }
}
