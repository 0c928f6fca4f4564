package dev.postrelay.model;

/**
 * One post handed over by the scraper.
 *
 * @param sourceRef      username of the scraped profile, may be null
 * @param rawText        post text, possibly containing HTML
 * @param sourceMediaUrl media attached to the original post, may be null
 */
public record RawContent(String sourceRef, String rawText, String sourceMediaUrl) {

    public static RawContent of(String sourceRef, String rawText) {
        return new RawContent(sourceRef, rawText, null);
    }
}
