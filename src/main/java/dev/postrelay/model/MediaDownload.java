package dev.postrelay.model;

import java.io.InputStream;

/**
 * An opened media artifact ready to be streamed to the caller.
 */
public record MediaDownload(Long itemId, String fileName, long size, InputStream content) {
}
