package org.netpreserve.sampler.archive;

import org.jetbrains.annotations.Nullable;

/**
 * Undecoded body of a capture as served by the replay endpoint.
 *
 * @param body        the original captured bytes
 * @param contentType Content-Type of the capture, if known
 */
public record FetchedBody(byte[] body, @Nullable String contentType) {
}
