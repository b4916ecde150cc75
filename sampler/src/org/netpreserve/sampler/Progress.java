package org.netpreserve.sampler;

/**
 * Point-in-time counters for a run.
 */
public record Progress(long runtime, int urls, int urlsDone, int urlsFailed, int snapshotsFetched,
                       int snapshotsCached, int snapshotsFailed) {
}
