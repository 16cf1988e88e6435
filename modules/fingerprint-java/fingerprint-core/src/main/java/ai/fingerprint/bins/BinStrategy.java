package ai.fingerprint.bins;

/**
 * Which of bin width and bin count stays fixed while bins are made nicer.
 */
public enum BinStrategy {
    BY_WIDTH,
    BY_COUNT
}
