package com.github.micycle1.simplertree;

/**
 * Immutable construction-time options of a {@link SimpleRTree}.
 */
public final class RTreeOptions {

	public static final int DEFAULT_MAX_ENTRIES = 9;
	public static final int DEFAULT_PARALLEL_THRESHOLD = 8192;

	private static final RTreeOptions DEFAULTS = new RTreeOptions(DEFAULT_MAX_ENTRIES, false, DEFAULT_PARALLEL_THRESHOLD);

	private final int maxEntries;
	private final boolean parallelBuild;
	private final int parallelThreshold;

	private RTreeOptions(int maxEntries, boolean parallelBuild, int parallelThreshold) {
		if (maxEntries < 2) {
			throw new IllegalArgumentException("maxEntries must be at least 2: " + maxEntries);
		}
		if (parallelThreshold < 1) {
			throw new IllegalArgumentException("parallelThreshold must be positive: " + parallelThreshold);
		}
		this.maxEntries = maxEntries;
		this.parallelBuild = parallelBuild;
		this.parallelThreshold = parallelThreshold;
	}

	/**
	 * Branching factor 9, sequential build.
	 */
	public static RTreeOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * @param maxEntries branching factor: maximum children per node and points per
	 *                   bucket node; at least 2
	 */
	public RTreeOptions withMaxEntries(int maxEntries) {
		return new RTreeOptions(maxEntries, parallelBuild, parallelThreshold);
	}

	/**
	 * Enables building independent subtrees as fork/join tasks. The resulting tree
	 * is identical to a sequential build.
	 */
	public RTreeOptions withParallelBuild(boolean parallelBuild) {
		return new RTreeOptions(maxEntries, parallelBuild, parallelThreshold);
	}

	/**
	 * @param parallelThreshold minimum number of points a subtree must span before
	 *                          it is forked as a separate task
	 */
	public RTreeOptions withParallelThreshold(int parallelThreshold) {
		return new RTreeOptions(maxEntries, parallelBuild, parallelThreshold);
	}

	public int getMaxEntries() {
		return maxEntries;
	}

	public boolean isParallelBuild() {
		return parallelBuild;
	}

	public int getParallelThreshold() {
		return parallelThreshold;
	}

	@Override
	public String toString() {
		return "RTreeOptions(maxEntries=" + maxEntries + ", parallelBuild=" + parallelBuild + ", parallelThreshold=" + parallelThreshold + ")";
	}
}
