package com.github.micycle1.simplertree;

/**
 * A fixed-length, indexable and swappable collection of 2D points owned by the
 * caller. {@link SimpleRTree} never copies coordinates out of a source; bulk
 * loading reorders it in place through {@link #swap(int, int)} and nodes then
 * refer to contiguous index ranges of the reordered source.
 * <p>
 * Implementations must be well formed: indices in {@code [0, size())} are
 * readable, coordinates are finite, and a swap is visible to subsequent reads
 * immediately. These preconditions are not checked.
 */
public interface PointSource {

	/**
	 * @return number of points
	 */
	int size();

	double getX(int index);

	double getY(int index);

	/**
	 * Exchanges the points (and any payload the caller associates with them) at
	 * two indices.
	 */
	void swap(int i, int j);

}
