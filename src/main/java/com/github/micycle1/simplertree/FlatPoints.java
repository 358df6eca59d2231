package com.github.micycle1.simplertree;

/**
 * A {@link PointSource} over an interleaved coordinate array
 * <code>[x0, y0, x1, y1, ...]</code>. The array is wrapped, not copied, and is
 * reordered in place when a tree is loaded from it.
 */
public class FlatPoints implements PointSource {

	private final double[] coords;

	public FlatPoints(double... coords) {
		if ((coords.length & 1) != 0) {
			throw new IllegalArgumentException("Expected an even number of coordinates, got " + coords.length);
		}
		this.coords = coords;
	}

	@Override
	public int size() {
		return coords.length >> 1;
	}

	@Override
	public double getX(int index) {
		return coords[index << 1];
	}

	@Override
	public double getY(int index) {
		return coords[(index << 1) + 1];
	}

	@Override
	public void swap(int i, int j) {
		final int a = i << 1, b = j << 1;
		final double tx = coords[a], ty = coords[a + 1];
		coords[a] = coords[b];
		coords[a + 1] = coords[b + 1];
		coords[b] = tx;
		coords[b + 1] = ty;
	}

	/**
	 * @return the backing array (not a copy)
	 */
	public double[] getCoordinates() {
		return coords;
	}
}
