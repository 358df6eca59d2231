package com.github.micycle1.simplertree;

import org.locationtech.jts.geom.Envelope;

/**
 * Immutable axis-aligned bounding box. A point is represented as a degenerate
 * box whose min and max corners coincide.
 */
public final class BBox {

	final double minX;
	final double minY;
	final double maxX;
	final double maxY;

	public BBox(double minX, double minY, double maxX, double maxY) {
		if (minX > maxX || minY > maxY) {
			throw new IllegalArgumentException("Inverted bounding box: " + minX + "," + minY + " -> " + maxX + "," + maxY);
		}
		this.minX = minX;
		this.minY = minY;
		this.maxX = maxX;
		this.maxY = maxY;
	}

	/**
	 * Creates the degenerate box of a single point.
	 */
	public static BBox ofPoint(double x, double y) {
		return new BBox(x, y, x, y);
	}

	/**
	 * Converts a non-null JTS envelope into a box.
	 *
	 * @throws IllegalArgumentException if the envelope is null (empty)
	 */
	public static BBox fromEnvelope(Envelope env) {
		if (env.isNull()) {
			throw new IllegalArgumentException("Cannot convert an empty envelope");
		}
		return new BBox(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
	}

	/**
	 * Returns the smallest box containing both this box and {@code other}.
	 *
	 * @param other the box to union with
	 * @return a new box; neither operand is modified
	 */
	public BBox extend(BBox other) {
		return new BBox(Math.min(minX, other.minX), Math.min(minY, other.minY), Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
	}

	/**
	 * Computes the squared-distance bounds from a query point to any point that
	 * may lie within this box.
	 * <p>
	 * The lower bound is the squared distance to the nearest point of the box (0
	 * when the query lies inside or on the boundary). The upper bound is the
	 * squared distance to the farthest corner. For a degenerate (point) box both
	 * bounds are the exact squared distance.
	 *
	 * @param x query x
	 * @param y query y
	 * @return the lower and upper squared-distance bounds
	 */
	public DistanceBounds distanceBounds(double x, double y) {
		return new DistanceBounds(lowerBound(x, y), upperBound(x, y));
	}

	/**
	 * Squared distance from (x,y) to the closest point of this box.
	 */
	double lowerBound(double x, double y) {
		final double dx = x < minX ? minX - x : (x > maxX ? x - maxX : 0);
		final double dy = y < minY ? minY - y : (y > maxY ? y - maxY : 0);
		return dx * dx + dy * dy;
	}

	/**
	 * Squared distance from (x,y) to the farthest corner of this box.
	 */
	double upperBound(double x, double y) {
		final double dx = Math.max(Math.abs(x - minX), Math.abs(x - maxX));
		final double dy = Math.max(Math.abs(y - minY), Math.abs(y - maxY));
		return dx * dx + dy * dy;
	}

	public boolean contains(double x, double y) {
		return x >= minX && x <= maxX && y >= minY && y <= maxY;
	}

	public boolean isPoint() {
		return minX == maxX && minY == maxY;
	}

	public double getMinX() {
		return minX;
	}

	public double getMinY() {
		return minY;
	}

	public double getMaxX() {
		return maxX;
	}

	public double getMaxY() {
		return maxY;
	}

	/**
	 * @return a new JTS envelope covering the same extent
	 */
	public Envelope toEnvelope() {
		return new Envelope(minX, maxX, minY, maxY);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BBox)) {
			return false;
		}
		BBox other = (BBox) o;
		return Double.compare(minX, other.minX) == 0 && Double.compare(minY, other.minY) == 0 && Double.compare(maxX, other.maxX) == 0
				&& Double.compare(maxY, other.maxY) == 0;
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(minX);
		result = 31 * result + Double.hashCode(minY);
		result = 31 * result + Double.hashCode(maxX);
		result = 31 * result + Double.hashCode(maxY);
		return result;
	}

	@Override
	public String toString() {
		return "BBox[" + minX + " : " + maxX + ", " + minY + " : " + maxY + "]";
	}

	/**
	 * Lower and upper squared-distance bounds from a query point to a box.
	 */
	public static final class DistanceBounds {

		private final double lower;
		private final double upper;

		DistanceBounds(double lower, double upper) {
			this.lower = lower;
			this.upper = upper;
		}

		public double getLower() {
			return lower;
		}

		public double getUpper() {
			return upper;
		}

		@Override
		public String toString() {
			return "DistanceBounds(" + lower + ", " + upper + ")";
		}
	}
}
