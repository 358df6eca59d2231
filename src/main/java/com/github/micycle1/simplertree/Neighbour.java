package com.github.micycle1.simplertree;

import org.locationtech.jts.geom.Coordinate;

/**
 * Result of a nearest-neighbour query.
 */
public final class Neighbour {

	/**
	 * Returned when the index is unbuilt or empty.
	 */
	public static final Neighbour NOT_FOUND = new Neighbour(false, -1, Double.NaN, Double.NaN, Double.POSITIVE_INFINITY);

	private final boolean found;
	private final int index;
	private final double x;
	private final double y;
	private final double distanceSquared;

	private Neighbour(boolean found, int index, double x, double y, double distanceSquared) {
		this.found = found;
		this.index = index;
		this.x = x;
		this.y = y;
		this.distanceSquared = distanceSquared;
	}

	static Neighbour of(int index, double x, double y, double distanceSquared) {
		return new Neighbour(true, index, x, y, distanceSquared);
	}

	public boolean isFound() {
		return found;
	}

	/**
	 * @return position of the point in the (reordered) point source, or -1
	 */
	public int getIndex() {
		return index;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getDistanceSquared() {
		return distanceSquared;
	}

	/**
	 * @return the point as a JTS coordinate, or null when nothing was found
	 */
	public Coordinate toCoordinate() {
		return found ? new Coordinate(x, y) : null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Neighbour)) {
			return false;
		}
		Neighbour other = (Neighbour) o;
		return found == other.found && index == other.index && Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
				&& Double.compare(distanceSquared, other.distanceSquared) == 0;
	}

	@Override
	public int hashCode() {
		int result = Boolean.hashCode(found);
		result = 31 * result + index;
		result = 31 * result + Double.hashCode(x);
		result = 31 * result + Double.hashCode(y);
		return result;
	}

	@Override
	public String toString() {
		if (!found) {
			return "Neighbour(not found)";
		}
		return "Neighbour(" + index + ": " + x + ", " + y + " d2=" + distanceSquared + ")";
	}
}
