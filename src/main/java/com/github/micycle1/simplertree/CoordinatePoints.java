package com.github.micycle1.simplertree;

import org.locationtech.jts.geom.Coordinate;

/**
 * A {@link PointSource} over a JTS coordinate array, reordered in place. Only
 * the x and y ordinates are indexed.
 */
public class CoordinatePoints implements PointSource {

	private final Coordinate[] coordinates;

	public CoordinatePoints(Coordinate[] coordinates) {
		this.coordinates = coordinates;
	}

	@Override
	public int size() {
		return coordinates.length;
	}

	@Override
	public double getX(int index) {
		return coordinates[index].x;
	}

	@Override
	public double getY(int index) {
		return coordinates[index].y;
	}

	@Override
	public void swap(int i, int j) {
		Coordinate tmp = coordinates[i];
		coordinates[i] = coordinates[j];
		coordinates[j] = tmp;
	}

	public Coordinate get(int index) {
		return coordinates[index];
	}
}
