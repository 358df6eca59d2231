package com.github.micycle1.simplertree;

/**
 * Coordinate axis along which a {@link BucketPartitioner} orders points.
 */
public enum Axis {
	X {
		@Override
		double valueAt(PointSource points, int index) {
			return points.getX(index);
		}
	},
	Y {
		@Override
		double valueAt(PointSource points, int index) {
			return points.getY(index);
		}
	};

	abstract double valueAt(PointSource points, int index);
}
