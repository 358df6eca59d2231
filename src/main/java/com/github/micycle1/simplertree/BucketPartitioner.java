package com.github.micycle1.simplertree;

/**
 * Partial ordering of a point range into contiguous buckets.
 * <p>
 * After {@link #partition(PointSource, Axis, int, int, int)} every bucket of
 * {@code bucketSize} consecutive indices (aligned to {@code start}; the last
 * bucket may be shorter) holds coordinates that are all &le; those of every
 * later bucket along the chosen axis. Order inside a bucket is unspecified.
 * <p>
 * Buckets are produced by selecting the middle bucket boundary with a
 * quickselect, then recursing on the two halves of the bucket range, so the
 * cost is well below that of a full sort. Points are only ever moved through
 * {@link PointSource#swap(int, int)}.
 */
public final class BucketPartitioner {

	private BucketPartitioner() {
	}

	/**
	 * Rearranges {@code [start, end)} of {@code points} into ordered buckets.
	 *
	 * @param points     the point source to reorder in place
	 * @param axis       the coordinate to order by
	 * @param start      first index of the range (inclusive)
	 * @param end        last index of the range (exclusive)
	 * @param bucketSize number of points per bucket, at least 1
	 */
	public static void partition(PointSource points, Axis axis, int start, int end, int bucketSize) {
		if (bucketSize < 1) {
			throw new IllegalArgumentException("Bucket size must be positive: " + bucketSize);
		}
		final int n = end - start;
		if (n <= bucketSize) {
			return;
		}
		final int buckets = (n + bucketSize - 1) / bucketSize;
		partitionBuckets(points, axis, start, end, bucketSize, 0, buckets);
	}

	/**
	 * Orders buckets {@code [loBucket, hiBucket)} of the range beginning at
	 * {@code start} relative to each other.
	 */
	private static void partitionBuckets(PointSource points, Axis axis, int start, int end, int bucketSize, int loBucket, int hiBucket) {
		if (hiBucket - loBucket <= 1) {
			return;
		}
		final int midBucket = (loBucket + hiBucket) >>> 1;
		final int left = start + loBucket * bucketSize;
		final int right = Math.min(start + hiBucket * bucketSize, end) - 1;
		select(points, axis, left, right, start + midBucket * bucketSize);
		partitionBuckets(points, axis, start, end, bucketSize, loBucket, midBucket);
		partitionBuckets(points, axis, start, end, bucketSize, midBucket, hiBucket);
	}

	/**
	 * Moves the k-th smallest value of {@code [left, right]} to index {@code k},
	 * with everything before it &le; and everything after it &ge;.
	 */
	static void select(PointSource points, Axis axis, int left, int right, int k) {
		while (left < right) {
			final double pivot = axis.valueAt(points, (left + right) >>> 1);
			int i = left - 1, j = right + 1;
			while (true) {
				do {
					i++;
				} while (axis.valueAt(points, i) < pivot);
				do {
					j--;
				} while (axis.valueAt(points, j) > pivot);
				if (i >= j) {
					break;
				}
				points.swap(i, j);
			}
			// [left, j] <= pivot <= [j + 1, right]
			if (k <= j) {
				right = j;
			} else {
				left = j + 1;
			}
		}
	}
}
