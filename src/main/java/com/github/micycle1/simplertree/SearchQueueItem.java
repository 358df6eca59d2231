package com.github.micycle1.simplertree;

import java.util.Comparator;

/**
 * A pooled entry of the nearest-neighbour priority queue: a node and the lower
 * bound of its squared distance to the query point.
 */
final class SearchQueueItem {

	static final Comparator<SearchQueueItem> BY_DISTANCE = (a, b) -> Double.compare(a.distance, b.distance);

	SimpleRTree.Node node;
	double distance;

	void reset() {
		node = null;
		distance = Double.POSITIVE_INFINITY;
	}

	@Override
	public String toString() {
		return "SearchQueueItem(" + distance + ")";
	}
}
