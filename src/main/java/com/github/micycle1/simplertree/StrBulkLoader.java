package com.github.micycle1.simplertree;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

import com.github.micycle1.simplertree.SimpleRTree.Node;

/**
 * Sort-Tile-Recursive bulk loader.
 * <p>
 * A node spanning N points at height h is split into
 * <code>M' = ceil(N / M^(h-1))</code> children: the range is first cut into
 * vertical slices of <code>N1 = N2 * ceil(sqrt(M'))</code> points ordered by x,
 * then each slice into buckets of <code>N2 = ceil(N / M')</code> points ordered
 * by y. Each bucket becomes a child and is split the same way until it holds at
 * most M points, at which point it becomes a bucket node owning one leaf per
 * point. Bounding boxes are aggregated bottom-up once the whole tree exists.
 */
final class StrBulkLoader {

	private final PointSource points;
	private final int maxEntries;
	private final boolean parallel;
	private final int parallelThreshold;

	StrBulkLoader(PointSource points, RTreeOptions options) {
		this.points = points;
		this.maxEntries = options.getMaxEntries();
		this.parallel = options.isParallelBuild();
		this.parallelThreshold = options.getParallelThreshold();
	}

	/**
	 * Builds the tree over every point of the source.
	 *
	 * @param xSorted whether the caller guarantees the source is already sliced
	 *                by x, letting the root skip its x partition
	 * @return the root, with all bounding boxes computed
	 */
	Node load(boolean xSorted) {
		final int n = points.size();
		Node root = new Node(0, n, rootHeight(n, maxEntries));
		if (parallel && n >= parallelThreshold) {
			ForkJoinPool.commonPool().invoke(new BuildTask(root, xSorted));
		} else {
			buildDownwards(root, xSorted);
		}
		root.computeBBoxUpwards();
		return root;
	}

	/**
	 * ceil(log_M(n)), with a minimum of 1. Integer arithmetic avoids the rounding
	 * of log ratios at exact powers of M.
	 */
	static int rootHeight(int n, int maxEntries) {
		int height = 1;
		long capacity = maxEntries;
		while (capacity < n) {
			capacity *= maxEntries;
			height++;
		}
		return height;
	}

	private void buildDownwards(Node node, boolean xSorted) {
		for (Node child : split(node, xSorted)) {
			buildDownwards(child, false);
		}
	}

	/**
	 * Partitions the range of {@code node} and attaches its children. Returns the
	 * children that still need splitting.
	 */
	private List<Node> split(Node node, boolean xSorted) {
		final int n = node.end - node.start;
		if (n <= maxEntries) {
			setBucketNode(node);
			return List.of();
		}

		final long subtreeCapacity = pow(maxEntries, node.height - 1);
		final int m = (int) ((n + subtreeCapacity - 1) / subtreeCapacity);
		final int n2 = (n + m - 1) / m;
		final int n1 = n2 * (int) Math.ceil(Math.sqrt(m));

		if (!xSorted) {
			BucketPartitioner.partition(points, Axis.X, node.start, node.end, n1);
		}
		node.children = new ArrayList<>(m);
		for (int i = 0; i < n; i += n1) {
			final int sliceEnd = Math.min(i + n1, n);
			BucketPartitioner.partition(points, Axis.Y, node.start + i, node.start + sliceEnd, n2);
			for (int j = i; j < sliceEnd; j += n2) {
				final int bucketEnd = Math.min(j + n2, sliceEnd);
				node.children.add(new Node(node.start + j, node.start + bucketEnd, node.height - 1));
			}
		}
		return node.children;
	}

	private void setBucketNode(Node node) {
		node.height = 1;
		node.children = new ArrayList<>(node.end - node.start);
		for (int i = node.start; i < node.end; i++) {
			node.children.add(Node.leaf(i, points.getX(i), points.getY(i)));
		}
	}

	private static long pow(int base, int exponent) {
		long result = 1;
		for (int i = 0; i < exponent; i++) {
			result *= base;
		}
		return result;
	}

	/**
	 * Builds one subtree. Children spanning at least the parallel threshold are
	 * forked; smaller ones are built inline. Sibling ranges are disjoint so no
	 * two tasks ever swap the same indices.
	 */
	private class BuildTask extends RecursiveAction {

		private final Node node;
		private final boolean xSorted;

		BuildTask(Node node, boolean xSorted) {
			this.node = node;
			this.xSorted = xSorted;
		}

		@Override
		protected void compute() {
			List<BuildTask> forked = new ArrayList<>();
			for (Node child : split(node, xSorted)) {
				if (child.end - child.start >= parallelThreshold) {
					forked.add(new BuildTask(child, false));
				} else {
					buildDownwards(child, false);
				}
			}
			invokeAll(forked);
		}
	}
}
