package com.github.micycle1.simplertree;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A static R-tree over a caller-owned array of 2D points, bulk loaded with the
 * Sort-Tile-Recursive algorithm and queried for the nearest point.
 * <p>
 * Loading reorders the {@link PointSource} in place; nodes refer to contiguous
 * index ranges of the reordered source rather than holding coordinates. The tree
 * can be loaded once only. After loading, the tree and the point source are
 * read-only and any number of threads may query concurrently.
 */
public class SimpleRTree {

	private static final Logger log = LoggerFactory.getLogger(SimpleRTree.class);

	private static final int QUEUE_POOL_SIZE = 2;

	private final RTreeOptions options;
	Node root;
	private PointSource points;
	private volatile boolean built;
	SearchPool<SearchQueueItem> itemPool;
	SearchPool<PriorityQueue<SearchQueueItem>> queuePool;

	/**
	 * Creates an unbuilt tree with {@link RTreeOptions#defaults()}.
	 */
	public SimpleRTree() {
		this(RTreeOptions.defaults());
	}

	public SimpleRTree(RTreeOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	/**
	 * Bulk loads the tree from unsorted points. The source is reordered in place.
	 * An empty source leaves the tree unbuilt.
	 *
	 * @param points the points to index
	 * @return this tree
	 * @throws IllegalStateException if the tree has already been loaded
	 */
	public SimpleRTree load(PointSource points) {
		return load(points, false);
	}

	/**
	 * Bulk loads the tree from points whose order already satisfies the root's x
	 * slicing, skipping that partition step. The order is not verified; an input
	 * that does not satisfy it yields a valid but poorly clustered tree.
	 *
	 * @param points the points to index
	 * @return this tree
	 * @throws IllegalStateException if the tree has already been loaded
	 */
	public SimpleRTree loadSorted(PointSource points) {
		return load(points, true);
	}

	private synchronized SimpleRTree load(PointSource points, boolean xSorted) {
		Objects.requireNonNull(points, "points");
		if (points.size() == 0) {
			log.debug("Ignoring load of an empty point source");
			return this;
		}
		if (built) {
			log.warn("Rejected second load of {} points into a tree of {} points", points.size(), size());
			throw new IllegalStateException("Tree is static, cannot load twice");
		}

		final long start = System.nanoTime();
		final Node node = new StrBulkLoader(points, options).load(xSorted);
		final int poolSize = node.height * options.getMaxEntries();

		this.points = points;
		this.root = node;
		this.itemPool = new SearchPool<>(poolSize, SearchQueueItem::new, SearchQueueItem::reset);
		this.queuePool = new SearchPool<>(QUEUE_POOL_SIZE, () -> new PriorityQueue<>(poolSize, SearchQueueItem.BY_DISTANCE),
				PriorityQueue::clear);
		this.built = true;

		if (log.isDebugEnabled()) {
			log.debug("Loaded {} points (height {}, {}) in {} ms", points.size(), node.height, options, (System.nanoTime() - start) / 1_000_000);
		}
		return this;
	}

	/**
	 * Finds the indexed point closest to (x,y) by squared Euclidean distance.
	 * <p>
	 * Nodes are visited in order of the lower bound of their distance to the
	 * query. The first point leaf taken from the queue is therefore a nearest
	 * point, and the search stops as soon as the next candidate's lower bound
	 * exceeds its distance. Children whose lower bound exceeds the smallest upper
	 * bound seen so far are never queued. Among equally near points the one
	 * returned is fixed for a given tree.
	 *
	 * @return the nearest point, or {@link Neighbour#NOT_FOUND} when the tree is
	 *         unbuilt
	 */
	public Neighbour findNearest(double x, double y) {
		if (!built) {
			return Neighbour.NOT_FOUND;
		}
		final SearchPool<SearchQueueItem> pool = itemPool;
		final PriorityQueue<SearchQueueItem> queue = queuePool.take();

		Node best = null;
		double bestDistance = Double.POSITIVE_INFINITY;
		double distanceUpperBound = root.bbox.upperBound(x, y);

		final SearchQueueItem rootItem = pool.take();
		rootItem.node = root;
		rootItem.distance = root.bbox.lowerBound(x, y);
		queue.add(rootItem);

		while (!queue.isEmpty()) {
			final SearchQueueItem item = queue.poll();
			final Node node = item.node;
			final double distance = item.distance;
			pool.giveBack(item);

			if (best != null && distance > bestDistance) {
				break;
			}
			if (node.leaf) {
				// leaf bounds are exact, and nothing left in the queue is closer
				if (best == null) {
					best = node;
					bestDistance = distance;
				}
				continue;
			}
			for (Node child : node.children) {
				final double lower = child.bbox.lowerBound(x, y);
				if (lower <= distanceUpperBound) {
					final SearchQueueItem childItem = pool.take();
					childItem.node = child;
					childItem.distance = lower;
					queue.add(childItem);
				}
				// every point of the child lies within its farthest corner
				final double upper = child.bbox.upperBound(x, y);
				if (upper < distanceUpperBound) {
					distanceUpperBound = upper;
				}
			}
		}

		while (!queue.isEmpty()) {
			pool.giveBack(queue.poll());
		}
		queuePool.giveBack(queue);

		if (best == null) {
			return Neighbour.NOT_FOUND;
		}
		return Neighbour.of(best.start, best.bbox.minX, best.bbox.minY, bestDistance);
	}

	/**
	 * JTS convenience overload of {@link #findNearest(double, double)}.
	 */
	public Neighbour findNearest(Coordinate query) {
		return findNearest(query.x, query.y);
	}

	/**
	 * @return index of the nearest point in the reordered point source, or -1 when
	 *         the tree is unbuilt
	 */
	public int findNearestIndex(double x, double y) {
		return findNearest(x, y).getIndex();
	}

	public boolean isBuilt() {
		return built;
	}

	/**
	 * @return the root node, or null when unbuilt
	 */
	public Node getRoot() {
		return root;
	}

	/**
	 * @return height of the root (bucket nodes are at height 1), or 0 when unbuilt
	 */
	public int getHeight() {
		return built ? root.height : 0;
	}

	/**
	 * @return number of indexed points
	 */
	public int size() {
		return built ? root.end - root.start : 0;
	}

	/**
	 * @return the point source the tree was loaded from, or null when unbuilt
	 */
	public PointSource getPoints() {
		return points;
	}

	public RTreeOptions getOptions() {
		return options;
	}

	/**
	 * A tree node spanning the points in {@code [start, end)} of the point source.
	 * <p>
	 * Point leaves have height 0, a degenerate box and no children. Bucket nodes
	 * (height 1) own one point leaf per point in their range; higher nodes own
	 * nodes one level down. Nodes are only modified while the tree is loading.
	 */
	public static class Node {

		final int start;
		final int end;
		int height;
		final boolean leaf;
		BBox bbox;
		List<Node> children;

		Node(int start, int end, int height) {
			this.start = start;
			this.end = end;
			this.height = height;
			this.leaf = false;
			this.children = Collections.emptyList();
		}

		private Node(int index, BBox point) {
			this.start = index;
			this.end = index + 1;
			this.height = 0;
			this.leaf = true;
			this.bbox = point;
			this.children = Collections.emptyList();
		}

		static Node leaf(int index, double x, double y) {
			return new Node(index, BBox.ofPoint(x, y));
		}

		/**
		 * Sets the box of every node below and including this one to the union of
		 * its children's boxes.
		 */
		BBox computeBBoxUpwards() {
			if (leaf) {
				return bbox;
			}
			BBox union = children.get(0).computeBBoxUpwards();
			for (int i = 1; i < children.size(); i++) {
				union = union.extend(children.get(i).computeBBoxUpwards());
			}
			bbox = union;
			return union;
		}

		public boolean isLeaf() {
			return leaf;
		}

		public int getHeight() {
			return height;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}

		public int size() {
			return end - start;
		}

		public BBox getBBox() {
			return bbox;
		}

		public List<Node> getChildren() {
			return Collections.unmodifiableList(children);
		}

		@Override
		public String toString() {
			return (leaf ? "Leaf" : "Node(h=" + height + ")") + "[" + start + ", " + end + ") " + bbox;
		}
	}
}
