package com.github.micycle1.simplertree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.simplertree.SimpleRTree.Node;

public class SimpleRTreeInvariantsTest {

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 9, 10, 80, 81, 82, 100, 163, 729, 730, 5000 })
	public void testTreeInvariants(int num) {
		FlatPoints points = SimpleRTreeTest.randomPoints(new Random(num), num);
		SimpleRTree tree = new SimpleRTree().load(points);

		Node root = tree.getRoot();
		assertEquals(0, root.getStart());
		assertEquals(num, root.getEnd());
		assertEquals(StrBulkLoader.rootHeight(num, 9), tree.getHeight());

		// Recursively check invariants across all nodes.
		checkNodeInvariants(root, points, 9);
	}

	@ParameterizedTest
	@ValueSource(ints = { 2, 3, 5, 16 })
	public void testTreeInvariantsWithBranchingFactor(int maxEntries) {
		FlatPoints points = SimpleRTreeTest.randomPoints(new Random(maxEntries), 1234);
		SimpleRTree tree = new SimpleRTree(RTreeOptions.defaults().withMaxEntries(maxEntries)).load(points);
		checkNodeInvariants(tree.getRoot(), points, maxEntries);
	}

	@Test
	public void testRootHeight() {
		assertEquals(1, StrBulkLoader.rootHeight(1, 9));
		assertEquals(1, StrBulkLoader.rootHeight(9, 9));
		assertEquals(2, StrBulkLoader.rootHeight(10, 9));
		assertEquals(2, StrBulkLoader.rootHeight(81, 9));
		assertEquals(3, StrBulkLoader.rootHeight(82, 9));
		assertEquals(3, StrBulkLoader.rootHeight(729, 9));
		assertEquals(10, StrBulkLoader.rootHeight(1024, 2));
	}

	@Test
	public void testSmallInputIsSingleBucket() {
		FlatPoints points = new FlatPoints(3, 1, 0, 0, 2, 5);
		SimpleRTree tree = new SimpleRTree().load(points);
		Node root = tree.getRoot();
		assertEquals(1, root.getHeight());
		assertFalse(root.isLeaf());
		assertEquals(3, root.getChildren().size());
		assertEquals(new BBox(0, 0, 3, 5), root.getBBox());
		for (Node leaf : root.getChildren()) {
			assertTrue(leaf.isLeaf());
		}
	}

	@Test
	public void testLoadReordersInPlace() {
		FlatPoints points = SimpleRTreeTest.randomPoints(new Random(61), 500);
		double[] backing = points.getCoordinates();
		SimpleRTree tree = new SimpleRTree().load(points);
		// leaves read the same array the caller handed in
		Node leaf = firstLeaf(tree.getRoot());
		assertEquals(backing[leaf.getStart() * 2], leaf.getBBox().getMinX());
		assertEquals(backing[leaf.getStart() * 2 + 1], leaf.getBBox().getMinY());
	}

	private static Node firstLeaf(Node node) {
		while (!node.isLeaf()) {
			node = node.getChildren().get(0);
		}
		return node;
	}

	/**
	 * Recursively checks the invariants for a node: 1. The node's box equals the
	 * union of its children's boxes. 2. Every point in the node's range lies within
	 * its box. 3. Children split the node's range into contiguous pieces. 4. Leaves
	 * hold exactly one point with a degenerate box.
	 */
	private void checkNodeInvariants(Node node, PointSource points, int maxEntries) {
		Envelope env = node.getBBox().toEnvelope();
		for (int i = node.getStart(); i < node.getEnd(); i++) {
			assertTrue(env.contains(points.getX(i), points.getY(i)), "Point " + i + " outside " + node);
		}

		if (node.isLeaf()) {
			assertEquals(1, node.size());
			assertTrue(node.getBBox().isPoint());
			assertEquals(BBox.ofPoint(points.getX(node.getStart()), points.getY(node.getStart())), node.getBBox());
			assertTrue(node.getChildren().isEmpty());
			return;
		}

		assertFalse(node.getChildren().isEmpty());
		assertTrue(node.getChildren().size() <= maxEntries, "Too many children in " + node);

		BBox union = null;
		int expectedStart = node.getStart();
		for (Node child : node.getChildren()) {
			assertEquals(expectedStart, child.getStart(), "Children must tile the parent range");
			expectedStart = child.getEnd();
			assertTrue(child.getHeight() < node.getHeight());
			if (node.getHeight() == 1) {
				assertTrue(child.isLeaf(), "Bucket nodes own point leaves only");
			} else {
				assertFalse(child.isLeaf(), "Only bucket nodes own point leaves");
			}
			union = union == null ? child.getBBox() : union.extend(child.getBBox());
			checkNodeInvariants(child, points, maxEntries);
		}
		assertEquals(node.getEnd(), expectedStart);
		assertEquals(union, node.getBBox(), "Node box must be the exact union of its children");
	}
}
