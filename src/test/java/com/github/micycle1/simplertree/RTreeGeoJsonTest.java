package com.github.micycle1.simplertree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

public class RTreeGeoJsonTest {

	@Test
	public void testOneGeometryPerNode() {
		// 12 points with branching factor 4: root, 3 bucket nodes, 12 leaves
		double[] coords = new double[24];
		for (int i = 0; i < 12; i++) {
			coords[2 * i] = i % 4;
			coords[2 * i + 1] = i / 4;
		}
		SimpleRTree tree = new SimpleRTree(RTreeOptions.defaults().withMaxEntries(4)).load(new FlatPoints(coords));
		GeometryCollection boxes = RTreeGeoJson.toGeometry(tree);

		assertEquals(countNodes(tree.getRoot()), boxes.getNumGeometries());
		Geometry root = boxes.getGeometryN(0);
		assertTrue(root instanceof Polygon);
		assertEquals(tree.getRoot().getBBox().toEnvelope(), root.getEnvelopeInternal());

		int points = 0;
		for (int i = 0; i < boxes.getNumGeometries(); i++) {
			if (boxes.getGeometryN(i) instanceof Point) {
				points++;
			}
		}
		assertEquals(12, points);
	}

	@Test
	public void testGeoJsonOutput() {
		SimpleRTree tree = new SimpleRTree().load(new FlatPoints(0, 0, 1, 2, 3, 1));
		String json = RTreeGeoJson.toGeoJson(tree);
		assertTrue(json.contains("GeometryCollection"));
		assertTrue(json.contains("Polygon"));
		assertTrue(json.contains("Point"));
	}

	@Test
	public void testUnbuiltTree() {
		assertTrue(RTreeGeoJson.toGeometry(new SimpleRTree()).isEmpty());
	}

	private static int countNodes(SimpleRTree.Node node) {
		int count = 1;
		for (SimpleRTree.Node child : node.getChildren()) {
			count += countNodes(child);
		}
		return count;
	}
}
