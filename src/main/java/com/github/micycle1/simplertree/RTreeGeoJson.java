package com.github.micycle1.simplertree;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import com.github.micycle1.simplertree.SimpleRTree.Node;

/**
 * Debug view of a loaded tree as GeoJSON, for inspecting node boxes in a map
 * viewer. Reads boxes and children only.
 */
public final class RTreeGeoJson {

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	private RTreeGeoJson() {
	}

	/**
	 * Collects the box of every node in pre-order. Bucket and internal boxes
	 * become polygons (or lines/points when degenerate), point leaves become
	 * points.
	 *
	 * @return a collection with one geometry per node; empty for an unbuilt tree
	 */
	public static GeometryCollection toGeometry(SimpleRTree tree) {
		List<Geometry> boxes = new ArrayList<>();
		if (tree.isBuilt()) {
			collect(tree.getRoot(), boxes);
		}
		return GEOMETRY_FACTORY.createGeometryCollection(boxes.toArray(new Geometry[0]));
	}

	/**
	 * @return the {@link #toGeometry(SimpleRTree) node boxes} as a GeoJSON
	 *         GeometryCollection
	 */
	public static String toGeoJson(SimpleRTree tree) {
		return new GeoJsonWriter().write(toGeometry(tree));
	}

	private static void collect(Node node, List<Geometry> boxes) {
		boxes.add(GEOMETRY_FACTORY.toGeometry(node.bbox.toEnvelope()));
		for (Node child : node.children) {
			collect(child, boxes);
		}
	}
}
