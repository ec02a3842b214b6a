package com.github.micycle1.trapezoidj.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Polygon;

import com.github.micycle1.trapezoidj.TestPolygons;
import com.github.micycle1.trapezoidj.Trapezoidation;
import com.github.micycle1.trapezoidj.input.PolygonLoops;
import com.github.micycle1.trapezoidj.map.TrapezoidMap;

class TrapezoidDumpTest {

	private TrapezoidMap square;
	private TrapezoidDump dump;

	@BeforeEach
	void setUp() {
		square = new TrapezoidMap(PolygonLoops.of(TestPolygons.square()));
		dump = new TrapezoidDump(square);
	}

	@Test
	void initialBox() {
		assertEquals("T0 Y:-1 to 11 Left:4 Right:5 POLYGON ((-1 -1, 11 -1, 11 11, -1 11, -1 -1))\n", dump.dumpTrapezoids());
		assertEquals("#0 Leaf\n", dump.dumpTree());
	}

	@Test
	void afterFirstPoint() {
		square.insertPoint(0);
		assertEquals("#0 Y 0\n   #0 Leaf\n   #1 Leaf\n", dump.dumpTree());
		assertEquals("T0 Y:-1 to 0 Left:4 Right:5 POLYGON ((-1 -1, 11 -1, 11 0, -1 0, -1 -1))\n"
				+ "T1 Y:0 to 11 Left:4 Right:5 POLYGON ((-1 0, 11 0, 11 11, -1 11, -1 0))\n", dump.dumpTrapezoids());
	}

	@Test
	void nestedTreeIndent() {
		square.insertPoint(0);
		square.insertPoint(2); // (10,10) lands in T1
		assertEquals("#0 Y 0\n   #0 Leaf\n   #2 Y 10\n      #1 Leaf\n      #2 Leaf\n", dump.dumpTree());
	}

	@Test
	void outlines() {
		square.insertPoint(0);
		List<Pair<Integer, Polygon>> outlines = dump.getOutlines();
		assertEquals(2, outlines.size());
		assertEquals(0, outlines.get(0).getLeft());
		assertEquals(12, outlines.get(0).getRight().getArea(), 1e-9);
		assertEquals(132, outlines.get(1).getRight().getArea(), 1e-9);

		List<Pair<Integer, Polygon>> inset = dump.getOutlines(0.25);
		assertEquals(0.5 * 11.5, inset.get(0).getRight().getArea(), 1e-9);
		assertTrue(outlines.get(1).getRight().contains(inset.get(1).getRight()));
	}

	@Test
	void insetCollapsesThinTrapezoids() {
		square.insertPoint(0);
		// T0 is 1 high: an inset of 2 collapses it to its mid line
		Polygon collapsed = dump.getOutline(square.getTrapezoid(0), 2);
		assertEquals(0, collapsed.getArea(), 1e-12);
		assertEquals(-0.5, collapsed.getEnvelopeInternal().getMinY(), 1e-12);
		assertEquals(-0.5, collapsed.getEnvelopeInternal().getMaxY(), 1e-12);
	}

	@Test
	void outlinesTileBuiltMap() {
		Polygon p = TestPolygons.arrow();
		TrapezoidMap map = Trapezoidation.build(p);
		double area = 0;
		for (Pair<Integer, Polygon> outline : new TrapezoidDump(map).getOutlines()) {
			area += outline.getRight().getArea();
		}
		assertEquals(map.getBounds().getArea(), area, 1e-6);
	}

	@Test
	void writesDumps(@TempDir Path dir) throws IOException {
		square.insertPoint(0);
		Path tree = dir.resolve("tree.txt");
		Path traps = dir.resolve("trapezoids.txt");
		dump.writeTree(tree);
		dump.writeTrapezoids(traps);
		assertEquals(dump.dumpTree(), Files.readString(tree));
		assertEquals(dump.dumpTrapezoids(), Files.readString(traps));
	}
}
