/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.spotdecoder.spots;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

/**
 * Tests for {@link SpotTable}
 */
public class SpotTableTest {

	private List<Spot> spots;

	@Before
	public void setUp() {
		spots = new ArrayList<>();
		spots.add(new Spot(2, new double[] { 1, 1 }, new double[] { 1, 0 }));
		spots.add(new Spot(0, new double[] { 5, 1 }, new double[] { 1, 0 }));
		spots.add(new Spot(0, new double[] { 1, 9 }, new double[] { 0, 1 }));
		spots.add(new Spot(2, new double[] { 0, 4 }, new double[] { 1, 0 }));
	}

	@Test
	public void testCanonicalOrder() {
		final SpotTable table = new SpotTable(spots);
		assertEquals(4, table.size());
		assertEquals(3, table.getNumRounds());
		assertEquals(2, table.getNumDimensions());
		assertArrayEquals(new double[] { 1, 9 }, table.get(0).getPosition(), 0);
		assertArrayEquals(new double[] { 5, 1 }, table.get(1).getPosition(), 0);
		assertArrayEquals(new double[] { 0, 4 }, table.get(2).getPosition(), 0);
		assertArrayEquals(new double[] { 1, 1 }, table.get(3).getPosition(), 0);

		final List<Spot> shuffled = new ArrayList<>(spots);
		Collections.shuffle(shuffled, new Random(42));
		final SpotTable other = new SpotTable(shuffled);
		for (int i = 0; i < table.size(); i++)
			assertSame(table.get(i), other.get(i));
	}

	@Test
	public void testTiesResolvedByIntensities() {
		final Spot dim = new Spot(1, new double[] { 2, 2 }, new double[] { 10 });
		final Spot bright = new Spot(1, new double[] { 2, 2 }, new double[] { 50 });
		assertEquals(dim.getQuality(), bright.getQuality(), 0);
		assertSame(dim, new SpotTable(Arrays.asList(bright, dim)).get(0));
		assertSame(dim, new SpotTable(Arrays.asList(dim, bright)).get(0));
	}

	@Test
	public void testIndicesInRound() {
		final SpotTable table = new SpotTable(spots);
		assertEquals(Arrays.asList(0, 1), table.indicesInRound(0));
		assertTrue(table.indicesInRound(1).isEmpty());
		assertEquals(Arrays.asList(2, 3), table.indicesInRound(2));
		assertTrue(table.indicesInRound(7).isEmpty());
	}

	@Test
	public void testEmptyTable() {
		final SpotTable table = new SpotTable(Collections.emptyList());
		assertTrue(table.isEmpty());
		assertEquals(0, table.getNumRounds());
		assertEquals(0, table.getCoordinates().length);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMixedDimensionality() {
		spots.add(new Spot(1, new double[] { 1, 1, 1 }, new double[] { 1 }));
		new SpotTable(spots);
	}

}
