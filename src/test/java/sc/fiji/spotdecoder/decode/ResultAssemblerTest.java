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

package sc.fiji.spotdecoder.decode;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import sc.fiji.spotdecoder.spots.Spot;

/**
 * Tests for {@link ResultAssembler} and {@link DecodedSequence}
 */
public class ResultAssemblerTest {

	@Test
	public void testPartialSequenceIsPadded() {
		final Spot s1 = new Spot(1, new double[] { 0, 0 }, new double[] { 0, 5 });
		final Spot s2 = new Spot(2, new double[] { 0, 2 }, new double[] { 7 });
		final DecodedSequence sequence = new DecodedSequence(4, Arrays.asList(3, 8), Arrays.asList(s1, s2), 0.5);
		assertNull(sequence.getSpot(0));
		assertSame(s2, sequence.getSpot(2));

		final IntensityTable table = ResultAssembler.assemble(Collections.singletonList(sequence), 4, 2);
		final IntensityTable.Feature feature = table.getFeature(0);
		assertEquals(4, feature.getComponentId());
		assertTrue(Double.isNaN(feature.getIntensities(0)[0]));
		assertTrue(Double.isNaN(feature.getPosition(3)[1]));
		assertArrayEquals(new double[] { 7, 0 }, feature.getIntensities(2), 0);
		assertArrayEquals(new int[] { -1, 1, 0, -1 }, feature.perRoundMaxChannel());
		assertArrayEquals(new double[] { 0, 1 }, feature.getCentroid(), 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTooFewRounds() {
		final Spot s1 = new Spot(1, new double[] { 0, 0 }, new double[] { 1 });
		final DecodedSequence sequence = new DecodedSequence(0, Arrays.asList(0), Arrays.asList(s1), 0);
		ResultAssembler.assemble(Collections.singletonList(sequence), 1, 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGapInRounds() {
		final Spot s1 = new Spot(0, new double[] { 0, 0 }, new double[] { 1 });
		final Spot s2 = new Spot(2, new double[] { 0, 0 }, new double[] { 1 });
		new DecodedSequence(0, Arrays.asList(0, 1), Arrays.asList(s1, s2), 0);
	}

}
