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

import org.junit.Test;

/**
 * Tests for {@link Spot}
 */
public class SpotTest {

	private final double precision = 0.0001;

	@Test
	public void testQuality() {
		assertEquals(1d, Spot.quality(new double[] { 10, 0, 0 }), precision);
		assertEquals(0.8, Spot.quality(new double[] { 3, 4 }), precision);
		assertEquals(0.5, Spot.quality(new double[] { 1, 1, 1, 1 }), precision);
	}

	@Test
	public void testQualityFallback() {
		assertEquals(Spot.FALLBACK_QUALITY, Spot.quality(new double[] { 0, 0, 0 }), 0);
		assertEquals(Spot.FALLBACK_QUALITY, Spot.quality(new double[] {}), 0);
		assertEquals(Spot.FALLBACK_QUALITY, Spot.quality(new double[] { -2, -1 }), 0);
		final Spot dark = new Spot(0, new double[] { 1, 1 }, new double[] { 0, 0 });
		assertFalse(Double.isNaN(dark.getQuality()));
		assertEquals(0, dark.getChannel());
	}

	@Test
	public void testChannelAssignment() {
		final Spot spot = new Spot(2, new double[] { 5, 6 }, new double[] { 1, 7, 3, 7 });
		// ties resolve to the lowest channel
		assertEquals(1, spot.getChannel());
		assertEquals(7d, spot.getIntensity(), 0);
		assertEquals(4, spot.numChannels());
		assertEquals(2, spot.getRound());
	}

	@Test
	public void testDistanceAndImmutability() {
		final double[] pos = { 0, 0, 0 };
		final Spot s1 = new Spot(0, pos, new double[] { 1 });
		final Spot s2 = new Spot(1, new double[] { 2, 3, 6 }, new double[] { 1 });
		assertEquals(7d, s1.distanceTo(s2), precision);
		assertEquals(0d, s1.distanceTo(s1), 0);
		pos[0] = 100;
		assertEquals(0d, s1.getCoordinate(0), 0);
		s1.getPosition()[1] = 100;
		assertEquals(0d, s1.getCoordinate(1), 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeRound() {
		new Spot(-1, new double[] { 0, 0 }, new double[] { 1 });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonFiniteCandidate() {
		new CandidateSpot(0, 0, new double[] { Double.NaN, 0 }, 1d);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIncompleteProfile() {
		new CandidateSpot(0, 2, new double[] { 0, 0 }, new double[] { 1, 2 });
	}

	@Test
	public void testCandidateProfile() {
		final CandidateSpot single = new CandidateSpot(0, 2, new double[] { 0, 0 }, 9d);
		assertArrayEquals(new double[] { 0, 0, 9, 0 }, single.getIntensities(4), 0);
		assertEquals(9d, single.getPeakIntensity(), 0);
		final CandidateSpot full = new CandidateSpot(0, 1, new double[] { 0, 0 }, new double[] { 2, 8, 1 });
		assertArrayEquals(new double[] { 2, 8, 1, 0 }, full.getIntensities(4), 0);
		assertEquals(8d, full.getPeakIntensity(), 0);
	}

}
