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

package sc.fiji.spotdecoder.detect;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import sc.fiji.spotdecoder.spots.CandidateSpot;

/**
 * Tests for {@link LocalMaximaDetector} and {@link HMaximaDetector}
 */
public class LocalMaximaDetectorTest {

	private Img<FloatType> img;

	@Before
	public void setUp() {
		img = ArrayImgs.floats(20, 20);
		set(img, 10, 10, 1f);
		// shoulder on the flank of the main peak
		set(img, 11, 10, 0.85f);
		set(img, 12, 10, 0.9f);
		// isolated dim peak
		set(img, 4, 15, 0.6f);
		// plateau
		set(img, 15, 4, 0.7f);
		set(img, 16, 4, 0.7f);
		// peak on the border
		set(img, 0, 7, 0.95f);
	}

	@Test
	public void testLocalMaxima() {
		final List<CandidateSpot> spots = new LocalMaximaDetector(0.5, 0).detect(0, Arrays.asList(img));
		assertEquals(5, spots.size());
		assertTrue(contains(spots, 10, 10));
		assertTrue(contains(spots, 12, 10));
		assertTrue(contains(spots, 4, 15));
		assertTrue(contains(spots, 0, 7));
		// only the first pixel of the plateau is kept
		assertTrue(contains(spots, 15, 4));
		assertFalse(contains(spots, 16, 4));
	}

	@Test
	public void testThresholdAndBorder() {
		final List<CandidateSpot> spots = new LocalMaximaDetector(0.65, 2).detect(3, Arrays.asList(img));
		assertEquals(3, spots.size());
		assertFalse(contains(spots, 4, 15));
		assertFalse(contains(spots, 0, 7));
		for (final CandidateSpot spot : spots) {
			assertEquals(3, spot.getRound());
			assertEquals(0, spot.getChannel());
		}
	}

	@Test
	public void testHMaxima() {
		final SpotDetector detector = SpotDetectorFactory.create(DetectorMethod.H_MAXIMA, 0.5, 0.2);
		assertEquals(DetectorMethod.H_MAXIMA, detector.getMethod());
		final List<CandidateSpot> spots = detector.detect(0, Arrays.asList(img));
		// the shoulder does not rise 0.2 above the saddle leading to the main peak
		assertFalse(contains(spots, 12, 10));
		assertTrue(contains(spots, 10, 10));
		assertTrue(contains(spots, 4, 15));
		assertEquals(4, spots.size());
	}

	@Test
	public void testMultiChannelProfiles() {
		final Img<FloatType> other = ArrayImgs.floats(20, 20);
		set(other, 10, 10, 0.2f);
		set(other, 3, 3, 0.8f);
		final List<CandidateSpot> spots = new LocalMaximaDetector(0.5, 0).detect(1, Arrays.asList(img, other));
		final CandidateSpot main = spots.stream()
				.filter(s -> s.getChannel() == 0 && s.getPosition()[0] == 10 && s.getPosition()[1] == 10)
				.findFirst().get();
		assertArrayEquals(new double[] { 1, 0.2, 0 }, main.getIntensities(3), 1e-6);
		final CandidateSpot second = spots.stream().filter(s -> s.getChannel() == 1).findFirst().get();
		assertArrayEquals(new double[] { 3, 3 }, second.getPosition(), 0);
		assertEquals(0.8, second.getPeakIntensity(), 1e-6);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMismatchedChannels() {
		new LocalMaximaDetector(0.5, 0).detect(0, Arrays.asList(img, ArrayImgs.floats(10, 10)));
	}

	@Test
	public void testFactory() {
		assertEquals(DetectorMethod.LOCAL_MAXIMA, SpotDetectorFactory.create("local maxima", 1, 0).getMethod());
		assertEquals(DetectorMethod.H_MAXIMA, DetectorMethod.fromString("h-maxima"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownMethod() {
		DetectorMethod.fromString("watershed");
	}

	private static void set(final Img<FloatType> img, final int x, final int y, final float value) {
		final RandomAccess<FloatType> ra = img.randomAccess();
		ra.setPosition(new long[] { x, y });
		ra.get().set(value);
	}

	private static boolean contains(final List<CandidateSpot> spots, final double x, final double y) {
		return spots.stream().anyMatch(s -> s.getPosition()[0] == x && s.getPosition()[1] == y);
	}

}
