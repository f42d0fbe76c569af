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

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import sc.fiji.spotdecoder.spots.CandidateSpot;

/**
 * Tests for {@link DogDetector}
 */
public class DogDetectorTest {

	private static Img<FloatType> blobs() {
		final Img<FloatType> img = ArrayImgs.floats(32, 32);
		final Cursor<FloatType> cursor = img.localizingCursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			final double x = cursor.getDoublePosition(0);
			final double y = cursor.getDoublePosition(1);
			cursor.get().setReal(gauss(x, y, 10, 10, 100) + gauss(x, y, 20, 18, 50));
		}
		return img;
	}

	private static double gauss(final double x, final double y, final double cx, final double cy,
			final double amplitude) {
		final double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
		return amplitude * Math.exp(-r2 / (2 * 2 * 2));
	}

	@Test
	public void testBlobCenters() {
		final SpotDetector detector = SpotDetectorFactory.create("dog", 2, 2);
		assertEquals(DetectorMethod.DOG, detector.getMethod());
		final List<CandidateSpot> spots = detector.detect(0, Arrays.asList(blobs()));
		assertEquals(2, spots.size());
		// iteration order: the blob further down comes last
		assertArrayEquals(new double[] { 10, 10 }, spots.get(0).getPosition(), 0);
		assertArrayEquals(new double[] { 20, 18 }, spots.get(1).getPosition(), 0);
		// profiles are sampled from the raw image
		assertEquals(100, spots.get(0).getPeakIntensity(), 1e-3);
	}

	@Test
	public void testResponseThreshold() {
		final List<CandidateSpot> spots = new DogDetector(2, 15, 0).detect(0, Arrays.asList(blobs()));
		assertEquals(1, spots.size());
		assertArrayEquals(new double[] { 10, 10 }, spots.get(0).getPosition(), 0);
	}

	@Test
	public void testBorderExclusion() {
		assertEquals(1, new DogDetector(2, 2, 11).detect(0, Arrays.asList(blobs())).size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidSigma() {
		new DogDetector(0, 1, 0);
	}

}
