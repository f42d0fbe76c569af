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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.neighborhood.Neighborhood;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.spotdecoder.SpotDecoderUtils;
import sc.fiji.spotdecoder.spots.CandidateSpot;

/**
 * Detects spots as local intensity maxima: pixels brighter than an absolute
 * threshold and not darker than any of their 3^n neighbors. On plateaus, only
 * pixels without an equally bright neighbor earlier in iteration order are
 * kept.
 */
public class LocalMaximaDetector implements SpotDetector {

	protected final double threshold;
	protected final int excludeBorder;

	/**
	 * @param threshold     the minimum (exclusive) intensity of a maximum
	 * @param excludeBorder the width of the image border, in pixels, in which
	 *                      maxima are ignored
	 */
	public LocalMaximaDetector(final double threshold, final int excludeBorder) {
		if (Double.isNaN(threshold)) throw new IllegalArgumentException("Threshold cannot be NaN");
		if (excludeBorder < 0) throw new IllegalArgumentException("Border width must be >= 0");
		this.threshold = threshold;
		this.excludeBorder = excludeBorder;
	}

	@Override
	public DetectorMethod getMethod() {
		return DetectorMethod.LOCAL_MAXIMA;
	}

	@Override
	public <T extends RealType<T>> List<CandidateSpot> detect(final int round,
			final List<? extends RandomAccessibleInterval<T>> channels) {
		final List<CandidateSpot> candidates = new ArrayList<>();
		if (channels.isEmpty()) return candidates;
		final RandomAccessibleInterval<T> reference = channels.get(0);
		for (final RandomAccessibleInterval<T> img : channels) {
			if (!Arrays.equals(Intervals.dimensionsAsLongArray(reference), Intervals.dimensionsAsLongArray(img)))
				throw new IllegalArgumentException("Channel images of round " + round + " differ in size");
		}
		final List<RandomAccess<T>> samplers = new ArrayList<>(channels.size());
		for (final RandomAccessibleInterval<T> img : channels)
			samplers.add(img.randomAccess());

		for (int c = 0; c < channels.size(); c++) {
			for (final long[] peak : findMaxima(channels.get(c))) {
				final double[] profile = new double[channels.size()];
				for (int k = 0; k < samplers.size(); k++) {
					final RandomAccess<T> sampler = samplers.get(k);
					sampler.setPosition(peak);
					profile[k] = sampler.get().getRealDouble();
				}
				final double[] position = new double[peak.length];
				for (int d = 0; d < peak.length; d++)
					position[d] = peak[d];
				candidates.add(new CandidateSpot(round, c, position, profile));
			}
		}
		SpotDecoderUtils.log(getMethod() + ": " + candidates.size() + " candidate(s) in round " + round);
		return candidates;
	}

	/**
	 * Finds the maxima of a single image.
	 *
	 * @param img the image
	 * @return the pixel positions of detected maxima, in iteration order
	 */
	protected <T extends RealType<T>> List<long[]> findMaxima(final RandomAccessibleInterval<T> img) {
		final List<long[]> maxima = new ArrayList<>();
		final long[] min = Intervals.minAsLongArray(img);
		final long[] max = Intervals.maxAsLongArray(img);
		final RandomAccess<Neighborhood<T>> neighborhoods = new RectangleShape(1, true)
				.neighborhoodsRandomAccessible(Views.extendBorder(img)).randomAccess();
		final Cursor<T> cursor = Views.flatIterable(img).localizingCursor();
		final long[] pos = new long[img.numDimensions()];
		final long[] npos = new long[img.numDimensions()];
		while (cursor.hasNext()) {
			final double value = cursor.next().getRealDouble();
			if (!(value > threshold)) continue;
			cursor.localize(pos);
			if (inBorder(pos, min, max)) continue;
			neighborhoods.setPosition(pos);
			boolean isMax = true;
			final Cursor<T> neighbors = neighborhoods.get().localizingCursor();
			while (neighbors.hasNext()) {
				final double neighbor = neighbors.next().getRealDouble();
				if (!Intervals.contains(img, neighbors)) continue;
				neighbors.localize(npos);
				if (neighbor > value || (neighbor == value && precedes(npos, pos))) {
					isMax = false;
					break;
				}
			}
			if (isMax && accept(img, pos, value)) maxima.add(pos.clone());
		}
		return maxima;
	}

	/**
	 * Hook for subclasses imposing further criteria on local maxima.
	 *
	 * @return true if the local maximum at {@code pos} is to be kept
	 */
	protected <T extends RealType<T>> boolean accept(final RandomAccessibleInterval<T> img, final long[] pos,
			final double value) {
		return true;
	}

	/** @return true if {@code pos} lies within {@link #getExcludeBorder()} pixels of the image edge */
	protected boolean inBorder(final long[] pos, final long[] min, final long[] max) {
		for (int d = 0; d < pos.length; d++) {
			if (pos[d] < min[d] + excludeBorder || pos[d] > max[d] - excludeBorder) return true;
		}
		return false;
	}

	/** @return true if {@code a} comes before {@code b} in flat iteration order */
	protected static boolean precedes(final long[] a, final long[] b) {
		for (int d = a.length - 1; d >= 0; d--) {
			if (a[d] != b[d]) return a[d] < b[d];
		}
		return false;
	}

	public double getThreshold() {
		return threshold;
	}

	public int getExcludeBorder() {
		return excludeBorder;
	}

}
