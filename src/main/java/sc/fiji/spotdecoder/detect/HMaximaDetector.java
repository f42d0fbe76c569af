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

import net.imglib2.Cursor;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.fill.FloodFill;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Detects spots as h-maxima: local maxima above the threshold that stand at
 * least {@code h} above every path leading to a brighter pixel. Maxima of
 * smaller dynamic (e.g., noise ripples on a spot's flank) are rejected.
 */
public class HMaximaDetector extends LocalMaximaDetector {

	private final double h;

	/**
	 * @param h             the minimum dynamic of a maximum. Must be positive
	 * @param threshold     the minimum (exclusive) intensity of a maximum
	 * @param excludeBorder the width of the image border, in pixels, in which
	 *                      maxima are ignored
	 */
	public HMaximaDetector(final double h, final double threshold, final int excludeBorder) {
		super(threshold, excludeBorder);
		if (!(h > 0) || Double.isInfinite(h)) throw new IllegalArgumentException("h must be a finite, positive number");
		this.h = h;
	}

	@Override
	public DetectorMethod getMethod() {
		return DetectorMethod.H_MAXIMA;
	}

	/**
	 * Floods the region around the maximum in which intensities stay above
	 * {@code value - h}. The maximum is rejected if that region holds a brighter
	 * pixel, or an equally bright pixel earlier in iteration order.
	 */
	@Override
	protected <T extends RealType<T>> boolean accept(final RandomAccessibleInterval<T> img, final long[] pos,
			final double value) {
		final double floor = value - h;
		final boolean[] brighter = { false };
		final boolean[] tied = { false };
		// pixels outside the image count as already flooded
		final Img<BitType> mask = ArrayImgs.bits(Intervals.dimensionsAsLongArray(img));
		final RandomAccessibleInterval<BitType> region = Views.translate(mask, Intervals.minAsLongArray(img));
		FloodFill.fill(Views.extendBorder(img), Views.extendValue(region, new BitType(true)), new Point(pos),
				new BitType(true), new RectangleShape(1, false), (source, target) -> {
					if (brighter[0] || target.get()) return false;
					final double v = source.getRealDouble();
					if (v > value) brighter[0] = true;
					else if (v == value) tied[0] = true;
					return v > floor && !brighter[0];
				});
		if (brighter[0]) return false;
		if (!tied[0]) return true;
		final Cursor<BitType> cursor = Views.flatIterable(region).localizingCursor();
		final RandomAccess<T> ra = img.randomAccess();
		final long[] other = new long[pos.length];
		while (cursor.hasNext()) {
			if (!cursor.next().get()) continue;
			cursor.localize(other);
			if (!precedes(other, pos)) break;
			ra.setPosition(other);
			if (ra.get().getRealDouble() == value) return false;
		}
		return true;
	}

	public double getH() {
		return h;
	}

}
