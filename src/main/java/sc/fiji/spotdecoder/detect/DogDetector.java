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

import net.imglib2.Point;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.dog.DogDetection;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Detects spots as extrema of the difference of Gaussians, an approximation of
 * the scale-normalized Laplacian of Gaussian. The threshold applies to the DoG
 * response rather than to raw intensities. Channel profiles are still sampled
 * from the raw images.
 */
public class DogDetector extends LocalMaximaDetector {

	/** Ratio between the larger and the smaller Gaussian */
	public static final double SIGMA_RATIO = 1.6;

	private final double sigma;

	/**
	 * @param sigma         the expected spot radius divided by sqrt(n), in pixels
	 * @param threshold     the minimum DoG response of a spot
	 * @param excludeBorder the width of the image border, in pixels, in which
	 *                      maxima are ignored
	 */
	public DogDetector(final double sigma, final double threshold, final int excludeBorder) {
		super(threshold, excludeBorder);
		if (!(sigma > 0) || Double.isInfinite(sigma))
			throw new IllegalArgumentException("sigma must be a finite, positive number");
		this.sigma = sigma;
	}

	@Override
	public DetectorMethod getMethod() {
		return DetectorMethod.DOG;
	}

	@Override
	protected <T extends RealType<T>> List<long[]> findMaxima(final RandomAccessibleInterval<T> img) {
		final long[] min = Intervals.minAsLongArray(img);
		final long[] max = Intervals.maxAsLongArray(img);
		final RandomAccessibleInterval<FloatType> floats = Views.translate(
				ArrayImgs.floats(Intervals.dimensionsAsLongArray(img)), min);
		LoopBuilder.setImages(img, floats).forEachPixel((in, out) -> out.setReal(in.getRealDouble()));
		final double[] calibration = new double[img.numDimensions()];
		Arrays.fill(calibration, 1d);
		// the larger Gaussian minus the smaller one: bright spots are minima
		final DogDetection<FloatType> dog = new DogDetection<>(Views.extendMirrorSingle(floats), img, calibration,
				sigma, sigma * SIGMA_RATIO, DogDetection.ExtremaType.MINIMA, threshold, false);
		final List<long[]> maxima = new ArrayList<>();
		for (final Point peak : dog.getPeaks()) {
			final long[] pos = peak.positionAsLongArray();
			if (!inBorder(pos, min, max)) maxima.add(pos);
		}
		maxima.sort((a, b) -> precedes(a, b) ? -1 : (precedes(b, a) ? 1 : 0));
		return maxima;
	}

	public double getSigma() {
		return sigma;
	}

}
