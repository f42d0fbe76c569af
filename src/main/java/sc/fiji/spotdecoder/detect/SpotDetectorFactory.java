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

import sc.fiji.spotdecoder.SpotDecoderUtils;

/**
 * Factory for spot detectors, selected by {@link DetectorMethod}.
 * <p>
 * Usage:
 * <pre>{@code
 * SpotDetector detector = SpotDetectorFactory.create(DetectorMethod.H_MAXIMA, 0.05, 0.015);
 * List<CandidateSpot> spots = detector.detect(round, channelImages);
 * }</pre>
 */
public class SpotDetectorFactory {

	private SpotDetectorFactory() {
	}

	/**
	 * Creates a detector that does not exclude image borders.
	 *
	 * @param method    the detection method
	 * @param threshold the absolute intensity threshold
	 * @param h         the minimum dynamic of maxima for
	 *                  {@link DetectorMethod#H_MAXIMA}, the Gaussian sigma for
	 *                  {@link DetectorMethod#DOG}. Ignored otherwise
	 * @return the detector
	 */
	public static SpotDetector create(final DetectorMethod method, final double threshold, final double h) {
		return create(method, threshold, h, 0);
	}

	/**
	 * Creates a detector.
	 *
	 * @param method        the detection method
	 * @param threshold     the absolute intensity threshold
	 * @param h             the minimum dynamic of maxima for
	 *                      {@link DetectorMethod#H_MAXIMA}, the Gaussian sigma
	 *                      for {@link DetectorMethod#DOG}. Ignored otherwise
	 * @param excludeBorder the width of the image border in which maxima are
	 *                      ignored
	 * @return the detector
	 */
	public static SpotDetector create(final DetectorMethod method, final double threshold, final double h,
			final int excludeBorder) {
		if (method == null) throw new IllegalArgumentException("Detector method cannot be null");
		SpotDecoderUtils.log("Creating " + method + " detector (threshold: " + threshold + ")");
		switch (method) {
		case H_MAXIMA:
			return new HMaximaDetector(h, threshold, excludeBorder);
		case DOG:
			return new DogDetector(h, threshold, excludeBorder);
		case LOCAL_MAXIMA:
		default:
			return new LocalMaximaDetector(threshold, excludeBorder);
		}
	}

	/**
	 * Creates a detector from its name.
	 *
	 * @see DetectorMethod#fromString(String)
	 */
	public static SpotDetector create(final String method, final double threshold, final double h) {
		return create(DetectorMethod.fromString(method), threshold, h);
	}

}
