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

import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import sc.fiji.spotdecoder.spots.CandidateSpot;

/**
 * Produces candidate spots from the images of one imaging round.
 *
 * @see SpotDetectorFactory
 */
public interface SpotDetector {

	/**
	 * Detects spots in every channel of a round. Each candidate carries the
	 * intensity of every channel sampled at its position.
	 *
	 * @param round    the round index
	 * @param channels the images of the round, indexed by channel. All images
	 *                 must share the same dimensions
	 * @return the candidate spots, in channel order
	 */
	<T extends RealType<T>> List<CandidateSpot> detect(int round, List<? extends RandomAccessibleInterval<T>> channels);

	/** @return the detection method implemented by this detector */
	DetectorMethod getMethod();

}
