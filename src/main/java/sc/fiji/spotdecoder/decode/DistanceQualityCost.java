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

import sc.fiji.spotdecoder.spots.Spot;

/**
 * Transition cost that grows with distance and shrinks with the quality of the
 * linked spots: {@code distance - lambda * (quality_from + quality_to)}.
 */
public class DistanceQualityCost implements TransitionCost {

	public static final double DEFAULT_LAMBDA = 1d;

	private final double lambda;

	public DistanceQualityCost() {
		this(DEFAULT_LAMBDA);
	}

	/**
	 * @param lambda the weight of spot quality relative to distance. 0 ignores
	 *               quality altogether
	 */
	public DistanceQualityCost(final double lambda) {
		if (!(lambda >= 0) || Double.isInfinite(lambda))
			throw new IllegalArgumentException("lambda must be a finite, non-negative number");
		this.lambda = lambda;
	}

	@Override
	public double costOf(final Spot from, final Spot to, final double distance) {
		return distance - lambda * (from.getQuality() + to.getQuality());
	}

	public double getLambda() {
		return lambda;
	}

}
