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
 * Cost of selecting a transition between a spot of round r and a spot of
 * round r+1 in a decoded sequence. Lower costs denote more favorable pairings.
 */
public interface TransitionCost {

	/**
	 * @param from     the spot of the earlier round
	 * @param to       the spot of the following round
	 * @param distance the Euclidean distance between the two spots
	 * @return the cost of the transition. May be negative
	 */
	double costOf(Spot from, Spot to, double distance);

}
