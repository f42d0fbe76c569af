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

package sc.fiji.spotdecoder.graph;

import org.jgrapht.graph.DefaultWeightedEdge;

import sc.fiji.spotdecoder.SpotDecoderUtils;

/**
 * An edge of the {@link CandidateGraph}, linking two spots from different
 * rounds. Its weight is the Euclidean distance between the two spots.
 */
public class SpotEdge extends DefaultWeightedEdge {

	private static final long serialVersionUID = 1L;
	private boolean repaired;

	public double getWeight() {
		return super.getWeight();
	}

	/** @return the Euclidean distance between the linked spots */
	public double getDistance() {
		return super.getWeight();
	}

	public Integer getSource() {
		return (Integer) super.getSource();
	}

	public Integer getTarget() {
		return (Integer) super.getTarget();
	}

	/**
	 * @return true if this edge was added by {@link ConnectivityRepairer} rather
	 *         than by the initial radius search
	 */
	public boolean isRepaired() {
		return repaired;
	}

	protected void setRepaired(final boolean repaired) {
		this.repaired = repaired;
	}

	@Override
	public String toString() {
		return "(" + getSource() + " : " + getTarget() + ") " + SpotDecoderUtils.formatDouble(getWeight(), 2);
	}

}
