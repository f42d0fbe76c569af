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

package sc.fiji.spotdecoder.util;

import java.util.ArrayList;
import java.util.List;

import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

/**
 * Fixed-radius neighbour queries over a static set of points, backed by a
 * KD-tree. Points are identified by their position in the array used to build
 * the index.
 */
public class RadiusSearch {

	private final double[][] coordinates;
	private final KDTree<Integer> kdtree;

	/**
	 * @param coordinates the point coordinates. Must not be modified afterwards
	 */
	public RadiusSearch(final double[][] coordinates) {
		this.coordinates = coordinates;
		if (coordinates.length == 0) {
			kdtree = null;
			return;
		}
		final Integer[] ids = new Integer[coordinates.length];
		for (int i = 0; i < ids.length; i++)
			ids[i] = i;
		kdtree = new KDTree<>(coordinates, ids);
	}

	/**
	 * Retrieves all the points within {@code radius} of a given point.
	 *
	 * @param index  the index of the query point
	 * @param radius the search radius (inclusive). Must be positive
	 * @return the indices of the neighbours, in ascending order. The query
	 *         point itself is never included
	 */
	public List<Integer> neighbors(final int index, final double radius) {
		final List<Integer> result = new ArrayList<>();
		if (kdtree == null) return result;
		final List<Neighbor<double[], Integer>> neighbors = new ArrayList<>();
		// Query the ball around the reference point
		kdtree.range(coordinates[index], radius, neighbors);
		for (final Neighbor<double[], Integer> neighbor : neighbors) {
			if (neighbor.value == index || neighbor.distance > radius) continue;
			result.add(neighbor.value);
		}
		result.sort(Integer::compare);
		return result;
	}

	public int size() {
		return coordinates.length;
	}

}
