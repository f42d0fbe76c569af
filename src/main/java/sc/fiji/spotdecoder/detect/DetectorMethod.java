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

/** Spot detection algorithms available through {@link SpotDetectorFactory}. */
public enum DetectorMethod {

	/** Pixels above an absolute threshold that are maximal in their 3^n neighborhood */
	LOCAL_MAXIMA,

	/** Regional maxima whose height over their surroundings is at least h */
	H_MAXIMA,

	/** Maxima of the difference of Gaussians, for blurred spots of known size */
	DOG;

	/**
	 * Case-insensitive lookup, also accepting hyphens/spaces as separators.
	 *
	 * @param name the method name, e.g., "local maxima" or "h_maxima"
	 * @return the matching method
	 * @throws IllegalArgumentException if no method matches {@code name}
	 */
	public static DetectorMethod fromString(final String name) {
		if (name == null) throw new IllegalArgumentException("Detector method cannot be null");
		final String normalized = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
		for (final DetectorMethod method : values()) {
			if (method.name().equals(normalized)) return method;
		}
		throw new IllegalArgumentException("Unknown detector method: " + name);
	}

}
