/*-
 * #%L
 * Genome Damage and Stability Centre Peak Profile Integration
 *
 * Software for time-of-flight diffraction peak integration
 * %%
 * Copyright (C) 2022 Alex Herbert
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

package uk.ac.sussex.gdsc.peakprofile;

import uk.ac.sussex.gdsc.peakprofile.data.PeakCandidate;

/**
 * The Lorentz correction for time-of-flight single crystal diffraction.
 *
 * <pre>
 * L = sin^2(theta) / lambda^4
 * </pre>
 *
 * <p>Theta is half the scattering angle.
 */
public final class LorentzCorrection {
  /** No public construction. */
  private LorentzCorrection() {}

  /**
   * Gets the correction factor for the peak.
   *
   * @param peak the peak
   * @return the factor (1 if the scattering geometry is unknown)
   */
  public static double getFactor(PeakCandidate peak) {
    if (!peak.hasScatteringGeometry()) {
      return 1;
    }
    return getFactor(peak.getScatteringAngle(), peak.getWavelength());
  }

  /**
   * Gets the correction factor.
   *
   * @param twoTheta the scattering angle (radians)
   * @param wavelength the wavelength
   * @return the factor
   */
  public static double getFactor(double twoTheta, double wavelength) {
    final double sinTheta = Math.sin(twoTheta / 2);
    final double l2 = wavelength * wavelength;
    return sinTheta * sinTheta / (l2 * l2);
  }
}
