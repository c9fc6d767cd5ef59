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

package uk.ac.sussex.gdsc.peakprofile.data;

/**
 * Provides the per-spectrum calibration used to build the peak profile.
 */
public interface ProfileCalibration {
  /**
   * Gets the diffractometer constants for the spectrum.
   *
   * @param spectrumId the spectrum id
   * @return the diffractometer constants
   */
  DiffractometerConstants getDiffractometerConstants(int spectrumId);

  /**
   * Gets the back-to-back exponential parameters for the spectrum at the time-of-flight.
   *
   * <p>The default implementation returns null to indicate the instrument does not define the
   * parameters.
   *
   * @param spectrumId the spectrum id
   * @param tof the time-of-flight
   * @return the parameters (or null)
   */
  default BackToBackParameters getBackToBackParameters(int spectrumId, double tof) {
    return null;
  }
}
