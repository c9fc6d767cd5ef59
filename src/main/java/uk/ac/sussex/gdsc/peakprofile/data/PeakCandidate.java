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

import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A predicted Bragg reflection to be integrated.
 *
 * <p>The Miller indices are used for diagnostics only. The scattering angle and wavelength are
 * optional and are only used for the Lorentz correction; they are NaN when unknown.
 */
public final class PeakCandidate {
  /** The detector id of the predicted peak position. */
  private final int detectorId;
  /** The bank containing the detector. */
  private final String bankName;
  /** The nominal time-of-flight. */
  private final double tof;
  /** The d-spacing. */
  private final double dspacing;
  /** The h index. */
  private final int h;
  /** The k index. */
  private final int k;
  /** The l index. */
  private final int l;
  /** The scattering angle (2-theta) in radians. */
  private final double scatteringAngle;
  /** The wavelength in Angstroms. */
  private final double wavelength;

  /**
   * Create an instance without the scattering geometry.
   *
   * @param detectorId the detector id
   * @param bankName the bank name
   * @param tof the nominal time-of-flight
   * @param dspacing the d-spacing
   * @param h the h index
   * @param k the k index
   * @param l the l index
   */
  public PeakCandidate(int detectorId, String bankName, double tof, double dspacing, int h, int k,
      int l) {
    this(detectorId, bankName, tof, dspacing, h, k, l, Double.NaN, Double.NaN);
  }

  /**
   * Create an instance.
   *
   * @param detectorId the detector id
   * @param bankName the bank name
   * @param tof the nominal time-of-flight
   * @param dspacing the d-spacing
   * @param h the h index
   * @param k the k index
   * @param l the l index
   * @param scatteringAngle the scattering angle (2-theta) in radians (NaN if unknown)
   * @param wavelength the wavelength in Angstroms (NaN if unknown)
   * @throws IllegalArgumentException if the TOF or d-spacing are not strictly positive
   */
  public PeakCandidate(int detectorId, String bankName, double tof, double dspacing, int h, int k,
      int l, double scatteringAngle, double wavelength) {
    ValidationUtils.checkStrictlyPositive(tof, "tof");
    ValidationUtils.checkStrictlyPositive(dspacing, "dspacing");
    this.detectorId = detectorId;
    this.bankName = ValidationUtils.checkNotNull(bankName, "bankName");
    this.tof = tof;
    this.dspacing = dspacing;
    this.h = h;
    this.k = k;
    this.l = l;
    this.scatteringAngle = scatteringAngle;
    this.wavelength = wavelength;
  }

  /**
   * Gets the detector id.
   *
   * @return the detector id
   */
  public int getDetectorId() {
    return detectorId;
  }

  /**
   * Gets the bank name.
   *
   * @return the bank name
   */
  public String getBankName() {
    return bankName;
  }

  /**
   * Gets the nominal time-of-flight.
   *
   * @return the tof
   */
  public double getTof() {
    return tof;
  }

  /**
   * Gets the d-spacing.
   *
   * @return the d-spacing
   */
  public double getDSpacing() {
    return dspacing;
  }

  public int getH() {
    return h;
  }

  public int getK() {
    return k;
  }

  public int getL() {
    return l;
  }

  /**
   * Gets the scattering angle (2-theta) in radians.
   *
   * @return the scattering angle (NaN if unknown)
   */
  public double getScatteringAngle() {
    return scatteringAngle;
  }

  /**
   * Gets the wavelength in Angstroms.
   *
   * @return the wavelength (NaN if unknown)
   */
  public double getWavelength() {
    return wavelength;
  }

  /**
   * Checks for the scattering geometry required for the Lorentz correction.
   *
   * @return true if the scattering angle and wavelength are known
   */
  public boolean hasScatteringGeometry() {
    return scatteringAngle > 0 && wavelength > 0;
  }

  @Override
  public String toString() {
    return String.format("(%d %d %d) detector=%d [%s] tof=%s d=%s", h, k, l, detectorId, bankName,
        MathUtils.rounded(tof), MathUtils.rounded(dspacing));
  }
}
