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

import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.peakprofile.data.PeakCandidate;

/**
 * The integrated intensity of a peak.
 */
public final class PeakIntegrationResult {
  private final PeakCandidate peak;
  private final double intensity;
  private final double sigma;
  private final IntegrationStatus status;
  private final PeakDiagnostics diagnostics;

  /**
   * Create an instance.
   *
   * @param peak the peak
   * @param intensity the intensity
   * @param sigma the error of the intensity
   * @param status the status
   * @param diagnostics the diagnostics (can be null)
   */
  public PeakIntegrationResult(PeakCandidate peak, double intensity, double sigma,
      IntegrationStatus status, PeakDiagnostics diagnostics) {
    this.peak = peak;
    this.intensity = intensity;
    this.sigma = sigma;
    this.status = status;
    this.diagnostics = diagnostics;
  }

  /**
   * Create a result with no peak.
   *
   * @param peak the peak
   * @param diagnostics the diagnostics (can be null)
   * @return the result
   */
  public static PeakIntegrationResult noPeak(PeakCandidate peak, PeakDiagnostics diagnostics) {
    return new PeakIntegrationResult(peak, 0, 0, IntegrationStatus.NO_PEAK, diagnostics);
  }

  public PeakCandidate getPeak() {
    return peak;
  }

  public double getIntensity() {
    return intensity;
  }

  public double getSigma() {
    return sigma;
  }

  public IntegrationStatus getStatus() {
    return status;
  }

  /**
   * Gets the diagnostics.
   *
   * @return the diagnostics (null if no window was available)
   */
  public PeakDiagnostics getDiagnostics() {
    return diagnostics;
  }

  /**
   * Gets the intensity over sigma. This is zero when sigma is zero.
   *
   * @return the intensity over sigma
   */
  public double getIntensityOverSigma() {
    return sigma > 0 ? intensity / sigma : 0;
  }

  @Override
  public String toString() {
    return String.format("%s : I=%s, sigma=%s, %s", peak, MathUtils.rounded(intensity),
        MathUtils.rounded(sigma), status);
  }
}
