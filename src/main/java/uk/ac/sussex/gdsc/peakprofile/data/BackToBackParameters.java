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
 * The instrument parameters of a back-to-back exponential peak at a given time-of-flight.
 */
public final class BackToBackParameters {
  /** The rise exponent. */
  private final double alpha;
  /** The decay exponent. */
  private final double beta;
  /** The Gaussian width. */
  private final double sigma;

  /**
   * Create an instance.
   *
   * @param alpha the rise exponent (A)
   * @param beta the decay exponent (B)
   * @param sigma the Gaussian width (S)
   */
  public BackToBackParameters(double alpha, double beta, double sigma) {
    this.alpha = alpha;
    this.beta = beta;
    this.sigma = sigma;
  }

  /**
   * Gets the rise exponent (A).
   *
   * @return the alpha
   */
  public double getAlpha() {
    return alpha;
  }

  /**
   * Gets the decay exponent (B).
   *
   * @return the beta
   */
  public double getBeta() {
    return beta;
  }

  /**
   * Gets the Gaussian width (S).
   *
   * @return the sigma
   */
  public double getSigma() {
    return sigma;
  }
}
