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

package uk.ac.sussex.gdsc.peakprofile.fit;

/**
 * The result of a single call to a {@link FitEngine}.
 *
 * <p>The parameters and covariance are indexed by the parameters of the model, including fixed
 * parameters. The covariance of a fixed parameter is zero.
 */
public final class FitResult {
  private final FitStatus status;
  private final double[] parameters;
  private final double[][] covariance;
  private final double cost;

  /**
   * Create an instance.
   *
   * @param status the status
   * @param parameters the parameters (can be null if the fit failed)
   * @param covariance the covariance (can be null)
   * @param cost the cost
   */
  public FitResult(FitStatus status, double[] parameters, double[][] covariance, double cost) {
    this.status = status;
    this.parameters = parameters;
    this.covariance = covariance;
    this.cost = cost;
  }

  /**
   * Create a failed result.
   *
   * @return the result
   */
  public static FitResult failed() {
    return new FitResult(FitStatus.FAILED, null, null, Double.NaN);
  }

  public FitStatus getStatus() {
    return status;
  }

  /**
   * Gets the fitted parameters.
   *
   * @return the parameters (can be null)
   */
  public double[] getParameters() {
    return parameters;
  }

  /**
   * Gets the covariance of the fitted parameters.
   *
   * @return the covariance (can be null)
   */
  public double[][] getCovariance() {
    return covariance;
  }

  public double getCost() {
    return cost;
  }
}
