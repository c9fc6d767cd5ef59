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

import uk.ac.sussex.gdsc.peakprofile.function.PeakFunction;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;

/**
 * The outcome of fitting a pixel with the {@link ConstrainedFitDriver}.
 */
public final class FitOutcome {
  private static final FitOutcome FAILED = new FitOutcome(null, null, null, 0);

  private final FitStatus status;
  private final ProfileModel model;
  private final double[][] covariance;
  private final int stages;

  private FitOutcome(FitStatus status, ProfileModel model, double[][] covariance, int stages) {
    this.status = status;
    this.model = model;
    this.covariance = covariance;
    this.stages = stages;
  }

  /**
   * Create a successful outcome.
   *
   * @param status the status of the accepted fit
   * @param model the fitted model
   * @param covariance the covariance (can be null)
   * @param stages the number of accepted stages
   * @return the outcome
   */
  public static FitOutcome success(FitStatus status, ProfileModel model, double[][] covariance,
      int stages) {
    return new FitOutcome(status, model, covariance, stages);
  }

  /**
   * Get the failed outcome.
   *
   * @return the outcome
   */
  public static FitOutcome failed() {
    return FAILED;
  }

  public boolean isSuccess() {
    return model != null;
  }

  /**
   * Gets the status of the accepted fit.
   *
   * @return the status (null if failed)
   */
  public FitStatus getStatus() {
    return status;
  }

  /**
   * Gets the fitted model.
   *
   * @return the model (null if failed)
   */
  public ProfileModel getModel() {
    return model;
  }

  /**
   * Gets the fitted peak.
   *
   * @return the peak (null if failed)
   */
  public PeakFunction getPeak() {
    return model == null ? null : model.getPeak();
  }

  /**
   * Gets the covariance of the model parameters.
   *
   * @return the covariance (can be null)
   */
  public double[][] getCovariance() {
    return covariance;
  }

  /**
   * Gets the number of accepted fit stages. A value of 2 indicates the unconstrained fit
   * superseded the constrained fit.
   *
   * @return the stages
   */
  public int getStages() {
    return stages;
  }

  /**
   * Evaluate the fitted peak (without the background).
   *
   * @param x the time-of-flight
   * @return the peak curve (null if failed)
   */
  public double[] getPeakCurve(double[] x) {
    return model == null ? null : model.peakValues(x);
  }
}
