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

import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;

/**
 * Fit a profile model in two stages.
 *
 * <p>The first stage fixes the shape parameters of the peak at their initial values in addition
 * to the fixed parameters of the model. If accepted the second stage refits from the result with
 * only the fixed parameters of the model. The second stage supersedes the first if accepted.
 *
 * <p>Failures of the fit engine are reported as a failed outcome and never propagated.
 */
public class ConstrainedFitDriver {
  private final FitEngine engine;
  private final CostFunction costFunction;
  private final FitAcceptanceRule acceptanceRule;
  private Logger logger;

  /**
   * Create an instance.
   *
   * @param engine the fit engine
   * @param costFunction the cost function
   * @param acceptanceRule the acceptance rule
   */
  public ConstrainedFitDriver(FitEngine engine, CostFunction costFunction,
      FitAcceptanceRule acceptanceRule) {
    this.engine = ValidationUtils.checkNotNull(engine, "engine");
    this.costFunction = ValidationUtils.checkNotNull(costFunction, "costFunction");
    this.acceptanceRule = ValidationUtils.checkNotNull(acceptanceRule, "acceptanceRule");
  }

  /**
   * Set the logger. Fit failures are logged at {@link Level#FINE}.
   *
   * @param logger the new logger
   */
  public void setLogger(Logger logger) {
    this.logger = logger;
  }

  public Logger getLogger() {
    return logger;
  }

  /**
   * Fit the model. The input model is not modified.
   *
   * @param model the model
   * @param x the time-of-flight
   * @param y the observed values
   * @param variance the variance of the observed values
   * @return the outcome
   */
  public FitOutcome fit(ProfileModel model, double[] x, double[] y, double[] variance) {
    try {
      final ProfileModel constrained = model.copy();
      for (final int i : constrained.getPeak().getShapeIndices()) {
        constrained.fix(i);
      }
      final FitResult first = engine.fit(constrained, x, y, variance, costFunction);
      if (!isAccepted(first, 1)) {
        return FitOutcome.failed();
      }
      constrained.setParameters(first.getParameters());

      final ProfileModel unconstrained = model.copy();
      unconstrained.setParameters(first.getParameters());
      final FitResult second = engine.fit(unconstrained, x, y, variance, costFunction);
      if (isAccepted(second, 2)) {
        unconstrained.setParameters(second.getParameters());
        return FitOutcome.success(second.getStatus(), unconstrained, second.getCovariance(), 2);
      }
      return FitOutcome.success(first.getStatus(), constrained, first.getCovariance(), 1);
    } catch (final RuntimeException ex) {
      if (logger != null) {
        logger.log(Level.FINE, ex, () -> "Fit error: " + model);
      }
      return FitOutcome.failed();
    }
  }

  private boolean isAccepted(FitResult result, int stage) {
    final boolean accepted =
        acceptanceRule.isAccepted(result.getStatus()) && result.getParameters() != null;
    if (!accepted && logger != null) {
      logger.fine(() -> String.format("Fit stage %d not accepted: %s", stage, result.getStatus()));
    }
    return accepted;
  }
}
