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

import uk.ac.sussex.gdsc.peakprofile.fit.FitOutcome;

/**
 * Use the fit covariance of the intensity parameter as the error.
 *
 * <p>The peak function must have the intensity as a parameter.
 */
public class HessianErrorEstimator implements ErrorEstimator {
  @Override
  public double estimate(FitOutcome outcome, double[] peakCurve, double[] variance, double[] x) {
    final double[][] covariance = outcome.getCovariance();
    final int index = outcome.getPeak().getIntensityIndex();
    if (covariance == null || index < 0) {
      return Double.NaN;
    }
    final double v = covariance[index][index];
    return v > 0 ? Math.sqrt(v) : Double.NaN;
  }
}
