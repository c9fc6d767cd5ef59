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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Estimate the background subtracted intensity of a time-of-flight trace.
 *
 * <pre>
 * intensity = sum((0.5 * (y[i] + y[i+1]) - bg) * dx[i])
 * sigma = sqrt(sum(0.5 * (var[i] + var[i+1]) * dx[i]^2))
 * </pre>
 *
 * <p>The background is the mean of the bins chosen by the {@link BackgroundSelector}.
 */
public class SeedEstimator {
  private final BackgroundSelector backgroundSelector;

  /**
   * Create an instance.
   *
   * @param backgroundSelector the background selector
   */
  public SeedEstimator(BackgroundSelector backgroundSelector) {
    this.backgroundSelector = ValidationUtils.checkNotNull(backgroundSelector,
        "backgroundSelector");
  }

  /**
   * Estimate the seed. If all the values are non-positive then the empty seed is returned.
   *
   * @param y the intensity
   * @param variance the variance
   * @param x the time-of-flight
   * @return the seed
   */
  public Seed estimate(double[] y, double[] variance, double[] x) {
    if (!hasSignal(y)) {
      return Seed.EMPTY;
    }
    final boolean[] mask = backgroundSelector.select(y);
    double sum = 0;
    int count = 0;
    for (int i = 0; i < y.length; i++) {
      if (mask[i]) {
        sum += y[i];
        count++;
      }
    }
    final double background = count == 0 ? 0 : sum / count;
    return new Seed(integrate(y, x, background), integrateError(variance, x), background);
  }

  private static boolean hasSignal(double[] y) {
    for (final double v : y) {
      if (v > 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Integrate the background subtracted values using the trapezoid rule.
   *
   * @param y the values
   * @param x the time-of-flight
   * @param background the background
   * @return the integral
   */
  static double integrate(double[] y, double[] x, double background) {
    double sum = 0;
    for (int i = 0; i < y.length - 1; i++) {
      sum += (0.5 * (y[i] + y[i + 1]) - background) * (x[i + 1] - x[i]);
    }
    return sum;
  }

  /**
   * Compute the error of the trapezoid integral.
   *
   * @param variance the variance
   * @param x the time-of-flight
   * @return the error
   */
  static double integrateError(double[] variance, double[] x) {
    return integrateError(variance, x, 0, variance.length);
  }

  /**
   * Compute the error of the trapezoid integral over the range {@code [from, to)}.
   *
   * @param variance the variance
   * @param x the time-of-flight
   * @param from the start index (inclusive)
   * @param to the end index (exclusive)
   * @return the error
   */
  static double integrateError(double[] variance, double[] x, int from, int to) {
    double sum = 0;
    for (int i = from; i < to - 1; i++) {
      final double dx = x[i + 1] - x[i];
      sum += 0.5 * (variance[i] + variance[i + 1]) * dx * dx;
    }
    return Math.sqrt(sum);
  }
}
