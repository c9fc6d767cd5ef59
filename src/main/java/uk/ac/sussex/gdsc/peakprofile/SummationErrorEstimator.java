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
import uk.ac.sussex.gdsc.peakprofile.fit.FitOutcome;

/**
 * Compute the error from the variance of the data in the central region of the fitted peak.
 *
 * <p>The region is bounded by the points where the cumulative area of the fitted peak is closest
 * to the cut-off fraction in each tail. The error is the trapezoid integration error of the
 * variance over the region.
 */
public class SummationErrorEstimator implements ErrorEstimator {
  /** The default fraction of the area in each tail. */
  public static final double DEFAULT_CUTOFF = 0.025;

  private final double cutoff;

  /**
   * Create an instance with the default cut-off.
   */
  public SummationErrorEstimator() {
    this(DEFAULT_CUTOFF);
  }

  /**
   * Create an instance.
   *
   * @param cutoff the fraction of the area in each tail
   * @throws IllegalArgumentException if the cut-off is not in {@code [0, 0.5)}
   */
  public SummationErrorEstimator(double cutoff) {
    ValidationUtils.checkArgument(cutoff >= 0 && cutoff < 0.5, "Cut-off must be in [0, 0.5): %s",
        cutoff);
    this.cutoff = cutoff;
  }

  public double getCutoff() {
    return cutoff;
  }

  @Override
  public double estimate(FitOutcome outcome, double[] peakCurve, double[] variance, double[] x) {
    final int[] range = findRange(peakCurve);
    if (range == null) {
      return Double.NaN;
    }
    return SeedEstimator.integrateError(variance, x, range[0], range[1]);
  }

  /**
   * Find the range of the central region of the curve.
   *
   * @param curve the curve
   * @return the range {from (inclusive), to (exclusive)} (or null if the curve has no area)
   */
  int[] findRange(double[] curve) {
    final int n = curve.length;
    final double[] cumulative = new double[n];
    double sum = 0;
    for (int i = 0; i < n; i++) {
      sum += curve[i];
      cumulative[i] = sum;
    }
    if (!(sum > 0)) {
      return null;
    }
    int lo = 0;
    int hi = 0;
    for (int i = 0; i < n; i++) {
      cumulative[i] /= sum;
      if (Math.abs(cumulative[i] - cutoff) < Math.abs(cumulative[lo] - cutoff)) {
        lo = i;
      }
      if (Math.abs(cumulative[i] - (1 - cutoff)) < Math.abs(cumulative[hi] - (1 - cutoff))) {
        hi = i;
      }
    }
    int to = hi + 1;
    if (to - lo < 2) {
      // Require at least one interval
      lo = Math.max(0, Math.min(lo, n - 2));
      to = lo + 2;
    }
    return new int[] {lo, to};
  }
}
