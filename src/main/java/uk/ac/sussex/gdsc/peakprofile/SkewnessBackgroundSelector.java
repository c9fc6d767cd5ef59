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

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Select the background bins by removing the largest values until the remaining values are not
 * positively skewed.
 *
 * <p>The background of a trace is assumed to be symmetric noise. Signal from a peak adds a tail of
 * high values that positively skews the distribution.
 */
public class SkewnessBackgroundSelector implements BackgroundSelector {
  /** The default minimum number of background points. */
  public static final int DEFAULT_MIN_POINTS = 3;

  private final int minPoints;

  /**
   * Create an instance with the default minimum number of points.
   */
  public SkewnessBackgroundSelector() {
    this(DEFAULT_MIN_POINTS);
  }

  /**
   * Create an instance.
   *
   * @param minPoints the minimum number of background points
   */
  public SkewnessBackgroundSelector(int minPoints) {
    ValidationUtils.checkStrictlyPositive(minPoints, "minPoints");
    this.minPoints = minPoints;
  }

  public int getMinPoints() {
    return minPoints;
  }

  @Override
  public boolean[] select(double[] values) {
    final int[] order = new int[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    IntArrays.quickSort(order, (a, b) -> Double.compare(values[a], values[b]));
    final double[] sorted = new double[values.length];
    for (int i = 0; i < order.length; i++) {
      sorted[i] = values[order[i]];
    }

    // Skewness is NaN for fewer than 3 points or no variance: treat as background
    final Skewness skewness = new Skewness();
    int size = sorted.length;
    while (size > minPoints && skewness.evaluate(sorted, 0, size) > 0) {
      size--;
    }

    final boolean[] mask = new boolean[values.length];
    for (int i = 0; i < size; i++) {
      mask[order[i]] = true;
    }
    return mask;
  }
}
