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

package uk.ac.sussex.gdsc.peakprofile.function;

import java.util.Arrays;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A composite model of a peak and a background with fixed flags and bounds for each parameter.
 *
 * <p>The parameters of the peak are followed by the parameters of the background. A model is
 * built for a single fit attempt and is never shared.
 */
public class ProfileModel {
  private final PeakFunction peak;
  private final ProfileFunction background;
  private final String[] names;
  private final boolean[] fixed;
  private final double[] lower;
  private final double[] upper;

  /**
   * Create an instance. All parameters are free and unbounded.
   *
   * @param peak the peak
   * @param background the background
   */
  public ProfileModel(PeakFunction peak, ProfileFunction background) {
    this.peak = peak;
    this.background = background;
    final String[] peakNames = peak.getParameterNames();
    final String[] backgroundNames = background.getParameterNames();
    names = Arrays.copyOf(peakNames, peakNames.length + backgroundNames.length);
    System.arraycopy(backgroundNames, 0, names, peakNames.length, backgroundNames.length);
    fixed = new boolean[names.length];
    lower = new double[names.length];
    upper = new double[names.length];
    Arrays.fill(lower, Double.NEGATIVE_INFINITY);
    Arrays.fill(upper, Double.POSITIVE_INFINITY);
  }

  private ProfileModel(ProfileModel source) {
    peak = source.peak.copy();
    background = source.background.copy();
    names = source.names;
    fixed = source.fixed.clone();
    lower = source.lower.clone();
    upper = source.upper.clone();
  }

  /**
   * Create a copy.
   *
   * @return the copy
   */
  public ProfileModel copy() {
    return new ProfileModel(this);
  }

  /**
   * Gets the peak. This is the live peak function of the model.
   *
   * @return the peak
   */
  public PeakFunction getPeak() {
    return peak;
  }

  /**
   * Gets the background. This is the live background function of the model.
   *
   * @return the background
   */
  public ProfileFunction getBackground() {
    return background;
  }

  public int getNumberOfParameters() {
    return names.length;
  }

  /**
   * Gets the parameter names.
   *
   * @return the names
   */
  public String[] getParameterNames() {
    return names.clone();
  }

  /**
   * Find the index of the named parameter.
   *
   * @param name the name
   * @return the index (or -1)
   */
  public int indexOf(String name) {
    for (int i = 0; i < names.length; i++) {
      if (names[i].equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Gets the parameter.
   *
   * @param index the index
   * @return the parameter
   */
  public double getParameter(int index) {
    final int n = peak.getNumberOfParameters();
    return index < n ? peak.getParameter(index) : background.getParameter(index - n);
  }

  /**
   * Sets the parameter.
   *
   * @param index the index
   * @param value the value
   */
  public void setParameter(int index, double value) {
    final int n = peak.getNumberOfParameters();
    if (index < n) {
      peak.setParameter(index, value);
    } else {
      background.setParameter(index - n, value);
    }
  }

  /**
   * Gets a copy of all the parameters.
   *
   * @return the parameters
   */
  public double[] getParameters() {
    final double[] p = new double[names.length];
    for (int i = 0; i < p.length; i++) {
      p[i] = getParameter(i);
    }
    return p;
  }

  /**
   * Sets all the parameters.
   *
   * @param values the values
   */
  public void setParameters(double[] values) {
    ValidationUtils.checkArgument(values.length == names.length, "Invalid parameter count: %d",
        values.length);
    for (int i = 0; i < values.length; i++) {
      setParameter(i, values[i]);
    }
  }

  /**
   * Fix the parameter at the current value.
   *
   * @param index the index
   */
  public void fix(int index) {
    fixed[index] = true;
  }

  /**
   * Fix the named parameter at the current value.
   *
   * @param name the name
   * @throws IllegalArgumentException if the name is not a parameter of the model
   */
  public void fix(String name) {
    final int index = indexOf(name);
    ValidationUtils.checkArgument(index >= 0, "Unknown parameter: %s", name);
    fixed[index] = true;
  }

  /**
   * Free all parameters.
   */
  public void freeAll() {
    Arrays.fill(fixed, false);
  }

  public boolean isFixed(int index) {
    return fixed[index];
  }

  /**
   * Gets the indices of the free parameters.
   *
   * @return the free indices
   */
  public int[] getFreeIndices() {
    int count = 0;
    final int[] free = new int[names.length];
    for (int i = 0; i < names.length; i++) {
      if (!fixed[i]) {
        free[count++] = i;
      }
    }
    return Arrays.copyOf(free, count);
  }

  /**
   * Sets the bounds of the parameter. The current value is clipped to the bounds.
   *
   * @param index the index
   * @param min the lower bound
   * @param max the upper bound
   * @throws IllegalArgumentException if {@code min > max}
   */
  public void setBounds(int index, double min, double max) {
    ValidationUtils.checkArgument(min <= max, "Invalid bounds for %s", names[index]);
    lower[index] = min;
    upper[index] = max;
    setParameter(index, clip(getParameter(index), min, max));
  }

  public double getLowerBound(int index) {
    return lower[index];
  }

  public double getUpperBound(int index) {
    return upper[index];
  }

  /**
   * Clip the value to the bounds of the parameter.
   *
   * @param index the index
   * @param value the value
   * @return the clipped value
   */
  public double clipToBounds(int index, double value) {
    return clip(value, lower[index], upper[index]);
  }

  private static double clip(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  /**
   * Compute the value of the peak plus background.
   *
   * @param x the time-of-flight
   * @return the value
   */
  public double value(double x) {
    return peak.value(x) + background.value(x);
  }

  /**
   * Compute the partial derivatives of the value with respect to all the parameters.
   *
   * @param x the time-of-flight
   * @param df the partial derivatives (output)
   */
  public void gradient(double x, double[] df) {
    final int n = peak.getNumberOfParameters();
    final double[] dp = new double[n];
    peak.gradient(x, dp);
    System.arraycopy(dp, 0, df, 0, n);
    final double[] db = new double[background.getNumberOfParameters()];
    background.gradient(x, db);
    System.arraycopy(db, 0, df, n, db.length);
  }

  /**
   * Evaluate the peak only (without the background) at each point.
   *
   * @param x the points
   * @return the values
   */
  public double[] peakValues(double[] x) {
    return peak.values(x);
  }

  @Override
  public String toString() {
    return peak.toString() + ';' + background.toString();
  }
}
