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

import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The method to compute the error of the fitted intensity of a pixel.
 */
public enum ErrorStrategy {
  /** Use the fit covariance of the intensity parameter. */
  HESSIAN("Hessian"),
  /** Use the variance of the data in the central region of the fitted peak. */
  SUMMATION("Summation");

  private static final ErrorStrategy[] values;

  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;

  ErrorStrategy(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Create the error estimator.
   *
   * @param summationCutoff the cut-off fraction for the summation strategy
   * @return the error estimator
   */
  public ErrorEstimator createEstimator(double summationCutoff) {
    return this == HESSIAN ? new HessianErrorEstimator()
        : new SummationErrorEstimator(summationCutoff);
  }

  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Get the value from the description.
   *
   * @param description the description
   * @return the strategy (or null)
   */
  public static ErrorStrategy fromDescription(String description) {
    for (final ErrorStrategy value : values) {
      if (value.getDescription().equalsIgnoreCase(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @return the error strategy
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static ErrorStrategy fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the error strategy
   * @throws NullPointerException if the default value is null
   */
  public static ErrorStrategy fromOrdinal(int ordinal, ErrorStrategy defaultValue) {
    return SimpleArrayUtils.getIndex(ordinal, values,
        ValidationUtils.checkNotNull(defaultValue, "Default value is null"));
  }
}
