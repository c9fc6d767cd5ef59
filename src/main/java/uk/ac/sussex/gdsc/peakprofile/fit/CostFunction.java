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

import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The cost function minimised when fitting a profile.
 */
public enum CostFunction {
  /** Sum of squared residuals. */
  UNWEIGHTED_LEAST_SQUARES("RSq"),
  /** Sum of squared residuals weighted by 1/variance. Points with no variance are ignored. */
  WEIGHTED_LEAST_SQUARES("ChiSq"),
  /** Poisson negative log-likelihood. */
  POISSON("Poisson");

  private static final CostFunction[] values;

  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;

  CostFunction(String description) {
    this.description = description;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Checks if the cost function is a least squares function. Least squares functions can be
   * minimised using the gradient.
   *
   * @return true if least squares
   */
  public boolean isLeastSquares() {
    return this != POISSON;
  }

  /**
   * Gets the descriptions.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Get the value from the description.
   *
   * @param description the description
   * @return the cost function (or null)
   */
  public static CostFunction fromDescription(String description) {
    for (final CostFunction value : values) {
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
   * @return the cost function
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static CostFunction fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the cost function
   * @throws NullPointerException if the default value is null
   */
  public static CostFunction fromOrdinal(int ordinal, CostFunction defaultValue) {
    return SimpleArrayUtils.getIndex(ordinal, values,
        ValidationUtils.checkNotNull(defaultValue, "Default value is null"));
  }
}
