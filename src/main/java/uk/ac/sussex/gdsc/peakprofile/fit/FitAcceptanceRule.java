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
 * The rule deciding if the status of a fit is accepted as a successful fit.
 */
public enum FitAcceptanceRule {
  /** Accept only {@link FitStatus#SUCCESS}. */
  SUCCESS_ONLY("Success") {
    @Override
    public boolean isAccepted(FitStatus status) {
      return status == FitStatus.SUCCESS;
    }
  },
  /**
   * Accept {@link FitStatus#SUCCESS} or {@link FitStatus#CHANGES_TOO_SMALL}. A fit that cannot
   * reduce the cost further is at a minimum within numerical precision.
   */
  SUCCESS_OR_CHANGES_TOO_SMALL("SuccessOrChangesTooSmall") {
    @Override
    public boolean isAccepted(FitStatus status) {
      return status == FitStatus.SUCCESS || status == FitStatus.CHANGES_TOO_SMALL;
    }
  };

  private static final FitAcceptanceRule[] values;

  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;

  FitAcceptanceRule(String description) {
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
   * Checks if the status is accepted.
   *
   * @param status the status
   * @return true if accepted
   */
  public abstract boolean isAccepted(FitStatus status);

  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Get the value from the description.
   *
   * @param description the description
   * @return the rule (or null)
   */
  public static FitAcceptanceRule fromDescription(String description) {
    for (final FitAcceptanceRule value : values) {
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
   * @return the acceptance rule
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static FitAcceptanceRule fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the acceptance rule
   * @throws NullPointerException if the default value is null
   */
  public static FitAcceptanceRule fromOrdinal(int ordinal, FitAcceptanceRule defaultValue) {
    return SimpleArrayUtils.getIndex(ordinal, values,
        ValidationUtils.checkNotNull(defaultValue, "Default value is null"));
  }
}
