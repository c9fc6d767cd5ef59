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

import java.util.function.Supplier;
import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The supported backgrounds.
 */
public enum BackgroundShape {
  /** A constant background. */
  FLAT("FlatBackground", FlatBackgroundFunction::new),
  /** A background linear in time-of-flight. */
  LINEAR("LinearBackground", LinearBackgroundFunction::new);

  /** The Constant values. */
  private static final BackgroundShape[] values;

  /** The Constant descriptions. */
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  /** The description. */
  private final String description;

  /** The factory for the function. */
  private final Supplier<ProfileFunction> factory;

  BackgroundShape(String description, Supplier<ProfileFunction> factory) {
    this.description = description;
    this.factory = factory;
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
   * Create a new instance of the background function.
   *
   * @return the background function
   */
  public ProfileFunction createFunction() {
    return factory.get();
  }

  /**
   * Gets the parameter names of the background function.
   *
   * @return the parameter names
   */
  public String[] getParameterNames() {
    return createFunction().getParameterNames();
  }

  /**
   * Gets the descriptions for all of the values.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the background shape (or null)
   */
  public static BackgroundShape fromDescription(String description) {
    for (final BackgroundShape value : values) {
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
   * @return the background shape
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static BackgroundShape fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the background shape
   * @throws NullPointerException if the default value is null
   */
  public static BackgroundShape fromOrdinal(int ordinal, BackgroundShape defaultValue) {
    return SimpleArrayUtils.getIndex(ordinal, values,
        ValidationUtils.checkNotNull(defaultValue, "Default value is null"));
  }
}
