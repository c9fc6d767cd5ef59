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

/**
 * The status of a fit.
 */
public enum FitStatus {
  /** The fit converged. */
  SUCCESS("Success"),
  /** The fit stopped as the changes in the cost were below the numerical precision. */
  CHANGES_TOO_SMALL("Changes in function value are too small"),
  /** The iteration limit was reached. */
  TOO_MANY_ITERATIONS("Too many iterations"),
  /** The fit failed. */
  FAILED("Failed");

  private final String description;

  FitStatus(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }
}
