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

package uk.ac.sussex.gdsc.peakprofile.data;

/**
 * The diffractometer constants of a spectrum used to convert d-spacing to time-of-flight.
 *
 * <pre>
 * tof = DIFC * d + DIFA * d^2 + TZERO
 * </pre>
 */
public final class DiffractometerConstants {
  private final double difc;
  private final double difa;
  private final double tzero;

  /**
   * Create an instance.
   *
   * @param difc the linear coefficient
   * @param difa the quadratic coefficient
   * @param tzero the offset
   */
  public DiffractometerConstants(double difc, double difa, double tzero) {
    this.difc = difc;
    this.difa = difa;
    this.tzero = tzero;
  }

  /**
   * Create constants with only the linear coefficient.
   *
   * @param difc the linear coefficient
   * @return the constants
   */
  public static DiffractometerConstants of(double difc) {
    return new DiffractometerConstants(difc, 0, 0);
  }

  /**
   * Convert the d-spacing to time-of-flight.
   *
   * @param dspacing the d-spacing
   * @return the time-of-flight
   */
  public double tofFromDSpacing(double dspacing) {
    return difc * dspacing + difa * dspacing * dspacing + tzero;
  }

  public double getDifc() {
    return difc;
  }

  public double getDifa() {
    return difa;
  }

  public double getTzero() {
    return tzero;
  }
}
