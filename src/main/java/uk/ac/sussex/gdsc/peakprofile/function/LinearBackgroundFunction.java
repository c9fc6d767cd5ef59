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

/**
 * A linear background: {@code f(x) = A0 + A1 * x}.
 */
public class LinearBackgroundFunction extends ProfileFunction {
  private static final String[] NAMES = {"A0", "A1"};

  /**
   * Create an instance.
   */
  public LinearBackgroundFunction() {
    super(NAMES.length);
  }

  private LinearBackgroundFunction(LinearBackgroundFunction source) {
    super(source);
  }

  @Override
  public LinearBackgroundFunction copy() {
    return new LinearBackgroundFunction(this);
  }

  @Override
  public String[] getParameterNames() {
    return NAMES.clone();
  }

  @Override
  public double value(double x) {
    return parameters[0] + parameters[1] * x;
  }

  @Override
  public void gradient(double x, double[] df) {
    df[0] = 1;
    df[1] = x;
  }
}
