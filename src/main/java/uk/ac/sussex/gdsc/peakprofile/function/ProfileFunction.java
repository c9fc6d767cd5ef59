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

/**
 * Base class for a one-dimensional function of time-of-flight with named parameters.
 */
public abstract class ProfileFunction {
  /** The relative step used for numerical derivatives. */
  private static final double RELATIVE_STEP = 1e-6;

  /** The parameters. */
  protected final double[] parameters;

  /**
   * Create an instance.
   *
   * @param size the number of parameters
   */
  protected ProfileFunction(int size) {
    parameters = new double[size];
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected ProfileFunction(ProfileFunction source) {
    parameters = source.parameters.clone();
  }

  /**
   * Gets the parameter names.
   *
   * @return the parameter names
   */
  public abstract String[] getParameterNames();

  /**
   * Compute the function value.
   *
   * @param x the time-of-flight
   * @return the value
   */
  public abstract double value(double x);

  /**
   * Create a copy.
   *
   * @return the copy
   */
  public abstract ProfileFunction copy();

  /**
   * Compute the partial derivatives of the function value with respect to each parameter.
   *
   * <p>The default implementation uses central finite differences.
   *
   * @param x the time-of-flight
   * @param df the partial derivatives (output)
   */
  public void gradient(double x, double[] df) {
    for (int i = 0; i < parameters.length; i++) {
      df[i] = numericalDerivative(x, i);
    }
  }

  /**
   * Compute the partial derivative with respect to the parameter using central finite
   * differences.
   *
   * @param x the time-of-flight
   * @param index the parameter index
   * @return the derivative
   */
  protected double numericalDerivative(double x, int index) {
    final double p = parameters[index];
    final double h = RELATIVE_STEP * Math.max(Math.abs(p), RELATIVE_STEP);
    parameters[index] = p + h;
    final double upper = value(x);
    parameters[index] = p - h;
    final double lower = value(x);
    parameters[index] = p;
    return (upper - lower) / (2 * h);
  }

  /**
   * Gets the number of parameters.
   *
   * @return the number of parameters
   */
  public int getNumberOfParameters() {
    return parameters.length;
  }

  /**
   * Find the index of the named parameter.
   *
   * @param name the name
   * @return the index (or -1)
   */
  public int indexOf(String name) {
    final String[] names = getParameterNames();
    for (int i = 0; i < names.length; i++) {
      if (names[i].equals(name)) {
        return i;
      }
    }
    return -1;
  }

  public double getParameter(int index) {
    return parameters[index];
  }

  public void setParameter(int index, double value) {
    parameters[index] = value;
  }

  /**
   * Gets a copy of the parameters.
   *
   * @return the parameters
   */
  public double[] getParameters() {
    return parameters.clone();
  }

  /**
   * Sets the parameters.
   *
   * @param values the new parameters
   */
  public void setParameters(double[] values) {
    System.arraycopy(values, 0, parameters, 0, parameters.length);
  }

  @Override
  public String toString() {
    final String[] names = getParameterNames();
    final StringBuilder sb = new StringBuilder("name=").append(getClass().getSimpleName());
    for (int i = 0; i < names.length; i++) {
      sb.append(',').append(names[i]).append('=').append(parameters[i]);
    }
    return sb.toString();
  }

  /**
   * Evaluate the function at each point.
   *
   * @param x the points
   * @return the values
   */
  public double[] values(double[] x) {
    return Arrays.stream(x).map(this::value).toArray();
  }
}
