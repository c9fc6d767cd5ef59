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

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.special.Erf;

/**
 * An asymmetric peak formed from the convolution of back-to-back exponentials with a Gaussian.
 *
 * <pre>
 * f(x) = I * N * (exp(u) erfc(y) + exp(v) erfc(z))
 * N = A * B / (2 * (A + B))
 * u = A / 2 * (A * S^2 + 2 * (x - X0))
 * v = B / 2 * (B * S^2 - 2 * (x - X0))
 * y = (A * S^2 + (x - X0)) / sqrt(2 * S^2)
 * z = (B * S^2 - (x - X0)) / sqrt(2 * S^2)
 * </pre>
 *
 * <p>The function has unit area scaled by the intensity I. A is the rise exponent, B is the decay
 * exponent and S is the standard deviation of the Gaussian.
 */
public class BackToBackExponentialFunction extends PeakFunction {
  /** The index of the intensity. */
  public static final int INTENSITY = 0;
  /** The index of the rise exponent. */
  public static final int ALPHA = 1;
  /** The index of the decay exponent. */
  public static final int BETA = 2;
  /** The index of the centre. */
  public static final int CENTRE = 3;
  /** The index of the Gaussian width. */
  public static final int SIGMA = 4;

  private static final String[] NAMES = {"I", "A", "B", "X0", "S"};
  private static final double FWHM_FACTOR = 2 * Math.sqrt(2 * Math.log(2));
  private static final double ONE_OVER_SQRT_PI = 1 / Math.sqrt(Math.PI);
  /** Above this limit erfc(y) is computed using the scaled asymptotic expansion. */
  private static final double ERFC_LIMIT = 26;
  /** The maximum number of evaluations when computing the FWHM. */
  private static final int MAX_EVALUATIONS = 200;

  /**
   * Create an instance.
   */
  public BackToBackExponentialFunction() {
    super(NAMES.length);
    parameters[INTENSITY] = 1;
    parameters[ALPHA] = 1;
    parameters[BETA] = 1;
    parameters[SIGMA] = 1;
  }

  private BackToBackExponentialFunction(BackToBackExponentialFunction source) {
    super(source);
  }

  @Override
  public BackToBackExponentialFunction copy() {
    return new BackToBackExponentialFunction(this);
  }

  @Override
  public String[] getParameterNames() {
    return NAMES.clone();
  }

  @Override
  public PeakShape getShape() {
    return PeakShape.BACK_TO_BACK_EXPONENTIAL;
  }

  @Override
  public double value(double x) {
    return parameters[INTENSITY] * shape(x);
  }

  /**
   * Compute the unit-area shape.
   *
   * @param x the time-of-flight
   * @return the value
   */
  private double shape(double x) {
    final double a = parameters[ALPHA];
    final double b = parameters[BETA];
    final double s2 = parameters[SIGMA] * parameters[SIGMA];
    if (a <= 0 || b <= 0 || s2 <= 0) {
      return 0;
    }
    final double dx = x - parameters[CENTRE];
    final double norm = a * b / (2 * (a + b));
    final double root2s2 = Math.sqrt(2 * s2);
    final double u = 0.5 * a * (a * s2 + 2 * dx);
    final double v = 0.5 * b * (b * s2 - 2 * dx);
    final double y = (a * s2 + dx) / root2s2;
    final double z = (b * s2 - dx) / root2s2;
    return norm * (expErfc(u, y) + expErfc(v, z));
  }

  /**
   * Compute {@code exp(u) * erfc(y)} avoiding overflow of exp(u) when erfc(y) underflows.
   *
   * @param u the exponent
   * @param y the erfc argument
   * @return the product
   */
  static double expErfc(double u, double y) {
    if (y <= ERFC_LIMIT) {
      final double e = Erf.erfc(y);
      return e == 0 ? 0 : Math.exp(u) * e;
    }
    // exp(u) erfc(y) = exp(u - y^2) erfcx(y)
    final double y2 = y * y;
    final double erfcx =
        ONE_OVER_SQRT_PI / y * (1 - 0.5 / y2 + 0.75 / (y2 * y2) - 1.875 / (y2 * y2 * y2));
    return Math.exp(u - y2) * erfcx;
  }

  @Override
  public void gradient(double x, double[] df) {
    final double s = shape(x);
    df[INTENSITY] = s;
    for (int i = 1; i < parameters.length; i++) {
      df[i] = numericalDerivative(x, i);
    }
  }

  @Override
  public int getIntensityIndex() {
    return INTENSITY;
  }

  @Override
  public int getCentreIndex() {
    return CENTRE;
  }

  @Override
  public int getWidthIndex() {
    return SIGMA;
  }

  @Override
  public int[] getShapeIndices() {
    return new int[] {ALPHA, BETA, SIGMA};
  }

  @Override
  public double getIntensity() {
    return parameters[INTENSITY];
  }

  @Override
  public void setIntensity(double intensity) {
    parameters[INTENSITY] = intensity;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The FWHM is computed numerically by locating the maximum and the half-maximum crossing
   * points on either side.
   *
   * @return the FWHM (or NaN if the shape parameters are not strictly positive)
   */
  @Override
  public double getFwhm() {
    final double a = parameters[ALPHA];
    final double b = parameters[BETA];
    final double s = parameters[SIGMA];
    if (!(a > 0 && b > 0 && s > 0)) {
      return Double.NaN;
    }
    try {
      return computeFwhm(s + 1 / a + 1 / b);
    } catch (MathIllegalArgumentException | MathIllegalStateException ex) {
      // No bracket for the half-maximum or too many evaluations
      return Double.NaN;
    }
  }

  private double computeFwhm(double scale) {
    final double x0 = parameters[CENTRE];
    final UnivariateFunction f = this::shape;
    final BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-12 * scale);
    final UnivariatePointValuePair max = optimizer.optimize(new MaxEval(MAX_EVALUATIONS),
        new UnivariateObjectiveFunction(f), GoalType.MAXIMIZE,
        new SearchInterval(x0 - 3 * scale, x0 + 3 * scale, x0));
    final double xmax = max.getPoint();
    final double half = max.getValue() / 2;
    final UnivariateFunction g = x -> shape(x) - half;

    double lower = xmax - scale;
    for (int i = 0; i < MAX_EVALUATIONS && g.value(lower) > 0; i++) {
      lower -= scale;
    }
    double upper = xmax + scale;
    for (int i = 0; i < MAX_EVALUATIONS && g.value(upper) > 0; i++) {
      upper += scale;
    }
    final BrentSolver solver = new BrentSolver(1e-10 * scale);
    final double left = solver.solve(MAX_EVALUATIONS, g, lower, xmax);
    final double right = solver.solve(MAX_EVALUATIONS, g, xmax, upper);
    return right - left;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Sets the Gaussian width S using the FWHM of a Gaussian. The exponents are unchanged so the
   * FWHM of the function will be larger than the target.
   */
  @Override
  public void setFwhm(double fwhm) {
    parameters[SIGMA] = fwhm / FWHM_FACTOR;
  }
}
