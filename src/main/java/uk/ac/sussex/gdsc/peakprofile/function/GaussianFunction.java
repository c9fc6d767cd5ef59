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
 * A symmetric Gaussian peak.
 *
 * <pre>
 * f(x) = Height * exp(-0.5 * (x - PeakCentre)^2 / Sigma^2)
 * </pre>
 *
 * <p>The intensity is {@code Height * Sigma * sqrt(2 pi)} and is not a parameter of the function.
 */
public class GaussianFunction extends PeakFunction {
  /** The index of the height. */
  public static final int HEIGHT = 0;
  /** The index of the centre. */
  public static final int CENTRE = 1;
  /** The index of the standard deviation. */
  public static final int SIGMA = 2;

  private static final String[] NAMES = {"Height", "PeakCentre", "Sigma"};
  private static final double SQRT_2PI = Math.sqrt(2 * Math.PI);
  private static final double FWHM_FACTOR = 2 * Math.sqrt(2 * Math.log(2));

  /**
   * Create an instance.
   */
  public GaussianFunction() {
    super(NAMES.length);
    parameters[SIGMA] = 1;
  }

  private GaussianFunction(GaussianFunction source) {
    super(source);
  }

  @Override
  public GaussianFunction copy() {
    return new GaussianFunction(this);
  }

  @Override
  public String[] getParameterNames() {
    return NAMES.clone();
  }

  @Override
  public PeakShape getShape() {
    return PeakShape.GAUSSIAN;
  }

  @Override
  public double value(double x) {
    final double dx = (x - parameters[CENTRE]) / parameters[SIGMA];
    return parameters[HEIGHT] * Math.exp(-0.5 * dx * dx);
  }

  @Override
  public void gradient(double x, double[] df) {
    final double s = parameters[SIGMA];
    final double dx = x - parameters[CENTRE];
    final double e = Math.exp(-0.5 * dx * dx / (s * s));
    final double he = parameters[HEIGHT] * e;
    df[HEIGHT] = e;
    df[CENTRE] = he * dx / (s * s);
    df[SIGMA] = he * dx * dx / (s * s * s);
  }

  @Override
  public int getIntensityIndex() {
    return -1;
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
    return new int[] {SIGMA};
  }

  @Override
  public double getIntensity() {
    return parameters[HEIGHT] * parameters[SIGMA] * SQRT_2PI;
  }

  @Override
  public void setIntensity(double intensity) {
    parameters[HEIGHT] = intensity / (parameters[SIGMA] * SQRT_2PI);
  }

  @Override
  public double getFwhm() {
    return FWHM_FACTOR * parameters[SIGMA];
  }

  @Override
  public void setFwhm(double fwhm) {
    // Preserve the intensity
    final double intensity = getIntensity();
    parameters[SIGMA] = fwhm / FWHM_FACTOR;
    setIntensity(intensity);
  }
}
