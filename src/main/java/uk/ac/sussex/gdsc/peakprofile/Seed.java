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

/**
 * The initial estimate of the peak in the time-of-flight trace of a pixel.
 */
public final class Seed {
  /** A seed with no signal. */
  public static final Seed EMPTY = new Seed(0, 0, 0);

  private final double intensity;
  private final double sigma;
  private final double background;

  /**
   * Create an instance.
   *
   * @param intensity the background subtracted intensity
   * @param sigma the error of the intensity
   * @param background the background level
   */
  public Seed(double intensity, double sigma, double background) {
    this.intensity = intensity;
    this.sigma = sigma;
    this.background = background;
  }

  public double getIntensity() {
    return intensity;
  }

  public double getSigma() {
    return sigma;
  }

  public double getBackground() {
    return background;
  }

  /**
   * Gets the intensity over sigma. This is zero when sigma is zero.
   *
   * @return the intensity over sigma
   */
  public double getIntensityOverSigma() {
    return sigma > 0 ? intensity / sigma : 0;
  }

  @Override
  public String toString() {
    return String.format("Seed[I=%g, sigma=%g, bg=%g]", intensity, sigma, background);
  }
}
