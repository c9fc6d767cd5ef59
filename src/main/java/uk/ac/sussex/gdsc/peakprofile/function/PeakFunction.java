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
 * Base class for a peak shape.
 *
 * <p>A peak has a centre, an integrated intensity and a full-width at half-maximum (FWHM). The
 * width parameter is the internal parameter controlling the FWHM.
 */
public abstract class PeakFunction extends ProfileFunction {
  /**
   * Create an instance.
   *
   * @param size the number of parameters
   */
  protected PeakFunction(int size) {
    super(size);
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected PeakFunction(PeakFunction source) {
    super(source);
  }

  @Override
  public abstract PeakFunction copy();

  /**
   * Gets the peak shape.
   *
   * @return the shape
   */
  public abstract PeakShape getShape();

  /**
   * Gets the index of the intensity parameter.
   *
   * @return the index (or -1 if the intensity is not a parameter of the function)
   */
  public abstract int getIntensityIndex();

  public abstract int getCentreIndex();

  /**
   * Gets the index of the parameter controlling the FWHM.
   *
   * @return the width index
   */
  public abstract int getWidthIndex();

  /**
   * Gets the indices of the shape parameters. These are all parameters other than the intensity
   * (or height) and centre.
   *
   * @return the shape indices
   */
  public abstract int[] getShapeIndices();

  /**
   * Gets the integrated intensity.
   *
   * @return the intensity
   */
  public abstract double getIntensity();

  /**
   * Sets the integrated intensity.
   *
   * @param intensity the new intensity
   */
  public abstract void setIntensity(double intensity);

  /**
   * Gets the full-width at half-maximum.
   *
   * @return the FWHM
   */
  public abstract double getFwhm();

  /**
   * Sets the width parameter to achieve the full-width at half-maximum.
   *
   * @param fwhm the new FWHM
   */
  public abstract void setFwhm(double fwhm);

  /**
   * Checks if the intensity is a parameter of the function.
   *
   * @return true if the intensity can be fitted directly
   */
  public boolean hasIntensityParameter() {
    return getIntensityIndex() >= 0;
  }

  public double getCentre() {
    return parameters[getCentreIndex()];
  }

  public void setCentre(double centre) {
    parameters[getCentreIndex()] = centre;
  }

  /**
   * Gets the ratio of the width parameter to the FWHM.
   *
   * @return the ratio
   */
  public double getWidthToFwhmRatio() {
    return parameters[getWidthIndex()] / getFwhm();
  }
}
