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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.data.BackToBackParameters;
import uk.ac.sussex.gdsc.peakprofile.data.DiffractometerConstants;

/**
 * Builds the profile model fitted to the time-of-flight trace of a single pixel.
 *
 * <p>The builder is immutable and may be shared between threads. Each call to
 * {@link #build(double, double[], double, double, BackToBackParameters)} creates a new model.
 */
public class ProfileFunctionBuilder {
  /** The default rise exponent as a multiple of 1/FWHM when not defined by the instrument. */
  private static final double DEFAULT_ALPHA_FACTOR = 4;
  /** The default decay exponent as a multiple of 1/FWHM when not defined by the instrument. */
  private static final double DEFAULT_BETA_FACTOR = 2;
  /** The ratio of the standard deviation to the FWHM of a Gaussian. */
  private static final double GAUSSIAN_WIDTH_RATIO = 1 / (2 * Math.sqrt(2 * Math.log(2)));

  private final PeakShape peakShape;
  private final BackgroundShape backgroundShape;
  private final double fractionalTolerance;
  private final String[] fixedParameters;

  /**
   * Create an instance.
   *
   * @param peakShape the peak shape
   * @param backgroundShape the background shape
   * @param fractionalTolerance the fractional tolerance of the centre
   * @param fixedParameters the names of the parameters to fix at the initial value
   * @throws IllegalArgumentException if a fixed parameter is not a parameter of the model
   */
  public ProfileFunctionBuilder(PeakShape peakShape, BackgroundShape backgroundShape,
      double fractionalTolerance, String... fixedParameters) {
    this.peakShape = ValidationUtils.checkNotNull(peakShape, "peakShape");
    this.backgroundShape = ValidationUtils.checkNotNull(backgroundShape, "backgroundShape");
    ValidationUtils.checkArgument(fractionalTolerance > 0 && fractionalTolerance < 1,
        "Fractional tolerance must be in (0, 1): %s", fractionalTolerance);
    this.fractionalTolerance = fractionalTolerance;
    this.fixedParameters = fixedParameters.clone();
    checkFixedParameters(peakShape, backgroundShape, this.fixedParameters);
  }

  /**
   * Check each named parameter is a parameter of the model.
   *
   * @param peakShape the peak shape
   * @param backgroundShape the background shape
   * @param names the names
   * @throws IllegalArgumentException if a name is not a parameter of the model
   */
  public static void checkFixedParameters(PeakShape peakShape, BackgroundShape backgroundShape,
      String... names) {
    final ProfileModel model =
        new ProfileModel(peakShape.createFunction(), backgroundShape.createFunction());
    for (final String name : names) {
      ValidationUtils.checkArgument(model.indexOf(name) >= 0,
          "Unknown parameter for %s: %s", model, name);
    }
  }

  public PeakShape getPeakShape() {
    return peakShape;
  }

  public BackgroundShape getBackgroundShape() {
    return backgroundShape;
  }

  public double getFractionalTolerance() {
    return fractionalTolerance;
  }

  /**
   * Gets the names of the parameters fixed at the initial value.
   *
   * @return the fixed parameters
   */
  public String[] getFixedParameters() {
    return fixedParameters.clone();
  }

  /**
   * Compute the expected time-of-flight of the peak for the calibration of a pixel.
   *
   * @param dspacing the d-spacing
   * @param constants the diffractometer constants
   * @return the centre
   */
  public static double computeCentre(double dspacing, DiffractometerConstants constants) {
    return constants.tofFromDSpacing(dspacing);
  }

  /**
   * Checks if the centre is within the time-of-flight axis.
   *
   * @param centre the centre
   * @param tof the time-of-flight axis
   * @return true if in range
   */
  public static boolean isInRange(double centre, double[] tof) {
    return centre >= tof[0] && centre <= tof[tof.length - 1];
  }

  /**
   * Compute the bounds of the centre as {@code centre * (1 +/- tolerance)} clipped to the
   * time-of-flight axis.
   *
   * @param centre the centre
   * @param tof the time-of-flight axis
   * @return the bounds {lower, upper}
   */
  public double[] computeCentreBounds(double centre, double[] tof) {
    final double lower = Math.max(tof[0], centre * (1 - fractionalTolerance));
    final double upper = Math.min(tof[tof.length - 1], centre * (1 + fractionalTolerance));
    return new double[] {lower, upper};
  }

  /**
   * Compute the limits of the FWHM. The minimum is the bin width at the centre of the axis; the
   * maximum is one third of the axis span.
   *
   * @param tof the time-of-flight axis
   * @return the limits {min, max}
   */
  public static double[] computeFwhmLimits(double[] tof) {
    final int mid = Math.min(tof.length / 2, tof.length - 2);
    final double min = tof[mid + 1] - tof[mid];
    final double max = (tof[tof.length - 1] - tof[0]) / 3;
    return new double[] {min, Math.max(min, max)};
  }

  /**
   * Compute the initial FWHM as {@code tolerance * centre} clipped to the FWHM limits.
   *
   * @param centre the centre
   * @param fwhmLimits the FWHM limits
   * @return the initial FWHM
   */
  public double computeInitialFwhm(double centre, double[] fwhmLimits) {
    return Math.max(fwhmLimits[0], Math.min(fwhmLimits[1], fractionalTolerance * centre));
  }

  /**
   * Build a new model for a pixel.
   *
   * <p>The peak parameters are bounded to be non-negative; the centre is bounded by
   * {@link #computeCentreBounds(double, double[])}; the width parameter is bounded by the FWHM
   * limits scaled by the width-to-FWHM ratio of the peak. The background is unbounded.
   *
   * @param centre the expected centre
   * @param tof the time-of-flight axis
   * @param intensity the initial intensity
   * @param background the initial background level
   * @param b2b the back-to-back exponential parameters of the instrument used for the rise and
   *        decay exponents (can be null)
   * @return the model
   */
  public ProfileModel build(double centre, double[] tof, double intensity, double background,
      BackToBackParameters b2b) {
    final double[] fwhmLimits = computeFwhmLimits(tof);
    final double fwhm = computeInitialFwhm(centre, fwhmLimits);

    final PeakFunction peak = peakShape.createFunction();
    peak.setCentre(centre);
    if (peak instanceof BackToBackExponentialFunction) {
      // Only the exponents are taken from the instrument
      if (b2b != null) {
        peak.setParameter(BackToBackExponentialFunction.ALPHA, b2b.getAlpha());
        peak.setParameter(BackToBackExponentialFunction.BETA, b2b.getBeta());
      } else {
        peak.setParameter(BackToBackExponentialFunction.ALPHA, DEFAULT_ALPHA_FACTOR / fwhm);
        peak.setParameter(BackToBackExponentialFunction.BETA, DEFAULT_BETA_FACTOR / fwhm);
      }
    }
    peak.setFwhm(fwhm);
    peak.setIntensity(intensity);

    final ProfileFunction bg = backgroundShape.createFunction();
    bg.setParameter(0, background);

    final ProfileModel model = new ProfileModel(peak, bg);
    double ratio = peak.getWidthToFwhmRatio();
    if (!(ratio > 0 && ratio < Double.POSITIVE_INFINITY)) {
      ratio = GAUSSIAN_WIDTH_RATIO;
    }
    final int n = peak.getNumberOfParameters();
    for (int i = 0; i < n; i++) {
      model.setBounds(i, 0, Double.POSITIVE_INFINITY);
    }
    final double[] centreBounds = computeCentreBounds(centre, tof);
    model.setBounds(peak.getCentreIndex(), centreBounds[0], centreBounds[1]);
    model.setBounds(peak.getWidthIndex(), fwhmLimits[0] * ratio, fwhmLimits[1] * ratio);

    for (final String name : fixedParameters) {
      model.fix(name);
    }
    return model;
  }
}
