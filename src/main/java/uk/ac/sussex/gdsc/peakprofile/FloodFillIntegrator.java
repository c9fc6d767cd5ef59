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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.data.BackToBackParameters;
import uk.ac.sussex.gdsc.peakprofile.data.PeakCandidate;
import uk.ac.sussex.gdsc.peakprofile.data.PixelWindow;
import uk.ac.sussex.gdsc.peakprofile.data.ProfileCalibration;
import uk.ac.sussex.gdsc.peakprofile.fit.ConstrainedFitDriver;
import uk.ac.sussex.gdsc.peakprofile.fit.FitOutcome;
import uk.ac.sussex.gdsc.peakprofile.function.PeakFunction;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileFunctionBuilder;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;

/**
 * Fit the time-of-flight trace of each pixel in a window starting from a seed pixel and growing
 * the region of accepted pixels to 4-connected neighbours.
 *
 * <p>Each round fits the frontier pixels in order of descending integrated intensity. The fill
 * stops when a round accepts no pixel. A pixel is fitted at most once.
 */
public class FloodFillIntegrator {
  private final ProfileCalibration calibration;
  private final SeedEstimator seedEstimator;
  private final ProfileFunctionBuilder builder;
  private final ConstrainedFitDriver driver;
  private final ErrorEstimator errorEstimator;
  private final double threshold;
  private Logger logger;

  /**
   * Create an instance.
   *
   * @param calibration the calibration
   * @param seedEstimator the seed estimator
   * @param builder the profile function builder
   * @param driver the fit driver
   * @param errorEstimator the error estimator
   * @param threshold the intensity over sigma threshold
   */
  public FloodFillIntegrator(ProfileCalibration calibration, SeedEstimator seedEstimator,
      ProfileFunctionBuilder builder, ConstrainedFitDriver driver, ErrorEstimator errorEstimator,
      double threshold) {
    this.calibration = ValidationUtils.checkNotNull(calibration, "calibration");
    this.seedEstimator = ValidationUtils.checkNotNull(seedEstimator, "seedEstimator");
    this.builder = ValidationUtils.checkNotNull(builder, "builder");
    this.driver = ValidationUtils.checkNotNull(driver, "driver");
    this.errorEstimator = ValidationUtils.checkNotNull(errorEstimator, "errorEstimator");
    this.threshold = threshold;
  }

  /**
   * Set the logger. Pixel decisions are logged at {@link Level#FINER}. The logger is passed to
   * the fit driver.
   *
   * @param logger the new logger
   */
  public void setLogger(Logger logger) {
    this.logger = logger;
    driver.setLogger(logger);
  }

  public double getThreshold() {
    return threshold;
  }

  /**
   * Integrate the peak in the window.
   *
   * @param window the window
   * @param peak the peak
   * @param seedRow the row of the seed pixel
   * @param seedCol the column of the seed pixel
   * @return the fit state
   */
  public FitState integrate(PixelWindow window, PeakCandidate peak, int seedRow, int seedCol) {
    final FitState state = new FitState(window.getRows(), window.getCols(), window.getBins());
    final double[] fwhmLimits = ProfileFunctionBuilder.computeFwhmLimits(window.getTof());
    final double[][] total = window.getIntegratedIntensity();
    final int cols = window.getCols();

    IntArrayList frontier = IntArrayList.wrap(new int[] {state.getIndex(seedRow, seedCol)});
    while (!frontier.isEmpty()) {
      final int[] pixels = frontier.toIntArray();
      // Descending intensity; ties in index order
      IntArrays.quickSort(pixels, (a, b) -> {
        final int result = Double.compare(total[b / cols][b % cols], total[a / cols][a % cols]);
        return result != 0 ? result : Integer.compare(a, b);
      });
      int accepted = 0;
      for (final int index : pixels) {
        if (fitPixel(window, peak, index / cols, index % cols, fwhmLimits, state)) {
          accepted++;
        }
      }
      state.incrementRounds();
      if (accepted == 0) {
        break;
      }
      frontier = state.nextFrontier();
    }
    return state;
  }

  /**
   * Fit the pixel.
   *
   * @return true if accepted
   */
  private boolean fitPixel(PixelWindow window, PeakCandidate peak, int row, int col,
      double[] fwhmLimits, FitState state) {
    state.markAttempted(row, col);
    final double[] x = window.getTof();
    final double[] y = window.getIntensity(row, col);
    final double[] variance = window.getVariance(row, col);

    final Seed seed = seedEstimator.estimate(y, variance, x);
    if (!(seed.getSigma() > 0) || seed.getIntensityOverSigma() < threshold) {
      return reject(row, col, "seed I/sigma", seed.getIntensityOverSigma());
    }

    final int spectrumId = window.getSpectrumId(row, col);
    final double centre = ProfileFunctionBuilder.computeCentre(peak.getDSpacing(),
        calibration.getDiffractometerConstants(spectrumId));
    if (!ProfileFunctionBuilder.isInRange(centre, x)) {
      return reject(row, col, "centre out of range", centre);
    }

    final BackToBackParameters b2b = calibration.getBackToBackParameters(spectrumId, centre);
    final ProfileModel model =
        builder.build(centre, x, seed.getIntensity(), seed.getBackground(), b2b);
    final FitOutcome outcome = driver.fit(model, x, y, variance);
    if (!outcome.isSuccess()) {
      return reject(row, col, "fit failed", Double.NaN);
    }

    final PeakFunction fitted = outcome.getPeak();
    final double fwhm = fitted.getFwhm();
    if (!(fwhm >= fwhmLimits[0] && fwhm <= fwhmLimits[1])) {
      return reject(row, col, "FWHM", fwhm);
    }
    final double intensity = fitted.getIntensity();
    final double[] curve = outcome.getPeakCurve(x);
    final double sigma = errorEstimator.estimate(outcome, curve, variance, x);
    if (!(sigma > 0 && intensity / sigma > threshold)) {
      return reject(row, col, "I/sigma", intensity / sigma);
    }

    state.accept(row, col, intensity, sigma, curve);
    if (logger != null) {
      logger.finer(() -> String.format("Pixel %d,%d accepted: I=%s, sigma=%s", row, col,
          MathUtils.rounded(intensity), MathUtils.rounded(sigma)));
    }
    return true;
  }

  private boolean reject(int row, int col, String reason, double value) {
    if (logger != null) {
      logger.finer(() -> String.format("Pixel %d,%d rejected: %s = %s", row, col, reason,
          MathUtils.rounded(value)));
    }
    return false;
  }
}
