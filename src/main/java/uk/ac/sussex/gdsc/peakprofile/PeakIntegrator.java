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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.concurrent.ConcurrentRuntimeException;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.IntegrationOptions.WindowMethod;
import uk.ac.sussex.gdsc.peakprofile.data.BackToBackParameters;
import uk.ac.sussex.gdsc.peakprofile.data.PeakCandidate;
import uk.ac.sussex.gdsc.peakprofile.data.PeakDataSource;
import uk.ac.sussex.gdsc.peakprofile.data.PixelWindow;
import uk.ac.sussex.gdsc.peakprofile.data.ProfileCalibration;
import uk.ac.sussex.gdsc.peakprofile.fit.CommonsMathFitEngine;
import uk.ac.sussex.gdsc.peakprofile.fit.ConstrainedFitDriver;
import uk.ac.sussex.gdsc.peakprofile.fit.FitEngine;
import uk.ac.sussex.gdsc.peakprofile.function.BackToBackExponentialFunction;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileFunctionBuilder;

/**
 * Integrate peaks by fitting the time-of-flight profile of each pixel in a window around the
 * peak.
 *
 * <p>The integrator holds no mutable state between peaks and can integrate peaks in parallel if
 * the data source, calibration and fit engine are thread safe.
 */
public class PeakIntegrator {
  private static final String INTERRUPTED_MSG = "Interrupted while integrating peaks";

  private final IntegrationOptions options;
  private final PeakDataSource dataSource;
  private final ProfileCalibration calibration;
  private final FitEngine engine;
  private final FloodFillIntegrator floodFill;
  private final EdgePolicy edgePolicy;
  private Logger logger;

  /**
   * Create an instance using a {@link CommonsMathFitEngine} limited to the maximum iterations of
   * the options.
   *
   * @param options the options
   * @param dataSource the data source
   * @param calibration the calibration
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public PeakIntegrator(IntegrationOptions options, PeakDataSource dataSource,
      ProfileCalibration calibration) {
    this(options, dataSource, calibration, createEngine(options));
  }

  /**
   * Create an instance.
   *
   * @param options the options
   * @param dataSource the data source
   * @param calibration the calibration
   * @param engine the fit engine
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public PeakIntegrator(IntegrationOptions options, PeakDataSource dataSource,
      ProfileCalibration calibration, FitEngine engine) {
    this(options, dataSource, calibration, engine, new SkewnessBackgroundSelector());
  }

  /**
   * Create an instance.
   *
   * @param options the options
   * @param dataSource the data source
   * @param calibration the calibration
   * @param engine the fit engine
   * @param backgroundSelector the background selector
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public PeakIntegrator(IntegrationOptions options, PeakDataSource dataSource,
      ProfileCalibration calibration, FitEngine engine, BackgroundSelector backgroundSelector) {
    this.options = ValidationUtils.checkNotNull(options, "options").copy();
    this.options.validate();
    this.dataSource = ValidationUtils.checkNotNull(dataSource, "dataSource");
    this.calibration = ValidationUtils.checkNotNull(calibration, "calibration");
    this.engine = ValidationUtils.checkNotNull(engine, "engine");
    final IntegrationOptions o = this.options;
    final ProfileFunctionBuilder builder = new ProfileFunctionBuilder(o.getPeakShape(),
        o.getBackgroundShape(), o.getFractionalCentreTolerance(), o.getFixedParameters());
    final ConstrainedFitDriver driver =
        new ConstrainedFitDriver(engine, o.getCostFunction(), o.getAcceptanceRule());
    floodFill = new FloodFillIntegrator(calibration, new SeedEstimator(backgroundSelector),
        builder, driver, o.getErrorStrategy().createEstimator(o.getSummationCutoff()),
        o.getIntensityOverSigmaThreshold());
    edgePolicy = new EdgePolicy(o.isIntegrateIfOnEdge());
  }

  private static FitEngine createEngine(IntegrationOptions options) {
    ValidationUtils.checkNotNull(options, "options").validate();
    return new CommonsMathFitEngine(options.getMaxIterations());
  }

  /**
   * Set the logger. Peak results are logged at {@link Level#INFO}. The logger is passed to the
   * flood fill and fit components.
   *
   * @param logger the new logger
   */
  public void setLogger(Logger logger) {
    this.logger = logger;
    floodFill.setLogger(logger);
  }

  public FitEngine getFitEngine() {
    return engine;
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public IntegrationOptions getOptions() {
    return options.copy();
  }

  /**
   * Integrate the peak.
   *
   * <p>An error reading the data or the calibration of the peak is logged and the peak is reported
   * as {@link IntegrationStatus#NO_PEAK}.
   *
   * @param peak the peak
   * @return the result
   */
  public PeakIntegrationResult integrate(PeakCandidate peak) {
    try {
      return integratePeak(peak);
    } catch (final RuntimeException ex) {
      if (logger != null) {
        logger.log(Level.WARNING, ex, () -> "Failed to integrate peak: " + peak);
      }
      return PeakIntegrationResult.noPeak(peak, null);
    }
  }

  private PeakIntegrationResult integratePeak(PeakCandidate peak) {
    PixelWindow window = dataSource.getPeakData(peak, options.getNrows(), options.getNcols(),
        options.getNrowsEdge(), options.getNcolsEdge());
    if (window == null) {
      if (logger != null) {
        logger.info(() -> "No data for peak: " + peak);
      }
      return PeakIntegrationResult.noPeak(peak, null);
    }

    window = cropWindow(window, peak);
    final int[] seed = window.findStrongestPixel(window.getPeakRow(), window.getPeakCol());
    final FitState state = floodFill.integrate(window, peak, seed[0], seed[1]);
    final IntegrationStatus status = edgePolicy.getStatus(state, window);

    final boolean[][] successful = state.getSuccessful();
    final PeakDiagnostics diagnostics = new PeakDiagnostics(seed[0], seed[1],
        state.getAttempted(), successful, window.getTof(), window.getFocusedIntensity(successful),
        window.getFocusedVariance(successful), state.getYFitFocused(), state.getRounds());

    final PeakIntegrationResult result;
    if (status == IntegrationStatus.VALID) {
      double intensity = state.getIntensitySum();
      double sigma = Math.sqrt(state.getVarianceSum());
      if (options.isLorentzCorrection()) {
        final double factor = LorentzCorrection.getFactor(peak);
        intensity *= factor;
        sigma *= factor;
      }
      result = new PeakIntegrationResult(peak, intensity, sigma, status, diagnostics);
    } else {
      result = new PeakIntegrationResult(peak, 0, 0, status, diagnostics);
    }
    if (logger != null) {
      logger.info(() -> String.format("%s (%d/%d pixels, I/sigma=%s)", result,
          diagnostics.getSuccessfulCount(), diagnostics.getAttemptedCount(),
          MathUtils.rounded(result.getIntensityOverSigma())));
    }
    return result;
  }

  /**
   * Crop the time-of-flight axis of the window around the nominal peak position.
   *
   * @param window the window
   * @param peak the peak
   * @return the cropped window
   */
  PixelWindow cropWindow(PixelWindow window, PeakCandidate peak) {
    if (options.getWindowMethod() == WindowMethod.FWHM_MULTIPLE) {
      final double fwhm = getExpectedFwhm(window, peak);
      if (fwhm > 0) {
        return window.cropToFwhm(peak.getTof(), fwhm, options.getNfwhm());
      }
    }
    return window.cropToBins(peak.getTof(), options.getNbins());
  }

  /**
   * Gets the FWHM of a back-to-back exponential using the calibration of the nominal peak pixel.
   *
   * @return the FWHM (or NaN if the instrument does not define the parameters)
   */
  private double getExpectedFwhm(PixelWindow window, PeakCandidate peak) {
    final int spectrumId = window.getSpectrumId(window.getPeakRow(), window.getPeakCol());
    final BackToBackParameters b2b =
        calibration.getBackToBackParameters(spectrumId, peak.getTof());
    if (b2b == null) {
      return Double.NaN;
    }
    final BackToBackExponentialFunction f = new BackToBackExponentialFunction();
    f.setParameter(BackToBackExponentialFunction.ALPHA, b2b.getAlpha());
    f.setParameter(BackToBackExponentialFunction.BETA, b2b.getBeta());
    f.setParameter(BackToBackExponentialFunction.SIGMA, b2b.getSigma());
    f.setCentre(peak.getTof());
    return f.getFwhm();
  }

  /**
   * Integrate the peaks sequentially.
   *
   * @param peaks the peaks
   * @return the results
   */
  public PeakIntegrationResults integrate(List<PeakCandidate> peaks) {
    final List<PeakIntegrationResult> results = new ArrayList<>(peaks.size());
    peaks.forEach(peak -> results.add(integrate(peak)));
    return new PeakIntegrationResults(results);
  }

  /**
   * Integrate the peaks using the executor. The results are in the order of the input peaks.
   *
   * @param peaks the peaks
   * @param executor the executor
   * @return the results
   * @throws ConcurrentRuntimeException if interrupted or a task fails
   */
  public PeakIntegrationResults integrate(List<PeakCandidate> peaks, ExecutorService executor) {
    final List<Future<PeakIntegrationResult>> futures = new ArrayList<>(peaks.size());
    peaks.forEach(peak -> futures.add(executor.submit(() -> integrate(peak))));
    final List<PeakIntegrationResult> results = new ArrayList<>(peaks.size());
    for (final Future<PeakIntegrationResult> future : futures) {
      try {
        results.add(future.get());
      } catch (final InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new ConcurrentRuntimeException(INTERRUPTED_MSG, ex);
      } catch (final ExecutionException ex) {
        throw new ConcurrentRuntimeException(ex.getCause());
      }
    }
    return new PeakIntegrationResults(results);
  }
}
