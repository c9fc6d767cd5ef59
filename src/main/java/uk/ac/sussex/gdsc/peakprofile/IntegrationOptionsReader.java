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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import uk.ac.sussex.gdsc.peakprofile.IntegrationOptions.WindowMethod;
import uk.ac.sussex.gdsc.peakprofile.fit.CostFunction;
import uk.ac.sussex.gdsc.peakprofile.fit.FitAcceptanceRule;
import uk.ac.sussex.gdsc.peakprofile.function.BackgroundShape;
import uk.ac.sussex.gdsc.peakprofile.function.PeakShape;

/**
 * Read {@link IntegrationOptions} from {@code key = value} lines.
 *
 * <p>Keys are case insensitive. Lines without a '=' and lines starting with '#' are ignored.
 * Missing keys keep the default value. Enum values use the description of the enum.
 */
public final class IntegrationOptionsReader {
  /** The key for the number of window rows. */
  public static final String KEY_NROWS = "nrows";
  /** The key for the number of window columns. */
  public static final String KEY_NCOLS = "ncols";
  /** The key for the number of edge rows. */
  public static final String KEY_NROWS_EDGE = "nrows_edge";
  /** The key for the number of edge columns. */
  public static final String KEY_NCOLS_EDGE = "ncols_edge";
  /** The key for the window method. */
  public static final String KEY_WINDOW_METHOD = "window_method";
  /** The key for the number of bins. */
  public static final String KEY_NBINS = "nbins";
  /** The key for the number of FWHM. */
  public static final String KEY_NFWHM = "nfwhm";
  /** The key for the peak shape. */
  public static final String KEY_PEAK_SHAPE = "peak_shape";
  /** The key for the background shape. */
  public static final String KEY_BACKGROUND_SHAPE = "background_shape";
  /** The key for the comma separated fixed parameters. */
  public static final String KEY_FIXED_PARAMETERS = "fixed_parameters";
  /** The key for the cost function. */
  public static final String KEY_COST_FUNCTION = "cost_function";
  /** The key for the fit acceptance rule. */
  public static final String KEY_ACCEPTANCE_RULE = "acceptance_rule";
  /** The key for the intensity over sigma threshold. */
  public static final String KEY_THRESHOLD = "threshold";
  /** The key for the fractional centre tolerance. */
  public static final String KEY_CENTRE_TOLERANCE = "fractional_centre_tolerance";
  /** The key for the error strategy. */
  public static final String KEY_ERROR_STRATEGY = "error_strategy";
  /** The key for the summation cut-off. */
  public static final String KEY_SUMMATION_CUTOFF = "summation_cutoff";
  /** The key for the integrate if on edge flag. */
  public static final String KEY_INTEGRATE_IF_ON_EDGE = "integrate_if_on_edge";
  /** The key for the Lorentz correction flag. */
  public static final String KEY_LORENTZ_CORRECTION = "lorentz_correction";
  /** The key for the maximum iterations. */
  public static final String KEY_MAX_ITERATIONS = "max_iterations";

  private static final List<String> KEYS = Arrays.asList(KEY_NROWS, KEY_NCOLS, KEY_NROWS_EDGE,
      KEY_NCOLS_EDGE, KEY_WINDOW_METHOD, KEY_NBINS, KEY_NFWHM, KEY_PEAK_SHAPE,
      KEY_BACKGROUND_SHAPE, KEY_FIXED_PARAMETERS, KEY_COST_FUNCTION, KEY_ACCEPTANCE_RULE,
      KEY_THRESHOLD, KEY_CENTRE_TOLERANCE, KEY_ERROR_STRATEGY, KEY_SUMMATION_CUTOFF,
      KEY_INTEGRATE_IF_ON_EDGE, KEY_LORENTZ_CORRECTION, KEY_MAX_ITERATIONS);

  private final Map<String, String> map;

  private IntegrationOptionsReader(Map<String, String> map) {
    this.map = map;
  }

  /**
   * Read the options from the file. The options are validated.
   *
   * @param path the path
   * @return the options
   * @throws IOException Signals that an I/O exception has occurred.
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public static IntegrationOptions read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path)) {
      return read(reader);
    }
  }

  /**
   * Read the options. The options are validated.
   *
   * @param reader the reader
   * @return the options
   * @throws IOException Signals that an I/O exception has occurred.
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public static IntegrationOptions read(Reader reader) throws IOException {
    final Map<String, String> map = new HashMap<>();
    final BufferedReader input =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    String line;
    while ((line = input.readLine()) != null) {
      // Only use lines that have key-value pairs
      final String trimmed = line.trim();
      if (trimmed.startsWith("#") || !trimmed.contains("=")) {
        continue;
      }
      final int index = trimmed.indexOf('=');
      final String key = trimmed.substring(0, index).trim().toLowerCase(Locale.US);
      if (!KEYS.contains(key)) {
        throw new IntegrationConfigurationException("Unknown parameter: " + key);
      }
      map.put(key, trimmed.substring(index + 1).trim());
    }
    return new IntegrationOptionsReader(map).createOptions();
  }

  private IntegrationOptions createOptions() {
    final IntegrationOptions options = new IntegrationOptions();
    options.setNrows(findInteger(KEY_NROWS, options.getNrows()));
    options.setNcols(findInteger(KEY_NCOLS, options.getNcols()));
    options.setNrowsEdge(findInteger(KEY_NROWS_EDGE, options.getNrowsEdge()));
    options.setNcolsEdge(findInteger(KEY_NCOLS_EDGE, options.getNcolsEdge()));
    options.setWindowMethod(
        findEnum(KEY_WINDOW_METHOD, WindowMethod::fromDescription, options.getWindowMethod()));
    options.setNbins(findInteger(KEY_NBINS, options.getNbins()));
    options.setNfwhm(findDouble(KEY_NFWHM, options.getNfwhm()));
    options.setPeakShape(
        findEnum(KEY_PEAK_SHAPE, PeakShape::fromDescription, options.getPeakShape()));
    options.setBackgroundShape(findEnum(KEY_BACKGROUND_SHAPE, BackgroundShape::fromDescription,
        options.getBackgroundShape()));
    final String fixed = map.get(KEY_FIXED_PARAMETERS);
    if (fixed != null) {
      options.setFixedParameters(fixed.isEmpty() ? new String[0] : fixed.split("\\s*,\\s*"));
    }
    options.setCostFunction(
        findEnum(KEY_COST_FUNCTION, CostFunction::fromDescription, options.getCostFunction()));
    options.setAcceptanceRule(findEnum(KEY_ACCEPTANCE_RULE, FitAcceptanceRule::fromDescription,
        options.getAcceptanceRule()));
    options.setIntensityOverSigmaThreshold(
        findDouble(KEY_THRESHOLD, options.getIntensityOverSigmaThreshold()));
    options.setFractionalCentreTolerance(
        findDouble(KEY_CENTRE_TOLERANCE, options.getFractionalCentreTolerance()));
    options.setErrorStrategy(
        findEnum(KEY_ERROR_STRATEGY, ErrorStrategy::fromDescription, options.getErrorStrategy()));
    options.setSummationCutoff(findDouble(KEY_SUMMATION_CUTOFF, options.getSummationCutoff()));
    options.setIntegrateIfOnEdge(
        findBoolean(KEY_INTEGRATE_IF_ON_EDGE, options.isIntegrateIfOnEdge()));
    options.setLorentzCorrection(
        findBoolean(KEY_LORENTZ_CORRECTION, options.isLorentzCorrection()));
    options.setMaxIterations(findInteger(KEY_MAX_ITERATIONS, options.getMaxIterations()));
    options.validate();
    return options;
  }

  private String findString(String key) {
    final String value = map.get(key);
    if (value == null || value.isEmpty()) {
      return null;
    }
    return value;
  }

  private int findInteger(String key, int defaultValue) {
    final String value = findString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (final NumberFormatException ex) {
      throw new IntegrationConfigurationException("Invalid integer for " + key + ": " + value, ex);
    }
  }

  private double findDouble(String key, double defaultValue) {
    final String value = findString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (final NumberFormatException ex) {
      throw new IntegrationConfigurationException("Invalid number for " + key + ": " + value, ex);
    }
  }

  private boolean findBoolean(String key, boolean defaultValue) {
    final String value = findString(key);
    if (value == null) {
      return defaultValue;
    }
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IntegrationConfigurationException("Invalid boolean for " + key + ": " + value);
  }

  private <T> T findEnum(String key, Function<String, T> fromDescription, T defaultValue) {
    final String value = findString(key);
    if (value == null) {
      return defaultValue;
    }
    final T result = fromDescription.apply(value);
    if (result == null) {
      throw new IntegrationConfigurationException("Invalid option for " + key + ": " + value);
    }
    return result;
  }
}
