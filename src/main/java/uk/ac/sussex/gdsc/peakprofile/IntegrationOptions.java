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

import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.data.PixelWindow;
import uk.ac.sussex.gdsc.peakprofile.fit.CostFunction;
import uk.ac.sussex.gdsc.peakprofile.fit.FitAcceptanceRule;
import uk.ac.sussex.gdsc.peakprofile.function.BackgroundShape;
import uk.ac.sussex.gdsc.peakprofile.function.PeakShape;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileFunctionBuilder;

/**
 * Provides the options for the {@link PeakIntegrator}.
 */
public class IntegrationOptions {

  /** The message when the default value for an enum is null. */
  private static final String MSG_DEFAULT_IS_NULL = "Default value is null";

  /** The number of rows in the pixel window. */
  private int nrows;

  /** The number of columns in the pixel window. */
  private int ncols;

  /** The number of rows from the detector edge flagged as edge pixels. */
  private int nrowsEdge;

  /** The number of columns from the detector edge flagged as edge pixels. */
  private int ncolsEdge;

  /** The window method. */
  private WindowMethod windowMethod;

  /** The number of TOF bins for the fixed bins window. */
  private int nbins;

  /** The number of FWHM for the FWHM window. */
  private double nfwhm;

  /** The peak shape. */
  private PeakShape peakShape;

  /** The background shape. */
  private BackgroundShape backgroundShape;

  /** The names of the parameters fixed at the initial value. */
  private String[] fixedParameters;

  /** The cost function. */
  private CostFunction costFunction;

  /** The fit acceptance rule. */
  private FitAcceptanceRule acceptanceRule;

  /** The intensity over sigma threshold. */
  private double intensityOverSigmaThreshold;

  /** The fractional tolerance of the peak centre. */
  private double fractionalCentreTolerance;

  /** The error strategy. */
  private ErrorStrategy errorStrategy;

  /** The cumulative area cut-off in each tail for the summation error. */
  private double summationCutoff;

  /** Set to true to integrate peaks that touch the detector edge. */
  private boolean integrateIfOnEdge;

  /** Set to true to apply the Lorentz correction. */
  private boolean lorentzCorrection;

  /** The maximum iterations of the fit engine. */
  private int maxIterations;

  /**
   * The method used to crop the time-of-flight axis of the pixel window.
   */
  public enum WindowMethod {
    /** Use a fixed number of bins. */
    FIXED_BINS("Bins"),
    /** Use a multiple of the expected FWHM of the peak. */
    FWHM_MULTIPLE("FWHM");

    /** The Constant values. */
    private static final WindowMethod[] values;

    /** The Constant descriptions. */
    private static final String[] descriptions;

    static {
      values = values();
      descriptions = new String[values.length];
      for (int i = 0; i < values.length; i++) {
        descriptions[i] = values[i].getDescription();
      }
    }

    /** The description. */
    private final String description;

    WindowMethod(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return getDescription();
    }

    /**
     * Gets the descriptions.
     *
     * @return the descriptions
     */
    public static String[] getDescriptions() {
      return descriptions.clone();
    }

    /**
     * Get the value from the description.
     *
     * @param description the description
     * @return the window method (or null)
     * @see #getDescription()
     */
    public static WindowMethod fromDescription(String description) {
      for (final WindowMethod value : values) {
        if (value.getDescription().equalsIgnoreCase(description)) {
          return value;
        }
      }
      return null;
    }

    /**
     * Create from the enum {@link #ordinal()}.
     *
     * @param ordinal the ordinal
     * @return the window method
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public static WindowMethod fromOrdinal(int ordinal) {
      return values[ValidationUtils.checkIndex(ordinal, values)];
    }

    /**
     * Create from the enum {@link #ordinal()}.
     *
     * @param ordinal the ordinal
     * @param defaultValue the default value (must not be null)
     * @return the window method
     * @throws NullPointerException if the default value is null
     */
    public static WindowMethod fromOrdinal(int ordinal, WindowMethod defaultValue) {
      return SimpleArrayUtils.getIndex(ordinal, values,
          ValidationUtils.checkNotNull(defaultValue, MSG_DEFAULT_IS_NULL));
    }
  }

  /**
   * Default constructor.
   */
  public IntegrationOptions() {
    nrows = 5;
    ncols = 5;
    nrowsEdge = 1;
    ncolsEdge = 1;
    windowMethod = WindowMethod.FWHM_MULTIPLE;
    nbins = 40;
    nfwhm = 4;
    peakShape = PeakShape.BACK_TO_BACK_EXPONENTIAL;
    backgroundShape = BackgroundShape.FLAT;
    fixedParameters = new String[] {"A"};
    costFunction = CostFunction.UNWEIGHTED_LEAST_SQUARES;
    acceptanceRule = FitAcceptanceRule.SUCCESS_OR_CHANGES_TOO_SMALL;
    intensityOverSigmaThreshold = 2.5;
    fractionalCentreTolerance = 0.02;
    errorStrategy = ErrorStrategy.SUMMATION;
    summationCutoff = SummationErrorEstimator.DEFAULT_CUTOFF;
    integrateIfOnEdge = false;
    lorentzCorrection = true;
    maxIterations = 3000;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  public IntegrationOptions(IntegrationOptions source) {
    nrows = source.nrows;
    ncols = source.ncols;
    nrowsEdge = source.nrowsEdge;
    ncolsEdge = source.ncolsEdge;
    windowMethod = source.windowMethod;
    nbins = source.nbins;
    nfwhm = source.nfwhm;
    peakShape = source.peakShape;
    backgroundShape = source.backgroundShape;
    fixedParameters = source.fixedParameters.clone();
    costFunction = source.costFunction;
    acceptanceRule = source.acceptanceRule;
    intensityOverSigmaThreshold = source.intensityOverSigmaThreshold;
    fractionalCentreTolerance = source.fractionalCentreTolerance;
    errorStrategy = source.errorStrategy;
    summationCutoff = source.summationCutoff;
    integrateIfOnEdge = source.integrateIfOnEdge;
    lorentzCorrection = source.lorentzCorrection;
    maxIterations = source.maxIterations;
  }

  /**
   * Create a copy.
   *
   * @return A copy
   */
  public IntegrationOptions copy() {
    return new IntegrationOptions(this);
  }

  /**
   * Validate the options.
   *
   * @throws IntegrationConfigurationException if the options are invalid
   */
  public void validate() {
    check(nrows > 0 && ncols > 0, "Window size must be positive: %dx%d", nrows, ncols);
    check(nrowsEdge >= 0 && ncolsEdge >= 0, "Edge margins must be positive: %dx%d", nrowsEdge,
        ncolsEdge);
    check(nbins >= PixelWindow.MIN_BINS, "Bins must be at least %d: %d", PixelWindow.MIN_BINS,
        nbins);
    check(nfwhm > 0, "FWHM multiple must be positive: %s", nfwhm);
    check(intensityOverSigmaThreshold >= 0, "Intensity over sigma threshold must be positive: %s",
        intensityOverSigmaThreshold);
    check(fractionalCentreTolerance > 0 && fractionalCentreTolerance < 1,
        "Fractional centre tolerance must be in (0, 1): %s", fractionalCentreTolerance);
    check(summationCutoff >= 0 && summationCutoff < 0.5, "Summation cut-off must be in [0, 0.5): %s",
        summationCutoff);
    check(maxIterations > 0, "Maximum iterations must be positive: %d", maxIterations);
    check(errorStrategy != ErrorStrategy.HESSIAN || peakShape.hasIntensityParameter(),
        "%s error requires a peak shape with an intensity parameter: %s", errorStrategy,
        peakShape);
    try {
      ProfileFunctionBuilder.checkFixedParameters(peakShape, backgroundShape, fixedParameters);
    } catch (final IllegalArgumentException ex) {
      throw new IntegrationConfigurationException(ex.getMessage(), ex);
    }
  }

  private static void check(boolean condition, String format, Object... args) {
    if (!condition) {
      throw new IntegrationConfigurationException(String.format(format, args));
    }
  }

  /**
   * Sets the number of rows in the pixel window.
   *
   * @param nrows the new number of rows
   */
  public void setNrows(int nrows) {
    this.nrows = nrows;
  }

  /**
   * Gets the number of rows in the pixel window.
   *
   * @return the number of rows
   */
  public int getNrows() {
    return nrows;
  }

  /**
   * Sets the number of columns in the pixel window.
   *
   * @param ncols the new number of columns
   */
  public void setNcols(int ncols) {
    this.ncols = ncols;
  }

  /**
   * Gets the number of columns in the pixel window.
   *
   * @return the number of columns
   */
  public int getNcols() {
    return ncols;
  }

  /**
   * Sets the number of rows from the detector edge flagged as edge pixels.
   *
   * @param nrowsEdge the new number of edge rows
   */
  public void setNrowsEdge(int nrowsEdge) {
    this.nrowsEdge = nrowsEdge;
  }

  public int getNrowsEdge() {
    return nrowsEdge;
  }

  /**
   * Sets the number of columns from the detector edge flagged as edge pixels.
   *
   * @param ncolsEdge the new number of edge columns
   */
  public void setNcolsEdge(int ncolsEdge) {
    this.ncolsEdge = ncolsEdge;
  }

  public int getNcolsEdge() {
    return ncolsEdge;
  }

  /**
   * Sets the window method.
   *
   * @param windowMethod the new window method
   * @throws NullPointerException if the argument is null
   */
  public void setWindowMethod(WindowMethod windowMethod) {
    this.windowMethod = ValidationUtils.checkNotNull(windowMethod);
  }

  public WindowMethod getWindowMethod() {
    return windowMethod;
  }

  public void setNbins(int nbins) {
    this.nbins = nbins;
  }

  public int getNbins() {
    return nbins;
  }

  public void setNfwhm(double nfwhm) {
    this.nfwhm = nfwhm;
  }

  public double getNfwhm() {
    return nfwhm;
  }

  /**
   * Sets the peak shape.
   *
   * @param peakShape the new peak shape
   * @throws NullPointerException if the argument is null
   */
  public void setPeakShape(PeakShape peakShape) {
    this.peakShape = ValidationUtils.checkNotNull(peakShape);
  }

  public PeakShape getPeakShape() {
    return peakShape;
  }

  /**
   * Sets the background shape.
   *
   * @param backgroundShape the new background shape
   * @throws NullPointerException if the argument is null
   */
  public void setBackgroundShape(BackgroundShape backgroundShape) {
    this.backgroundShape = ValidationUtils.checkNotNull(backgroundShape);
  }

  public BackgroundShape getBackgroundShape() {
    return backgroundShape;
  }

  /**
   * Sets the names of the parameters fixed at the initial value.
   *
   * @param fixedParameters the new fixed parameters
   */
  public void setFixedParameters(String... fixedParameters) {
    this.fixedParameters = fixedParameters.clone();
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
   * Sets the cost function.
   *
   * @param costFunction the new cost function
   * @throws NullPointerException if the argument is null
   */
  public void setCostFunction(CostFunction costFunction) {
    this.costFunction = ValidationUtils.checkNotNull(costFunction);
  }

  public CostFunction getCostFunction() {
    return costFunction;
  }

  /**
   * Sets the fit acceptance rule.
   *
   * @param acceptanceRule the new acceptance rule
   * @throws NullPointerException if the argument is null
   */
  public void setAcceptanceRule(FitAcceptanceRule acceptanceRule) {
    this.acceptanceRule = ValidationUtils.checkNotNull(acceptanceRule);
  }

  public FitAcceptanceRule getAcceptanceRule() {
    return acceptanceRule;
  }

  public void setIntensityOverSigmaThreshold(double intensityOverSigmaThreshold) {
    this.intensityOverSigmaThreshold = intensityOverSigmaThreshold;
  }

  public double getIntensityOverSigmaThreshold() {
    return intensityOverSigmaThreshold;
  }

  public void setFractionalCentreTolerance(double fractionalCentreTolerance) {
    this.fractionalCentreTolerance = fractionalCentreTolerance;
  }

  public double getFractionalCentreTolerance() {
    return fractionalCentreTolerance;
  }

  /**
   * Sets the error strategy.
   *
   * @param errorStrategy the new error strategy
   * @throws NullPointerException if the argument is null
   */
  public void setErrorStrategy(ErrorStrategy errorStrategy) {
    this.errorStrategy = ValidationUtils.checkNotNull(errorStrategy);
  }

  public ErrorStrategy getErrorStrategy() {
    return errorStrategy;
  }

  public void setSummationCutoff(double summationCutoff) {
    this.summationCutoff = summationCutoff;
  }

  public double getSummationCutoff() {
    return summationCutoff;
  }

  public void setIntegrateIfOnEdge(boolean integrateIfOnEdge) {
    this.integrateIfOnEdge = integrateIfOnEdge;
  }

  public boolean isIntegrateIfOnEdge() {
    return integrateIfOnEdge;
  }

  public void setLorentzCorrection(boolean lorentzCorrection) {
    this.lorentzCorrection = lorentzCorrection;
  }

  public boolean isLorentzCorrection() {
    return lorentzCorrection;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }
}
