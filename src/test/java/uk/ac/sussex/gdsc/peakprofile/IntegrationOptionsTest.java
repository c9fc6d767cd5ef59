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

import java.util.function.Consumer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.peakprofile.IntegrationOptions.WindowMethod;
import uk.ac.sussex.gdsc.peakprofile.fit.CostFunction;
import uk.ac.sussex.gdsc.peakprofile.fit.FitAcceptanceRule;
import uk.ac.sussex.gdsc.peakprofile.function.BackgroundShape;
import uk.ac.sussex.gdsc.peakprofile.function.PeakShape;

@SuppressWarnings({"javadoc"})
class IntegrationOptionsTest {
  @Test
  void defaultsAreValid() {
    final IntegrationOptions options = new IntegrationOptions();
    options.validate();
    Assertions.assertEquals(5, options.getNrows());
    Assertions.assertEquals(5, options.getNcols());
    Assertions.assertEquals(WindowMethod.FWHM_MULTIPLE, options.getWindowMethod());
    Assertions.assertEquals(PeakShape.BACK_TO_BACK_EXPONENTIAL, options.getPeakShape());
    Assertions.assertEquals(BackgroundShape.FLAT, options.getBackgroundShape());
    Assertions.assertArrayEquals(new String[] {"A"}, options.getFixedParameters());
    Assertions.assertEquals(CostFunction.UNWEIGHTED_LEAST_SQUARES, options.getCostFunction());
    Assertions.assertEquals(FitAcceptanceRule.SUCCESS_OR_CHANGES_TOO_SMALL,
        options.getAcceptanceRule());
    Assertions.assertEquals(ErrorStrategy.SUMMATION, options.getErrorStrategy());
    Assertions.assertEquals(2.5, options.getIntensityOverSigmaThreshold());
    Assertions.assertEquals(0.02, options.getFractionalCentreTolerance());
    Assertions.assertFalse(options.isIntegrateIfOnEdge());
    Assertions.assertTrue(options.isLorentzCorrection());
  }

  @Test
  void copyIsIndependent() {
    final IntegrationOptions options = new IntegrationOptions();
    options.setFixedParameters("A", "B");
    final IntegrationOptions copy = options.copy();
    copy.setNrows(9);
    copy.setFixedParameters();
    copy.setPeakShape(PeakShape.GAUSSIAN);
    Assertions.assertEquals(5, options.getNrows());
    Assertions.assertArrayEquals(new String[] {"A", "B"}, options.getFixedParameters());
    Assertions.assertEquals(PeakShape.BACK_TO_BACK_EXPONENTIAL, options.getPeakShape());
    Assertions.assertEquals(9, copy.getNrows());
  }

  @Test
  void testValidation() {
    assertInvalid(o -> o.setNrows(0));
    assertInvalid(o -> o.setNcolsEdge(-1));
    assertInvalid(o -> o.setNbins(1));
    assertInvalid(o -> o.setNfwhm(0));
    assertInvalid(o -> o.setIntensityOverSigmaThreshold(-1));
    assertInvalid(o -> o.setFractionalCentreTolerance(0));
    assertInvalid(o -> o.setFractionalCentreTolerance(1));
    assertInvalid(o -> o.setSummationCutoff(0.5));
    assertInvalid(o -> o.setMaxIterations(0));
    assertInvalid(o -> o.setFixedParameters("X"));
    // The Gaussian has no exponent parameter
    assertInvalid(o -> o.setPeakShape(PeakShape.GAUSSIAN));
    // The Gaussian has no intensity parameter for the Hessian error
    assertInvalid(o -> {
      o.setPeakShape(PeakShape.GAUSSIAN);
      o.setFixedParameters();
      o.setErrorStrategy(ErrorStrategy.HESSIAN);
    });
    assertValid(o -> {
      o.setPeakShape(PeakShape.GAUSSIAN);
      o.setFixedParameters("Sigma");
    });
    assertValid(o -> {
      o.setBackgroundShape(BackgroundShape.LINEAR);
      o.setFixedParameters("A", "A1");
      o.setErrorStrategy(ErrorStrategy.HESSIAN);
    });
  }

  private static void assertInvalid(Consumer<IntegrationOptions> change) {
    final IntegrationOptions options = new IntegrationOptions();
    change.accept(options);
    Assertions.assertThrows(IntegrationConfigurationException.class, options::validate);
  }

  private static void assertValid(Consumer<IntegrationOptions> change) {
    final IntegrationOptions options = new IntegrationOptions();
    change.accept(options);
    options.validate();
  }

  @Test
  void canConvertWindowMethod() {
    Assertions.assertEquals(WindowMethod.FIXED_BINS, WindowMethod.fromDescription("bins"));
    Assertions.assertEquals(WindowMethod.FWHM_MULTIPLE, WindowMethod.fromDescription("FWHM"));
    Assertions.assertNull(WindowMethod.fromDescription("other"));
    Assertions.assertEquals(WindowMethod.FWHM_MULTIPLE, WindowMethod.fromOrdinal(1));
    Assertions.assertEquals(WindowMethod.FIXED_BINS,
        WindowMethod.fromOrdinal(-1, WindowMethod.FIXED_BINS));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> WindowMethod.fromOrdinal(2));
    Assertions.assertArrayEquals(new String[] {"Bins", "FWHM"}, WindowMethod.getDescriptions());
  }
}
