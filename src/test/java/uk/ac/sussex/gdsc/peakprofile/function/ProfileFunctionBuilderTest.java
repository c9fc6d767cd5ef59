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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.peakprofile.data.BackToBackParameters;
import uk.ac.sussex.gdsc.peakprofile.data.DiffractometerConstants;

@SuppressWarnings({"javadoc"})
class ProfileFunctionBuilderTest {
  private static double[] createTof(double start, double step, int n) {
    final double[] tof = new double[n];
    for (int i = 0; i < n; i++) {
      tof[i] = start + i * step;
    }
    return tof;
  }

  @Test
  void testConstructorValidation() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 1));
    // Exponent parameter is not part of a Gaussian
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0.1, "A"));
    // A1 is only part of the linear background
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0.1, "A1"));
    final ProfileFunctionBuilder builder = new ProfileFunctionBuilder(
        PeakShape.BACK_TO_BACK_EXPONENTIAL, BackgroundShape.LINEAR, 0.1, "A", "A1");
    Assertions.assertArrayEquals(new String[] {"A", "A1"}, builder.getFixedParameters());
    Assertions.assertEquals(0.1, builder.getFractionalTolerance());
  }

  @Test
  void canComputeCentre() {
    final DiffractometerConstants constants = new DiffractometerConstants(5000, 2, 10);
    // tof = difc * d + difa * d^2 + tzero
    Assertions.assertEquals(5000 * 1.5 + 2 * 2.25 + 10,
        ProfileFunctionBuilder.computeCentre(1.5, constants), 1e-10);
  }

  @Test
  void canCheckRange() {
    final double[] tof = createTof(1000, 10, 21);
    Assertions.assertTrue(ProfileFunctionBuilder.isInRange(1000, tof));
    Assertions.assertTrue(ProfileFunctionBuilder.isInRange(1200, tof));
    Assertions.assertFalse(ProfileFunctionBuilder.isInRange(999, tof));
    Assertions.assertFalse(ProfileFunctionBuilder.isInRange(1201, tof));
  }

  @Test
  void centreBoundsAreClippedToAxis() {
    final double[] tof = createTof(1000, 10, 21);
    final ProfileFunctionBuilder builder =
        new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0.02);
    Assertions.assertArrayEquals(new double[] {1078, 1122},
        builder.computeCentreBounds(1100, tof), 1e-10);
    Assertions.assertArrayEquals(new double[] {1000, 1040.4},
        builder.computeCentreBounds(1020, tof), 1e-10);
  }

  @Test
  void canComputeFwhmLimits() {
    Assertions.assertArrayEquals(new double[] {10, 200.0 / 3},
        ProfileFunctionBuilder.computeFwhmLimits(createTof(1000, 10, 21)), 1e-10);
    // Span too small: the maximum is the minimum
    Assertions.assertArrayEquals(new double[] {10, 10},
        ProfileFunctionBuilder.computeFwhmLimits(createTof(1000, 10, 3)), 1e-10);
    Assertions.assertArrayEquals(new double[] {10, 10},
        ProfileFunctionBuilder.computeFwhmLimits(createTof(1000, 10, 2)), 1e-10);
    // Non-uniform axis uses the bin at the middle
    final double[] tof = {0, 1, 3, 6, 10};
    Assertions.assertArrayEquals(new double[] {3, 10.0 / 3},
        ProfileFunctionBuilder.computeFwhmLimits(tof), 1e-10);
  }

  @Test
  void initialFwhmIsClipped() {
    final ProfileFunctionBuilder builder =
        new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0.02);
    final double[] limits = {10, 50};
    Assertions.assertEquals(22, builder.computeInitialFwhm(1100, limits), 1e-10);
    Assertions.assertEquals(10, builder.computeInitialFwhm(100, limits));
    Assertions.assertEquals(50, builder.computeInitialFwhm(10000, limits));
  }

  @Test
  void canBuildGaussianModel() {
    final double[] tof = createTof(1000, 10, 21);
    final ProfileFunctionBuilder builder =
        new ProfileFunctionBuilder(PeakShape.GAUSSIAN, BackgroundShape.FLAT, 0.02, "A0");
    final ProfileModel model = builder.build(1100, tof, 500, 3, null);
    final PeakFunction peak = model.getPeak();
    Assertions.assertEquals(1100, peak.getCentre());
    Assertions.assertEquals(22, peak.getFwhm(), 1e-10);
    Assertions.assertEquals(500, peak.getIntensity(), 1e-10);
    Assertions.assertEquals(3, model.getParameter(model.indexOf("A0")));
    Assertions.assertTrue(model.isFixed(model.indexOf("A0")));
    Assertions.assertFalse(model.isFixed(GaussianFunction.SIGMA));

    Assertions.assertEquals(0, model.getLowerBound(GaussianFunction.HEIGHT));
    Assertions.assertEquals(1078, model.getLowerBound(GaussianFunction.CENTRE), 1e-10);
    Assertions.assertEquals(1122, model.getUpperBound(GaussianFunction.CENTRE), 1e-10);
    final double ratio = 1 / (2 * Math.sqrt(2 * Math.log(2)));
    Assertions.assertEquals(10 * ratio, model.getLowerBound(GaussianFunction.SIGMA), 1e-10);
    Assertions.assertEquals(200.0 / 3 * ratio, model.getUpperBound(GaussianFunction.SIGMA),
        1e-10);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, model.getLowerBound(3));
  }

  @Test
  void canBuildBackToBackModelWithInstrumentParameters() {
    final double[] tof = createTof(1000, 10, 21);
    final ProfileFunctionBuilder builder = new ProfileFunctionBuilder(
        PeakShape.BACK_TO_BACK_EXPONENTIAL, BackgroundShape.LINEAR, 0.02, "A", "B");
    final ProfileModel model =
        builder.build(1100, tof, 500, 3, new BackToBackParameters(0.3, 0.05, 6));
    Assertions.assertEquals(500, model.getParameter(BackToBackExponentialFunction.INTENSITY));
    Assertions.assertEquals(0.3, model.getParameter(BackToBackExponentialFunction.ALPHA));
    Assertions.assertEquals(0.05, model.getParameter(BackToBackExponentialFunction.BETA));
    // The width is initialised from the fractional tolerance, not the instrument
    Assertions.assertEquals(22 / (2 * Math.sqrt(2 * Math.log(2))),
        model.getParameter(BackToBackExponentialFunction.SIGMA), 1e-10);
    Assertions.assertEquals(1100, model.getParameter(BackToBackExponentialFunction.CENTRE));
    Assertions.assertTrue(model.isFixed(BackToBackExponentialFunction.ALPHA));
    Assertions.assertTrue(model.isFixed(BackToBackExponentialFunction.BETA));
    Assertions.assertArrayEquals(new int[] {0, 3, 4, 5, 6}, model.getFreeIndices());
    Assertions.assertEquals(0, model.getParameter(6));
  }

  @Test
  void canBuildBackToBackModelWithDefaultExponents() {
    final double[] tof = createTof(1000, 10, 21);
    final ProfileFunctionBuilder builder = new ProfileFunctionBuilder(
        PeakShape.BACK_TO_BACK_EXPONENTIAL, BackgroundShape.FLAT, 0.02);
    final ProfileModel model = builder.build(1100, tof, 500, 3, null);
    Assertions.assertEquals(4.0 / 22, model.getParameter(BackToBackExponentialFunction.ALPHA),
        1e-10);
    Assertions.assertEquals(2.0 / 22, model.getParameter(BackToBackExponentialFunction.BETA),
        1e-10);
    Assertions.assertEquals(0, model.getLowerBound(BackToBackExponentialFunction.INTENSITY));
    Assertions.assertEquals(0, model.getLowerBound(BackToBackExponentialFunction.ALPHA));
    Assertions.assertEquals(0, model.getLowerBound(BackToBackExponentialFunction.BETA));
    Assertions.assertEquals(1078, model.getLowerBound(BackToBackExponentialFunction.CENTRE),
        1e-10);
  }
}
