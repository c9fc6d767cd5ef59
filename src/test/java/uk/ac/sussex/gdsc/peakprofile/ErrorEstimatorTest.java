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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.peakprofile.fit.CommonsMathFitEngine;
import uk.ac.sussex.gdsc.peakprofile.fit.CostFunction;
import uk.ac.sussex.gdsc.peakprofile.fit.FitOutcome;
import uk.ac.sussex.gdsc.peakprofile.fit.FitResult;
import uk.ac.sussex.gdsc.peakprofile.fit.FitStatus;
import uk.ac.sussex.gdsc.peakprofile.function.BackToBackExponentialFunction;
import uk.ac.sussex.gdsc.peakprofile.function.FlatBackgroundFunction;
import uk.ac.sussex.gdsc.peakprofile.function.GaussianFunction;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;
import uk.ac.sussex.gdsc.test.api.TestAssertions;
import uk.ac.sussex.gdsc.test.api.TestHelper;

@SuppressWarnings({"javadoc"})
class ErrorEstimatorTest {
  @Test
  void canFindSummationRange() {
    final SummationErrorEstimator estimator = new SummationErrorEstimator(0.1);
    // Cumulative fractions: 0, 1/8, 1/4, 3/4, 7/8, 1, 1
    Assertions.assertArrayEquals(new int[] {1, 5},
        estimator.findRange(new double[] {0, 1, 1, 4, 1, 1, 0}));
    Assertions.assertNull(estimator.findRange(new double[] {0, 0, 0}));
    // At least one interval
    Assertions.assertArrayEquals(new int[] {0, 2}, estimator.findRange(new double[] {5, 0, 0}));
    Assertions.assertArrayEquals(new int[] {0, 3},
        new SummationErrorEstimator().findRange(new double[] {0, 0, 5, 0, 0}));
  }

  @Test
  void testSummationCutoff() {
    Assertions.assertEquals(SummationErrorEstimator.DEFAULT_CUTOFF,
        new SummationErrorEstimator().getCutoff());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SummationErrorEstimator(0.5));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SummationErrorEstimator(-0.1));
  }

  @Test
  void canEstimateSummationError() {
    final double[] x = {0, 1, 2, 3, 4, 5, 6};
    final double[] variance = {1, 2, 3, 4, 5, 6, 7};
    final double sigma = new SummationErrorEstimator(0.1).estimate(null,
        new double[] {0, 1, 1, 4, 1, 1, 0}, variance, x);
    Assertions.assertEquals(SeedEstimator.integrateError(variance, x, 1, 5), sigma);
    Assertions.assertEquals(Double.NaN,
        new SummationErrorEstimator().estimate(null, new double[7], variance, x));
  }

  @Test
  void canEstimateHessianError() {
    final ProfileModel model =
        new ProfileModel(new BackToBackExponentialFunction(), new FlatBackgroundFunction());
    final double[][] covariance = new double[6][6];
    covariance[BackToBackExponentialFunction.INTENSITY][BackToBackExponentialFunction.INTENSITY] =
        16;
    final HessianErrorEstimator estimator = new HessianErrorEstimator();
    Assertions.assertEquals(4, estimator.estimate(
        FitOutcome.success(FitStatus.SUCCESS, model, covariance, 2), null, null, null));
    Assertions.assertEquals(Double.NaN, estimator.estimate(
        FitOutcome.success(FitStatus.SUCCESS, model, null, 2), null, null, null));
    Assertions.assertEquals(Double.NaN, estimator.estimate(
        FitOutcome.success(FitStatus.SUCCESS, model, new double[6][6], 2), null, null, null));
    // No intensity parameter
    final ProfileModel gaussian =
        new ProfileModel(new GaussianFunction(), new FlatBackgroundFunction());
    Assertions.assertEquals(Double.NaN, estimator.estimate(
        FitOutcome.success(FitStatus.SUCCESS, gaussian, new double[4][4], 2), null, null, null));
  }

  @Test
  void canCreateEstimator() {
    Assertions.assertTrue(
        ErrorStrategy.HESSIAN.createEstimator(0.1) instanceof HessianErrorEstimator);
    final ErrorEstimator estimator = ErrorStrategy.SUMMATION.createEstimator(0.1);
    Assertions.assertTrue(estimator instanceof SummationErrorEstimator);
    Assertions.assertEquals(0.1, ((SummationErrorEstimator) estimator).getCutoff());
    Assertions.assertEquals(ErrorStrategy.HESSIAN, ErrorStrategy.fromDescription("hessian"));
    Assertions.assertNull(ErrorStrategy.fromDescription("Bootstrap"));
    Assertions.assertEquals(ErrorStrategy.SUMMATION, ErrorStrategy.fromOrdinal(1));
    Assertions.assertEquals(ErrorStrategy.HESSIAN,
        ErrorStrategy.fromOrdinal(5, ErrorStrategy.HESSIAN));
  }

  @Test
  void hessianAndSummationErrorsAgree() {
    // Poisson counts: variance equals the observed value
    final BackToBackExponentialFunction peak = new BackToBackExponentialFunction();
    peak.setParameters(new double[] {1000, 0.05, 0.02, 1100, 5});
    final ProfileModel model = new ProfileModel(peak, new FlatBackgroundFunction());
    final double[] x = new double[501];
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = 950 + i;
      y[i] = model.value(x[i]);
    }
    for (final String name : new String[] {"A", "B", "X0", "S", "A0"}) {
      model.fix(name);
    }
    model.setParameter(BackToBackExponentialFunction.INTENSITY, 800);

    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertNotNull(result.getParameters());
    final ProfileModel fitted = model.copy();
    fitted.setParameters(result.getParameters());
    final FitOutcome outcome =
        FitOutcome.success(result.getStatus(), fitted, result.getCovariance(), 2);
    Assertions.assertEquals(1000, fitted.getPeak().getIntensity(), 1e-3);

    final double[] curve = outcome.getPeakCurve(x);
    final double hessian = new HessianErrorEstimator().estimate(outcome, curve, y, x);
    TestAssertions.assertTest(Math.sqrt(1000), hessian, TestHelper.doublesAreClose(0.01),
        "Hessian");
    // Summation over the entire peak
    final double summation = new SummationErrorEstimator(0).estimate(outcome, curve, y, x);
    TestAssertions.assertTest(hessian, summation, TestHelper.doublesAreClose(0.01),
        "Summation");
    // Excluding the tails reduces the error
    final double central = new SummationErrorEstimator().estimate(outcome, curve, y, x);
    Assertions.assertTrue(central < summation);
  }
}
