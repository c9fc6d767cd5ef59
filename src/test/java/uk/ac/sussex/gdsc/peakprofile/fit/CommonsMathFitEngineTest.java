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

package uk.ac.sussex.gdsc.peakprofile.fit;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.peakprofile.function.FlatBackgroundFunction;
import uk.ac.sussex.gdsc.peakprofile.function.GaussianFunction;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;
import uk.ac.sussex.gdsc.test.api.TestAssertions;
import uk.ac.sussex.gdsc.test.api.Predicates;
import uk.ac.sussex.gdsc.test.api.function.DoubleDoubleBiPredicate;

@SuppressWarnings({"javadoc"})
class CommonsMathFitEngineTest {
  private static final double[] EXPECTED = {100, 50, 5, 10};

  private static ProfileModel createModel(double... parameters) {
    final ProfileModel model =
        new ProfileModel(new GaussianFunction(), new FlatBackgroundFunction());
    model.setParameters(parameters);
    return model;
  }

  private static double[] createX() {
    final double[] x = new double[101];
    for (int i = 0; i < x.length; i++) {
      x[i] = i;
    }
    return x;
  }

  private static double[] createY(double[] x) {
    final ProfileModel model = createModel(EXPECTED);
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = model.value(x[i]);
    }
    return y;
  }

  private static void assertFit(FitResult result, double relativeError) {
    Assertions.assertTrue(
        FitAcceptanceRule.SUCCESS_OR_CHANGES_TOO_SMALL.isAccepted(result.getStatus()),
        () -> "Status: " + result.getStatus());
    final DoubleDoubleBiPredicate test = Predicates.doublesAreClose(relativeError, 1e-6);
    TestAssertions.assertArrayTest(EXPECTED, result.getParameters(), test, "parameters");
  }

  @Test
  void canFitWeightedLeastSquares() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 48, 6, 8);
    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    assertFit(result, 1e-4);
    Assertions.assertEquals(0, result.getCost(), 1e-6);
    final double[][] cov = result.getCovariance();
    Assertions.assertNotNull(cov);
    Assertions.assertEquals(4, cov.length);
    for (int i = 0; i < 4; i++) {
      Assertions.assertTrue(cov[i][i] > 0);
    }
  }

  @Test
  void canFitUnweightedLeastSquares() {
    final double[] x = createX();
    final double[] y = createY(x);
    final double[] variance = new double[x.length];
    final ProfileModel model = createModel(80, 48, 6, 8);
    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, variance,
        CostFunction.UNWEIGHTED_LEAST_SQUARES);
    assertFit(result, 1e-4);
  }

  @Test
  void canFitPoisson() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 48, 6, 8);
    final FitResult result =
        new CommonsMathFitEngine().fit(model, x, y, y, CostFunction.POISSON);
    assertFit(result, 1e-2);
    Assertions.assertNotNull(result.getCovariance());
  }

  @Test
  void toleranceExitReportsChangesTooSmall() {
    // The optimiser converges then reports the tolerances are too small to continue
    final CommonsMathFitEngine engine = new CommonsMathFitEngine() {
      @Override
      LevenbergMarquardtOptimizer createOptimizer() {
        return new LevenbergMarquardtOptimizer() {
          @Override
          public Optimum optimize(LeastSquaresProblem problem) {
            super.optimize(problem);
            throw new ConvergenceException(LocalizedFormats.TOO_SMALL_COST_RELATIVE_TOLERANCE,
                1e-10);
          }
        };
      }
    };
    final double[] x = createX();
    final double[] y = createY(x);
    final FitResult result = engine.fit(createModel(80, 48, 6, 8), x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertEquals(FitStatus.CHANGES_TOO_SMALL, result.getStatus());
    assertFit(result, 1e-3);
    Assertions.assertNotNull(result.getCovariance());
    Assertions.assertFalse(FitAcceptanceRule.SUCCESS_ONLY.isAccepted(result.getStatus()));
  }

  @Test
  void toleranceExitWithoutProgressReturnsTheStart() {
    final CommonsMathFitEngine engine = new CommonsMathFitEngine() {
      @Override
      LevenbergMarquardtOptimizer createOptimizer() {
        return new LevenbergMarquardtOptimizer() {
          @Override
          public Optimum optimize(LeastSquaresProblem problem) {
            throw new ConvergenceException(
                LocalizedFormats.TOO_SMALL_PARAMETERS_RELATIVE_TOLERANCE, 1e-10);
          }
        };
      }
    };
    final double[] x = createX();
    final double[] y = createY(x);
    final FitResult result = engine.fit(createModel(80, 48, 6, 8), x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertEquals(FitStatus.CHANGES_TOO_SMALL, result.getStatus());
    Assertions.assertArrayEquals(new double[] {80, 48, 6, 8}, result.getParameters());
  }

  @Test
  void fitRespectsBounds() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 48, 6, 8);
    model.setBounds(GaussianFunction.SIGMA, 1, 4);
    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertNotNull(result.getParameters());
    final double sigma = result.getParameters()[GaussianFunction.SIGMA];
    Assertions.assertTrue(sigma >= 1 && sigma <= 4, () -> "Sigma: " + sigma);
  }

  @Test
  void fixedParametersAreUnchanged() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 50, 5, 10);
    model.fix(GaussianFunction.SIGMA);
    // Equal bounds also fix the parameter
    model.setBounds(3, 10, 10);
    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    assertFit(result, 1e-4);
    Assertions.assertEquals(5, result.getParameters()[GaussianFunction.SIGMA]);
    Assertions.assertEquals(10, result.getParameters()[3]);
    // No covariance for fixed parameters
    final int sigma = GaussianFunction.SIGMA;
    Assertions.assertEquals(0, result.getCovariance()[sigma][sigma]);
  }

  @Test
  void noFreeParametersReturnsTheModel() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 48, 6, 8);
    for (int i = 0; i < 4; i++) {
      model.fix(i);
    }
    final FitResult result = new CommonsMathFitEngine().fit(model, x, y, y,
        CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertEquals(FitStatus.SUCCESS, result.getStatus());
    Assertions.assertArrayEquals(new double[] {80, 48, 6, 8}, result.getParameters());
  }

  @Test
  void inputModelIsNotModified() {
    final double[] x = createX();
    final double[] y = createY(x);
    final ProfileModel model = createModel(80, 48, 6, 8);
    new CommonsMathFitEngine().fit(model, x, y, y, CostFunction.WEIGHTED_LEAST_SQUARES);
    new CommonsMathFitEngine().fit(model, x, y, y, CostFunction.POISSON);
    Assertions.assertArrayEquals(new double[] {80, 48, 6, 8}, model.getParameters());
  }

  @Test
  void failsWithTooFewWeightedObservations() {
    final double[] x = {1, 2, 3};
    final double[] y = {1, 2, 1};
    final double[] variance = {1, 0, 0};
    final FitResult result = new CommonsMathFitEngine().fit(createModel(2, 2, 1, 0), x, y,
        variance, CostFunction.WEIGHTED_LEAST_SQUARES);
    Assertions.assertEquals(FitStatus.FAILED, result.getStatus());
    Assertions.assertNull(result.getParameters());
  }

  @Test
  void testDataLengthMismatch() {
    final CommonsMathFitEngine engine = new CommonsMathFitEngine();
    final ProfileModel model = createModel(EXPECTED);
    Assertions.assertThrows(IllegalArgumentException.class, () -> engine.fit(model,
        new double[3], new double[3], new double[2], CostFunction.POISSON));
  }

  @Test
  void testMaxIterations() {
    Assertions.assertEquals(CommonsMathFitEngine.DEFAULT_MAX_ITERATIONS,
        new CommonsMathFitEngine().getMaxIterations());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new CommonsMathFitEngine(0));
  }
}
