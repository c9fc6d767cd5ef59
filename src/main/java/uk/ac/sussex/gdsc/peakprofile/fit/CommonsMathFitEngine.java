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

import java.util.Arrays;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.MultivariateFunctionMappingAdapter;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.util.Pair;
import uk.ac.sussex.gdsc.core.utils.DoubleEquality;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;

/**
 * Fit a profile model using Apache Commons Math.
 *
 * <p>Least squares cost functions use the Levenberg-Marquardt optimiser with parameter bounds
 * applied by clamping. The Poisson likelihood uses the Nelder-Mead simplex optimiser with the
 * bounds applied by a mapping to an unbounded search space.
 *
 * <p>A new optimiser is created for each fit so the engine can be shared between threads.
 */
public class CommonsMathFitEngine implements FitEngine {
  /** The default maximum number of iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 3000;

  /** The relative change in the cost used to define convergence. */
  private static final double RELATIVE_COST_TOLERANCE = 1e-6;
  /** The threshold for singularity when computing the covariance. */
  private static final double SINGULARITY_THRESHOLD = 1e-12;
  /** The fraction of the bounds range used to move a start point off a bound. */
  private static final double BOUND_MARGIN = 1e-6;

  private final int maxIterations;

  /**
   * Create an instance with the default maximum iterations.
   */
  public CommonsMathFitEngine() {
    this(DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Create an instance.
   *
   * @param maxIterations the maximum iterations
   */
  public CommonsMathFitEngine(int maxIterations) {
    ValidationUtils.checkStrictlyPositive(maxIterations, "maxIterations");
    this.maxIterations = maxIterations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  @Override
  public FitResult fit(ProfileModel model, double[] x, double[] y, double[] variance,
      CostFunction costFunction) {
    ValidationUtils.checkArgument(x.length == y.length && x.length == variance.length,
        "Data length mismatch");
    final ProfileModel working = model.copy();
    final int[] free = getFittedIndices(working);
    if (free.length == 0) {
      return new FitResult(FitStatus.SUCCESS, working.getParameters(), null, Double.NaN);
    }
    if (costFunction.isLeastSquares()) {
      return fitLeastSquares(working, free, x, y, variance,
          costFunction == CostFunction.WEIGHTED_LEAST_SQUARES);
    }
    return fitPoisson(working, free, x, y);
  }

  /**
   * Gets the indices of the parameters to fit. Parameters with equal lower and upper bounds are
   * fixed.
   */
  private static int[] getFittedIndices(ProfileModel model) {
    final int[] free = model.getFreeIndices();
    int count = 0;
    for (final int i : free) {
      if (model.getLowerBound(i) < model.getUpperBound(i)) {
        free[count++] = i;
      }
    }
    return count == free.length ? free : Arrays.copyOf(free, count);
  }

  private FitResult fitLeastSquares(ProfileModel model, int[] free, double[] x, double[] y,
      double[] variance, boolean weighted) {
    final double[] weights = new double[y.length];
    int observations = 0;
    for (int i = 0; i < weights.length; i++) {
      if (weighted) {
        weights[i] = variance[i] > 0 ? 1.0 / variance[i] : 0;
      } else {
        weights[i] = 1;
      }
      if (weights[i] != 0) {
        observations++;
      }
    }
    if (observations < free.length) {
      return FitResult.failed();
    }

    final FreeParameterFunction function = new FreeParameterFunction(model, free, x);
    final LevenbergMarquardtOptimizer optimizer = createOptimizer();
    final RealVector observed = new ArrayRealVector(y, false);
    final Evaluation[] latest = new Evaluation[1];
    final ConvergenceChecker<Evaluation> checker = (iteration, previous, current) -> {
      latest[0] = current;
      return DoubleEquality.relativeError(previous.getCost(),
          current.getCost()) < RELATIVE_COST_TOLERANCE;
    };
    final ParameterValidator paramValidator = point -> {
      for (int i = point.getDimension(); i-- > 0;) {
        point.setEntry(i, model.clipToBounds(free[i], point.getEntry(i)));
      }
      return point;
    };
    final RealVector start = new ArrayRealVector(function.getStart(), false);
    final RealMatrix weightMatrix = new DiagonalMatrix(weights, false);
    final int maxEvaluations = Integer.MAX_VALUE;
    final boolean lazyEvaluation = false;

    final LeastSquaresProblem problem = LeastSquaresFactory.create(function, observed, start,
        weightMatrix, checker, maxEvaluations, maxIterations, lazyEvaluation, paramValidator);
    Evaluation solution;
    FitStatus status;
    try {
      final Optimum optimum = optimizer.optimize(problem);
      solution = optimum;
      status = FitStatus.SUCCESS;
    } catch (TooManyIterationsException | TooManyEvaluationsException ex) {
      return new FitResult(FitStatus.TOO_MANY_ITERATIONS, null, null, Double.NaN);
    } catch (final ConvergenceException ex) {
      // Raised only when the tolerances are too small to improve the solution
      solution = latest[0] != null ? latest[0] : problem.evaluate(start);
      status = FitStatus.CHANGES_TOO_SMALL;
    } catch (MathIllegalStateException | MathIllegalArgumentException
        | MathArithmeticException ex) {
      return FitResult.failed();
    }

    final double[] point = solution.getPoint().toArray();
    if (!isFinite(point)) {
      return FitResult.failed();
    }
    function.setFree(point);

    // The cost is the square root of the weighted sum of squares
    final double cost = solution.getCost() * solution.getCost();
    double[][] covariance = null;
    try {
      final RealMatrix cov = solution.getCovariances(SINGULARITY_THRESHOLD);
      // Scale by the residual variance when the observations have no error estimate
      final double scale = weighted ? 1 : cost / Math.max(1, observations - free.length);
      covariance = expand(cov, free, model.getNumberOfParameters(), scale);
    } catch (final SingularMatrixException ex) {
      // No covariance
      covariance = null;
    }
    return new FitResult(status, model.getParameters(), covariance, cost);
  }

  /**
   * Creates the least squares optimiser. The optimiser reports a {@link ConvergenceException}
   * when the cost or parameter changes are too small to make further progress.
   *
   * @return the optimiser
   */
  LevenbergMarquardtOptimizer createOptimizer() {
    return new LevenbergMarquardtOptimizer();
  }

  private FitResult fitPoisson(ProfileModel model, int[] free, double[] x, double[] y) {
    final FreeParameterFunction function = new FreeParameterFunction(model, free, x);
    final double[] lower = new double[free.length];
    final double[] upper = new double[free.length];
    final double[] start = function.getStart();
    for (int i = 0; i < free.length; i++) {
      lower[i] = model.getLowerBound(free[i]);
      upper[i] = model.getUpperBound(free[i]);
      start[i] = moveInside(start[i], lower[i], upper[i]);
    }

    final MultivariateFunction likelihood = point -> {
      function.setFree(point);
      double sum = 0;
      for (int i = 0; i < x.length; i++) {
        final double f = model.value(x[i]);
        if (f <= 0) {
          if (f < 0 || y[i] != 0) {
            return Double.POSITIVE_INFINITY;
          }
        } else {
          sum += f - y[i] * Math.log(f);
        }
      }
      return sum;
    };
    final MultivariateFunctionMappingAdapter adapter =
        new MultivariateFunctionMappingAdapter(likelihood, lower, upper);
    final double[] guess = adapter.boundedToUnbounded(start);
    final double[] steps = new double[free.length];
    for (int i = 0; i < steps.length; i++) {
      // Mapped parameters have a scale of 1 in the unbounded space
      steps[i] = Double.isInfinite(lower[i]) && Double.isInfinite(upper[i])
          ? Math.max(0.1 * Math.abs(start[i]), 0.01)
          : 0.1;
    }

    final SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-30);
    final PointValuePair optimum;
    try {
      optimum = optimizer.optimize(new MaxEval(maxIterations * free.length * 10),
          new MaxIter(maxIterations), new ObjectiveFunction(adapter), GoalType.MINIMIZE,
          new InitialGuess(guess), new NelderMeadSimplex(steps));
    } catch (TooManyIterationsException | TooManyEvaluationsException ex) {
      return new FitResult(FitStatus.TOO_MANY_ITERATIONS, null, null, Double.NaN);
    } catch (MathIllegalStateException | MathIllegalArgumentException
        | MathArithmeticException ex) {
      return FitResult.failed();
    }

    final double[] point = adapter.unboundedToBounded(optimum.getPoint());
    if (!isFinite(point) || !(optimum.getValue() < Double.POSITIVE_INFINITY)) {
      return FitResult.failed();
    }
    function.setFree(point);
    final double[][] covariance =
        computeFisherCovariance(model, free, x, model.getNumberOfParameters());
    return new FitResult(FitStatus.SUCCESS, model.getParameters(), covariance,
        optimum.getValue());
  }

  /**
   * Move the value inside the bounds so it can be mapped to the unbounded search space.
   */
  private static double moveInside(double value, double lower, double upper) {
    double lo = lower;
    double hi = upper;
    if (Double.isFinite(lower) && Double.isFinite(upper)) {
      final double margin = BOUND_MARGIN * (upper - lower);
      lo += margin;
      hi -= margin;
    } else if (Double.isFinite(lower)) {
      lo += Math.max(BOUND_MARGIN * Math.abs(lower), Double.MIN_NORMAL);
    } else if (Double.isFinite(upper)) {
      hi -= Math.max(BOUND_MARGIN * Math.abs(upper), Double.MIN_NORMAL);
    }
    return Math.max(lo, Math.min(hi, value));
  }

  /**
   * Compute the inverse of the Fisher information matrix for a Poisson process.
   *
   * @return the covariance (or null if singular)
   */
  private static double[][] computeFisherCovariance(ProfileModel model, int[] free, double[] x,
      int size) {
    final int m = free.length;
    final double[][] fisher = new double[m][m];
    final double[] df = new double[size];
    for (final double xi : x) {
      final double f = model.value(xi);
      if (f > 0) {
        model.gradient(xi, df);
        for (int j = 0; j < m; j++) {
          final double dj = df[free[j]] / f;
          for (int k = 0; k <= j; k++) {
            fisher[j][k] += dj * df[free[k]];
          }
        }
      }
    }
    for (int j = 0; j < m; j++) {
      for (int k = 0; k < j; k++) {
        fisher[k][j] = fisher[j][k];
      }
    }
    try {
      final RealMatrix inverse = new LUDecomposition(new Array2DRowRealMatrix(fisher, false),
          SINGULARITY_THRESHOLD).getSolver().getInverse();
      return expand(inverse, free, size, 1);
    } catch (final SingularMatrixException ex) {
      return null;
    }
  }

  private static double[][] expand(RealMatrix cov, int[] free, int size, double scale) {
    final double[][] full = new double[size][size];
    for (int j = 0; j < free.length; j++) {
      for (int k = 0; k < free.length; k++) {
        full[free[j]][free[k]] = cov.getEntry(j, k) * scale;
      }
    }
    return full;
  }

  private static boolean isFinite(double[] values) {
    for (final double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Evaluate the model as a function of the free parameters.
   */
  private static final class FreeParameterFunction implements MultivariateJacobianFunction {
    private final ProfileModel model;
    private final int[] free;
    private final double[] x;
    private final double[] df;

    FreeParameterFunction(ProfileModel model, int[] free, double[] x) {
      this.model = model;
      this.free = free;
      this.x = x;
      df = new double[model.getNumberOfParameters()];
    }

    double[] getStart() {
      final double[] start = new double[free.length];
      for (int i = 0; i < free.length; i++) {
        start[i] = model.getParameter(free[i]);
      }
      return start;
    }

    void setFree(double[] point) {
      for (int i = 0; i < free.length; i++) {
        model.setParameter(free[i], point[i]);
      }
    }

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      setFree(point.toArray());
      final double[] value = new double[x.length];
      final double[][] jacobian = new double[x.length][free.length];
      for (int i = 0; i < x.length; i++) {
        value[i] = model.value(x[i]);
        model.gradient(x[i], df);
        for (int j = 0; j < free.length; j++) {
          jacobian[i][j] = df[free[j]];
        }
      }
      return new Pair<>(new ArrayRealVector(value, false),
          new Array2DRowRealMatrix(jacobian, false));
    }
  }
}
