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

import org.apache.commons.math3.special.Erf;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.test.api.TestAssertions;
import uk.ac.sussex.gdsc.test.api.Predicates;
import uk.ac.sussex.gdsc.test.api.function.DoubleDoubleBiPredicate;

@SuppressWarnings({"javadoc"})
class BackToBackExponentialFunctionTest {
  private static final double FWHM_FACTOR = 2 * Math.sqrt(2 * Math.log(2));

  static BackToBackExponentialFunction create(double intensity, double alpha, double beta,
      double centre, double sigma) {
    final BackToBackExponentialFunction f = new BackToBackExponentialFunction();
    f.setParameter(BackToBackExponentialFunction.INTENSITY, intensity);
    f.setParameter(BackToBackExponentialFunction.ALPHA, alpha);
    f.setParameter(BackToBackExponentialFunction.BETA, beta);
    f.setParameter(BackToBackExponentialFunction.CENTRE, centre);
    f.setParameter(BackToBackExponentialFunction.SIGMA, sigma);
    return f;
  }

  @Test
  void hasUnitAreaScaledByIntensity() {
    final BackToBackExponentialFunction f = create(250, 0.5, 0.1, 1000, 3);
    // Trapezoid integration over a range covering the tails
    final double dx = 0.05;
    double sum = 0;
    double previous = f.value(900);
    for (double x = 900 + dx; x <= 1300; x += dx) {
      final double v = f.value(x);
      sum += 0.5 * (previous + v) * dx;
      previous = v;
    }
    Assertions.assertEquals(250, sum, 250 * 1e-4);
    Assertions.assertEquals(250, f.getIntensity());
    Assertions.assertTrue(f.hasIntensityParameter());
  }

  @Test
  void isAsymmetric() {
    // Slow decay gives a longer tail after the centre
    final BackToBackExponentialFunction f = create(1, 1, 0.1, 0, 1);
    Assertions.assertTrue(f.value(10) > f.value(-10));
  }

  @Test
  void hasZeroValueForInvalidShape() {
    Assertions.assertEquals(0, create(1, 0, 1, 0, 1).value(0));
    Assertions.assertEquals(0, create(1, 1, -1, 0, 1).value(0));
    Assertions.assertEquals(0, create(1, 1, 1, 0, 0).value(0));
    Assertions.assertEquals(Double.NaN, create(1, 1, 1, 0, 0).getFwhm());
    Assertions.assertEquals(Double.NaN, create(1, -1, 1, 0, 1).getFwhm());
  }

  @Test
  void canComputeExpErfc() {
    for (final double y : new double[] {-3, 0, 1.5, 10, 25}) {
      final double u = 0.5 * y;
      Assertions.assertEquals(Math.exp(u) * Erf.erfc(y),
          BackToBackExponentialFunction.expErfc(u, y), 1e-14);
    }
    // exp(u) overflows but the product is finite
    final double v = BackToBackExponentialFunction.expErfc(800, 30);
    Assertions.assertTrue(Double.isFinite(v));
    Assertions.assertTrue(v > 0);
    // The asymptotic expansion is continuous with the direct computation
    final double y = 26;
    final double direct = BackToBackExponentialFunction.expErfc(y * y, y);
    final double above = BackToBackExponentialFunction.expErfc(y * y, Math.nextUp(y));
    Assertions.assertEquals(direct, above, direct * 1e-3);
  }

  @Test
  void fwhmApproachesGaussianForFastExponentials() {
    final BackToBackExponentialFunction f = create(1, 1e3, 1e3, 500, 4);
    Assertions.assertEquals(4 * FWHM_FACTOR, f.getFwhm(), 1e-2);
  }

  @Test
  void fwhmIncludesExponentialTails() {
    final BackToBackExponentialFunction f = create(1, 0.2, 0.05, 500, 4);
    final double fwhm = f.getFwhm();
    Assertions.assertTrue(fwhm > 4 * FWHM_FACTOR);
    // The value at the half-maximum points is half the maximum
    final double max = maximum(f, 400, 700);
    final double left = findCrossing(f, max / 2, 400, 700, true);
    final double right = findCrossing(f, max / 2, 400, 700, false);
    Assertions.assertEquals(right - left, fwhm, 1e-2);
  }

  private static double maximum(BackToBackExponentialFunction f, double lo, double hi) {
    double max = 0;
    for (double x = lo; x <= hi; x += 1e-3) {
      max = Math.max(max, f.value(x));
    }
    return max;
  }

  private static double findCrossing(BackToBackExponentialFunction f, double level, double lo,
      double hi, boolean first) {
    double last = Double.NaN;
    for (double x = lo; x <= hi; x += 1e-3) {
      if (f.value(x) >= level) {
        if (first) {
          return x;
        }
        last = x;
      }
    }
    return last;
  }

  @Test
  void setFwhmSetsGaussianWidth() {
    final BackToBackExponentialFunction f = create(1, 0.2, 0.05, 500, 4);
    f.setFwhm(10);
    Assertions.assertEquals(10 / FWHM_FACTOR, f.getParameter(BackToBackExponentialFunction.SIGMA),
        1e-12);
  }

  @Test
  void canComputeGradient() {
    final BackToBackExponentialFunction f = create(250, 0.5, 0.1, 1000, 3);
    final double[] df = new double[5];
    final DoubleDoubleBiPredicate test = Predicates.doublesAreClose(1e-4, 1e-8);
    for (final double x : new double[] {990, 998, 1000, 1003, 1020}) {
      f.gradient(x, df);
      Assertions.assertEquals(f.value(x) / 250, df[0], 1e-12);
      for (int i = 1; i < 5; i++) {
        final double h = 1e-5 * Math.abs(f.getParameter(i));
        final BackToBackExponentialFunction f1 = f.copy();
        final BackToBackExponentialFunction f2 = f.copy();
        f1.setParameter(i, f.getParameter(i) + h);
        f2.setParameter(i, f.getParameter(i) - h);
        final double expected = (f1.value(x) - f2.value(x)) / (2 * h);
        TestAssertions.assertTest(expected, df[i], test, f.getParameterNames()[i]);
      }
    }
  }

  @Test
  void copyIsIndependent() {
    final BackToBackExponentialFunction f = create(250, 0.5, 0.1, 1000, 3);
    final BackToBackExponentialFunction copy = f.copy();
    copy.setCentre(990);
    Assertions.assertEquals(1000, f.getCentre());
    Assertions.assertEquals(990, copy.getCentre());
  }
}
