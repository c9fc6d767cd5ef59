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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class FitAcceptanceRuleTest {
  @Test
  void canAcceptStatus() {
    for (final FitStatus status : FitStatus.values()) {
      Assertions.assertEquals(status == FitStatus.SUCCESS,
          FitAcceptanceRule.SUCCESS_ONLY.isAccepted(status));
      Assertions.assertEquals(
          status == FitStatus.SUCCESS || status == FitStatus.CHANGES_TOO_SMALL,
          FitAcceptanceRule.SUCCESS_OR_CHANGES_TOO_SMALL.isAccepted(status));
    }
  }

  @Test
  void canConvertDescriptions() {
    Assertions.assertEquals(FitAcceptanceRule.SUCCESS_OR_CHANGES_TOO_SMALL,
        FitAcceptanceRule.fromDescription("SuccessOrChangesTooSmall"));
    Assertions.assertNull(FitAcceptanceRule.fromDescription("Any"));
    Assertions.assertEquals(FitAcceptanceRule.SUCCESS_ONLY, FitAcceptanceRule.fromOrdinal(0));
    Assertions.assertEquals(CostFunction.WEIGHTED_LEAST_SQUARES,
        CostFunction.fromDescription("chisq"));
    Assertions.assertEquals(CostFunction.POISSON,
        CostFunction.fromOrdinal(9, CostFunction.POISSON));
    Assertions.assertTrue(CostFunction.UNWEIGHTED_LEAST_SQUARES.isLeastSquares());
    Assertions.assertTrue(CostFunction.WEIGHTED_LEAST_SQUARES.isLeastSquares());
    Assertions.assertFalse(CostFunction.POISSON.isLeastSquares());
    Assertions.assertArrayEquals(new String[] {"RSq", "ChiSq", "Poisson"},
        CostFunction.getDescriptions());
  }
}
