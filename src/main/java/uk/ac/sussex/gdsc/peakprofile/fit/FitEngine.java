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

import uk.ac.sussex.gdsc.peakprofile.function.ProfileModel;

/**
 * Fits a profile model to data.
 */
public interface FitEngine {
  /**
   * Fit the free parameters of the model to the data within the parameter bounds. The model is not
   * modified.
   *
   * @param model the model (the current parameters are the start point)
   * @param x the time-of-flight
   * @param y the observed values
   * @param variance the variance of the observed values
   * @param costFunction the cost function
   * @return the result
   */
  FitResult fit(ProfileModel model, double[] x, double[] y, double[] variance,
      CostFunction costFunction);
}
