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

import uk.ac.sussex.gdsc.peakprofile.data.PixelWindow;

/**
 * Decide the status of an integrated peak.
 *
 * <p>A peak with no accepted pixels has no peak. A peak where any attempted pixel is an edge pixel
 * is on the edge unless integration on the edge is allowed.
 */
public class EdgePolicy {
  private final boolean integrateIfOnEdge;

  /**
   * Create an instance.
   *
   * @param integrateIfOnEdge set to true to integrate peaks that touch the detector edge
   */
  public EdgePolicy(boolean integrateIfOnEdge) {
    this.integrateIfOnEdge = integrateIfOnEdge;
  }

  public boolean isIntegrateIfOnEdge() {
    return integrateIfOnEdge;
  }

  /**
   * Gets the status.
   *
   * @param state the fit state
   * @param window the window
   * @return the status
   */
  public IntegrationStatus getStatus(FitState state, PixelWindow window) {
    if (state.getAcceptedCount() == 0) {
      return IntegrationStatus.NO_PEAK;
    }
    if (!integrateIfOnEdge && isAttemptedOnEdge(state, window)) {
      return IntegrationStatus.ON_EDGE;
    }
    return IntegrationStatus.VALID;
  }

  private static boolean isAttemptedOnEdge(FitState state, PixelWindow window) {
    for (int r = 0; r < state.getRows(); r++) {
      for (int c = 0; c < state.getCols(); c++) {
        if (state.isAttempted(r, c) && window.isEdge(r, c)) {
          return true;
        }
      }
    }
    return false;
  }
}
