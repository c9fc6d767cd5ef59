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

/**
 * The diagnostic data of an integrated peak for display of the fit.
 *
 * <p>The arrays are owned by the diagnostics and must not be modified.
 */
public final class PeakDiagnostics {
  private final int seedRow;
  private final int seedCol;
  private final boolean[][] attempted;
  private final boolean[][] successful;
  private final double[] tof;
  private final double[] focusedIntensity;
  private final double[] focusedVariance;
  private final double[] yFitFocused;
  private final int rounds;

  /**
   * Create an instance.
   *
   * @param seedRow the seed row
   * @param seedCol the seed column
   * @param attempted the attempted mask
   * @param successful the successful mask
   * @param tof the cropped time-of-flight axis
   * @param focusedIntensity the intensity summed over the successful pixels
   * @param focusedVariance the variance summed over the successful pixels
   * @param yFitFocused the fitted peak summed over the successful pixels
   * @param rounds the number of flood fill rounds
   */
  PeakDiagnostics(int seedRow, int seedCol, boolean[][] attempted, boolean[][] successful,
      double[] tof, double[] focusedIntensity, double[] focusedVariance, double[] yFitFocused,
      int rounds) {
    this.seedRow = seedRow;
    this.seedCol = seedCol;
    this.attempted = attempted;
    this.successful = successful;
    this.tof = tof;
    this.focusedIntensity = focusedIntensity;
    this.focusedVariance = focusedVariance;
    this.yFitFocused = yFitFocused;
    this.rounds = rounds;
  }

  public int getSeedRow() {
    return seedRow;
  }

  public int getSeedCol() {
    return seedCol;
  }

  public boolean[][] getAttempted() {
    return attempted;
  }

  public boolean[][] getSuccessful() {
    return successful;
  }

  public double[] getTof() {
    return tof;
  }

  public double[] getFocusedIntensity() {
    return focusedIntensity;
  }

  public double[] getFocusedVariance() {
    return focusedVariance;
  }

  public double[] getYFitFocused() {
    return yFitFocused;
  }

  public int getRounds() {
    return rounds;
  }

  /**
   * Count the pixels in the mask.
   *
   * @param mask the mask
   * @return the count
   */
  static int count(boolean[][] mask) {
    int count = 0;
    for (final boolean[] row : mask) {
      for (final boolean b : row) {
        if (b) {
          count++;
        }
      }
    }
    return count;
  }

  /**
   * Gets the number of attempted pixels.
   *
   * @return the count
   */
  public int getAttemptedCount() {
    return count(attempted);
  }

  /**
   * Gets the number of successful pixels.
   *
   * @return the count
   */
  public int getSuccessfulCount() {
    return count(successful);
  }
}
