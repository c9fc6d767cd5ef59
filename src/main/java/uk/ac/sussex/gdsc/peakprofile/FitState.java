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

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * The state of the flood fill over the pixels of a window.
 *
 * <p>Pixels are identified by the index {@code row * cols + col}. A pixel can be attempted only
 * once and only an attempted pixel can be successful.
 */
public class FitState {
  private final int rows;
  private final int cols;
  private final boolean[][] attempted;
  private final boolean[][] successful;
  private final double[] yFitFocused;
  private double intensitySum;
  private double varianceSum;
  private int acceptedCount;
  private int rounds;

  /**
   * Create an instance.
   *
   * @param rows the rows
   * @param cols the columns
   * @param bins the number of time-of-flight bins
   */
  public FitState(int rows, int cols, int bins) {
    this.rows = rows;
    this.cols = cols;
    attempted = new boolean[rows][cols];
    successful = new boolean[rows][cols];
    yFitFocused = new double[bins];
  }

  public int getRows() {
    return rows;
  }

  public int getCols() {
    return cols;
  }

  /**
   * Get the pixel index.
   *
   * @param row the row
   * @param col the column
   * @return the index
   */
  public int getIndex(int row, int col) {
    return row * cols + col;
  }

  /**
   * Mark the pixel as attempted.
   *
   * @param row the row
   * @param col the column
   * @throws IllegalStateException if the pixel has already been attempted
   */
  public void markAttempted(int row, int col) {
    if (attempted[row][col]) {
      throw new IllegalStateException("Pixel already attempted: " + row + "," + col);
    }
    attempted[row][col] = true;
  }

  public boolean isAttempted(int row, int col) {
    return attempted[row][col];
  }

  public boolean isSuccessful(int row, int col) {
    return successful[row][col];
  }

  /**
   * Accept the fitted pixel.
   *
   * @param row the row
   * @param col the column
   * @param intensity the intensity
   * @param sigma the error of the intensity
   * @param peakCurve the fitted peak curve
   * @throws IllegalStateException if the pixel has not been attempted
   */
  public void accept(int row, int col, double intensity, double sigma, double[] peakCurve) {
    if (!attempted[row][col]) {
      throw new IllegalStateException("Pixel not attempted: " + row + "," + col);
    }
    successful[row][col] = true;
    intensitySum += intensity;
    varianceSum += sigma * sigma;
    acceptedCount++;
    for (int i = 0; i < yFitFocused.length; i++) {
      yFitFocused[i] += peakCurve[i];
    }
  }

  /**
   * Increment the number of flood fill rounds.
   */
  void incrementRounds() {
    rounds++;
  }

  public int getRounds() {
    return rounds;
  }

  public double getIntensitySum() {
    return intensitySum;
  }

  public double getVarianceSum() {
    return varianceSum;
  }

  public int getAcceptedCount() {
    return acceptedCount;
  }

  /**
   * Gets the sum of the fitted peak curves of the accepted pixels.
   *
   * @return the focused fit
   */
  public double[] getYFitFocused() {
    return yFitFocused.clone();
  }

  /**
   * Gets a copy of the attempted mask.
   *
   * @return the attempted mask
   */
  public boolean[][] getAttempted() {
    return copy(attempted);
  }

  /**
   * Gets a copy of the successful mask.
   *
   * @return the successful mask
   */
  public boolean[][] getSuccessful() {
    return copy(successful);
  }

  private static boolean[][] copy(boolean[][] mask) {
    final boolean[][] result = new boolean[mask.length][];
    for (int i = 0; i < mask.length; i++) {
      result[i] = mask[i].clone();
    }
    return result;
  }

  /**
   * Gets the next frontier: the unattempted pixels with a 4-connected successful neighbour.
   *
   * @return the pixel indices
   */
  public IntArrayList nextFrontier() {
    final IntArrayList frontier = new IntArrayList();
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        if (!attempted[r][c] && hasSuccessfulNeighbour(r, c)) {
          frontier.add(getIndex(r, c));
        }
      }
    }
    return frontier;
  }

  private boolean hasSuccessfulNeighbour(int row, int col) {
    return (row > 0 && successful[row - 1][col])
        || (row + 1 < rows && successful[row + 1][col])
        || (col > 0 && successful[row][col - 1])
        || (col + 1 < cols && successful[row][col + 1]);
  }
}
