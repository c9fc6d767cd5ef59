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

package uk.ac.sussex.gdsc.peakprofile.data;

import java.util.Arrays;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A rectangular window of detector pixels around a candidate peak.
 *
 * <p>Each pixel has an intensity and variance trace over a time-of-flight (TOF) axis that is
 * shared by all pixels. The window is read-only after construction: the arrays returned by the
 * accessors are the internal data and must not be modified.
 */
public final class PixelWindow {
  /** The minimum number of TOF bins. */
  public static final int MIN_BINS = 2;

  private final int rows;
  private final int cols;
  private final double[][][] intensity;
  private final double[][][] variance;
  private final double[] tof;
  private final int[][] spectrumIds;
  private final boolean[][] edge;
  /** The row of the nominal peak position. */
  private final int peakRow;
  /** The column of the nominal peak position. */
  private final int peakCol;

  /**
   * Create an instance.
   *
   * @param intensity the intensity [row][col][bin]
   * @param variance the variance [row][col][bin]
   * @param tof the time-of-flight axis [bin] (must be ascending)
   * @param spectrumIds the spectrum id [row][col]
   * @param edge the edge flag [row][col]
   * @param peakRow the row of the nominal peak position
   * @param peakCol the column of the nominal peak position
   * @throws IllegalArgumentException if the array dimensions do not match
   */
  public PixelWindow(double[][][] intensity, double[][][] variance, double[] tof,
      int[][] spectrumIds, boolean[][] edge, int peakRow, int peakCol) {
    ValidationUtils.checkArgument(tof.length >= MIN_BINS, "Require at least %d TOF bins",
        MIN_BINS);
    for (int i = 1; i < tof.length; i++) {
      ValidationUtils.checkArgument(tof[i] > tof[i - 1], "TOF axis is not ascending at bin %d",
          i);
    }
    rows = intensity.length;
    ValidationUtils.checkArgument(rows > 0, "No rows");
    cols = intensity[0].length;
    ValidationUtils.checkArgument(cols > 0, "No columns");
    checkDimensions(intensity, "intensity", rows, cols, tof.length);
    checkDimensions(variance, "variance", rows, cols, tof.length);
    ValidationUtils.checkArgument(spectrumIds.length == rows, "Spectrum id rows mismatch");
    ValidationUtils.checkArgument(edge.length == rows, "Edge rows mismatch");
    for (int r = 0; r < rows; r++) {
      ValidationUtils.checkArgument(spectrumIds[r].length == cols,
          "Spectrum id columns mismatch");
      ValidationUtils.checkArgument(edge[r].length == cols, "Edge columns mismatch");
    }
    ValidationUtils.checkArgument(peakRow >= 0 && peakRow < rows, "Invalid peak row: %d",
        peakRow);
    ValidationUtils.checkArgument(peakCol >= 0 && peakCol < cols, "Invalid peak column: %d",
        peakCol);
    this.intensity = intensity;
    this.variance = variance;
    this.tof = tof;
    this.spectrumIds = spectrumIds;
    this.edge = edge;
    this.peakRow = peakRow;
    this.peakCol = peakCol;
  }

  private static void checkDimensions(double[][][] data, String name, int rows, int cols,
      int bins) {
    ValidationUtils.checkArgument(data.length == rows, "%s rows mismatch", name);
    for (int r = 0; r < rows; r++) {
      ValidationUtils.checkArgument(data[r].length == cols, "%s columns mismatch", name);
      for (int c = 0; c < cols; c++) {
        ValidationUtils.checkArgument(data[r][c].length == bins, "%s bins mismatch", name);
      }
    }
  }

  public int getRows() {
    return rows;
  }

  public int getCols() {
    return cols;
  }

  /**
   * Gets the number of TOF bins.
   *
   * @return the number of bins
   */
  public int getBins() {
    return tof.length;
  }

  /**
   * Gets the TOF axis.
   *
   * @return the tof
   */
  public double[] getTof() {
    return tof;
  }

  /**
   * Gets the intensity trace of the pixel.
   *
   * @param row the row
   * @param col the column
   * @return the intensity
   */
  public double[] getIntensity(int row, int col) {
    return intensity[row][col];
  }

  /**
   * Gets the variance trace of the pixel.
   *
   * @param row the row
   * @param col the column
   * @return the variance
   */
  public double[] getVariance(int row, int col) {
    return variance[row][col];
  }

  public int getSpectrumId(int row, int col) {
    return spectrumIds[row][col];
  }

  /**
   * Checks if the pixel is within the detector edge margin.
   *
   * @param row the row
   * @param col the column
   * @return true if an edge pixel
   */
  public boolean isEdge(int row, int col) {
    return edge[row][col];
  }

  public int getPeakRow() {
    return peakRow;
  }

  public int getPeakCol() {
    return peakCol;
  }

  /**
   * Gets the width of the bin. The last bin uses the width of the preceding bin.
   *
   * @param bin the bin
   * @return the bin width
   */
  public double getBinWidth(int bin) {
    final int i = Math.min(bin, tof.length - 2);
    return tof[i + 1] - tof[i];
  }

  /**
   * Find the bin nearest to the time-of-flight. Values outside the axis are clipped to the first
   * or last bin.
   *
   * @param value the time-of-flight
   * @return the bin
   */
  public int findBin(double value) {
    final int index = Arrays.binarySearch(tof, value);
    if (index >= 0) {
      return index;
    }
    final int insert = -(index + 1);
    if (insert == 0) {
      return 0;
    }
    if (insert == tof.length) {
      return tof.length - 1;
    }
    return (value - tof[insert - 1] <= tof[insert] - value) ? insert - 1 : insert;
  }

  /**
   * Create a window restricted to the TOF bins in the range {@code [start, end)}.
   *
   * @param start the start bin (inclusive)
   * @param end the end bin (exclusive)
   * @return the cropped window
   * @throws IllegalArgumentException if the range is invalid or has fewer than
   *         {@link #MIN_BINS} bins
   */
  public PixelWindow crop(int start, int end) {
    ValidationUtils.checkArgument(start >= 0 && end <= tof.length && end - start >= MIN_BINS,
        "Invalid crop range");
    if (start == 0 && end == tof.length) {
      return this;
    }
    final double[][][] newIntensity = new double[rows][cols][];
    final double[][][] newVariance = new double[rows][cols][];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        newIntensity[r][c] = Arrays.copyOfRange(intensity[r][c], start, end);
        newVariance[r][c] = Arrays.copyOfRange(variance[r][c], start, end);
      }
    }
    return new PixelWindow(newIntensity, newVariance, Arrays.copyOfRange(tof, start, end),
        spectrumIds, edge, peakRow, peakCol);
  }

  /**
   * Create a window of the given number of bins centred on the bin containing the
   * time-of-flight. The range is shifted to fit inside the TOF axis.
   *
   * @param centre the centre time-of-flight
   * @param nbins the number of bins
   * @return the cropped window
   */
  public PixelWindow cropToBins(double centre, int nbins) {
    final int size = Math.max(MIN_BINS, Math.min(nbins, tof.length));
    final int start = Math.max(0, Math.min(findBin(centre) - size / 2, tof.length - size));
    return crop(start, start + size);
  }

  /**
   * Create a window spanning a multiple of the expected full-width at half-maximum (FWHM) centred
   * on the time-of-flight.
   *
   * @param centre the centre time-of-flight
   * @param fwhm the expected FWHM
   * @param nfwhm the number of FWHM to include
   * @return the cropped window
   */
  public PixelWindow cropToFwhm(double centre, double fwhm, double nfwhm) {
    final double width = getBinWidth(findBin(centre));
    return cropToBins(centre, (int) Math.ceil(nfwhm * fwhm / width));
  }

  /**
   * Gets the total counts of each pixel summed over the TOF axis.
   *
   * @return the integrated intensity [row][col]
   */
  public double[][] getIntegratedIntensity() {
    final double[][] total = new double[rows][cols];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        double sum = 0;
        for (final double v : intensity[r][c]) {
          sum += v;
        }
        total[r][c] = sum;
      }
    }
    return total;
  }

  /**
   * Find the pixel with the highest integrated intensity in the 3x3 neighbourhood of the given
   * pixel (clipped to the window). Ties are resolved in favour of the given pixel.
   *
   * @param row the row
   * @param col the column
   * @return the pixel {row, col}
   */
  public int[] findStrongestPixel(int row, int col) {
    final double[][] total = getIntegratedIntensity();
    int bestRow = row;
    int bestCol = col;
    for (int r = Math.max(0, row - 1); r <= Math.min(rows - 1, row + 1); r++) {
      for (int c = Math.max(0, col - 1); c <= Math.min(cols - 1, col + 1); c++) {
        if (total[r][c] > total[bestRow][bestCol]) {
          bestRow = r;
          bestCol = c;
        }
      }
    }
    return new int[] {bestRow, bestCol};
  }

  /**
   * Gets the intensity summed over the pixels in the mask.
   *
   * @param mask the mask [row][col]
   * @return the focused intensity
   */
  public double[] getFocusedIntensity(boolean[][] mask) {
    return focus(intensity, mask);
  }

  /**
   * Gets the variance summed over the pixels in the mask.
   *
   * @param mask the mask [row][col]
   * @return the focused variance
   */
  public double[] getFocusedVariance(boolean[][] mask) {
    return focus(variance, mask);
  }

  private double[] focus(double[][][] data, boolean[][] mask) {
    final double[] sum = new double[tof.length];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        if (mask[r][c]) {
          final double[] trace = data[r][c];
          for (int i = 0; i < sum.length; i++) {
            sum[i] += trace[i];
          }
        }
      }
    }
    return sum;
  }
}
