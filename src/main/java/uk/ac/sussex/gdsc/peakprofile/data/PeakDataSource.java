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

/**
 * Supplies the window of detector pixels around a candidate peak.
 *
 * <p>Implementations convert the instrument geometry to a rectangular pixel array. The returned
 * window must be aligned so that all pixels share the same time-of-flight axis.
 */
public interface PeakDataSource {
  /**
   * Gets the peak data.
   *
   * <p>The window is centred on the detector of the peak. Pixels within the given number of rows
   * or columns of the physical detector boundary are flagged as edge pixels.
   *
   * @param peak the peak
   * @param nrows the number of rows in the window
   * @param ncols the number of columns in the window
   * @param nrowsEdge the number of rows at the detector edge to flag
   * @param ncolsEdge the number of columns at the detector edge to flag
   * @return the peak data (or null if the detector is not in a supported bank)
   */
  PixelWindow getPeakData(PeakCandidate peak, int nrows, int ncols, int nrowsEdge,
      int ncolsEdge);
}
