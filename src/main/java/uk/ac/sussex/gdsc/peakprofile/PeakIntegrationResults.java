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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.peakprofile.data.PeakCandidate;

/**
 * The results of integrating a list of peaks. The results are in the order of the input peaks.
 */
public class PeakIntegrationResults extends AbstractList<PeakIntegrationResult> {
  /** The table header. */
  private static final String HEADER = "h\tk\tl\ttof\tdspacing\tintensity\tsigma\tstatus";

  private final List<PeakIntegrationResult> results;

  /**
   * Create an instance.
   *
   * @param results the results
   */
  public PeakIntegrationResults(List<PeakIntegrationResult> results) {
    this.results = new ArrayList<>(results);
  }

  @Override
  public PeakIntegrationResult get(int index) {
    return results.get(index);
  }

  @Override
  public int size() {
    return results.size();
  }

  /**
   * Count the results with each status.
   *
   * @return the counts
   */
  public Map<IntegrationStatus, Integer> getStatusCounts() {
    final Map<IntegrationStatus, Integer> counts = new EnumMap<>(IntegrationStatus.class);
    for (final IntegrationStatus status : IntegrationStatus.values()) {
      counts.put(status, 0);
    }
    results.forEach(r -> counts.merge(r.getStatus(), 1, Integer::sum));
    return counts;
  }

  /**
   * Gets the count of the results with the status.
   *
   * @param status the status
   * @return the count
   */
  public int getCount(IntegrationStatus status) {
    return (int) results.stream().filter(r -> r.getStatus() == status).count();
  }

  /**
   * Write the results as a tab-delimited table.
   *
   * @param out the output
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void write(Appendable out) throws IOException {
    out.append(HEADER).append(System.lineSeparator());
    final StringBuilder sb = new StringBuilder();
    for (final PeakIntegrationResult result : results) {
      sb.setLength(0);
      final PeakCandidate peak = result.getPeak();
      sb.append(peak.getH()).append('\t');
      sb.append(peak.getK()).append('\t');
      sb.append(peak.getL()).append('\t');
      sb.append(peak.getTof()).append('\t');
      sb.append(peak.getDSpacing()).append('\t');
      sb.append(result.getIntensity()).append('\t');
      sb.append(result.getSigma()).append('\t');
      sb.append(result.getStatus().getDescription());
      out.append(sb).append(System.lineSeparator());
    }
  }

  /**
   * Write the results as a tab-delimited table to the file.
   *
   * @param path the path
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void write(Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      write(writer);
    }
  }
}
