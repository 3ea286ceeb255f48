package com.flamingo.ai.corpusindex.service.taxonomy.projection;

import java.util.Arrays;
import java.util.Comparator;

/** Helpers shared by the projectors. */
final class EigenSupport {

  private EigenSupport() {}

  /** Indices of the {@code count} largest values, largest first, lower index on ties. */
  static int[] topIndices(double[] values, int count) {
    Integer[] order = new Integer[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -values[i]).thenComparing(i -> i));
    int[] top = new int[Math.min(count, order.length)];
    for (int i = 0; i < top.length; i++) {
      top[i] = order[i];
    }
    return top;
  }

  /** Flips each column so its largest-magnitude entry is positive, making signs reproducible. */
  static void fixSigns(double[][] coords) {
    if (coords.length == 0) {
      return;
    }
    for (int c = 0; c < coords[0].length; c++) {
      double largest = 0;
      for (double[] row : coords) {
        if (Math.abs(row[c]) > Math.abs(largest)) {
          largest = row[c];
        }
      }
      if (largest < 0) {
        for (double[] row : coords) {
          row[c] = -row[c];
        }
      }
    }
  }
}
