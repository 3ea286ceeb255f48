package com.flamingo.ai.corpusindex.service.taxonomy.projection;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/** Linear projection onto the two leading principal components of the mean-centred points. */
public class PcaProjector implements LayoutProjector {

  public static final String METHOD = "pca";

  @Override
  public double[][] project(double[][] points) {
    int m = points.length;
    int d = points[0].length;
    double[] mean = new double[d];
    for (double[] point : points) {
      for (int c = 0; c < d; c++) {
        mean[c] += point[c] / m;
      }
    }
    DMatrixRMaj centred = new DMatrixRMaj(m, d);
    for (int i = 0; i < m; i++) {
      for (int c = 0; c < d; c++) {
        centred.set(i, c, points[i][c] - mean[c]);
      }
    }

    SingularValueDecomposition_F64<DMatrixRMaj> svd =
        DecompositionFactory_DDRM.svd(m, d, true, false, true);
    if (!svd.decompose(centred)) {
      throw new IllegalStateException("SVD failed for " + m + " points");
    }
    double[] singular = svd.getSingularValues();
    int rank = Math.min(svd.numberOfSingularValues(), singular.length);
    double[] values = new double[rank];
    System.arraycopy(singular, 0, values, 0, rank);
    DMatrixRMaj u = svd.getU(null, false);

    double[][] coords = new double[m][2];
    int[] top = EigenSupport.topIndices(values, 2);
    for (int axis = 0; axis < top.length; axis++) {
      for (int i = 0; i < m; i++) {
        coords[i][axis] = u.get(i, top[axis]) * values[top[axis]];
      }
    }
    EigenSupport.fixSigns(coords);
    return coords;
  }

  @Override
  public String method() {
    return METHOD;
  }
}
