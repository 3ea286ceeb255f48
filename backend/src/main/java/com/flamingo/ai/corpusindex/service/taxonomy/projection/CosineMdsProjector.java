package com.flamingo.ai.corpusindex.service.taxonomy.projection;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * Classical multidimensional scaling over cosine distance {@code 1 - cos(a, b)}.
 *
 * <p>Double-centres the squared distance matrix and keeps the two leading eigenvectors scaled by
 * the square root of their eigenvalues. Points with zero norm are treated as orthogonal to all
 * others.
 */
public class CosineMdsProjector implements LayoutProjector {

  public static final String METHOD = "cosine-mds";

  @Override
  public double[][] project(double[][] points) {
    int m = points.length;
    double[] norms = new double[m];
    for (int i = 0; i < m; i++) {
      double sum = 0;
      for (double v : points[i]) {
        sum += v * v;
      }
      norms[i] = Math.sqrt(sum);
    }

    double[][] squared = new double[m][m];
    for (int i = 0; i < m; i++) {
      for (int j = i + 1; j < m; j++) {
        double cosine = 0;
        if (norms[i] > 0 && norms[j] > 0) {
          double dot = 0;
          for (int c = 0; c < points[i].length; c++) {
            dot += points[i][c] * points[j][c];
          }
          cosine = dot / (norms[i] * norms[j]);
        }
        double distance = 1.0 - cosine;
        squared[i][j] = distance * distance;
        squared[j][i] = squared[i][j];
      }
    }

    double[] rowMeans = new double[m];
    double grandMean = 0;
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < m; j++) {
        rowMeans[i] += squared[i][j];
      }
      grandMean += rowMeans[i];
      rowMeans[i] /= m;
    }
    grandMean /= (double) m * m;

    DMatrixRMaj centred = new DMatrixRMaj(m, m);
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < m; j++) {
        centred.set(i, j, -0.5 * (squared[i][j] - rowMeans[i] - rowMeans[j] + grandMean));
      }
    }

    EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(m, true, true);
    if (!eig.decompose(centred)) {
      throw new IllegalStateException("Eigen decomposition failed for " + m + " points");
    }
    double[] eigenvalues = new double[eig.getNumberOfEigenvalues()];
    for (int i = 0; i < eigenvalues.length; i++) {
      eigenvalues[i] = eig.getEigenvalue(i).getReal();
    }

    double[][] coords = new double[m][2];
    int[] top = EigenSupport.topIndices(eigenvalues, 2);
    for (int axis = 0; axis < top.length; axis++) {
      double lambda = eigenvalues[top[axis]];
      DMatrixRMaj vector = eig.getEigenVector(top[axis]);
      if (lambda <= 0 || vector == null) {
        continue;
      }
      double scale = Math.sqrt(lambda);
      for (int i = 0; i < m; i++) {
        coords[i][axis] = vector.get(i, 0) * scale;
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
