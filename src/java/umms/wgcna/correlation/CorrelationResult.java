package umms.wgcna.correlation;

import umms.core.datastructures.MatrixWithHeaders;

/**
 * Correlations between the columns of two matrices, with Student t p-values and the
 * number of complete observations each value was computed from.
 * Rows of every table are the columns of the first matrix, columns those of the second.
 */
public class CorrelationResult {

	private final MatrixWithHeaders correlations;
	private final MatrixWithHeaders pValues;
	private final MatrixWithHeaders observations;

	public CorrelationResult(MatrixWithHeaders correlations, MatrixWithHeaders pValues, MatrixWithHeaders observations) {
		this.correlations = correlations;
		this.pValues = pValues;
		this.observations = observations;
	}

	public MatrixWithHeaders getCorrelations() {
		return correlations;
	}

	public MatrixWithHeaders getPValues() {
		return pValues;
	}

	public MatrixWithHeaders getObservations() {
		return observations;
	}

	public double getCorrelation(String row, String column) {
		return correlations.get(row, column);
	}

	public double getPValue(String row, String column) {
		return pValues.get(row, column);
	}
}
