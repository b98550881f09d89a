package umms.wgcna.network;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;

/**
 * Soft-thresholds a correlation matrix into a weighted adjacency matrix.
 * The diagonal is always 0, there are no self loops.
 */
public class AdjacencyTransformer {

	private static final String STAGE = "adjacency";

	private final NetworkType networkType;
	private final double power;

	public AdjacencyTransformer(NetworkType networkType, double power) {
		if(!(power > 0)) {
			throw new IllegalArgumentException("Soft-threshold power must be positive, got " + power);
		}
		this.networkType = networkType;
		this.power = power;
	}

	public NetworkType getNetworkType() {
		return networkType;
	}

	public double getPower() {
		return power;
	}

	public double adjacency(double r) {
		return networkType.adjacency(r, power);
	}

	public MatrixWithHeaders transform(MatrixWithHeaders correlation) {
		int n = correlation.rowDimension();
		if(n != correlation.columnDimension() || !correlation.getRowNames().equals(correlation.getColumnNames())) {
			throw new IllegalArgumentException("Adjacency needs a square correlation matrix with matching row and column names, got " + correlation);
		}
		MatrixWithHeaders rtrn = new MatrixWithHeaders(correlation.getRowNames(), correlation.getColumnNames());
		for(int i = 0; i < n; i++) {
			for(int j = 0; j < n; j++) {
				double r = correlation.get(i, j);
				if(Double.isNaN(r)) {
					throw new DegenerateInputException(STAGE, "correlation", "NaN at (" + correlation.getRowName(i) + ", " + correlation.getColumnName(j) + ")");
				}
				rtrn.set(i, j, i == j ? 0 : adjacency(r));
			}
		}
		return rtrn;
	}

	/**
	 * Converts correlation rows of a gene block (see CorrelationEngine#correlationRows) in place.
	 * Row b belongs to gene block[b], whose own entry is set to 0.
	 */
	public void transformRows(double[][] rows, int[] block) {
		for(int b = 0; b < rows.length; b++) {
			double[] row = rows[b];
			for(int g = 0; g < row.length; g++) {
				if(Double.isNaN(row[g])) {
					throw new DegenerateInputException(STAGE, "correlation rows", "NaN at gene " + block[b] + ", " + g);
				}
				row[g] = adjacency(row[g]);
			}
			row[block[b]] = 0;
		}
	}
}
