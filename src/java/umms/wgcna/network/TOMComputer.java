package umms.wgcna.network;

import org.apache.log4j.Logger;

import Jama.Matrix;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.core.utils.BlockExecutor;

/**
 * Topological overlap of a weighted network:
 * TOM_ij = (l_ij + a_ij) / (min(k_i, k_j) + 1 - a_ij), with l_ij = sum_u a_iu a_uj,
 * k_i = sum_u a_iu and TOM_ii = 1.
 * <p>
 * A block of genes only needs its own adjacency rows against all n genes: by symmetry
 * l_ij = sum_u a_iu a_ju, so L_B = A_B A_B^T still sums shared neighbours over the whole
 * network while the working set stays |B| x n. The product is a Jama matrix multiply,
 * one row chunk of A_B per task.
 */
public class TOMComputer {

	static Logger logger = Logger.getLogger(TOMComputer.class.getName());

	private static final String STAGE = "TOM";

	private final BlockExecutor executor;

	public TOMComputer(BlockExecutor executor) {
		this.executor = executor;
	}

	/**
	 * @param adjacencyRows |block| x n adjacency rows, row b belonging to gene block[b] and 0 at its own index
	 * @param block gene indices of the block
	 * @return |block| x |block| TOM, symmetric with unit diagonal
	 */
	public double[][] computeBlock(final double[][] adjacencyRows, final int[] block) {
		final int m = block.length;
		if(adjacencyRows.length != m) {
			throw new IllegalArgumentException("Got " + adjacencyRows.length + " adjacency rows for a block of " + m + " genes");
		}
		final double[] k = new double[m];
		for(int b = 0; b < m; b++) {
			double sum = 0;
			double[] row = adjacencyRows[b];
			for(int u = 0; u < row.length; u++) {
				sum += row[u];
			}
			if(Double.isNaN(sum) || Double.isInfinite(sum)) {
				throw new DegenerateInputException(STAGE, "adjacency", "non-finite connectivity for gene " + block[b]);
			}
			k[b] = sum;
		}

		if(m == 0) {
			return new double[0][0];
		}
		final int n = adjacencyRows[0].length;
		logger.debug("Shared neighbour product for a block of " + m + " genes over " + n + " genes");
		final Matrix ab = new Matrix(adjacencyRows);
		final Matrix abt = ab.transpose();
		final double[][] tom = new double[m][m];
		executor.forEachRange(m, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				double[][] shared = ab.getMatrix(start, end - 1, 0, n - 1).times(abt).getArray();
				for(int i = start; i < end; i++) {
					double[] li = shared[i - start];
					double[] ai = adjacencyRows[i];
					tom[i][i] = 1;
					for(int j = i + 1; j < m; j++) {
						double a = ai[block[j]];
						double value = (li[j] + a) / (Math.min(k[i], k[j]) + 1 - a);
						if(Double.isNaN(value) || Double.isInfinite(value)) {
							throw new DegenerateInputException(STAGE, "TOM", "non-finite overlap for genes " + block[i] + ", " + block[j]);
						}
						tom[i][j] = Math.min(1, Math.max(0, value));
					}
				}
			}
		});
		for(int i = 0; i < m; i++) {
			for(int j = 0; j < i; j++) {
				tom[i][j] = tom[j][i];
			}
		}
		return tom;
	}

	/**
	 * TOM of a full adjacency matrix. The diagonal of the input is treated as 0.
	 */
	public MatrixWithHeaders compute(MatrixWithHeaders adjacency) {
		int n = adjacency.rowDimension();
		if(n != adjacency.columnDimension()) {
			throw new IllegalArgumentException("TOM needs a square adjacency matrix, got " + adjacency);
		}
		double[][] rows = adjacency.getData().getArrayCopy();
		int[] block = new int[n];
		for(int i = 0; i < n; i++) {
			block[i] = i;
			rows[i][i] = 0;
		}
		return new MatrixWithHeaders(computeBlock(rows, block), adjacency.getRowNames(), adjacency.getColumnNames());
	}

	/**
	 * 1 - TOM, the distance used for clustering.
	 */
	public static double[][] dissimilarity(double[][] tom) {
		double[][] rtrn = new double[tom.length][];
		for(int i = 0; i < tom.length; i++) {
			rtrn[i] = new double[tom[i].length];
			for(int j = 0; j < tom[i].length; j++) {
				rtrn[i][j] = 1 - tom[i][j];
			}
		}
		return rtrn;
	}
}
