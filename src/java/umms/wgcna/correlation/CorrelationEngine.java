package umms.wgcna.correlation;

import java.util.List;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.core.exception.InsufficientSamplesException;
import umms.core.math.Statistics;
import umms.core.utils.BlockExecutor;

/**
 * Pairwise correlation between matrix columns using pairwise-complete observations.
 * The correlation routine itself is a {@link CorrelationFunction} handed in by the caller.
 */
public class CorrelationEngine {

	static Logger logger = Logger.getLogger(CorrelationEngine.class.getName());

	private static final String STAGE = "correlation";

	private final CorrelationFunction function;
	private final BlockExecutor executor;

	public CorrelationEngine() {
		this(new PearsonCorrelation(), BlockExecutor.withAvailableProcessors());
	}

	public CorrelationEngine(CorrelationFunction function, BlockExecutor executor) {
		this.function = function;
		this.executor = executor;
	}

	public static CorrelationFunction functionForName(String name) {
		if("pearson".equalsIgnoreCase(name)) {
			return new PearsonCorrelation();
		} else if("spearman".equalsIgnoreCase(name)) {
			return new SpearmanCorrelation();
		}
		throw new IllegalArgumentException("Invalid correlation function name: " + name + " only pearson and spearman are supported");
	}

	public CorrelationFunction getFunction() {
		return function;
	}

	public BlockExecutor getExecutor() {
		return executor;
	}

	/**
	 * Correlates every column of x with every column of y. Both matrices must have the
	 * same number of rows, in the same order.
	 */
	public CorrelationResult correlate(MatrixWithHeaders x, MatrixWithHeaders y) {
		if(x.rowDimension() != y.rowDimension()) {
			throw new IllegalArgumentException("Cannot correlate " + x + " with " + y + ": row counts differ");
		}
		logger.debug("Correlating " + x.columnDimension() + " x " + y.columnDimension() + " columns");
		final double[][] xCols = x.toColumnArrays();
		final double[][] yCols = y.toColumnArrays();
		final List<String> xNames = x.getColumnNames();
		final List<String> yNames = y.getColumnNames();
		final boolean[] xComplete = completeness(xCols);
		final boolean[] yComplete = completeness(yCols);

		final double[][] cor = new double[xCols.length][yCols.length];
		final double[][] p = new double[xCols.length][yCols.length];
		final double[][] n = new double[xCols.length][yCols.length];

		executor.forEachRange(xCols.length, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				int[] nObs = new int[1];
				for(int i = start; i < end; i++) {
					for(int j = 0; j < yCols.length; j++) {
						double r = pairCorrelation(xCols[i], yCols[j], xComplete[i] && yComplete[j], xNames.get(i), yNames.get(j), nObs);
						cor[i][j] = r;
						n[i][j] = nObs[0];
						p[i][j] = Statistics.correlationPValue(r, nObs[0]);
					}
				}
			}
		});

		return new CorrelationResult(new MatrixWithHeaders(cor, xNames, yNames),
				new MatrixWithHeaders(p, xNames, yNames),
				new MatrixWithHeaders(n, xNames, yNames));
	}

	/**
	 * Correlation matrix of the columns of x. Symmetric, diagonal exactly 1.
	 */
	public CorrelationResult correlate(MatrixWithHeaders x) {
		final double[][] cols = x.toColumnArrays();
		final List<String> names = x.getColumnNames();
		final boolean[] complete = completeness(cols);
		final int size = cols.length;

		final double[][] cor = new double[size][size];
		final double[][] p = new double[size][size];
		final double[][] n = new double[size][size];

		executor.forEachRange(size, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				int[] nObs = new int[1];
				for(int i = start; i < end; i++) {
					for(int j = i; j < size; j++) {
						double r = pairCorrelation(cols[i], cols[j], complete[i] && complete[j], names.get(i), names.get(j), nObs);
						if(i == j) {
							r = 1;
						}
						cor[i][j] = r;
						n[i][j] = nObs[0];
						p[i][j] = Statistics.correlationPValue(r, nObs[0]);
					}
				}
			}
		});
		for(int i = 0; i < size; i++) {
			for(int j = 0; j < i; j++) {
				cor[i][j] = cor[j][i];
				p[i][j] = p[j][i];
				n[i][j] = n[j][i];
			}
		}

		return new CorrelationResult(new MatrixWithHeaders(cor, names, names),
				new MatrixWithHeaders(p, names, names),
				new MatrixWithHeaders(n, names, names));
	}

	/**
	 * Correlations of the block's columns against all columns, without p-values.
	 * Entry [b][g] is cor(columns[block[b]], columns[g]); self correlations are exactly 1.
	 */
	public double[][] correlationRows(final double[][] columns, final List<String> names, final int[] block) {
		final double[][] rtrn = new double[block.length][columns.length];
		final boolean[] complete = completeness(columns);
		boolean allComplete = true;
		for(boolean c : complete) {
			allComplete &= c;
		}

		if(allComplete && function instanceof PearsonCorrelation) {
			final double[][] unit = unitColumns(columns, names);
			executor.forEachRange(block.length, new BlockExecutor.RangeTask() {
				public void run(int start, int end) {
					for(int b = start; b < end; b++) {
						double[] u = unit[block[b]];
						for(int g = 0; g < unit.length; g++) {
							double r = 0;
							double[] v = unit[g];
							for(int s = 0; s < u.length; s++) {
								r += u[s] * v[s];
							}
							rtrn[b][g] = Math.max(-1, Math.min(1, r));
						}
						rtrn[b][block[b]] = 1;
					}
				}
			});
			return rtrn;
		}

		executor.forEachRange(block.length, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				int[] nObs = new int[1];
				for(int b = start; b < end; b++) {
					int i = block[b];
					for(int g = 0; g < columns.length; g++) {
						rtrn[b][g] = pairCorrelation(columns[i], columns[g], complete[i] && complete[g], names.get(i), names.get(g), nObs);
					}
					rtrn[b][i] = 1;
				}
			}
		});
		return rtrn;
	}

	/**
	 * Correlation of a single pair of named vectors.
	 */
	public double correlate(String nameX, double[] x, String nameY, double[] y) {
		return pairCorrelation(x, y, Statistics.allFinite(x) && Statistics.allFinite(y), nameX, nameY, new int[1]);
	}

	double pairCorrelation(double[] x, double[] y, boolean complete, String nameX, String nameY, int[] nObs) {
		double[] a = x;
		double[] b = y;
		if(!complete) {
			int n = 0;
			for(int s = 0; s < x.length; s++) {
				if(!Double.isNaN(x[s]) && !Double.isNaN(y[s])) {
					n++;
				}
			}
			a = new double[n];
			b = new double[n];
			int k = 0;
			for(int s = 0; s < x.length; s++) {
				if(!Double.isNaN(x[s]) && !Double.isNaN(y[s])) {
					a[k] = x[s];
					b[k] = y[s];
					k++;
				}
			}
		}
		nObs[0] = a.length;
		if(a.length < 3) {
			throw new InsufficientSamplesException(nameX, nameY, a.length);
		}
		if(!Statistics.allFinite(a) || !Statistics.allFinite(b)) {
			throw new DegenerateInputException(STAGE, nameX + " vs " + nameY, "infinite values");
		}
		double r = function.measure(a, b);
		if(Double.isNaN(r)) {
			throw new DegenerateInputException(STAGE, nameX + " vs " + nameY,
					"correlation undefined, zero variance over " + a.length + " complete observations");
		}
		return r;
	}

	private double[][] unitColumns(double[][] columns, List<String> names) {
		double[][] unit = new double[columns.length][];
		for(int g = 0; g < columns.length; g++) {
			if(columns[g].length < 3) {
				throw new InsufficientSamplesException(names.get(g), names.get(g), columns[g].length);
			}
			if(!Statistics.allFinite(columns[g])) {
				throw new DegenerateInputException(STAGE, names.get(g), "infinite values");
			}
			double[] z = Statistics.standardize(columns[g]);
			if(z == null) {
				throw new DegenerateInputException(STAGE, names.get(g), "zero variance");
			}
			double scale = 1.0 / Math.sqrt(z.length - 1);
			for(int s = 0; s < z.length; s++) {
				z[s] *= scale;
			}
			unit[g] = z;
		}
		return unit;
	}

	private static boolean[] completeness(double[][] cols) {
		boolean[] rtrn = new boolean[cols.length];
		for(int j = 0; j < cols.length; j++) {
			boolean complete = true;
			for(int s = 0; s < cols[j].length && complete; s++) {
				complete = !Double.isNaN(cols[j][s]);
			}
			rtrn[j] = complete;
		}
		return rtrn;
	}
}
