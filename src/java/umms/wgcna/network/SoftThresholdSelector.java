package umms.wgcna.network;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.math.Statistics;
import umms.core.utils.BlockExecutor;
import umms.wgcna.correlation.CorrelationEngine;

/**
 * Evaluates candidate soft-threshold powers by how well the resulting connectivity
 * distribution follows a power law.
 */
public class SoftThresholdSelector {

	static Logger logger = Logger.getLogger(SoftThresholdSelector.class.getName());

	public static final int DEFAULT_BREAKS = 10;

	private final CorrelationEngine engine;
	private final NetworkType networkType;
	private final int blockSize;

	public SoftThresholdSelector(CorrelationEngine engine, NetworkType networkType, int blockSize) {
		if(blockSize < 1) {
			throw new IllegalArgumentException("Block size must be positive, got " + blockSize);
		}
		this.engine = engine;
		this.networkType = networkType;
		this.blockSize = blockSize;
	}

	/**
	 * Default candidates: 1 to 10, then even powers up to 50.
	 */
	public static int[] defaultPowers() {
		int[] rtrn = new int[10 + 20];
		for(int i = 0; i < 10; i++) {
			rtrn[i] = i + 1;
		}
		for(int i = 0; i < 20; i++) {
			rtrn[10 + i] = 12 + 2 * i;
		}
		return rtrn;
	}

	public SoftThresholdTable evaluate(MatrixWithHeaders expression, final int[] powers) {
		final int n = expression.columnDimension();
		final double[][] columns = expression.toColumnArrays();
		final List<String> names = expression.getColumnNames();
		final double[][] connectivity = new double[powers.length][n];

		for(int start = 0; start < n; start += blockSize) {
			int end = Math.min(n, start + blockSize);
			final int[] block = new int[end - start];
			for(int b = 0; b < block.length; b++) {
				block[b] = start + b;
			}
			logger.debug("Connectivity of genes " + start + " to " + end + " for " + powers.length + " powers");
			final double[][] cor = engine.correlationRows(columns, names, block);
			engine.getExecutor().forEachRange(block.length, new BlockExecutor.RangeTask() {
				public void run(int s, int e) {
					for(int b = s; b < e; b++) {
						double[] row = cor[b];
						for(int p = 0; p < powers.length; p++) {
							double k = 0;
							for(int g = 0; g < row.length; g++) {
								if(g != block[b]) {
									k += networkType.adjacency(row[g], powers[p]);
								}
							}
							connectivity[p][block[b]] = k;
						}
					}
				}
			});
		}

		List<SoftThresholdFit> fits = new ArrayList<SoftThresholdFit>(powers.length);
		for(int p = 0; p < powers.length; p++) {
			SoftThresholdFit fit = scaleFreeFit(powers[p], connectivity[p], DEFAULT_BREAKS);
			logger.info("Power " + powers[p] + ": scale-free R^2 " + fit.getScaleFreeRSquared() + ", mean connectivity " + fit.getMeanConnectivity());
			fits.add(fit);
		}
		return new SoftThresholdTable(fits);
	}

	/**
	 * Fits log10 p(k) against log10 k over nBreaks equal-width connectivity bins.
	 * Bin centres are the mean connectivity of the bin, or its midpoint when the bin is
	 * empty or its mean is 0.
	 */
	public static SoftThresholdFit scaleFreeFit(int power, double[] k, int nBreaks) {
		double mean = Statistics.mean(k);
		double median = Statistics.median(k);
		double max = Statistics.max(k);
		double min = Statistics.min(k);
		if(!(max > min)) {
			return new SoftThresholdFit(power, Double.NaN, Double.NaN, Double.NaN, mean, median, max);
		}

		double width = (max - min) / nBreaks;
		double[] binSum = new double[nBreaks];
		int[] binCount = new int[nBreaks];
		for(int i = 0; i < k.length; i++) {
			int bin = Math.min(nBreaks - 1, (int) Math.floor((k[i] - min) / width));
			binSum[bin] += k[i];
			binCount[bin]++;
		}

		double[] logDk = new double[nBreaks];
		double[] logPk = new double[nBreaks];
		double[][] truncatedX = new double[nBreaks][2];
		SimpleRegression regression = new SimpleRegression();
		for(int b = 0; b < nBreaks; b++) {
			double dk = binCount[b] > 0 ? binSum[b] / binCount[b] : 0;
			if(dk == 0) {
				dk = min + (b + 0.5) * width;
			}
			logDk[b] = Math.log10(dk);
			logPk[b] = Math.log10(binCount[b] / (double) k.length + 1e-9);
			truncatedX[b][0] = logDk[b];
			truncatedX[b][1] = dk;
			regression.addData(logDk[b], logPk[b]);
		}
		double slope = regression.getSlope();
		double rSquared = -Math.signum(slope) * regression.getRSquare();

		return new SoftThresholdFit(power, rSquared, slope, truncatedFit(logPk, truncatedX), mean, median, max);
	}

	private static double truncatedFit(double[] y, double[][] x) {
		OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
		try {
			ols.newSampleData(y, x);
			return ols.calculateAdjustedRSquared();
		} catch (SingularMatrixException e) {
			logger.debug("Truncated exponential fit is singular: " + e.getMessage());
			return Double.NaN;
		}
	}
}
