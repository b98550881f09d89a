package umms.core.math;

import java.util.Arrays;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

public class Statistics {

	private static final NaturalRanking AVERAGE_RANKING = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE);

	public static double mean(double [] values) {
		double sum = 0;
		for(int i = 0; i < values.length; i++) {
			sum += values[i];
		}
		return sum / (double) values.length;
	}

	public static double sum(double[] vals){
		double sum=0;
		for(int i=0; i<vals.length; i++){sum+=vals[i];}
		return sum;
	}

	public static double max(double[] vals){
		double max=Double.NEGATIVE_INFINITY;
		for(int i=0; i<vals.length; i++){max=Math.max(max, vals[i]);}
		return max;
	}

	public static double min(double[] vals){
		double min=Double.POSITIVE_INFINITY;
		for(int i=0; i<vals.length; i++){min=Math.min(min, vals[i]);}
		return min;
	}

	/**
	 * Sample variance (n - 1 denominator).
	 */
	public static double variance(double [] values) {
		return variance(values, mean(values));
	}

	public static double variance(double [] values, double mean) {
		if(values.length < 2) {
			return 0;
		}
		double ss = 0;
		for(int i = 0; i < values.length; i++) {
			double d = values[i] - mean;
			ss += d * d;
		}
		return ss / (double) (values.length - 1);
	}

	public static double stdev(double[] values){
		return Math.sqrt(variance(values));
	}

	public static double median(double[] list){
		double[] sorted = Arrays.copyOf(list, list.length);
		Arrays.sort(sorted);
		if(sorted.length == 0) {
			return Double.NaN;
		}
		if(sorted.length%2==0){
			return (sorted[sorted.length/2] + sorted[(sorted.length/2)-1]) / 2.0;
		}
		return sorted[sorted.length/2];
	}

	/**
	 * Centers and scales a vector to mean 0 and unit sample variance.
	 * @return null when the vector has zero variance
	 */
	public static double[] standardize(double[] values) {
		double mean = mean(values);
		double sd = Math.sqrt(variance(values, mean));
		if(!(sd > 0)) {
			return null;
		}
		double[] rtrn = new double[values.length];
		for(int i = 0; i < values.length; i++) {
			rtrn[i] = (values[i] - mean) / sd;
		}
		return rtrn;
	}

	/**
	 * Two-pass Pearson correlation. Returns NaN when either vector is constant,
	 * otherwise a value clamped to [-1, 1].
	 */
	public static double pearsonCorrelation(double[] x, double[] y){
		if(x.length != y.length) {
			throw new IllegalArgumentException("Vectors have different lengths: " + x.length + " and " + y.length);
		}
		double meanX = mean(x);
		double meanY = mean(y);
		double sxx = 0;
		double syy = 0;
		double sxy = 0;
		for (int i=0; i<x.length; i++){
			double dx = x[i] - meanX;
			double dy = y[i] - meanY;
			sxx += dx * dx;
			syy += dy * dy;
			sxy += dx * dy;
		}
		if(sxx == 0 || syy == 0) {
			return Double.NaN;
		}
		double r = sxy / Math.sqrt(sxx * syy);
		return Math.max(-1, Math.min(1, r));
	}

	public static double spearmanCorrelation(double [] x, double [] y){
		return pearsonCorrelation(rank(x), rank(y));
	}

	/**
	 * Ranks, ties get their average rank.
	 */
	public static double[] rank(double[] vals){
		return AVERAGE_RANKING.rank(vals);
	}

	/**
	 * Two-sided p-value of a correlation coefficient using the Student t approximation
	 * t = r * sqrt((n-2)/(1-r^2)) with n - 2 degrees of freedom.
	 */
	public static double correlationPValue(double r, int n) {
		if(n < 3) {
			throw new IllegalArgumentException("A correlation p-value needs at least 3 observations, got " + n);
		}
		if(Double.isNaN(r)) {
			return Double.NaN;
		}
		double oneMinusR2 = 1 - r * r;
		if(oneMinusR2 <= 0) {
			return 0;
		}
		double t = Math.abs(r) * Math.sqrt((n - 2) / oneMinusR2);
		TDistribution dist = new TDistribution((RandomGenerator) null, n - 2);
		return Math.min(1, 2 * dist.cumulativeProbability(-t));
	}

	public static boolean isFinite(double value) {
		return !Double.isNaN(value) && !Double.isInfinite(value);
	}

	public static boolean allFinite(double[] values) {
		for(int i = 0; i < values.length; i++) {
			if(!isFinite(values[i])) {
				return false;
			}
		}
		return true;
	}
}
