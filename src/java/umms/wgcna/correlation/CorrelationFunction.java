package umms.wgcna.correlation;

/**
 * Correlation between two equally long vectors without missing values.
 * Implementations return NaN when the correlation is undefined (a constant vector).
 */
public interface CorrelationFunction {
	String getName();
	double measure(double [] a, double [] b);
}
