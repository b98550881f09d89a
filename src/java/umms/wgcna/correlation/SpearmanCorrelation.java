package umms.wgcna.correlation;

import umms.core.math.Statistics;

public class SpearmanCorrelation implements CorrelationFunction {

	public double measure(double[] a, double[] b) {
		return Statistics.spearmanCorrelation(a, b);
	}

	public String getName(){return "spearman";}

}
