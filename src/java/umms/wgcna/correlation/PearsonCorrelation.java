package umms.wgcna.correlation;

import umms.core.math.Statistics;

public class PearsonCorrelation implements CorrelationFunction {

	public double measure(double[] a, double[] b) {
		return Statistics.pearsonCorrelation(a, b);
	}

	public String getName(){return "pearson";}

}
