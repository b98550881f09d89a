package umms.wgcna.trait;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.correlation.CorrelationResult;
import umms.wgcna.module.ModuleEigengenes;

/**
 * Correlates module eigengenes with the trait columns.
 */
public class TraitCorrelator {

	static Logger logger = Logger.getLogger(TraitCorrelator.class.getName());

	private final CorrelationEngine engine;

	public TraitCorrelator(CorrelationEngine engine) {
		this.engine = engine;
	}

	public ModuleTraitStats correlate(ModuleEigengenes eigengenes, MatrixWithHeaders traits) {
		MatrixWithHeaders me = eigengenes.getEigengenes();
		checkAligned(me, "eigengenes", traits, "traits");
		logger.info("Correlating " + me.columnDimension() + " eigengenes with " + traits.columnDimension() + " traits");
		CorrelationResult result = engine.correlate(me, traits);
		return new ModuleTraitStats(result.getCorrelations(), result.getPValues());
	}

	/**
	 * Both matrices must list the same samples in the same order.
	 */
	static void checkAligned(MatrixWithHeaders x, String xName, MatrixWithHeaders y, String yName) {
		if(!x.getRowNames().equals(y.getRowNames())) {
			throw new IllegalArgumentException("Samples of " + xName + " (" + x.rowDimension() + ") and " + yName + " ("
					+ y.rowDimension() + ") are not aligned; both need the same sample names in the same order");
		}
	}
}
