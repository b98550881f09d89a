package umms.wgcna.trait;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.correlation.CorrelationResult;
import umms.wgcna.module.ModuleEigengenes;

/**
 * Gene level statistics: module membership (kME) and gene significance (GS).
 */
public class MembershipAnalyzer {

	static Logger logger = Logger.getLogger(MembershipAnalyzer.class.getName());

	private final CorrelationEngine engine;

	public MembershipAnalyzer(CorrelationEngine engine) {
		this.engine = engine;
	}

	/**
	 * @param expression samples x genes
	 * @return kME of every gene against every eigengene
	 */
	public MembershipStats moduleMembership(MatrixWithHeaders expression, ModuleEigengenes eigengenes) {
		TraitCorrelator.checkAligned(expression, "expression", eigengenes.getEigengenes(), "eigengenes");
		logger.info("Computing membership of " + expression.columnDimension() + " genes in " + eigengenes.size() + " modules");
		CorrelationResult result = engine.correlate(expression, eigengenes.getEigengenes());
		return new MembershipStats(result.getCorrelations(), result.getPValues(), eigengenes);
	}

	/**
	 * Correlation of every gene with one trait column. A constant trait has no defined
	 * correlation and fails with a DegenerateInputException.
	 */
	public GeneSignificance geneSignificance(MatrixWithHeaders expression, MatrixWithHeaders traits, String trait) {
		TraitCorrelator.checkAligned(expression, "expression", traits, "traits");
		if(!traits.hasColumn(trait)) {
			throw new IllegalArgumentException("Unknown trait " + trait + ", traits are " + traits.getColumnNames());
		}
		List<String> selected = new ArrayList<String>();
		selected.add(trait);
		logger.info("Computing significance of " + expression.columnDimension() + " genes for trait " + trait);
		CorrelationResult result = engine.correlate(expression, traits.submatrixByColumnNames(selected));

		int n = expression.columnDimension();
		double[] gs = new double[n];
		double[] p = new double[n];
		for(int i = 0; i < n; i++) {
			gs[i] = result.getCorrelations().get(i, 0);
			p[i] = result.getPValues().get(i, 0);
		}
		return new GeneSignificance(trait, expression.getColumnNames(), gs, p);
	}
}
