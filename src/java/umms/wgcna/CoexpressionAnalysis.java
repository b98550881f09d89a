package umms.wgcna;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.core.exception.InsufficientSamplesException;
import umms.core.math.Statistics;
import umms.core.utils.BlockExecutor;
import umms.wgcna.clustering.DynamicTreeCut;
import umms.wgcna.clustering.HierarchicalClustering;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.hub.HubGeneSelector;
import umms.wgcna.hub.ModuleGeneReport;
import umms.wgcna.module.BlockwiseModuleDetector;
import umms.wgcna.module.EigengeneCalculator;
import umms.wgcna.module.ModuleDetectionResult;
import umms.wgcna.module.ModuleDetector;
import umms.wgcna.network.AdjacencyTransformer;
import umms.wgcna.network.SoftThresholdSelector;
import umms.wgcna.network.SoftThresholdTable;
import umms.wgcna.trait.GeneSignificance;
import umms.wgcna.trait.MembershipAnalyzer;
import umms.wgcna.trait.MembershipStats;
import umms.wgcna.trait.ModuleTraitStats;
import umms.wgcna.trait.TraitCorrelator;

/**
 * Runs the whole network analysis for one data set: power table, blockwise module
 * detection, module-trait correlation, membership, gene significance and hub genes.
 * Each stage gets its collaborators through constructors; stages share no state.
 */
public class CoexpressionAnalysis {

	static Logger logger = Logger.getLogger(CoexpressionAnalysis.class.getName());

	private static final String STAGE = "input";

	private final AnalysisConfig config;

	public CoexpressionAnalysis(AnalysisConfig config) {
		config.validate();
		this.config = config;
	}

	public AnalysisConfig getConfig() {
		return config;
	}

	/**
	 * @param expression samples x genes, no missing values
	 * @param traits samples x traits; rows are reordered to the expression samples
	 */
	public AnalysisResult run(MatrixWithHeaders expression, MatrixWithHeaders traits) {
		logger.info("Starting analysis " + config.getAnalysisId() + " on " + expression.rowDimension() + " samples x "
				+ expression.columnDimension() + " genes");
		logger.debug(config);
		validateExpression(expression);
		MatrixWithHeaders alignedTraits = alignTraits(expression, traits);
		List<ConfigurationWarning> warnings = new ArrayList<ConfigurationWarning>();

		BlockExecutor executor = new BlockExecutor(config.getThreads());
		try {
			CorrelationEngine engine = new CorrelationEngine(CorrelationEngine.functionForName(config.getCorrelation()), executor);

			SoftThresholdTable table = new SoftThresholdSelector(engine, config.getNetworkType(), config.getMaxBlockSize())
					.evaluate(expression, config.getCandidatePowers());
			int suggested = table.firstPowerAbove(config.getTargetRSquared());
			logger.info("Using power " + config.getPower() + (suggested > 0 ? "; the first power above R^2 " + config.getTargetRSquared() + " is " + suggested : ""));
			warnings.addAll(table.checkPower(config.getPower(), config.getTargetRSquared()));

			ModuleDetector detector = new ModuleDetector(new HierarchicalClustering(config.getLinkage()),
					new DynamicTreeCut(config.getMinModuleSize(), config.getDeepSplit(), config.getCutHeight()),
					new EigengeneCalculator(), engine.getFunction(), config.getMergeCutHeight());
			BlockwiseModuleDetector blockwise = new BlockwiseModuleDetector(engine,
					new AdjacencyTransformer(config.getNetworkType(), config.getPower()), detector, config.getMaxBlockSize());
			ModuleDetectionResult modules = blockwise.detect(expression);
			warnings.addAll(modules.getWarnings());
			logger.info(modules.getAssignment().getModules().size() + " modules, " + modules.getAssignment().unassignedCount() + " genes unassigned");

			ModuleTraitStats traitStats = new TraitCorrelator(engine).correlate(modules.getEigengenes(), alignedTraits);
			MembershipAnalyzer membershipAnalyzer = new MembershipAnalyzer(engine);
			MembershipStats membership = membershipAnalyzer.moduleMembership(expression, modules.getEigengenes());
			String trait = config.getGeneSignificanceTrait() != null ? config.getGeneSignificanceTrait() : alignedTraits.getColumnName(0);
			GeneSignificance significance = membershipAnalyzer.geneSignificance(expression, alignedTraits, trait);

			List<ModuleGeneReport> reports = new ArrayList<ModuleGeneReport>();
			if(!modules.getAssignment().getModules().isEmpty() || !config.getModulesOfInterest().isEmpty()) {
				HubGeneSelector selector = new HubGeneSelector(config.getKmeThreshold(), config.getKmePValueThreshold());
				reports = selector.select(config.getAnalysisId(), modules.getAssignment(), membership, significance, config.getModulesOfInterest());
				warnings.addAll(selector.warnings(reports));
			}

			for(ConfigurationWarning warning : warnings) {
				logger.warn(warning);
			}
			logger.info("Analysis " + config.getAnalysisId() + " done");
			return new AnalysisResult(config, expression, alignedTraits, table, modules, traitStats, membership, significance, reports, warnings);
		} finally {
			executor.shutdown();
		}
	}

	/**
	 * Rejects expression data the network cannot be built from: fewer than 3 samples,
	 * missing or infinite values, constant genes.
	 */
	static void validateExpression(MatrixWithHeaders expression) {
		if(expression.columnDimension() == 0) {
			throw new IllegalArgumentException("Expression matrix has no genes");
		}
		if(expression.rowDimension() < 3) {
			String gene = expression.getColumnName(0);
			throw new InsufficientSamplesException(gene, gene, expression.rowDimension());
		}
		for(int g = 0; g < expression.columnDimension(); g++) {
			double[] column = expression.getColumn(g);
			if(!Statistics.allFinite(column)) {
				throw new DegenerateInputException(STAGE, "expression", "missing or infinite value for gene " + expression.getColumnName(g));
			}
			if(Statistics.variance(column) == 0) {
				throw new DegenerateInputException(STAGE, "expression", "zero variance for gene " + expression.getColumnName(g));
			}
		}
	}

	/**
	 * Orders the trait rows like the expression samples. Every expression sample needs a trait row.
	 */
	static MatrixWithHeaders alignTraits(MatrixWithHeaders expression, MatrixWithHeaders traits) {
		if(traits.columnDimension() == 0) {
			throw new IllegalArgumentException("Trait matrix has no trait columns");
		}
		List<String> missing = new ArrayList<String>();
		for(String sample : expression.getRowNames()) {
			if(!traits.hasRow(sample)) {
				missing.add(sample);
			}
		}
		if(!missing.isEmpty()) {
			throw new IllegalArgumentException("Samples of expression missing from traits: " + missing);
		}
		for(int t = 0; t < traits.columnDimension(); t++) {
			for(double v : traits.getColumn(t)) {
				if(Double.isInfinite(v)) {
					throw new DegenerateInputException(STAGE, "traits", "infinite value for trait " + traits.getColumnName(t));
				}
			}
		}
		if(traits.getRowNames().equals(expression.getRowNames())) {
			return traits;
		}
		logger.debug("Reordering trait rows to the expression sample order");
		return traits.submatrixByRowNames(expression.getRowNames());
	}
}
