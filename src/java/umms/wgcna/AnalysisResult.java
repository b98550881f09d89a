package umms.wgcna;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import umms.core.datastructures.MatrixWithHeaders;
import umms.wgcna.hub.ModuleGeneReport;
import umms.wgcna.module.ModuleDetectionResult;
import umms.wgcna.network.SoftThresholdTable;
import umms.wgcna.trait.GeneSignificance;
import umms.wgcna.trait.MembershipStats;
import umms.wgcna.trait.ModuleTraitStats;

/**
 * Everything one analysis run produces.
 */
public class AnalysisResult {

	private final AnalysisConfig config;
	private final MatrixWithHeaders expression;
	private final MatrixWithHeaders traits;
	private final SoftThresholdTable softThreshold;
	private final ModuleDetectionResult modules;
	private final ModuleTraitStats moduleTraitStats;
	private final MembershipStats membership;
	private final GeneSignificance geneSignificance;
	private final List<ModuleGeneReport> reports;
	private final List<ConfigurationWarning> warnings;

	public AnalysisResult(AnalysisConfig config, MatrixWithHeaders expression, MatrixWithHeaders traits, SoftThresholdTable softThreshold,
			ModuleDetectionResult modules, ModuleTraitStats moduleTraitStats, MembershipStats membership,
			GeneSignificance geneSignificance, List<ModuleGeneReport> reports, List<ConfigurationWarning> warnings) {
		this.config = config;
		this.expression = expression;
		this.traits = traits;
		this.softThreshold = softThreshold;
		this.modules = modules;
		this.moduleTraitStats = moduleTraitStats;
		this.membership = membership;
		this.geneSignificance = geneSignificance;
		this.reports = Collections.unmodifiableList(new ArrayList<ModuleGeneReport>(reports));
		this.warnings = Collections.unmodifiableList(new ArrayList<ConfigurationWarning>(warnings));
	}

	public AnalysisConfig getConfig() {
		return config;
	}

	public String getAnalysisId() {
		return config.getAnalysisId();
	}

	/**
	 * The validated samples x genes matrix the network was built from.
	 */
	public MatrixWithHeaders getExpression() {
		return expression;
	}

	/**
	 * Trait matrix with rows in expression sample order.
	 */
	public MatrixWithHeaders getTraits() {
		return traits;
	}

	public SoftThresholdTable getSoftThreshold() {
		return softThreshold;
	}

	public ModuleDetectionResult getModules() {
		return modules;
	}

	public ModuleTraitStats getModuleTraitStats() {
		return moduleTraitStats;
	}

	public MembershipStats getMembership() {
		return membership;
	}

	public GeneSignificance getGeneSignificance() {
		return geneSignificance;
	}

	public List<ModuleGeneReport> getReports() {
		return reports;
	}

	public List<ConfigurationWarning> getWarnings() {
		return warnings;
	}
}
