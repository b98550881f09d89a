package umms.wgcna.hub;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.exception.UnknownModuleException;
import umms.wgcna.ConfigurationWarning;
import umms.wgcna.module.ModuleAssignment;
import umms.wgcna.module.ModuleColors;
import umms.wgcna.trait.GeneSignificance;
import umms.wgcna.trait.MembershipStats;

/**
 * Filters the members of each module of interest down to its hub genes: genes with
 * |kME| above the membership threshold and a kME p-value below the significance threshold,
 * both measured against the gene's own module.
 */
public class HubGeneSelector {

	static Logger logger = Logger.getLogger(HubGeneSelector.class.getName());

	public static final double DEFAULT_KME_THRESHOLD = 0.7;
	public static final double DEFAULT_KME_PVALUE_THRESHOLD = 0.05;

	private final double kmeThreshold;
	private final double kmePValueThreshold;

	public HubGeneSelector() {
		this(DEFAULT_KME_THRESHOLD, DEFAULT_KME_PVALUE_THRESHOLD);
	}

	public HubGeneSelector(double kmeThreshold, double kmePValueThreshold) {
		if(kmeThreshold < 0 || kmeThreshold > 1) {
			throw new IllegalArgumentException("kME threshold must lie in [0,1], got " + kmeThreshold);
		}
		if(kmePValueThreshold <= 0 || kmePValueThreshold > 1) {
			throw new IllegalArgumentException("kME p-value threshold must lie in (0,1], got " + kmePValueThreshold);
		}
		this.kmeThreshold = kmeThreshold;
		this.kmePValueThreshold = kmePValueThreshold;
	}

	public double getKmeThreshold() {
		return kmeThreshold;
	}

	public double getKmePValueThreshold() {
		return kmePValueThreshold;
	}

	/**
	 * @param modulesOfInterest colour names, ME&lt;colour&gt; names or numeric ids; empty means every merged module
	 */
	public List<ModuleGeneReport> select(String analysisId, ModuleAssignment assignment, MembershipStats membership,
			GeneSignificance significance, Collection<String> modulesOfInterest) {
		List<Integer> modules = new ArrayList<Integer>();
		if(modulesOfInterest == null || modulesOfInterest.isEmpty()) {
			modules.addAll(assignment.getModules());
		} else {
			for(String label : modulesOfInterest) {
				int module = ModuleColors.idOf(label);
				if(module <= ModuleAssignment.UNASSIGNED || assignment.moduleSize(module) == 0 || !membership.hasModule(module)) {
					throw new UnknownModuleException(label);
				}
				if(!modules.contains(module)) {
					modules.add(module);
				}
			}
		}

		List<ModuleGeneReport> rtrn = new ArrayList<ModuleGeneReport>(modules.size());
		for(int module : modules) {
			List<String> members = assignment.getGenes(module);
			List<HubGene> hubs = new ArrayList<HubGene>();
			for(String gene : members) {
				double kme = membership.getKME(gene, module);
				double p = membership.getPValue(gene, module);
				if(Math.abs(kme) > kmeThreshold && p < kmePValueThreshold) {
					hubs.add(new HubGene(gene, module, kme, p, significance.getGS(gene), significance.getPValue(gene)));
				}
			}
			logger.info("Module " + ModuleColors.colorOf(module) + ": " + hubs.size() + " hub genes out of " + members.size());
			rtrn.add(new ModuleGeneReport(analysisId, module, members, hubs));
		}
		return rtrn;
	}

	/**
	 * One NO_HUB_GENES advisory per report with an empty hub list.
	 */
	public List<ConfigurationWarning> warnings(List<ModuleGeneReport> reports) {
		List<ConfigurationWarning> rtrn = new ArrayList<ConfigurationWarning>();
		for(ModuleGeneReport report : reports) {
			if(report.getHubs().isEmpty()) {
				rtrn.add(new ConfigurationWarning(ConfigurationWarning.Kind.NO_HUB_GENES, "Module " + report.getColor() + " ("
						+ report.getModule() + ") of " + report.getAllGenes().size() + " genes has no gene with |kME| > "
						+ kmeThreshold + " and kME p < " + kmePValueThreshold));
			}
		}
		return rtrn;
	}
}
