package umms.wgcna.hub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import umms.wgcna.module.ModuleColors;

/**
 * Every gene of one module of interest plus its hub subset, keyed by analysis id and module.
 */
public class ModuleGeneReport {

	private final String analysisId;
	private final int module;
	private final List<String> allGenes;
	private final List<HubGene> hubs;

	public ModuleGeneReport(String analysisId, int module, List<String> allGenes, List<HubGene> hubs) {
		this.analysisId = analysisId;
		this.module = module;
		this.allGenes = Collections.unmodifiableList(new ArrayList<String>(allGenes));
		this.hubs = Collections.unmodifiableList(new ArrayList<HubGene>(hubs));
	}

	public String getAnalysisId() {
		return analysisId;
	}

	public int getModule() {
		return module;
	}

	public String getColor() {
		return ModuleColors.colorOf(module);
	}

	public List<String> getAllGenes() {
		return allGenes;
	}

	public List<HubGene> getHubs() {
		return hubs;
	}

	/**
	 * File name stem shared by this module's gene lists.
	 */
	public String getName() {
		return analysisId + "_" + getColor();
	}
}
