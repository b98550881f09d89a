package umms.wgcna;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import umms.wgcna.clustering.DynamicTreeCut;
import umms.wgcna.clustering.HierarchicalClustering;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.hub.HubGeneSelector;
import umms.wgcna.module.BlockwiseModuleDetector;
import umms.wgcna.module.ModuleDetector;
import umms.wgcna.network.NetworkType;
import umms.wgcna.network.SoftThresholdSelector;

/**
 * Parameters of one co-expression analysis. All values are explicit; nothing is read from
 * global state. The soft-threshold power and the modules of interest are decisions made by
 * the caller, the analysis only reports how well they fit.
 */
public class AnalysisConfig {

	public static final int DEFAULT_POWER = 6;
	public static final double DEFAULT_TARGET_R_SQUARED = 0.80;
	public static final int DEFAULT_MIN_MODULE_SIZE = 30;
	public static final int DEFAULT_DEEP_SPLIT = 2;
	public static final double DEFAULT_CUT_HEIGHT = 0.995;

	private String analysisId = "analysis";
	private int[] candidatePowers = SoftThresholdSelector.defaultPowers();
	private int power = DEFAULT_POWER;
	private double targetRSquared = DEFAULT_TARGET_R_SQUARED;
	private NetworkType networkType = NetworkType.SIGNED;
	private String correlation = "pearson";
	private String linkage = "average";
	private int minModuleSize = DEFAULT_MIN_MODULE_SIZE;
	private int deepSplit = DEFAULT_DEEP_SPLIT;
	private double cutHeight = DEFAULT_CUT_HEIGHT;
	private double mergeCutHeight = ModuleDetector.DEFAULT_MERGE_CUT_HEIGHT;
	private int maxBlockSize = BlockwiseModuleDetector.DEFAULT_MAX_BLOCK_SIZE;
	private int threads = Runtime.getRuntime().availableProcessors();
	private double kmeThreshold = HubGeneSelector.DEFAULT_KME_THRESHOLD;
	private double kmePValueThreshold = HubGeneSelector.DEFAULT_KME_PVALUE_THRESHOLD;
	private String geneSignificanceTrait;
	private List<String> modulesOfInterest = new ArrayList<String>();

	/**
	 * @throws IllegalArgumentException naming the first out of range value
	 */
	public void validate() {
		if(analysisId == null || analysisId.trim().isEmpty()) {
			throw new IllegalArgumentException("Analysis id must not be empty");
		}
		if(candidatePowers == null || candidatePowers.length == 0) {
			throw new IllegalArgumentException("At least one candidate power is required");
		}
		for(int p : candidatePowers) {
			if(p < 1) {
				throw new IllegalArgumentException("Candidate powers must be positive, got " + p);
			}
		}
		if(power < 1) {
			throw new IllegalArgumentException("Power must be positive, got " + power);
		}
		if(!(targetRSquared > 0 && targetRSquared <= 1)) {
			throw new IllegalArgumentException("Target scale-free R^2 must lie in (0,1], got " + targetRSquared);
		}
		if(networkType == null) {
			throw new IllegalArgumentException("Network type is required");
		}
		CorrelationEngine.functionForName(correlation);
		new HierarchicalClustering(linkage);
		if(minModuleSize < 1) {
			throw new IllegalArgumentException("Minimum module size must be at least 1, got " + minModuleSize);
		}
		if(deepSplit < 0 || deepSplit > DynamicTreeCut.MAX_DEEP_SPLIT) {
			throw new IllegalArgumentException("deepSplit must be between 0 and " + DynamicTreeCut.MAX_DEEP_SPLIT + ", got " + deepSplit);
		}
		if(!(cutHeight > 0)) {
			throw new IllegalArgumentException("Cut height must be positive, got " + cutHeight);
		}
		if(!(mergeCutHeight >= 0 && mergeCutHeight <= 2)) {
			throw new IllegalArgumentException("Merge cut height must lie in [0,2], got " + mergeCutHeight);
		}
		if(maxBlockSize < 1) {
			throw new IllegalArgumentException("Maximum block size must be positive, got " + maxBlockSize);
		}
		if(threads < 1) {
			throw new IllegalArgumentException("Thread count must be positive, got " + threads);
		}
		if(!(kmeThreshold >= 0 && kmeThreshold <= 1)) {
			throw new IllegalArgumentException("kME threshold must lie in [0,1], got " + kmeThreshold);
		}
		if(!(kmePValueThreshold > 0 && kmePValueThreshold <= 1)) {
			throw new IllegalArgumentException("kME p-value threshold must lie in (0,1], got " + kmePValueThreshold);
		}
	}

	public String getAnalysisId() {
		return analysisId;
	}

	public void setAnalysisId(String analysisId) {
		this.analysisId = analysisId;
	}

	public int[] getCandidatePowers() {
		return Arrays.copyOf(candidatePowers, candidatePowers.length);
	}

	public void setCandidatePowers(int[] candidatePowers) {
		this.candidatePowers = Arrays.copyOf(candidatePowers, candidatePowers.length);
	}

	public int getPower() {
		return power;
	}

	public void setPower(int power) {
		this.power = power;
	}

	public double getTargetRSquared() {
		return targetRSquared;
	}

	public void setTargetRSquared(double targetRSquared) {
		this.targetRSquared = targetRSquared;
	}

	public NetworkType getNetworkType() {
		return networkType;
	}

	public void setNetworkType(NetworkType networkType) {
		this.networkType = networkType;
	}

	public String getCorrelation() {
		return correlation;
	}

	public void setCorrelation(String correlation) {
		this.correlation = correlation;
	}

	public String getLinkage() {
		return linkage;
	}

	public void setLinkage(String linkage) {
		this.linkage = linkage;
	}

	public int getMinModuleSize() {
		return minModuleSize;
	}

	public void setMinModuleSize(int minModuleSize) {
		this.minModuleSize = minModuleSize;
	}

	public int getDeepSplit() {
		return deepSplit;
	}

	public void setDeepSplit(int deepSplit) {
		this.deepSplit = deepSplit;
	}

	public double getCutHeight() {
		return cutHeight;
	}

	public void setCutHeight(double cutHeight) {
		this.cutHeight = cutHeight;
	}

	public double getMergeCutHeight() {
		return mergeCutHeight;
	}

	public void setMergeCutHeight(double mergeCutHeight) {
		this.mergeCutHeight = mergeCutHeight;
	}

	public int getMaxBlockSize() {
		return maxBlockSize;
	}

	public void setMaxBlockSize(int maxBlockSize) {
		this.maxBlockSize = maxBlockSize;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(int threads) {
		this.threads = threads;
	}

	public double getKmeThreshold() {
		return kmeThreshold;
	}

	public void setKmeThreshold(double kmeThreshold) {
		this.kmeThreshold = kmeThreshold;
	}

	public double getKmePValueThreshold() {
		return kmePValueThreshold;
	}

	public void setKmePValueThreshold(double kmePValueThreshold) {
		this.kmePValueThreshold = kmePValueThreshold;
	}

	/**
	 * @return the trait used for gene significance, null for the first trait column
	 */
	public String getGeneSignificanceTrait() {
		return geneSignificanceTrait;
	}

	public void setGeneSignificanceTrait(String geneSignificanceTrait) {
		this.geneSignificanceTrait = geneSignificanceTrait;
	}

	/**
	 * @return module labels for hub extraction, empty for every detected module
	 */
	public List<String> getModulesOfInterest() {
		return new ArrayList<String>(modulesOfInterest);
	}

	public void setModulesOfInterest(List<String> modulesOfInterest) {
		this.modulesOfInterest = new ArrayList<String>(modulesOfInterest);
	}

	public String toString() {
		return "id=" + analysisId + " power=" + power + " candidates=" + Arrays.toString(candidatePowers) + " targetR2=" + targetRSquared
				+ " network=" + networkType + " correlation=" + correlation + " linkage=" + linkage + " minModuleSize=" + minModuleSize
				+ " deepSplit=" + deepSplit + " cutHeight=" + cutHeight + " mergeCutHeight=" + mergeCutHeight + " maxBlockSize=" + maxBlockSize
				+ " threads=" + threads + " kME>" + kmeThreshold + " kMEp<" + kmePValueThreshold
				+ " gsTrait=" + geneSignificanceTrait + " modules=" + modulesOfInterest;
	}
}
