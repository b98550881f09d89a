package umms.wgcna.module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import umms.wgcna.ConfigurationWarning;
import umms.wgcna.clustering.Dendrogram;

/**
 * Output of module detection: one dendrogram per gene block, the module assignment and
 * the eigengenes of the merged modules.
 */
public class ModuleDetectionResult {

	private final List<Dendrogram> dendrograms;
	private final List<int[]> blocks;
	private final ModuleAssignment assignment;
	private final ModuleEigengenes eigengenes;
	private final List<ConfigurationWarning> warnings;

	public ModuleDetectionResult(List<Dendrogram> dendrograms, List<int[]> blocks, ModuleAssignment assignment,
			ModuleEigengenes eigengenes, List<ConfigurationWarning> warnings) {
		this.dendrograms = Collections.unmodifiableList(new ArrayList<Dendrogram>(dendrograms));
		this.blocks = Collections.unmodifiableList(new ArrayList<int[]>(blocks));
		this.assignment = assignment;
		this.eigengenes = eigengenes;
		this.warnings = Collections.unmodifiableList(new ArrayList<ConfigurationWarning>(warnings));
	}

	public List<Dendrogram> getDendrograms() {
		return dendrograms;
	}

	/**
	 * Gene indices of each block, in the order of {@link #getDendrograms()}.
	 */
	public List<int[]> getBlocks() {
		return blocks;
	}

	public ModuleAssignment getAssignment() {
		return assignment;
	}

	public ModuleEigengenes getEigengenes() {
		return eigengenes;
	}

	public List<ConfigurationWarning> getWarnings() {
		return warnings;
	}
}
