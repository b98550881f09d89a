package umms.wgcna.io;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import umms.wgcna.AnalysisResult;
import umms.wgcna.clustering.Dendrogram;
import umms.wgcna.hub.HubGene;
import umms.wgcna.hub.ModuleGeneReport;
import umms.wgcna.module.ModuleAssignment;
import umms.wgcna.module.ModuleColors;
import umms.wgcna.trait.GeneSignificance;
import umms.wgcna.trait.MembershipStats;

/**
 * Writes the tab-separated result tables of an analysis, each prefixed by the analysis id.
 */
public class CoexpressionWriter {

	static Logger logger = Logger.getLogger(CoexpressionWriter.class.getName());

	public static final String HUB_HEADER = "gene\tmodule\tcolor\tkME\tkME.p\tGS\tGS.p";

	private final File outDir;

	public CoexpressionWriter(File outDir) throws IOException {
		if(!outDir.isDirectory() && !outDir.mkdirs()) {
			throw new IOException("Could not create output directory " + outDir);
		}
		this.outDir = outDir;
	}

	public File getOutDir() {
		return outDir;
	}

	/**
	 * @return the files written
	 */
	public List<File> write(AnalysisResult result) throws IOException {
		String id = result.getAnalysisId();
		List<File> rtrn = new ArrayList<File>();

		File f = file(id + "_softThreshold.txt");
		result.getSoftThreshold().write(f.getAbsolutePath());
		rtrn.add(f);

		f = file(id + "_moduleAssignment.txt");
		writeAssignment(result.getModules().getAssignment(), f);
		rtrn.add(f);

		f = file(id + "_eigengenes.txt");
		result.getModules().getEigengenes().getEigengenes().write(f.getAbsolutePath(), "sample");
		rtrn.add(f);

		f = file(id + "_moduleTraitCor.txt");
		result.getModuleTraitStats().getCorrelations().write(f.getAbsolutePath(), "module");
		rtrn.add(f);

		f = file(id + "_moduleTraitPvalue.txt");
		result.getModuleTraitStats().getPValues().write(f.getAbsolutePath(), "module");
		rtrn.add(f);

		f = file(id + "_geneInfo.txt");
		writeGeneInfo(result.getModules().getAssignment(), result.getMembership(), result.getGeneSignificance(), f);
		rtrn.add(f);

		List<Dendrogram> dendrograms = result.getModules().getDendrograms();
		for(int b = 0; b < dendrograms.size(); b++) {
			f = file(id + "_dendrogram_block" + (b + 1) + ".txt");
			dendrograms.get(b).write(f.getAbsolutePath());
			rtrn.add(f);
		}

		for(ModuleGeneReport report : result.getReports()) {
			f = file(report.getName() + "_hubGenes.txt");
			writeHubs(report, f);
			rtrn.add(f);
			f = file(report.getName() + "_allGenes.txt");
			writeGeneList(report.getAllGenes(), f);
			rtrn.add(f);
		}
		logger.info("Wrote " + rtrn.size() + " files to " + outDir);
		return rtrn;
	}

	private File file(String name) {
		return new File(outDir, name);
	}

	public static void writeAssignment(ModuleAssignment assignment, File file) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(file));
		try {
			bw.write("gene\tunmerged.module\tunmerged.color\tmodule\tcolor");
			bw.newLine();
			for(int i = 0; i < assignment.size(); i++) {
				int unmerged = assignment.getUnmergedModule(i);
				int merged = assignment.getModule(i);
				bw.write(StringUtils.join(new Object[] {assignment.getGenes().get(i), unmerged, ModuleColors.colorOf(unmerged),
						merged, ModuleColors.colorOf(merged)}, '\t'));
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}

	/**
	 * One row per gene: its module, GS and p for the selected trait, then kME and p for every module.
	 */
	public static void writeGeneInfo(ModuleAssignment assignment, MembershipStats membership, GeneSignificance significance, File file) throws IOException {
		List<Integer> modules = membership.getModules();
		List<String> header = new ArrayList<String>();
		header.add("gene");
		header.add("module");
		header.add("color");
		header.add("GS." + significance.getTrait());
		header.add("p.GS." + significance.getTrait());
		for(int m : modules) {
			header.add("kME" + ModuleColors.colorOf(m));
			header.add("p.kME" + ModuleColors.colorOf(m));
		}

		BufferedWriter bw = new BufferedWriter(new FileWriter(file));
		try {
			bw.write(StringUtils.join(header, '\t'));
			bw.newLine();
			List<String> genes = assignment.getGenes();
			for(int i = 0; i < genes.size(); i++) {
				String gene = genes.get(i);
				List<Object> row = new ArrayList<Object>(header.size());
				row.add(gene);
				row.add(assignment.getModule(i));
				row.add(ModuleColors.colorOf(assignment.getModule(i)));
				row.add(significance.getGS(gene));
				row.add(significance.getPValue(gene));
				for(int m : modules) {
					row.add(membership.getKME(gene, m));
					row.add(membership.getPValue(gene, m));
				}
				bw.write(StringUtils.join(row, '\t'));
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}

	public static void writeHubs(ModuleGeneReport report, File file) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(file));
		try {
			bw.write(HUB_HEADER);
			bw.newLine();
			for(HubGene hub : report.getHubs()) {
				bw.write(StringUtils.join(new Object[] {hub.getGene(), hub.getModule(), ModuleColors.colorOf(hub.getModule()),
						hub.getKME(), hub.getKMEPValue(), hub.getGS(), hub.getGSPValue()}, '\t'));
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}

	public static void writeGeneList(List<String> genes, File file) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(file));
		try {
			for(String gene : genes) {
				bw.write(gene);
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}
}
