package umms.wgcna.module;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.wgcna.clustering.Dendrogram;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.network.AdjacencyTransformer;
import umms.wgcna.network.TOMComputer;

/**
 * Module detection on expression data, one block of contiguous genes at a time.
 * <p>
 * For each block the correlation and adjacency rows of its genes are computed against all
 * genes, which gives the block's TOM without ever holding the full genes x genes matrices.
 * The block is clustered and cut on its own; module ids are offset so they stay unique
 * across blocks, and the merge step then runs over every block's modules together.
 * Blocks run one after another; the work inside a block is spread over the engine's executor.
 */
public class BlockwiseModuleDetector {

	static Logger logger = Logger.getLogger(BlockwiseModuleDetector.class.getName());

	public static final int DEFAULT_MAX_BLOCK_SIZE = 5000;

	private final CorrelationEngine engine;
	private final AdjacencyTransformer adjacency;
	private final TOMComputer tomComputer;
	private final ModuleDetector detector;
	private final int maxBlockSize;

	public BlockwiseModuleDetector(CorrelationEngine engine, AdjacencyTransformer adjacency, ModuleDetector detector, int maxBlockSize) {
		if(maxBlockSize < 1) {
			throw new IllegalArgumentException("Block size must be positive, got " + maxBlockSize);
		}
		this.engine = engine;
		this.adjacency = adjacency;
		this.tomComputer = new TOMComputer(engine.getExecutor());
		this.detector = detector;
		this.maxBlockSize = maxBlockSize;
	}

	public int getMaxBlockSize() {
		return maxBlockSize;
	}

	/**
	 * Contiguous gene index blocks of at most maxBlockSize genes.
	 */
	public static List<int[]> blocks(int numGenes, int maxBlockSize) {
		List<int[]> rtrn = new ArrayList<int[]>();
		for(int start = 0; start < numGenes; start += maxBlockSize) {
			int end = Math.min(numGenes, start + maxBlockSize);
			int[] block = new int[end - start];
			for(int i = start; i < end; i++) {
				block[i - start] = i;
			}
			rtrn.add(block);
		}
		return rtrn;
	}

	/**
	 * @param expression samples x genes
	 */
	public ModuleDetectionResult detect(MatrixWithHeaders expression) {
		List<String> genes = expression.getColumnNames();
		double[][] columns = expression.toColumnArrays();
		List<int[]> blocks = blocks(genes.size(), maxBlockSize);
		logger.info("Detecting modules among " + genes.size() + " genes in " + blocks.size() + " block(s)");

		int[] labels = new int[genes.size()];
		List<Dendrogram> dendrograms = new ArrayList<Dendrogram>(blocks.size());
		int offset = 0;
		for(int b = 0; b < blocks.size(); b++) {
			int[] block = blocks.get(b);
			double[][] rows = engine.correlationRows(columns, genes, block);
			adjacency.transformRows(rows, block);
			double[][] tom = tomComputer.computeBlock(rows, block);

			List<String> blockGenes = new ArrayList<String>(block.length);
			for(int g : block) {
				blockGenes.add(genes.get(g));
			}
			Dendrogram dendrogram = detector.cluster(tom, blockGenes);
			dendrograms.add(dendrogram);
			int[] blockLabels = detector.cutModules(dendrogram);

			int max = 0;
			for(int i = 0; i < block.length; i++) {
				if(blockLabels[i] != ModuleAssignment.UNASSIGNED) {
					labels[block[i]] = blockLabels[i] + offset;
					max = Math.max(max, blockLabels[i]);
				}
			}
			logger.info("Block " + (b + 1) + "/" + blocks.size() + ": " + max + " modules among " + block.length + " genes");
			offset += max;
		}

		ModuleAssignment assignment = detector.mergeCloseModules(expression, labels);
		ModuleEigengenes eigengenes = detector.getEigengeneCalculator().calculate(expression, assignment, false);
		return new ModuleDetectionResult(dendrograms, blocks, assignment, eigengenes, detector.warnings(assignment));
	}
}
