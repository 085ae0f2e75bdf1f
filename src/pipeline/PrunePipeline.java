package pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import core.PruneReport;
import core.TreePruner;
import preprocessing.GeneTrees;
import tree.NewickWriter;

/**
 * Prunes the same node names from every tree of a Newick file and writes the
 * results with fixed-precision branch lengths. Internal nodes carry their
 * names by default, or their support values with {@link NewickWriter.LabelStyle#SUPPORT}.
 */
public class PrunePipeline {

    private static final Logger logger = Logger.getLogger(PrunePipeline.class);

    private final List<String> namesToRemove;
    private final NewickWriter newickWriter;

    public PrunePipeline(List<String> namesToRemove, int branchPrecision, NewickWriter.LabelStyle labelStyle){
        this.namesToRemove = ImmutableList.copyOf(namesToRemove);
        this.newickWriter = new NewickWriter(branchPrecision, labelStyle);
    }

    public PrunePipeline(List<String> namesToRemove, int branchPrecision){
        this(namesToRemove, branchPrecision, NewickWriter.LabelStyle.NAMES);
    }

    /**
     * Counts of one run.
     */
    public static class Result {
        public int attempted;
        public int malformed;
        public int written;
        public int removedNodes;
        public int rootRequests;

        @Override
        public String toString(){
            return "attempted=" + attempted + ", malformed=" + malformed + ", written=" + written
                + ", removedNodes=" + removedNodes + ", rootRequests=" + rootRequests;
        }
    }

    public Result run(Path input, Path output) throws IOException{
        GeneTrees geneTrees = new GeneTrees(input.toString());
        geneTrees.readGeneTrees();
        Result result;
        try(BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)){
            result = prune(geneTrees, writer);
        }
        logger.info("Pruned " + result.written + " trees (" + result.removedNodes + " nodes removed), written to " + output);
        return result;
    }

    public Result prune(GeneTrees geneTrees, Writer writer) throws IOException{
        Result result = new Result();
        result.attempted = geneTrees.attempted;
        result.malformed = geneTrees.malformed.size();
        for(var geneTree : geneTrees.getGeneTrees()){
            PruneReport report = TreePruner.prune(geneTree.tree, namesToRemove);
            if(report.hasRootRequests())
                logger.warn("Tree #" + geneTree.number + ": root deletion requested for " + report.getRootRequests());
            result.removedNodes += report.getRemovedNodes();
            result.rootRequests += report.getRootRequests().size();

            writer.write(newickWriter.write(geneTree.tree));
            writer.write('\n');
            result.written++;
        }
        return result;
    }
}
