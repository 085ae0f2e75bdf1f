package pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

import core.TreeFilter;
import preprocessing.GeneTrees;

/**
 * Reads a Newick file, keeps the trees a {@link TreeFilter} accepts and writes
 * their original statement text, one tree per line.
 */
public class TreeFilterPipeline {

    private static final Logger logger = Logger.getLogger(TreeFilterPipeline.class);

    private final TreeFilter filter;

    public TreeFilterPipeline(TreeFilter filter){
        this.filter = filter;
    }

    public FilterResult run(Path input, Path output) throws IOException{
        GeneTrees geneTrees = new GeneTrees(input.toString());
        geneTrees.readGeneTrees();
        FilterResult result;
        try(BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)){
            result = filter(geneTrees, writer);
        }
        logger.info("Kept " + result.getPassed() + " of " + result.getAttempted() + " trees (" + filter.describe()
            + "), written to " + output);
        return result;
    }

    public FilterResult filter(GeneTrees geneTrees, Writer writer) throws IOException{
        int passed = 0;
        for(var geneTree : geneTrees.getGeneTrees()){
            if(filter.accept(geneTree.tree)){
                writer.write(geneTree.newick);
                writer.write('\n');
                passed++;
            }
            else if(logger.isDebugEnabled()){
                logger.debug("Rejected tree #" + geneTree.number);
            }
        }
        return new FilterResult(geneTrees.attempted, geneTrees.malformed.size(), passed);
    }

    public TreeFilter getFilter(){
        return filter;
    }
}
