package preprocessing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import tree.NewickParseException;
import tree.NewickParser;
import tree.Tree;

/**
 * GeneTrees: the gene trees of one Newick file.
 *
 * The file may hold any number of ';'-terminated statements, one per line or
 * not. Each statement is parsed on its own; a malformed statement is logged,
 * counted and skipped so it never blocks the other trees of the file.
 */
public class GeneTrees {

    private static final Logger logger = Logger.getLogger(GeneTrees.class);

    /**
     * One parsed statement together with its original text.
     */
    public static class GeneTree {
        public final int number;        // 1-based position of the statement in the file
        public final String newick;     // statement text as read, terminated by ';'
        public final Tree tree;

        GeneTree(int number, String newick, Tree tree){
            this.number = number;
            this.newick = newick;
            this.tree = tree;
        }
    }

    public ArrayList<GeneTree> geneTrees;   // successfully parsed trees, in file order
    public List<Integer> malformed;         // statement numbers that failed to parse
    public int attempted;                   // statements read
    public String path;

    /**
     * Sets up an empty collection for the given file; call {@link #readGeneTrees()} to load it.
     */
    public GeneTrees(String path){
        this.geneTrees = new ArrayList<>();
        this.malformed = new ArrayList<>();
        this.path = path;
    }

    public void readGeneTrees() throws IOException{
        String blob = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        readStatements(blob);
        logger.info("Read " + geneTrees.size() + " of " + attempted + " gene trees from " + path
            + (malformed.isEmpty() ? "" : ", skipped " + malformed.size() + " malformed"));
    }

    /**
     * Parses every statement of an in-memory blob.
     */
    public static GeneTrees fromText(String source, String blob){
        GeneTrees trees = new GeneTrees(source);
        trees.readStatements(blob);
        return trees;
    }

    private void readStatements(String blob){
        for(String statement : NewickParser.splitStatements(blob)){
            attempted++;
            try{
                Tree tree = NewickParser.parse(statement);
                geneTrees.add(new GeneTree(attempted, statement, tree));
            }
            catch(NewickParseException e){
                malformed.add(attempted);
                logger.warn(path + ": skipped malformed tree #" + attempted + ": " + e.getMessage());
            }
        }
    }

    public List<GeneTree> getGeneTrees(){
        return Collections.unmodifiableList(geneTrees);
    }

    public int size(){
        return geneTrees.size();
    }
}
