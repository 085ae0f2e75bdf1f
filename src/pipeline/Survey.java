package pipeline;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

import preprocessing.GeneTrees;
import utils.Config;
import utils.Threading;

/**
 * Runs a per-file classification over every Newick file of a directory and
 * writes one summary row per file.
 *
 * Files are independent units of work and are summarized in parallel; the
 * rows are collected in file-name order and written by the calling thread.
 *
 * @param <S> per-file summary type
 */
public abstract class Survey<S> {

    private static final Logger logger = Logger.getLogger(Survey.class);

    static final CSVFormat TABLE_FORMAT = CSVFormat.TDF.builder()
        .setRecordSeparator('\n')
        .build();

    private final int numThreads;

    protected Survey(int numThreads){
        this.numThreads = numThreads;
    }

    /**
     * Classifies the already parsed trees of one file.
     */
    protected abstract S summarize(String source, GeneTrees geneTrees);

    /**
     * Summary used when a file cannot be read at all.
     */
    protected abstract S unreadable(String source);

    protected abstract List<String> header();

    protected abstract List<String> row(S summary);

    /**
     * Whether the summary gets a row in the table.
     */
    protected boolean include(S summary){
        return true;
    }

    public S summarize(Path file){
        String source = file.getFileName().toString();
        GeneTrees geneTrees = new GeneTrees(file.toString());
        try{
            geneTrees.readGeneTrees();
        }
        catch(IOException e){
            logger.error("Cannot read " + file + ": " + e.getMessage());
            return unreadable(source);
        }
        return summarize(source, geneTrees);
    }

    public List<S> summarizeAll(List<Path> files){
        return Threading.processListParallelWithResults(files, this::summarize, numThreads);
    }

    /**
     * Tree files of {@code directory} (suffix {@value Config#TREE_FILE_SUFFIX}), sorted by name.
     */
    public static List<Path> treeFiles(Path directory) throws IOException{
        try(Stream<Path> listing = Files.list(directory)){
            return listing
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(Config.TREE_FILE_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public List<S> run(Path directory, Path output) throws IOException{
        List<Path> files = treeFiles(directory);
        if(files.isEmpty())
            logger.warn("No *" + Config.TREE_FILE_SUFFIX + " files in " + directory);
        else
            logger.info("Summarizing " + files.size() + " tree files from " + directory);

        List<S> summaries = summarizeAll(files);
        try(Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)){
            writeTable(summaries, writer);
        }
        logger.info("Summary written to " + output);
        return summaries;
    }

    public void writeTable(List<S> summaries, Appendable out) throws IOException{
        CSVPrinter printer = new CSVPrinter(out, TABLE_FORMAT);
        printer.printRecord(header());
        for(S summary : summaries){
            if(include(summary))
                printer.printRecord(row(summary));
            else
                logger.warn("No table row for " + summary);
        }
        printer.flush();
    }

    /**
     * Summaries that {@link #writeTable} leaves out of the table.
     */
    public List<S> omitted(List<S> summaries){
        List<S> left = new ArrayList<>();
        for(S summary : summaries){
            if(!include(summary))
                left.add(summary);
        }
        return left;
    }
}
