import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import com.google.common.base.Splitter;

import core.ClassificationConfig;
import core.GroupCoverageFilter;
import core.LeafCountFilter;
import core.SupportFilter;
import core.TreeFilter;
import core.WgdSummary;
import core.WgtSummary;
import pipeline.FilterResult;
import pipeline.PrunePipeline;
import pipeline.TreeFilterPipeline;
import pipeline.WgdSurvey;
import pipeline.WgtSurvey;
import taxon.GroupMapping;
import tree.NewickWriter;
import utils.Config;
import utils.Config.Command;
import utils.Threading;

/**
 * Command-line entry point of the gene-tree toolkit.
 *
 * <pre>
 *   java Main &lt;command&gt; [options]
 * </pre>
 *
 * Commands: prune, filter-support, filter-leaves, filter-groups, wgd, wgt.
 */
public class Main {

    private static final Logger logger = Logger.getLogger(Main.class);

    private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args){
        System.exit(run(args));
    }

    static int run(String[] args){
        if(args.length == 0 || args[0].equals("-h") || args[0].equals("--help")){
            printUsage();
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }

        Command command;
        try{
            command = Command.fromLabel(args[0]);
        }
        catch(IllegalArgumentException e){
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        Options options = optionsFor(command);
        if(args.length > 1 && (args[1].equals("-h") || args[1].equals("--help"))){
            printHelp(command, options);
            return EXIT_OK;
        }
        CommandLine line;
        try{
            line = new DefaultParser().parse(options, Arrays.copyOfRange(args, 1, args.length));
        }
        catch(ParseException e){
            System.err.println("Error: " + e.getMessage());
            printHelp(command, options);
            return EXIT_USAGE;
        }

        try{
            switch(command){
                case PRUNE:
                    return prune(line);
                case FILTER_SUPPORT:
                    return filter(line, new SupportFilter(
                        doubleValue(line, "t", Config.DEFAULT_MIN_SUPPORT),
                        doubleValue(line, "b", Config.DEFAULT_MIN_BRANCH)));
                case FILTER_LEAVES:
                    return filter(line, new LeafCountFilter(intValue(line, "t", 0)));
                case FILTER_GROUPS:
                    GroupMapping mapping = GroupMapping.read(Paths.get(line.getOptionValue("c")));
                    return filter(line, new GroupCoverageFilter(mapping.asMap(),
                        intValue(line, "g", Config.DEFAULT_MIN_GROUPS)));
                case WGD:
                    return wgd(line);
                case WGT:
                    return wgt(line);
                default:
                    throw new IllegalStateException("Unhandled command " + command);
            }
        }
        catch(IllegalArgumentException e){
            System.err.println("Error: " + e.getMessage());
            printHelp(command, options);
            return EXIT_USAGE;
        }
        catch(IOException e){
            logger.error(command.getLabel() + " failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int prune(CommandLine line) throws IOException{
        List<String> names = new ArrayList<>(namesOption(line, "n"));
        if(line.hasOption("f")){
            for(String name : Files.readAllLines(Paths.get(line.getOptionValue("f")), StandardCharsets.UTF_8)){
                if(!name.trim().isEmpty())
                    names.add(name.trim());
            }
        }
        if(names.isEmpty())
            throw new IllegalArgumentException("No node names given; use -n or -f");

        int precision = intValue(line, "p", Config.BRANCH_PRECISION);
        NewickWriter.LabelStyle labelStyle = line.hasOption("s") ? NewickWriter.LabelStyle.SUPPORT : NewickWriter.LabelStyle.NAMES;
        PrunePipeline pipeline = new PrunePipeline(names, precision, labelStyle);
        Path output = Paths.get(line.getOptionValue("o"));
        PrunePipeline.Result result = pipeline.run(Paths.get(line.getOptionValue("i")), output);

        System.out.println("Total trees:    " + result.attempted);
        System.out.println("Malformed:      " + result.malformed);
        System.out.println("Trees written:  " + result.written);
        System.out.println("Nodes removed:  " + result.removedNodes);
        if(result.rootRequests > 0)
            System.out.println("Root deletions refused: " + result.rootRequests);
        System.out.println("Output written to: " + output);
        return EXIT_OK;
    }

    private static int filter(CommandLine line, TreeFilter filter) throws IOException{
        Path output = Paths.get(line.getOptionValue("o"));
        FilterResult result = new TreeFilterPipeline(filter).run(Paths.get(line.getOptionValue("i")), output);

        System.out.println("Total trees:    " + result.getAttempted());
        System.out.println("Malformed:      " + result.getMalformed());
        System.out.println("Trees passed:   " + result.getPassed());
        System.out.println("Criteria:       " + filter.describe());
        System.out.println("Output written to: " + output);
        return EXIT_OK;
    }

    private static int wgd(CommandLine line) throws IOException{
        WgdSurvey survey = new WgdSurvey(classificationConfig(line), intValue(line, "j", Threading.defaultThreads()));
        Path output = Paths.get(line.getOptionValue("o", Config.WGD_SUMMARY_FILE));
        List<WgdSummary> summaries = survey.run(Paths.get(line.getOptionValue("d", ".")), output);
        List<WgdSummary> omitted = survey.omitted(summaries);

        System.out.println("Analysis completed for " + summaries.size() + " files. Results saved to " + output);
        if(!omitted.isEmpty()){
            System.out.println("Files without informative trees, left out of the table: " + omitted.size());
            for(WgdSummary summary : omitted)
                System.out.println("  " + summary);
        }
        System.out.println("  - Independent: both species form monophyletic groups (WGD after speciation)");
        System.out.println("  - Shared: neither species forms a monophyletic group (WGD before speciation)");
        System.out.println("  - Uncertain: mixed pattern (may indicate gene loss)");
        return EXIT_OK;
    }

    private static int wgt(CommandLine line) throws IOException{
        WgtSurvey survey = new WgtSurvey(classificationConfig(line), intValue(line, "j", Threading.defaultThreads()));
        Path output = Paths.get(line.getOptionValue("o", Config.WGT_SUMMARY_FILE));
        List<WgtSummary> summaries = survey.run(Paths.get(line.getOptionValue("d", ".")), output);

        System.out.println("Analysis completed for " + summaries.size() + " files. Results saved to " + output);
        System.out.println("  - Shared_Ratio > 0.5 suggests a shared WGT event");
        System.out.println("  - NonShared_Ratio > 0.5 suggests independent WGT events");
        return EXIT_OK;
    }

    private static ClassificationConfig classificationConfig(CommandLine line){
        return new ClassificationConfig(namesOption(line, "a"), namesOption(line, "b"));
    }

    private static Set<String> namesOption(CommandLine line, String opt){
        Set<String> names = new LinkedHashSet<>();
        String[] values = line.getOptionValues(opt);
        if(values != null){
            for(String value : values)
                NAME_SPLITTER.split(value).forEach(names::add);
        }
        return names;
    }

    private static double doubleValue(CommandLine line, String opt, double defaultValue){
        String value = line.getOptionValue(opt);
        if(value == null)
            return defaultValue;
        try{
            return Double.parseDouble(value);
        }
        catch(NumberFormatException e){
            throw new IllegalArgumentException("Invalid number '" + value + "' for -" + opt);
        }
    }

    private static int intValue(CommandLine line, String opt, int defaultValue){
        String value = line.getOptionValue(opt);
        if(value == null)
            return defaultValue;
        try{
            return Integer.parseInt(value);
        }
        catch(NumberFormatException e){
            throw new IllegalArgumentException("Invalid integer '" + value + "' for -" + opt);
        }
    }

    static Options optionsFor(Command command){
        Options options = new Options();
        switch(command){
            case PRUNE:
                options.addOption(required("i", "input", "Input Newick file"));
                options.addOption(required("o", "output", "Output Newick file"));
                options.addOption(Option.builder("n").longOpt("nodes").hasArgs()
                    .desc("Node names to remove, comma separated").build());
                options.addOption(Option.builder("f").longOpt("nodes-file").hasArg()
                    .desc("File with one node name per line").build());
                options.addOption(Option.builder("p").longOpt("precision").hasArg()
                    .desc("Branch length decimals (default " + Config.BRANCH_PRECISION + ")").build());
                options.addOption(Option.builder("s").longOpt("support-labels")
                    .desc("Write support values instead of internal node names").build());
                break;
            case FILTER_SUPPORT:
                options.addOption(required("i", "infile", "Input Newick file"));
                options.addOption(required("o", "outfile", "Output file for kept trees"));
                options.addOption(Option.builder("t").longOpt("threshold_support").hasArg()
                    .desc("Minimum support (default " + Config.DEFAULT_MIN_SUPPORT + ")").build());
                options.addOption(Option.builder("b").longOpt("threshold_branch").hasArg()
                    .desc("Minimum internal branch length (default " + Config.DEFAULT_MIN_BRANCH + ")").build());
                break;
            case FILTER_LEAVES:
                options.addOption(required("i", "input", "Input Newick file"));
                options.addOption(required("o", "output", "Output file for kept trees"));
                options.addOption(required("t", "threshold", "Minimum number of leaves"));
                break;
            case FILTER_GROUPS:
                options.addOption(required("i", "input", "Input Newick file"));
                options.addOption(required("c", "csv", "CSV mapping id,group without header"));
                options.addOption(required("o", "output", "Output file for kept trees"));
                options.addOption(Option.builder("g").longOpt("groups").hasArg()
                    .desc("Minimum number of groups (default " + Config.DEFAULT_MIN_GROUPS + ")").build());
                break;
            case WGD:
            case WGT:
                options.addOption(Option.builder("d").longOpt("dir").hasArg()
                    .desc("Directory of *" + Config.TREE_FILE_SUFFIX + " files (default: current directory)").build());
                options.addOption(Option.builder("a").longOpt("species-a").hasArgs().required()
                    .desc("Gene copy names of species A, comma separated").build());
                options.addOption(Option.builder("b").longOpt("species-b").hasArgs().required()
                    .desc("Gene copy names of species B, comma separated").build());
                options.addOption(Option.builder("o").longOpt("output").hasArg()
                    .desc("Summary table (default " + (command == Command.WGD ? Config.WGD_SUMMARY_FILE : Config.WGT_SUMMARY_FILE) + ")").build());
                options.addOption(Option.builder("j").longOpt("threads").hasArg()
                    .desc("Files processed in parallel (default: available processors)").build());
                break;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
        return options;
    }

    private static Option required(String opt, String longOpt, String description){
        return Option.builder(opt).longOpt(longOpt).hasArg().required().desc(description).build();
    }

    private static void printHelp(Command command, Options options){
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(System.err);
        formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "java Main " + command.getLabel(), null,
            options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    private static void printUsage(){
        System.out.println("Usage: java Main <command> [options]");
        System.out.println("Commands:");
        System.out.println("  prune           Remove named nodes from every tree, reconnecting siblings");
        System.out.println("  filter-support  Keep trees whose internal supports and branch lengths pass thresholds");
        System.out.println("  filter-leaves   Keep trees with at least N leaves");
        System.out.println("  filter-groups   Keep trees covering at least N groups of a CSV mapping");
        System.out.println("  wgd             Shared vs independent WGD statistics over *.nwk files");
        System.out.println("  wgt             Shared vs independent WGT statistics over *.nwk files");
        System.out.println("Run 'java Main <command> -h' for the options of a command.");
    }
}
