package utils;

import java.util.Locale;

/**
 * Default settings of the gene-tree commands.
 *
 * These are constants only. Every run builds its own settings from the
 * command line and hands them to the filters and classifiers it creates.
 */
public class Config {

    /**
     * Decimals written for branch lengths; fixed notation keeps downstream
     * line parsers away from exponents.
     */
    public static final int BRANCH_PRECISION = 10;

    /**
     * Decimals of the ratio columns of the WGD/WGT summary tables.
     */
    public static final int RATIO_DECIMALS = 4;

    public static final double DEFAULT_MIN_SUPPORT = 0.7;
    public static final double DEFAULT_MIN_BRANCH = 0.01;
    public static final int DEFAULT_MIN_GROUPS = 30;

    public static final String TREE_FILE_SUFFIX = ".nwk";
    public static final String WGD_SUMMARY_FILE = "WGD_support_summary.txt";
    public static final String WGT_SUMMARY_FILE = "WGT_support_summary.txt";

    /**
     * Commands understood by {@code Main}.
     */
    public enum Command {
        PRUNE("prune"),
        FILTER_SUPPORT("filter-support"),
        FILTER_LEAVES("filter-leaves"),
        FILTER_GROUPS("filter-groups"),
        WGD("wgd"),
        WGT("wgt");

        private final String label;

        Command(String label){
            this.label = label;
        }

        public String getLabel(){
            return label;
        }

        public static Command fromLabel(String label){
            for(Command c : values()){
                if(c.label.equals(label))
                    return c;
            }
            throw new IllegalArgumentException("Unknown command '" + label + "'");
        }
    }

    private Config(){
    }

    public static String formatRatio(double ratio){
        return String.format(Locale.ROOT, "%." + RATIO_DECIMALS + "f", ratio);
    }
}
