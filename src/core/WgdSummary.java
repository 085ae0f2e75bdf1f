package core;

import java.util.Arrays;
import java.util.List;

import utils.Config;

/**
 * Per-file tally of WGD classifications.
 *
 * {@code attempted} counts every statement read, {@code malformed} those that
 * did not parse and {@code skipped} parsed trees with too few copies, so
 * attempted = malformed + skipped + total.
 */
public class WgdSummary {

    public static final List<String> HEADER = Arrays.asList(
        "File", "Attempted", "Malformed", "Total", "Independent", "Shared", "Uncertain", "Ind_Ratio", "Shared_Ratio");

    private final String source;
    private int attempted;
    private int malformed;
    private int skipped;
    private int independent;
    private int shared;
    private int uncertain;

    public WgdSummary(String source){
        this.source = source;
    }

    public void addMalformed(){
        attempted++;
        malformed++;
    }

    public void addSkipped(){
        attempted++;
        skipped++;
    }

    public void add(WgdClassifier.Category category){
        attempted++;
        switch(category){
            case INDEPENDENT:
                independent++;
                break;
            case SHARED:
                shared++;
                break;
            case UNCERTAIN:
                uncertain++;
                break;
            default:
                throw new IllegalArgumentException("Unknown category " + category);
        }
    }

    public String getSource(){
        return source;
    }

    public int getAttempted(){
        return attempted;
    }

    public int getMalformed(){
        return malformed;
    }

    public int getSkipped(){
        return skipped;
    }

    public int getTotal(){
        return independent + shared + uncertain;
    }

    public int getIndependent(){
        return independent;
    }

    public int getShared(){
        return shared;
    }

    public int getUncertain(){
        return uncertain;
    }

    public double getIndependentRatio(){
        return getTotal() == 0 ? 0 : (double) independent / getTotal();
    }

    public double getSharedRatio(){
        return getTotal() == 0 ? 0 : (double) shared / getTotal();
    }

    public List<String> toRow(){
        return Arrays.asList(
            source,
            String.valueOf(attempted),
            String.valueOf(malformed),
            String.valueOf(getTotal()),
            String.valueOf(independent),
            String.valueOf(shared),
            String.valueOf(uncertain),
            Config.formatRatio(getIndependentRatio()),
            Config.formatRatio(getSharedRatio()));
    }

    @Override
    public String toString(){
        return source + ": attempted=" + attempted + ", malformed=" + malformed + ", skipped=" + skipped
            + ", independent=" + independent + ", shared=" + shared + ", uncertain=" + uncertain;
    }
}
