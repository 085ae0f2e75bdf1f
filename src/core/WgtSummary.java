package core;

import java.util.Arrays;
import java.util.List;

import utils.Config;

/**
 * Per-file tally of WGT classifications; attempted = malformed + total.
 */
public class WgtSummary {

    public static final List<String> HEADER = Arrays.asList(
        "File", "Attempted", "Malformed", "Total_Trees", "NonShared_Count", "NonShared_Ratio", "Shared_Count", "Shared_Ratio");

    private final String source;
    private int malformed;
    private int nonShared;
    private int shared;

    public WgtSummary(String source){
        this.source = source;
    }

    public void addMalformed(){
        malformed++;
    }

    public void add(WgtClassifier.Category category){
        if(category == WgtClassifier.Category.SHARED)
            shared++;
        else
            nonShared++;
    }

    public String getSource(){
        return source;
    }

    public int getAttempted(){
        return malformed + getTotal();
    }

    public int getMalformed(){
        return malformed;
    }

    public int getTotal(){
        return nonShared + shared;
    }

    public int getNonShared(){
        return nonShared;
    }

    public int getShared(){
        return shared;
    }

    public double getNonSharedRatio(){
        return getTotal() == 0 ? 0 : (double) nonShared / getTotal();
    }

    public double getSharedRatio(){
        return getTotal() == 0 ? 0 : (double) shared / getTotal();
    }

    public List<String> toRow(){
        return Arrays.asList(
            source,
            String.valueOf(getAttempted()),
            String.valueOf(malformed),
            String.valueOf(getTotal()),
            String.valueOf(nonShared),
            Config.formatRatio(getNonSharedRatio()),
            String.valueOf(shared),
            Config.formatRatio(getSharedRatio()));
    }

    @Override
    public String toString(){
        return source + ": " + toRow();
    }
}
