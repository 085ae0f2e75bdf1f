package core;

import java.util.List;

import com.google.common.base.Preconditions;

import tree.Tree;

/**
 * Keeps trees whose internal support values and internal branch lengths all
 * reach the thresholds. A tree without any internal support or without any
 * internal branch length is rejected.
 */
public class SupportFilter implements TreeFilter {

    private final double minSupport;
    private final double minBranch;

    public SupportFilter(double minSupport, double minBranch){
        Preconditions.checkArgument(!Double.isNaN(minSupport) && !Double.isNaN(minBranch),
            "Thresholds must be numbers");
        this.minSupport = minSupport;
        this.minBranch = minBranch;
    }

    @Override
    public boolean accept(Tree tree){
        List<Double> supports = TreeStatistics.internalSupports(tree);
        List<Double> branches = TreeStatistics.internalBranchLengths(tree);
        if(supports.isEmpty() || branches.isEmpty())
            return false;
        for(double s : supports){
            if(s < minSupport)
                return false;
        }
        for(double b : branches){
            if(b < minBranch)
                return false;
        }
        return true;
    }

    public double getMinSupport(){
        return minSupport;
    }

    public double getMinBranch(){
        return minBranch;
    }

    @Override
    public String describe(){
        return "support >= " + minSupport + ", internal branch length >= " + minBranch;
    }
}
