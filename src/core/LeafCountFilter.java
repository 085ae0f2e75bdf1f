package core;

import com.google.common.base.Preconditions;

import tree.Tree;

/**
 * Keeps trees with at least {@code threshold} leaves.
 */
public class LeafCountFilter implements TreeFilter {

    private final int threshold;

    public LeafCountFilter(int threshold){
        Preconditions.checkArgument(threshold >= 0, "Leaf threshold must not be negative, got %s", threshold);
        this.threshold = threshold;
    }

    @Override
    public boolean accept(Tree tree){
        return tree.leavesCount() >= threshold;
    }

    @Override
    public String describe(){
        return "leaves >= " + threshold;
    }
}
