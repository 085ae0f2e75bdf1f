package core;

import tree.Tree;

/**
 * Accept/reject decision over one parsed tree.
 */
public interface TreeFilter {

    boolean accept(Tree tree);

    /**
     * Short human readable description of the thresholds, used in run summaries.
     */
    String describe();
}
