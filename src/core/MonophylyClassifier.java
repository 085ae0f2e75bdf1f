package core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

import tree.Tree;
import tree.TreeNode;

/**
 * MonophylyClassifier: decides whether a set of leaf names forms a clade.
 *
 * The names present in the tree are monophyletic iff some node's leaf set is
 * exactly that intersection. Only ancestors of the present members can be
 * that node, so the search walks upward from each member and compares the
 * leaf set of every ancestor with the intersection.
 *
 * Intersections with fewer than two names are monophyletic by definition;
 * the WGT statistics rely on this.
 */
public class MonophylyClassifier {

    private static final Logger logger = Logger.getLogger(MonophylyClassifier.class);

    private MonophylyClassifier(){
    }

    /**
     * @throws ClassifierException if {@code targetNames} is empty or none of
     *         its names is a leaf of {@code tree}
     */
    public static boolean isMonophyletic(Tree tree, Set<String> targetNames){
        if(targetNames == null || targetNames.isEmpty())
            throw new ClassifierException("Empty target set");
        Set<String> present = presentNames(tree, targetNames);
        if(present.isEmpty())
            throw new ClassifierException("None of " + targetNames + " is a leaf of the tree");
        return isClade(tree, present);
    }

    /**
     * Like {@link #isMonophyletic} but an empty or absent target set counts
     * as monophyletic instead of failing.
     */
    public static boolean isMonophyleticOrTrivial(Tree tree, Set<String> targetNames){
        if(targetNames == null || targetNames.isEmpty())
            return true;
        return isClade(tree, presentNames(tree, targetNames));
    }

    /**
     * Target names that label at least one leaf of the tree.
     */
    public static Set<String> presentNames(Tree tree, Set<String> targetNames){
        return new LinkedHashSet<>(Sets.intersection(tree.leafNames(), targetNames));
    }

    private static boolean isClade(Tree tree, Set<String> present){
        if(present.size() < 2)
            return true;

        // candidates are the ancestors of every present leaf, each visited once
        Set<TreeNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for(var leaf : tree.leaves()){
            if(!present.contains(leaf.name))
                continue;
            for(TreeNode curr = leaf.parent; curr != null && visited.add(curr); curr = curr.parent){
                Set<String> below = tree.leafNames(curr);
                if(below.equals(present))
                    return true;
                if(!present.containsAll(below)){
                    // an outsider below curr stays below every further ancestor
                    if(logger.isDebugEnabled())
                        logger.debug("Clade above " + leaf.name + " also holds " + Sets.difference(below, present));
                    break;
                }
            }
        }
        return false;
    }
}
