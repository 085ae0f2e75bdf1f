package core;

import java.util.Collection;

import org.apache.log4j.Logger;

import tree.Tree;
import tree.TreeNode;

/**
 * TreePruner: removes named nodes from a tree in place.
 *
 * For every matching node:
 * <ul>
 * <li>the root cannot be removed; the request is recorded and skipped,</li>
 * <li>with exactly one sibling, the sibling takes the parent's place under the
 *     grandparent with branch length parent + sibling, so every path from the
 *     grandparent keeps its length; without a grandparent the sibling becomes
 *     the root and drops its branch length. The node and its parent leave the
 *     tree,</li>
 * <li>with zero or several siblings the node is only detached; ancestors
 *     left without children are detached with it, the root excepted.</li>
 * </ul>
 *
 * Names are handled in the iteration order of the given collection. Earlier
 * removals change the sibling and grandparent relations seen by later ones.
 */
public class TreePruner {

    private static final Logger logger = Logger.getLogger(TreePruner.class);

    private TreePruner(){
    }

    public static PruneReport prune(Tree tree, Collection<String> namesToRemove){
        PruneReport report = new PruneReport();
        for(String name : namesToRemove){
            var matches = tree.findByName(name);
            if(matches.isEmpty()){
                report.nameNotFound(name);
                continue;
            }
            for(TreeNode node : matches){
                if(node == tree.root){
                    logger.warn("Node '" + name + "' is the root and cannot be pruned; left in place");
                    report.rootDeletionRejected(name);
                    continue;
                }
                // already gone with an ancestor removed earlier in this call
                if(!tree.contains(node))
                    continue;
                removeNode(tree, node, report);
            }
        }
        tree.compact();
        return report;
    }

    private static void removeNode(Tree tree, TreeNode node, PruneReport report){
        TreeNode parent = node.parent;
        var siblings = tree.siblings(node);

        if(siblings.size() == 1){
            TreeNode sibling = siblings.get(0);
            TreeNode grandparent = parent.parent;
            sibling.detach();
            if(grandparent != null){
                sibling.setBranchLength(addLengths(parent.branchLength, sibling.branchLength));
                int position = parent.detach();
                grandparent.addChild(position, sibling);
            }
            else{
                sibling.setBranchLength(null);
                tree.root = sibling;
                parent.childs.clear();
            }
            node.setParent(null);
            report.siblingReconnected();
        }
        else{
            node.detach();
            removeEmptyAncestors(tree, parent);
        }
        report.nodeRemoved();
    }

    /**
     * A parent left without children would turn into a leaf without a taxon;
     * it is detached as well, up to but never including the root.
     */
    private static void removeEmptyAncestors(Tree tree, TreeNode node){
        TreeNode curr = node;
        while(curr != null && curr != tree.root && curr.isLeaf()){
            TreeNode up = curr.parent;
            curr.detach();
            curr = up;
        }
    }

    private static Double addLengths(Double a, Double b){
        if(a == null && b == null)
            return null;
        return (a == null ? 0.0 : a) + (b == null ? 0.0 : b);
    }
}
