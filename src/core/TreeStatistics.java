package core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import tree.Tree;
import tree.TreeNode;

/**
 * Support and branch-length sequences read from the parsed tree.
 *
 * Both sequences cover internal nodes only (the root included), in the order
 * their closing parentheses appear in the Newick text. Nodes lacking the
 * annotation contribute nothing.
 */
public class TreeStatistics {

    private TreeStatistics(){
    }

    public static List<Double> internalSupports(Tree tree){
        List<Double> supports = new ArrayList<>();
        for(TreeNode node : internalNodesInTextOrder(tree)){
            if(node.support != null)
                supports.add(node.support);
        }
        return supports;
    }

    public static List<Double> internalBranchLengths(Tree tree){
        List<Double> lengths = new ArrayList<>();
        for(TreeNode node : internalNodesInTextOrder(tree)){
            if(node.branchLength != null)
                lengths.add(node.branchLength);
        }
        return lengths;
    }

    /**
     * Internal nodes ordered by the position of their closing parenthesis,
     * i.e. post-order. Built as the reverse of a root-first walk that visits
     * children right to left, so deep trees need no recursion.
     */
    private static List<TreeNode> internalNodesInTextOrder(Tree tree){
        List<TreeNode> order = new ArrayList<>();
        if(tree.root == null)
            return order;
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(tree.root);
        while(!stack.isEmpty()){
            TreeNode curr = stack.pop();
            if(curr.isLeaf())
                continue;
            order.add(curr);
            for(var x : curr.childs)
                stack.push(x);
        }
        Collections.reverse(order);
        return order;
    }

    public static double totalBranchLength(Tree tree){
        double total = 0;
        for(TreeNode node : tree.preOrder()){
            if(node.branchLength != null)
                total += node.branchLength;
        }
        return total;
    }

    /**
     * Sum of branch lengths on the path from {@code descendant} up to, but
     * excluding, {@code ancestor}.
     */
    public static double pathLength(TreeNode ancestor, TreeNode descendant){
        double total = 0;
        for(TreeNode curr = descendant; curr != null && curr != ancestor; curr = curr.parent){
            if(curr.branchLength != null)
                total += curr.branchLength;
        }
        return total;
    }
}
