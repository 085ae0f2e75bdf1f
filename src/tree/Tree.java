package tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Tree: rooted, ordered gene tree parsed from one Newick statement.
 *
 * All nodes are kept in an arena ({@link #nodes}) and carry their arena index.
 * Children are owned through the child lists; the parent field of a node is a
 * back-reference used for upward traversal (sibling lookup, pruning).
 *
 * Leaf sets are never cached: the pruning pass mutates the tree in place, so
 * every query walks the current structure.
 */
public class Tree {

    public ArrayList<TreeNode> nodes;   // arena, indexed by TreeNode.index
    public TreeNode root;

    public Tree(){
        nodes = new ArrayList<>();
    }

    /**
     * Creates a new node in the arena.
     */
    public TreeNode addNode(ArrayList<TreeNode> children, TreeNode parent){
        TreeNode nd = new TreeNode().setIndex(nodes.size()).setChilds(children).setParent(parent);
        nodes.add(nd);
        return nd;
    }

    /**
     * Creates an internal node owning the given children, in the given order.
     */
    public TreeNode addInternalNode(ArrayList<TreeNode> children){
        var nd = addNode(children, null);
        for(var x : children)
            x.setParent(nd);
        return nd;
    }

    public TreeNode addLeaf(String name){
        return addNode(null, null).setName(name);
    }

    /**
     * Lazy depth-first sequence of the leaves, in child insertion order.
     * Each call of {@code iterator()} restarts the traversal from the root.
     */
    public Iterable<TreeNode> leaves(){
        return () -> new LeafIterator(root);
    }

    public Iterable<TreeNode> leaves(TreeNode from){
        return () -> new LeafIterator(from);
    }

    public int leavesCount(){
        int count = 0;
        for(var ignored : leaves())
            count++;
        return count;
    }

    /**
     * Leaf names below {@code node}; duplicated names collapse into one entry.
     */
    public Set<String> leafNames(TreeNode node){
        Set<String> names = new LinkedHashSet<>();
        for(var leaf : leaves(node))
            names.add(leaf.name);
        return names;
    }

    public Set<String> leafNames(){
        return leafNames(root);
    }

    /**
     * All nodes carrying {@code name}, in pre-order. Independently generated
     * gene trees may repeat a name, so every match is returned.
     */
    public Set<TreeNode> findByName(String name){
        Set<TreeNode> matches = new LinkedHashSet<>();
        for(var node : preOrder()){
            if(name.equals(node.name))
                matches.add(node);
        }
        return matches;
    }

    public Optional<TreeNode> parent(TreeNode node){
        return Optional.ofNullable(node.parent);
    }

    /**
     * Children of the node's parent other than the node itself; empty for the root.
     */
    public List<TreeNode> siblings(TreeNode node){
        if(node.parent == null)
            return Collections.emptyList();
        List<TreeNode> siblings = new ArrayList<>(node.parent.childCount() - 1);
        for(var x : node.parent.childs){
            if(x != node)
                siblings.add(x);
        }
        return siblings;
    }

    /**
     * Whether the node is still reachable from the current root.
     */
    public boolean contains(TreeNode node){
        TreeNode curr = node;
        while(curr.parent != null)
            curr = curr.parent;
        return curr == root;
    }

    private void preOrderUtil(TreeNode node, List<TreeNode> order){
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(node);
        while(!stack.isEmpty()){
            TreeNode curr = stack.pop();
            order.add(curr);
            if(!curr.isLeaf()){
                for(int i = curr.childs.size() - 1; i >= 0; --i)
                    stack.push(curr.childs.get(i));
            }
        }
    }

    public List<TreeNode> preOrder(){
        List<TreeNode> order = new ArrayList<>();
        if(root != null)
            preOrderUtil(root, order);
        return order;
    }

    /**
     * Drops nodes that are no longer reachable from the root and renumbers
     * the arena in pre-order.
     */
    public void compact(){
        var order = preOrder();
        nodes = new ArrayList<>(order);
        for(int i = 0; i < nodes.size(); ++i)
            nodes.get(i).setIndex(i);
    }

    public String getNewickFormat(int branchPrecision){
        return new NewickWriter(branchPrecision, NewickWriter.LabelStyle.NAMES).write(this);
    }

    public String getNewickFormat(){
        return getNewickFormat(NewickWriter.DEFAULT_PRECISION);
    }

    @Override
    public String toString(){
        return getNewickFormat();
    }

    private static class LeafIterator implements Iterator<TreeNode> {

        private final Deque<TreeNode> stack = new ArrayDeque<>();
        private TreeNode next;

        LeafIterator(TreeNode start){
            if(start != null)
                stack.push(start);
            advance();
        }

        private void advance(){
            next = null;
            while(!stack.isEmpty()){
                TreeNode curr = stack.pop();
                if(curr.isLeaf()){
                    next = curr;
                    return;
                }
                for(int i = curr.childs.size() - 1; i >= 0; --i)
                    stack.push(curr.childs.get(i));
            }
        }

        @Override
        public boolean hasNext(){
            return next != null;
        }

        @Override
        public TreeNode next(){
            if(next == null)
                throw new NoSuchElementException();
            TreeNode result = next;
            advance();
            return result;
        }
    }
}
