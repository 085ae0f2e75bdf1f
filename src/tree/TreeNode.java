package tree;

import java.util.ArrayList;

/**
 * TreeNode: one node of a gene tree.
 *
 * Nodes live in the arena of their owning {@link Tree} and are addressed by
 * {@code index}. The {@code parent} field is a back-reference only; a node is
 * owned by the child list of its parent (or by the tree, for the root).
 */
public class TreeNode {

    public int index;
    public String name;                 // taxon identifier for leaves, optional label for internal nodes
    public Double support;              // bootstrap / posterior value, internal nodes only
    public Double branchLength;         // distance to parent
    public ArrayList<TreeNode> childs;  // null or empty for leaves
    public TreeNode parent;

    public TreeNode setIndex(int index){
        this.index = index;
        return this;
    }

    public TreeNode setName(String name){
        this.name = name;
        return this;
    }

    public TreeNode setSupport(Double support){
        this.support = support;
        return this;
    }

    public TreeNode setBranchLength(Double branchLength){
        this.branchLength = branchLength;
        return this;
    }

    public TreeNode setChilds(ArrayList<TreeNode> childs){
        this.childs = childs;
        return this;
    }

    public TreeNode setParent(TreeNode parent){
        this.parent = parent;
        return this;
    }

    public boolean isLeaf(){
        return childs == null || childs.isEmpty();
    }

    public boolean isRoot(){
        return parent == null;
    }

    public int childCount(){
        return childs == null ? 0 : childs.size();
    }

    /**
     * Appends a child and points its parent reference here.
     */
    public void addChild(TreeNode child){
        addChild(childCount(), child);
    }

    public void addChild(int position, TreeNode child){
        if(childs == null)
            childs = new ArrayList<>();
        childs.add(position, child);
        child.parent = this;
    }

    /**
     * Removes this node from its parent's child list.
     *
     * @return the position it occupied, or -1 if it had no parent
     */
    public int detach(){
        if(parent == null)
            return -1;
        int position = parent.childs.indexOf(this);
        parent.childs.remove(position);
        parent = null;
        return position;
    }

    @Override
    public String toString(){
        StringBuilder sb = new StringBuilder();
        sb.append("TreeNode[").append(index);
        if(name != null)
            sb.append(" name=").append(name);
        if(support != null)
            sb.append(" support=").append(support);
        if(branchLength != null)
            sb.append(" length=").append(branchLength);
        sb.append(" childs=").append(childCount()).append("]");
        return sb.toString();
    }
}
