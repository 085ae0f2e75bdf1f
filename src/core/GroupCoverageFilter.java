package core;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import tree.Tree;

/**
 * Keeps trees whose leaves cover at least {@code requiredGroups} distinct
 * groups of a leaf-name → group mapping. Leaves without a group are ignored.
 */
public class GroupCoverageFilter implements TreeFilter {

    private final Map<String, String> leafToGroup;
    private final int requiredGroups;

    public GroupCoverageFilter(Map<String, String> leafToGroup, int requiredGroups){
        Preconditions.checkArgument(requiredGroups >= 0,
            "Required group count must not be negative, got %s", requiredGroups);
        this.leafToGroup = ImmutableMap.copyOf(leafToGroup);
        this.requiredGroups = requiredGroups;
    }

    @Override
    public boolean accept(Tree tree){
        return coveredGroups(tree).size() >= requiredGroups;
    }

    /**
     * Groups having at least one leaf in the tree.
     */
    public Set<String> coveredGroups(Tree tree){
        Set<String> covered = new HashSet<>();
        for(var leaf : tree.leaves()){
            String group = leafToGroup.get(leaf.name);
            if(group != null)
                covered.add(group);
        }
        return covered;
    }

    @Override
    public String describe(){
        return "groups >= " + requiredGroups;
    }
}
