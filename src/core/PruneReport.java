package core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link TreePruner#prune} call.
 */
public class PruneReport {

    private int removedNodes;
    private int reconnections;
    private final List<String> notFound = new ArrayList<>();
    private final List<String> rootRequests = new ArrayList<>();

    void nodeRemoved(){
        removedNodes++;
    }

    void siblingReconnected(){
        reconnections++;
    }

    void nameNotFound(String name){
        notFound.add(name);
    }

    void rootDeletionRejected(String name){
        rootRequests.add(name);
    }

    public int getRemovedNodes(){
        return removedNodes;
    }

    public int getReconnections(){
        return reconnections;
    }

    public List<String> getNotFound(){
        return Collections.unmodifiableList(notFound);
    }

    /**
     * Names that matched the root. The root cannot be pruned and is left in place.
     */
    public List<String> getRootRequests(){
        return Collections.unmodifiableList(rootRequests);
    }

    public boolean hasRootRequests(){
        return !rootRequests.isEmpty();
    }

    @Override
    public String toString(){
        return "removed=" + removedNodes + ", reconnected=" + reconnections
            + ", notFound=" + notFound.size() + ", rootRequests=" + rootRequests;
    }
}
