package core;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Gene-copy names of the two species compared by the WGD/WGT statistics.
 * Passed explicitly into each classifier; both sets must be non-empty and
 * disjoint.
 */
public class ClassificationConfig {

    private final ImmutableSet<String> speciesA;
    private final ImmutableSet<String> speciesB;

    public ClassificationConfig(Set<String> speciesA, Set<String> speciesB){
        Preconditions.checkArgument(speciesA != null && !speciesA.isEmpty(), "Copy set A is empty");
        Preconditions.checkArgument(speciesB != null && !speciesB.isEmpty(), "Copy set B is empty");
        Set<String> overlap = Sets.intersection(speciesA, speciesB);
        Preconditions.checkArgument(overlap.isEmpty(), "Copy sets A and B share %s", overlap);
        this.speciesA = ImmutableSet.copyOf(speciesA);
        this.speciesB = ImmutableSet.copyOf(speciesB);
    }

    public ImmutableSet<String> getSpeciesA(){
        return speciesA;
    }

    public ImmutableSet<String> getSpeciesB(){
        return speciesB;
    }

    @Override
    public String toString(){
        return "A=" + speciesA + ", B=" + speciesB;
    }
}
