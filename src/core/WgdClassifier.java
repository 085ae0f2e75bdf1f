package core;

import java.util.Optional;
import java.util.Set;

import tree.Tree;

/**
 * Whole-genome duplication (two copies per species) classification.
 *
 * Trees holding fewer than two copies of either species are not informative
 * and are skipped. Otherwise:
 * <ul>
 * <li>{@link Category#INDEPENDENT}: both species' copies are monophyletic, ((A1,A2),(B1,B2)),
 *     duplication after speciation;</li>
 * <li>{@link Category#SHARED}: neither is, ((A1,B1),(A2,B2)), duplication before speciation;</li>
 * <li>{@link Category#UNCERTAIN}: exactly one is, often gene loss.</li>
 * </ul>
 */
public class WgdClassifier {

    public static final int MIN_COPIES = 2;

    public enum Category {
        INDEPENDENT,
        SHARED,
        UNCERTAIN
    }

    private final ClassificationConfig config;

    public WgdClassifier(ClassificationConfig config){
        this.config = config;
    }

    /**
     * @return the category, or empty when the tree lacks copies of A or B
     */
    public Optional<Category> classify(Tree tree){
        Set<String> aHere = MonophylyClassifier.presentNames(tree, config.getSpeciesA());
        Set<String> bHere = MonophylyClassifier.presentNames(tree, config.getSpeciesB());
        if(aHere.size() < MIN_COPIES || bHere.size() < MIN_COPIES)
            return Optional.empty();

        boolean monoA = MonophylyClassifier.isMonophyletic(tree, aHere);
        boolean monoB = MonophylyClassifier.isMonophyletic(tree, bHere);
        if(monoA && monoB)
            return Optional.of(Category.INDEPENDENT);
        if(!monoA && !monoB)
            return Optional.of(Category.SHARED);
        return Optional.of(Category.UNCERTAIN);
    }

    public ClassificationConfig getConfig(){
        return config;
    }
}
