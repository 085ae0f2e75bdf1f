package core;

import tree.Tree;

/**
 * Whole-genome triplication (three copies per species) classification.
 *
 * Every tree is classified, whatever the number of copies present: a species
 * with at most one copy in the tree counts as monophyletic. This is looser
 * than {@link WgdClassifier}, which skips such trees.
 */
public class WgtClassifier {

    public enum Category {
        NON_SHARED,     // A or B monophyletic, ((A1,A2,A3),(B1,B2,B3))
        SHARED          // copies intermingled, ((A1,B1),(A2,B2),(A3,B3))
    }

    private final ClassificationConfig config;

    public WgtClassifier(ClassificationConfig config){
        this.config = config;
    }

    public Category classify(Tree tree){
        boolean monoA = MonophylyClassifier.isMonophyleticOrTrivial(tree, config.getSpeciesA());
        boolean monoB = MonophylyClassifier.isMonophyleticOrTrivial(tree, config.getSpeciesB());
        return monoA || monoB ? Category.NON_SHARED : Category.SHARED;
    }

    public ClassificationConfig getConfig(){
        return config;
    }
}
