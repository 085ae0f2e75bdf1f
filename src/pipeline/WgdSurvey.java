package pipeline;

import java.util.List;

import core.ClassificationConfig;
import core.WgdClassifier;
import core.WgdSummary;
import preprocessing.GeneTrees;

/**
 * WGD statistics per tree file. Files without any informative tree get no
 * row; their counts are logged instead.
 */
public class WgdSurvey extends Survey<WgdSummary> {

    private final WgdClassifier classifier;

    public WgdSurvey(ClassificationConfig config, int numThreads){
        super(numThreads);
        this.classifier = new WgdClassifier(config);
    }

    @Override
    protected WgdSummary summarize(String source, GeneTrees geneTrees){
        WgdSummary summary = new WgdSummary(source);
        for(int i = 0; i < geneTrees.malformed.size(); i++)
            summary.addMalformed();
        for(var geneTree : geneTrees.getGeneTrees()){
            var category = classifier.classify(geneTree.tree);
            if(category.isPresent())
                summary.add(category.get());
            else
                summary.addSkipped();
        }
        return summary;
    }

    @Override
    protected WgdSummary unreadable(String source){
        return new WgdSummary(source);
    }

    @Override
    protected List<String> header(){
        return WgdSummary.HEADER;
    }

    @Override
    protected List<String> row(WgdSummary summary){
        return summary.toRow();
    }

    @Override
    protected boolean include(WgdSummary summary){
        return summary.getTotal() > 0;
    }
}
