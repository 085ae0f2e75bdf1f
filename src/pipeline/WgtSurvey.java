package pipeline;

import java.util.List;

import core.ClassificationConfig;
import core.WgtClassifier;
import core.WgtSummary;
import preprocessing.GeneTrees;

/**
 * WGT statistics per tree file; every file gets a row.
 */
public class WgtSurvey extends Survey<WgtSummary> {

    private final WgtClassifier classifier;

    public WgtSurvey(ClassificationConfig config, int numThreads){
        super(numThreads);
        this.classifier = new WgtClassifier(config);
    }

    @Override
    protected WgtSummary summarize(String source, GeneTrees geneTrees){
        WgtSummary summary = new WgtSummary(source);
        for(int i = 0; i < geneTrees.malformed.size(); i++)
            summary.addMalformed();
        for(var geneTree : geneTrees.getGeneTrees())
            summary.add(classifier.classify(geneTree.tree));
        return summary;
    }

    @Override
    protected WgtSummary unreadable(String source){
        return new WgtSummary(source);
    }

    @Override
    protected List<String> header(){
        return WgtSummary.HEADER;
    }

    @Override
    protected List<String> row(WgtSummary summary){
        return summary.toRow();
    }
}
