package core;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;
import tree.NewickParser;
import tree.Tree;

public class MonophylyClassifierTest extends TestCase {

    private static boolean mono(String newick, String... names){
        return MonophylyClassifier.isMonophyletic(NewickParser.parse(newick), ImmutableSet.copyOf(names));
    }

    public void testCherryIsMonophyletic(){
        assertTrue(mono("((A1,A2),(B1,B2));", "A1", "A2"));
        assertTrue(mono("((A1,A2),(B1,B2));", "B1", "B2"));
    }

    public void testIntermingledSetIsNot(){
        assertFalse(mono("((A1,B1),(A2,B2));", "A1", "A2"));
        assertFalse(mono("(A1,(A2,B1));", "A1", "A2"));
    }

    public void testWholeTreeIsMonophyletic(){
        assertTrue(mono("((A1,A2),(B1,B2));", "A1", "A2", "B1", "B2"));
    }

    public void testDeepClade(){
        assertTrue(mono("(((A1,A2),A3),(B1,(B2,B3)));", "A1", "A2", "A3"));
        assertFalse(mono("(((A1,A2),B1),(A3,(B2,B3)));", "A1", "A2", "A3"));
    }

    public void testAbsentNamesAreIgnored(){
        assertTrue(mono("((A1,A2),(B1,B2));", "A1", "A2", "A9"));
    }

    public void testSinglePresentNameIsTrivial(){
        assertTrue(mono("((A1,B1),(A2,B2));", "A1"));
        assertTrue(mono("((A1,B1),(A2,B2));", "A1", "Z"));
    }

    public void testDuplicatedNames(){
        assertTrue(mono("((A1,B1),(A1,A2));", "A1", "A2"));
        assertFalse(mono("((A1,B1),(A2,B2));", "A1", "A2"));
    }

    public void testEmptyTargetFails(){
        try{
            MonophylyClassifier.isMonophyletic(NewickParser.parse("(A,B);"), ImmutableSet.<String>of());
            fail("expected a ClassifierException");
        }
        catch(ClassifierException e){
            // expected
        }
    }

    public void testNoPresentNameFails(){
        try{
            mono("(A,B);", "X", "Y");
            fail("expected a ClassifierException");
        }
        catch(ClassifierException e){
            assertTrue(e.getMessage().contains("X"));
        }
    }

    public void testTrivialVariantNeverFails(){
        Tree tree = NewickParser.parse("(A,B);");
        assertTrue(MonophylyClassifier.isMonophyleticOrTrivial(tree, ImmutableSet.of("X", "Y")));
        assertTrue(MonophylyClassifier.isMonophyleticOrTrivial(tree, ImmutableSet.<String>of()));
        assertFalse(MonophylyClassifier.isMonophyleticOrTrivial(
            NewickParser.parse("((A,C),(B,D));"), ImmutableSet.of("A", "B")));
    }

    public void testPresentNames(){
        Set<String> present = MonophylyClassifier.presentNames(
            NewickParser.parse("((A1,B1),(A1,A2));"), ImmutableSet.of("A1", "A2", "A3"));
        assertEquals(ImmutableSet.of("A1", "A2"), present);
    }
}
