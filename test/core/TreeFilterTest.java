package core;

import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;
import tree.NewickParser;
import tree.Tree;

public class TreeFilterTest extends TestCase {

    public void testLeafCountThreshold(){
        Tree tree = NewickParser.parse("((A,B),(C,D));");
        assertTrue(new LeafCountFilter(4).accept(tree));
        assertFalse(new LeafCountFilter(5).accept(tree));
        assertTrue(new LeafCountFilter(0).accept(tree));
    }

    public void testLeafCountCountsDuplicates(){
        assertTrue(new LeafCountFilter(3).accept(NewickParser.parse("(A,(A,A));")));
    }

    public void testNegativeLeafThresholdIsRejected(){
        try{
            new LeafCountFilter(-1);
            fail("expected an IllegalArgumentException");
        }
        catch(IllegalArgumentException e){
            // expected
        }
    }

    public void testGroupCoverage(){
        ImmutableMap<String, String> mapping = ImmutableMap.of(
            "s1", "g1", "s2", "g1", "s3", "g2", "s4", "g3");
        Tree tree = NewickParser.parse("((s1,s2),(s3,unmapped));");

        GroupCoverageFilter filter = new GroupCoverageFilter(mapping, 2);
        Set<String> covered = filter.coveredGroups(tree);
        assertEquals(ImmutableSet.of("g1", "g2"), covered);
        assertTrue(filter.accept(tree));
        assertFalse(new GroupCoverageFilter(mapping, 3).accept(tree));
    }

    public void testDescribe(){
        assertEquals("leaves >= 4", new LeafCountFilter(4).describe());
        assertEquals("groups >= 30", new GroupCoverageFilter(ImmutableMap.<String, String>of(), 30).describe());
    }
}
