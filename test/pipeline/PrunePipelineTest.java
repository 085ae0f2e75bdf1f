package pipeline;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;
import preprocessing.GeneTrees;
import tree.NewickWriter;

public class PrunePipelineTest extends TestCase {

    public void testPrunesEveryTree() throws IOException{
        GeneTrees trees = GeneTrees.fromText("mem",
            "((A:0.1,B:0.2)n1:0.3,(C:0.4,D:0.5)n2:0.6)root;\n(B:1,C:1)r;\n(A:1,C:1)B;\n(oops;\n");
        StringWriter out = new StringWriter();
        PrunePipeline.Result result = new PrunePipeline(Collections.singletonList("B"), 1).prune(trees, out);

        assertEquals("(A:0.4,(C:0.4,D:0.5)n2:0.6)root;\nC;\n(A:1.0,C:1.0)B;\n", out.toString());
        assertEquals(4, result.attempted);
        assertEquals(1, result.malformed);
        assertEquals(3, result.written);
        assertEquals(2, result.removedNodes);
        assertEquals(1, result.rootRequests);
    }

    public void testSupportIsDropped() throws IOException{
        GeneTrees trees = GeneTrees.fromText("mem", "((A:1,B:1)0.9:0.1,C:1)r;");
        StringWriter out = new StringWriter();
        new PrunePipeline(Arrays.asList("Z"), 2).prune(trees, out);
        assertEquals("((A:1.00,B:1.00):0.10,C:1.00)r;\n", out.toString());
    }

    public void testSupportLabels() throws IOException{
        GeneTrees trees = GeneTrees.fromText("mem", "((A:1,B:1)x 0.9:0.1,(C:1,D:1)y:1)r;");
        StringWriter out = new StringWriter();
        new PrunePipeline(Arrays.asList("D"), 1, NewickWriter.LabelStyle.SUPPORT).prune(trees, out);
        assertEquals("((A:1.0,B:1.0)0.9:0.1,C:2.0);\n", out.toString());
    }
}
