package tree;

import junit.framework.TestCase;

public class NewickWriterTest extends TestCase {

    public void testDefaultFormatUsesTenDecimals(){
        Tree tree = NewickParser.parse("((A:0.1,B:0.2)n1:0.3,(C:0.4,D:0.5)n2:0.6)root;");
        assertEquals("((A:0.1000000000,B:0.2000000000)n1:0.3000000000,(C:0.4000000000,D:0.5000000000)n2:0.6000000000)root;",
            new NewickWriter().write(tree));
    }

    public void testNoExponentNotation(){
        Tree tree = NewickParser.parse("(A:1e-7,B:12345678.5);");
        String written = new NewickWriter().write(tree);
        assertEquals("(A:0.0000001000,B:12345678.5000000000);", written);
        assertFalse(written.contains("E"));
        assertFalse(written.contains("e"));
    }

    public void testAbsentLabelsAreOmitted(){
        Tree tree = NewickParser.parse("((A,B),(C:1,D));");
        assertEquals("((A,B),(C:1.00,D));", new NewickWriter(2, NewickWriter.LabelStyle.NAMES).write(tree));
    }

    public void testNamesStyleDropsSupport(){
        Tree tree = NewickParser.parse("((A:0.1,B:0.2)0.95:0.05,(C:0.15,D:0.18)n2 88:0.03)1.0:0.0;");
        assertEquals("((A:0.10,B:0.20):0.05,(C:0.15,D:0.18)n2:0.03):0.00;",
            new NewickWriter(2, NewickWriter.LabelStyle.NAMES).write(tree));
    }

    public void testSupportStyle(){
        Tree tree = NewickParser.parse("((A:0.1,B:0.2)0.95:0.05,(C:0.15,D:0.18)n2 100:0.03)1.0:0.0;");
        assertEquals("((A:0.10,B:0.20)0.95:0.05,(C:0.15,D:0.18)100:0.03)1:0.00;",
            new NewickWriter(2, NewickWriter.LabelStyle.SUPPORT).write(tree));
    }

    public void testQuotesNamesWithDelimiters(){
        Tree tree = NewickParser.parse("('Homo sapiens','O''Brien',plain);");
        assertEquals("('Homo sapiens','O''Brien',plain);", new NewickWriter().write(tree));
    }

    public void testDeterministic(){
        Tree tree = NewickParser.parse("((A:0.3333333333333,B:0.2)n1:0.3,C:1)r;");
        NewickWriter writer = new NewickWriter(4, NewickWriter.LabelStyle.NAMES);
        assertEquals(writer.write(tree), writer.write(tree));
        assertEquals("((A:0.3333,B:0.2000)n1:0.3000,C:1.0000)r;", writer.write(tree));
    }

    public void testRejectsBadPrecision(){
        try{
            new NewickWriter(-1, NewickWriter.LabelStyle.NAMES);
            fail("expected an IllegalArgumentException");
        }
        catch(IllegalArgumentException e){
            // expected
        }
    }

    public void testFormatSupport(){
        assertEquals("1", NewickWriter.formatSupport(1.0));
        assertEquals("0.95", NewickWriter.formatSupport(0.95));
        assertEquals("100", NewickWriter.formatSupport(100.0));
    }

    public void testNumericInternalNameIsQuoted(){
        Tree tree = NewickParser.parse("((1,2)'3',4);");
        String written = new NewickWriter().write(tree);
        assertEquals("((1,2)'3',4);", written);
        assertEquals("3", NewickParser.parse(written).root.childs.get(0).name);
    }

    public void testDeepCaterpillar(){
        int depth = 20000;
        StringBuilder sb = new StringBuilder();
        for(int i = 0; i < depth; i++)
            sb.append('(');
        sb.append("L0");
        for(int i = 1; i <= depth; i++)
            sb.append(",L").append(i).append("):1");
        Tree tree = NewickParser.parse(sb.append(';').toString());

        String written = tree.getNewickFormat(0);
        Tree again = NewickParser.parse(written);
        assertEquals(depth + 1, again.leavesCount());
        assertEquals(written, again.getNewickFormat(0));
    }
}
