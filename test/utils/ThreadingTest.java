package utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

public class ThreadingTest extends TestCase {

    private static List<Integer> range(int n){
        List<Integer> items = new ArrayList<>();
        for(int i = 0; i < n; i++)
            items.add(i);
        return items;
    }

    public void testResultsKeepInputOrder(){
        List<Integer> squares = Threading.processListParallelWithResults(range(101), x -> x * x, 4);
        assertEquals(101, squares.size());
        for(int i = 0; i < squares.size(); i++)
            assertEquals(i * i, (int) squares.get(i));
    }

    public void testSequentialWithOneThread(){
        List<String> out = Threading.processListParallelWithResults(range(3), x -> "n" + x, 1);
        assertEquals(3, out.size());
        assertEquals("n2", out.get(2));
    }

    public void testMoreThreadsThanItems(){
        List<Integer> out = Threading.processListParallelWithResults(range(2), x -> x + 1, 16);
        assertEquals(2, out.size());
        assertEquals(2, (int) out.get(1));
    }

    public void testEmptyInput(){
        assertTrue(Threading.processListParallelWithResults(Collections.<Integer>emptyList(), x -> x, 4).isEmpty());
    }

    public void testWorkerFailureIsRethrown(){
        try{
            Threading.processListParallelWithResults(range(20), x -> {
                if(x == 13)
                    throw new IllegalStateException("bad item " + x);
                return x;
            }, 4);
            fail("expected the worker exception");
        }
        catch(IllegalStateException e){
            assertEquals("bad item 13", e.getMessage());
        }
    }
}
