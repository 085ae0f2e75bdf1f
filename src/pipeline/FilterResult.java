package pipeline;

/**
 * Counts of one filter run. {@code attempted} includes malformed statements,
 * so silent skips stay visible.
 */
public class FilterResult {

    private final int attempted;
    private final int malformed;
    private final int passed;

    public FilterResult(int attempted, int malformed, int passed){
        this.attempted = attempted;
        this.malformed = malformed;
        this.passed = passed;
    }

    public int getAttempted(){
        return attempted;
    }

    public int getMalformed(){
        return malformed;
    }

    public int getPassed(){
        return passed;
    }

    @Override
    public String toString(){
        return "attempted=" + attempted + ", malformed=" + malformed + ", passed=" + passed;
    }
}
