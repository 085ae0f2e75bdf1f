package tree;

/**
 * Thrown when a Newick statement is malformed. Batch readers catch it, count
 * the statement as skipped and move on to the next one.
 */
public class NewickParseException extends RuntimeException {

    private final int position;

    public NewickParseException(String message, int position){
        super(message + " at position " + position);
        this.position = position;
    }

    public NewickParseException(String message, int position, Throwable cause){
        super(message + " at position " + position, cause);
        this.position = position;
    }

    /**
     * Character offset within the statement where parsing stopped.
     */
    public int getPosition(){
        return position;
    }
}
