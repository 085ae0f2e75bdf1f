package core;

/**
 * Raised by a single monophyly query whose target set is empty or has no
 * member among the tree's leaves. It concerns that query only.
 */
public class ClassifierException extends RuntimeException {

    public ClassifierException(String message){
        super(message);
    }
}
