package tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.regex.Pattern;

/**
 * NewickParser: builds a {@link Tree} from one Newick statement.
 *
 * Grammar:
 * <pre>
 *   tree           := subtree ';'
 *   subtree        := leaf | '(' subtree (',' subtree)* ')' internal_label
 *   leaf           := name [':' branch_length]
 *   internal_label := [name] [support] [':' branch_length]
 * </pre>
 *
 * Parsing is stack based: an open parenthesis pushes a sentinel, a closing
 * parenthesis pops the finished children down to that sentinel and replaces
 * them with their new parent. Deeply nested trees therefore never recurse.
 *
 * Internal labels follow the two usual conventions: a lone numeric token
 * after ')' is a support value, a lone non-numeric token is a name, and a
 * name followed by a numeric token carries both. Leaf labels and quoted
 * labels are always names.
 */
public class NewickParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String text;
    private final int n;
    private int i;
    private Tree tree;
    private boolean lastLabelQuoted;    // whether the last label read was quoted

    private NewickParser(String text){
        this.text = text;
        this.n = text.length();
    }

    /**
     * Parses a single statement. A missing terminating ';' at the end of the
     * input is tolerated; anything but whitespace after the ';' is not.
     *
     * @throws NewickParseException if the statement is malformed
     */
    public static Tree parse(String text){
        if(text == null)
            throw new NewickParseException("No Newick text", 0);
        return new NewickParser(text).parseTree();
    }

    /**
     * Splits a blob holding several statements at each ';' and re-appends the
     * terminator. ';' never occurs inside a subtree, so every ';' outside a
     * quoted label or a comment ends a statement; an unbalanced statement
     * therefore never swallows the ones after it. Empty statements are dropped
     * and a trailing unterminated statement is kept.
     */
    public static List<String> splitStatements(String blob){
        List<String> statements = new ArrayList<>();
        StringBuilder curr = new StringBuilder();
        boolean quoted = false;
        boolean comment = false;

        for(int j = 0; j < blob.length(); ++j){
            char c = blob.charAt(j);
            if(comment){
                if(c == ']')
                    comment = false;
            }
            else if(quoted){
                if(c == '\'')
                    quoted = false;
            }
            else if(c == '\''){
                quoted = true;
            }
            else if(c == '['){
                comment = true;
            }
            else if(c == ';'){
                addStatement(statements, curr.toString());
                curr.setLength(0);
                continue;
            }
            curr.append(c);
        }
        addStatement(statements, curr.toString());
        return statements;
    }

    private static void addStatement(List<String> statements, String body){
        String trimmed = body.trim();
        if(!trimmed.isEmpty())
            statements.add(trimmed + ";");
    }

    private Tree parseTree(){
        tree = new Tree();
        Stack<TreeNode> nodes = new Stack<>();
        int depth = 0;
        boolean expectSubtree = true;   // after '(' or ',' or at the start
        boolean terminated = false;

        while(true){
            skipBlanks();
            if(i >= n)
                break;
            char curr = text.charAt(i);

            if(curr == '('){
                if(!expectSubtree)
                    throw new NewickParseException("Missing ',' before '('", i);
                nodes.push(null);
                depth++;
                i++;
            }
            else if(curr == ','){
                if(depth == 0)
                    throw new NewickParseException("',' outside parentheses", i);
                if(expectSubtree)
                    throw new NewickParseException("Leaf without a name", i);
                expectSubtree = true;
                i++;
            }
            else if(curr == ')'){
                if(depth == 0)
                    throw new NewickParseException("Unbalanced parentheses: unexpected ')'", i);
                if(expectSubtree){
                    if(nodes.peek() == null)
                        throw new NewickParseException("Empty subtree", i);
                    throw new NewickParseException("Leaf without a name", i);
                }
                ArrayList<TreeNode> children = new ArrayList<>();
                while(nodes.peek() != null){
                    children.add(nodes.pop());
                }
                nodes.pop();
                Collections.reverse(children);
                depth--;
                i++;

                TreeNode internal = tree.addInternalNode(children);
                parseInternalLabel(internal);
                nodes.push(internal);
                expectSubtree = false;
            }
            else if(curr == ';'){
                if(depth > 0)
                    throw new NewickParseException("Unbalanced parentheses: " + depth + " unclosed '('", i);
                i++;
                terminated = true;
                break;
            }
            else if(curr == ':'){
                throw new NewickParseException("Leaf without a name", i);
            }
            else{
                if(!expectSubtree)
                    throw new NewickParseException("Unexpected '" + curr + "'", i);
                TreeNode leaf = tree.addLeaf(readLabel());
                leaf.setBranchLength(readBranchLength());
                nodes.push(leaf);
                expectSubtree = false;
            }
        }

        if(terminated){
            skipBlanks();
            if(i < n)
                throw new NewickParseException("Trailing text after ';'", i);
        }
        if(depth > 0)
            throw new NewickParseException("Unbalanced parentheses: " + depth + " unclosed '('", n);
        if(nodes.isEmpty())
            throw new NewickParseException("No tree found", 0);

        tree.root = nodes.pop();
        return tree;
    }

    private void parseInternalLabel(TreeNode node){
        skipBlanks();
        String first = isLabelStart() ? readLabel() : null;
        boolean firstQuoted = lastLabelQuoted;
        skipBlanks();
        String second = isLabelStart() ? readLabel() : null;

        if(first != null && second == null){
            // a quoted token is always a name
            if(!firstQuoted && isNumber(first))
                node.setSupport(Double.valueOf(first));
            else
                node.setName(first);
        }
        else if(first != null){
            if(lastLabelQuoted || !isNumber(second))
                throw new NewickParseException("Malformed support value '" + second + "'", i);
            node.setName(first);
            node.setSupport(Double.valueOf(second));
        }
        node.setBranchLength(readBranchLength());
    }

    private Double readBranchLength(){
        skipBlanks();
        if(i >= n || text.charAt(i) != ':')
            return null;
        i++;
        skipBlanks();
        int start = i;
        while(i < n && !isDelimiter(text.charAt(i)))
            i++;
        String token = text.substring(start, i);
        if(!isNumber(token))
            throw new NewickParseException("Malformed branch length '" + token + "'", start);
        double value = Double.parseDouble(token);
        if(value < 0)
            throw new NewickParseException("Negative branch length '" + token + "'", start);
        return value;
    }

    private String readLabel(){
        lastLabelQuoted = text.charAt(i) == '\'';
        if(lastLabelQuoted)
            return readQuotedLabel();
        int start = i;
        while(i < n && !isDelimiter(text.charAt(i)))
            i++;
        return text.substring(start, i);
    }

    private String readQuotedLabel(){
        int start = i;
        i++;
        StringBuilder sb = new StringBuilder();
        while(i < n){
            char c = text.charAt(i);
            if(c == '\''){
                if(i + 1 < n && text.charAt(i + 1) == '\''){
                    sb.append('\'');
                    i += 2;
                    continue;
                }
                i++;
                if(sb.length() == 0)
                    throw new NewickParseException("Empty quoted label", start);
                return sb.toString();
            }
            sb.append(c);
            i++;
        }
        throw new NewickParseException("Unterminated quoted label", start);
    }

    private void skipBlanks(){
        while(i < n){
            char c = text.charAt(i);
            if(Character.isWhitespace(c)){
                i++;
            }
            else if(c == '['){
                int close = text.indexOf(']', i);
                if(close < 0)
                    throw new NewickParseException("Unterminated comment", i);
                i = close + 1;
            }
            else{
                return;
            }
        }
    }

    private boolean isLabelStart(){
        return i < n && !isDelimiter(text.charAt(i));
    }

    private static boolean isDelimiter(char c){
        return c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '['
            || Character.isWhitespace(c);
    }

    static boolean isNumber(String token){
        return NUMBER.matcher(token).matches();
    }
}
