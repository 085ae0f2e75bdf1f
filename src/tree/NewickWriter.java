package tree;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * NewickWriter: serializes a {@link Tree} back to a Newick statement.
 *
 * Branch lengths are written with a fixed number of decimals so downstream
 * line-oriented tools never see exponent notation. Absent names and branch
 * lengths are omitted. Output depends only on the tree and the writer
 * settings.
 */
public class NewickWriter {

    public static final int DEFAULT_PRECISION = 10;

    /**
     * What goes after the closing parenthesis of an internal node.
     */
    public enum LabelStyle {
        NAMES,      // node names and branch lengths, no support ("format 5")
        SUPPORT     // support values in place of internal names
    }

    private static final CharMatcher NEEDS_QUOTES =
        CharMatcher.anyOf("()[],:;'").or(CharMatcher.whitespace());

    private final int precision;
    private final LabelStyle labelStyle;
    private final String lengthFormat;

    public NewickWriter(int precision, LabelStyle labelStyle){
        Preconditions.checkArgument(precision >= 0 && precision <= 20,
            "Branch length precision must be between 0 and 20, got %s", precision);
        this.precision = precision;
        this.labelStyle = Preconditions.checkNotNull(labelStyle);
        this.lengthFormat = "%." + precision + "f";
    }

    public NewickWriter(){
        this(DEFAULT_PRECISION, LabelStyle.NAMES);
    }

    public int getPrecision(){
        return precision;
    }

    public String write(Tree tree){
        StringBuilder sb = new StringBuilder();
        if(tree.root != null)
            newickFormatUtil(tree.root, sb);
        sb.append(';');
        return sb.toString();
    }

    /**
     * Writes the subtree of {@code start} with an explicit stack, so deep
     * caterpillar trees are written like shallow ones.
     */
    private void newickFormatUtil(TreeNode start, StringBuilder sb){
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start));
        while(!stack.isEmpty()){
            Frame top = stack.peek();
            TreeNode node = top.node;
            if(node.isLeaf()){
                stack.pop();
                if(node.name != null)
                    sb.append(quote(node.name, false));
                appendLength(node, sb);
            }
            else if(top.next == node.childs.size()){
                stack.pop();
                sb.append(')');
                appendInternalLabel(node, sb);
                appendLength(node, sb);
            }
            else{
                sb.append(top.next == 0 ? '(' : ',');
                stack.push(new Frame(node.childs.get(top.next++)));
            }
        }
    }

    private void appendLength(TreeNode node, StringBuilder sb){
        if(node.branchLength != null)
            sb.append(':').append(formatLength(node.branchLength));
    }

    private void appendInternalLabel(TreeNode node, StringBuilder sb){
        if(labelStyle == LabelStyle.SUPPORT){
            if(node.support != null)
                sb.append(formatSupport(node.support));
        }
        else if(node.name != null){
            sb.append(quote(node.name, true));
        }
    }

    String formatLength(double length){
        return String.format(Locale.ROOT, lengthFormat, length);
    }

    /**
     * Shortest plain decimal, e.g. 1.0 → "1", 0.95 → "0.95", 100.0 → "100".
     */
    static String formatSupport(double support){
        return BigDecimal.valueOf(support).stripTrailingZeros().toPlainString();
    }

    /**
     * Quotes names holding Newick delimiters. A numeric internal name is
     * quoted too, otherwise it would read back as a support value.
     */
    static String quote(String name, boolean internal){
        if(!NEEDS_QUOTES.matchesAnyOf(name) && !(internal && NewickParser.isNumber(name)))
            return name;
        return "'" + name.replace("'", "''") + "'";
    }

    private static class Frame {
        final TreeNode node;
        int next;       // index of the next child to write

        Frame(TreeNode node){
            this.node = node;
        }
    }
}
