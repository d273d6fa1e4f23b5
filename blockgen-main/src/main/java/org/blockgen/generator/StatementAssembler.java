package org.blockgen.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.blockgen.block.BlockInput;
import org.blockgen.block.BlockNode;

/**
 * Finishes the code of a single block: prepends the comments that belong to it and appends the code
 * of the statements that follow it.
 * <p>
 * Comments are only emitted by blocks that stand on their own. A block plugged into a parent
 * expression stays silent and its comment is surfaced by the nearest enclosing statement, which
 * collects the comments of its whole expression subtree.
 */
public final class StatementAssembler {

    private final int commentWrap;
    private final Function<BlockNode, String> successorCode;

    /**
     * @param commentWrap   column at which comment lines wrap, marker included
     * @param successorCode emits the complete code of a successor statement and its chain
     */
    public StatementAssembler(int commentWrap, Function<BlockNode, String> successorCode) {
        this.commentWrap = commentWrap;
        this.successorCode = successorCode;
    }

    public String assemble(BlockNode block, String code, boolean thisOnly) {
        String commentCode = block.hasConnectedOutput() ? "" : collectComments(block);
        String nextCode = "";
        if (!thisOnly) {
            Optional<BlockNode> next = block.nextStatement();
            if (next.isPresent()) {
                nextCode = successorCode.apply(next.get());
            }
        }
        return commentCode + code + nextCode;
    }

    /**
     * All comments in the expression subtree rooted at {@code block}, one per line, followed by an
     * empty line; the empty string if there are none. Only value inputs belong to the subtree; the
     * statements in statement inputs and the successor chain of {@code block} are not part of it.
     */
    public String allNestedComments(BlockNode block) {
        List<String> comments = new ArrayList<>();
        collectNested(block, comments);
        if (comments.isEmpty()) {
            return "";
        }
        comments.add("");
        return String.join("\n", comments);
    }

    private String collectComments(BlockNode block) {
        StringBuilder commentCode = new StringBuilder();
        Optional<String> comment = block.commentText().filter(text -> !text.isEmpty());
        if (comment.isPresent()) {
            String wrapped = CommentFormatter.wrap(comment.get(), commentWrap - CommentFormatter.LINE_COMMENT.length());
            commentCode.append(CommentFormatter.prefixLines(wrapped + "\n", CommentFormatter.LINE_COMMENT));
        }
        // Statement inputs are left to the nested statements, which emit their own comments.
        for (BlockInput input : block.inputs()) {
            if (!input.isValueSlot() || input.connectedChild() == null) {
                continue;
            }
            String nested = allNestedComments(input.connectedChild());
            if (!nested.isEmpty()) {
                commentCode.append(CommentFormatter.prefixLines(nested, CommentFormatter.LINE_COMMENT));
            }
        }
        return commentCode.toString();
    }

    private static void collectNested(BlockNode block, List<String> comments) {
        block.commentText().filter(text -> !text.isEmpty()).ifPresent(comments::add);
        // Statement bodies surface their own comments when they are assembled.
        for (BlockInput input : block.inputs()) {
            if (input.isValueSlot() && input.connectedChild() != null) {
                collectNested(input.connectedChild(), comments);
            }
        }
    }
}
