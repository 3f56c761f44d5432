package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.Diagnostic;
import com.vidnyan.patchast.domain.model.Fragment;
import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.PatchedTree;
import com.vidnyan.patchast.domain.model.Region;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import com.vidnyan.patchast.domain.walker.AstWalker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Computes the region of every node of a tree by matching each node's expected
 * spelling against the source, depth first, with a single forward cursor.
 * One instance serves one traversal and is not thread-safe.
 */
@Slf4j
public class RegionPatcher {

    private final TokenScanner scanner;
    private final SourceLines lines;
    private final boolean collectChildren;
    private final SpellingRules rules;

    /** Remaining expected elements of every node being handled, innermost first. */
    private final Deque<Deque<Expected>> pending = new ArrayDeque<>();

    private final Map<SyntaxNode, Region> regions = new IdentityHashMap<>();
    private final Map<SyntaxNode, List<Fragment>> children;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param source newline-normalized source the tree was parsed from
     */
    public RegionPatcher(String source, boolean collectChildren) {
        this.scanner = new TokenScanner(source);
        this.lines = new SourceLines(source);
        this.collectChildren = collectChildren;
        this.children = collectChildren ? new IdentityHashMap<>() : null;
        this.rules = new SpellingRules(this);
    }

    public static PatchedTree patch(SyntaxNode root, String source, boolean collectChildren) {
        RegionPatcher patcher = new RegionPatcher(source, collectChildren);
        patcher.visit(root);
        log.debug("Patched {} nodes over {} characters", patcher.regions.size(), source.length());
        return patcher.result(root);
    }

    /**
     * Patches {@code node} and everything below it. Always reports the node as
     * handled so generic walks do not descend into it again.
     */
    public boolean visit(SyntaxNode node) {
        if (regions.containsKey(node)) {
            log.warn("Node <{}> has been already patched; please report!", node.typeName());
            diagnostics.add(new Diagnostic(Diagnostic.Kind.REENTRANT_PATCH, node.typeName(),
                    "Node <" + node.typeName() + "> has been already patched"));
            return true;
        }
        Optional<Spelling> spelling = rules.spell(node);
        if (spelling.isEmpty()) {
            log.warn("Unknown node type <{}>; please report!", node.typeName());
            diagnostics.add(new Diagnostic(Diagnostic.Kind.UNREGISTERED_NODE_KIND, node.typeName(),
                    "Unknown node type <" + node.typeName() + ">"));
            regions.put(node, Region.empty(scanner.offset()));
            if (collectChildren) {
                children.put(node, List.of());
            }
            return true;
        }
        handle(node, spelling.get());
        return true;
    }

    public PatchedTree result(SyntaxNode root) {
        return new PatchedTree(root, scanner.source(), new IdentityHashMap<>(regions),
                children == null ? null : new IdentityHashMap<>(children), diagnostics);
    }

    private void handle(SyntaxNode node, Spelling spelling) {
        Deque<Expected> expected = new ArrayDeque<>(spelling.elements());
        pending.push(expected);
        Deque<Fragment> fragments = new ArrayDeque<>();
        List<String> gaps = new ArrayList<>();
        int suspectedStart = scanner.offset();
        int start = suspectedStart;
        boolean firstToken = true;
        while (!expected.isEmpty()) {
            Expected element = expected.pollFirst();
            int offset = scanner.offset();
            int tokenStart;
            Fragment fragment;
            if (element instanceof Expected.Child child) {
                AstWalker.visitWithEarlyExit(child.node(), this::visit, false);
                tokenStart = regions.get(child.node()).start();
                fragment = Fragment.of(child.node());
            } else {
                Region region = consumeLiteral(spelling, element);
                tokenStart = region.start();
                fragment = Fragment.of(scanner.text(region));
            }
            if (!firstToken) {
                String gap = scanner.slice(offset, tokenStart);
                gaps.add(gap);
                if (collectChildren) {
                    fragments.addLast(Fragment.of(gap));
                }
            } else {
                firstToken = false;
                start = tokenStart;
            }
            if (collectChildren) {
                fragments.addLast(fragment);
            }
        }
        start = handleParens(fragments, start, gaps);
        if (spelling.isEatParens()) {
            start = eatSurroundingParens(fragments, suspectedStart, start);
        }
        if (spelling.isEatSpaces()) {
            if (collectChildren) {
                fragments.addFirst(Fragment.of(scanner.slice(0, start)));
            }
            Region rest = scanner.consumeRest();
            if (collectChildren) {
                fragments.addLast(Fragment.of(scanner.text(rest)));
            }
            start = 0;
        }
        if (collectChildren) {
            children.put(node, List.copyOf(fragments));
        }
        regions.put(node, new Region(start, scanner.offset()));
        pending.pop();
    }

    private Region consumeLiteral(Spelling spelling, Expected element) {
        if (element instanceof Expected.Ambiguous ambiguous) {
            Sentinel sentinel = ambiguous.sentinel();
            int end = sentinel.isBoundedByNextStatement() ? nextStatementStart() : scanner.source().length();
            return scanner.consumePattern(sentinel.pattern(), end);
        }
        String text = ((Expected.Token) element).text();
        if (spelling.isInsideString()) {
            return "{".equals(text) ? scanner.consumeFieldOpening() : scanner.consumeUnchecked(text);
        }
        return scanner.consume(text);
    }

    /**
     * Balances parentheses left unmatched in the gaps: each stray {@code (}
     * is closed by consuming a {@code )} after the node, each stray {@code )}
     * moves the start back to an earlier {@code (}.
     */
    private int handleParens(Deque<Fragment> fragments, int start, List<String> gaps) {
        int[] needed = countNeededParens(gaps);
        int opens = needed[0];
        int closes = needed[1];
        int oldEnd = scanner.offset();
        int newEnd = -1;
        for (int i = 0; i < closes; i++) {
            newEnd = scanner.consume(")").end();
        }
        if (newEnd >= 0 && collectChildren) {
            fragments.addLast(Fragment.of(scanner.slice(oldEnd, newEnd)));
        }
        int newStart = start;
        for (int i = 0; i < opens; i++) {
            OptionalInt open = scanner.rfindToken("(", 0, newStart);
            if (open.isEmpty()) {
                break;
            }
            newStart = open.getAsInt();
        }
        if (newStart != start) {
            if (collectChildren) {
                fragments.addFirst(Fragment.of(scanner.slice(newStart, start)));
            }
            start = newStart;
        }
        return start;
    }

    private int eatSurroundingParens(Deque<Fragment> fragments, int suspectedStart, int start) {
        OptionalInt open = scanner.rfindToken("(", suspectedStart, start);
        if (open.isEmpty()) {
            return start;
        }
        int oldStart = start;
        int oldOffset = scanner.offset();
        start = open.getAsInt();
        if (collectChildren) {
            fragments.addFirst(Fragment.of(scanner.slice(start + 1, oldStart)));
            fragments.addFirst(Fragment.of("("));
        }
        Region close = scanner.consume(")");
        if (collectChildren) {
            fragments.addLast(Fragment.of(scanner.slice(oldOffset, close.start())));
            fragments.addLast(Fragment.of(")"));
        }
        return start;
    }

    /**
     * Returns {unmatched ')', unmatched '('} over the gaps, ignoring comments
     * and gaps that start with a quote.
     */
    static int[] countNeededParens(List<String> gaps) {
        int unmatchedCloses = 0;
        int opens = 0;
        for (String gap : gaps) {
            if (gap.isEmpty() || gap.charAt(0) == '\'' || gap.charAt(0) == '"') {
                continue;
            }
            int index = 0;
            while (index < gap.length()) {
                char ch = gap.charAt(index);
                if (ch == ')') {
                    if (opens > 0) {
                        opens--;
                    } else {
                        unmatchedCloses++;
                    }
                }
                if (ch == '(') {
                    opens++;
                }
                if (ch == '#') {
                    index = gap.indexOf('\n', index);
                    if (index < 0) {
                        break;
                    }
                }
                index++;
            }
        }
        return new int[]{unmatchedCloses, opens};
    }

    /**
     * Offset of the first statement still pending in the innermost node that
     * has one; strings must end before it.
     */
    int nextStatementStart() {
        for (Deque<Expected> elements : pending) {
            for (Expected element : elements) {
                if (element instanceof Expected.Child child && child.node().kind().isStatement()) {
                    return lines.offsetOf(child.node().line(), child.node().column());
                }
            }
        }
        return scanner.source().length();
    }

    /**
     * Region of the string literal ahead of the cursor, leaving the cursor in place.
     */
    Region peekString() {
        int saved = scanner.offset();
        Region region = scanner.consumePattern(Sentinel.STRING.pattern(), nextStatementStart());
        scanner.reset(saved);
        return region;
    }

    /**
     * Whether {@code node} is an {@code if} spelled as {@code elif}, judged from
     * the text at its position. The second check, four characters ending one
     * before the node, is kept as found; it does not line up with {@code elif}
     * for every layout.
     */
    boolean isElif(SyntaxNode node) {
        if (node == null || !node.is(NodeKind.IF)) {
            return false;
        }
        int offset = offsetOf(node);
        String word = scanner.slice(offset, offset + 4);
        String altWord = offset >= 5 ? scanner.slice(offset - 5, offset - 1) : "";
        return "elif".equals(word) || "elif".equals(altWord);
    }

    /**
     * Offset of the node's own (line, column) position.
     */
    int offsetOf(SyntaxNode node) {
        return lines.offsetOf(node.line(), node.column());
    }

    /**
     * First character ahead of the cursor that is not whitespace, or 0.
     */
    char nextSignificantChar() {
        String source = scanner.source();
        for (int i = scanner.offset(); i < source.length(); i++) {
            char ch = source.charAt(i);
            if (!Character.isWhitespace(ch)) {
                return ch;
            }
        }
        return 0;
    }

    String source() {
        return scanner.source();
    }

    void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }
}
