package domain.format;

import domain.token.KeywordKind;
import domain.token.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable per-document formatting state shared by the driver and the active layout.
 *
 * <p>Output helpers keep two rules: a line never ends in whitespace, and a line comment
 * is never followed by code on the same line (the next token resumes on a fresh line at
 * the column the layout asks for).</p>
 */
final class FormatterState {

    private final FormatOptions options;
    private final StringBuilder out;
    private final Deque<ParenFrame> frames = new ArrayDeque<>();

    private int inlineDepth = 0;
    private ClauseContext clause = ClauseContext.NONE;
    private boolean firstToken = true;
    private PendingDirective pending = PendingDirective.NONE;
    /** column to resume at after a line comment; -1 when no comment is open */
    private int commentBreakColumn = -1;

    FormatterState(FormatOptions options, int sizeHint) {
        this.options = options;
        this.out = new StringBuilder(Math.max(16, sizeHint + sizeHint / 2));
    }

    String keywordText(KeywordKind kw) {
        return kw.render(options.isUppercase());
    }

    // ---- frames ----

    void pushFrame(ParenFrame frame) {
        frames.push(frame);
        if (frame.getKind() == ParenFrame.Kind.INLINE) inlineDepth++;
    }

    /** @return the innermost frame, or {@code null} when no paren is open */
    ParenFrame popFrame() {
        ParenFrame f = frames.poll();
        if (f != null && f.getKind() == ParenFrame.Kind.INLINE) inlineDepth--;
        return f;
    }

    int parenDepth() {
        return frames.size();
    }

    int subqueryDepth() {
        int n = 0;
        for (ParenFrame f : frames) {
            if (f.getKind() == ParenFrame.Kind.SUBQUERY) n++;
        }
        return n;
    }

    boolean isInline() {
        return inlineDepth > 0;
    }

    // ---- flags ----

    ClauseContext clause() {
        return clause;
    }

    void setClause(ClauseContext clause) {
        this.clause = (clause == null) ? ClauseContext.NONE : clause;
    }

    boolean isFirstToken() {
        return firstToken;
    }

    /** Next token starts a new statement: no line break before it. */
    void startStatement() {
        firstToken = true;
    }

    PendingDirective pending() {
        return pending;
    }

    void setPending(PendingDirective pending) {
        this.pending = (pending == null) ? PendingDirective.NONE : pending;
    }

    boolean takePending(PendingDirective expected) {
        if (pending != expected) return false;
        pending = PendingDirective.NONE;
        return true;
    }

    void breakAfterComment(int column) {
        commentBreakColumn = Math.max(0, column);
    }

    // ---- output ----

    void append(String text) {
        resolveCommentBreak();
        out.append(text);
        firstToken = false;
    }

    /** One separating space, unless already at a line start or after a space. */
    void space() {
        if (resolveCommentBreak()) return;
        if (atLineStart()) return;
        if (out.charAt(out.length() - 1) == ' ') return;
        out.append(' ');
    }

    void spaceIfNeeded(Token token, Token prev) {
        if (Spacing.needsSpaceBefore(token, prev)) space();
    }

    void newLine(int column) {
        commentBreakColumn = -1;
        rtrimLastLine();
        out.append('\n');
        pad(column);
    }

    void pad(int n) {
        for (int i = 0; i < n; i++) out.append(' ');
    }

    boolean atLineStart() {
        for (int i = out.length() - 1; i >= 0; i--) {
            char c = out.charAt(i);
            if (c == '\n') return true;
            if (c != ' ') return false;
        }
        return true;
    }

    /** Output with trailing whitespace removed. */
    String trimmedOutput() {
        int end = out.length();
        while (end > 0) {
            char c = out.charAt(end - 1);
            if (c != '\n' && !isTrailingSpace(c)) break;
            end--;
        }
        return out.substring(0, end);
    }

    private boolean resolveCommentBreak() {
        if (commentBreakColumn < 0) return false;
        newLine(commentBreakColumn);
        return true;
    }

    private void rtrimLastLine() {
        int end = out.length();
        while (end > 0 && isTrailingSpace(out.charAt(end - 1))) end--;
        out.setLength(end);
    }

    static boolean isTrailingSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }
}
