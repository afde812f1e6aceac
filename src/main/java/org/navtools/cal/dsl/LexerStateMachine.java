package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Context state machine driving keyword classification in {@link CalLexer}.
 *
 * The machine keeps a stack of frames. Each frame records its state and the brace depth
 * at which it was entered, so a section frame is left exactly when its closing brace is seen.
 * Which frame is pushed or popped for an event is decided by {@link #TRANSITIONS}; everything
 * else tracked here (brace and bracket depth, property value mode, item columns) only acts as
 * a guard on those events.
 */
public final class LexerStateMachine {

    public enum State {
        NORMAL, // before OBJECT
        OBJECT_LEVEL, // OBJECT header and body
        SECTION_LEVEL, // inside PROPERTIES, FIELDS, CODE, ...
        CODE_BLOCK, // inside BEGIN ... END
        CASE_BLOCK // inside CASE ... END within code
    }

    public enum Event {
        OBJECT_KEYWORD,
        SECTION_BRACE_OPEN,
        SECTION_BRACE_CLOSE,
        BEGIN,
        CASE,
        END
    }

    /**
     * Sections whose items are laid out in fixed leading columns.
     */
    public enum SectionType {
        FIELDS(4), KEYS(2), CONTROLS(3), ACTIONS(3), ELEMENTS(4), DATAITEMS(4),
        DATASET(0), REQUESTPAGE(0), LABELS(0), OTHER(0);

        private final int structuralColumns;

        SectionType(int structuralColumns) {
            this.structuralColumns = structuralColumns;
        }

        boolean isColumnar() {
            return structuralColumns > 0;
        }

        static SectionType of(TokenType keyword) {
            return switch (keyword) {
                case FIELDS -> FIELDS;
                case KEYS -> KEYS;
                case CONTROLS -> CONTROLS;
                case ACTIONS -> ACTIONS;
                case ELEMENTS -> ELEMENTS;
                case DATAITEMS -> DATAITEMS;
                case DATASET -> DATASET;
                case REQUESTPAGE -> REQUESTPAGE;
                case LABELS -> LABELS;
                default -> OTHER;
            };
        }
    }

    /**
     * Effect of a transition on the frame stack. {@code target} is only set for pushes.
     */
    public record Transition(Kind kind, State target) {

        public enum Kind { PUSH, POP, STAY }

        static Transition push(State target) {
            return new Transition(Kind.PUSH, target);
        }

        static final Transition POP = new Transition(Kind.POP, null);
        static final Transition STAY = new Transition(Kind.STAY, null);
    }

    private record Frame(State state, int braceDepth, SectionType sectionType) {
    }

    private static final Map<State, Map<Event, Transition>> TRANSITIONS = new EnumMap<>(State.class);

    static {
        define(State.NORMAL, Event.OBJECT_KEYWORD, Transition.push(State.OBJECT_LEVEL));
        define(State.NORMAL, Event.SECTION_BRACE_OPEN, Transition.push(State.SECTION_LEVEL));
        define(State.NORMAL, Event.BEGIN, Transition.push(State.CODE_BLOCK));

        define(State.OBJECT_LEVEL, Event.SECTION_BRACE_OPEN, Transition.push(State.SECTION_LEVEL));

        define(State.SECTION_LEVEL, Event.SECTION_BRACE_OPEN, Transition.push(State.SECTION_LEVEL));
        define(State.SECTION_LEVEL, Event.SECTION_BRACE_CLOSE, Transition.POP);
        define(State.SECTION_LEVEL, Event.BEGIN, Transition.push(State.CODE_BLOCK));

        define(State.CODE_BLOCK, Event.BEGIN, Transition.push(State.CODE_BLOCK));
        define(State.CODE_BLOCK, Event.CASE, Transition.push(State.CASE_BLOCK));
        define(State.CODE_BLOCK, Event.END, Transition.POP);

        define(State.CASE_BLOCK, Event.BEGIN, Transition.push(State.CODE_BLOCK));
        define(State.CASE_BLOCK, Event.CASE, Transition.push(State.CASE_BLOCK));
        define(State.CASE_BLOCK, Event.END, Transition.POP);
    }

    private static void define(State from, Event event, Transition transition) {
        TRANSITIONS.computeIfAbsent(from, s -> new EnumMap<>(Event.class)).put(event, transition);
    }

    /**
     * Looks up the transition for an event, {@link Transition#STAY} when none is defined.
     */
    public static Transition transition(State from, Event event) {
        Map<Event, Transition> row = TRANSITIONS.get(from);
        if (row == null) {
            return Transition.STAY;
        }
        return row.getOrDefault(event, Transition.STAY);
    }

    private static final Set<String> TRIGGER_PROPERTIES = Set.of(
            "oninsert", "onmodify", "ondelete", "onrename",
            "onvalidate", "onlookup",
            "onrun",
            "oninit", "onopenpage", "onclosepage", "onfindrecord", "onnextrecord",
            "onaftergetrecord", "onnewrecord", "oninsertrecord", "onmodifyrecord",
            "ondeleterecord", "onqueryclosepage", "onaftergetcurrrecord", "onactivate",
            "onaction", "onassistedit", "ondrilldown",
            "oninitreport", "onprereport", "onpostreport",
            "onpredataitem", "onpostdataitem",
            "oninitxmlport", "onprexmlport", "onpostxmlport", "onprexmlitem",
            "onafterassignfield", "onbeforepassfield",
            "onafterassignvariable", "onbeforepassvariable",
            "onafterinitrecord", "onafterinsertrecord", "onbeforeinsertrecord",
            "onbeforeopen");

    private final Deque<Frame> frames = new ArrayDeque<>();
    private int braceDepth;
    private int bracketDepth;
    private boolean inPropertyValue;
    private String lastPropertyName = "";
    private boolean pendingSectionKeyword;
    private SectionType sectionType;
    // 0 = not inside a columnar item, 1..n = structural column, n+1 = properties
    private int column;
    private boolean underflow;

    public LexerStateMachine() {
        reset();
    }

    public void reset() {
        frames.clear();
        frames.push(new Frame(State.NORMAL, 0, null));
        braceDepth = 0;
        bracketDepth = 0;
        inPropertyValue = false;
        lastPropertyName = "";
        pendingSectionKeyword = false;
        sectionType = null;
        column = 0;
        underflow = false;
    }

    public State state() {
        return frames.peek().state();
    }

    public boolean isInCode() {
        State s = state();
        return s == State.CODE_BLOCK || s == State.CASE_BLOCK;
    }

    public int braceDepth() {
        return braceDepth;
    }

    public int bracketDepth() {
        return bracketDepth;
    }

    public boolean inPropertyValue() {
        return inPropertyValue;
    }

    public String lastPropertyName() {
        return lastPropertyName;
    }

    public SectionType sectionType() {
        return sectionType;
    }

    public int depth() {
        return frames.size();
    }

    public boolean hadUnderflow() {
        return underflow;
    }

    // ---- events ----

    public void onObjectKeyword() {
        apply(Event.OBJECT_KEYWORD);
    }

    /**
     * A section keyword was scanned. It only opens a section when the next brace follows
     * and the keyword is not part of code, a property value or a structural item column.
     */
    public void onSectionKeyword(TokenType keyword) {
        pendingSectionKeyword = false;
        if (isInCode() || inPropertyValue || isProtectedColumn()) {
            return;
        }
        pendingSectionKeyword = true;
        sectionType = SectionType.of(keyword);
    }

    public void onOtherWord() {
        pendingSectionKeyword = false;
    }

    /**
     * A structural opening brace was scanned.
     */
    public void onLeftBrace() {
        braceDepth++;
        if ((state() == State.OBJECT_LEVEL && braceDepth == 1) || pendingSectionKeyword) {
            apply(Event.SECTION_BRACE_OPEN);
            pendingSectionKeyword = false;
        }
        if (state() == State.SECTION_LEVEL && column == 0 && sectionType != null && sectionType.isColumnar()
                && braceDepth > frames.peek().braceDepth()) {
            column = 1;
        }
    }

    /**
     * A closing brace was scanned outside code.
     *
     * @return false when the brace has no matching opening brace
     */
    public boolean onRightBrace() {
        if (braceDepth <= 0) {
            return false;
        }
        braceDepth--;
        if (state() == State.SECTION_LEVEL && braceDepth < frames.peek().braceDepth()) {
            apply(Event.SECTION_BRACE_CLOSE);
        }
        inPropertyValue = false;
        lastPropertyName = "";
        bracketDepth = 0;
        column = 0;
        return true;
    }

    public void onIdentifier(String name) {
        if (!inPropertyValue && state() == State.SECTION_LEVEL) {
            lastPropertyName = name;
        }
    }

    public void onEquals() {
        if (!lastPropertyName.isEmpty() && state() == State.SECTION_LEVEL) {
            inPropertyValue = true;
        }
    }

    public void onSemicolon() {
        if (bracketDepth == 0) {
            inPropertyValue = false;
            lastPropertyName = "";
        }
        if (column > 0 && sectionType != null && column <= sectionType.structuralColumns) {
            column++;
        }
    }

    public void onLeftBracket() {
        if (inPropertyValue) {
            bracketDepth++;
        }
    }

    public void onRightBracket() {
        if (inPropertyValue && bracketDepth > 0) {
            bracketDepth--;
        }
    }

    public void onBegin() {
        if (isProtectedColumn() || bracketDepth > 0) {
            return;
        }
        if (inPropertyValue && !isTriggerProperty(lastPropertyName)) {
            return;
        }
        apply(Event.BEGIN);
    }

    public void onCase() {
        apply(Event.CASE);
    }

    public void onEnd() {
        if (isProtectedColumn() || bracketDepth > 0) {
            return;
        }
        if (inPropertyValue && !isTriggerProperty(lastPropertyName)) {
            return;
        }
        apply(Event.END);
    }

    // ---- guards used by the lexer ----

    /**
     * True while scanning a structural column (id, indent, name, type) of a columnar item.
     */
    public boolean isProtectedColumn() {
        return column > 0 && sectionType != null && column <= sectionType.structuralColumns;
    }

    /**
     * BEGIN and END read as words inside brackets and inside non-trigger property values.
     */
    public boolean treatsBeginEndAsWord() {
        return bracketDepth > 0
                || (inPropertyValue && !isTriggerProperty(lastPropertyName) && state() != State.CODE_BLOCK);
    }

    public boolean downgradesSectionKeyword() {
        return isProtectedColumn() || bracketDepth > 0 || isInCode();
    }

    public static boolean isTriggerProperty(String name) {
        return TRIGGER_PROPERTIES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * True when only the base frame and structural object or section frames closed at depth 0 remain.
     */
    public boolean isCleanExit() {
        if (underflow || braceDepth != 0) {
            return false;
        }
        for (Frame frame : frames) {
            if (frame.state() == State.CODE_BLOCK || frame.state() == State.CASE_BLOCK) {
                return false;
            }
        }
        return true;
    }

    private void apply(Event event) {
        Transition t = transition(state(), event);
        switch (t.kind()) {
            case PUSH -> frames.push(new Frame(t.target(), braceDepth, sectionType));
            case POP -> {
                if (frames.size() > 1) {
                    Frame closed = frames.pop();
                    if (closed.state() == State.SECTION_LEVEL) {
                        sectionType = frames.peek().sectionType();
                    }
                } else {
                    underflow = true;
                }
            }
            case STAY -> {
                if (event == Event.END) {
                    underflow = true;
                }
            }
        }
    }
}
