import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.numu.debug.Debug;
import com.numu.debug.DebugLevel;
import com.numu.script.EvalResult;
import com.numu.script.NumuScript;
import com.numu.script.ScriptError;
import com.numu.script.ast.Node;
import com.numu.script.ast.NodeType;
import com.numu.script.eval.Environment;
import com.numu.script.eval.EvaluationError;
import com.numu.script.parser.Associativity;
import com.numu.script.parser.LexError;
import com.numu.script.parser.ParseError;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NumuScriptTest {

    private final List<String> logged = new ArrayList<>();

    @BeforeEach
    void captureDebug() {
        Debug.get().setSink((level, tag, message, error) ->
                logged.add(level + " " + tag + " " + message + (error == null ? "" : " !" + error.getClass().getSimpleName())));
    }

    @AfterEach
    void releaseDebug() {
        Debug.get().reset();
    }

    private static NumuScript rightLeaning() {
        NumuScript script = new NumuScript();
        script.setAssociativity(Associativity.RIGHT_LEANING);
        return script;
    }

    @Test
    void evaluate_basicExpressions() {
        NumuScript s = new NumuScript();
        assertEquals(14.0, s.evaluate("2+3*4"), 0.0);
        assertEquals(14.0, rightLeaning().evaluate("2+3*4"), 0.0);
        assertEquals(20.0, s.evaluate("(2+3)*4"), 0.0);
        assertEquals(1500.5, s.evaluate("1.5e3 + .5"), 0.0);
    }

    @Test
    void associativity_changesChainsOfEqualPrecedence() {
        NumuScript conventional = new NumuScript();
        assertEquals(Associativity.CONVENTIONAL, conventional.getAssociativity());
        assertEquals(3.0, conventional.evaluate("10-4-3"), 0.0);
        assertEquals(1.0, conventional.evaluate("8/4/2"), 0.0);

        NumuScript legacy = rightLeaning();
        assertEquals(9.0, legacy.evaluate("10-4-3"), 0.0);
        assertEquals(4.0, legacy.evaluate("8/4/2"), 0.0);

        legacy.setAssociativity(null);
        assertEquals(Associativity.CONVENTIONAL, legacy.getAssociativity());
    }

    @Test
    void builtins_andHostFunctions() {
        NumuScript s = new NumuScript();
        assertEquals(5.0, s.evaluate("abs(-5)"), 0.0);
        assertEquals(7.0, s.evaluate("max(1,7,3)"), 0.0);
        assertEquals(3.0, s.evaluate("avg(2,4)"), 0.0);
        assertEquals(0.0, s.evaluate("sum()"), 0.0);

        s.registerFunction("square", args -> args.get(0) * args.get(0), 1);
        assertEquals(81.0, s.evaluate("square(9)"), 0.0);

        EvaluationError err = assertThrows(EvaluationError.class, () -> s.evaluate("foo(1)"));
        assertEquals("unknown function: foo", err.getMessage());
    }

    @Test
    void variables_hostAndScript() {
        NumuScript s = new NumuScript();
        s.setVariable("rate", 0.5);
        assertEquals(50.0, s.evaluate("rate * 100"), 0.0);

        assertEquals(12.0, s.evaluate("total = 3 * 4; total"), 0.0);
        assertEquals(12.0, s.getVariable("total"), 0.0);
        assertEquals(24.0, s.evaluate("total * 2"), 0.0);
    }

    @Test
    void programs_withComments() {
        NumuScript s = new NumuScript();
        String program = "# setup\n"
                + "a = 2;   # first\n"
                + "b = a ^ 3;\n"
                + "b - a  # result\n";
        assertEquals(6.0, s.evaluate(program), 0.0);
    }

    @Test
    void instances_doNotShareState() {
        NumuScript first = new NumuScript();
        NumuScript second = new NumuScript();
        first.evaluate("x = 1");
        first.registerFunction("f", args -> 1, 0);

        assertThrows(EvaluationError.class, () -> second.evaluate("x"));
        assertThrows(EvaluationError.class, () -> second.evaluate("f()"));
        assertNotSame(first.arena(), second.arena());
    }

    @Test
    void customEnvironment_isUsedAsIs() {
        Environment bare = new Environment();
        NumuScript s = new NumuScript(bare);
        assertSame(bare, s.environment());
        assertThrows(EvaluationError.class, () -> s.evaluate("abs(1)"));
        assertThrows(IllegalArgumentException.class, () -> new NumuScript(null));
    }

    @Test
    void tryEvaluate_reportsEachStage() {
        NumuScript s = new NumuScript();

        EvalResult ok = s.tryEvaluate("1 + 1");
        assertTrue(ok.isOk());
        assertEquals(2.0, ok.value(), 0.0);
        assertNull(ok.error());

        EvalResult lex = s.tryEvaluate("1 + @");
        assertFalse(lex.isOk());
        assertTrue(lex.error() instanceof LexError);
        assertEquals(ScriptError.Stage.LEX, lex.error().stage());

        EvalResult parse = s.tryEvaluate("(1 + 2");
        assertTrue(parse.error() instanceof ParseError);
        assertEquals("expected ')' after expression", parse.error().reason());

        EvalResult eval = s.tryEvaluate("1 / 0");
        assertEquals(ScriptError.Stage.EVALUATE, eval.error().stage());
        assertEquals("division by zero", eval.error().getMessage());

        assertThrows(IllegalStateException.class, eval::value);
    }

    @Test
    void failures_areLoggedOnceAtWarn() {
        NumuScript s = new NumuScript();
        assertThrows(ParseError.class, () -> s.evaluate("1 +"));

        List<String> warnings = new ArrayList<>();
        for (String line : logged) {
            if (line.startsWith(DebugLevel.WARN + " ")) warnings.add(line);
        }
        assertEquals(1, warnings.size());
        String w = warnings.get(0);
        assertTrue(w.startsWith("WARN numu.engine evaluate failed (PARSE): [line 1:4] expected expression"), w);
        assertTrue(w.endsWith("!ParseError"), w);
    }

    @Test
    void success_isLoggedAtDebug() {
        NumuScript s = new NumuScript();
        s.evaluate("abs(-2)");

        boolean sawResult = false;
        boolean sawCall = false;
        for (String line : logged) {
            if (line.equals("DEBUG numu.engine evaluated to 2.0")) sawResult = true;
            if (line.startsWith("TRACE numu.eval call abs")) sawCall = true;
            assertFalse(line.startsWith("WARN"), line);
        }
        assertTrue(sawResult, logged.toString());
        assertTrue(sawCall, logged.toString());
    }

    @Test
    void minLevel_filtersBelowThreshold() {
        Debug.get().setMinLevel(DebugLevel.WARN);
        assertFalse(Debug.get().isEnabled(DebugLevel.TRACE));
        assertTrue(Debug.get().isEnabled(DebugLevel.ERROR));

        NumuScript s = new NumuScript();
        s.evaluate("abs(-2) + 1");
        assertTrue(logged.isEmpty(), logged.toString());

        s.tryEvaluate("1 / 0");
        assertEquals(1, logged.size());
        assertTrue(logged.get(0).startsWith("WARN numu.engine evaluate failed (EVALUATE): division by zero"));
    }

    @Test
    void defaultSink_isDisabled() {
        Debug.get().reset();
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
        assertEquals(DebugLevel.TRACE, Debug.get().getMinLevel());
        assertEquals(2.0, new NumuScript().evaluate("1 + 1"), 0.0);
    }

    @Test
    void evaluate_doesNotGrowTheEngineArena() {
        NumuScript s = new NumuScript();
        int before = s.arena().size();
        for (int i = 0; i < 1000; i++) {
            assertEquals(3.0, s.evaluate("1 + 2"), 0.0);
        }
        s.tryEvaluate("1 / 0");
        s.tryEvaluate("(1 +");
        assertEquals(before, s.arena().size());
    }

    @Test
    void simplify_keepsOnlyTheFoldedTree() {
        NumuScript s = new NumuScript();
        Node folded = s.simplify("2 * 3 + 4");
        assertEquals("10.0", folded.toString());
        assertSame(s.arena(), folded.arena());
        assertEquals(1, s.arena().size());
    }

    @Test
    void parse_andSimplify() {
        NumuScript s = new NumuScript();
        Node parsed = s.parse("x + 2 * 3");
        assertEquals("(+ x (* 2.0 3.0))", parsed.toString());
        assertSame(s.arena(), parsed.arena());

        Node simplified = s.simplify("x + 2 * 3");
        assertEquals("(+ x 6.0)", simplified.toString());

        Node program = s.parseProgram("a = 1; a");
        assertEquals(NodeType.BLOCK, program.type);

        assertThrows(ParseError.class, () -> s.parse("2 +"));
        assertThrows(IllegalArgumentException.class, () -> s.parse(null));
    }

    @Test
    void evaluate_parsedNode() {
        NumuScript s = new NumuScript();
        s.setVariable("x", 3);
        Node node = s.parse("x ^ 2");
        assertEquals(9.0, s.evaluate(node), 0.0);
        s.setVariable("x", 4);
        assertEquals(16.0, s.evaluate(node), 0.0);
    }
}
