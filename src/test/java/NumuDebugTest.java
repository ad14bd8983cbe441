import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.numu.debug.Debug;
import com.numu.debug.DebugLevel;
import com.numu.script.EvalResult;
import com.numu.script.NumuScript;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NumuDebugTest {

    @AfterEach
    void releaseDebug() {
        Debug.get().reset();
    }

    @Test
    void defaultSink_isUsableWithoutSetup() {
        // no setSink or reset before this point
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
        Debug.get().w("numu.test", "dropped", new RuntimeException("x"));

        NumuScript s = new NumuScript();
        assertEquals(5.0, s.evaluate("abs(-5)"), 0.0);
        assertEquals(3.0, s.evaluate("1 + 2"), 0.0);

        EvalResult failed = s.tryEvaluate("foo(1)");
        assertEquals("unknown function: foo", failed.error().getMessage());
    }

    @Test
    void nullSink_fallsBackToNoop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.WARN));
        assertEquals(2.0, new NumuScript().evaluate("max(1, 2)"), 0.0);
    }

    @Test
    void log_respectsMinLevel() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + ":" + message));
        Debug.get().setMinLevel(DebugLevel.INFO);

        Debug.get().t("numu.test", "trace");
        Debug.get().d("numu.test", "debug");
        Debug.get().i("numu.test", "info");
        Debug.get().e("numu.test", "error", null);

        assertEquals(2, seen.size());
        assertEquals("INFO:info", seen.get(0));
        assertEquals("ERROR:error", seen.get(1));

        Debug.get().reset();
        assertEquals(DebugLevel.TRACE, Debug.get().getMinLevel());
        assertFalse(Debug.get().isEnabled(DebugLevel.TRACE));
    }
}
