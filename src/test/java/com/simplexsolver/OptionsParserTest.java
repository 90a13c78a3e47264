package com.simplexsolver;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import java.time.Duration;

public class OptionsParserTest {
    @Test
    public void parsesBasicFlags() {
        String[] args = {
                "-tolerance", "1e-8", "-pivottol", "1e-6", "-iterations", "5000",
                "-nodes", "1_000", "-bland-after", "10", "-timelimit", "2.5"
        };
        SolverConfig c = OptionsParser.parse(args);
        assertEquals(1e-8, c.tolerance, 0.0);
        assertEquals(1e-6, c.pivotTolerance, 0.0);
        assertEquals(5000L, c.iterationLimit);
        assertEquals(1000L, c.nodeLimit);
        assertEquals(10, c.degenerateSwitch);
        assertEquals(Duration.ofMillis(2500), c.timeLimit);
    }

    @Test
    public void emptyArgsGiveDefaults() {
        SolverConfig c = OptionsParser.parse(new String[0]);
        assertEquals(SolverConfig.DEFAULT_TOLERANCE, c.tolerance, 0.0);
        assertEquals(SolverConfig.DEFAULT_PIVOT_TOLERANCE, c.pivotTolerance, 0.0);
        assertEquals(SolverConfig.DEFAULT_ITERATION_LIMIT, c.iterationLimit);
        assertEquals(SolverConfig.DEFAULT_NODE_LIMIT, c.nodeLimit);
        assertEquals(SolverConfig.DEFAULT_DEGENERATE_SWITCH, c.degenerateSwitch);
        assertNull(c.timeLimit);
    }

    @Test
    public void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{ "-verbose" }));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{ "-nodes" }));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{ "-nodes", "many" }));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{ "-tolerance", "-1" }));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{ "-timelimit", "0" }));
    }
}
