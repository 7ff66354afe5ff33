package org.stl.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.stl.expressions.Formula;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPrinterTest {

    @Test
    @DisplayName("输出完全加括号的文本")
    void testPrint() {
        assertAll("print",
                () -> assertEquals("(G[0.0, 2.0] (x > 0.0))", FormulaPrinter.print(FormulaParser.parse("G[0,2](x > 0)"))),
                () -> assertEquals("((x > 0.0) and (y <= 1.5) and (z == -1.0))",
                        FormulaParser.parse("x > 0 and y <= 1.5 and z == -1").toString()),
                () -> assertEquals("((x > 0.0) W[1.0, 3.0] (not (y > 0.0)))",
                        FormulaPrinter.print(FormulaParser.parse("x > 0 W[1, 3] !(y > 0)"))),
                () -> assertEquals("(|(x - y)| < 1.0)", FormulaPrinter.print(FormulaParser.parse("|x - y| < 1")))
        );
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "x > 0",
            "x > 0 and (y > 0 and z > 0)",
            "(x > 0 or y > 0) or z > 0",
            "G[0, 2] F[1, 3] (x + 2 * y >= z / 4)",
            "x > 0 -> (y < 1 -> z != 2)",
            "X (x == 3) U[0, 5] |x - y| <= 0.25",
            "not (x > 0) W[0, 1] -x > -2",
            "eventually[0.5, 1.5] (speed < 120 and rpm < 4000)"
    })
    @DisplayName("输出可以被重新解析为相同的语法树")
    void testRoundTrip(String text) {
        Formula original = FormulaParser.parse(text);
        Formula reparsed = FormulaParser.parse(FormulaPrinter.print(original));
        assertEquals(original, reparsed);
    }
}
